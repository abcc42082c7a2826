package com.paymsg.egress;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.config.TranscoderSettingsLoader;
import com.paymsg.egress.iso.AccountReportGenerator;
import com.paymsg.egress.iso.CreditTransferGenerator;
import com.paymsg.egress.iso.InitiationGenerator;
import com.paymsg.egress.iso.InstitutionTransferGenerator;
import com.paymsg.egress.iso.MxMessageGenerator;
import com.paymsg.egress.swift.ConfirmationGenerator;
import com.paymsg.egress.swift.Mt101Generator;
import com.paymsg.egress.swift.Mt103Generator;
import com.paymsg.egress.swift.Mt202Generator;
import com.paymsg.egress.swift.MtMessageGenerator;
import com.paymsg.egress.swift.StatementGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders payment records as SWIFT MT text or ISO 20022 XML.
 *
 * <p>Targets form a closed set. MT targets are given by their three digit
 * type, with or without the "MT" prefix ("103", "MT103"); MX targets by their
 * family key ("pacs.008"). Output is UTF-8.</p>
 *
 * <p>Missing values never prevent rendering: BICs, names, references and
 * currencies fall back to the configured placeholders, and a UETR is drawn
 * from the {@link UetrGenerator} when the record carries none.</p>
 */
public class Translator {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final UetrGenerator uetrs;
    private final Map<String, MtMessageGenerator> mtGenerators = new LinkedHashMap<>();
    private final Map<String, MxMessageGenerator> mxGenerators = new LinkedHashMap<>();

    public Translator() {
        this(TranscoderSettingsLoader.defaults(), UetrGenerator.random(), Clock.systemUTC());
    }

    public Translator(TranscoderSettings settings, UetrGenerator uetrs, Clock clock) {
        this.uetrs = uetrs;

        register(new Mt101Generator(settings, clock));
        register(new Mt103Generator(settings, clock));
        register(new Mt202Generator(settings, clock));
        register(new ConfirmationGenerator(settings, clock, false));
        register(new ConfirmationGenerator(settings, clock, true));
        register(new StatementGenerator(settings, clock, "940"));
        register(new StatementGenerator(settings, clock, "942"));
        register(new StatementGenerator(settings, clock, "950"));

        register(new CreditTransferGenerator(settings, clock, "pacs.008"));
        register(new InstitutionTransferGenerator(settings, clock));
        register(new AccountReportGenerator(settings, clock, "camt.053"));
        register(new AccountReportGenerator(settings, clock, "camt.054"));
        register(new AccountReportGenerator(settings, clock, "camt.052"));
        register(new CreditTransferGenerator(settings, clock, "camt.004"));
        register(new InitiationGenerator(settings, clock));
    }

    private void register(MtMessageGenerator generator) {
        mtGenerators.put(generator.messageType(), generator);
    }

    private void register(MxMessageGenerator generator) {
        mxGenerators.put(generator.key(), generator);
    }

    /**
     * Renders a record to the given target.
     *
     * @param record the record to render
     * @param target "103", "MT103" or an MX key such as "pacs.008"
     * @return UTF-8 bytes of the rendered message
     * @throws UnsupportedTargetException if no generator exists for the target
     */
    public byte[] render(PaymentMessage record, String target) {
        if (record == null) {
            throw new IllegalArgumentException("Record to render cannot be null");
        }
        String normalized = normalize(target);
        MtMessageGenerator mt = mtGenerators.get(normalized);
        if (mt != null) {
            log.debug("Rendering {} as MT{}", record.family().getKey(), normalized);
            return mt.generate(record, uetrs).getBytes(StandardCharsets.UTF_8);
        }
        MxMessageGenerator mx = mxGenerators.get(normalized);
        if (mx != null) {
            log.debug("Rendering {} as {}", record.family().getKey(), normalized);
            return mx.generate(record, uetrs).getBytes(StandardCharsets.UTF_8);
        }
        throw new UnsupportedTargetException(target);
    }

    /**
     * Renders to an MT type; {@code messageType} is "103" or "MT103".
     */
    public byte[] toMt(PaymentMessage record, String messageType) {
        String normalized = normalize(messageType);
        if (!mtGenerators.containsKey(normalized)) {
            throw new UnsupportedTargetException(messageType);
        }
        return render(record, normalized);
    }

    /**
     * Renders to an ISO 20022 family key such as "camt.053".
     */
    public byte[] toMx(PaymentMessage record, String key) {
        String normalized = normalize(key);
        if (!mxGenerators.containsKey(normalized)) {
            throw new UnsupportedTargetException(key);
        }
        return render(record, normalized);
    }

    public Set<String> mtTargets() {
        return Collections.unmodifiableSet(mtGenerators.keySet());
    }

    public Set<String> mxTargets() {
        return Collections.unmodifiableSet(mxGenerators.keySet());
    }

    private static String normalize(String target) {
        if (target == null) {
            return "";
        }
        String trimmed = target.trim();
        if (trimmed.regionMatches(true, 0, "MT", 0, 2)) {
            trimmed = trimmed.substring(2);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
