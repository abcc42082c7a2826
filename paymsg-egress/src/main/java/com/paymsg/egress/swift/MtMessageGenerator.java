package com.paymsg.egress.swift;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.egress.UetrGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Base class for SWIFT MT generators.
 *
 * Renders Blocks 1 and 2 (and Block 3 for gpi types) around the Block 4 body
 * contributed by each message type. Missing values are replaced by the
 * configured sentinels so that every field stays structurally valid.
 */
public abstract class MtMessageGenerator {

    private static final Logger log = LoggerFactory.getLogger(MtMessageGenerator.class);

    private static final DateTimeFormatter YYMMDD = DateTimeFormatter.ofPattern("yyMMdd");
    private static final DateTimeFormatter MMDD = DateTimeFormatter.ofPattern("MMdd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyMMddHHmm");
    private static final int ADDRESS_LENGTH = 12;

    protected final TranscoderSettings settings;
    protected final Clock clock;

    protected MtMessageGenerator(TranscoderSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Three digit message type rendered in Block 2.
     */
    public abstract String messageType();

    /**
     * Appends the Block 4 fields, each terminated by a newline.
     */
    protected abstract void appendBody(StringBuilder body, PaymentMessage record);

    /**
     * Whether Block 3 carries a UETR (field 121).
     */
    protected boolean carriesUetr() {
        return false;
    }

    public String generate(PaymentMessage record, UetrGenerator uetrs) {
        StringBuilder mt = new StringBuilder();
        mt.append("{1:F01").append(logicalTerminal(record.getSenderBic())).append("0000000000}");
        mt.append("{2:I").append(messageType()).append(logicalTerminal(record.getReceiverBic())).append("N}");
        if (carriesUetr()) {
            String uetr = record.getUetr() != null ? record.getUetr() : uetrs.next();
            mt.append("{3:{121:").append(uetr).append("}}");
        }
        mt.append("{4:\n");
        appendBody(mt, record);
        mt.append("-}");
        return mt.toString();
    }

    /**
     * BIC padded with 'X' (or cut) to the 12 character logical terminal address.
     */
    protected String logicalTerminal(String bic) {
        StringBuilder address = new StringBuilder(isBlank(bic) ? settings.getPlaceholderBic() : bic.trim());
        while (address.length() < ADDRESS_LENGTH) {
            address.append('X');
        }
        return address.substring(0, ADDRESS_LENGTH);
    }

    protected static void field(StringBuilder body, String tag, String value) {
        body.append(':').append(tag).append(':').append(value).append('\n');
    }

    /**
     * Party field: optional "/account" line, then the name and any further lines.
     */
    protected void party(StringBuilder body, String tag, String account, String name, List<String> lines) {
        body.append(':').append(tag).append(':');
        if (!isBlank(account)) {
            body.append('/').append(singleLine(account)).append('\n');
        }
        body.append(isBlank(name) ? settings.getMtNameSentinel() : singleLine(name)).append('\n');
        if (lines != null) {
            for (String line : lines) {
                if (!isBlank(line)) {
                    body.append(singleLine(line)).append('\n');
                }
            }
        }
    }

    protected String reference(String value) {
        return isBlank(value) ? settings.getDefaultReference() : singleLine(value);
    }

    protected String currency(String value) {
        return isBlank(value) ? settings.getDefaultCurrency() : value.trim();
    }

    /**
     * Decimal point to the MT comma; digits are kept as given.
     */
    protected static String amount(String value) {
        return isBlank(value) ? "0,00" : value.trim().replace('.', ',');
    }

    protected String today() {
        return LocalDate.now(clock).format(YYMMDD);
    }

    protected String now() {
        return ZonedDateTime.now(clock).format(DATE_TIME) + "+0000";
    }

    /**
     * ISO date (yyyy-MM-dd) to YYMMDD, or today's date when absent or unreadable.
     */
    protected String yymmdd(String isoDate) {
        LocalDate date = isoDate(isoDate);
        return (date != null ? date : LocalDate.now(clock)).format(YYMMDD);
    }

    protected String mmdd(String isoDate) {
        LocalDate date = isoDate(isoDate);
        return (date != null ? date : LocalDate.now(clock)).format(MMDD);
    }

    private static LocalDate isoDate(String value) {
        if (isBlank(value) || value.trim().length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim().substring(0, 10));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable date '{}', using today", value);
            return null;
        }
    }

    protected static String singleLine(String value) {
        return value.trim().replaceAll("\\s*[\\r\\n]+\\s*", " ");
    }

    protected static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
