package com.paymsg.ingress;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.canonical.enums.WireFormat;
import com.paymsg.ingress.iso.IsoMessageReader;
import com.paymsg.ingress.swift.SwiftMtReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Entry point for reading raw payment messages.
 *
 * <p>SWIFT MT text (starting with Block 1) is read by {@link SwiftMtReader};
 * anything else is treated as ISO 20022 XML and read by
 * {@link IsoMessageReader}. Unreadable input yields a record whose fields are
 * null rather than an exception.</p>
 *
 * <pre>
 * PaymentMessage record = new MessageParser(bytes).parseDetailed();
 * </pre>
 */
public class MessageParser {

    private static final Logger log = LoggerFactory.getLogger(MessageParser.class);

    private final byte[] raw;
    private final WireFormat format;
    private IsoMessageReader isoReader;

    public MessageParser(byte[] raw) {
        this.raw = raw == null ? new byte[0] : raw;
        this.format = WireFormat.detect(this.raw);
        log.debug("Detected wire format {} for {} bytes", format, this.raw.length);
    }

    public WireFormat getFormat() {
        return format;
    }

    /**
     * Family of an XML payload; {@link MessageFamily#BASE} for MT input and
     * for XML that matches no known family.
     */
    public MessageFamily getFamily() {
        return format == WireFormat.MT ? MessageFamily.BASE : isoReader().getFamily();
    }

    /**
     * Reads the fields common to every message. MT input is always read in
     * full, since the MT reader has no cheaper base mode.
     */
    public PaymentMessage parse() {
        if (format == WireFormat.MT) {
            return new SwiftMtReader(raw).read();
        }
        return isoReader().readBase();
    }

    /**
     * Reads the typed record of the detected family.
     */
    public PaymentMessage parseDetailed() {
        if (format == WireFormat.MT) {
            return new SwiftMtReader(raw).read();
        }
        return isoReader().readDetailed();
    }

    /**
     * Base fields as a snake_case map.
     */
    public Map<String, Object> flatten() {
        return parse().toMap();
    }

    private IsoMessageReader isoReader() {
        if (isoReader == null) {
            isoReader = new IsoMessageReader(raw);
        }
        return isoReader;
    }
}
