package com.paymsg.canonical.enums;

import java.nio.charset.StandardCharsets;

/**
 * Wire format of a raw message.
 */
public enum WireFormat {
    MT,
    XML,
    UNKNOWN;

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    /**
     * Sniffs the format from the first meaningful bytes: SWIFT MT starts with
     * the Block 1 marker "{1:", XML with '&lt;' once a BOM and leading
     * whitespace are skipped.
     */
    public static WireFormat detect(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return UNKNOWN;
        }
        int start = 0;
        if (raw.length >= 3 && raw[0] == UTF8_BOM[0] && raw[1] == UTF8_BOM[1] && raw[2] == UTF8_BOM[2]) {
            start = 3;
        }
        while (start < raw.length && Character.isWhitespace((char) (raw[start] & 0xFF))) {
            start++;
        }
        if (start >= raw.length) {
            return UNKNOWN;
        }
        int prefixLength = Math.min(3, raw.length - start);
        String prefix = new String(raw, start, prefixLength, StandardCharsets.ISO_8859_1);
        if (prefix.startsWith("{1:")) {
            return MT;
        }
        if (raw[start] == '<') {
            return XML;
        }
        return UNKNOWN;
    }
}
