package com.paymsg.ingress.swift;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits SWIFT MT text into its header values and Block 4 fields.
 *
 * A field starts at a line of the form {@code :TAG:value} with a two or three
 * character alphanumeric tag. Its value runs up to the next tag line, a line
 * starting with '-' (end of block) or the end of the input, so truncated
 * messages still yield the fields they contain. Repeated tags are kept in
 * order.
 */
public final class MtBlockScanner {

    private static final Pattern BLOCK1 = Pattern.compile("\\{1:[A-Z]\\d{2}([A-Z0-9]{8,14})\\d{10}\\}");
    private static final Pattern BLOCK1_LENIENT = Pattern.compile("\\{1:[A-Z]\\d{2}([A-Z0-9]{8,14})");
    private static final Pattern BLOCK2 = Pattern.compile("\\{2:([IO])(\\d{3})([A-Z0-9]{12})");
    private static final Pattern BLOCK2_LENIENT = Pattern.compile("\\{2:([IO])(\\d{3})([A-Z0-9]{8,11})");
    private static final Pattern BLOCK2_TYPE = Pattern.compile("\\{2:[IO](\\d{3})");
    private static final Pattern UETR = Pattern.compile("\\{121:([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})\\}");
    private static final Pattern TAG_LINE = Pattern.compile("^:([0-9A-Z]{2,3}):(.*)$");
    private static final String BLOCK4_START = "{4:";

    private MtBlockScanner() {
    }

    /**
     * Logical terminal or BIC of the Block 1 sender.
     */
    public static String senderAddress(String text) {
        Matcher matcher = BLOCK1.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        matcher = BLOCK1_LENIENT.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Logical terminal or BIC of the Block 2 receiver.
     */
    public static String receiverAddress(String text) {
        Matcher matcher = BLOCK2.matcher(text);
        if (matcher.find()) {
            return matcher.group(3);
        }
        matcher = BLOCK2_LENIENT.matcher(text);
        return matcher.find() ? matcher.group(3) : null;
    }

    /**
     * Three digit message type from Block 2 ("103").
     */
    public static Optional<String> messageType(String text) {
        Matcher matcher = BLOCK2_TYPE.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * UETR from the Block 3 field 121.
     */
    public static String uetr(String text) {
        Matcher matcher = UETR.matcher(text);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    /**
     * Block 4 fields in order of appearance; empty when there is no Block 4.
     */
    public static List<MtField> fields(String text) {
        int start = text.indexOf(BLOCK4_START);
        if (start < 0) {
            return Collections.emptyList();
        }
        String body = text.substring(start + BLOCK4_START.length());

        List<MtField> fields = new ArrayList<>();
        String tag = null;
        StringBuilder value = null;
        for (String rawLine : body.split("\n", -1)) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            Matcher matcher = TAG_LINE.matcher(line);
            if (matcher.matches()) {
                if (tag != null) {
                    fields.add(new MtField(tag, value.toString().trim()));
                }
                tag = matcher.group(1);
                value = new StringBuilder(matcher.group(2));
            } else if (line.trim().startsWith("-")) {
                break;
            } else if (tag != null) {
                value.append('\n').append(line);
            }
        }
        if (tag != null) {
            fields.add(new MtField(tag, value.toString().trim()));
        }
        return fields;
    }
}
