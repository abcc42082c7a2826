package com.paymsg.ingress.swift;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the MT940/942/950 statement line (field 61).
 *
 * <pre>
 * 2310241024CR1000,50NTRFREFERENCE1//BANKREF
 * |     |   | |      |   |          '- servicer reference
 * |     |   | |      |   '- customer reference
 * |     |   | |      '- transaction type
 * |     |   | '- amount
 * |     |   '- debit/credit mark
 * |     '- entry date (MMDD, optional)
 * '- value date (YYMMDD)
 * </pre>
 */
public final class StatementLineParser {

    private static final Pattern STATEMENT_LINE = Pattern.compile(
        "^(\\d{6})(\\d{4})?(RC|RD|CR|DR|C|D)([A-Z])?(\\d[\\d,]*)([A-Z]\\w{3})(.*)$");

    private StatementLineParser() {
    }

    /**
     * Parses the first line of a field 61 value into an entry map, or returns
     * null when the line does not follow the statement-line layout.
     */
    public static Map<String, String> parse(String value, String currency) {
        if (value == null) {
            return null;
        }
        String firstLine = value.split("\n", 2)[0].trim();
        Matcher matcher = STATEMENT_LINE.matcher(firstLine);
        if (!matcher.matches()) {
            return null;
        }
        String valueDate = MtValues.isoDate(matcher.group(1));
        String bookingDate = valueDate;
        if (matcher.group(2) != null && valueDate != null) {
            bookingDate = valueDate.substring(0, 5) + matcher.group(2).substring(0, 2) + "-" + matcher.group(2).substring(2);
        }
        String remainder = matcher.group(7);
        int separator = remainder.indexOf("//");
        String reference = separator >= 0 ? remainder.substring(0, separator) : remainder;

        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("reference", reference.trim().isEmpty() ? null : reference.trim());
        entry.put("amount", MtValues.decimal(matcher.group(5)));
        entry.put("currency", currency);
        entry.put("credit_debit_indicator", direction(matcher.group(3)));
        entry.put("status", "BOOK");
        entry.put("booking_date", bookingDate);
        entry.put("value_date", valueDate);
        entry.put("transaction_type", matcher.group(6));
        return entry;
    }

    /**
     * C and CR are credits, D and DR debits; a reversal (RC, RD) moves money
     * the opposite way of the entry it reverses.
     */
    static String direction(String mark) {
        switch (mark) {
            case "C":
            case "CR":
            case "RD":
                return "CRDT";
            default:
                return "DBIT";
        }
    }
}
