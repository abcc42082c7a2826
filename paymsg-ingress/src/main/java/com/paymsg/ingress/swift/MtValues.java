package com.paymsg.ingress.swift;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions for SWIFT MT field values.
 */
final class MtValues {

    private static final Pattern DATE = Pattern.compile("^(\\d{2})(\\d{2})(\\d{2})$");
    private static final Pattern DATE_CURRENCY_AMOUNT = Pattern.compile("^(\\d{6})([A-Z]{3})(\\d[\\d,]*)");
    private static final Pattern CURRENCY_AMOUNT = Pattern.compile("^([A-Z]{3})(\\d[\\d,]*)");
    private static final Pattern MARK_DATE_CURRENCY_AMOUNT = Pattern.compile("^([CD])(\\d{6})([A-Z]{3})(\\d[\\d,]*)");
    private static final Pattern COUNT_CURRENCY_AMOUNT = Pattern.compile("^(\\d+)([A-Z]{3})(\\d[\\d,]*)");
    private static final Pattern FLOOR_LIMIT = Pattern.compile("^([A-Z]{3})([CD])?(\\d[\\d,]*)");

    private MtValues() {
    }

    /**
     * Comma decimal separator to period; nothing else is normalised.
     */
    static String decimal(String amount) {
        return amount == null ? null : amount.replace(',', '.');
    }

    /**
     * YYMMDD to ISO yyyy-MM-dd, assuming the 21st century.
     */
    static String isoDate(String yymmdd) {
        if (yymmdd == null) {
            return null;
        }
        Matcher matcher = DATE.matcher(yymmdd);
        return matcher.matches() ? "20" + matcher.group(1) + "-" + matcher.group(2) + "-" + matcher.group(3) : null;
    }

    /**
     * Field 32A: date, currency, amount. Returns null when the layout does not match.
     */
    static String[] dateCurrencyAmount(String value) {
        Matcher matcher = value == null ? null : DATE_CURRENCY_AMOUNT.matcher(value.trim());
        if (matcher == null || !matcher.find()) {
            return null;
        }
        return new String[] {isoDate(matcher.group(1)), matcher.group(2), decimal(matcher.group(3))};
    }

    /**
     * Fields 32B and 33B: currency, amount.
     */
    static String[] currencyAmount(String value) {
        Matcher matcher = value == null ? null : CURRENCY_AMOUNT.matcher(value.trim());
        if (matcher == null || !matcher.find()) {
            return null;
        }
        return new String[] {matcher.group(1), decimal(matcher.group(2))};
    }

    /**
     * Balance fields 60a, 62a, 64, 65: mark, date, currency, amount.
     */
    static String[] balance(String value) {
        Matcher matcher = value == null ? null : MARK_DATE_CURRENCY_AMOUNT.matcher(value.trim());
        if (matcher == null || !matcher.find()) {
            return null;
        }
        return new String[] {
            "C".equals(matcher.group(1)) ? "CRDT" : "DBIT",
            isoDate(matcher.group(2)), matcher.group(3), decimal(matcher.group(4))};
    }

    /**
     * Fields 90C and 90D: number of entries, currency, sum.
     */
    static String[] countCurrencyAmount(String value) {
        Matcher matcher = value == null ? null : COUNT_CURRENCY_AMOUNT.matcher(value.trim());
        if (matcher == null || !matcher.find()) {
            return null;
        }
        return new String[] {matcher.group(1), matcher.group(2), decimal(matcher.group(3))};
    }

    /**
     * Field 34F: currency, optional mark, amount.
     */
    static String[] floorLimit(String value) {
        Matcher matcher = value == null ? null : FLOOR_LIMIT.matcher(value.trim());
        if (matcher == null || !matcher.find()) {
            return null;
        }
        return new String[] {matcher.group(1), decimal(matcher.group(3))};
    }
}
