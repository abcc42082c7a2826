package com.paymsg.egress.swift;

import com.paymsg.canonical.HasEntries;
import com.paymsg.canonical.HasPaymentInformation;
import com.paymsg.canonical.HasTransactions;
import com.paymsg.canonical.PaymentMessage;

import java.util.List;
import java.util.Map;

/**
 * Looks up the remittance text of the first nested transaction, payment or entry.
 */
final class Remittance {

    private Remittance() {
    }

    static String of(PaymentMessage record) {
        if (record instanceof HasTransactions) {
            return firstValue(((HasTransactions) record).getTransactions(), "remittance_information");
        }
        if (record instanceof HasPaymentInformation) {
            return firstValue(((HasPaymentInformation) record).getPaymentInformation(), "remittance_information");
        }
        if (record instanceof HasEntries) {
            return firstValue(((HasEntries) record).getEntries(), "remittance");
        }
        return null;
    }

    static String firstValue(List<Map<String, String>> rows, String key) {
        if (rows == null || rows.isEmpty() || rows.get(0) == null) {
            return null;
        }
        String value = rows.get(0).get(key);
        return value == null || value.trim().isEmpty() ? null : value;
    }
}
