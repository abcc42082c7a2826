package com.paymsg.canonical;

import java.util.List;
import java.util.Map;

/**
 * Record carrying payment-information entries (pain.001, pain.008).
 */
public interface HasPaymentInformation {

    List<Map<String, String>> getPaymentInformation();
}
