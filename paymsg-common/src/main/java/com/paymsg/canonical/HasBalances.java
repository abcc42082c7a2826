package com.paymsg.canonical;

import java.util.List;
import java.util.Map;

/**
 * Record carrying account balances.
 */
public interface HasBalances {

    List<Map<String, String>> getBalances();
}
