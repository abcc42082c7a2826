package com.paymsg.canonical;

import java.util.List;
import java.util.Map;

/**
 * Record carrying a list of transaction maps (pacs families).
 */
public interface HasTransactions {

    List<Map<String, String>> getTransactions();
}
