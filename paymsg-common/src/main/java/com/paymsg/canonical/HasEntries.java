package com.paymsg.canonical;

import java.util.List;
import java.util.Map;

/**
 * Record carrying account entries (camt.052, camt.053, camt.054).
 */
public interface HasEntries {

    List<Map<String, String>> getEntries();
}
