package com.paymsg.canonical;

import java.util.List;
import java.util.Map;

/**
 * Record carrying fund orders (setr.004, setr.010).
 */
public interface HasOrders {

    List<Map<String, String>> getOrders();
}
