package com.paymsg.egress;

import java.util.UUID;

/**
 * Source of UETRs for rendered messages that carry none.
 */
@FunctionalInterface
public interface UetrGenerator {

    String next();

    /**
     * Random version 4 UUIDs; every call yields a new value.
     */
    static UetrGenerator random() {
        return () -> UUID.randomUUID().toString();
    }
}
