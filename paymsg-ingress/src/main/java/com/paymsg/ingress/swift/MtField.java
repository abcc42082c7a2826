package com.paymsg.ingress.swift;

import lombok.Value;

/**
 * One Block 4 field: tag without colons ("32A") and its raw, possibly
 * multi-line value.
 */
@Value
public class MtField {
    String tag;
    String value;
}
