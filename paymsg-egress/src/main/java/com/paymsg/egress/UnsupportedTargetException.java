package com.paymsg.egress;

/**
 * Thrown when a record is rendered to a format with no generator.
 */
public class UnsupportedTargetException extends UnsupportedOperationException {

    private final String target;

    public UnsupportedTargetException(String target) {
        super("Translation to " + target + " is not supported");
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
