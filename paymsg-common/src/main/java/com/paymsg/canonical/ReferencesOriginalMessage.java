package com.paymsg.canonical;

/**
 * Record that points back at the message it answers, recalls or returns.
 */
public interface ReferencesOriginalMessage {

    String getOriginalMessageId();
}
