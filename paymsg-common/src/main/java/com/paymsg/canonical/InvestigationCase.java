package com.paymsg.canonical;

/**
 * Record that belongs to an exception-and-investigation case.
 */
public interface InvestigationCase {

    String getCaseId();
}
