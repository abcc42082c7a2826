package com.paymsg.egress.swift;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;

import java.time.Clock;

/**
 * MT202 general financial institution transfer. The ordering and beneficiary
 * institutions are the sending and receiving banks.
 */
public class Mt202Generator extends MtMessageGenerator {

    public Mt202Generator(TranscoderSettings settings, Clock clock) {
        super(settings, clock);
    }

    @Override
    public String messageType() {
        return "202";
    }

    @Override
    protected boolean carriesUetr() {
        return true;
    }

    @Override
    protected void appendBody(StringBuilder body, PaymentMessage record) {
        field(body, "20", reference(record.getMessageId()));
        field(body, "21", reference(record.getEndToEndId()));
        field(body, "32A", today() + currency(record.getCurrency()) + amount(record.getAmount()));
        field(body, "52A", logicalTerminal(record.getSenderBic()));
        field(body, "58A", logicalTerminal(record.getReceiverBic()));
    }
}
