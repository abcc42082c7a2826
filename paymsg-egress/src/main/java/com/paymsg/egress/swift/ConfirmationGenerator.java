package com.paymsg.egress.swift;

import com.paymsg.canonical.AccountReport;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;

import java.time.Clock;

/**
 * MT900 confirmation of debit and MT910 confirmation of credit.
 */
public class ConfirmationGenerator extends MtMessageGenerator {

    private final boolean credit;

    public ConfirmationGenerator(TranscoderSettings settings, Clock clock, boolean credit) {
        super(settings, clock);
        this.credit = credit;
    }

    @Override
    public String messageType() {
        return credit ? "910" : "900";
    }

    @Override
    protected void appendBody(StringBuilder body, PaymentMessage record) {
        field(body, "20", reference(record.getMessageId()));
        field(body, "21", reference(record.getEndToEndId()));
        field(body, "25", reference(account(record)));
        field(body, "32A", today() + currency(record.getCurrency()) + amount(record.getAmount()));
        if (credit) {
            // Ordering institution when known, else the ordering customer
            if (!isBlank(record.getSenderBic())) {
                field(body, "52A", logicalTerminal(record.getSenderBic()));
            } else {
                party(body, "50K", null, record.getDebtorName(), null);
            }
        } else {
            field(body, "52A", logicalTerminal(record.getSenderBic()));
        }
    }

    private String account(PaymentMessage record) {
        if (record instanceof AccountReport && !isBlank(((AccountReport) record).getAccountId())) {
            return ((AccountReport) record).getAccountId();
        }
        return credit ? record.getCreditorAccount() : record.getDebtorAccount();
    }
}
