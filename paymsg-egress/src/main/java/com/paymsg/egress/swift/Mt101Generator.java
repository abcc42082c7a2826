package com.paymsg.egress.swift;

import com.paymsg.canonical.HasPaymentInformation;
import com.paymsg.canonical.Pain001Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MT101 request for transfer. One transaction sequence is written per payment
 * information entry; a record without entries yields a single sequence built
 * from its own fields.
 */
public class Mt101Generator extends MtMessageGenerator {

    public Mt101Generator(TranscoderSettings settings, Clock clock) {
        super(settings, clock);
    }

    @Override
    public String messageType() {
        return "101";
    }

    @Override
    protected void appendBody(StringBuilder body, PaymentMessage record) {
        List<Map<String, String>> payments = payments(record);

        field(body, "20", reference(record.getMessageId()));
        field(body, "28D", "1/1");
        String orderingName = record.getDebtorName();
        if (isBlank(orderingName) && record instanceof Pain001Message) {
            orderingName = ((Pain001Message) record).getInitiatingParty();
        }
        party(body, "50H", isBlank(record.getDebtorAccount()) ? null : record.getDebtorAccount(), orderingName, null);
        field(body, "30", yymmdd(payments.get(0).get("requested_execution_date")));

        // Transaction sequences
        for (Map<String, String> payment : payments) {
            field(body, "21", reference(firstNonBlank(payment.get("end_to_end_id"), payment.get("payment_information_id"))));
            field(body, "32B", currency(firstNonBlank(payment.get("currency"), record.getCurrency()))
                + amount(firstNonBlank(payment.get("amount"), record.getAmount())));
            String creditorAgent = payment.get("creditor_agent");
            if (!isBlank(creditorAgent)) {
                field(body, "57A", creditorAgent.trim());
            }
            party(body, "59", payment.get("creditor_account"), payment.get("creditor_name"), null);
            String remittance = payment.get("remittance_information");
            if (!isBlank(remittance)) {
                field(body, "70", singleLine(remittance));
            }
            field(body, "71A", "SHA");
        }
    }

    private static List<Map<String, String>> payments(PaymentMessage record) {
        List<Map<String, String>> payments = new ArrayList<>();
        if (record instanceof HasPaymentInformation && ((HasPaymentInformation) record).getPaymentInformation() != null) {
            for (Map<String, String> payment : ((HasPaymentInformation) record).getPaymentInformation()) {
                if (payment != null) {
                    payments.add(payment);
                }
            }
        }
        if (payments.isEmpty()) {
            Map<String, String> single = new LinkedHashMap<>();
            single.put("end_to_end_id", record.getEndToEndId());
            single.put("amount", record.getAmount());
            single.put("currency", record.getCurrency());
            single.put("creditor_name", record.getCreditorName());
            single.put("creditor_account", record.getCreditorAccount());
            single.put("remittance_information", Remittance.of(record));
            payments.add(single);
        }
        return payments;
    }

    private static String firstNonBlank(String first, String second) {
        return isBlank(first) ? second : first;
    }
}
