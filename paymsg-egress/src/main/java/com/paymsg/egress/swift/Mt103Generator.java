package com.paymsg.egress.swift;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.PostalAddress;
import com.paymsg.config.TranscoderSettings;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * MT103 single customer credit transfer.
 */
public class Mt103Generator extends MtMessageGenerator {

    public Mt103Generator(TranscoderSettings settings, Clock clock) {
        super(settings, clock);
    }

    @Override
    public String messageType() {
        return "103";
    }

    @Override
    protected boolean carriesUetr() {
        return true;
    }

    @Override
    protected void appendBody(StringBuilder body, PaymentMessage record) {
        field(body, "20", reference(record.getMessageId()));
        field(body, "23B", "CRED");
        field(body, "32A", today() + currency(record.getCurrency()) + amount(record.getAmount()));
        party(body, "50K", record.getDebtorAccount(), record.getDebtorName(), addressLines(record.getDebtorAddress()));
        party(body, "59", record.getCreditorAccount(), record.getCreditorName(), addressLines(record.getCreditorAddress()));
        String remittance = Remittance.of(record);
        if (remittance != null) {
            field(body, "70", singleLine(remittance));
        }
        field(body, "71A", "SHA");
    }

    /**
     * Free-format address lines, or street/town/country when only a structured
     * address is known.
     */
    static List<String> addressLines(PostalAddress address) {
        List<String> lines = new ArrayList<>();
        if (address == null) {
            return lines;
        }
        if (address.getAddressLines() != null && !address.getAddressLines().isEmpty()) {
            lines.addAll(address.getAddressLines());
            return lines;
        }
        StringBuilder street = new StringBuilder();
        if (address.getStreetName() != null) {
            street.append(address.getStreetName());
        }
        if (address.getBuildingNumber() != null) {
            street.append(street.length() > 0 ? " " : "").append(address.getBuildingNumber());
        }
        if (street.length() > 0) {
            lines.add(street.toString());
        }
        StringBuilder town = new StringBuilder();
        if (address.getPostCode() != null) {
            town.append(address.getPostCode());
        }
        if (address.getTownName() != null) {
            town.append(town.length() > 0 ? " " : "").append(address.getTownName());
        }
        if (address.getCountry() != null) {
            town.append(town.length() > 0 ? " " : "").append(address.getCountry());
        }
        if (town.length() > 0) {
            lines.add(town.toString());
        }
        return lines;
    }
}
