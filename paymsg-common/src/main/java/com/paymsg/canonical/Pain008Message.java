package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Customer direct debit initiation (pain.008).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Pain008Message extends PaymentMessage implements HasPaymentInformation {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "number_of_transactions", "control_sum", "initiating_party", "payment_information");

    private String creationDateTime;

    private Integer numberOfTransactions;

    private String controlSum;

    private String initiatingParty;

    /**
     * One map per direct debit, carrying its PmtInf context and mandate id.
     */
    @Builder.Default
    private List<Map<String, String>> paymentInformation = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.PAIN_008;
    }
}
