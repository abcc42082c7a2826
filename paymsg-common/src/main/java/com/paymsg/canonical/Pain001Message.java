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
 * Customer credit transfer initiation (pain.001).
 *
 * Also produced from SWIFT MT101 request-for-transfer messages.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Pain001Message extends PaymentMessage implements HasPaymentInformation {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "number_of_transactions", "control_sum", "initiating_party", "payment_information");

    private String creationDateTime;

    private Integer numberOfTransactions;

    private String controlSum;

    /**
     * Name of the initiating party (InitgPty/Nm).
     */
    private String initiatingParty;

    /**
     * One map per credit transfer, carrying its PmtInf context.
     */
    @Builder.Default
    private List<Map<String, String>> paymentInformation = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.PAIN_001;
    }
}
