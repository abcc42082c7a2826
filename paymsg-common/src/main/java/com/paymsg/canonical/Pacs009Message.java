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
 * Financial institution credit transfer (pacs.009).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Pacs009Message extends PaymentMessage implements HasTransactions {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "settlement_method", "clearing_system", "number_of_transactions", "transactions");

    private String creationDateTime;

    private String settlementMethod;

    private String clearingSystem;

    private Integer numberOfTransactions;

    /**
     * One map per CdtTrfTxInf; debtor and creditor are institution BICs.
     */
    @Builder.Default
    private List<Map<String, String>> transactions = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.PACS_009;
    }
}
