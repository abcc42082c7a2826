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
 * FI to FI customer credit transfer (pacs.008).
 *
 * Also the record produced for generic SWIFT MT customer transfers such as MT103.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Pacs008Message extends PaymentMessage implements HasTransactions {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "settlement_method", "clearing_system", "number_of_transactions", "settlement_amount", "settlement_currency", "transactions");

    /**
     * Group header creation timestamp (GrpHdr/CreDtTm).
     */
    private String creationDateTime;

    /**
     * Settlement method code, e.g. INDA, INGA, CLRG.
     */
    private String settlementMethod;

    private String clearingSystem;

    private Integer numberOfTransactions;

    /**
     * Total interbank settlement amount of the group.
     */
    private String settlementAmount;

    private String settlementCurrency;

    /**
     * One map per CdtTrfTxInf block.
     */
    @Builder.Default
    private List<Map<String, String>> transactions = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.PACS_008;
    }
}
