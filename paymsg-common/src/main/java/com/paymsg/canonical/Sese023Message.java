package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Set;

/**
 * Securities settlement transaction instruction (sese.023).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Sese023Message extends PaymentMessage {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "trade_date", "settlement_date", "security_id", "security_id_type", "security_quantity", "security_quantity_type", "settlement_amount", "settlement_currency", "delivering_agent", "receiving_agent");

    private String creationDateTime;

    private String tradeDate;

    private String settlementDate;

    private String securityId;

    /**
     * Identification scheme of the security, e.g. ISIN.
     */
    private String securityIdType;

    private String securityQuantity;

    /**
     * Quantity kind, e.g. Unit or FaceAmt.
     */
    private String securityQuantityType;

    private String settlementAmount;

    private String settlementCurrency;

    private String deliveringAgent;

    private String receivingAgent;

    @Override
    public MessageFamily family() {
        return MessageFamily.SESE_023;
    }
}
