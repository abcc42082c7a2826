package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Set;

/**
 * Foreign exchange trade instruction (fxtr.014).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Fxtr014Message extends PaymentMessage {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "trade_date", "settlement_date", "exchange_rate", "trading_party", "counterparty", "traded_currency", "traded_amount", "counter_currency", "counter_amount");

    private String creationDateTime;

    private String tradeDate;

    private String settlementDate;

    /**
     * Agreed exchange rate as decimal text.
     */
    private String exchangeRate;

    private String tradingParty;

    private String counterparty;

    private String tradedCurrency;

    private String tradedAmount;

    private String counterCurrency;

    private String counterAmount;

    @Override
    public MessageFamily family() {
        return MessageFamily.FXTR_014;
    }
}
