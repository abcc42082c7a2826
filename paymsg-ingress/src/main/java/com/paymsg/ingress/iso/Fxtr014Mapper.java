package com.paymsg.ingress.iso;

import com.paymsg.canonical.Fxtr014Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;

/**
 * Mapper for ISO 20022 fxtr.014 (Foreign Exchange Trade Instruction).
 *
 * The trading side's buy amount is the traded amount; the sell amount is the
 * counter amount. Parties are read as a BIC when given, else as a name.
 */
public class Fxtr014Mapper implements FamilyMapper {

    private static final String TRADE_AMOUNTS = ".//ns:TradAmts";

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        return base.seed(Fxtr014Message.builder())
            .creationDateTime(fields.text(".//ns:CreDtTm"))
            .tradeDate(fields.text(".//ns:TradInf/ns:TradDt | .//ns:TradDt/ns:Dt | .//ns:TradDt"))
            .settlementDate(fields.text(TRADE_AMOUNTS + "/ns:SttlmDt | .//ns:SttlmDt/ns:Dt | .//ns:SttlmDt"))
            .exchangeRate(fields.text(".//ns:AgrdRate/ns:XchgRate | .//ns:XchgRate"))
            .tradingParty(party(fields, "TradgSdId"))
            .counterparty(party(fields, "CtrPtySdId"))
            .tradedAmount(fields.text(TRADE_AMOUNTS + "/ns:TradgSdBuyAmt/ns:Amt"))
            .tradedCurrency(fields.text(TRADE_AMOUNTS + "/ns:TradgSdBuyAmt/ns:Amt/@Ccy"))
            .counterAmount(fields.text(TRADE_AMOUNTS + "/ns:TradgSdSellAmt/ns:Amt"))
            .counterCurrency(fields.text(TRADE_AMOUNTS + "/ns:TradgSdSellAmt/ns:Amt/@Ccy"))
            .build();
    }

    private static String party(FieldExtractor fields, String side) {
        String prefix = ".//ns:" + side + "/ns:SubmitgPty";
        return fields.text(prefix + "/ns:AnyBIC/ns:AnyBIC | " + prefix + "/ns:AnyBIC | "
            + prefix + "/ns:NmAndAdr/ns:Nm | .//ns:" + side + "//ns:Nm");
    }
}
