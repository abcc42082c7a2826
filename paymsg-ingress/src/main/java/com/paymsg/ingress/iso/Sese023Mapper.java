package com.paymsg.ingress.iso;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.Sese023Message;
import com.paymsg.ingress.common.FieldExtractor;
import com.paymsg.ingress.common.XmlDocuments;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Mapper for ISO 20022 sese.023 (Securities Settlement Transaction Instruction).
 */
public class Sese023Mapper implements FamilyMapper {

    private static final String TRADE_DETAILS = ".//ns:TradDtls";
    private static final String INSTRUMENT = ".//ns:FinInstrmId";
    private static final String SETTLEMENT_AMOUNT = ".//ns:SttlmAmt/ns:Amt";

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        String isin = fields.text(INSTRUMENT + "/ns:ISIN");
        String securityIdType = isin != null
            ? "ISIN"
            : fields.text(INSTRUMENT + "/ns:OthrId/ns:Tp/ns:Cd | " + INSTRUMENT + "/ns:OthrId/ns:Tp/ns:Prtry");

        String quantity = null;
        String quantityType = null;
        List<Element> quantities = fields.nodes(".//ns:SttlmQty/ns:Qty/*");
        if (!quantities.isEmpty()) {
            quantity = fields.text(quantities.get(0), ".");
            quantityType = XmlDocuments.localName(quantities.get(0));
        }

        return base.seed(Sese023Message.builder())
            .creationDateTime(fields.text(".//ns:CreDtTm"))
            .tradeDate(date(fields, TRADE_DETAILS + "/ns:TradDt"))
            .settlementDate(date(fields, TRADE_DETAILS + "/ns:SttlmDt"))
            .securityId(IsoFields.firstNonNull(isin, fields.text(INSTRUMENT + "/ns:OthrId/ns:Id")))
            .securityIdType(securityIdType)
            .securityQuantity(quantity)
            .securityQuantityType(quantityType)
            .settlementAmount(fields.text(SETTLEMENT_AMOUNT + "/ns:Amt | " + SETTLEMENT_AMOUNT))
            .settlementCurrency(fields.text(SETTLEMENT_AMOUNT + "/ns:Amt/@Ccy | " + SETTLEMENT_AMOUNT + "/@Ccy"))
            .deliveringAgent(settlementParty(fields, "DlvrgSttlmPties"))
            .receivingAgent(settlementParty(fields, "RcvgSttlmPties"))
            .build();
    }

    private static String date(FieldExtractor fields, String path) {
        return fields.text(path + "/ns:Dt/ns:Dt | " + path + "/ns:Dt/ns:DtTm | " + path + "/ns:Dt | " + path);
    }

    private static String settlementParty(FieldExtractor fields, String parties) {
        String party = ".//ns:" + parties + "/ns:Pty1/ns:Id";
        return fields.text(party + "/ns:AnyBIC | " + party + "/ns:NmAndAdr/ns:Nm | "
            + ".//ns:" + parties + "/ns:Dpstry/ns:Id/ns:AnyBIC");
    }
}
