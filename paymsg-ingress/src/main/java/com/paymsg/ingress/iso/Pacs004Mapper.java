package com.paymsg.ingress.iso;

import com.paymsg.canonical.Pacs004Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for ISO 20022 pacs.004 (Payment Return).
 */
public class Pacs004Mapper implements FamilyMapper {

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        return base.seed(Pacs004Message.builder())
            .creationDateTime(fields.text(IsoFields.CREATION_DATE_TIME))
            .originalMessageId(fields.text(".//ns:OrgnlGrpInf/ns:OrgnlMsgId"))
            .originalMessageNameId(fields.text(".//ns:OrgnlGrpInf/ns:OrgnlMsgNmId"))
            .transactions(extractReturns(fields))
            .build();
    }

    private static List<Map<String, String>> extractReturns(FieldExtractor fields) {
        List<Map<String, String>> returns = new ArrayList<>();
        for (Element tx : fields.nodes(".//ns:TxInf")) {
            returns.add(row(
                "return_id", fields.text(tx, "ns:RtrId"),
                "original_end_to_end_id", fields.text(tx, "ns:OrgnlEndToEndId"),
                "original_transaction_id", fields.text(tx, "ns:OrgnlTxId"),
                "original_uetr", fields.text(tx, "ns:OrgnlUETR"),
                "returned_amount", fields.text(tx, "ns:RtrdIntrBkSttlmAmt"),
                "returned_currency", fields.text(tx, "ns:RtrdIntrBkSttlmAmt/@Ccy"),
                "return_reason", fields.text(tx, "ns:RtrRsnInf/ns:Rsn/ns:Cd | ns:RtrRsnInf/ns:Rsn/ns:Prtry")));
        }
        return returns;
    }
}
