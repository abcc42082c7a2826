package com.paymsg.ingress.iso;

import com.paymsg.canonical.Camt056Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for ISO 20022 camt.056 (FI to FI Payment Cancellation Request).
 *
 * Both the current (FIToFIPmtCxlReq) and the recall (FIToFICstmrCdtTrfRcl)
 * root layouts are read. Underlying transactions come from Undrlyg/TxInf,
 * or from Undrlyg itself when the references sit directly below it.
 */
public class Camt056Mapper implements FamilyMapper {

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        return base.seed(Camt056Message.builder())
            .creationDateTime(fields.text(".//ns:Assgnmt/ns:CreDtTm"))
            .assignmentId(fields.text(".//ns:Assgnmt/ns:Id"))
            .caseId(fields.text(".//ns:Case/ns:Id"))
            .originalMessageId(fields.text(".//ns:OrgnlGrpInf/ns:OrgnlMsgId"))
            .originalMessageNameId(fields.text(".//ns:OrgnlGrpInf/ns:OrgnlMsgNmId"))
            .recallReason(fields.text(".//ns:CxlRsnInf/ns:Rsn/ns:Cd | .//ns:CxlRsnInf/ns:Rsn/ns:Prtry"))
            .underlyingTransactions(extractUnderlying(fields))
            .build();
    }

    private static List<Map<String, String>> extractUnderlying(FieldExtractor fields) {
        List<Map<String, String>> underlying = new ArrayList<>();
        for (Element tx : fields.nodes(".//ns:Undrlyg/ns:TxInf | .//ns:Undrlyg")) {
            underlying.add(row(
                "cancellation_id", fields.text(tx, "ns:CxlId"),
                "original_instruction_id", fields.text(tx, "ns:OrgnlInstrId"),
                "original_end_to_end_id", fields.text(tx, "ns:OrgnlEndToEndId"),
                "original_transaction_id", fields.text(tx, "ns:OrgnlTxId"),
                "original_uetr", fields.text(tx, "ns:OrgnlUETR"),
                "original_amount", fields.text(tx, "ns:OrgnlIntrBkSttlmAmt"),
                "original_currency", fields.text(tx, "ns:OrgnlIntrBkSttlmAmt/@Ccy"),
                "reason", fields.text(tx, "ns:CxlRsnInf/ns:Rsn/ns:Cd | ns:CxlRsnInf/ns:Rsn/ns:Prtry")));
        }
        return underlying;
    }
}
