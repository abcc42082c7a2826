package com.paymsg.ingress.iso;

import com.paymsg.canonical.Camt029Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for ISO 20022 camt.029 (Resolution Of Investigation).
 */
public class Camt029Mapper implements FamilyMapper {

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        return base.seed(Camt029Message.builder())
            .creationDateTime(fields.text(".//ns:Assgnmt/ns:CreDtTm"))
            .assignmentId(fields.text(".//ns:Assgnmt/ns:Id"))
            .caseId(fields.text(".//ns:Case/ns:Id | .//ns:RslvdCase/ns:Id"))
            .investigationStatus(fields.text(".//ns:Sts/ns:Conf"))
            .cancellationDetails(extractCancellations(fields))
            .build();
    }

    private static List<Map<String, String>> extractCancellations(FieldExtractor fields) {
        List<Map<String, String>> details = new ArrayList<>();
        for (Element tx : fields.nodes(".//ns:CxlDtls/ns:TxInfAndSts | .//ns:CxlDtls")) {
            details.add(row(
                "cancellation_status_id", fields.text(tx, "ns:CxlStsId"),
                "original_end_to_end_id", fields.text(tx, "ns:OrgnlEndToEndId"),
                "original_transaction_id", fields.text(tx, "ns:OrgnlTxId"),
                "original_uetr", fields.text(tx, "ns:OrgnlUETR"),
                "transaction_cancellation_status", fields.text(tx, "ns:TxCxlSts")));
        }
        return details;
    }
}
