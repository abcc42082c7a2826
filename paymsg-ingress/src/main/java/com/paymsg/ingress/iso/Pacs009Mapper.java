package com.paymsg.ingress.iso;

import com.paymsg.canonical.Pacs009Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for ISO 20022 pacs.009 (Financial Institution Credit Transfer).
 *
 * Debtor and creditor are institutions here, so each transaction carries
 * their BICs rather than names. Supports both Dbtr/FinInstnId/BICFI and the
 * flattened Dbtr/BICFI layout.
 */
public class Pacs009Mapper implements FamilyMapper {

    private static final String GRP_HDR = ".//ns:GrpHdr";

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        return base.seed(Pacs009Message.builder())
            .creationDateTime(fields.text(IsoFields.CREATION_DATE_TIME))
            .settlementMethod(fields.text(GRP_HDR + "/ns:SttlmInf/ns:SttlmMtd"))
            .clearingSystem(fields.text(GRP_HDR + "/ns:SttlmInf/ns:ClrSys/ns:Cd"))
            .numberOfTransactions(IsoFields.count(fields.text(GRP_HDR + "/ns:NbOfTxs")))
            .transactions(extractTransactions(fields))
            .build();
    }

    private static List<Map<String, String>> extractTransactions(FieldExtractor fields) {
        List<Map<String, String>> transactions = new ArrayList<>();
        for (Element tx : fields.nodes(".//ns:CdtTrfTxInf")) {
            transactions.add(row(
                "instruction_id", fields.text(tx, "ns:PmtId/ns:InstrId"),
                "end_to_end_id", fields.text(tx, "ns:PmtId/ns:EndToEndId"),
                "transaction_id", fields.text(tx, "ns:PmtId/ns:TxId"),
                "uetr", fields.text(tx, "ns:PmtId/ns:UETR"),
                "amount", fields.text(tx, "ns:IntrBkSttlmAmt"),
                "currency", fields.text(tx, "ns:IntrBkSttlmAmt/@Ccy"),
                "debtor", institution(fields, tx, "Dbtr"),
                "creditor", institution(fields, tx, "Cdtr"),
                "debtor_agent", IsoFields.agentBic(fields, tx, "DbtrAgt"),
                "creditor_agent", IsoFields.agentBic(fields, tx, "CdtrAgt")));
        }
        return transactions;
    }

    private static String institution(FieldExtractor fields, Element tx, String party) {
        return fields.text(tx, "ns:" + party + "/ns:FinInstnId/ns:BICFI | ns:" + party + "/ns:BICFI | ns:"
            + party + "/ns:FinInstnId/ns:BIC");
    }
}
