package com.paymsg.ingress.iso;

import com.paymsg.canonical.Pacs008Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for ISO 20022 pacs.008 (FI to FI Customer Credit Transfer).
 *
 * Extracts the group header settlement data and one transaction map per
 * CdtTrfTxInf block, with IntrBkSttlmAmt preferred over InstdAmt for the
 * transaction amount.
 */
public class Pacs008Mapper implements FamilyMapper {

    // PACS.008 element paths
    private static final String GRP_HDR = ".//ns:GrpHdr";
    private static final String CDT_TRF_TX_INF = ".//ns:CdtTrfTxInf";
    private static final String TX_AMOUNT = "ns:IntrBkSttlmAmt | ns:Amt/ns:InstdAmt | ns:InstdAmt";
    private static final String TX_CURRENCY =
        "ns:IntrBkSttlmAmt/@Ccy | ns:Amt/ns:InstdAmt/@Ccy | ns:InstdAmt/@Ccy";

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        return base.seed(Pacs008Message.builder())
            .creationDateTime(fields.text(IsoFields.CREATION_DATE_TIME))
            .settlementMethod(fields.text(GRP_HDR + "/ns:SttlmInf/ns:SttlmMtd"))
            .clearingSystem(fields.text(GRP_HDR + "/ns:SttlmInf/ns:ClrSys/ns:Cd | " + GRP_HDR + "/ns:SttlmInf/ns:ClrSys/ns:Prtry"))
            .numberOfTransactions(IsoFields.count(fields.text(GRP_HDR + "/ns:NbOfTxs")))
            .settlementAmount(fields.text(GRP_HDR + "/ns:TtlIntrBkSttlmAmt"))
            .settlementCurrency(fields.text(GRP_HDR + "/ns:TtlIntrBkSttlmAmt/@Ccy"))
            .transactions(extractTransactions(fields))
            .build();
    }

    private static List<Map<String, String>> extractTransactions(FieldExtractor fields) {
        List<Map<String, String>> transactions = new ArrayList<>();
        for (Element tx : fields.nodes(CDT_TRF_TX_INF)) {
            transactions.add(row(
                "end_to_end_id", fields.text(tx, "ns:PmtId/ns:EndToEndId"),
                "instruction_id", fields.text(tx, "ns:PmtId/ns:InstrId"),
                "transaction_id", fields.text(tx, "ns:PmtId/ns:TxId"),
                "uetr", fields.text(tx, "ns:PmtId/ns:UETR"),
                "amount", fields.text(tx, TX_AMOUNT),
                "currency", fields.text(tx, TX_CURRENCY),
                "debtor_name", IsoFields.partyName(fields, tx, "Dbtr"),
                "debtor_account", IsoFields.account(fields, tx, "DbtrAcct"),
                "debtor_agent", IsoFields.agentBic(fields, tx, "DbtrAgt"),
                "creditor_name", IsoFields.partyName(fields, tx, "Cdtr"),
                "creditor_account", IsoFields.account(fields, tx, "CdtrAcct"),
                "creditor_agent", IsoFields.agentBic(fields, tx, "CdtrAgt"),
                "remittance_information", fields.text(tx, "ns:RmtInf/ns:Ustrd")));
        }
        return transactions;
    }
}
