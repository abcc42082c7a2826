package com.paymsg.ingress.iso;

import com.paymsg.canonical.Pain001Message;
import com.paymsg.canonical.Pain008Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.firstNonNull;
import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for customer initiations: pain.001 (credit transfer) and pain.008
 * (direct debit).
 *
 * Every transaction inside a PmtInf block becomes one payment-information
 * entry carrying the block's context. Parties are looked up on the
 * transaction first and on the PmtInf block second, which covers the debtor
 * of a pain.001 and the creditor of a pain.008 living at block level.
 */
public class InitiationMapper implements FamilyMapper {

    private static final String GRP_HDR = ".//ns:GrpHdr";

    private final MessageFamily family;

    public InitiationMapper(MessageFamily family) {
        this.family = family;
    }

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        String creationDateTime = fields.text(GRP_HDR + "/ns:CreDtTm");
        Integer numberOfTransactions = IsoFields.count(fields.text(GRP_HDR + "/ns:NbOfTxs"));
        String controlSum = fields.text(GRP_HDR + "/ns:CtrlSum");
        String initiatingParty = fields.text(GRP_HDR + "/ns:InitgPty/ns:Nm");
        List<Map<String, String>> paymentInformation = extractPaymentInformation(fields);

        if (family == MessageFamily.PAIN_008) {
            return base.seed(Pain008Message.builder())
                .creationDateTime(creationDateTime)
                .numberOfTransactions(numberOfTransactions)
                .controlSum(controlSum)
                .initiatingParty(initiatingParty)
                .paymentInformation(paymentInformation)
                .build();
        }
        return base.seed(Pain001Message.builder())
            .creationDateTime(creationDateTime)
            .numberOfTransactions(numberOfTransactions)
            .controlSum(controlSum)
            .initiatingParty(initiatingParty)
            .paymentInformation(paymentInformation)
            .build();
    }

    private List<Map<String, String>> extractPaymentInformation(FieldExtractor fields) {
        boolean directDebit = family == MessageFamily.PAIN_008;
        String transactionPath = directDebit ? "ns:DrctDbtTxInf" : "ns:CdtTrfTxInf";
        String datePath = directDebit ? "ns:ReqdColltnDt" : "ns:ReqdExctnDt/ns:Dt | ns:ReqdExctnDt/ns:DtTm | ns:ReqdExctnDt";

        List<Map<String, String>> entries = new ArrayList<>();
        for (Element pmtInf : fields.nodes(".//ns:PmtInf")) {
            for (Element tx : fields.nodes(pmtInf, transactionPath)) {
                Map<String, String> entry = row(
                    "payment_information_id", fields.text(pmtInf, "ns:PmtInfId"),
                    "payment_method", fields.text(pmtInf, "ns:PmtMtd"),
                    "requested_execution_date", fields.text(pmtInf, datePath),
                    "end_to_end_id", fields.text(tx, "ns:PmtId/ns:EndToEndId"),
                    "instruction_id", fields.text(tx, "ns:PmtId/ns:InstrId"),
                    "amount", fields.text(tx, "ns:Amt/ns:InstdAmt | ns:InstdAmt"),
                    "currency", fields.text(tx, "ns:Amt/ns:InstdAmt/@Ccy | ns:InstdAmt/@Ccy"),
                    "debtor_name", firstNonNull(IsoFields.partyName(fields, tx, "Dbtr"), IsoFields.partyName(fields, pmtInf, "Dbtr")),
                    "debtor_account", firstNonNull(IsoFields.account(fields, tx, "DbtrAcct"), IsoFields.account(fields, pmtInf, "DbtrAcct")),
                    "debtor_agent", firstNonNull(IsoFields.agentBic(fields, tx, "DbtrAgt"), IsoFields.agentBic(fields, pmtInf, "DbtrAgt")),
                    "creditor_name", firstNonNull(IsoFields.partyName(fields, tx, "Cdtr"), IsoFields.partyName(fields, pmtInf, "Cdtr")),
                    "creditor_account", firstNonNull(IsoFields.account(fields, tx, "CdtrAcct"), IsoFields.account(fields, pmtInf, "CdtrAcct")),
                    "creditor_agent", firstNonNull(IsoFields.agentBic(fields, tx, "CdtrAgt"), IsoFields.agentBic(fields, pmtInf, "CdtrAgt")),
                    "remittance_information", fields.text(tx, "ns:RmtInf/ns:Ustrd"));
                if (directDebit) {
                    entry.put("mandate_id", fields.text(tx, "ns:DrctDbtTx/ns:MndtRltdInf/ns:MndtId"));
                }
                entries.add(entry);
            }
        }
        return entries;
    }
}
