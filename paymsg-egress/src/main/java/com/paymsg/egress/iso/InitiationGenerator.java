package com.paymsg.egress.iso;

import com.paymsg.canonical.HasPaymentInformation;
import com.paymsg.canonical.Pain001Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.egress.UetrGenerator;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * pain.001 customer credit transfer initiation.
 *
 * <p>Payment information entries are grouped into {@code PmtInf} blocks by
 * their {@code payment_information_id}, one {@code CdtTrfTxInf} per entry. A
 * record without entries yields a single block built from its own fields.</p>
 *
 * <p>The first transaction always carries the record's own amount, currency
 * and agents: when the first entry disagrees with them, a transaction built
 * from the record is written ahead of the entries.</p>
 */
public class InitiationGenerator extends MxMessageGenerator {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}.*");

    public InitiationGenerator(TranscoderSettings settings, Clock clock) {
        super(settings, clock, "pain.001");
    }

    @Override
    protected void appendDocument(StringBuilder xml, PaymentMessage record, UetrGenerator uetrs) {
        List<Map<String, String>> payments = payments(record);
        String initiatingParty = record.getDebtorName();
        String controlSum = null;
        if (record instanceof Pain001Message) {
            Pain001Message initiation = (Pain001Message) record;
            initiatingParty = isBlank(initiation.getInitiatingParty()) ? initiatingParty : initiation.getInitiatingParty();
            controlSum = initiation.getControlSum();
        }

        xml.append("  <CstmrCdtTrfInitn>\n");

        // Group Header
        xml.append("    <GrpHdr>\n");
        xml.append("      <MsgId>").append(escapeXml(reference(record.getMessageId()))).append("</MsgId>\n");
        xml.append("      <CreDtTm>").append(escapeXml(creationDateTime())).append("</CreDtTm>\n");
        xml.append("      <NbOfTxs>").append(payments.size()).append("</NbOfTxs>\n");
        if (!isBlank(controlSum)) {
            xml.append("      <CtrlSum>").append(escapeXml(controlSum.trim())).append("</CtrlSum>\n");
        }
        xml.append("      <InitgPty>\n");
        xml.append("        <Nm>").append(escapeXml(name(initiatingParty))).append("</Nm>\n");
        xml.append("      </InitgPty>\n");
        xml.append("    </GrpHdr>\n");

        boolean first = true;
        for (Map.Entry<String, List<Map<String, String>>> block : blocks(record, payments).entrySet()) {
            List<Map<String, String>> transactions = block.getValue();
            Map<String, String> lead = transactions.get(0);

            xml.append("    <PmtInf>\n");
            xml.append("      <PmtInfId>").append(escapeXml(block.getKey())).append("</PmtInfId>\n");
            xml.append("      <PmtMtd>TRF</PmtMtd>\n");
            xml.append("      <NbOfTxs>").append(transactions.size()).append("</NbOfTxs>\n");
            xml.append("      <ReqdExctnDt>\n");
            xml.append("        <Dt>").append(escapeXml(executionDate(lead.get("requested_execution_date")))).append("</Dt>\n");
            xml.append("      </ReqdExctnDt>\n");
            party(xml, "      ", "Dbtr", firstNonBlank(lead.get("debtor_name"), record.getDebtorName()),
                record.getDebtorAddress());
            String debtorAccount = firstNonBlank(lead.get("debtor_account"), record.getDebtorAccount());
            account(xml, "      ", "DbtrAcct", isBlank(debtorAccount) ? settings.getDefaultReference() : debtorAccount);
            agent(xml, "      ", "DbtrAgt", firstNonBlank(lead.get("debtor_agent"), record.getSenderBic()));

            for (Map<String, String> transaction : transactions) {
                appendTransaction(xml, record, transaction, first ? uetr(record, uetrs) : null, first);
                first = false;
            }
            xml.append("    </PmtInf>\n");
        }

        xml.append("  </CstmrCdtTrfInitn>\n");
    }

    private void appendTransaction(StringBuilder xml, PaymentMessage record, Map<String, String> transaction,
                                   String uetr, boolean first) {
        xml.append("      <CdtTrfTxInf>\n");
        xml.append("        <PmtId>\n");
        if (!isBlank(transaction.get("instruction_id"))) {
            xml.append("          <InstrId>").append(escapeXml(transaction.get("instruction_id").trim())).append("</InstrId>\n");
        }
        String endToEndId = first
            ? firstNonBlank(transaction.get("end_to_end_id"), record.getEndToEndId())
            : transaction.get("end_to_end_id");
        xml.append("          <EndToEndId>").append(escapeXml(reference(endToEndId))).append("</EndToEndId>\n");
        if (uetr != null) {
            xml.append("          <UETR>").append(escapeXml(uetr)).append("</UETR>\n");
        }
        xml.append("        </PmtId>\n");
        xml.append("        <Amt>\n");
        xml.append("          <InstdAmt Ccy=\"")
            .append(escapeXml(currency(firstNonBlank(transaction.get("currency"), record.getCurrency())))).append("\">")
            .append(escapeXml(amount(firstNonBlank(transaction.get("amount"), record.getAmount()))))
            .append("</InstdAmt>\n");
        xml.append("        </Amt>\n");
        agent(xml, "        ", "CdtrAgt", firstNonBlank(transaction.get("creditor_agent"), record.getReceiverBic()));
        party(xml, "        ", "Cdtr", firstNonBlank(transaction.get("creditor_name"), first ? record.getCreditorName() : null),
            first ? record.getCreditorAddress() : null);
        account(xml, "        ", "CdtrAcct",
            firstNonBlank(transaction.get("creditor_account"), first ? record.getCreditorAccount() : null));
        String remittance = transaction.get("remittance_information");
        if (!isBlank(remittance)) {
            xml.append("        <RmtInf>\n");
            xml.append("          <Ustrd>").append(escapeXml(remittance.trim())).append("</Ustrd>\n");
            xml.append("        </RmtInf>\n");
        }
        xml.append("      </CdtTrfTxInf>\n");
    }

    private List<Map<String, String>> payments(PaymentMessage record) {
        List<Map<String, String>> payments = new ArrayList<>();
        if (record instanceof HasPaymentInformation && ((HasPaymentInformation) record).getPaymentInformation() != null) {
            for (Map<String, String> payment : ((HasPaymentInformation) record).getPaymentInformation()) {
                if (payment != null) {
                    payments.add(payment);
                }
            }
        }
        if (payments.isEmpty() || !agreesWithRecord(payments.get(0), record)) {
            Map<String, String> own = new LinkedHashMap<>();
            own.put("end_to_end_id", record.getEndToEndId());
            own.put("amount", record.getAmount());
            own.put("currency", record.getCurrency());
            own.put("creditor_name", record.getCreditorName());
            own.put("creditor_account", record.getCreditorAccount());
            payments.add(0, own);
        }
        return payments;
    }

    private static boolean agreesWithRecord(Map<String, String> payment, PaymentMessage record) {
        return agrees(payment.get("amount"), record.getAmount())
            && agrees(payment.get("currency"), record.getCurrency())
            && agrees(payment.get("debtor_agent"), record.getSenderBic())
            && agrees(payment.get("creditor_agent"), record.getReceiverBic());
    }

    private static boolean agrees(String value, String own) {
        return isBlank(value) || isBlank(own) || value.trim().equals(own.trim());
    }

    private Map<String, List<Map<String, String>>> blocks(PaymentMessage record, List<Map<String, String>> payments) {
        Map<String, List<Map<String, String>>> blocks = new LinkedHashMap<>();
        for (Map<String, String> payment : payments) {
            String id = payment.get("payment_information_id");
            if (isBlank(id)) {
                id = "PMTINF-" + reference(firstNonBlank(payment.get("end_to_end_id"), record.getEndToEndId()));
            }
            blocks.computeIfAbsent(id.trim(), key -> new ArrayList<>()).add(payment);
        }
        return blocks;
    }

    private String executionDate(String requested) {
        if (!isBlank(requested) && ISO_DATE.matcher(requested.trim()).matches()) {
            return requested.trim().substring(0, 10);
        }
        return LocalDate.now(clock).toString();
    }

    private static String firstNonBlank(String value, String fallback) {
        return isBlank(value) ? fallback : value.trim();
    }
}
