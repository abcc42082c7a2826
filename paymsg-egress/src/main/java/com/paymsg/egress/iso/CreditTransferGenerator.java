package com.paymsg.egress.iso;

import com.paymsg.canonical.HasTransactions;
import com.paymsg.canonical.Pacs008Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.egress.UetrGenerator;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * FI to FI customer credit transfer envelope.
 *
 * Produces pacs.008 and is reused for camt.004, where the same envelope is
 * written under the camt.004 namespace.
 */
public class CreditTransferGenerator extends MxMessageGenerator {

    public CreditTransferGenerator(TranscoderSettings settings, Clock clock, String key) {
        super(settings, clock, key);
    }

    @Override
    protected void appendDocument(StringBuilder xml, PaymentMessage record, UetrGenerator uetrs) {
        String amount = amount(record.getAmount());
        String currency = currency(record.getCurrency());
        String settlementMethod = "CLRG";
        if (record instanceof Pacs008Message && !isBlank(((Pacs008Message) record).getSettlementMethod())) {
            settlementMethod = ((Pacs008Message) record).getSettlementMethod().trim();
        }

        xml.append("  <FIToFICstmrCdtTrf>\n");

        // Group Header
        xml.append("    <GrpHdr>\n");
        xml.append("      <MsgId>").append(escapeXml(reference(record.getMessageId()))).append("</MsgId>\n");
        xml.append("      <CreDtTm>").append(escapeXml(creationDateTime())).append("</CreDtTm>\n");
        xml.append("      <NbOfTxs>1</NbOfTxs>\n");
        xml.append("      <SttlmInf>\n");
        xml.append("        <SttlmMtd>").append(escapeXml(settlementMethod)).append("</SttlmMtd>\n");
        xml.append("      </SttlmInf>\n");
        agent(xml, "      ", "InstgAgt", record.getSenderBic());
        agent(xml, "      ", "InstdAgt", record.getReceiverBic());
        xml.append("    </GrpHdr>\n");

        // Credit Transfer Transaction Information
        xml.append("    <CdtTrfTxInf>\n");
        xml.append("      <PmtId>\n");
        String instructionId = transactionValue(record, "instruction_id");
        if (instructionId != null) {
            xml.append("        <InstrId>").append(escapeXml(instructionId)).append("</InstrId>\n");
        }
        xml.append("        <EndToEndId>").append(escapeXml(reference(record.getEndToEndId()))).append("</EndToEndId>\n");
        xml.append("        <UETR>").append(escapeXml(uetr(record, uetrs))).append("</UETR>\n");
        xml.append("      </PmtId>\n");
        xml.append("      <IntrBkSttlmAmt Ccy=\"").append(escapeXml(currency)).append("\">")
            .append(escapeXml(amount)).append("</IntrBkSttlmAmt>\n");
        xml.append("      <ChrgBr>SHAR</ChrgBr>\n");
        party(xml, "      ", "Dbtr", record.getDebtorName(), record.getDebtorAddress());
        account(xml, "      ", "DbtrAcct", record.getDebtorAccount());
        party(xml, "      ", "Cdtr", record.getCreditorName(), record.getCreditorAddress());
        account(xml, "      ", "CdtrAcct", record.getCreditorAccount());
        String remittance = transactionValue(record, "remittance_information");
        if (remittance != null) {
            xml.append("      <RmtInf>\n");
            xml.append("        <Ustrd>").append(escapeXml(remittance)).append("</Ustrd>\n");
            xml.append("      </RmtInf>\n");
        }
        xml.append("    </CdtTrfTxInf>\n");

        xml.append("  </FIToFICstmrCdtTrf>\n");
    }

    private static String transactionValue(PaymentMessage record, String key) {
        if (!(record instanceof HasTransactions)) {
            return null;
        }
        List<Map<String, String>> transactions = ((HasTransactions) record).getTransactions();
        if (transactions == null || transactions.isEmpty() || transactions.get(0) == null) {
            return null;
        }
        String value = transactions.get(0).get(key);
        return isBlank(value) ? null : value.trim();
    }
}
