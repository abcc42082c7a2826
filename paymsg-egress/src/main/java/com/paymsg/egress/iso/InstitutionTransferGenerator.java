package com.paymsg.egress.iso;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.egress.UetrGenerator;

import java.time.Clock;

/**
 * pacs.009 financial institution credit transfer. Debtor and creditor are the
 * sending and receiving institutions; their postal addresses sit below
 * {@code FinInstnId}.
 */
public class InstitutionTransferGenerator extends MxMessageGenerator {

    public InstitutionTransferGenerator(TranscoderSettings settings, Clock clock) {
        super(settings, clock, "pacs.009");
    }

    @Override
    protected void appendDocument(StringBuilder xml, PaymentMessage record, UetrGenerator uetrs) {
        xml.append("  <FICdtTrf>\n");

        // Group Header
        xml.append("    <GrpHdr>\n");
        xml.append("      <MsgId>").append(escapeXml(reference(record.getMessageId()))).append("</MsgId>\n");
        xml.append("      <CreDtTm>").append(escapeXml(creationDateTime())).append("</CreDtTm>\n");
        xml.append("      <NbOfTxs>1</NbOfTxs>\n");
        xml.append("      <SttlmInf>\n");
        xml.append("        <SttlmMtd>INDA</SttlmMtd>\n");
        xml.append("      </SttlmInf>\n");
        xml.append("    </GrpHdr>\n");

        xml.append("    <CdtTrfTxInf>\n");
        xml.append("      <PmtId>\n");
        xml.append("        <EndToEndId>").append(escapeXml(reference(record.getEndToEndId()))).append("</EndToEndId>\n");
        xml.append("        <UETR>").append(escapeXml(uetr(record, uetrs))).append("</UETR>\n");
        xml.append("      </PmtId>\n");
        xml.append("      <IntrBkSttlmAmt Ccy=\"").append(escapeXml(currency(record.getCurrency()))).append("\">")
            .append(escapeXml(amount(record.getAmount()))).append("</IntrBkSttlmAmt>\n");
        agent(xml, "      ", "InstgAgt", record.getSenderBic());
        agent(xml, "      ", "InstdAgt", record.getReceiverBic());
        agent(xml, "      ", "Dbtr", record.getSenderBic(), record.getDebtorAddress());
        account(xml, "      ", "DbtrAcct", record.getDebtorAccount());
        agent(xml, "      ", "Cdtr", record.getReceiverBic(), record.getCreditorAddress());
        account(xml, "      ", "CdtrAcct", record.getCreditorAccount());
        xml.append("    </CdtTrfTxInf>\n");

        xml.append("  </FICdtTrf>\n");
    }
}
