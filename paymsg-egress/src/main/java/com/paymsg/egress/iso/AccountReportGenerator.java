package com.paymsg.egress.iso;

import com.paymsg.canonical.AccountReport;
import com.paymsg.canonical.Camt052Message;
import com.paymsg.canonical.Camt053Message;
import com.paymsg.canonical.Camt054Message;
import com.paymsg.canonical.HasBalances;
import com.paymsg.canonical.HasEntries;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.egress.UetrGenerator;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bank-to-customer cash management reports.
 *
 * <p>The statement layout serves all three targets: camt.053 writes a
 * {@code Stmt} block, camt.052 the same block as a {@code Rpt} and camt.054 a
 * {@code Ntfctn} without balances.</p>
 *
 * <p>The record's own amount is always the first amount of the document: a
 * statement or report whose first balance differs from it (or which has no
 * balances) gets a leading balance of that amount, and a notification whose
 * first entry differs from it (or which has no entries) gets a leading entry
 * built from the record's own fields.</p>
 */
public class AccountReportGenerator extends MxMessageGenerator {

    private final String rootElement;
    private final String blockElement;
    private final String defaultBalanceType;

    public AccountReportGenerator(TranscoderSettings settings, Clock clock, String key) {
        super(settings, clock, key);
        switch (key) {
            case "camt.052":
                this.rootElement = "BkToCstmrAcctRpt";
                this.blockElement = "Rpt";
                this.defaultBalanceType = "ITBD";
                break;
            case "camt.053":
                this.rootElement = "BkToCstmrStmt";
                this.blockElement = "Stmt";
                this.defaultBalanceType = "OPBD";
                break;
            case "camt.054":
                this.rootElement = "BkToCstmrDbtCdtNtfctn";
                this.blockElement = "Ntfctn";
                this.defaultBalanceType = null;
                break;
            default:
                throw new IllegalArgumentException("Not an account report: " + key);
        }
    }

    private boolean notification() {
        return defaultBalanceType == null;
    }

    @Override
    protected void appendDocument(StringBuilder xml, PaymentMessage record, UetrGenerator uetrs) {
        String currency = currency(record.getCurrency());
        String creationDateTime = creationDateTime();

        xml.append("  <").append(rootElement).append(">\n");

        // Group Header
        xml.append("    <GrpHdr>\n");
        xml.append("      <MsgId>").append(escapeXml(reference(record.getMessageId()))).append("</MsgId>\n");
        xml.append("      <CreDtTm>").append(escapeXml(creationDateTime)).append("</CreDtTm>\n");
        xml.append("      <MsgRcpt>\n");
        xml.append("        <Id>\n");
        xml.append("          <OrgId>\n");
        xml.append("            <AnyBIC>").append(escapeXml(bic(record.getReceiverBic()))).append("</AnyBIC>\n");
        xml.append("          </OrgId>\n");
        xml.append("        </Id>\n");
        xml.append("      </MsgRcpt>\n");
        xml.append("    </GrpHdr>\n");

        // Report block
        xml.append("    <").append(blockElement).append(">\n");
        xml.append("      <Id>").append(escapeXml(reference(blockId(record)))).append("</Id>\n");
        xml.append("      <CreDtTm>").append(escapeXml(creationDateTime)).append("</CreDtTm>\n");
        appendAccount(xml, record, currency);

        if (!notification()) {
            for (Map<String, String> balance : balances(record, currency)) {
                appendBalance(xml, balance, currency);
            }
        }
        appendSummary(xml, record);
        for (Map<String, String> entry : entries(record, currency)) {
            appendEntry(xml, entry, currency);
        }

        xml.append("    </").append(blockElement).append(">\n");
        xml.append("  </").append(rootElement).append(">\n");
    }

    private void appendAccount(StringBuilder xml, PaymentMessage record, String currency) {
        String accountId = record.getDebtorAccount();
        String accountCurrency = currency;
        String owner = null;
        if (record instanceof AccountReport) {
            AccountReport report = (AccountReport) record;
            accountId = isBlank(report.getAccountId()) ? accountId : report.getAccountId();
            accountCurrency = isBlank(report.getAccountCurrency()) ? currency : report.getAccountCurrency().trim();
            owner = report.getAccountOwner();
        }
        xml.append("      <Acct>\n");
        accountId(xml, "        ", isBlank(accountId) ? settings.getDefaultReference() : accountId);
        xml.append("        <Ccy>").append(escapeXml(accountCurrency)).append("</Ccy>\n");
        if (!isBlank(owner)) {
            xml.append("        <Ownr>\n");
            xml.append("          <Nm>").append(escapeXml(owner.trim())).append("</Nm>\n");
            xml.append("        </Ownr>\n");
        }
        agent(xml, "        ", "Svcr", record.getSenderBic());
        xml.append("      </Acct>\n");
    }

    private void appendBalance(StringBuilder xml, Map<String, String> balance, String currency) {
        xml.append("      <Bal>\n");
        xml.append("        <Tp>\n");
        xml.append("          <CdOrPrtry>\n");
        xml.append("            <Cd>").append(escapeXml(orElse(balance.get("type"), defaultBalanceType))).append("</Cd>\n");
        xml.append("          </CdOrPrtry>\n");
        xml.append("        </Tp>\n");
        xml.append("        <Amt Ccy=\"").append(escapeXml(orElse(balance.get("currency"), currency))).append("\">")
            .append(escapeXml(amount(balance.get("amount")))).append("</Amt>\n");
        xml.append("        <CdtDbtInd>").append(escapeXml(orElse(balance.get("credit_debit_indicator"), "CRDT")))
            .append("</CdtDbtInd>\n");
        xml.append("        <Dt>\n");
        xml.append("          <Dt>").append(escapeXml(orElse(balance.get("date"), today()))).append("</Dt>\n");
        xml.append("        </Dt>\n");
        xml.append("      </Bal>\n");
    }

    private void appendSummary(StringBuilder xml, PaymentMessage record) {
        if (!(record instanceof AccountReport)) {
            return;
        }
        AccountReport report = (AccountReport) record;
        boolean credits = report.getTotalCreditEntries() != null || report.getTotalCreditAmount() != null;
        boolean debits = report.getTotalDebitEntries() != null || report.getTotalDebitAmount() != null;
        if (!credits && !debits) {
            return;
        }
        xml.append("      <TxsSummry>\n");
        if (credits) {
            appendTotal(xml, "TtlCdtNtries", report.getTotalCreditEntries(), report.getTotalCreditAmount());
        }
        if (debits) {
            appendTotal(xml, "TtlDbtNtries", report.getTotalDebitEntries(), report.getTotalDebitAmount());
        }
        xml.append("      </TxsSummry>\n");
    }

    private static void appendTotal(StringBuilder xml, String element, Integer count, String sum) {
        xml.append("        <").append(element).append(">\n");
        if (count != null) {
            xml.append("          <NbOfNtries>").append(count).append("</NbOfNtries>\n");
        }
        if (!isBlank(sum)) {
            xml.append("          <Sum>").append(escapeXml(sum.trim())).append("</Sum>\n");
        }
        xml.append("        </").append(element).append(">\n");
    }

    private void appendEntry(StringBuilder xml, Map<String, String> entry, String currency) {
        xml.append("      <Ntry>\n");
        if (!isBlank(entry.get("reference"))) {
            xml.append("        <NtryRef>").append(escapeXml(entry.get("reference").trim())).append("</NtryRef>\n");
        }
        xml.append("        <Amt Ccy=\"").append(escapeXml(orElse(entry.get("currency"), currency))).append("\">")
            .append(escapeXml(amount(entry.get("amount")))).append("</Amt>\n");
        xml.append("        <CdtDbtInd>").append(escapeXml(orElse(entry.get("credit_debit_indicator"), "CRDT")))
            .append("</CdtDbtInd>\n");
        xml.append("        <Sts>\n");
        xml.append("          <Cd>").append(escapeXml(orElse(entry.get("status"), "BOOK"))).append("</Cd>\n");
        xml.append("        </Sts>\n");
        if (!isBlank(entry.get("booking_date"))) {
            xml.append("        <BookgDt>\n");
            xml.append("          <Dt>").append(escapeXml(entry.get("booking_date").trim())).append("</Dt>\n");
            xml.append("        </BookgDt>\n");
        }
        if (!isBlank(entry.get("value_date"))) {
            xml.append("        <ValDt>\n");
            xml.append("          <Dt>").append(escapeXml(entry.get("value_date").trim())).append("</Dt>\n");
            xml.append("        </ValDt>\n");
        }
        if (!isBlank(entry.get("transaction_type"))) {
            xml.append("        <BkTxCd>\n");
            xml.append("          <Prtry>\n");
            xml.append("            <Cd>").append(escapeXml(entry.get("transaction_type").trim())).append("</Cd>\n");
            xml.append("          </Prtry>\n");
            xml.append("        </BkTxCd>\n");
        }
        boolean references = !isBlank(entry.get("end_to_end_id")) || !isBlank(entry.get("uetr"));
        boolean remittance = !isBlank(entry.get("remittance"));
        if (references || remittance) {
            xml.append("        <NtryDtls>\n");
            xml.append("          <TxDtls>\n");
            if (references) {
                xml.append("            <Refs>\n");
                if (!isBlank(entry.get("end_to_end_id"))) {
                    xml.append("              <EndToEndId>").append(escapeXml(entry.get("end_to_end_id").trim()))
                        .append("</EndToEndId>\n");
                }
                if (!isBlank(entry.get("uetr"))) {
                    xml.append("              <UETR>").append(escapeXml(entry.get("uetr").trim())).append("</UETR>\n");
                }
                xml.append("            </Refs>\n");
            }
            if (remittance) {
                xml.append("            <RmtInf>\n");
                xml.append("              <Ustrd>").append(escapeXml(entry.get("remittance").trim())).append("</Ustrd>\n");
                xml.append("            </RmtInf>\n");
            }
            xml.append("          </TxDtls>\n");
            xml.append("        </NtryDtls>\n");
        }
        xml.append("      </Ntry>\n");
    }

    private List<Map<String, String>> balances(PaymentMessage record, String currency) {
        List<Map<String, String>> balances = new ArrayList<>();
        if (record instanceof HasBalances && ((HasBalances) record).getBalances() != null) {
            for (Map<String, String> balance : ((HasBalances) record).getBalances()) {
                if (balance != null) {
                    balances.add(balance);
                }
            }
        }
        if (balances.isEmpty() || !carriesRecordAmount(balances.get(0), record, currency)) {
            Map<String, String> leading = new LinkedHashMap<>();
            leading.put("type", hasType(balances, defaultBalanceType) ? "INFO" : defaultBalanceType);
            leading.put("amount", record.getAmount());
            leading.put("currency", currency);
            leading.put("credit_debit_indicator", "CRDT");
            leading.put("date", today());
            balances.add(0, leading);
        }
        return balances;
    }

    private List<Map<String, String>> entries(PaymentMessage record, String currency) {
        List<Map<String, String>> entries = new ArrayList<>();
        if (record instanceof HasEntries && ((HasEntries) record).getEntries() != null) {
            for (Map<String, String> entry : ((HasEntries) record).getEntries()) {
                if (entry != null) {
                    entries.add(entry);
                }
            }
        }
        if (notification() && (entries.isEmpty() || !carriesRecordAmount(entries.get(0), record, currency))) {
            Map<String, String> leading = new LinkedHashMap<>();
            leading.put("reference", record.getMessageId());
            leading.put("amount", record.getAmount());
            leading.put("currency", currency);
            leading.put("credit_debit_indicator", "CRDT");
            leading.put("status", "BOOK");
            leading.put("end_to_end_id", record.getEndToEndId());
            leading.put("uetr", record.getUetr());
            entries.add(0, leading);
        }
        return entries.isEmpty() ? Collections.emptyList() : entries;
    }

    /**
     * Whether a balance or entry renders with the record's own amount and
     * currency. A record without an amount accepts any first amount.
     */
    private static boolean carriesRecordAmount(Map<String, String> item, PaymentMessage record, String currency) {
        if (isBlank(record.getAmount())) {
            return true;
        }
        return amount(item.get("amount")).equals(record.getAmount().trim())
            && orElse(item.get("currency"), currency).equals(currency);
    }

    private static boolean hasType(List<Map<String, String>> balances, String type) {
        for (Map<String, String> balance : balances) {
            if (type.equals(orElse(balance.get("type"), type))) {
                return true;
            }
        }
        return false;
    }

    private static String blockId(PaymentMessage record) {
        if (record instanceof Camt053Message) {
            return ((Camt053Message) record).getStatementId();
        }
        if (record instanceof Camt052Message) {
            return ((Camt052Message) record).getReportId();
        }
        if (record instanceof Camt054Message) {
            return ((Camt054Message) record).getNotificationId();
        }
        return record.getMessageId();
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }

    private static String orElse(String value, String fallback) {
        return isBlank(value) ? fallback : value.trim();
    }
}
