package com.paymsg.ingress.iso;

import com.paymsg.canonical.Camt052Message;
import com.paymsg.canonical.Camt053Message;
import com.paymsg.canonical.Camt054Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for the cash-management reports camt.052 (Rpt), camt.053 (Stmt)
 * and camt.054 (Ntfctn).
 *
 * Only the first report block is read. Entries (Ntry) become one map each
 * with the first transaction detail's references and remittance text.
 */
public class AccountReportMapper implements FamilyMapper {

    private final MessageFamily family;

    public AccountReportMapper(MessageFamily family) {
        this.family = family;
    }

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        List<Element> blocks = fields.nodes(containerPath());
        Element block = blocks.isEmpty() ? null : blocks.get(0);

        String blockId = fields.text(block, "ns:Id");
        String creationDateTime = IsoFields.firstNonNull(
            fields.text(IsoFields.CREATION_DATE_TIME), fields.text(block, "ns:CreDtTm"));
        String accountId = IsoFields.account(fields, block, "Acct");
        String accountCurrency = fields.text(block, "ns:Acct/ns:Ccy");
        String accountOwner = fields.text(block, "ns:Acct/ns:Ownr/ns:Nm");
        String accountServicer = fields.text(block,
            "ns:Acct/ns:Svcr/ns:FinInstnId/ns:BICFI | ns:Acct/ns:Svcr/ns:FinInstnId/ns:BIC");
        Integer totalCreditEntries = IsoFields.count(fields.text(block, "ns:TxsSummry/ns:TtlCdtNtries/ns:NbOfNtries"));
        String totalCreditAmount = fields.text(block, "ns:TxsSummry/ns:TtlCdtNtries/ns:Sum");
        Integer totalDebitEntries = IsoFields.count(fields.text(block, "ns:TxsSummry/ns:TtlDbtNtries/ns:NbOfNtries"));
        String totalDebitAmount = fields.text(block, "ns:TxsSummry/ns:TtlDbtNtries/ns:Sum");
        List<Map<String, String>> entries = extractEntries(fields, block);

        switch (family) {
            case CAMT_052:
                return base.seed(Camt052Message.builder())
                    .reportId(blockId)
                    .creationDateTime(creationDateTime)
                    .accountId(accountId)
                    .accountCurrency(accountCurrency)
                    .accountOwner(accountOwner)
                    .accountServicer(accountServicer)
                    .totalCreditEntries(totalCreditEntries)
                    .totalCreditAmount(totalCreditAmount)
                    .totalDebitEntries(totalDebitEntries)
                    .totalDebitAmount(totalDebitAmount)
                    .balances(extractBalances(fields, block))
                    .entries(entries)
                    .build();
            case CAMT_054:
                return base.seed(Camt054Message.builder())
                    .notificationId(blockId)
                    .creationDateTime(creationDateTime)
                    .accountId(accountId)
                    .accountCurrency(accountCurrency)
                    .accountOwner(accountOwner)
                    .accountServicer(accountServicer)
                    .totalCreditEntries(totalCreditEntries)
                    .totalCreditAmount(totalCreditAmount)
                    .totalDebitEntries(totalDebitEntries)
                    .totalDebitAmount(totalDebitAmount)
                    .entries(entries)
                    .build();
            default:
                return base.seed(Camt053Message.builder())
                    .statementId(blockId)
                    .creationDateTime(creationDateTime)
                    .accountId(accountId)
                    .accountCurrency(accountCurrency)
                    .accountOwner(accountOwner)
                    .accountServicer(accountServicer)
                    .totalCreditEntries(totalCreditEntries)
                    .totalCreditAmount(totalCreditAmount)
                    .totalDebitEntries(totalDebitEntries)
                    .totalDebitAmount(totalDebitAmount)
                    .balances(extractBalances(fields, block))
                    .entries(entries)
                    .build();
        }
    }

    private String containerPath() {
        switch (family) {
            case CAMT_052:
                return ".//ns:Rpt";
            case CAMT_054:
                return ".//ns:Ntfctn";
            default:
                return ".//ns:Stmt";
        }
    }

    private static List<Map<String, String>> extractBalances(FieldExtractor fields, Element block) {
        List<Map<String, String>> balances = new ArrayList<>();
        for (Element balance : fields.nodes(block, "ns:Bal")) {
            balances.add(row(
                "type", fields.text(balance, "ns:Tp/ns:CdOrPrtry/ns:Cd | ns:Tp/ns:CdOrPrtry/ns:Prtry"),
                "amount", fields.text(balance, "ns:Amt"),
                "currency", fields.text(balance, "ns:Amt/@Ccy"),
                "credit_debit_indicator", fields.text(balance, "ns:CdtDbtInd"),
                "date", fields.text(balance, "ns:Dt/ns:Dt | ns:Dt/ns:DtTm")));
        }
        return balances;
    }

    private static List<Map<String, String>> extractEntries(FieldExtractor fields, Element block) {
        List<Map<String, String>> entries = new ArrayList<>();
        for (Element entry : fields.nodes(block, "ns:Ntry")) {
            entries.add(row(
                "reference", fields.text(entry, "ns:NtryRef | ns:AcctSvcrRef"),
                "amount", fields.text(entry, "ns:Amt"),
                "currency", fields.text(entry, "ns:Amt/@Ccy"),
                "credit_debit_indicator", fields.text(entry, "ns:CdtDbtInd"),
                "status", fields.text(entry, "ns:Sts/ns:Cd | ns:Sts"),
                "booking_date", fields.text(entry, "ns:BookgDt/ns:Dt | ns:BookgDt/ns:DtTm"),
                "value_date", fields.text(entry, "ns:ValDt/ns:Dt | ns:ValDt/ns:DtTm"),
                "transaction_type", fields.text(entry, "ns:BkTxCd/ns:Prtry/ns:Cd | ns:BkTxCd/ns:Domn/ns:Cd"),
                "end_to_end_id", fields.text(entry, ".//ns:TxDtls/ns:Refs/ns:EndToEndId"),
                "uetr", fields.text(entry, ".//ns:TxDtls/ns:Refs/ns:UETR"),
                "remittance", fields.text(entry, ".//ns:TxDtls/ns:RmtInf/ns:Ustrd | ns:AddtlNtryInf")));
        }
        return entries;
    }
}
