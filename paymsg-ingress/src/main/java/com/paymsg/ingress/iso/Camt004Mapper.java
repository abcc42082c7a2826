package com.paymsg.ingress.iso;

import com.paymsg.canonical.Camt004Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for ISO 20022 camt.004 (Return Account).
 */
public class Camt004Mapper implements FamilyMapper {

    private static final String MSG_HDR = ".//ns:MsgHdr";
    private static final String REPORT = ".//ns:AcctRpt";

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        List<Element> reports = fields.nodes(REPORT);
        Element report = reports.isEmpty() ? fields.getContext() : reports.get(0);

        return base.seed(Camt004Message.builder())
            .creationDateTime(fields.text(MSG_HDR + "/ns:CreDtTm"))
            .originalBusinessQuery(fields.text(MSG_HDR + "/ns:OrgnlBizQry/ns:MsgId"))
            .accountId(fields.text(report, "ns:AcctId/ns:IBAN | ns:AcctId/ns:Othr/ns:Id | .//ns:Acct/ns:Id/ns:IBAN"))
            .accountOwner(fields.text(report, ".//ns:Ownr/ns:Nm | .//ns:Ownr//ns:AnyBIC"))
            .accountServicer(fields.text(report, ".//ns:Svcr/ns:FinInstnId/ns:BICFI | .//ns:Svcr/ns:FinInstnId/ns:BIC"))
            .accountStatus(fields.text(report, ".//ns:Acct/ns:Sts | .//ns:AcctOrErr/ns:Acct/ns:Sts"))
            .accountCurrency(fields.text(report, ".//ns:Acct/ns:Ccy"))
            .numberOfPayments(IsoFields.count(fields.text(report, ".//ns:NbOfPmts")))
            .balances(extractAmounts(fields, report, ".//ns:MulBal | .//ns:Bal",
                "ns:Tp/ns:Cd | ns:Tp/ns:CdOrPrtry/ns:Cd | ns:Tp/ns:Prtry"))
            .limits(extractAmounts(fields, report, ".//ns:CurLmt | .//ns:Lmt",
                "ns:LmtId/ns:Tp/ns:Cd | ns:Tp/ns:Cd | ns:LmtId/ns:Tp/ns:Prtry"))
            .businessErrors(extractErrors(fields))
            .build();
    }

    private static List<Map<String, String>> extractAmounts(FieldExtractor fields, Element report,
                                                            String path, String typePath) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (Element item : fields.nodes(report, path)) {
            List<Element> amounts = fields.nodes(item, ".//*[@Ccy]");
            Element amount = amounts.isEmpty() ? null : amounts.get(0);
            rows.add(row(
                "type", fields.text(item, typePath),
                "amount", fields.text(amount, "."),
                "currency", amount != null ? fields.text(amount, "@Ccy") : null,
                "credit_debit_indicator", fields.text(item, "ns:CdtDbtInd | .//ns:CdtDbtInd"),
                "date", fields.text(item, "ns:ValDt/ns:Dt | ns:ValDt/ns:DtTm")));
        }
        return rows;
    }

    private static List<Map<String, String>> extractErrors(FieldExtractor fields) {
        List<Map<String, String>> errors = new ArrayList<>();
        for (Element error : fields.nodes(".//ns:BizErr | .//ns:OprlErr")) {
            errors.add(row(
                "code", fields.text(error, "ns:Err/ns:Prtry | ns:Err/ns:Cd"),
                "description", fields.text(error, "ns:Desc")));
        }
        return errors;
    }
}
