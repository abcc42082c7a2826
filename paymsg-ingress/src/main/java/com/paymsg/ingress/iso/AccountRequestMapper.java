package com.paymsg.ingress.iso;

import com.paymsg.canonical.Acmt007Message;
import com.paymsg.canonical.Acmt015Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.ingress.common.FieldExtractor;

/**
 * Mapper for account management requests: acmt.007 (account opening) and
 * acmt.015 (account excluded mandate maintenance). Both share the Refs /
 * Acct / AcctSvcrId / Org layout.
 */
public class AccountRequestMapper implements FamilyMapper {

    private final MessageFamily family;

    public AccountRequestMapper(MessageFamily family) {
        this.family = family;
    }

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        String processId = fields.text(".//ns:Refs/ns:PrcId/ns:Id");
        String creationDateTime = fields.text(".//ns:Refs/ns:MsgId/ns:CreDtTm");
        String accountId = fields.text(".//ns:Acct/ns:Id/ns:IBAN | .//ns:Acct/ns:Id/ns:Othr/ns:Id");
        String accountCurrency = fields.text(".//ns:Acct/ns:Ccy");
        String accountServicer = fields.text(
            ".//ns:AcctSvcrId/ns:FinInstnId/ns:BICFI | .//ns:AcctSvcrId/ns:FinInstnId/ns:BIC");
        String organizationName = fields.text(".//ns:Org/ns:FullLglNm/ns:FullLglNm | .//ns:Org/ns:FullLglNm");
        String branchName = fields.text(".//ns:AcctSvcrId/ns:BrnchId/ns:Nm");

        if (family == MessageFamily.ACMT_015) {
            return base.seed(Acmt015Message.builder())
                .processId(processId)
                .creationDateTime(creationDateTime)
                .accountId(accountId)
                .accountCurrency(accountCurrency)
                .accountServicer(accountServicer)
                .organizationName(organizationName)
                .branchName(branchName)
                .build();
        }
        return base.seed(Acmt007Message.builder())
            .processId(processId)
            .creationDateTime(creationDateTime)
            .accountId(accountId)
            .accountCurrency(accountCurrency)
            .accountServicer(accountServicer)
            .organizationName(organizationName)
            .branchName(branchName)
            .build();
    }
}
