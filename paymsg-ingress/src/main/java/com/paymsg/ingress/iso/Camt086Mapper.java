package com.paymsg.ingress.iso;

import com.paymsg.canonical.Camt086Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;

/**
 * Mapper for ISO 20022 camt.086 (Bank Services Billing Statement).
 */
public class Camt086Mapper implements FamilyMapper {

    private static final String STATEMENT = ".//ns:BllgStmtGrp/ns:BllgStmt";

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        return base.seed(Camt086Message.builder())
            .reportId(fields.text(".//ns:RptHdr/ns:RptId"))
            .groupId(fields.text(".//ns:BllgStmtGrp/ns:GrpId"))
            .statementId(fields.text(STATEMENT + "/ns:StmtId"))
            .creationDateTime(fields.text(STATEMENT + "/ns:CreDtTm"))
            .statementStatus(fields.text(STATEMENT + "/ns:Sts"))
            .build();
    }
}
