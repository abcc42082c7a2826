package com.paymsg.ingress.iso;

import com.paymsg.canonical.Pacs002Message;
import com.paymsg.canonical.Pain002Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for the payment status reports: pacs.002 (FI to FI) and pain.002
 * (customer). Both report a group status and one status per original
 * transaction (TxInfAndSts).
 */
public class StatusReportMapper implements FamilyMapper {

    private static final String ORIGINAL_GROUP = ".//ns:OrgnlGrpInfAndSts";

    private final MessageFamily family;

    public StatusReportMapper(MessageFamily family) {
        this.family = family;
    }

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        String creationDateTime = fields.text(IsoFields.CREATION_DATE_TIME);
        String originalMessageId = fields.text(ORIGINAL_GROUP + "/ns:OrgnlMsgId");
        String originalMessageNameId = fields.text(ORIGINAL_GROUP + "/ns:OrgnlMsgNmId");
        String groupStatus = fields.text(ORIGINAL_GROUP + "/ns:GrpSts");
        List<Map<String, String>> statuses = extractStatuses(fields);

        if (family == MessageFamily.PAIN_002) {
            return base.seed(Pain002Message.builder())
                .creationDateTime(creationDateTime)
                .initiatingParty(fields.text(".//ns:GrpHdr/ns:InitgPty/ns:Nm"))
                .originalMessageId(originalMessageId)
                .originalMessageNameId(originalMessageNameId)
                .groupStatus(groupStatus)
                .transactionsStatus(statuses)
                .build();
        }
        return base.seed(Pacs002Message.builder())
            .creationDateTime(creationDateTime)
            .originalMessageId(originalMessageId)
            .originalMessageNameId(originalMessageNameId)
            .groupStatus(groupStatus)
            .transactionsStatus(statuses)
            .build();
    }

    private static List<Map<String, String>> extractStatuses(FieldExtractor fields) {
        List<Map<String, String>> statuses = new ArrayList<>();
        for (Element tx : fields.nodes(".//ns:TxInfAndSts")) {
            statuses.add(row(
                "original_instruction_id", fields.text(tx, "ns:OrgnlInstrId"),
                "original_end_to_end_id", fields.text(tx, "ns:OrgnlEndToEndId"),
                "original_uetr", fields.text(tx, "ns:OrgnlUETR"),
                "status", fields.text(tx, "ns:TxSts"),
                "reason_code", fields.text(tx, "ns:StsRsnInf/ns:Rsn/ns:Cd | ns:StsRsnInf/ns:Rsn/ns:Prtry"),
                "additional_info", fields.text(tx, "ns:StsRsnInf/ns:AddtlInf")));
        }
        return statuses;
    }
}
