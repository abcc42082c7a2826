package com.paymsg.ingress.iso;

import com.paymsg.ingress.common.FieldExtractor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.w3c.dom.Element;

/**
 * Routing data from an ISO 20022 Business Application Header (AppHdr).
 *
 * Used as a fallback for sender, receiver and message id when the wrapped
 * business document does not carry them itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessHeader {

    private static final String FROM_BIC =
        "ns:Fr/ns:FIId/ns:FinInstnId/ns:BICFI | ns:Fr/ns:FIId/ns:FinInstnId/ns:BIC | ns:Fr/ns:OrgId/ns:Id/ns:OrgId/ns:AnyBIC";
    private static final String TO_BIC =
        "ns:To/ns:FIId/ns:FinInstnId/ns:BICFI | ns:To/ns:FIId/ns:FinInstnId/ns:BIC | ns:To/ns:OrgId/ns:Id/ns:OrgId/ns:AnyBIC";

    /**
     * BIC of the sending institution (Fr).
     */
    private String senderBic;

    /**
     * BIC of the receiving institution (To).
     */
    private String receiverBic;

    /**
     * Business message identifier (BizMsgIdr).
     */
    private String businessMessageId;

    /**
     * Message definition identifier (MsgDefIdr), e.g. "pacs.008.001.08".
     */
    private String messageDefinitionId;

    private String creationDate;

    public static BusinessHeader from(Element appHdr) {
        FieldExtractor fields = FieldExtractor.forElement(appHdr);
        return BusinessHeader.builder()
            .senderBic(fields.text(FROM_BIC))
            .receiverBic(fields.text(TO_BIC))
            .businessMessageId(fields.text("ns:BizMsgIdr"))
            .messageDefinitionId(fields.text("ns:MsgDefIdr"))
            .creationDate(fields.text("ns:CreDt"))
            .build();
    }
}
