package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payment return (pacs.004).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Pacs004Message extends PaymentMessage implements HasTransactions, ReferencesOriginalMessage {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "original_message_id", "original_message_name_id", "transactions");

    private String creationDateTime;

    /**
     * Message id of the returned payment (OrgnlGrpInf/OrgnlMsgId).
     */
    private String originalMessageId;

    private String originalMessageNameId;

    /**
     * One map per returned transaction (TxInf).
     */
    @Builder.Default
    private List<Map<String, String>> transactions = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.PACS_004;
    }
}
