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
 * FI to FI payment cancellation request (camt.056), also known as a recall.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Camt056Message extends PaymentMessage implements ReferencesOriginalMessage, InvestigationCase {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "assignment_id", "case_id", "original_message_id", "original_message_name_id", "recall_reason", "underlying_transactions");

    private String creationDateTime;

    private String assignmentId;

    private String caseId;

    private String originalMessageId;

    private String originalMessageNameId;

    private String recallReason;

    @Builder.Default
    private List<Map<String, String>> underlyingTransactions = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.CAMT_056;
    }
}
