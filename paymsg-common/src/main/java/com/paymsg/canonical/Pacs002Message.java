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
 * FI to FI payment status report (pacs.002).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Pacs002Message extends PaymentMessage implements ReferencesOriginalMessage {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "original_message_id", "original_message_name_id", "group_status", "transactions_status");

    private String creationDateTime;

    private String originalMessageId;

    private String originalMessageNameId;

    /**
     * Group status code (GrpSts), e.g. ACSP or RJCT.
     */
    private String groupStatus;

    /**
     * One map per TxInfAndSts block.
     */
    @Builder.Default
    private List<Map<String, String>> transactionsStatus = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.PACS_002;
    }
}
