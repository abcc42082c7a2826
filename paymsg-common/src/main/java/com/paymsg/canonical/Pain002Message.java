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
 * Customer payment status report (pain.002).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Pain002Message extends PaymentMessage implements ReferencesOriginalMessage {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "initiating_party", "original_message_id", "original_message_name_id", "group_status", "transactions_status");

    private String creationDateTime;

    private String initiatingParty;

    private String originalMessageId;

    private String originalMessageNameId;

    private String groupStatus;

    @Builder.Default
    private List<Map<String, String>> transactionsStatus = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.PAIN_002;
    }
}
