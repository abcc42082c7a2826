package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Set;

/**
 * Bank services billing statement (camt.086).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Camt086Message extends PaymentMessage {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "report_id", "group_id", "statement_id", "statement_status");

    private String creationDateTime;

    private String reportId;

    private String groupId;

    private String statementId;

    private String statementStatus;

    @Override
    public MessageFamily family() {
        return MessageFamily.CAMT_086;
    }
}
