package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Set;

/**
 * Account opening request (acmt.007).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Acmt007Message extends PaymentMessage {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "process_id", "account_id", "account_currency", "account_servicer", "organization_name", "branch_name");

    private String creationDateTime;

    private String processId;

    private String accountId;

    private String accountCurrency;

    private String accountServicer;

    private String organizationName;

    private String branchName;

    @Override
    public MessageFamily family() {
        return MessageFamily.ACMT_007;
    }
}
