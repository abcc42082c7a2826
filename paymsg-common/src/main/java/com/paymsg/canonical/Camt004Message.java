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
 * Return account (camt.004), the answer to a get-account query.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Camt004Message extends PaymentMessage implements HasBalances {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "original_business_query", "account_id", "account_owner", "account_servicer", "account_status", "account_currency", "balances", "limits", "number_of_payments", "business_errors");

    private String creationDateTime;

    /**
     * Message id of the query being answered.
     */
    private String originalBusinessQuery;

    private String accountId;

    private String accountOwner;

    private String accountServicer;

    private String accountStatus;

    private String accountCurrency;

    @Builder.Default
    private List<Map<String, String>> balances = new ArrayList<>();

    @Builder.Default
    private List<Map<String, String>> limits = new ArrayList<>();

    private Integer numberOfPayments;

    /**
     * Operational errors reported instead of the account report.
     */
    @Builder.Default
    private List<Map<String, String>> businessErrors = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.CAMT_004;
    }
}
