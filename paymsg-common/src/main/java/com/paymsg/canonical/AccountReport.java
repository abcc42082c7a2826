package com.paymsg.canonical;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Common shape of the cash-management reports (camt.052, camt.053, camt.054):
 * one reported account, its entries and the entry totals.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract class AccountReport extends PaymentMessage implements HasEntries {

    protected static final Set<String> ACCOUNT_FIELDS = fieldsWith(
        "creation_date_time", "account_id", "account_currency", "account_owner", "account_servicer", "total_credit_entries", "total_credit_amount", "total_debit_entries", "total_debit_amount", "entries");

    private String creationDateTime;

    /**
     * Account identifier (IBAN or proprietary id).
     */
    private String accountId;

    private String accountCurrency;

    private String accountOwner;

    /**
     * BIC of the servicing institution.
     */
    private String accountServicer;

    private Integer totalCreditEntries;

    private String totalCreditAmount;

    private Integer totalDebitEntries;

    private String totalDebitAmount;

    /**
     * One map per Ntry or MT :61: statement line.
     */
    @Builder.Default
    private List<Map<String, String>> entries = new ArrayList<>();

    protected static Set<String> reportFieldsWith(String... names) {
        Set<String> fields = new LinkedHashSet<>(ACCOUNT_FIELDS);
        Collections.addAll(fields, names);
        return Collections.unmodifiableSet(fields);
    }
}
