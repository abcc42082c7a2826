package com.paymsg.egress.swift;

import com.paymsg.canonical.AccountReport;
import com.paymsg.canonical.Camt052Message;
import com.paymsg.canonical.Camt053Message;
import com.paymsg.canonical.Camt054Message;
import com.paymsg.canonical.HasBalances;
import com.paymsg.canonical.HasEntries;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.config.TranscoderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Account statements: MT940 customer statement, MT942 interim transaction
 * report and MT950 statement message.
 *
 * <p>Every entry becomes a {@code :61:} statement line. MT940 and MT942 follow
 * each line with a {@code :86:} carrying the entry's remittance text; MT950 has
 * no information-to-account-owner field.</p>
 */
public class StatementGenerator extends MtMessageGenerator {

    private static final Logger log = LoggerFactory.getLogger(StatementGenerator.class);

    private static final Pattern TRANSACTION_TYPE = Pattern.compile("[A-Z]\\w{3}");
    private static final String DEFAULT_TRANSACTION_TYPE = "NTRF";

    private final String messageType;

    public StatementGenerator(TranscoderSettings settings, Clock clock, String messageType) {
        super(settings, clock);
        if (!"940".equals(messageType) && !"942".equals(messageType) && !"950".equals(messageType)) {
            throw new IllegalArgumentException("Not a statement message type: " + messageType);
        }
        this.messageType = messageType;
    }

    @Override
    public String messageType() {
        return messageType;
    }

    private boolean interim() {
        return "942".equals(messageType);
    }

    private boolean carriesInformation() {
        return !"950".equals(messageType);
    }

    @Override
    protected void appendBody(StringBuilder body, PaymentMessage record) {
        String currency = currency(firstNonBlank(record.getCurrency(), accountCurrency(record)));

        field(body, "20", reference(record.getMessageId()));
        field(body, "25", reference(account(record)));
        field(body, "28C", reference(sequenceNumber(record)));

        if (interim()) {
            field(body, "34F", currency + amount(record.getAmount()));
            field(body, "13D", now());
        } else {
            field(body, "60F", "C" + today() + currency + amount(record.getAmount()));
        }

        List<Map<String, String>> entries = entries(record);
        for (Map<String, String> entry : entries) {
            if (entry == null) {
                continue;
            }
            field(body, "61", statementLine(entry));
            String remittance = entry.get("remittance");
            if (carriesInformation() && !isBlank(remittance)) {
                field(body, "86", singleLine(remittance));
            }
        }

        if (interim()) {
            appendTotals(body, record, entries, currency);
        } else {
            String[] closing = closingBalance(record, currency);
            field(body, "62F", closing[0] + today() + closing[1] + amount(closing[2]));
        }
        log.debug("Rendered MT{} with {} statement line(s)", messageType, entries.size());
    }

    /**
     * Value date, booking date, mark, amount, transaction type and reference of
     * one entry.
     */
    private String statementLine(Map<String, String> entry) {
        String type = entry.get("transaction_type");
        if (type == null || !TRANSACTION_TYPE.matcher(type.trim()).matches()) {
            type = DEFAULT_TRANSACTION_TYPE;
        }
        String valueDate = firstNonBlank(entry.get("value_date"), entry.get("booking_date"));
        String bookingDate = firstNonBlank(entry.get("booking_date"), valueDate);
        return yymmdd(valueDate)
            + mmdd(bookingDate)
            + mark(entry.get("credit_debit_indicator"))
            + amount(entry.get("amount"))
            + type.trim()
            + reference(firstNonBlank(entry.get("reference"), entry.get("end_to_end_id")));
    }

    private void appendTotals(StringBuilder body, PaymentMessage record, List<Map<String, String>> entries, String currency) {
        Integer debitCount = null;
        String debitAmount = null;
        Integer creditCount = null;
        String creditAmount = null;
        if (record instanceof AccountReport) {
            AccountReport report = (AccountReport) record;
            debitCount = report.getTotalDebitEntries();
            debitAmount = report.getTotalDebitAmount();
            creditCount = report.getTotalCreditEntries();
            creditAmount = report.getTotalCreditAmount();
        }
        if (debitCount == null || debitAmount == null || creditCount == null || creditAmount == null) {
            int debits = 0;
            int credits = 0;
            BigDecimal debitSum = BigDecimal.ZERO;
            BigDecimal creditSum = BigDecimal.ZERO;
            for (Map<String, String> entry : entries) {
                if (entry == null) {
                    continue;
                }
                BigDecimal value = decimal(entry.get("amount"));
                if ("CRDT".equals(entry.get("credit_debit_indicator"))) {
                    credits++;
                    creditSum = creditSum.add(value);
                } else {
                    debits++;
                    debitSum = debitSum.add(value);
                }
            }
            debitCount = debitCount != null ? debitCount : debits;
            debitAmount = debitAmount != null ? debitAmount : debitSum.toPlainString();
            creditCount = creditCount != null ? creditCount : credits;
            creditAmount = creditAmount != null ? creditAmount : creditSum.toPlainString();
        }
        field(body, "90D", debitCount + currency + amount(debitAmount));
        field(body, "90C", creditCount + currency + amount(creditAmount));
    }

    /**
     * Mark, currency and amount of the closing booked balance, falling back to
     * the opening amount when the record has none.
     */
    private String[] closingBalance(PaymentMessage record, String currency) {
        if (record instanceof HasBalances && ((HasBalances) record).getBalances() != null) {
            for (Map<String, String> balance : ((HasBalances) record).getBalances()) {
                if (balance != null && "CLBD".equals(balance.get("type")) && !isBlank(balance.get("amount"))) {
                    return new String[] {
                        mark(balance.get("credit_debit_indicator")),
                        currency(firstNonBlank(balance.get("currency"), currency)),
                        balance.get("amount")
                    };
                }
            }
        }
        return new String[] {"C", currency, record.getAmount()};
    }

    private static List<Map<String, String>> entries(PaymentMessage record) {
        if (record instanceof HasEntries && ((HasEntries) record).getEntries() != null) {
            return ((HasEntries) record).getEntries();
        }
        return Collections.emptyList();
    }

    private static String account(PaymentMessage record) {
        if (record instanceof AccountReport && !isBlank(((AccountReport) record).getAccountId())) {
            return ((AccountReport) record).getAccountId();
        }
        return record.getDebtorAccount();
    }

    private static String accountCurrency(PaymentMessage record) {
        return record instanceof AccountReport ? ((AccountReport) record).getAccountCurrency() : null;
    }

    private static String sequenceNumber(PaymentMessage record) {
        String number = null;
        if (record instanceof Camt053Message) {
            number = ((Camt053Message) record).getStatementId();
        } else if (record instanceof Camt052Message) {
            number = ((Camt052Message) record).getReportId();
        } else if (record instanceof Camt054Message) {
            number = ((Camt054Message) record).getNotificationId();
        }
        return isBlank(number) ? "1" : number;
    }

    private static String mark(String creditDebitIndicator) {
        return "DBIT".equals(creditDebitIndicator) ? "D" : "C";
    }

    private static BigDecimal decimal(String amount) {
        if (isBlank(amount)) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            log.warn("Entry amount '{}' is not a decimal, counted as zero", amount);
            return BigDecimal.ZERO;
        }
    }

    private static String firstNonBlank(String first, String second) {
        return isBlank(first) ? second : first;
    }
}
