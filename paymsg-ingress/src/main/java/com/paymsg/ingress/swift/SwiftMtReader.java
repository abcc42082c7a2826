package com.paymsg.ingress.swift;

import com.paymsg.canonical.Camt052Message;
import com.paymsg.canonical.Camt053Message;
import com.paymsg.canonical.Pacs008Message;
import com.paymsg.canonical.Pain001Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.PostalAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads SWIFT MT block text into typed records.
 *
 * <ul>
 *   <li>MT101 becomes a {@link Pain001Message} with one payment-information
 *       entry per transaction sequence (field 21).</li>
 *   <li>MT940 and MT950 become a {@link Camt053Message}, MT942 a
 *       {@link Camt052Message}; each field 61 opens an entry and a directly
 *       following field 86 is its remittance text.</li>
 *   <li>Every other type is read as a generic credit transfer
 *       ({@link Pacs008Message}).</li>
 * </ul>
 *
 * Input is decoded as UTF-8 with replacement, so reading never fails on
 * bytes; fields that do not follow their layout are left null.
 */
public class SwiftMtReader {

    private static final Logger log = LoggerFactory.getLogger(SwiftMtReader.class);

    private static final String[] ORDERING_CUSTOMER_TAGS = {"50K", "50F", "50A", "50H", "50C", "50L"};
    private static final String[] BENEFICIARY_TAGS = {"59", "59A", "59F"};
    private static final Map<String, String> BALANCE_TYPES = new LinkedHashMap<>();

    static {
        BALANCE_TYPES.put("60F", "OPBD");
        BALANCE_TYPES.put("60M", "ITBD");
        BALANCE_TYPES.put("62F", "CLBD");
        BALANCE_TYPES.put("62M", "ITBD");
        BALANCE_TYPES.put("64", "CLAV");
        BALANCE_TYPES.put("65", "FWAV");
    }

    private final String text;
    private final List<MtField> fields;
    private final String messageType;

    public SwiftMtReader(byte[] raw) {
        this.text = raw == null ? "" : new String(raw, StandardCharsets.UTF_8);
        this.fields = MtBlockScanner.fields(text);
        this.messageType = MtBlockScanner.messageType(text).orElse(null);
    }

    public String getMessageType() {
        return messageType;
    }

    /**
     * Reads the record for the message type found in Block 2.
     */
    public PaymentMessage read() {
        PaymentMessage header = PaymentMessage.builder()
            .messageId(first("20"))
            .uetr(MtBlockScanner.uetr(text))
            .senderBic(MtBlockScanner.senderAddress(text))
            .receiverBic(MtBlockScanner.receiverAddress(text))
            .build();

        log.debug("Reading MT{} with {} Block 4 fields", messageType, fields.size());
        if ("101".equals(messageType)) {
            return readRequestForTransfer(header);
        }
        if ("940".equals(messageType) || "950".equals(messageType)) {
            return readStatement(header);
        }
        if ("942".equals(messageType)) {
            return readInterimReport(header);
        }
        return readCreditTransfer(header);
    }

    private PaymentMessage readCreditTransfer(PaymentMessage header) {
        String[] valueDateAmount = MtValues.dateCurrencyAmount(first("32A"));
        String currency = null;
        String amount = null;
        if (valueDateAmount != null) {
            currency = valueDateAmount[1];
            amount = valueDateAmount[2];
        } else {
            String[] currencyAmount = MtValues.currencyAmount(firstOf("32B", "33B"));
            if (currencyAmount != null) {
                currency = currencyAmount[0];
                amount = currencyAmount[1];
            }
        }

        Party debtor = Party.parse(firstOf(ORDERING_CUSTOMER_TAGS));
        Party creditor = Party.parse(firstOf(BENEFICIARY_TAGS));
        String relatedReference = first("21");

        Map<String, String> transaction = new LinkedHashMap<>();
        transaction.put("end_to_end_id", relatedReference);
        transaction.put("instruction_id", header.getMessageId());
        transaction.put("uetr", header.getUetr());
        transaction.put("amount", amount);
        transaction.put("currency", currency);
        transaction.put("debtor_name", debtor.name);
        transaction.put("debtor_account", debtor.account);
        transaction.put("debtor_agent", Party.parse(first("52A")).firstLine());
        transaction.put("creditor_name", creditor.name);
        transaction.put("creditor_account", creditor.account);
        transaction.put("creditor_agent", Party.parse(firstOf("57A", "58A")).firstLine());
        transaction.put("remittance_information", first("70"));

        List<Map<String, String>> transactions = new ArrayList<>();
        if (!fields.isEmpty()) {
            transactions.add(transaction);
        }

        return header.seed(Pacs008Message.builder())
            .endToEndId(relatedReference)
            .amount(amount)
            .currency(currency)
            .debtorName(debtor.name)
            .debtorAccount(debtor.account)
            .debtorAddress(debtor.address())
            .creditorName(creditor.name)
            .creditorAccount(creditor.account)
            .creditorAddress(creditor.address())
            .settlementAmount(amount)
            .settlementCurrency(currency)
            .numberOfTransactions(transactions.isEmpty() ? null : 1)
            .transactions(transactions)
            .build();
    }

    private PaymentMessage readRequestForTransfer(PaymentMessage header) {
        Party instructingParty = Party.parse(firstOf(ORDERING_CUSTOMER_TAGS));
        String executionDate = MtValues.isoDate(first("30"));

        List<Map<String, String>> paymentInformation = new ArrayList<>();
        Map<String, String> current = null;
        for (MtField field : fields) {
            String tag = field.getTag();
            if ("21".equals(tag)) {
                current = new LinkedHashMap<>();
                current.put("payment_information_id", header.getMessageId());
                current.put("requested_execution_date", executionDate);
                current.put("end_to_end_id", field.getValue());
                current.put("amount", null);
                current.put("currency", null);
                current.put("debtor_name", instructingParty.name);
                current.put("debtor_account", instructingParty.account);
                current.put("creditor_name", null);
                current.put("creditor_account", null);
                current.put("creditor_agent", null);
                current.put("remittance_information", null);
                paymentInformation.add(current);
            } else if (current != null) {
                if ("32B".equals(tag)) {
                    String[] currencyAmount = MtValues.currencyAmount(field.getValue());
                    if (currencyAmount != null) {
                        current.put("currency", currencyAmount[0]);
                        current.put("amount", currencyAmount[1]);
                    }
                } else if (Arrays.asList(BENEFICIARY_TAGS).contains(tag)) {
                    Party creditor = Party.parse(field.getValue());
                    current.put("creditor_name", creditor.name);
                    current.put("creditor_account", creditor.account);
                } else if ("57A".equals(tag)) {
                    current.put("creditor_agent", Party.parse(field.getValue()).firstLine());
                } else if ("70".equals(tag)) {
                    current.put("remittance_information", field.getValue());
                }
            }
        }

        Map<String, String> firstTransaction = paymentInformation.isEmpty() ? new LinkedHashMap<>() : paymentInformation.get(0);
        return header.seed(Pain001Message.builder())
            .endToEndId(firstTransaction.get("end_to_end_id"))
            .amount(firstTransaction.get("amount"))
            .currency(firstTransaction.get("currency"))
            .debtorName(instructingParty.name)
            .debtorAccount(instructingParty.account)
            .debtorAddress(instructingParty.address())
            .creditorName(firstTransaction.get("creditor_name"))
            .creditorAccount(firstTransaction.get("creditor_account"))
            .initiatingParty(instructingParty.name)
            .numberOfTransactions(paymentInformation.size())
            .paymentInformation(paymentInformation)
            .build();
    }

    private PaymentMessage readStatement(PaymentMessage header) {
        String[] opening = MtValues.balance(firstOf("60F", "60M"));
        String currency = opening != null ? opening[2] : null;
        boolean withRemittance = "940".equals(messageType);

        return header.seed(Camt053Message.builder())
            .amount(opening != null ? opening[3] : null)
            .currency(currency)
            .statementId(orElse(first("28C"), header.getMessageId()))
            .accountId(first("25"))
            .accountCurrency(currency)
            .balances(balances())
            .entries(entries(currency, withRemittance))
            .build();
    }

    private PaymentMessage readInterimReport(PaymentMessage header) {
        String[] floorLimit = MtValues.floorLimit(first("34F"));
        String currency = floorLimit != null ? floorLimit[0] : null;
        String[] debits = MtValues.countCurrencyAmount(first("90D"));
        String[] credits = MtValues.countCurrencyAmount(first("90C"));

        return header.seed(Camt052Message.builder())
            .amount(floorLimit != null ? floorLimit[1] : null)
            .currency(currency)
            .reportId(orElse(first("28C"), header.getMessageId()))
            .creationDateTime(first("13D"))
            .accountId(first("25"))
            .accountCurrency(currency)
            .totalDebitEntries(debits != null ? count(debits[0]) : null)
            .totalDebitAmount(debits != null ? debits[2] : null)
            .totalCreditEntries(credits != null ? count(credits[0]) : null)
            .totalCreditAmount(credits != null ? credits[2] : null)
            .balances(balances())
            .entries(entries(currency, true))
            .build();
    }

    private List<Map<String, String>> balances() {
        List<Map<String, String>> balances = new ArrayList<>();
        for (MtField field : fields) {
            String type = BALANCE_TYPES.get(field.getTag());
            String[] balance = type != null ? MtValues.balance(field.getValue()) : null;
            if (balance != null) {
                Map<String, String> row = new LinkedHashMap<>();
                row.put("type", type);
                row.put("amount", balance[3]);
                row.put("currency", balance[2]);
                row.put("credit_debit_indicator", balance[0]);
                row.put("date", balance[1]);
                balances.add(row);
            }
        }
        return balances;
    }

    /**
     * Statement lines in order; a field 86 right after a field 61 belongs to
     * that entry and to no other.
     */
    private List<Map<String, String>> entries(String currency, boolean withRemittance) {
        List<Map<String, String>> entries = new ArrayList<>();
        Map<String, String> open = null;
        for (MtField field : fields) {
            if ("61".equals(field.getTag())) {
                open = StatementLineParser.parse(field.getValue(), currency);
                if (open != null) {
                    entries.add(open);
                } else {
                    log.warn("Skipping statement line that does not follow the field 61 layout: {}", field.getValue());
                }
            } else if ("86".equals(field.getTag())) {
                if (open != null && withRemittance) {
                    open.put("remittance", field.getValue());
                }
                open = null;
            } else {
                open = null;
            }
        }
        return entries;
    }

    private String first(String tag) {
        for (MtField field : fields) {
            if (field.getTag().equals(tag)) {
                return field.getValue().isEmpty() ? null : field.getValue();
            }
        }
        return null;
    }

    private String firstOf(String... tags) {
        for (String tag : tags) {
            String value = first(tag);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Integer count(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            log.warn("Entry count out of range: {}", digits);
            return null;
        }
    }

    private static String orElse(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }

    /**
     * Party field (50a, 59a, 52A, 57A, 58A): an optional "/account" first
     * line, then name and address lines.
     */
    private static final class Party {
        private String account;
        private String name;
        private final List<String> lines = new ArrayList<>();

        static Party parse(String value) {
            Party party = new Party();
            if (value == null) {
                return party;
            }
            for (String rawLine : value.split("\n")) {
                String line = rawLine.trim();
                if (line.isEmpty()) {
                    continue;
                }
                if (party.account == null && party.name == null && party.lines.isEmpty() && line.startsWith("/")) {
                    party.account = line.substring(1).trim();
                } else if (party.name == null) {
                    party.name = line;
                } else {
                    party.lines.add(line);
                }
            }
            return party;
        }

        String firstLine() {
            return name;
        }

        PostalAddress address() {
            return PostalAddress.ofNullable(null, null, null, null, null, lines);
        }
    }
}
