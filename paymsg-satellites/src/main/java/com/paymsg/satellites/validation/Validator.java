package com.paymsg.satellites.validation;

import com.paymsg.canonical.HasPaymentInformation;
import com.paymsg.canonical.HasTransactions;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.ValidationReport;
import com.paymsg.canonical.enums.WireFormat;
import com.paymsg.ingress.common.XmlDocuments;
import com.paymsg.ingress.swift.MtBlockScanner;
import com.paymsg.ingress.swift.MtField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.dom.DOMSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pre-flight checks for raw messages and parsed records.
 *
 * <p>{@link #validateSchema(byte[])} checks the wire structure: Block layout
 * and mandatory fields for SWIFT MT, XSD conformance for ISO 20022 XML.
 * {@link #validate(PaymentMessage)} checks field contents of a record: BICs,
 * UETR, currency and IBAN check digits, including those nested in
 * transactions and payment information entries.</p>
 *
 * Problems are reported, never thrown; every check runs so the report lists
 * all errors found.
 */
public class Validator {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private static final Pattern BIC = Pattern.compile("^[A-Z]{4}[A-Z]{2}[A-Z0-9]{2}([A-Z0-9]{3})?$");
    private static final Pattern UETR_V4 = Pattern.compile(
        "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-4[0-9a-fA-F]{3}-[89abAB][0-9a-fA-F]{3}-[0-9a-fA-F]{12}$");
    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");
    private static final Pattern IBAN = Pattern.compile("^[A-Z]{2}[0-9]{2}[A-Z0-9]{11,30}$");
    private static final Pattern NOT_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");
    private static final BigInteger NINETY_SEVEN = BigInteger.valueOf(97);

    private static final Pattern BLOCK1 = Pattern.compile("\\{1:[A-Z]\\d{2}([^{}]{12})\\d{10}\\}");
    private static final Pattern BLOCK2_INPUT = Pattern.compile("\\{2:I(\\d{3})([^{}]{12})([A-Z](\\d{1,3})?)?\\}");
    private static final Pattern BLOCK2_OUTPUT = Pattern.compile("\\{2:O(\\d{3})\\d{10}([^{}]{12})[^{}]*\\}");
    private static final Pattern FIELD_32A = Pattern.compile("^(\\d{6})(.{3})(.*)$", Pattern.DOTALL);
    private static final Pattern MT_AMOUNT = Pattern.compile("^\\d+(,\\d*)?$");
    private static final DateTimeFormatter YYMMDD = DateTimeFormatter.ofPattern("uuMMdd").withResolverStyle(ResolverStyle.STRICT);
    private static final String BLOCK4_START = "{4:";
    private static final String BLOCK4_END = "-}";

    private final SchemaRegistry registry;

    public Validator() {
        this(SchemaRegistry.getInstance());
    }

    public Validator(SchemaRegistry registry) {
        this.registry = registry;
    }

    /**
     * Structural check of a raw message.
     */
    public ValidationReport validateSchema(byte[] raw) {
        WireFormat format = WireFormat.detect(raw);
        log.debug("Structural validation of {} message", format);
        switch (format) {
            case MT:
                return ValidationReport.of(mtStructureErrors(new String(raw, StandardCharsets.UTF_8)));
            case XML:
                return validateXml(raw);
            default:
                return ValidationReport.invalid("Unrecognized message format: expected SWIFT MT blocks or ISO 20022 XML");
        }
    }

    /**
     * Content check of a parsed record.
     */
    public ValidationReport validate(PaymentMessage message) {
        List<String> errors = new ArrayList<>();
        if (message == null) {
            errors.add("Message cannot be null");
            return ValidationReport.of(errors);
        }

        addIfPresent(errors, "[Sender] ", bicError(message.getSenderBic()));
        addIfPresent(errors, "[Receiver] ", bicError(message.getReceiverBic()));
        addIfPresent(errors, "[UETR] ", uetrError(message.getUetr()));
        addIfPresent(errors, "[Currency] ", currencyError(message.getCurrency()));
        addIfPresent(errors, "[Debtor Account] ", ibanError(message.getDebtorAccount()));
        addIfPresent(errors, "[Creditor Account] ", ibanError(message.getCreditorAccount()));

        if (message instanceof HasTransactions) {
            validateAccounts(errors, "Transaction", ((HasTransactions) message).getTransactions());
        }
        if (message instanceof HasPaymentInformation) {
            validateAccounts(errors, "Payment", ((HasPaymentInformation) message).getPaymentInformation());
        }

        if (!errors.isEmpty()) {
            log.debug("Record {} failed validation with {} error(s)", message.getMessageId(), errors.size());
        }
        return ValidationReport.of(errors);
    }

    private static void validateAccounts(List<String> errors, String label, List<Map<String, String>> rows) {
        if (rows == null) {
            return;
        }
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            if (row == null) {
                continue;
            }
            addIfPresent(errors, "[" + label + " " + i + " Debtor Account] ", ibanError(row.get("debtor_account")));
            addIfPresent(errors, "[" + label + " " + i + " Creditor Account] ", ibanError(row.get("creditor_account")));
        }
    }

    private static void addIfPresent(List<String> errors, String prefix, String error) {
        if (error != null) {
            errors.add(prefix + error);
        }
    }

    /**
     * ISO 9362: bank code, country, location and optional branch; 8 or 11 characters.
     */
    static String bicError(String bic) {
        if (bic == null || bic.trim().isEmpty()) {
            return null;
        }
        String clean = bic.trim();
        if (!BIC.matcher(clean).matches()) {
            return "Invalid BIC format: '" + clean + "'. Must match ISO 9362 with 8 or 11 characters.";
        }
        return null;
    }

    static String uetrError(String uetr) {
        if (uetr == null) {
            return null;
        }
        if (!UETR_V4.matcher(uetr.trim()).matches()) {
            return "Invalid UETR format: '" + uetr + "'. Must be a version 4 UUID.";
        }
        return null;
    }

    /**
     * A present but blank currency is an error; an absent one is not.
     */
    static String currencyError(String currency) {
        if (currency == null) {
            return null;
        }
        if (!CURRENCY.matcher(currency.trim()).matches()) {
            return "Invalid currency code: '" + currency + "'. Must be three upper-case letters (ISO 4217).";
        }
        return null;
    }

    /**
     * Modulo-97 check of values shaped like an IBAN once spaces and
     * punctuation are removed. Anything else is treated as a domestic account
     * number and not checked.
     */
    static String ibanError(String account) {
        if (account == null || account.trim().isEmpty()) {
            return null;
        }
        String clean = NOT_ALPHANUMERIC.matcher(account).replaceAll("").toUpperCase(Locale.ROOT);
        if (!IBAN.matcher(clean).matches()) {
            return null;
        }
        String rearranged = clean.substring(4) + clean.substring(0, 4);
        StringBuilder numeric = new StringBuilder();
        for (char c : rearranged.toCharArray()) {
            if (Character.isLetter(c)) {
                numeric.append(c - 'A' + 10);
            } else {
                numeric.append(c);
            }
        }
        if (!new BigInteger(numeric.toString()).mod(NINETY_SEVEN).equals(BigInteger.ONE)) {
            return "Invalid IBAN checksum: '" + clean + "'. Failed Modulo-97 verification.";
        }
        return null;
    }

    private List<String> mtStructureErrors(String text) {
        List<String> errors = new ArrayList<>();

        // Basic header block
        Matcher block1 = BLOCK1.matcher(text);
        if (block1.find()) {
            addIfPresent(errors, "", addressError("Block 1", block1.group(1)));
        } else {
            errors.add("Invalid Block 1 structure: expected {1:F01<12 character address><session><sequence>}");
        }

        // Application header block
        Matcher input = BLOCK2_INPUT.matcher(text);
        Matcher output = BLOCK2_OUTPUT.matcher(text);
        if (input.find()) {
            addIfPresent(errors, "", addressError("Block 2", input.group(2)));
        } else if (output.find()) {
            addIfPresent(errors, "", addressError("Block 2", output.group(2)));
        } else {
            errors.add("Invalid Block 2 structure: expected {2:I<type><12 character address>[priority]}");
        }

        int start = text.indexOf(BLOCK4_START);
        if (start < 0) {
            errors.add("Missing Block 4 (text block)");
            return errors;
        }
        if (!text.substring(start).contains(BLOCK4_END)) {
            errors.add("Invalid Block 4 structure: text block must end with '-}'");
        }

        List<MtField> fields = MtBlockScanner.fields(text);
        Optional<MtField> reference = fields.stream().filter(f -> "20".equals(f.getTag())).findFirst();
        if (reference.isEmpty() || reference.get().getValue().trim().isEmpty()) {
            errors.add("Mandatory Field :20: (Sender's Reference) missing");
        }
        fields.stream()
            .filter(f -> "32A".equals(f.getTag()))
            .findFirst()
            .ifPresent(f -> errors.addAll(field32aErrors(f.getValue())));
        return errors;
    }

    /**
     * Logical terminal address to BIC: the ninth character is the terminal
     * code and is dropped.
     */
    private static String addressError(String block, String address) {
        String bic = address.substring(0, 8) + address.substring(9);
        if (!BIC.matcher(bic).matches()) {
            return "Invalid BIC format in " + block + ": '" + address + "'";
        }
        return null;
    }

    private static List<String> field32aErrors(String value) {
        List<String> errors = new ArrayList<>();
        String clean = value.trim();
        Matcher matcher = FIELD_32A.matcher(clean);
        if (!matcher.matches()) {
            errors.add("Invalid Field 32A structure: '" + clean + "'. Expected date, currency and amount");
            return errors;
        }
        try {
            LocalDate.parse(matcher.group(1), YYMMDD);
        } catch (DateTimeParseException e) {
            errors.add("Invalid date in Field 32A: '" + matcher.group(1) + "'");
        }
        if (!CURRENCY.matcher(matcher.group(2)).matches()) {
            errors.add("Invalid currency in Field 32A: '" + matcher.group(2) + "'");
        }
        if (!MT_AMOUNT.matcher(matcher.group(3).trim()).matches()) {
            errors.add("Invalid amount format in Field 32A: '" + matcher.group(3).trim() + "'");
        }
        return errors;
    }

    private ValidationReport validateXml(byte[] raw) {
        Document document;
        try {
            document = XmlDocuments.parse(raw);
        } catch (XmlDocuments.XmlParseException e) {
            return ValidationReport.invalid(e.getMessage());
        }

        Element root = document.getDocumentElement();
        Element payload = "Document".equals(XmlDocuments.localName(root))
            ? root
            : XmlDocuments.findFirst(root, "Document");
        if (payload == null) {
            payload = root;
        }
        String namespace = XmlDocuments.namespaceOf(payload);
        Optional<Path> schemaFile = registry.lookup(namespace);
        if (schemaFile.isEmpty()) {
            return ValidationReport.invalid("Unsupported namespace: '" + namespace + "' has no registered schema");
        }

        List<String> errors = new ArrayList<>();
        try {
            SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "file");
            Schema schema = factory.newSchema(schemaFile.get().toFile());
            javax.xml.validation.Validator validator = schema.newValidator();
            validator.setErrorHandler(new CollectingErrorHandler(errors));
            validator.validate(new DOMSource(payload));
        } catch (SAXException e) {
            log.warn("Schema {} could not be applied: {}", schemaFile.get(), e.getMessage());
            if (errors.isEmpty()) {
                errors.add(e.getMessage());
            }
        } catch (IOException e) {
            log.warn("Failed to read schema {}", schemaFile.get(), e);
            errors.add("Failed to read schema for namespace '" + namespace + "': " + e.getMessage());
        }
        return ValidationReport.of(errors);
    }

    /**
     * Collects every error reported by the schema engine instead of stopping
     * at the first one.
     */
    private static class CollectingErrorHandler implements ErrorHandler {

        private final List<String> errors;

        CollectingErrorHandler(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public void warning(SAXParseException exception) {
            log.debug("Schema validation warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) {
            errors.add(exception.getMessage());
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            errors.add(exception.getMessage());
            throw exception;
        }
    }
}
