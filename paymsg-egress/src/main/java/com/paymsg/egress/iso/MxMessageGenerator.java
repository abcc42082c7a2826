package com.paymsg.egress.iso;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.PostalAddress;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.egress.UetrGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Base class for ISO 20022 XML generators.
 *
 * Subclasses write the business document below the {@code Document} root; the
 * namespace of each target comes from {@link TranscoderSettings#namespaceFor(String)}.
 */
public abstract class MxMessageGenerator {

    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ISO_INSTANT;
    private static final Pattern IBAN = Pattern.compile("^[A-Z]{2}\\d{2}[A-Z0-9]{11,30}$");

    protected final TranscoderSettings settings;
    protected final Clock clock;
    private final String key;

    protected MxMessageGenerator(TranscoderSettings settings, Clock clock, String key) {
        this.settings = settings;
        this.clock = clock;
        this.key = key;
    }

    /**
     * Family key of the produced document ("pacs.008").
     */
    public String key() {
        return key;
    }

    public String generate(PaymentMessage record, UetrGenerator uetrs) {
        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<Document xmlns=\"").append(escapeXml(settings.namespaceFor(key))).append("\">\n");
        appendDocument(xml, record, uetrs);
        xml.append("</Document>");
        return xml.toString();
    }

    /**
     * Appends the message element and everything below it, indented by two spaces.
     */
    protected abstract void appendDocument(StringBuilder xml, PaymentMessage record, UetrGenerator uetrs);

    protected String creationDateTime() {
        return DATE_TIME_FORMATTER.format(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS));
    }

    protected String name(String value) {
        return isBlank(value) ? settings.getMxNameSentinel() : value.trim();
    }

    protected String bic(String value) {
        return isBlank(value) ? settings.getMxNameSentinel() : value.trim();
    }

    protected String reference(String value) {
        return isBlank(value) ? settings.getDefaultReference() : value.trim();
    }

    protected String currency(String value) {
        return isBlank(value) ? settings.getDefaultCurrency() : value.trim();
    }

    protected static String amount(String value) {
        return isBlank(value) ? "0.00" : value.trim();
    }

    protected String uetr(PaymentMessage record, UetrGenerator uetrs) {
        return isBlank(record.getUetr()) ? uetrs.next() : record.getUetr().trim();
    }

    /**
     * Account element: IBAN when the identifier has IBAN shape, else a
     * proprietary {@code Othr/Id}.
     */
    protected static void account(StringBuilder xml, String indent, String element, String account) {
        if (isBlank(account)) {
            return;
        }
        xml.append(indent).append("<").append(element).append(">\n");
        accountId(xml, indent + "  ", account);
        xml.append(indent).append("</").append(element).append(">\n");
    }

    protected static void accountId(StringBuilder xml, String indent, String account) {
        String id = account.trim();
        xml.append(indent).append("<Id>\n");
        if (IBAN.matcher(id).matches()) {
            xml.append(indent).append("  <IBAN>").append(escapeXml(id)).append("</IBAN>\n");
        } else {
            xml.append(indent).append("  <Othr>\n");
            xml.append(indent).append("    <Id>").append(escapeXml(id)).append("</Id>\n");
            xml.append(indent).append("  </Othr>\n");
        }
        xml.append(indent).append("</Id>\n");
    }

    protected void agent(StringBuilder xml, String indent, String element, String bic) {
        agent(xml, indent, element, bic, null);
    }

    /**
     * Financial institution element with an optional postal address below
     * {@code FinInstnId}.
     */
    protected void agent(StringBuilder xml, String indent, String element, String bic, PostalAddress address) {
        xml.append(indent).append("<").append(element).append(">\n");
        xml.append(indent).append("  <FinInstnId>\n");
        xml.append(indent).append("    <BICFI>").append(escapeXml(bic(bic))).append("</BICFI>\n");
        postalAddress(xml, indent + "    ", address);
        xml.append(indent).append("  </FinInstnId>\n");
        xml.append(indent).append("</").append(element).append(">\n");
    }

    /**
     * Customer party with its name and, when known, postal address.
     */
    protected void party(StringBuilder xml, String indent, String element, String name, PostalAddress address) {
        xml.append(indent).append("<").append(element).append(">\n");
        xml.append(indent).append("  <Nm>").append(escapeXml(name(name))).append("</Nm>\n");
        postalAddress(xml, indent + "  ", address);
        xml.append(indent).append("</").append(element).append(">\n");
    }

    /**
     * PstlAdr element, components in schema order. Nothing is written for a
     * null or empty address.
     */
    protected static void postalAddress(StringBuilder xml, String indent, PostalAddress address) {
        if (address == null) {
            return;
        }
        List<String> lines = new ArrayList<>();
        if (address.getAddressLines() != null) {
            for (String line : address.getAddressLines()) {
                if (!isBlank(line)) {
                    lines.add(line.trim());
                }
            }
        }
        boolean structured = !isBlank(address.getStreetName()) || !isBlank(address.getBuildingNumber())
            || !isBlank(address.getPostCode()) || !isBlank(address.getTownName()) || !isBlank(address.getCountry());
        if (!structured && lines.isEmpty()) {
            return;
        }
        xml.append(indent).append("<PstlAdr>\n");
        addressLine(xml, indent, "StrtNm", address.getStreetName());
        addressLine(xml, indent, "BldgNb", address.getBuildingNumber());
        addressLine(xml, indent, "PstCd", address.getPostCode());
        addressLine(xml, indent, "TwnNm", address.getTownName());
        addressLine(xml, indent, "Ctry", address.getCountry());
        for (String line : lines) {
            addressLine(xml, indent, "AdrLine", line);
        }
        xml.append(indent).append("</PstlAdr>\n");
    }

    private static void addressLine(StringBuilder xml, String indent, String element, String value) {
        if (isBlank(value)) {
            return;
        }
        xml.append(indent).append("  <").append(element).append(">").append(escapeXml(value.trim()))
            .append("</").append(element).append(">\n");
    }

    /**
     * Escape XML special characters.
     */
    protected static String escapeXml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                   .replace("<", "&lt;")
                   .replace(">", "&gt;")
                   .replace("\"", "&quot;")
                   .replace("'", "&apos;");
    }

    protected static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
