package com.paymsg.ingress.iso;

import com.paymsg.canonical.PostalAddress;
import com.paymsg.ingress.common.FieldExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Location expressions and lookups shared by the ISO 20022 mappers.
 */
final class IsoFields {

    private static final Logger log = LoggerFactory.getLogger(IsoFields.class);

    static final String MESSAGE_ID =
        ".//ns:GrpHdr/ns:MsgId | .//ns:MsgHdr/ns:MsgId | .//ns:MsgId/ns:Id | .//ns:Assgnmt/ns:Id";
    static final String END_TO_END_ID =
        ".//ns:PmtId/ns:EndToEndId | .//ns:EndToEndId | .//ns:OrgnlEndToEndId";
    static final String UETR = ".//ns:UETR | .//ns:OrgnlUETR";
    static final String FIRST_AMOUNT = ".//*[@Ccy]";
    static final String SENDER_BIC =
        ".//ns:InstgAgt/ns:FinInstnId/ns:BICFI | .//ns:InstgAgt/ns:FinInstnId/ns:BIC"
            + " | .//ns:DbtrAgt/ns:FinInstnId/ns:BICFI | .//ns:DbtrAgt/ns:FinInstnId/ns:BIC"
            + " | .//ns:Acct/ns:Svcr/ns:FinInstnId/ns:BICFI | .//ns:Acct/ns:Svcr/ns:FinInstnId/ns:BIC";
    static final String RECEIVER_BIC =
        ".//ns:InstdAgt/ns:FinInstnId/ns:BICFI | .//ns:InstdAgt/ns:FinInstnId/ns:BIC"
            + " | .//ns:CdtrAgt/ns:FinInstnId/ns:BICFI | .//ns:CdtrAgt/ns:FinInstnId/ns:BIC"
            + " | .//ns:MsgRcpt//ns:AnyBIC | .//ns:MsgRcpt//ns:BICFI";
    static final String CREATION_DATE_TIME = ".//ns:GrpHdr/ns:CreDtTm";

    private IsoFields() {
    }

    /**
     * BIC of an agent element ({@code DbtrAgt}, {@code CdtrAgt}, ...) below {@code node}.
     */
    static String agentBic(FieldExtractor fields, Node node, String agent) {
        return fields.text(node, "ns:" + agent + "/ns:FinInstnId/ns:BICFI | ns:" + agent + "/ns:FinInstnId/ns:BIC");
    }

    /**
     * Account identifier below {@code node}: IBAN first, then a proprietary id.
     */
    static String account(FieldExtractor fields, Node node, String account) {
        return fields.text(node, "ns:" + account + "/ns:Id/ns:IBAN | ns:" + account + "/ns:Id/ns:Othr/ns:Id");
    }

    static String partyName(FieldExtractor fields, Node node, String party) {
        return fields.text(node, "ns:" + party + "/ns:Nm | ns:" + party + "/ns:Pty/ns:Nm");
    }

    /**
     * Postal address of the first {@code party} element found below the context,
     * for customer parties and for institutions (pacs.009) alike.
     */
    static PostalAddress address(FieldExtractor fields, String party) {
        List<Element> matches = fields.nodes(".//ns:" + party + "/ns:PstlAdr | .//ns:" + party + "/ns:Pty/ns:PstlAdr"
            + " | .//ns:" + party + "/ns:FinInstnId/ns:PstlAdr");
        if (matches.isEmpty()) {
            return null;
        }
        Element postalAddress = matches.get(0);
        return PostalAddress.ofNullable(
            fields.text(postalAddress, "ns:Ctry"),
            fields.text(postalAddress, "ns:TwnNm"),
            fields.text(postalAddress, "ns:PstCd"),
            fields.text(postalAddress, "ns:StrtNm"),
            fields.text(postalAddress, "ns:BldgNb"),
            fields.texts(postalAddress, "ns:AdrLine"));
    }

    /**
     * Parses a count element; non-numeric text yields null.
     */
    static Integer count(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric count '{}'", value);
            return null;
        }
    }

    static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    /**
     * Ordered map of alternating keys and values; null values are kept.
     */
    static Map<String, String> row(String... keysAndValues) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            row.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return row;
    }
}
