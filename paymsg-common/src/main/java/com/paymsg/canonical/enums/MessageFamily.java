package com.paymsg.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.paymsg.canonical.Acmt007Message;
import com.paymsg.canonical.Acmt015Message;
import com.paymsg.canonical.Camt004Message;
import com.paymsg.canonical.Camt029Message;
import com.paymsg.canonical.Camt052Message;
import com.paymsg.canonical.Camt053Message;
import com.paymsg.canonical.Camt054Message;
import com.paymsg.canonical.Camt056Message;
import com.paymsg.canonical.Camt086Message;
import com.paymsg.canonical.Fxtr014Message;
import com.paymsg.canonical.Pacs002Message;
import com.paymsg.canonical.Pacs004Message;
import com.paymsg.canonical.Pacs008Message;
import com.paymsg.canonical.Pacs009Message;
import com.paymsg.canonical.Pain001Message;
import com.paymsg.canonical.Pain002Message;
import com.paymsg.canonical.Pain008Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.Sese023Message;
import com.paymsg.canonical.Setr004Message;
import com.paymsg.canonical.Setr010Message;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Message families with a dedicated record type.
 *
 * Each family carries its ISO 20022 key (e.g. "pacs.008"), the record class,
 * the snake_case field names that record declares and the business root
 * element names that identify the family when no namespace is available.
 */
public enum MessageFamily {
    BASE("base", PaymentMessage.class, PaymentMessage.FIELDS),
    PACS_008("pacs.008", Pacs008Message.class, Pacs008Message.FIELDS, "FIToFICstmrCdtTrf"),
    PACS_009("pacs.009", Pacs009Message.class, Pacs009Message.FIELDS, "FICdtTrf"),
    PACS_004("pacs.004", Pacs004Message.class, Pacs004Message.FIELDS, "PmtRtr"),
    PACS_002("pacs.002", Pacs002Message.class, Pacs002Message.FIELDS, "FIToFIPmtStsRpt"),
    PAIN_001("pain.001", Pain001Message.class, Pain001Message.FIELDS, "CstmrCdtTrfInitn"),
    PAIN_002("pain.002", Pain002Message.class, Pain002Message.FIELDS, "CstmrPmtStsRpt"),
    PAIN_008("pain.008", Pain008Message.class, Pain008Message.FIELDS, "CstmrDrctDbtInitn"),
    CAMT_004("camt.004", Camt004Message.class, Camt004Message.FIELDS, "RtrAcct"),
    CAMT_029("camt.029", Camt029Message.class, Camt029Message.FIELDS, "RsltnOfInvstgtn"),
    CAMT_052("camt.052", Camt052Message.class, Camt052Message.FIELDS, "BkToCstmrAcctRpt"),
    CAMT_053("camt.053", Camt053Message.class, Camt053Message.FIELDS, "BkToCstmrStmt"),
    CAMT_054("camt.054", Camt054Message.class, Camt054Message.FIELDS, "BkToCstmrDbtCdtNtfctn"),
    CAMT_056("camt.056", Camt056Message.class, Camt056Message.FIELDS, "FIToFIPmtCxlReq", "FIToFICstmrCdtTrfRcl"),
    CAMT_086("camt.086", Camt086Message.class, Camt086Message.FIELDS, "BkSrvcsBllgStmt"),
    FXTR_014("fxtr.014", Fxtr014Message.class, Fxtr014Message.FIELDS, "FXTradInstr"),
    SESE_023("sese.023", Sese023Message.class, Sese023Message.FIELDS, "SctiesSttlmTxInstr"),
    SETR_004("setr.004", Setr004Message.class, Setr004Message.FIELDS, "RedOrdr"),
    SETR_010("setr.010", Setr010Message.class, Setr010Message.FIELDS, "SbcptOrdr"),
    ACMT_007("acmt.007", Acmt007Message.class, Acmt007Message.FIELDS, "AcctOpngReq"),
    ACMT_015("acmt.015", Acmt015Message.class, Acmt015Message.FIELDS, "AcctExcldMndtMntncReq");

    private final String key;
    private final Class<? extends PaymentMessage> recordType;
    private final Set<String> fields;
    private final List<String> rootElements;

    MessageFamily(String key, Class<? extends PaymentMessage> recordType, Set<String> fields,
                  String... rootElements) {
        this.key = key;
        this.recordType = recordType;
        this.fields = fields;
        this.rootElements = List.of(rootElements);
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public Class<? extends PaymentMessage> getRecordType() {
        return recordType;
    }

    public Set<String> getFields() {
        return fields;
    }

    public List<String> getRootElements() {
        return rootElements;
    }

    /**
     * Resolves a family from its key ("pacs.008"). Unknown keys resolve to BASE.
     */
    public static MessageFamily fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (MessageFamily family : values()) {
                if (family.key.equals(normalized)) {
                    return family;
                }
            }
        }
        return BASE;
    }

    /**
     * Finds the family whose key occurs in a namespace URI, e.g.
     * "urn:iso:std:iso:20022:tech:xsd:camt.053.001.08".
     */
    public static Optional<MessageFamily> fromNamespace(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            return Optional.empty();
        }
        for (MessageFamily family : values()) {
            if (family != BASE && namespace.contains(family.key)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the family by the local name of its business root element.
     */
    public static Optional<MessageFamily> fromRootElement(String localName) {
        if (localName == null) {
            return Optional.empty();
        }
        for (MessageFamily family : values()) {
            if (family.rootElements.contains(localName)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }
}
