package com.paymsg.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Library settings loaded from {@code /config/paymsg-settings.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscoderSettings {

    /**
     * System property that overrides {@link #schemaDirectory}.
     */
    public static final String SCHEMA_DIR_PROPERTY = "paymsg.schema.dir";

    /**
     * Directory holding the ISO 20022 XSD files. Resolved as a filesystem path
     * first, then as a classpath directory.
     */
    private String schemaDirectory;

    /**
     * Twelve character logical terminal used when a record has no BIC.
     */
    private String placeholderBic;

    /**
     * Name written to MT output when a party name is missing.
     */
    private String mtNameSentinel;

    /**
     * Name and agent identifier written to MX output when missing.
     */
    private String mxNameSentinel;

    /**
     * Reference written when a record has no message id.
     */
    private String defaultReference;

    private String defaultCurrency;

    /**
     * Relative tolerance for fuzzy amount matching (0.01 = 1%).
     */
    private BigDecimal fuzzyAmountTolerance;

    /**
     * Full schema identifier per MX render target, e.g. "pacs.008" to
     * "pacs.008.001.08".
     */
    @Builder.Default
    private Map<String, String> mxNamespaces = new LinkedHashMap<>();

    /**
     * The effective schema directory, honouring the system property override.
     */
    public String effectiveSchemaDirectory() {
        String override = System.getProperty(SCHEMA_DIR_PROPERTY);
        if (override != null && !override.trim().isEmpty()) {
            return override.trim();
        }
        return schemaDirectory;
    }

    /**
     * Namespace URI for an MX target key, falling back to version 001.08.
     */
    public String namespaceFor(String targetKey) {
        String schemaId = mxNamespaces != null ? mxNamespaces.get(targetKey) : null;
        if (schemaId == null) {
            schemaId = targetKey + ".001.08";
        }
        return "urn:iso:std:iso:20022:tech:xsd:" + schemaId;
    }
}
