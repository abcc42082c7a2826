package com.paymsg.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class TranscoderSettingsLoaderTest {

    @AfterEach
    public void clearOverride() {
        System.clearProperty(TranscoderSettings.SCHEMA_DIR_PROPERTY);
    }

    @Test
    public void testLoadsBundledDefaults() {
        TranscoderSettings settings = new TranscoderSettingsLoader().load();

        assertEquals("XXXXXXXXXXXX", settings.getPlaceholderBic());
        assertEquals("N/A", settings.getMtNameSentinel());
        assertEquals("UNKNOWN", settings.getMxNameSentinel());
        assertEquals("NONREF", settings.getDefaultReference());
        assertEquals(0, new BigDecimal("0.01").compareTo(settings.getFuzzyAmountTolerance()));
        assertEquals("urn:iso:std:iso:20022:tech:xsd:pacs.008.001.08", settings.namespaceFor("pacs.008"));
        assertEquals("urn:iso:std:iso:20022:tech:xsd:pain.001.001.09", settings.namespaceFor("pain.001"));
    }

    @Test
    public void testMissingResourceFails() {
        TranscoderSettingsLoader loader = new TranscoderSettingsLoader();

        assertThrows(SettingsLoadException.class, () -> loader.load("/config/does-not-exist.json"));
    }

    @Test
    public void testSchemaDirectoryOverride() {
        TranscoderSettings settings = TranscoderSettings.builder().schemaDirectory("schemas").build();
        assertEquals("schemas", settings.effectiveSchemaDirectory());

        System.setProperty(TranscoderSettings.SCHEMA_DIR_PROPERTY, "/opt/xsd");
        assertEquals("/opt/xsd", settings.effectiveSchemaDirectory());
    }

    @Test
    public void testUnconfiguredTargetUsesDefaultVersion() {
        TranscoderSettings settings = TranscoderSettings.builder().build();

        assertEquals("urn:iso:std:iso:20022:tech:xsd:camt.054.001.08", settings.namespaceFor("camt.054"));
    }
}
