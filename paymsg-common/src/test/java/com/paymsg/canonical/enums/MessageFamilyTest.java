package com.paymsg.canonical.enums;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MessageFamilyTest {

    @Test
    public void testFromNamespace() {
        assertEquals(MessageFamily.CAMT_053,
            MessageFamily.fromNamespace("urn:iso:std:iso:20022:tech:xsd:camt.053.001.08").orElseThrow());
        assertEquals(MessageFamily.PACS_002,
            MessageFamily.fromNamespace("urn:iso:std:iso:20022:tech:xsd:pacs.002.001.10").orElseThrow());
        assertTrue(MessageFamily.fromNamespace("urn:iso:std:iso:20022:tech:xsd:head.001.001.02").isEmpty());
        assertTrue(MessageFamily.fromNamespace(null).isEmpty());
    }

    @Test
    public void testFromRootElement() {
        assertEquals(MessageFamily.PACS_008, MessageFamily.fromRootElement("FIToFICstmrCdtTrf").orElseThrow());
        assertEquals(MessageFamily.CAMT_056, MessageFamily.fromRootElement("FIToFIPmtCxlReq").orElseThrow());
        assertEquals(MessageFamily.CAMT_056, MessageFamily.fromRootElement("FIToFICstmrCdtTrfRcl").orElseThrow());
        assertTrue(MessageFamily.fromRootElement("Document").isEmpty());
    }

    @Test
    public void testFromKeyFallsBackToBase() {
        assertEquals(MessageFamily.SETR_010, MessageFamily.fromKey("setr.010"));
        assertEquals(MessageFamily.BASE, MessageFamily.fromKey("abc.123"));
        assertEquals(MessageFamily.BASE, MessageFamily.fromKey(null));
    }

    @Test
    public void testTwentySpecializedFamilies() {
        assertEquals(21, MessageFamily.values().length);
    }

    @Test
    public void testWireFormatDetection() {
        assertEquals(WireFormat.MT, WireFormat.detect("{1:F01BANKBEBBAXXX0000000000}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(WireFormat.XML, WireFormat.detect("\uFEFF  <Document/>".getBytes(StandardCharsets.UTF_8)));
        assertEquals(WireFormat.UNKNOWN, WireFormat.detect("hello".getBytes(StandardCharsets.UTF_8)));
        assertEquals(WireFormat.UNKNOWN, WireFormat.detect(new byte[0]));
        assertEquals(WireFormat.UNKNOWN, WireFormat.detect(null));
    }
}
