package com.paymsg.ingress.swift;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StatementLineParserTest {

    @Test
    public void testFullStatementLine() {
        Map<String, String> entry = StatementLineParser.parse("2310251024CR1000,50NTRFREFERENCE1//BANKREF\nSUPPLEMENT", "USD");

        assertEquals("2023-10-25", entry.get("value_date"));
        assertEquals("2023-10-24", entry.get("booking_date"));
        assertEquals("CRDT", entry.get("credit_debit_indicator"));
        assertEquals("1000.50", entry.get("amount"));
        assertEquals("USD", entry.get("currency"));
        assertEquals("NTRF", entry.get("transaction_type"));
        assertEquals("REFERENCE1", entry.get("reference"));
        assertEquals("BOOK", entry.get("status"));
    }

    @Test
    public void testEntryDateAndFundsCodeAreOptional() {
        Map<String, String> entry = StatementLineParser.parse("231024DD75,00FCHGNONREF", "EUR");

        assertEquals("2023-10-24", entry.get("booking_date"));
        assertEquals("DBIT", entry.get("credit_debit_indicator"));
        assertEquals("75.00", entry.get("amount"));
        assertEquals("FCHG", entry.get("transaction_type"));
        assertEquals("NONREF", entry.get("reference"));
    }

    @Test
    public void testReversalMarks() {
        assertEquals("CRDT", StatementLineParser.direction("RD"));
        assertEquals("DBIT", StatementLineParser.direction("RC"));
        assertEquals("DBIT", StatementLineParser.direction("DR"));
    }

    @Test
    public void testUnparseableLine() {
        assertNull(StatementLineParser.parse("NOT A STATEMENT LINE", "USD"));
        assertNull(StatementLineParser.parse(null, "USD"));
    }
}
