package com.paymsg.egress.swift;

import com.paymsg.canonical.Pacs008Message;
import com.paymsg.canonical.Pain001Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.PostalAddress;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.config.TranscoderSettingsLoader;
import com.paymsg.egress.UetrGenerator;
import com.paymsg.ingress.MessageParser;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the MT101, MT103, MT202, MT900 and MT910 layouts.
 */
public class PaymentGeneratorsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
    private static final UetrGenerator UETRS = () -> "eb6305c9-1f7f-49de-aed0-16487c27b42d";

    private final TranscoderSettings settings = TranscoderSettingsLoader.defaults();

    private static Map<String, String> payment(String e2e, String amount, String creditor, String agent) {
        Map<String, String> payment = new LinkedHashMap<>();
        payment.put("payment_information_id", "PMT-" + e2e);
        payment.put("requested_execution_date", "2023-10-24");
        payment.put("end_to_end_id", e2e);
        payment.put("amount", amount);
        payment.put("currency", "USD");
        payment.put("creditor_name", creditor);
        payment.put("creditor_agent", agent);
        return payment;
    }

    @Test
    public void testMt101WritesOneSequencePerPayment() {
        List<Map<String, String>> payments = new ArrayList<>();
        payments.add(payment("TXN1", "1000.50", "BENEFICIARY ONE", null));
        payments.add(payment("TXN2", "20.00", "BENEFICIARY TWO", "BARCGB22"));
        Pain001Message record = Pain001Message.builder()
            .messageId("REQ12345")
            .initiatingParty("INSTRUCTING CUST")
            .debtorAccount("12345678")
            .senderBic("SENDERUS33XX")
            .receiverBic("RECVGB22XXXX")
            .paymentInformation(payments)
            .build();

        String mt = new Mt101Generator(settings, CLOCK).generate(record, UETRS);

        assertTrue(mt.contains(":28D:1/1\n"));
        assertTrue(mt.contains(":50H:/12345678\nINSTRUCTING CUST\n"));
        assertTrue(mt.contains(":30:231024\n"));
        assertTrue(mt.contains(":21:TXN1\n:32B:USD1000,50\n:59:BENEFICIARY ONE\n"));
        assertTrue(mt.contains(":21:TXN2\n:32B:USD20,00\n:57A:BARCGB22\n:59:BENEFICIARY TWO\n"));
        assertFalse(mt.contains("{3:"));

        Pain001Message parsed = (Pain001Message) new MessageParser(mt.getBytes(StandardCharsets.UTF_8)).parseDetailed();
        assertEquals(Integer.valueOf(2), parsed.getNumberOfTransactions());
        assertEquals("TXN2", parsed.getPaymentInformation().get(1).get("end_to_end_id"));
        assertEquals("BARCGB22", parsed.getPaymentInformation().get(1).get("creditor_agent"));
        assertEquals("INSTRUCTING CUST", parsed.getInitiatingParty());
    }

    @Test
    public void testMt103AddressAndRemittance() {
        Map<String, String> transaction = new LinkedHashMap<>();
        transaction.put("remittance_information", "Invoice\n42");
        List<Map<String, String>> transactions = new ArrayList<>();
        transactions.add(transaction);
        Pacs008Message record = Pacs008Message.builder()
            .messageId("MSG1")
            .debtorName("John Doe")
            .debtorAddress(PostalAddress.ofNullable("DE", "Frankfurt", "60311", "Main Street", "12", null))
            .creditorName("Jane Smith")
            .creditorAddress(PostalAddress.ofNullable(null, null, null, null, null, List.of("1 Rue de Rivoli", "Paris")))
            .transactions(transactions)
            .build();

        String mt = new Mt103Generator(settings, CLOCK).generate(record, UETRS);

        assertTrue(mt.contains(":50K:John Doe\nMain Street 12\n60311 Frankfurt DE\n"));
        assertTrue(mt.contains(":59:Jane Smith\n1 Rue de Rivoli\nParis\n"));
        assertTrue(mt.contains(":70:Invoice 42\n"));
        assertTrue(mt.contains(":23B:CRED\n"));
        assertTrue(mt.contains(":71A:SHA\n-}"));
    }

    @Test
    public void testMt202CarriesInstitutions() {
        PaymentMessage record = PaymentMessage.builder()
            .messageId("MT202MSG")
            .endToEndId("RELREF123")
            .amount("50000.00")
            .currency("EUR")
            .senderBic("BANKUS33")
            .receiverBic("BANKGB22XXX")
            .build();

        String mt = new Mt202Generator(settings, CLOCK).generate(record, UETRS);

        assertTrue(mt.contains(":21:RELREF123\n"));
        assertTrue(mt.contains(":32A:240315EUR50000,00\n"));
        assertTrue(mt.contains(":52A:BANKUS33XXXX\n"));
        assertTrue(mt.contains(":58A:BANKGB22XXXX\n"));
        assertTrue(mt.contains("{3:{121:eb6305c9-1f7f-49de-aed0-16487c27b42d}}"));
    }

    @Test
    public void testConfirmations() {
        PaymentMessage record = PaymentMessage.builder()
            .messageId("CONF-1")
            .amount("10.00")
            .currency("GBP")
            .debtorName("Payer Ltd")
            .debtorAccount("DEBIT-ACC")
            .creditorAccount("CREDIT-ACC")
            .build();

        String debit = new ConfirmationGenerator(settings, CLOCK, false).generate(record, UETRS);
        assertTrue(debit.contains("{2:I900"));
        assertTrue(debit.contains(":21:NONREF\n:25:DEBIT-ACC\n:32A:240315GBP10,00\n:52A:XXXXXXXXXXXX\n"));

        String credit = new ConfirmationGenerator(settings, CLOCK, true).generate(record, UETRS);
        assertTrue(credit.contains("{2:I910"));
        assertTrue(credit.contains(":25:CREDIT-ACC\n"));
        assertTrue(credit.contains(":50K:Payer Ltd\n"));
        assertFalse(credit.contains(":52A:"));
    }
}
