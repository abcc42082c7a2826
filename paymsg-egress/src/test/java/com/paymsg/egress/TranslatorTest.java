package com.paymsg.egress;

import com.paymsg.canonical.Camt052Message;
import com.paymsg.canonical.Camt053Message;
import com.paymsg.canonical.Camt054Message;
import com.paymsg.canonical.Pacs008Message;
import com.paymsg.canonical.Pacs009Message;
import com.paymsg.canonical.Pain001Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.PostalAddress;
import com.paymsg.config.TranscoderSettings;
import com.paymsg.config.TranscoderSettingsLoader;
import com.paymsg.ingress.MessageParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rendering records to every supported target.
 */
public class TranslatorTest {

    static final String FIXED_UETR = "eb6305c9-1f7f-49de-aed0-16487c27b42d";
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    private final TranscoderSettings settings = TranscoderSettingsLoader.defaults();
    private final Translator translator = new Translator(settings, () -> FIXED_UETR, CLOCK);

    static PaymentMessage sampleRecord() {
        return PaymentMessage.builder()
            .messageId("MSG12345")
            .endToEndId("E2E98765")
            .amount("1500.00")
            .currency("EUR")
            .senderBic("DEUTDEFFXXXX")
            .receiverBic("BNPAFRPPXXXX")
            .debtorName("John Doe")
            .creditorName("Jane Smith")
            .debtorAccount("DE89370400440532013000")
            .creditorAccount("987654321")
            .build();
    }

    private String renderText(PaymentMessage record, String target) {
        return new String(translator.render(record, target), StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @ValueSource(strings = {"101", "103", "202", "900", "910", "940", "942", "950",
        "pacs.008", "pacs.009", "camt.052", "camt.053", "camt.054", "camt.004", "pain.001"})
    public void testRoundTripPreservesCoreFields(String target) {
        byte[] rendered = translator.render(sampleRecord(), target);

        PaymentMessage parsed = new MessageParser(rendered).parseDetailed();

        assertEquals("MSG12345", parsed.getMessageId(), target);
        assertEquals("1500.00", parsed.getAmount(), target);
        assertEquals("EUR", parsed.getCurrency(), target);
        assertEquals("DEUTDEFFXXXX", parsed.getSenderBic(), target);
        assertEquals("BNPAFRPPXXXX", parsed.getReceiverBic(), target);
    }

    @Test
    public void testHighPrecisionAmountSurvivesMtAndMx() {
        PaymentMessage record = sampleRecord();
        record.setAmount("0.12345678901");

        for (String target : new String[] {"103", "pacs.008", "camt.053"}) {
            PaymentMessage parsed = new MessageParser(translator.render(record, target)).parse();
            assertEquals("0.12345678901", parsed.getAmount(), target);
        }
    }

    @Test
    public void testTargetSpellings() {
        String plain = renderText(sampleRecord(), "103");
        assertEquals(plain, renderText(sampleRecord(), "MT103"));
        assertEquals(plain, renderText(sampleRecord(), "mt103"));
        assertEquals(plain, new String(translator.toMt(sampleRecord(), "103"), StandardCharsets.UTF_8));

        String xml = renderText(sampleRecord(), "pacs.008");
        assertEquals(xml, renderText(sampleRecord(), "PACS.008"));
        assertEquals(xml, new String(translator.toMx(sampleRecord(), "pacs.008"), StandardCharsets.UTF_8));
    }

    @Test
    public void testUnsupportedTargetNamesTarget() {
        UnsupportedTargetException e = assertThrows(UnsupportedTargetException.class,
            () -> translator.render(sampleRecord(), "MT999"));
        assertEquals("MT999", e.getTarget());
        assertTrue(e.getMessage().contains("MT999"));
        assertTrue(e instanceof UnsupportedOperationException);

        assertThrows(UnsupportedTargetException.class, () -> translator.render(sampleRecord(), "pain.008"));
        assertThrows(UnsupportedTargetException.class, () -> translator.render(sampleRecord(), null));
        assertThrows(UnsupportedTargetException.class, () -> translator.toMt(sampleRecord(), "pacs.008"));
        assertThrows(UnsupportedTargetException.class, () -> translator.toMx(sampleRecord(), "103"));
    }

    @Test
    public void testNullRecordRejected() {
        assertThrows(IllegalArgumentException.class, () -> translator.render(null, "103"));
    }

    @Test
    public void testTargetSets() {
        assertEquals(List.of("101", "103", "202", "900", "910", "940", "942", "950"),
            new ArrayList<>(translator.mtTargets()));
        assertTrue(translator.mxTargets().contains("pacs.008"));
        assertTrue(translator.mxTargets().contains("camt.004"));
        assertTrue(translator.mxTargets().contains("pain.001"));
        assertEquals(7, translator.mxTargets().size());
    }

    @Test
    public void testUetrSynthesizedWhenAbsent() {
        String mt = renderText(sampleRecord(), "103");
        assertTrue(mt.contains("{3:{121:" + FIXED_UETR + "}}"));

        PaymentMessage parsed = new MessageParser(translator.render(sampleRecord(), "pacs.008")).parse();
        assertEquals(FIXED_UETR, parsed.getUetr());
    }

    @Test
    public void testUetrKeptWhenPresent() {
        PaymentMessage record = sampleRecord();
        record.setUetr("8a562c67-ca16-48ba-b074-65581be6f011");

        assertTrue(renderText(record, "202").contains("{121:8a562c67-ca16-48ba-b074-65581be6f011}"));
        assertEquals("8a562c67-ca16-48ba-b074-65581be6f011",
            new MessageParser(translator.render(record, "pacs.009")).parse().getUetr());
    }

    @Test
    public void testRandomUetrsAreVersion4() {
        Translator randomUetrs = new Translator(settings, UetrGenerator.random(), CLOCK);
        String first = new MessageParser(randomUetrs.render(sampleRecord(), "103")).parse().getUetr();
        String second = new MessageParser(randomUetrs.render(sampleRecord(), "103")).parse().getUetr();

        assertNotNull(first);
        assertEquals('4', first.charAt(14));
        assertNotEquals(first, second);
    }

    @Test
    public void testEmptyRecordUsesPlaceholders() {
        PaymentMessage empty = new PaymentMessage();

        String mt = renderText(empty, "103");
        assertTrue(mt.startsWith("{1:F01XXXXXXXXXXXX0000000000}{2:I103XXXXXXXXXXXXN}"));
        assertTrue(mt.contains(":20:NONREF\n"));
        assertTrue(mt.contains(":32A:240315USD0,00\n"));
        assertTrue(mt.contains(":50K:N/A\n"));
        assertTrue(mt.contains(":59:N/A\n"));
        assertTrue(mt.endsWith("-}"));

        String xml = renderText(empty, "pacs.008");
        assertTrue(xml.contains("<Nm>UNKNOWN</Nm>"));
        assertTrue(xml.contains("<BICFI>UNKNOWN</BICFI>"));
        assertTrue(xml.contains("<MsgId>NONREF</MsgId>"));
        assertTrue(xml.contains("<IntrBkSttlmAmt Ccy=\"USD\">0.00</IntrBkSttlmAmt>"));
    }

    @Test
    public void testShortBicPaddedInMtHeader() {
        PaymentMessage record = sampleRecord();
        record.setSenderBic("DEUTDEFF");
        record.setReceiverBic("BNPAFRPP");

        String mt = renderText(record, "103");
        assertTrue(mt.startsWith("{1:F01DEUTDEFFXXXX0000000000}{2:I103BNPAFRPPXXXXN}"));
    }

    @Test
    public void testXmlSpecialCharactersEscaped() {
        PaymentMessage record = sampleRecord();
        record.setDebtorName("Smith & <Sons> \"Ltd\" 'UK'");

        String xml = renderText(record, "pacs.008");
        assertTrue(xml.contains("<Nm>Smith &amp; &lt;Sons&gt; &quot;Ltd&quot; &apos;UK&apos;</Nm>"));

        PaymentMessage parsed = new MessageParser(xml.getBytes(StandardCharsets.UTF_8)).parse();
        assertEquals("Smith & <Sons> \"Ltd\" 'UK'", parsed.getDebtorName());
    }

    @Test
    public void testNamespaceFromSettings() {
        assertTrue(renderText(sampleRecord(), "pacs.008")
            .contains("xmlns=\"urn:iso:std:iso:20022:tech:xsd:pacs.008.001.08\""));
        assertTrue(renderText(sampleRecord(), "camt.004")
            .contains("xmlns=\"urn:iso:std:iso:20022:tech:xsd:camt.004.001.08\""));
    }

    @Test
    public void testPacs008RoundTripKeepsParties() {
        Map<String, String> transaction = new LinkedHashMap<>();
        transaction.put("instruction_id", "INSTR-1");
        transaction.put("remittance_information", "Invoice 42");
        List<Map<String, String>> transactions = new ArrayList<>();
        transactions.add(transaction);
        Pacs008Message record = sampleRecord().seed(Pacs008Message.builder())
            .settlementMethod("INDA")
            .transactions(transactions)
            .build();

        Pacs008Message parsed = (Pacs008Message) new MessageParser(translator.render(record, "pacs.008")).parseDetailed();

        assertEquals("E2E98765", parsed.getEndToEndId());
        assertEquals("John Doe", parsed.getDebtorName());
        assertEquals("Jane Smith", parsed.getCreditorName());
        assertEquals("DE89370400440532013000", parsed.getDebtorAccount());
        assertEquals("987654321", parsed.getCreditorAccount());
        assertEquals("INDA", parsed.getSettlementMethod());
        assertEquals("INSTR-1", parsed.getTransactions().get(0).get("instruction_id"));
        assertEquals("Invoice 42", parsed.getTransactions().get(0).get("remittance_information"));
    }

    @Test
    public void testMt103RoundTripKeepsParties() {
        PaymentMessage parsed = new MessageParser(translator.render(sampleRecord(), "MT103")).parse();

        assertEquals("John Doe", parsed.getDebtorName());
        assertEquals("Jane Smith", parsed.getCreditorName());
        assertEquals("DE89370400440532013000", parsed.getDebtorAccount());
        assertEquals("987654321", parsed.getCreditorAccount());
        assertEquals(FIXED_UETR, parsed.getUetr());
    }

    private static Map<String, String> row(String... keyValues) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put(keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    static List<PaymentMessage> accountReportRecords() {
        List<Map<String, String>> balances = new ArrayList<>(Arrays.asList(
            row("type", "OPBD", "amount", "5.00", "currency", "EUR", "credit_debit_indicator", "CRDT", "date", "2024-03-14"),
            row("type", "CLBD", "amount", "12.00", "currency", "EUR", "credit_debit_indicator", "CRDT", "date", "2024-03-15")));
        List<Map<String, String>> entries = new ArrayList<>(Arrays.asList(
            row("reference", "NTRY-1", "amount", "7.00", "currency", "EUR", "credit_debit_indicator", "CRDT"),
            row("reference", "NTRY-2", "amount", "3.00", "currency", "EUR", "credit_debit_indicator", "DBIT")));

        Camt053Message statement = sampleRecord().seed(Camt053Message.builder())
            .statementId("STMT-1")
            .balances(new ArrayList<>(balances))
            .entries(new ArrayList<>(entries))
            .build();
        Camt052Message report = sampleRecord().seed(Camt052Message.builder())
            .reportId("RPT-1")
            .balances(new ArrayList<>(balances))
            .entries(new ArrayList<>(entries))
            .build();
        Camt054Message notification = sampleRecord().seed(Camt054Message.builder())
            .notificationId("NTF-1")
            .entries(new ArrayList<>(entries))
            .build();
        return Arrays.asList(statement, report, notification);
    }

    @ParameterizedTest
    @ValueSource(strings = {"101", "103", "202", "900", "910", "940", "942", "950",
        "pacs.008", "pacs.009", "camt.052", "camt.053", "camt.054", "camt.004", "pain.001"})
    public void testRoundTripPreservesCoreFieldsOfAccountReports(String target) {
        for (PaymentMessage record : accountReportRecords()) {
            String context = record.getClass().getSimpleName() + " -> " + target;

            PaymentMessage parsed = new MessageParser(translator.render(record, target)).parseDetailed();

            assertEquals("MSG12345", parsed.getMessageId(), context);
            assertEquals("1500.00", parsed.getAmount(), context);
            assertEquals("EUR", parsed.getCurrency(), context);
            assertEquals("DEUTDEFFXXXX", parsed.getSenderBic(), context);
            assertEquals("BNPAFRPPXXXX", parsed.getReceiverBic(), context);
        }
    }

    @Test
    public void testStatementKeepsBalancesBehindRecordAmount() {
        Camt053Message statement = (Camt053Message) accountReportRecords().get(0);

        Camt053Message parsed = (Camt053Message) new MessageParser(translator.render(statement, "camt.053")).parseDetailed();

        assertEquals(3, parsed.getBalances().size());
        assertEquals("1500.00", parsed.getBalances().get(0).get("amount"));
        assertEquals("INFO", parsed.getBalances().get(0).get("type"));
        assertEquals("5.00", parsed.getBalances().get(1).get("amount"));
        assertEquals("12.00", parsed.getBalances().get(2).get("amount"));
        assertEquals(2, parsed.getEntries().size());
    }

    @Test
    public void testStatementWithMatchingBalanceWritesNoExtraBalance() {
        Camt053Message statement = (Camt053Message) accountReportRecords().get(0);
        statement.setAmount("5.00");

        Camt053Message parsed = (Camt053Message) new MessageParser(translator.render(statement, "camt.053")).parseDetailed();

        assertEquals("5.00", parsed.getAmount());
        assertEquals(2, parsed.getBalances().size());
        assertEquals("OPBD", parsed.getBalances().get(0).get("type"));
    }

    @Test
    public void testNotificationLeadsWithRecordAmount() {
        Camt054Message notification = (Camt054Message) accountReportRecords().get(2);

        Camt054Message parsed = (Camt054Message) new MessageParser(translator.render(notification, "camt.054")).parseDetailed();

        assertEquals("1500.00", parsed.getAmount());
        assertEquals(3, parsed.getEntries().size());
        assertEquals("1500.00", parsed.getEntries().get(0).get("amount"));
        assertEquals("7.00", parsed.getEntries().get(1).get("amount"));
        assertEquals("NTRY-2", parsed.getEntries().get(2).get("reference"));
    }

    private static PostalAddress berlin() {
        return PostalAddress.builder()
            .country("DE")
            .townName("Berlin")
            .postCode("10117")
            .streetName("Unter den Linden")
            .buildingNumber("1")
            .build();
    }

    private static PostalAddress paris() {
        return PostalAddress.builder()
            .country("FR")
            .addressLines(new ArrayList<>(Arrays.asList("16 Boulevard des Italiens", "75009 Paris")))
            .build();
    }

    @ParameterizedTest
    @ValueSource(strings = {"pacs.008", "pacs.009", "camt.004", "pain.001"})
    public void testPostalAddressesRoundTrip(String target) {
        PaymentMessage record = sampleRecord();
        record.setDebtorAddress(berlin());
        record.setCreditorAddress(paris());

        String xml = renderText(record, target);
        assertTrue(xml.contains("<PstlAdr>"), target);

        PaymentMessage parsed = new MessageParser(xml.getBytes(StandardCharsets.UTF_8)).parse();
        assertEquals(berlin(), parsed.getDebtorAddress(), target);
        assertEquals(paris(), parsed.getCreditorAddress(), target);
    }

    @Test
    public void testPostalAddressComponentsInSchemaOrder() {
        PaymentMessage record = sampleRecord();
        record.setDebtorAddress(berlin());

        String xml = renderText(record, "pacs.008");

        int street = xml.indexOf("<StrtNm>Unter den Linden</StrtNm>");
        int building = xml.indexOf("<BldgNb>1</BldgNb>");
        int postCode = xml.indexOf("<PstCd>10117</PstCd>");
        int town = xml.indexOf("<TwnNm>Berlin</TwnNm>");
        int country = xml.indexOf("<Ctry>DE</Ctry>");
        assertTrue(street > 0 && street < building && building < postCode && postCode < town && town < country);
        assertEquals(1, xml.split("<PstlAdr>", -1).length - 1);
    }

    @Test
    public void testPacs009AddressesBelowInstitution() {
        PaymentMessage record = sampleRecord();
        record.setDebtorAddress(berlin());

        String xml = renderText(record, "pacs.009");
        assertTrue(xml.contains("<BICFI>DEUTDEFFXXXX</BICFI>\n          <PstlAdr>"));

        Pacs009Message parsed = (Pacs009Message) new MessageParser(xml.getBytes(StandardCharsets.UTF_8)).parseDetailed();
        assertEquals("Berlin", parsed.getDebtorAddress().getTownName());
    }

    @Test
    public void testEmptyAddressWritesNothing() {
        PaymentMessage record = sampleRecord();
        record.setDebtorAddress(new PostalAddress());

        assertFalse(renderText(record, "pacs.008").contains("PstlAdr"));
    }

    @Test
    public void testInitiationRoundTripKeepsPaymentInformation() {
        List<Map<String, String>> payments = new ArrayList<>(Arrays.asList(
            row("payment_information_id", "PMT-A", "requested_execution_date", "2024-03-20",
                "end_to_end_id", "E2E-1", "amount", "1500.00", "currency", "EUR",
                "creditor_name", "Jane Smith", "creditor_account", "FR1420041010050500013M02606",
                "creditor_agent", "BNPAFRPPXXXX", "remittance_information", "Invoice 1"),
            row("payment_information_id", "PMT-A", "requested_execution_date", "2024-03-20",
                "end_to_end_id", "E2E-2", "amount", "250.00", "currency", "EUR",
                "creditor_name", "Max Mustermann", "creditor_agent", "COBADEFFXXX"),
            row("payment_information_id", "PMT-B", "requested_execution_date", "2024-03-21",
                "end_to_end_id", "E2E-3", "amount", "75.25", "currency", "EUR",
                "creditor_name", "Erika Musterfrau")));
        Pain001Message record = sampleRecord().seed(Pain001Message.builder())
            .initiatingParty("ACME Treasury")
            .controlSum("1825.25")
            .paymentInformation(payments)
            .build();
        record.setEndToEndId("E2E-1");

        String xml = renderText(record, "pain.001");
        assertTrue(xml.contains("xmlns=\"urn:iso:std:iso:20022:tech:xsd:pain.001.001.09\""));
        assertEquals(2, xml.split("<PmtInf>", -1).length - 1);

        Pain001Message parsed = (Pain001Message) new MessageParser(xml.getBytes(StandardCharsets.UTF_8)).parseDetailed();
        assertEquals("MSG12345", parsed.getMessageId());
        assertEquals("ACME Treasury", parsed.getInitiatingParty());
        assertEquals(Integer.valueOf(3), parsed.getNumberOfTransactions());
        assertEquals("1825.25", parsed.getControlSum());
        assertEquals(FIXED_UETR, parsed.getUetr());
        assertEquals(3, parsed.getPaymentInformation().size());

        Map<String, String> second = parsed.getPaymentInformation().get(1);
        assertEquals("PMT-A", second.get("payment_information_id"));
        assertEquals("E2E-2", second.get("end_to_end_id"));
        assertEquals("250.00", second.get("amount"));
        assertEquals("COBADEFFXXX", second.get("creditor_agent"));
        assertEquals("DEUTDEFFXXXX", second.get("debtor_agent"));
        assertEquals("John Doe", second.get("debtor_name"));

        Map<String, String> third = parsed.getPaymentInformation().get(2);
        assertEquals("PMT-B", third.get("payment_information_id"));
        assertEquals("2024-03-21", third.get("requested_execution_date"));
        assertEquals("Invoice 1", parsed.getPaymentInformation().get(0).get("remittance_information"));
    }

    @Test
    public void testInitiationLeadsWithRecordWhenFirstPaymentDiffers() {
        List<Map<String, String>> payments = new ArrayList<>();
        payments.add(row("payment_information_id", "PMT-A", "end_to_end_id", "E2E-9", "amount", "40.00", "currency", "EUR"));
        Pain001Message record = sampleRecord().seed(Pain001Message.builder())
            .paymentInformation(payments)
            .build();

        Pain001Message parsed = (Pain001Message) new MessageParser(translator.render(record, "pain.001")).parseDetailed();

        assertEquals("1500.00", parsed.getAmount());
        assertEquals("E2E98765", parsed.getEndToEndId());
        assertEquals(2, parsed.getPaymentInformation().size());
        assertEquals("40.00", parsed.getPaymentInformation().get(1).get("amount"));
    }
}
