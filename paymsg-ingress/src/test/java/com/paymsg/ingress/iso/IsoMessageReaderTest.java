package com.paymsg.ingress.iso;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.PostalAddress;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.ingress.MessageFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for base field extraction, header handling and family detection.
 */
public class IsoMessageReaderTest {

    @Test
    public void testReadsBaseFieldsOfCreditTransfer() {
        IsoMessageReader reader = new IsoMessageReader(MessageFixtures.load("pacs008.xml"));
        PaymentMessage message = reader.readBase();

        assertEquals(MessageFamily.PACS_008, reader.getFamily());
        assertEquals("MSG12345", message.getMessageId());
        assertEquals("E2E98765", message.getEndToEndId());
        assertEquals("8a562c67-ca16-48ba-b074-65581be6f011", message.getUetr());
        assertEquals("1500.00", message.getAmount());
        assertEquals("EUR", message.getCurrency());
        assertEquals("DEUTDEFF", message.getSenderBic());
        assertEquals("BNPAFRPP", message.getReceiverBic());
        assertEquals("John Doe", message.getDebtorName());
        assertEquals("Jane Smith", message.getCreditorName());
        assertEquals("DE89370400440532013000", message.getDebtorAccount());
        assertEquals("987654321", message.getCreditorAccount());
    }

    @Test
    public void testReadsStructuredAndUnstructuredAddresses() {
        PaymentMessage message = new IsoMessageReader(MessageFixtures.load("pacs008.xml")).readBase();

        PostalAddress debtor = message.getDebtorAddress();
        assertNotNull(debtor);
        assertEquals("DE", debtor.getCountry());
        assertEquals("Frankfurt", debtor.getTownName());
        assertEquals("60311", debtor.getPostCode());
        assertEquals("Main Street", debtor.getStreetName());
        assertEquals("12", debtor.getBuildingNumber());
        assertTrue(debtor.getAddressLines().isEmpty());

        PostalAddress creditor = message.getCreditorAddress();
        assertEquals(List.of("1 Rue de la Paix", "75002 Paris"), creditor.getAddressLines());
        assertNull(creditor.getCountry());
    }

    @Test
    public void testHeaderSuppliesRoutingButDocumentIdWins() {
        IsoMessageReader reader = new IsoMessageReader(MessageFixtures.load("bah-pacs008.xml"));
        PaymentMessage message = reader.readBase();

        assertNotNull(reader.getHeader());
        assertEquals(MessageFamily.PACS_008, reader.getFamily());
        assertEquals("SENDERBAH", message.getSenderBic());
        assertEquals("RECEIVERBAH", message.getReceiverBic());
        assertEquals("DOC-MSG-123", message.getMessageId());
        assertEquals("2500.00", message.getAmount());
        assertEquals("GBP", message.getCurrency());
        assertEquals("E2E-456", message.getEndToEndId());
    }

    @Test
    public void testHeaderIdentifierUsedWhenDocumentHasNone() {
        PaymentMessage message = new IsoMessageReader(MessageFixtures.load("bah-without-msgid.xml")).readBase();

        assertEquals("ONLY-IN-BAH", message.getMessageId());
        assertEquals("75.50", message.getAmount());
        assertEquals("EUR", message.getCurrency());
    }

    @Test
    public void testHeaderAsDocumentRoot() {
        IsoMessageReader reader = new IsoMessageReader(MessageFixtures.load("apphdr-root.xml"));
        PaymentMessage message = reader.readBase();

        assertEquals("DIRECTSEN", message.getSenderBic());
        assertEquals("DIRECT-ID", message.getMessageId());
        assertEquals(MessageFamily.BASE, reader.getFamily());
    }

    @Test
    public void testHeaderDefinitionIdentifiesFamilyOfUnknownPayload() {
        String xml = "<BusMsg xmlns=\"urn:iso:std:iso:20022:tech:xsd:head.001.001.02\">"
            + "<AppHdr><BizMsgIdr>HDR-1</BizMsgIdr><MsgDefIdr>camt.053.001.08</MsgDefIdr></AppHdr>"
            + "<Payload><Stmt><Id>S-1</Id></Stmt></Payload>"
            + "</BusMsg>";

        IsoMessageReader reader = new IsoMessageReader(MessageFixtures.bytes(xml));

        assertEquals(MessageFamily.CAMT_053, reader.getFamily());
        assertEquals("camt.053.001.08", reader.getHeader().getMessageDefinitionId());
    }

    @Test
    public void testDispatchFromRootTagWithoutNamespace() {
        String xml = "<Document><BkToCstmrStmt><GrpHdr><MsgId>NO-NS</MsgId></GrpHdr>"
            + "<Stmt><Id>STMT-NO-NS</Id></Stmt></BkToCstmrStmt></Document>";

        IsoMessageReader reader = new IsoMessageReader(MessageFixtures.bytes(xml));

        assertEquals(MessageFamily.CAMT_053, reader.getFamily());
        assertEquals("NO-NS", reader.readDetailed().getMessageId());
    }

    @Test
    public void testMalformedXmlReadsAsEmpty() {
        IsoMessageReader reader = new IsoMessageReader(MessageFixtures.bytes("<Document><MsgId>Broken"));

        assertEquals(MessageFamily.BASE, reader.getFamily());
        assertNull(reader.getHeader());
        assertNull(reader.readBase().getMessageId());
        assertEquals(PaymentMessage.class, reader.readDetailed().getClass());
    }

    @Test
    public void testEveryFamilyHasMapper() {
        for (MessageFamily family : MessageFamily.values()) {
            if (family != MessageFamily.BASE) {
                assertTrue(IsoMessageReader.mappers().containsKey(family), "No mapper for " + family.getKey());
            }
        }
    }

    /**
     * A bare document in every known namespace must read without errors and
     * yield the family's record type.
     */
    @ParameterizedTest
    @EnumSource(value = MessageFamily.class, mode = EnumSource.Mode.EXCLUDE, names = "BASE")
    public void testEmptyDocumentDegradesGracefully(MessageFamily family) {
        String xml = "<Document xmlns=\"urn:iso:std:iso:20022:tech:xsd:" + family.getKey() + ".001.01\"/>";

        PaymentMessage message = new IsoMessageReader(MessageFixtures.bytes(xml)).readDetailed();

        assertEquals(family.getRecordType(), message.getClass());
        assertNull(message.getMessageId());
        assertNull(message.getAmount());
        assertNotNull(message.toMap());
    }
}
