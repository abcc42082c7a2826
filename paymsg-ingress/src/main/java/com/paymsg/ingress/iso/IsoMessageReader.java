package com.paymsg.ingress.iso;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.ingress.common.FieldExtractor;
import com.paymsg.ingress.common.MessageFamilyDetector;
import com.paymsg.ingress.common.XmlDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads ISO 20022 XML into typed records.
 *
 * <p>Handles a bare {@code Document}, a Business Application Header wrapper
 * ({@code AppHdr} next to or around the {@code Document}) and a lone
 * {@code AppHdr}. Bytes that are not well-formed XML leave the reader in an
 * empty state where every field reads as null.</p>
 */
public class IsoMessageReader {

    private static final Logger log = LoggerFactory.getLogger(IsoMessageReader.class);

    private static final String APP_HDR = "AppHdr";
    private static final String DOCUMENT = "Document";

    private static final Map<MessageFamily, FamilyMapper> MAPPERS = new EnumMap<>(MessageFamily.class);

    static {
        MAPPERS.put(MessageFamily.PACS_008, new Pacs008Mapper());
        MAPPERS.put(MessageFamily.PACS_009, new Pacs009Mapper());
        MAPPERS.put(MessageFamily.PACS_004, new Pacs004Mapper());
        MAPPERS.put(MessageFamily.PACS_002, new StatusReportMapper(MessageFamily.PACS_002));
        MAPPERS.put(MessageFamily.PAIN_001, new InitiationMapper(MessageFamily.PAIN_001));
        MAPPERS.put(MessageFamily.PAIN_002, new StatusReportMapper(MessageFamily.PAIN_002));
        MAPPERS.put(MessageFamily.PAIN_008, new InitiationMapper(MessageFamily.PAIN_008));
        MAPPERS.put(MessageFamily.CAMT_004, new Camt004Mapper());
        MAPPERS.put(MessageFamily.CAMT_029, new Camt029Mapper());
        MAPPERS.put(MessageFamily.CAMT_052, new AccountReportMapper(MessageFamily.CAMT_052));
        MAPPERS.put(MessageFamily.CAMT_053, new AccountReportMapper(MessageFamily.CAMT_053));
        MAPPERS.put(MessageFamily.CAMT_054, new AccountReportMapper(MessageFamily.CAMT_054));
        MAPPERS.put(MessageFamily.CAMT_056, new Camt056Mapper());
        MAPPERS.put(MessageFamily.CAMT_086, new Camt086Mapper());
        MAPPERS.put(MessageFamily.FXTR_014, new Fxtr014Mapper());
        MAPPERS.put(MessageFamily.SESE_023, new Sese023Mapper());
        MAPPERS.put(MessageFamily.SETR_004, new FundOrderMapper(MessageFamily.SETR_004));
        MAPPERS.put(MessageFamily.SETR_010, new FundOrderMapper(MessageFamily.SETR_010));
        MAPPERS.put(MessageFamily.ACMT_007, new AccountRequestMapper(MessageFamily.ACMT_007));
        MAPPERS.put(MessageFamily.ACMT_015, new AccountRequestMapper(MessageFamily.ACMT_015));
    }

    private final BusinessHeader header;
    private final FieldExtractor fields;
    private final MessageFamily family;

    public IsoMessageReader(byte[] raw) {
        Document document = null;
        try {
            document = XmlDocuments.parse(raw);
        } catch (XmlDocuments.XmlParseException e) {
            log.debug("Input is not well-formed XML, reading as empty: {}", e.getMessage());
        }

        if (document == null) {
            this.header = null;
            this.fields = FieldExtractor.empty();
            this.family = MessageFamily.BASE;
            return;
        }

        Element root = document.getDocumentElement();
        Element appHdr = APP_HDR.equals(XmlDocuments.localName(root))
            ? root
            : XmlDocuments.findFirst(root, APP_HDR);
        Element payload = root;
        if (appHdr != null) {
            this.header = BusinessHeader.from(appHdr);
            if (appHdr != root) {
                payload = locatePayload(root, appHdr);
            }
            log.debug("Business Application Header found, payload element: {}", XmlDocuments.localName(payload));
        } else {
            this.header = null;
        }

        this.fields = FieldExtractor.forElement(payload);
        this.family = detectFamily(payload);
    }

    public MessageFamily getFamily() {
        return family;
    }

    public BusinessHeader getHeader() {
        return header;
    }

    /**
     * Extracts the fields common to every family.
     */
    public PaymentMessage readBase() {
        String messageId = fields.text(IsoFields.MESSAGE_ID);
        String senderBic = fields.text(IsoFields.SENDER_BIC);
        String receiverBic = fields.text(IsoFields.RECEIVER_BIC);
        if (header != null) {
            messageId = IsoFields.firstNonNull(messageId, header.getBusinessMessageId());
            senderBic = IsoFields.firstNonNull(senderBic, header.getSenderBic());
            receiverBic = IsoFields.firstNonNull(receiverBic, header.getReceiverBic());
        }

        String amount = null;
        String currency = null;
        List<Element> amounts = fields.nodes(IsoFields.FIRST_AMOUNT);
        if (!amounts.isEmpty()) {
            Element first = amounts.get(0);
            amount = fields.text(first, ".");
            String ccy = first.getAttribute("Ccy").trim();
            currency = ccy.isEmpty() ? null : ccy;
        }

        return PaymentMessage.builder()
            .messageId(messageId)
            .endToEndId(fields.text(IsoFields.END_TO_END_ID))
            .uetr(fields.text(IsoFields.UETR))
            .amount(amount)
            .currency(currency)
            .senderBic(senderBic)
            .receiverBic(receiverBic)
            .debtorName(fields.text(".//ns:Dbtr/ns:Nm | .//ns:Dbtr/ns:Pty/ns:Nm"))
            .creditorName(fields.text(".//ns:Cdtr/ns:Nm | .//ns:Cdtr/ns:Pty/ns:Nm"))
            .debtorAccount(fields.text(".//ns:DbtrAcct/ns:Id/ns:IBAN | .//ns:DbtrAcct/ns:Id/ns:Othr/ns:Id"))
            .creditorAccount(fields.text(".//ns:CdtrAcct/ns:Id/ns:IBAN | .//ns:CdtrAcct/ns:Id/ns:Othr/ns:Id"))
            .debtorAddress(IsoFields.address(fields, "Dbtr"))
            .creditorAddress(IsoFields.address(fields, "Cdtr"))
            .build();
    }

    /**
     * Extracts the record of the detected family, or the base record when the
     * family has no dedicated mapping.
     */
    public PaymentMessage readDetailed() {
        PaymentMessage base = readBase();
        FamilyMapper mapper = MAPPERS.get(family);
        if (mapper == null) {
            return base;
        }
        log.debug("Mapping payload as {}", family.getKey());
        return mapper.map(base, fields);
    }

    static Map<MessageFamily, FamilyMapper> mappers() {
        return Collections.unmodifiableMap(MAPPERS);
    }

    private MessageFamily detectFamily(Element payload) {
        MessageFamily detected = MessageFamilyDetector.detect(fields.getNamespace(), payload);
        if (detected == MessageFamily.BASE && header != null) {
            detected = MessageFamily.fromNamespace(header.getMessageDefinitionId()).orElse(MessageFamily.BASE);
        }
        return detected;
    }

    /**
     * The business document next to a header: the {@code Document} element
     * when present, else the first sibling element that is not the header.
     */
    private static Element locatePayload(Element root, Element appHdr) {
        Element document = XmlDocuments.findFirst(root, DOCUMENT);
        if (document != null) {
            return document;
        }
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && node != appHdr) {
                return (Element) node;
            }
        }
        return root;
    }
}
