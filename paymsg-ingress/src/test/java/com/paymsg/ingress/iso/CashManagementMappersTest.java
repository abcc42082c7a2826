package com.paymsg.ingress.iso;

import com.paymsg.canonical.Camt004Message;
import com.paymsg.canonical.Camt029Message;
import com.paymsg.canonical.Camt052Message;
import com.paymsg.canonical.Camt053Message;
import com.paymsg.canonical.Camt054Message;
import com.paymsg.canonical.Camt056Message;
import com.paymsg.canonical.Camt086Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.MessageFixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the camt mappers: account reports, investigations and billing.
 */
public class CashManagementMappersTest {

    private static PaymentMessage read(String fixture) {
        return new IsoMessageReader(MessageFixtures.load(fixture)).readDetailed();
    }

    @Test
    public void testStatementBalancesAndEntries() {
        Camt053Message message = assertInstanceOf(Camt053Message.class, read("camt053.xml"));

        assertEquals("STMT-MSG-1", message.getMessageId());
        assertEquals("STMT-1", message.getStatementId());
        assertEquals("2023-10-25T06:00:00Z", message.getCreationDateTime());
        assertEquals("GB29NWBK60161331926819", message.getAccountId());
        assertEquals("GBP", message.getAccountCurrency());
        assertEquals("ACME Corp", message.getAccountOwner());
        assertEquals("NWBKGB2L", message.getAccountServicer());
        assertEquals(1, message.getTotalCreditEntries());
        assertEquals("1000.50", message.getTotalCreditAmount());
        assertEquals(1, message.getTotalDebitEntries());
        assertEquals("500.00", message.getTotalDebitAmount());

        assertEquals(2, message.getBalances().size());
        Map<String, String> closing = message.getBalances().get(1);
        assertEquals("CLBD", closing.get("type"));
        assertEquals("5500.50", closing.get("amount"));
        assertEquals("2023-10-25", closing.get("date"));

        assertEquals(2, message.getEntries().size());
        Map<String, String> credit = message.getEntries().get(0);
        assertEquals("REF1", credit.get("reference"));
        assertEquals("CRDT", credit.get("credit_debit_indicator"));
        assertEquals("BOOK", credit.get("status"));
        assertEquals("NTRF", credit.get("transaction_type"));
        assertEquals("E2E-IN-1", credit.get("end_to_end_id"));
        assertEquals("SALARY PAYMENT", credit.get("remittance"));
        assertNull(message.getEntries().get(1).get("remittance"));
    }

    @Test
    public void testAccountReportUsesReportBlock() {
        Camt052Message message = assertInstanceOf(Camt052Message.class, read("camt052.xml"));

        assertEquals("RPT-1", message.getReportId());
        assertEquals("ACCT123456", message.getAccountId());
        assertEquals("PDNG", message.getEntries().get(0).get("status"));
        assertTrue(message.getBalances().isEmpty());
        assertNull(message.getTotalCreditEntries());
    }

    @Test
    public void testNotificationEntries() {
        Camt054Message message = assertInstanceOf(Camt054Message.class, read("camt054.xml"));

        assertEquals("NTF-1", message.getNotificationId());
        assertEquals("99.50", message.getAmount());
        assertEquals("FEETX", message.getEndToEndId());
        assertEquals("FEETX", message.getEntries().get(0).get("end_to_end_id"));
    }

    @Test
    public void testReturnAccount() {
        Camt004Message message = assertInstanceOf(Camt004Message.class, read("camt004.xml"));

        assertEquals("RTRACCT-1", message.getMessageId());
        assertEquals("2023-10-26T12:00:00Z", message.getCreationDateTime());
        assertEquals("QRY-1", message.getOriginalBusinessQuery());
        assertEquals("GB29NWBK60161331926819", message.getAccountId());
        assertEquals("ENAB", message.getAccountStatus());
        assertEquals("GBP", message.getAccountCurrency());

        Map<String, String> balance = message.getBalances().get(0);
        assertEquals("XPCD", balance.get("type"));
        assertEquals("12000.00", balance.get("amount"));
        assertEquals("GBP", balance.get("currency"));
        assertEquals("CRDT", balance.get("credit_debit_indicator"));

        assertEquals("BILI", message.getLimits().get(0).get("type"));
        assertEquals("50000.00", message.getLimits().get(0).get("amount"));
        assertEquals("X001", message.getBusinessErrors().get(0).get("code"));
        assertEquals("Partial data", message.getBusinessErrors().get(0).get("description"));
    }

    @Test
    public void testRecallRequest() {
        Camt056Message recall = assertInstanceOf(Camt056Message.class, read("camt056.xml"));

        assertEquals("ASS-99", recall.getMessageId());
        assertEquals("ASS-99", recall.getAssignmentId());
        assertEquals("CASE-ABC", recall.getCaseId());
        assertEquals("PAYMENT-101", recall.getOriginalMessageId());
        assertEquals("550e8400-e29b-41d4-a716-446655440000", recall.getUetr());
        assertEquals("E2E-REF-001", recall.getEndToEndId());
        assertNull(recall.getRecallReason());
        assertEquals(1, recall.getUnderlyingTransactions().size());
        assertEquals("E2E-REF-001", recall.getUnderlyingTransactions().get(0).get("original_end_to_end_id"));
    }

    @Test
    public void testResolutionOfInvestigation() {
        Camt029Message resolution = assertInstanceOf(Camt029Message.class, read("camt029.xml"));

        assertEquals("CASE-ABC", resolution.getCaseId());
        assertEquals("Accepted", resolution.getInvestigationStatus());
        assertEquals("Cancelled", resolution.getCancellationDetails().get(0).get("transaction_cancellation_status"));
    }

    @Test
    public void testBillingStatement() {
        Camt086Message message = assertInstanceOf(Camt086Message.class, read("camt086.xml"));

        assertEquals("RPT-12345", message.getReportId());
        assertEquals("GRP-54321", message.getGroupId());
        assertEquals("STMT-999", message.getStatementId());
        assertEquals("2023-11-20T10:00:00Z", message.getCreationDateTime());
        assertEquals("ORGN", message.getStatementStatus());
    }

    @Test
    public void testBillingStatementWithOptionalPartsMissing() {
        String xml = "<Document xmlns=\"urn:iso:std:iso:20022:tech:xsd:camt.086.001.05\">"
            + "<BkSrvcsBllgStmt><RptHdr></RptHdr><BllgStmtGrp><BllgStmt><StmtId>STMT-ONLY</StmtId>"
            + "</BllgStmt></BllgStmtGrp></BkSrvcsBllgStmt></Document>";

        Camt086Message message = assertInstanceOf(Camt086Message.class,
            new IsoMessageReader(MessageFixtures.bytes(xml)).readDetailed());

        assertNull(message.getReportId());
        assertNull(message.getGroupId());
        assertEquals("STMT-ONLY", message.getStatementId());
        assertNull(message.getCreationDateTime());
        assertNull(message.getStatementStatus());
    }
}
