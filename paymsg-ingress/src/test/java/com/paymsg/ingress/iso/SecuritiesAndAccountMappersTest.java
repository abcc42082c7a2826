package com.paymsg.ingress.iso;

import com.paymsg.canonical.Acmt007Message;
import com.paymsg.canonical.Acmt015Message;
import com.paymsg.canonical.Fxtr014Message;
import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.Sese023Message;
import com.paymsg.canonical.Setr004Message;
import com.paymsg.canonical.Setr010Message;
import com.paymsg.ingress.MessageFixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SecuritiesAndAccountMappersTest {

    private static PaymentMessage read(String fixture) {
        return new IsoMessageReader(MessageFixtures.load(fixture)).readDetailed();
    }

    @Test
    public void testForeignExchangeTrade() {
        Fxtr014Message message = assertInstanceOf(Fxtr014Message.class, read("fxtr014.xml"));

        assertEquals("2023-11-01", message.getTradeDate());
        assertEquals("2023-11-03", message.getSettlementDate());
        assertEquals("CITIUS33", message.getTradingParty());
        assertEquals("DEUTSCHE BANK AG", message.getCounterparty());
        assertEquals("1.1000", message.getExchangeRate());
        assertEquals("1500000.00", message.getTradedAmount());
        assertEquals("EUR", message.getTradedCurrency());
        assertEquals("1650000.00", message.getCounterAmount());
        assertEquals("USD", message.getCounterCurrency());
    }

    @Test
    public void testSecuritiesSettlementInstruction() {
        Sese023Message message = assertInstanceOf(Sese023Message.class, read("sese023.xml"));

        assertEquals("2023-10-15", message.getTradeDate());
        assertEquals("2023-10-18", message.getSettlementDate());
        assertEquals("US0378331005", message.getSecurityId());
        assertEquals("ISIN", message.getSecurityIdType());
        assertEquals("1000", message.getSecurityQuantity());
        assertEquals("Unit", message.getSecurityQuantityType());
        assertEquals("175000.00", message.getSettlementAmount());
        assertEquals("USD", message.getSettlementCurrency());
        assertEquals("CHASUS33", message.getDeliveringAgent());
        assertEquals("Vanguard Group", message.getReceivingAgent());
    }

    @Test
    public void testRedemptionOrdersInUnitsOrAmount() {
        Setr004Message message = assertInstanceOf(Setr004Message.class, read("setr004.xml"));

        assertEquals("MSTR-RED-8899", message.getMasterReference());
        assertEquals("POOL-009", message.getPoolReference());
        assertEquals("2023-11-06T14:32:00Z", message.getCreationDateTime());
        assertEquals(2, message.getOrders().size());

        Map<String, String> units = message.getOrders().get(0);
        assertEquals("ORD-8899-1", units.get("order_reference"));
        assertEquals("ACCT-12345", units.get("investment_account_id"));
        assertEquals("US0378331005", units.get("financial_instrument_id"));
        assertEquals("150.5", units.get("units"));
        assertNull(units.get("amount"));

        Map<String, String> amount = message.getOrders().get(1);
        assertNull(amount.get("units"));
        assertEquals("50000.00", amount.get("amount"));
        assertEquals("USD", amount.get("currency"));
    }

    @Test
    public void testSubscriptionOrder() {
        Setr010Message message = assertInstanceOf(Setr010Message.class, read("setr010.xml"));

        assertEquals("MSTR-SUB-7766", message.getMasterReference());
        assertEquals("POOL-SUB-001", message.getPoolReference());
        assertEquals(1, message.getOrders().size());
        assertEquals("ACCT-99999", message.getOrders().get(0).get("investment_account_id"));
        assertEquals("25000.00", message.getOrders().get(0).get("amount"));
        assertEquals("EUR", message.getOrders().get(0).get("currency"));
        assertNull(message.getOrders().get(0).get("units"));
    }

    @Test
    public void testAccountOpeningRequest() {
        Acmt007Message message = assertInstanceOf(Acmt007Message.class, read("acmt007.xml"));

        assertEquals("MSG-111", message.getMessageId());
        assertEquals("PRC-777", message.getProcessId());
        assertEquals("ACC-123", message.getAccountId());
        assertEquals("USD", message.getAccountCurrency());
        assertEquals("BANKDEF", message.getAccountServicer());
        assertEquals("Acme Corp", message.getOrganizationName());
        assertEquals("Downtown Branch", message.getBranchName());
    }

    @Test
    public void testMandateMaintenanceRequestWithNestedLegalName() {
        Acmt015Message message = assertInstanceOf(Acmt015Message.class, read("acmt015.xml"));

        assertEquals("PRC-888", message.getProcessId());
        assertEquals("AA11222233334444555566667777", message.getAccountId());
        assertEquals("Globex Inc", message.getOrganizationName());
        assertEquals("Uptown Branch", message.getBranchName());
    }
}
