package com.paymsg.ingress.iso;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.canonical.Setr004Message;
import com.paymsg.canonical.Setr010Message;
import com.paymsg.canonical.enums.MessageFamily;
import com.paymsg.ingress.common.FieldExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.paymsg.ingress.iso.IsoFields.row;

/**
 * Mapper for investment fund orders: setr.004 (redemption) and setr.010
 * (subscription). An order is quantified either in units or as an amount;
 * the other side stays null.
 */
public class FundOrderMapper implements FamilyMapper {

    private static final String AMOUNT = "ns:OrdrQty/ns:AmtdQty | ns:OrdrQty/ns:OrdrAmt | ns:GrssAmt | ns:NetAmt";
    private static final String CURRENCY =
        "ns:OrdrQty/ns:AmtdQty/@Ccy | ns:OrdrQty/ns:OrdrAmt/@Ccy | ns:GrssAmt/@Ccy | ns:NetAmt/@Ccy";

    private final MessageFamily family;

    public FundOrderMapper(MessageFamily family) {
        this.family = family;
    }

    @Override
    public PaymentMessage map(PaymentMessage base, FieldExtractor fields) {
        String creationDateTime = fields.text(".//ns:MsgId/ns:CreDtTm");
        String masterReference = fields.text(".//ns:MltplOrdrDtls/ns:MstrRef");
        String poolReference = fields.text(".//ns:PoolRef/ns:Ref");
        List<Map<String, String>> orders = extractOrders(fields);

        if (family == MessageFamily.SETR_010) {
            return base.seed(Setr010Message.builder())
                .creationDateTime(creationDateTime)
                .masterReference(masterReference)
                .poolReference(poolReference)
                .orders(orders)
                .build();
        }
        return base.seed(Setr004Message.builder())
            .creationDateTime(creationDateTime)
            .masterReference(masterReference)
            .poolReference(poolReference)
            .orders(orders)
            .build();
    }

    private static List<Map<String, String>> extractOrders(FieldExtractor fields) {
        List<Map<String, String>> orders = new ArrayList<>();
        for (Element order : fields.nodes(".//ns:IndvOrdrDtls")) {
            orders.add(row(
                "order_reference", fields.text(order, "ns:OrdrRef"),
                "investment_account_id", fields.text(order,
                    "ns:InvstmtAcctDtls/ns:AcctId/ns:Prtry/ns:Id | ns:InvstmtAcctDtls/ns:AcctId"),
                "financial_instrument_id", fields.text(order,
                    "ns:FinInstrmDtls/ns:Id/ns:ISIN | ns:FinInstrmDtls/ns:Id/ns:OthrPrtryId/ns:Id"),
                "units", fields.text(order, "ns:OrdrQty/ns:UnitQty | ns:OrdrQty/ns:UnitsNb/ns:Unit"),
                "amount", fields.text(order, AMOUNT),
                "currency", fields.text(order, CURRENCY)));
        }
        return orders;
    }
}
