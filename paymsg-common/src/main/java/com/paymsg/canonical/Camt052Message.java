package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bank to customer account report (camt.052).
 *
 * Also produced from SWIFT MT942 interim transaction reports.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Camt052Message extends AccountReport implements HasBalances {

    public static final Set<String> FIELDS = reportFieldsWith(
        "report_id", "balances");

    private String reportId;

    @Builder.Default
    private List<Map<String, String>> balances = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.CAMT_052;
    }
}
