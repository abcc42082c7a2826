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
 * Redemption order (setr.004).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Setr004Message extends PaymentMessage implements HasOrders {

    public static final Set<String> FIELDS = fieldsWith(
        "creation_date_time", "master_reference", "pool_reference", "orders");

    private String creationDateTime;

    private String masterReference;

    private String poolReference;

    @Builder.Default
    private List<Map<String, String>> orders = new ArrayList<>();

    @Override
    public MessageFamily family() {
        return MessageFamily.SETR_004;
    }
}
