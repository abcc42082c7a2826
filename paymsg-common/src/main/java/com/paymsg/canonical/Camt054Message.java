package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Set;

/**
 * Bank to customer debit/credit notification (camt.054).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Camt054Message extends AccountReport {

    public static final Set<String> FIELDS = reportFieldsWith(
        "notification_id");

    private String notificationId;

    @Override
    public MessageFamily family() {
        return MessageFamily.CAMT_054;
    }
}
