package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Format-agnostic payment record shared by every message family.
 *
 * Produced from ISO 20022 XML as well as SWIFT MT text. Every field is
 * optional: a null value means the element was not present in the source.
 * Amounts are kept as the literal decimal text of the message so no precision
 * is lost on the way through.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public class PaymentMessage {

    /**
     * Snake_case names of the fields declared on this record, used when
     * building records from loose maps.
     */
    public static final Set<String> FIELDS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
        "message_id", "end_to_end_id", "uetr", "amount", "currency",
        "sender_bic", "receiver_bic", "debtor_name", "creditor_name",
        "debtor_address", "creditor_address", "debtor_account", "creditor_account")));

    /**
     * Message identifier (GrpHdr/MsgId, Field 20, or the header BizMsgIdr).
     */
    private String messageId;

    /**
     * End-to-end identification carried unchanged through the chain.
     */
    private String endToEndId;

    /**
     * Unique end-to-end transaction reference (UUID v4).
     */
    private String uetr;

    /**
     * Amount as decimal text with a period separator.
     */
    private String amount;

    /**
     * ISO 4217 currency code.
     */
    private String currency;

    private String senderBic;

    private String receiverBic;

    private String debtorName;

    private String creditorName;

    private PostalAddress debtorAddress;

    private PostalAddress creditorAddress;

    private String debtorAccount;

    private String creditorAccount;

    /**
     * The family this record represents.
     */
    public MessageFamily family() {
        return MessageFamily.BASE;
    }

    /**
     * Converts the record to an ordered map keyed by snake_case field names.
     * Absent fields are present with a null value; nested addresses become maps.
     */
    public Map<String, Object> toMap() {
        return RecordMapper.toMap(this);
    }

    /**
     * Copies the base fields of this record into a family builder.
     */
    public <B extends PaymentMessageBuilder<?, ?>> B seed(B builder) {
        builder.messageId(messageId);
        builder.endToEndId(endToEndId);
        builder.uetr(uetr);
        builder.amount(amount);
        builder.currency(currency);
        builder.senderBic(senderBic);
        builder.receiverBic(receiverBic);
        builder.debtorName(debtorName);
        builder.creditorName(creditorName);
        builder.debtorAddress(debtorAddress);
        builder.creditorAddress(creditorAddress);
        builder.debtorAccount(debtorAccount);
        builder.creditorAccount(creditorAccount);
        return builder;
    }

    protected static Set<String> fieldsWith(String... names) {
        Set<String> fields = new LinkedHashSet<>(FIELDS);
        Collections.addAll(fields, names);
        return Collections.unmodifiableSet(fields);
    }
}
