package com.paymsg.ingress.iso;

import com.paymsg.canonical.PaymentMessage;
import com.paymsg.ingress.common.FieldExtractor;

/**
 * Maps the payload of one ISO 20022 family onto its dedicated record.
 *
 * Implementations start from the already extracted base record so every
 * specialized record carries the base fields too. Missing elements become
 * null fields or empty lists; mappers never throw on data.
 */
public interface FamilyMapper {

    PaymentMessage map(PaymentMessage base, FieldExtractor fields);
}
