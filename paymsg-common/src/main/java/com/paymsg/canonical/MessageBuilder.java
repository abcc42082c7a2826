package com.paymsg.canonical;

import com.paymsg.canonical.enums.MessageFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds typed records from a family key and a loose field map.
 *
 * Keys the target record does not declare are ignored. Values that cannot be
 * coerced to the declared field type are dropped with a warning, so building
 * never fails on data; the worst case is a record with fewer fields set.
 */
public final class MessageBuilder {

    private static final Logger log = LoggerFactory.getLogger(MessageBuilder.class);

    private MessageBuilder() {
    }

    /**
     * Builds the record for {@code schemaKey} ("pacs.008", "camt.053", ...).
     * Unknown keys produce a base {@link PaymentMessage}.
     *
     * @param schemaKey family key, matched case-insensitively
     * @param fields snake_case field values, e.g. {@code message_id}
     * @return populated record, never null
     */
    public static PaymentMessage build(String schemaKey, Map<String, ?> fields) {
        MessageFamily family = MessageFamily.fromKey(schemaKey);
        if (family == MessageFamily.BASE && schemaKey != null && !"base".equalsIgnoreCase(schemaKey.trim())) {
            log.debug("No dedicated record for schema {}, building base record", schemaKey);
        }
        Class<? extends PaymentMessage> type = family.getRecordType();

        Map<String, Object> accepted = new LinkedHashMap<>();
        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                if (family.getFields().contains(entry.getKey())) {
                    accepted.put(entry.getKey(), entry.getValue());
                }
            }
        }

        try {
            return RecordMapper.MAPPER.convertValue(accepted, type);
        } catch (IllegalArgumentException e) {
            log.debug("Bulk conversion to {} failed, retrying field by field: {}", type.getSimpleName(), e.getMessage());
        }

        Map<String, Object> coercible = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : accepted.entrySet()) {
            try {
                RecordMapper.MAPPER.convertValue(
                    Collections.singletonMap(entry.getKey(), entry.getValue()), type);
                coercible.put(entry.getKey(), entry.getValue());
            } catch (IllegalArgumentException e) {
                log.warn("Dropping field {} for {}: value cannot be converted ({})",
                    entry.getKey(), family.getKey(), e.getMessage());
            }
        }
        return RecordMapper.MAPPER.convertValue(coercible, type);
    }
}
