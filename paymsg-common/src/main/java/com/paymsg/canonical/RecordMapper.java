package com.paymsg.canonical;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson mapper for converting records to and from snake_case maps.
 */
final class RecordMapper {

    static final ObjectMapper MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private RecordMapper() {
    }

    static Map<String, Object> toMap(PaymentMessage message) {
        return MAPPER.convertValue(message, MAP_TYPE);
    }
}
