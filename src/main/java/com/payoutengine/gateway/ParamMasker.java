package com.payoutengine.gateway;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Masks bank details, tax ids and document data in call parameters before they are logged.
 */
public final class ParamMasker {

    private static final Set<String> TAIL_ONLY = Set.of("account", "bank_code", "card_number", "phone_number");
    private static final Set<String> HIDDEN = Set.of("passport_number", "passport_series", "snils", "private_key", "document_base64");

    private ParamMasker() {
    }

    public static Map<String, Object> mask(Map<String, ?> params) {
        if (params == null) {
            return Map.of();
        }
        Map<String, Object> masked = new LinkedHashMap<>();
        params.forEach((key, value) -> masked.put(key, maskValue(key, value)));
        return masked;
    }

    private static Map<String, Object> maskNested(Map<?, ?> params) {
        Map<String, Object> masked = new LinkedHashMap<>();
        params.forEach((key, value) -> masked.put(String.valueOf(key), maskValue(String.valueOf(key), value)));
        return masked;
    }

    private static Object maskValue(String key, Object value) {
        if (value instanceof Map) {
            return maskNested((Map<?, ?>) value);
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(item -> maskValue(key, item)).collect(Collectors.toList());
        }
        if (!(value instanceof String)) {
            return value;
        }
        String text = (String) value;
        if (HIDDEN.contains(key)) {
            return "****";
        }
        if (TAIL_ONLY.contains(key) && text.length() >= 4) {
            return "****" + text.substring(text.length() - 4);
        }
        if ("inn".equals(key) && text.length() >= 4) {
            return text.substring(0, 2) + "****" + text.substring(text.length() - 2);
        }
        return text;
    }
}
