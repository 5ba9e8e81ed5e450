package io.hivememory.learning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.hivememory.core.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Maps a feature map to a stable state key: keys sorted, numbers bucketed to one
 * decimal, joined as {@code k=v|k=v}. Nested maps and lists are written as JSON with
 * their map keys sorted. NaN and the infinities keep their names.
 */
public final class StateDiscretizer {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private StateDiscretizer() {
    }

    public static String stateKey(Map<String, ?> features) {
        if (features == null || features.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("|");
        new TreeMap<String, Object>(features).forEach((key, value) -> joiner.add(key + "=" + bucket(value)));
        return joiner.toString();
    }

    static String bucket(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d)
                    .setScale(1, RoundingMode.HALF_UP)
                    .toPlainString();
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return CANONICAL.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new ValidationException("State feature is not serializable: " + e.getOriginalMessage());
            }
        }
        return String.valueOf(value);
    }
}
