package ai.sessionkeeper.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Canonical forms for free-form values stored in JSON maps, matching what {@link Json#mapper()} reads back:
 * integral numbers become {@code Long} (or {@code BigInteger} past 64 bits), other numbers {@code Double}, maps
 * and collections are copied recursively. Values outside the JSON model are left alone.
 */
public final class JsonValues {
    private JsonValues() {}

    public static @Nullable Object normalize(@Nullable Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), normalize(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            var copy = new ArrayList<Object>(collection.size());
            collection.forEach(v -> copy.add(normalize(v)));
            return copy;
        }
        return value;
    }

    /** Unmodifiable normalized copy of a string-keyed map. Null values are kept. */
    public static Map<String, Object> normalizeMap(Map<String, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> copy.put(k, normalize(v)));
        return Collections.unmodifiableMap(copy);
    }
}
