package org.webmev.structures.shared;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed values (maps, lists, boxed scalars) produced by a JSON decoder.
 */
public final class Values {
    private Values() {}

    /**
     * Deep copy of maps and lists; scalars are shared.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * Returns a mutable deep copy of {@code value} when it is a map, otherwise {@code null}.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) deepCopy(value);
        }
        return null;
    }

    public static boolean isIntegral(Object value) {
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64;
        }
        return value instanceof Long
            || value instanceof Integer
            || value instanceof Short
            || value instanceof Byte;
    }

    /**
     * True for any JSON number (integral or floating point). Booleans are not numbers.
     */
    public static boolean isNumber(Object value) {
        return isIntegral(value)
            || value instanceof Double
            || value instanceof Float
            || value instanceof BigDecimal;
    }

    public static long toLong(Object value) {
        return ((Number) value).longValue();
    }

    public static double toDouble(Object value) {
        return ((Number) value).doubleValue();
    }

    /**
     * Renders a value for inclusion in an error message.
     */
    public static String describe(Object value) {
        if (value instanceof String str) {
            return "\"" + str + "\"";
        }
        return String.valueOf(value);
    }
}
