package io.plinth.core.util;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/// Copy helpers for the loosely typed values carried by plans and node instances.
///
/// Property values are JSON-shaped: maps, lists, strings, numbers, booleans and nulls. Every
/// copy brings a value into the canonical form a JSON round trip produces, so a value reads
/// back the same whether it was kept in memory or written to disk:
/// - maps become `LinkedHashMap`s with `String` keys
/// - collections and arrays become `ArrayList`s (`byte[]` becomes its Base64 text, `char[]`
/// its string)
/// - integral numbers become `Integer`, `Long` or `BigInteger`, whichever is the smallest
/// that holds the value
/// - decimal numbers become `Double`
/// - characters and enum constants become strings
///
/// Null values are preserved, which rules out `Map.copyOf` and `List.copyOf`. Any other value
/// type is rejected with `IllegalArgumentException`.
public final class Values {

    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Values() {}

    /// Returns a recursively copied, mutable version of a value in canonical form.
    ///
    /// @param value the value to copy, may be null
    /// @return a `LinkedHashMap` for maps, an `ArrayList` for collections and arrays, the
    /// canonical scalar otherwise
    /// @throws IllegalArgumentException if the value is not JSON-shaped
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        List<?> elements = elementsOf(value);
        if (elements != null) {
            List<Object> copy = new ArrayList<>(elements.size());
            for (Object element : elements) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return canonicalScalar(value);
    }

    /// Returns a recursively copied, mutable map.
    ///
    /// @param map the map to copy, may be null
    /// @return a new map, empty when `map` is null, never null
    /// @throws IllegalArgumentException if a value is not JSON-shaped
    public static Map<String, Object> mutableCopy(Map<String, ?> map) {
        if (map == null) {
            return new LinkedHashMap<>();
        }
        return copyMap(map);
    }

    /// Returns a recursively copied map in which no level can be modified.
    ///
    /// @param map the map to freeze, may be null
    /// @return an unmodifiable copy, empty when `map` is null, never null
    /// @throws IllegalArgumentException if a value is not JSON-shaped
    public static Map<String, Object> frozenCopy(Map<String, ?> map) {
        if (map == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(keyOf(k), frozenValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    /// Returns a recursively copied value in which no level can be modified.
    ///
    /// @param value the value to freeze, may be null
    /// @return an unmodifiable map or list for containers, the canonical scalar otherwise
    /// @throws IllegalArgumentException if the value is not JSON-shaped
    public static Object frozenValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(keyOf(k), frozenValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        List<?> elements = elementsOf(value);
        if (elements != null) {
            List<Object> copy = new ArrayList<>(elements.size());
            for (Object element : elements) {
                copy.add(frozenValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return canonicalScalar(value);
    }

    private static Map<String, Object> copyMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(keyOf(k), deepCopy(v)));
        return copy;
    }

    private static String keyOf(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Property keys must not be null");
        }
        return key instanceof String text ? text : String.valueOf(canonicalScalar(key));
    }

    /// Returns the elements of a collection or non-byte, non-char array, null for anything else.
    private static List<?> elementsOf(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value == null
                || !value.getClass().isArray()
                || value instanceof byte[]
                || value instanceof char[]) {
            return null;
        }
        int length = Array.getLength(value);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(value, i));
        }
        return elements;
    }

    private static Object canonicalScalar(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return canonicalNumber(number);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof char[] chars) {
            return new String(chars);
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof Character || value instanceof CharSequence) {
            return value.toString();
        }
        throw new IllegalArgumentException(
                "Unsupported property value type: " + value.getClass().getName());
    }

    private static Object canonicalNumber(Number number) {
        if (number instanceof Integer || number instanceof Double) {
            return number;
        }
        if (number instanceof Long
                || number instanceof Short
                || number instanceof Byte
                || number instanceof AtomicInteger
                || number instanceof AtomicLong) {
            return integral(BigInteger.valueOf(number.longValue()));
        }
        if (number instanceof BigInteger big) {
            return integral(big);
        }
        if (number instanceof Float) {
            // the shortest decimal text of the float, as written to JSON
            return Double.parseDouble(number.toString());
        }
        // BigDecimal and other numbers: read their text back as a JSON parser would
        String text = number.toString();
        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            return Double.parseDouble(text);
        }
        try {
            return integral(new BigInteger(text));
        } catch (NumberFormatException e) {
            return number.doubleValue();
        }
    }

    private static Number integral(BigInteger value) {
        if (value.compareTo(INT_MIN) >= 0 && value.compareTo(INT_MAX) <= 0) {
            return value.intValue();
        }
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }
}
