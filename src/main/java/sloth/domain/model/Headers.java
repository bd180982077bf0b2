package sloth.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Ordered multimap of HTTP header names to values.
 * <p>
 * Names are stored in canonical form ({@code content-type} becomes
 * {@code Content-Type}) so lookups are case-insensitive.
 * Not thread-safe.
 */
public final class Headers {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";

    private final Map<String, List<String>> values = new LinkedHashMap<>();

    public Headers() {}

    public static Headers empty() { return new Headers(); }

    /** Builds headers from alternating name/value arguments. */
    public static Headers of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Headers h = new Headers();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            h.add(namesAndValues[i], namesAndValues[i + 1]);
        }
        return h;
    }

    /** @throws IllegalArgumentException if {@code name} is not a valid header field name */
    public Headers add(String name, String value) {
        values.computeIfAbsent(canonical(requireValidName(name)), k -> new ArrayList<>()).add(value);
        return this;
    }

    /** Replaces every value of {@code name} with the single {@code value}. */
    public Headers set(String name, String value) {
        List<String> list = new ArrayList<>();
        list.add(value);
        values.put(canonical(requireValidName(name)), list);
        return this;
    }

    /** First value of the header, or {@code null} if it is absent. */
    public String get(String name) {
        List<String> list = values.get(canonical(name));
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    public List<String> values(String name) {
        List<String> list = values.get(canonical(name));
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /** Drops every value of {@code name}. */
    public Headers remove(String name) {
        values.remove(canonical(name));
        return this;
    }

    public boolean contains(String name) {
        return values.containsKey(canonical(name));
    }

    public Set<String> names() { return Collections.unmodifiableSet(values.keySet()); }

    public boolean isEmpty() { return values.isEmpty(); }

    /** Calls {@code action} once per (name, value) pair, in insertion order. */
    public void forEach(BiConsumer<String, String> action) {
        for (Map.Entry<String, List<String>> e : values.entrySet()) {
            for (String v : e.getValue()) action.accept(e.getKey(), v);
        }
    }

    public Headers copy() {
        Headers h = new Headers();
        forEach(h::add);
        return h;
    }

    /** True if {@code name} is a non-empty RFC 7230 token. */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) return false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean token = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
            if (!token) return false;
        }
        return true;
    }

    private static String requireValidName(String name) {
        if (!isValidName(name)) throw new IllegalArgumentException("invalid header name: \"" + name + "\"");
        return name;
    }

    /**
     * Canonical header name: first letter and every letter after a hyphen
     * upper case, the rest lower case. Names containing spaces or other
     * non-token characters are returned unchanged.
     */
    public static String canonical(String name) {
        if (name == null) throw new IllegalArgumentException("header name is null");
        char[] chars = name.toCharArray();
        boolean upper = true;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c == ' ' || c > 127) return name;
            chars[i] = upper ? Character.toUpperCase(c) : Character.toLowerCase(c);
            upper = c == '-';
        }
        return new String(chars);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Headers other && values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return values.toString(); }
}
