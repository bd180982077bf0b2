package sloth.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeadersTest {

    @Test
    void namesAreCanonicalAndLookupIgnoresCase() {
        Headers h = new Headers().add("content-type", "text/plain").add("x-request-ID", "7");

        assertEquals("text/plain", h.get("CONTENT-TYPE"));
        assertEquals("7", h.get("X-Request-Id"));
        assertEquals(List.of("Content-Type", "X-Request-Id"), new ArrayList<>(h.names()));
    }

    @Test
    void addKeepsEveryValueAndSetReplacesThem() {
        Headers h = new Headers().add("Set-Cookie", "a=1").add("set-cookie", "b=2");
        assertEquals(List.of("a=1", "b=2"), h.values("Set-Cookie"));
        assertEquals("a=1", h.get("Set-Cookie"));

        h.set("Set-Cookie", "c=3");
        assertEquals(List.of("c=3"), h.values("Set-Cookie"));
    }

    @Test
    void missingHeaderReadsAsNullAndEmptyList() {
        Headers h = Headers.empty();
        assertNull(h.get("Content-Type"));
        assertTrue(h.values("Content-Type").isEmpty());
        assertFalse(h.contains("Content-Type"));
        assertTrue(h.isEmpty());
    }

    @Test
    void ofTakesPairsAndRejectsOddArguments() {
        Headers h = Headers.of("A", "1", "b", "2");
        assertEquals("1", h.get("a"));
        assertEquals("2", h.get("B"));
        assertThrows(IllegalArgumentException.class, () -> Headers.of("A"));
    }

    @Test
    void forEachVisitsPairsInInsertionOrder() {
        Headers h = Headers.of("Vary", "Accept", "Cache-Control", "no-cache", "Vary", "Origin");
        List<String> seen = new ArrayList<>();
        h.forEach((k, v) -> seen.add(k + "=" + v));
        assertEquals(List.of("Vary=Accept", "Vary=Origin", "Cache-Control=no-cache"), seen);
    }

    @Test
    void invalidNamesAreRejected() {
        Headers h = new Headers();
        assertThrows(IllegalArgumentException.class, () -> h.add("Bad Name", "x"));
        assertThrows(IllegalArgumentException.class, () -> h.add("X-Evil\r\nSet-Cookie", "x"));
        assertThrows(IllegalArgumentException.class, () -> h.set("", "x"));
        assertThrows(IllegalArgumentException.class, () -> h.add(null, "x"));
        assertTrue(h.isEmpty());
        assertTrue(Headers.isValidName("X-Custom_1.0"));
    }

    @Test
    void removeDropsAllValues() {
        Headers h = Headers.of("Vary", "Accept", "vary", "Origin", "A", "1");
        h.remove("VARY");
        assertFalse(h.contains("Vary"));
        assertEquals("1", h.get("A"));
    }

    @Test
    void copyIsIndependent() {
        Headers original = Headers.of("A", "1");
        Headers copy = original.copy().add("B", "2");
        assertFalse(original.contains("B"));
        assertEquals(original, Headers.of("a", "1"));
        assertNotEquals(original, copy);
    }
}
