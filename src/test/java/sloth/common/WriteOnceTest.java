package sloth.common;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WriteOnceTest {

    @Test
    void secondSetFailsAndKeepsFirstValue() {
        WriteOnce<String> cell = new WriteOnce<>(() -> new IllegalStateException("taken"));
        assertFalse(cell.isSet());
        assertNull(cell.get());

        cell.set("first");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> cell.set("second"));
        assertEquals("taken", e.getMessage());
        assertEquals("first", cell.get());
    }

    @Test
    void getOrSetFillsOnlyOnce() {
        WriteOnce<String> cell = new WriteOnce<>(IllegalStateException::new);
        AtomicInteger built = new AtomicInteger();

        assertEquals("v1", cell.getOrSet(() -> "v" + built.incrementAndGet()));
        assertEquals("v1", cell.getOrSet(() -> "v" + built.incrementAndGet()));
        assertEquals(1, built.get());
        assertThrows(IllegalStateException.class, () -> cell.set("other"));
    }

    @Test
    void nullIsNotAValue() {
        WriteOnce<String> cell = new WriteOnce<>(IllegalStateException::new);
        assertThrows(NullPointerException.class, () -> cell.set(null));
        assertFalse(cell.isSet());
    }
}
