package sloth.common;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A slot that can be filled exactly once. Filling it again throws the
 * exception built by the supplied factory, and the first value stays.
 * Not thread-safe; meant for single-threaded setup code.
 */
public final class WriteOnce<T> {

    private final Supplier<? extends RuntimeException> alreadySet;
    private T value;

    public WriteOnce(Supplier<? extends RuntimeException> alreadySet) {
        this.alreadySet = Objects.requireNonNull(alreadySet, "alreadySet");
    }

    public boolean isSet() { return value != null; }

    /** The value, or null while empty. */
    public T get() { return value; }

    public void set(T newValue) {
        Objects.requireNonNull(newValue, "value");
        if (value != null) throw alreadySet.get();
        value = newValue;
    }

    /** Returns the value, filling the slot from {@code initial} first if it is empty. */
    public T getOrSet(Supplier<? extends T> initial) {
        if (value == null) set(initial.get());
        return value;
    }
}
