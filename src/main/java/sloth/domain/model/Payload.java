package sloth.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * What a resource hands back as the body of its response.
 * <p>
 * Text and bytes are written as they are. Anything else is a {@link Structured}
 * value and gets serialized to JSON.
 */
public sealed interface Payload permits Payload.Text, Payload.Bytes, Payload.Structured {

    static Payload text(String text) { return new Text(text); }

    static Payload bytes(byte[] bytes) { return new Bytes(bytes); }

    static Payload structured(Object value) { return new Structured(value); }

    static Payload empty() { return new Text(""); }

    record Text(String value) implements Payload {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        public byte[] toBytes() { return value.getBytes(StandardCharsets.UTF_8); }
    }

    record Bytes(byte[] value) implements Payload {
        public Bytes {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() { return Arrays.hashCode(value); }

        @Override
        public String toString() { return "Bytes[length=" + value.length + "]"; }
    }

    /** A value for the JSON encoder; {@code null} encodes as {@code null}. */
    record Structured(Object value) implements Payload {}
}
