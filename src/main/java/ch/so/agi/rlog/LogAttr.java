package ch.so.agi.rlog;

import java.util.Objects;

/**
 * A single key/value attribute of a {@link LogRecord}. The value is opaque to
 * the facade and may be {@code null}.
 */
public final class LogAttr {

    private final String key;
    private final Object value;

    private LogAttr(String key, Object value) {
        if (key == null)
            throw new IllegalArgumentException("key must not be null");

        this.key = key;
        this.value = value;
    }

    public static LogAttr of(String key, Object value) {
        return new LogAttr(key, value);
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogAttr)) {
            return false;
        }
        LogAttr other = (LogAttr) o;
        return key.equals(other.key) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
