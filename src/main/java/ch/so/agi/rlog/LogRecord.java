package ch.so.agi.rlog;

import java.util.List;

/**
 * Immutable structured log event handed to a {@link LogHandler}. A record is
 * built once per logging call and is not retained by the facade afterwards.
 */
public final class LogRecord {

    private final String message;
    private final LogLevel level;
    private final List<LogAttr> attrs;

    public LogRecord(String message, LogLevel level, List<LogAttr> attrs) {
        if (level == null)
            throw new IllegalArgumentException("level must not be null");

        this.message = message == null ? "" : message;
        this.level = level;
        this.attrs = attrs == null ? List.of() : List.copyOf(attrs);
    }

    public String getMessage() {
        return message;
    }

    public LogLevel getLevel() {
        return level;
    }

    /**
     * @return the attributes in insertion order; the list is unmodifiable
     */
    public List<LogAttr> getAttrs() {
        return attrs;
    }

    /**
     * Returns the value of the first attribute with the given key.
     *
     * @param key attribute key
     * @return the value, or {@code null} if absent or explicitly {@code null}
     */
    public Object getAttr(String key) {
        for (LogAttr attr : attrs) {
            if (attr.getKey().equals(key)) {
                return attr.getValue();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "[" + level + "] " + message + " " + attrs;
    }
}
