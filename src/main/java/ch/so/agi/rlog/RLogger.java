package ch.so.agi.rlog;

import java.util.List;

/**
 * Leveled logging front used by application and extension code.
 * <p>
 * Attributes are passed as alternating keys and values:
 * <pre>
 * log.info("started", "port", 8080, "tls", true);
 * </pre>
 * Keys must be {@link String}s and the list must have an even length,
 * otherwise an {@link IllegalArgumentException} is thrown. Callers that
 * prefer a typed form can use {@link #logAttrs(LogLevel, String, List)}.
 * <p>
 * Every record produced by a logger carries a trailing {@code module}
 * attribute naming the logger's module, so output of several extensions
 * packaged into one application can be told apart.
 */
public interface RLogger {

    public void log(LogLevel level, String msg, Object... keyValues);

    public void logAttrs(LogLevel level, String msg, List<LogAttr> attrs);

    /**
     * @return the module name attached to every record of this logger
     */
    public String module();

    public default void debug(String msg, Object... keyValues) {
        log(LogLevel.DEBUG, msg, keyValues);
    }

    public default void info(String msg, Object... keyValues) {
        log(LogLevel.INFO, msg, keyValues);
    }

    public default void warn(String msg, Object... keyValues) {
        log(LogLevel.WARN, msg, keyValues);
    }

    public default void error(String msg, Object... keyValues) {
        log(LogLevel.ERROR, msg, keyValues);
    }
}
