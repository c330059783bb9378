package ch.so.agi.rlog;

import java.util.List;
import java.util.logging.Logger;

/**
 * {@link LogHandler} that delivers records to {@link java.util.logging}. Used
 * for standalone execution and unit tests, where no other backend is wired.
 * <p>
 * Attributes are appended to the message as {@code {key=value, ...}}. An
 * attribute value that is a {@link Throwable} is additionally passed as the
 * thrown of the JUL record.
 */
public class JulLogHandler implements LogHandler {

    public static final String DEFAULT_LOGGER_NAME = "rlog";

    private final Logger logger;
    private final LogLevel minLevel;

    /**
     * Creates a handler writing to the {@value #DEFAULT_LOGGER_NAME} JUL logger
     * and lowers that logger's level to match {@code minLevel}.
     * <p>
     * Only the logger's level is changed. JUL handlers keep their own levels,
     * so with the default {@code ConsoleHandler} (level {@code INFO}) records
     * at {@link LogLevel#DEBUG} are built and delivered to JUL but not
     * printed. Lower the handler's level as well to see them.
     *
     * @param minLevel minimum level to deliver
     */
    public JulLogHandler(LogLevel minLevel) {
        this(Logger.getLogger(DEFAULT_LOGGER_NAME), minLevel);
        this.logger.setLevel(minLevel.getInnerLevel());
    }

    public JulLogHandler(Logger logger, LogLevel minLevel) {
        if (logger == null)
            throw new IllegalArgumentException("logger must not be null");
        if (minLevel == null)
            throw new IllegalArgumentException("minLevel must not be null");

        this.logger = logger;
        this.minLevel = minLevel;
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return level.isAtLeast(minLevel) && logger.isLoggable(level.getInnerLevel());
    }

    @Override
    public void handle(LogRecord record) {
        java.util.logging.LogRecord julRecord =
                new java.util.logging.LogRecord(record.getLevel().getInnerLevel(), render(record));
        julRecord.setLoggerName(logger.getName());
        julRecord.setThrown(findThrown(record.getAttrs()));
        logger.log(julRecord);
    }

    Logger getInnerLogger() {
        return logger;
    }

    static String render(LogRecord record) {
        List<LogAttr> attrs = record.getAttrs();
        if (attrs.isEmpty()) {
            return record.getMessage();
        }

        StringBuilder sb = new StringBuilder(record.getMessage()).append(" {");
        for (int i = 0; i < attrs.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(attrs.get(i));
        }
        return sb.append('}').toString();
    }

    private static Throwable findThrown(List<LogAttr> attrs) {
        for (LogAttr attr : attrs) {
            if (attr.getValue() instanceof Throwable) {
                return (Throwable) attr.getValue();
            }
        }
        return null;
    }
}
