package ch.so.agi.rlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * {@link LogHandler} that bridges to SLF4J. Records are emitted through the
 * fluent event API, so attributes arrive at the backend as real key/value
 * pairs rather than being flattened into the message.
 */
public class Slf4jLogHandler implements LogHandler {

    private final Logger logger;

    public Slf4jLogHandler() {
        this(LoggerFactory.getLogger(JulLogHandler.DEFAULT_LOGGER_NAME));
    }

    public Slf4jLogHandler(Logger logger) {
        if (logger == null)
            throw new IllegalArgumentException("logger must not be null");

        this.logger = logger;
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        switch (level) {
            case DEBUG:
                return logger.isDebugEnabled();
            case INFO:
                return logger.isInfoEnabled();
            case WARN:
                return logger.isWarnEnabled();
            default:
                return logger.isErrorEnabled();
        }
    }

    @Override
    public void handle(LogRecord record) {
        LoggingEventBuilder event = logger.atLevel(toSlf4jLevel(record.getLevel()));
        for (LogAttr attr : record.getAttrs()) {
            if (attr.getValue() instanceof Throwable) {
                event = event.setCause((Throwable) attr.getValue());
            }
            event = event.addKeyValue(attr.getKey(), attr.getValue());
        }
        event.log(record.getMessage());
    }

    static Level toSlf4jLevel(LogLevel level) {
        switch (level) {
            case DEBUG:
                return Level.DEBUG;
            case INFO:
                return Level.INFO;
            case WARN:
                return Level.WARN;
            default:
                return Level.ERROR;
        }
    }
}
