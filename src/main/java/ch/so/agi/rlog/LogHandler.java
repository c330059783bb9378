package ch.so.agi.rlog;

/**
 * Backend capability the facade delegates to. Implementations decide which
 * severities are active and perform the actual delivery; the facade itself
 * never does any I/O.
 * <p>
 * Both methods are called synchronously on the logging thread, so
 * implementations must be thread-safe if loggers are shared across threads.
 */
public interface LogHandler {

    /**
     * Checked before a record is built. Returning {@code false} suppresses the
     * call without any attribute processing.
     *
     * @param level severity of the pending call
     * @return {@code true} if records of this level should be delivered
     */
    public boolean isEnabled(LogLevel level);

    /**
     * Delivers a record. Failures are the handler's own business; anything
     * thrown here propagates to the logging caller.
     *
     * @param record the record to deliver, never {@code null}
     */
    public void handle(LogRecord record);
}
