package ch.so.agi.rlog.utils;

/**
 * Baseclass for all exceptions thrown by the logging facade itself.
 *
 * The type classifies the failure so callers can react to configuration
 * errors without parsing messages.
 */
public class RLogException extends RuntimeException {

    public static final String HANDLER_NOT_SET = "HANDLER_NOT_SET";

    private final String type;

    public RLogException(String type, String message) {
        super(message);
        this.type = type;
    }

    public String getType() {
        return this.type;
    }
}
