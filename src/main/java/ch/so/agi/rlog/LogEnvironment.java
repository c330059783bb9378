package ch.so.agi.rlog;

import ch.so.agi.rlog.utils.RLogException;

/**
 * Central access point for rlog logging. The environment holds the single
 * process-wide {@link LogHandler}; every {@link RLogger} handed out is bound
 * to the handler that was installed at the time of retrieval.
 * <p>
 * The handler must be installed before any logger is retrieved, typically in
 * {@code main()} before extensions are started. Retrieving a logger without a
 * handler is a programming error and fails with an {@link RLogException}.
 * <p>
 * The slot is a volatile reference: a completed {@link #setDefaultHandler}
 * happens-before every later retrieval on any thread. There is no further
 * coordination, so concurrent installs simply race and the last write wins.
 */
public class LogEnvironment {

    public static final String ATTR_KEY_MODULE = "module";
    public static final String DEFAULT_MODULE_NAME = "default";

    // Holds the installed handler together with the shared default logger.
    private static volatile ModuleLogger defaultLogger = null;

    private LogEnvironment() {}

    /**
     * Installs the process-wide handler, replacing any previous one. Loggers
     * retrieved earlier keep their old binding.
     *
     * @param handler the {@link LogHandler} to use from now on
     * @throws IllegalArgumentException if {@code handler} is {@code null}
     */
    public static void setDefaultHandler(LogHandler handler) {
        if (handler == null)
            throw new IllegalArgumentException("The handler must not be null");

        defaultLogger = new ModuleLogger(DEFAULT_MODULE_NAME, handler);
    }

    /**
     * @return {@code true} once a handler has been installed
     */
    public static boolean isHandlerSet() {
        return defaultLogger != null;
    }

    /**
     * Installs a {@link JulLogHandler} at {@link LogLevel#DEBUG} if no handler
     * was set previously.
     */
    public static void initStandalone() {
        initStandalone(LogLevel.DEBUG);
    }

    /**
     * Installs a {@link JulLogHandler} with the provided threshold if no
     * handler was set previously.
     *
     * @param minLevel desired minimum log level
     */
    public static void initStandalone(LogLevel minLevel) {
        if (defaultLogger == null) {
            setDefaultHandler(new JulLogHandler(minLevel));
        }
    }

    /**
     * Installs an {@link Slf4jLogHandler} if no handler was set previously.
     */
    public static void initSlf4j() {
        if (defaultLogger == null) {
            setDefaultHandler(new Slf4jLogHandler());
        }
    }

    /**
     * Returns the logger of the {@value #DEFAULT_MODULE_NAME} module. The same
     * instance is returned until another handler is installed.
     * <p>
     * The default logger is not live: installing a new handler creates a new
     * default logger, and an instance retrieved before keeps delivering to the
     * previous handler. Retrieve it again after {@link #setDefaultHandler}.
     *
     * @return the default {@link RLogger}
     * @throws RLogException if no handler has been set
     */
    public static RLogger getDefaultLogger() {
        return current();
    }

    /**
     * Returns a logger that tags every record with the given module name.
     * Extensions use this to make their records attributable, since several
     * of them may run inside one application.
     *
     * @param module name of the emitting module
     * @return a new {@link RLogger} bound to the current handler
     * @throws IllegalArgumentException if {@code module} is {@code null} or blank
     * @throws RLogException if no handler has been set
     */
    public static RLogger getLogger(String module) {
        if (module == null || module.isBlank())
            throw new IllegalArgumentException("The module must not be blank");

        return new ModuleLogger(module, current().getHandler());
    }

    /**
     * Returns a logger whose module name is the simple name of the class, or
     * its binary name for anonymous classes.
     *
     * @param logSource the class requesting logging
     * @return a new {@link RLogger} bound to the current handler
     * @throws IllegalArgumentException if {@code logSource} is {@code null}
     * @throws RLogException if no handler has been set
     */
    public static RLogger getLogger(Class<?> logSource) {
        if (logSource == null)
            throw new IllegalArgumentException("The logSource must not be null");

        String name = logSource.getSimpleName();
        // anonymous classes have no simple name
        return getLogger(name.isEmpty() ? logSource.getName() : name);
    }

    private static ModuleLogger current() {
        ModuleLogger logger = defaultLogger;
        if (logger == null) {
            throw new RLogException(RLogException.HANDLER_NOT_SET,
                    "Log handler not set, call LogEnvironment.setDefaultHandler() first");
        }
        return logger;
    }

    /**
     * Removes the installed handler. Only intended for tests.
     */
    static void reset() {
        defaultLogger = null;
    }
}
