package ch.so.agi.rlog;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link RLogger} bound to one handler and one module name. Instances are
 * immutable; the handler is fixed at retrieval time and later changes of the
 * environment do not affect them.
 */
final class ModuleLogger implements RLogger {

    private final String module;
    private final LogHandler handler;

    ModuleLogger(String module, LogHandler handler) {
        if (module == null || module.isBlank())
            throw new IllegalArgumentException("module must not be blank");
        if (handler == null)
            throw new IllegalArgumentException("handler must not be null");

        this.module = module;
        this.handler = handler;
    }

    @Override
    public void log(LogLevel level, String msg, Object... keyValues) {
        if (level == null)
            throw new IllegalArgumentException("level must not be null");
        if (!handler.isEnabled(level)) {
            return;
        }

        int count = keyValues == null ? 0 : keyValues.length;
        if (count % 2 != 0) {
            throw new IllegalArgumentException(
                    "Attributes must be key/value pairs, got " + count + " arguments");
        }

        // +1 for the module attribute
        List<LogAttr> attrs = new ArrayList<>(count / 2 + 1);
        for (int i = 0; i < count; i += 2) {
            if (!(keyValues[i] instanceof String)) {
                throw new IllegalArgumentException("Attribute key at position " + i
                        + " must be a String, got " + describe(keyValues[i]));
            }
            attrs.add(LogAttr.of((String) keyValues[i], keyValues[i + 1]));
        }
        dispatch(level, msg, attrs);
    }

    @Override
    public void logAttrs(LogLevel level, String msg, List<LogAttr> attrs) {
        if (level == null)
            throw new IllegalArgumentException("level must not be null");
        if (!handler.isEnabled(level)) {
            return;
        }

        List<LogAttr> copy = new ArrayList<>(attrs == null ? 1 : attrs.size() + 1);
        if (attrs != null) {
            for (LogAttr attr : attrs) {
                if (attr == null)
                    throw new IllegalArgumentException("attrs must not contain null");
                copy.add(attr);
            }
        }
        dispatch(level, msg, copy);
    }

    @Override
    public String module() {
        return module;
    }

    LogHandler getHandler() {
        return handler;
    }

    private void dispatch(LogLevel level, String msg, List<LogAttr> attrs) {
        attrs.add(LogAttr.of(LogEnvironment.ATTR_KEY_MODULE, module));
        handler.handle(new LogRecord(msg, level, attrs));
    }

    private static String describe(Object key) {
        return key == null ? "null" : key.getClass().getName();
    }

    @Override
    public String toString() {
        return "ModuleLogger[" + module + "]";
    }
}
