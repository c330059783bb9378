package ch.so.agi.rlog;

/**
 * Severity of a log record. Constants are declared in ascending order of
 * severity, so {@link #ordinal()} can be used for threshold comparisons.
 * <p>
 * Each level also carries the {@link java.util.logging.Level} it maps to when
 * records are bridged to {@code java.util.logging}.
 */
public enum LogLevel {

    DEBUG(java.util.logging.Level.FINE),
    INFO(java.util.logging.Level.INFO),
    WARN(java.util.logging.Level.WARNING),
    ERROR(java.util.logging.Level.SEVERE);

    private final java.util.logging.Level innerLevel;

    LogLevel(java.util.logging.Level innerLevel) {
        this.innerLevel = innerLevel;
    }

    /**
     * Checks whether this level is at least as severe as {@code threshold}.
     *
     * @param threshold minimum level
     * @return {@code true} if records of this level pass the threshold
     * @throws IllegalArgumentException if {@code threshold} is {@code null}
     */
    public boolean isAtLeast(LogLevel threshold) {
        if (threshold == null)
            throw new IllegalArgumentException("threshold must not be null");

        return ordinal() >= threshold.ordinal();
    }

    /**
     * Exposes the mapped {@link java.util.logging.Level} for the JUL bridge.
     *
     * @return the mapped {@code java.util.logging.Level}
     */
    java.util.logging.Level getInnerLevel() {
        return innerLevel;
    }
}
