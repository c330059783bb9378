package ch.so.agi.rlog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.slf4j.Logger;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

class Slf4jLogHandlerTest {

    private Logger logger;
    private LoggingEventBuilder event;

    @BeforeEach
    void setUp() {
        logger = mock(Logger.class);
        event = mock(LoggingEventBuilder.class);
        when(event.addKeyValue(anyString(), ArgumentMatchers.<Object>any())).thenReturn(event);
        when(event.setCause(any())).thenReturn(event);
    }

    @Test
    void attributesArePassedAsKeyValuePairs() {
        when(logger.isInfoEnabled()).thenReturn(true);
        when(logger.atLevel(Level.INFO)).thenReturn(event);
        RLogger log = new ModuleLogger("http", new Slf4jLogHandler(logger));

        log.info("started", "port", 8080);

        InOrder order = inOrder(event);
        order.verify(event).addKeyValue("port", 8080);
        order.verify(event).addKeyValue("module", "http");
        order.verify(event).log("started");
    }

    @Test
    void nullAttributeValueIsPassedThrough() {
        when(logger.isWarnEnabled()).thenReturn(true);
        when(logger.atLevel(Level.WARN)).thenReturn(event);

        new ModuleLogger("m", new Slf4jLogHandler(logger)).warn("missing", "user", null, "retry", 2);

        InOrder order = inOrder(event);
        order.verify(event).addKeyValue("user", (Object) null);
        order.verify(event).addKeyValue("retry", 2);
        order.verify(event).addKeyValue("module", "m");
        order.verify(event).log("missing");
    }

    @Test
    void disabledLevelDoesNotReachLogger() {
        when(logger.isDebugEnabled()).thenReturn(false);
        RLogger log = new ModuleLogger("m", new Slf4jLogHandler(logger));

        log.debug("x", "k", "v");

        verify(logger, never()).atLevel(any());
    }

    @Test
    void enabledChecksMapToSlf4jLevels() {
        when(logger.isDebugEnabled()).thenReturn(false);
        when(logger.isInfoEnabled()).thenReturn(false);
        when(logger.isWarnEnabled()).thenReturn(true);
        when(logger.isErrorEnabled()).thenReturn(true);
        Slf4jLogHandler handler = new Slf4jLogHandler(logger);

        assertFalse(handler.isEnabled(LogLevel.DEBUG));
        assertFalse(handler.isEnabled(LogLevel.INFO));
        assertTrue(handler.isEnabled(LogLevel.WARN));
        assertTrue(handler.isEnabled(LogLevel.ERROR));
    }

    @Test
    void throwableAttributeIsSetAsCause() {
        when(logger.isErrorEnabled()).thenReturn(true);
        when(logger.atLevel(Level.ERROR)).thenReturn(event);
        IllegalStateException failure = new IllegalStateException("disk full");

        new ModuleLogger("m", new Slf4jLogHandler(logger)).error("write failed", "error", failure);

        verify(event).setCause(failure);
        verify(event).addKeyValue("error", failure);
        verify(event).log("write failed");
    }

    @Test
    void levelMapping() {
        assertEquals(Level.DEBUG, Slf4jLogHandler.toSlf4jLevel(LogLevel.DEBUG));
        assertEquals(Level.INFO, Slf4jLogHandler.toSlf4jLevel(LogLevel.INFO));
        assertEquals(Level.WARN, Slf4jLogHandler.toSlf4jLevel(LogLevel.WARN));
        assertEquals(Level.ERROR, Slf4jLogHandler.toSlf4jLevel(LogLevel.ERROR));
    }
}
