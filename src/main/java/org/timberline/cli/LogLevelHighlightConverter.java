package org.timberline.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback {@code %levelColor(...)} converter: bold red ERROR, yellow WARN, cyan INFO,
 * grey DEBUG and TRACE.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String RESET = "\u001B[0m";
    static final String BOLD_RED = "\u001B[1;31m";
    static final String YELLOW = "\u001B[33m";
    static final String CYAN = "\u001B[36m";
    static final String GREY = "\u001B[90m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorOf(event.getLevel());
        return color == null ? in : color + in + RESET;
    }

    static String colorOf(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> BOLD_RED;
            case Level.WARN_INT -> YELLOW;
            case Level.INFO_INT -> CYAN;
            case Level.DEBUG_INT, Level.TRACE_INT -> GREY;
            default -> null;
        };
    }
}
