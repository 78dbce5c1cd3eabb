package hep.afw;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Logger interface for pipeline operations
 * 
 * Messages are {@link String#format} patterns, usually prefixed with a bracketed
 * phase tag such as {@code [CHUNK]} or {@code [SKIM ]}.
 */
public interface Logger {
    /**
     * Log informational message
     * 
     * @param fmt  format pattern
     * @param args pattern arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log error message
     * 
     * @param fmt  format pattern
     * @param args pattern arguments
     */
    void error(String fmt, Object... args);

    /**
     * Log debug message. Dropped unless the implementation opts in.
     */
    default void debug(String fmt, Object... args) {
    }

    /**
     * Discards log messages but prints errors
     */
    public static final class NullLogger implements Logger {
        @Override
        public void log(String fmt, Object... args) {
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.println(String.format(fmt, args));
        }
    }

    /**
     * java.util.logging backed logger with a one-line console format
     */
    public static final class DefaultLogger implements Logger {
        private static final java.util.logging.Logger ROOT = java.util.logging.Logger.getLogger("hep.afw");

        static {
            ROOT.setUseParentHandlers(false);
            final ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.ALL);
            handler.setFormatter(new Formatter() {
                private final DateTimeFormatter df = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

                @Override
                public String format(LogRecord record) {
                    final String timestamp = LocalDateTime.now().format(df);
                    final String threadName = Thread.currentThread().getName();
                    return String.format("%s [%s] %-7s %s - %s%n", timestamp, threadName, record.getLevel().getName(),
                            record.getLoggerName(), record.getMessage());
                }
            });
            ROOT.addHandler(handler);
            ROOT.setLevel(Level.INFO);
        }

        private final java.util.logging.Logger LOGGER;

        public DefaultLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger("hep.afw." + name);
        }

        /**
         * Switches the whole hierarchy between INFO and FINE.
         */
        public static void verbose(boolean debug) {
            ROOT.setLevel(debug ? Level.FINE : Level.INFO);
        }

        @Override
        public void log(String fmt, Object... args) {
            if (LOGGER.isLoggable(Level.INFO))
                LOGGER.log(Level.INFO, String.format(fmt, args));
        }

        @Override
        public void debug(String fmt, Object... args) {
            if (LOGGER.isLoggable(Level.FINE))
                LOGGER.log(Level.FINE, String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.log(Level.SEVERE, String.format(fmt, args));
        }
    }
}
