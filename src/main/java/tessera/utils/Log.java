package tessera.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Tessera");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new LineFormatter());
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    /**
     * Accepts "debug", "info", "warn" or "error" (case-insensitive). Anything else keeps the current level.
     */
    public static void setLevel(String name) {
        if (name == null) return;
        switch (name.trim().toLowerCase()) {
            case "debug": logger.setLevel(Level.FINE); break;
            case "info": logger.setLevel(Level.INFO); break;
            case "warn": logger.setLevel(Level.WARNING); break;
            case "error": logger.setLevel(Level.SEVERE); break;
            default: warn("Unknown log level '" + name + "', keeping " + logger.getLevel());
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    /** {@code [LEVEL] msg}, followed by the full stack trace when a throwable is attached. */
    static class LineFormatter extends SimpleFormatter {
        @Override
        public synchronized String format(LogRecord record) {
            String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                              record.getLevel() == Level.WARNING ? "WARN" :
                              record.getLevel() == Level.INFO ? "INFO" : "DEBUG";
            String line = String.format("[%s] %s%n", levelStr, record.getMessage());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                line += trace;
            }
            return line;
        }
    }
}
