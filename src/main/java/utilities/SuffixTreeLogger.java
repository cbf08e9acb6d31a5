package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class SuffixTreeLogger {

    // Set to a file path to also append log records there.
    public static final String LOG_FILE_PROPERTY = "suffixtree.log.file";

    private static Logger logger;

    static {
        try {
            logger = Logger.getLogger(SuffixTreeLogger.class.getName());
            logger.setUseParentHandlers(false); // Disable default console handler

            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setLevel(Level.INFO);
            logger.addHandler(consoleHandler);

            String logFile = System.getProperty(LOG_FILE_PROPERTY);
            if (logFile != null && !logFile.isBlank()) {
                FileHandler fileHandler = new FileHandler(logFile, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            }

            logger.setLevel(Level.ALL);

        } catch (Exception e) {
            System.err.println("Failed to initialize logger: " + e.getMessage());
        }
    }

    private SuffixTreeLogger() {
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }

    // Lets callers skip building expensive messages nobody will see.
    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE) && hasHandlerAt(Level.FINE);
    }

    public static boolean isTraceEnabled() {
        return logger.isLoggable(Level.FINEST) && hasHandlerAt(Level.FINEST);
    }

    private static boolean hasHandlerAt(Level level) {
        for (Handler handler : logger.getHandlers()) {
            if (handler.getLevel().intValue() <= level.intValue()) {
                return true;
            }
        }
        return false;
    }
}
