/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.mwn.util;

import java.io.IOError;
import java.io.IOException;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * The shared {@link Logger} for the MultiWordNet library.  Messages are
 * attributed to the class and method that called into this facade, rather
 * than to the facade itself.
 *
 * <p>Setting the {@value #LOG_FILE_PROPERTY} system property causes all
 * messages to also be written to that file.
 */
public class MwnLogger {

    public static final String LOGGER_NAME = "ca.mcgill.cs.mwn";

    public static final Logger LOGGER = Logger.getLogger(LOGGER_NAME);

    public static final String LOG_FILE_PROPERTY = "mwn.logfile";

    static {
        String logFileName = System.getProperty(LOG_FILE_PROPERTY);
        if (logFileName != null) {
            try {
                Handler handler = new FileHandler(logFileName);
                LOGGER.addHandler(handler);
            } catch (IOException ioe) {
                throw new IOError(ioe);
            }
        }
    }

    private MwnLogger() { }

    /**
     * Returns {@code true} if log messages sent at this output level will be
     * shown to the user.
     */
    public static boolean isLoggable(Level outputLevel) {
        return LOGGER.isLoggable(outputLevel);
    }

    /**
     * Sets which logging is reported by the library according to the desired
     * level, replacing the parent handlers with a console handler.
     */
    public static void setLevel(Level outputLevel) {
        Handler verboseHandler = new ConsoleHandler();
        verboseHandler.setLevel(outputLevel);
        LOGGER.addHandler(verboseHandler);
        LOGGER.setLevel(outputLevel);
        LOGGER.setUseParentHandlers(false);
    }

    /**
     * Prints {@link Level#FINER} messages, which are generally only useful
     * for tracing individual store queries.
     */
    public static void veryVerbose(String format, Object... args) {
        log(Level.FINER, format, args);
    }

    /**
     * Prints {@link Level#FINE} messages.
     */
    public static void verbose(String format, Object... args) {
        log(Level.FINE, format, args);
    }

    /**
     * Prints {@link Level#INFO} messages.
     */
    public static void info(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    /**
     * Prints {@link Level#WARNING} messages.
     */
    public static void warning(String format, Object... args) {
        log(Level.WARNING, format, args);
    }

    /**
     * Prints {@link Level#SEVERE} messages.
     */
    public static void severe(String format, Object... args) {
        log(Level.SEVERE, format, args);
    }

    private static void log(Level level, String format, Object[] args) {
        if (!LOGGER.isLoggable(level))
            return;
        StackTraceElement[] callStack = Thread.currentThread().getStackTrace();
        // Index 0 is Thread.getStackTrace()
        // Index 1 is this method
        // Index 2 is the public level method
        // Index 3 is the caller
        StackTraceElement caller = callStack[Math.min(3, callStack.length - 1)];
        LOGGER.logp(level, caller.getClassName(), caller.getMethodName(),
                    String.format(format, args));
    }
}
