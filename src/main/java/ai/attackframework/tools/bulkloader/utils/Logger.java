package ai.attackframework.tools.bulkloader.utils;

import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * - Delegates to SLF4J so levels/appenders are configurable via logback.xml.
 * - Exposes a listener bus so callers (and tests) can observe what the loader reports,
 *   in particular per-document bulk failures that are never raised.
 */
public final class Logger {

    /**
     * Listener contract for observers of loader log output.
     */
    public interface LogListener { void onLog(String level, String message); }

    private static final String LOGGER_NAME = "ai.attackframework.tools.bulkloader";

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private static final List<LogListener> LISTENERS = new CopyOnWriteArrayList<>();

    /**
     * Utility holder; not instantiable.
     */
    private Logger() {}

    /**
     * Registers a listener. Registering the same instance twice has no effect.
     * <p>
     * @param listener listener to add (nullable ignored)
     */
    public static void registerListener(LogListener listener) {
        if (listener != null && !LISTENERS.contains(listener)) LISTENERS.add(listener);
    }

    /**
     * Unregisters a listener.
     * <p>
     * @param listener listener to remove (nullable ignored)
     */
    public static void unregisterListener(LogListener listener) { LISTENERS.remove(listener); }

    /**
     * Logs at INFO and notifies listeners.
     * <p>
     * @param msg message to log
     */
    public static void logInfo(String msg)  {
        final String m = safe(msg);
        LOG.info(m);
        notifyListeners("INFO",  m);
    }

    /**
     * Logs at WARN and notifies listeners.
     * <p>
     * @param msg message to log
     */
    public static void logWarn(String msg)  {
        final String m = safe(msg);
        LOG.warn(m);
        notifyListeners("WARN",  m);
    }

    /**
     * Logs at DEBUG (when enabled) and notifies listeners.
     * <p>
     * @param msg message to log
     */
    public static void logDebug(String msg) {
        final String m = safe(msg);
        if (LOG.isDebugEnabled()) LOG.debug(m);
        notifyListeners("DEBUG", m);
    }

    /**
     * Logs at ERROR and notifies listeners.
     * <p>
     * @param msg message to log
     */
    public static void logError(String msg) {
        final String m = safe(msg);
        LOG.error(m);
        notifyListeners("ERROR", m);
    }

    /**
     * Logs at ERROR with throwable; listeners receive a concise one-line summary.
     * <p>
     * @param msg message to log
     * @param t   throwable (nullable)
     */
    public static void logError(String msg, Throwable t) {
        final String base = safe(msg);
        final String detail = (t != null ? " :: " + t.getClass().getSimpleName() + ": " + safe(t.getMessage()) : "");
        LOG.error(base, t);                    // stack trace handled by backend
        notifyListeners("ERROR", base + detail);
    }

    private static void notifyListeners(String level, String m) {
        for (LogListener l : LISTENERS) {
            try { l.onLog(level, m); }
            catch (RuntimeException ex) {
                if (LOG.isDebugEnabled()) LOG.debug("listener threw: {}", ex.toString());
            }
        }
    }

    private static String safe(String s) { return Objects.toString(s, ""); }
}
