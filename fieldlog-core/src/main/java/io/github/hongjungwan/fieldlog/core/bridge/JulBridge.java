package io.github.hongjungwan.fieldlog.core.bridge;

import io.github.hongjungwan.fieldlog.api.FieldLogger;
import io.github.hongjungwan.fieldlog.api.Level;

import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * java.util.logging 루트 로거를 FieldLogger로 연결.
 *
 * <p>Installing removes the root handlers (restored by {@link #uninstall()}) and adds a
 * single {@link FieldLogHandler}. Installing again replaces only the handler and the
 * root level.</p>
 */
public final class JulBridge {

    private static final Object LOCK = new Object();

    private static FieldLogHandler installed;
    private static List<Handler> detachedHandlers = List.of();
    private static java.util.logging.Level originalLevel;

    private JulBridge() {}

    public static void install(FieldLogger logger) {
        synchronized (LOCK) {
            Logger root = rootLogger();
            if (installed == null) {
                detachedHandlers = List.of(root.getHandlers());
                detachedHandlers.forEach(root::removeHandler);
                originalLevel = root.getLevel();
            } else {
                root.removeHandler(installed);
            }
            installed = new FieldLogHandler(logger);
            root.addHandler(installed);
            root.setLevel(toJulLevel(logger.getLevel()));
        }
    }

    /** 원래 핸들러와 레벨 복원 */
    public static void uninstall() {
        synchronized (LOCK) {
            if (installed == null) {
                return;
            }
            Logger root = rootLogger();
            root.removeHandler(installed);
            detachedHandlers.forEach(root::addHandler);
            root.setLevel(originalLevel);
            installed = null;
            detachedHandlers = List.of();
            originalLevel = null;
        }
    }

    public static boolean isInstalled() {
        synchronized (LOCK) {
            return installed != null;
        }
    }

    /** 최소 레벨 → JUL 레벨 */
    public static java.util.logging.Level toJulLevel(Level level) {
        return switch (level) {
            case TRACE -> java.util.logging.Level.FINEST;
            case DEBUG -> java.util.logging.Level.FINE;
            case INFO -> java.util.logging.Level.INFO;
            case WARN -> java.util.logging.Level.WARNING;
            case ERROR, FATAL -> java.util.logging.Level.SEVERE;
            case DISABLED -> java.util.logging.Level.OFF;
        };
    }

    /** JUL 레코드 레벨 → 레코드 레벨 (CONFIG는 info) */
    public static Level fromJulLevel(java.util.logging.Level level) {
        int value = level.intValue();
        if (value >= java.util.logging.Level.SEVERE.intValue()) {
            return Level.ERROR;
        }
        if (value >= java.util.logging.Level.WARNING.intValue()) {
            return Level.WARN;
        }
        if (value >= java.util.logging.Level.CONFIG.intValue()) {
            return Level.INFO;
        }
        if (value >= java.util.logging.Level.FINE.intValue()) {
            return Level.DEBUG;
        }
        return Level.TRACE;
    }

    private static Logger rootLogger() {
        return LogManager.getLogManager().getLogger("");
    }
}
