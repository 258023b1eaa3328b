package io.github.hongjungwan.fieldlog.core.internal;

import io.github.hongjungwan.fieldlog.api.FieldLog;
import io.github.hongjungwan.fieldlog.core.bridge.FieldLogHandler;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 라이브러리 프레임을 건너뛴 호출 위치 탐색.
 */
final class CallerLocator {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private static final Set<String> LIBRARY_CLASSES = Set.of(
            CallerLocator.class.getName(),
            DefaultFieldLogger.class.getName(),
            FieldLog.class.getName(),
            FieldLogHandler.class.getName());

    private static final String JUL_PACKAGE = "java.util.logging.";

    private CallerLocator() {}

    /** 라이브러리 밖 첫 프레임 (Class.method(File.java:line)) */
    static String locate() {
        return WALKER.walk(frames -> frames
                .dropWhile(frame -> isLibraryFrame(frame.getClassName()))
                .findFirst()
                .map(frame -> frame.toStackTraceElement().toString())
                .orElse(null));
    }

    /** 호출 위치부터의 스택 */
    static List<StackTraceElement> captureStack() {
        return WALKER.walk(frames -> frames
                .dropWhile(frame -> isLibraryFrame(frame.getClassName()))
                .map(StackWalker.StackFrame::toStackTraceElement)
                .collect(Collectors.toUnmodifiableList()));
    }

    static boolean isLibraryFrame(String className) {
        if (className.startsWith(JUL_PACKAGE)) {
            return true;
        }
        int nested = className.indexOf('$');
        String outer = nested < 0 ? className : className.substring(0, nested);
        return LIBRARY_CLASSES.contains(outer);
    }
}
