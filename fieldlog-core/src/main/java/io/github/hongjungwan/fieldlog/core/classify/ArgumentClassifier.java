package io.github.hongjungwan.fieldlog.core.classify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.List;

/**
 * Splits the variadic arguments of a logging call into format arguments, key/value
 * fields and an embedded error value.
 *
 * <p>For formatted calls the number of placeholders in the message decides the split:</p>
 * <ul>
 *   <li>{@code 0 < placeholders <= args}: the first {@code placeholders} arguments format
 *       the message, the rest are fields</li>
 *   <li>no placeholders: every argument is a field and the message is used verbatim</li>
 *   <li>more placeholders than arguments: every argument is a format argument</li>
 * </ul>
 *
 * <p>Every {@code %} counts as a placeholder, including the escapes {@code %%} and
 * {@code %n}. Arguments taken for such markers are passed to {@link String#format},
 * which ignores the surplus.</p>
 */
public final class ArgumentClassifier {

    private ArgumentClassifier() {}

    /** 메시지 내 '%' 개수. {@code %%}도 두 개로 센다. */
    public static int countPlaceholders(String message) {
        if (message == null || message.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < message.length(); i++) {
            if (message.charAt(i) == '%') {
                count++;
            }
        }
        return count;
    }

    /** 포맷 호출 인자 분류 */
    public static Classification classify(String message, Object[] args) {
        if (args == null || args.length == 0) {
            return new Classification(List.of(), List.of());
        }
        List<Object> all = Arrays.asList(args);
        int placeholders = countPlaceholders(message);

        if (placeholders == 0) {
            return new Classification(List.of(), copyOf(all));
        }
        if (placeholders <= all.size()) {
            return new Classification(
                    copyOf(all.subList(0, placeholders)),
                    copyOf(all.subList(placeholders, all.size())));
        }
        return new Classification(copyOf(all), List.of());
    }

    /**
     * Formats the message with {@link String#format}. Without format arguments the message
     * is returned unchanged; a format the JDK rejects degrades to the unformatted message.
     */
    public static String render(String message, List<Object> formatArgs) {
        if (message == null || formatArgs.isEmpty()) {
            return message;
        }
        try {
            return String.format(message, formatArgs.toArray());
        } catch (IllegalFormatException e) {
            return message;
        }
    }

    /**
     * Removes the first {@link Throwable} from a key/value field list.
     *
     * <p>When the throwable sits in a value position its key is removed with it, so
     * {@code ["k1", "v1", "error", e, "k2", "v2"]} leaves {@code ["k1", "v1", "k2", "v2"]}.
     * Later throwables remain ordinary fields.</p>
     */
    public static ExtractedError extractError(List<Object> fields) {
        for (int i = 0; i < fields.size(); i++) {
            Object candidate = fields.get(i);
            if (candidate instanceof Throwable) {
                List<Object> remaining = new ArrayList<>(fields);
                remaining.remove(i);
                if (i % 2 == 1) {
                    remaining.remove(i - 1);
                }
                return new ExtractedError((Throwable) candidate, Collections.unmodifiableList(remaining));
            }
        }
        return new ExtractedError(null, fields);
    }

    public static ExtractedError extractError(Object[] fields) {
        if (fields == null || fields.length == 0) {
            return new ExtractedError(null, List.of());
        }
        return extractError(copyOf(Arrays.asList(fields)));
    }

    // 값에 null이 올 수 있어 List.copyOf 대신 사용
    static List<Object> copyOf(List<Object> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
