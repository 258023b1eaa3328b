package io.github.hongjungwan.fieldlog.core.internal;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.api.domain.LogRecord;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * 로그 레코드 JSON 직렬화 (한 줄에 하나의 객체).
 *
 * 필드 순서: level, time, 바인딩 필드, 레코드 필드, hook 필드, stack, error, caller, message.
 */
public class LogSerializer {

    private static final int INITIAL_BUFFER_SIZE = 256;

    private final ObjectMapper objectMapper;
    private final String timeFieldFormat;
    private final DateTimeFormatter timeFormatter;

    public LogSerializer() {
        this(LogConfig.TIME_FORMAT_RFC3339);
    }

    /** 시간 포맷 패턴 검증 (잘못된 패턴은 설정 오류) */
    public LogSerializer(String timeFieldFormat) {
        this.timeFieldFormat = timeFieldFormat;
        this.timeFormatter = isUnixFormat(timeFieldFormat) ? null : createFormatter(timeFieldFormat);
        this.objectMapper = createObjectMapper();
    }

    private ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }

    private static DateTimeFormatter createFormatter(String pattern) {
        try {
            return DateTimeFormatter.ofPattern(pattern).withZone(ZoneId.systemDefault());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid time field format: " + pattern, e);
        }
    }

    private static boolean isUnixFormat(String format) {
        return LogConfig.TIME_FORMAT_UNIX.equals(format)
                || LogConfig.TIME_FORMAT_UNIX_MS.equals(format)
                || LogConfig.TIME_FORMAT_UNIX_MICRO.equals(format)
                || LogConfig.TIME_FORMAT_UNIX_NANO.equals(format);
    }

    /** 레코드 직렬화. 줄바꿈 문자로 끝난다. */
    public byte[] serialize(LogRecord record, Instant time, List<Object> contextFields,
                            Map<String, Object> hookFields) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(INITIAL_BUFFER_SIZE);

        try (JsonGenerator gen = objectMapper.createGenerator(out)) {
            gen.writeStartObject();

            if (record.getLevel() != null) {
                gen.writeStringField("level", record.getLevel().getLabel());
            }
            writeTime(gen, time);
            writePairs(gen, contextFields);
            writePairs(gen, record.getFields());

            for (Map.Entry<String, Object> entry : hookFields.entrySet()) {
                writeField(gen, entry.getKey(), entry.getValue());
            }

            if (record.getStackFields() != null) {
                for (Map.Entry<String, Object> entry : record.getStackFields().entrySet()) {
                    writeField(gen, entry.getKey(), entry.getValue());
                }
            } else if (record.getStack() != null) {
                writeStack(gen, record.getStack());
            }

            if (record.isErrorAttached()) {
                if (record.getError() == null) {
                    gen.writeNullField("error");
                } else {
                    gen.writeStringField("error", errorText(record.getError()));
                }
            }
            if (record.getCaller() != null) {
                gen.writeStringField("caller", record.getCaller());
            }
            gen.writeStringField("message", record.getMessage());

            gen.writeEndObject();
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize log record", e);
        }

        out.write('\n');
        return out.toByteArray();
    }

    private void writeTime(JsonGenerator gen, Instant time) throws IOException {
        if (timeFormatter != null) {
            gen.writeStringField("time", timeFormatter.format(time));
            return;
        }
        switch (timeFieldFormat) {
            case LogConfig.TIME_FORMAT_UNIX -> gen.writeNumberField("time", time.getEpochSecond());
            case LogConfig.TIME_FORMAT_UNIX_MS -> gen.writeNumberField("time", time.toEpochMilli());
            case LogConfig.TIME_FORMAT_UNIX_MICRO ->
                    gen.writeNumberField("time", time.getEpochSecond() * 1_000_000L + time.getNano() / 1_000);
            default -> gen.writeNumberField("time", time.getEpochSecond() * 1_000_000_000L + time.getNano());
        }
    }

    private void writePairs(JsonGenerator gen, List<Object> pairs) throws IOException {
        for (int i = 0; i < pairs.size(); i += 2) {
            String key = String.valueOf(pairs.get(i));
            Object value = i + 1 < pairs.size() ? pairs.get(i + 1) : null;
            writeField(gen, key, value);
        }
    }

    private void writeField(JsonGenerator gen, String key, Object value) throws IOException {
        gen.writeFieldName(key);
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof String) {
            gen.writeString((String) value);
        } else if (value instanceof Throwable) {
            gen.writeString(errorText((Throwable) value));
        } else if (value instanceof Boolean) {
            gen.writeBoolean((Boolean) value);
        } else if (value instanceof Integer || value instanceof Long) {
            gen.writeNumber(((Number) value).longValue());
        } else {
            gen.writeTree(toTree(value));
        }
    }

    private JsonNode toTree(Object value) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(String.valueOf(value));
        }
    }

    private void writeStack(JsonGenerator gen, List<StackTraceElement> stack) throws IOException {
        gen.writeArrayFieldStart("stack");
        for (StackTraceElement frame : stack) {
            gen.writeStartObject();
            gen.writeStringField("func", frame.getClassName() + "." + frame.getMethodName());
            gen.writeStringField("source", frame.getFileName());
            gen.writeNumberField("line", frame.getLineNumber());
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }

    /** 에러 필드에 기록되는 문자열 (메시지가 없으면 클래스명) */
    public static String errorText(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }

    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
