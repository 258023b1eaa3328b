package io.github.hongjungwan.fieldlog.starter;

import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * fieldlog 설정 Properties (prefix: fieldlog).
 */
@Data
@ConfigurationProperties(prefix = "fieldlog")
public class FieldLogProperties {

    /** 자동 설정 활성화 여부 */
    private boolean enabled = true;

    /** 최소 레벨: trace, debug, info, warn, error, fatal, disabled */
    private String level = "info";

    /** time 필드 포맷 (DateTimeFormatter 패턴 또는 UNIX, UNIXMS, UNIXMICRO, UNIXNANO) */
    private String timeFieldFormat = LogConfig.TIME_FORMAT_RFC3339;

    /** stderr JSON 출력 여부 */
    private boolean console = true;

    /** 이어쓰기할 로그 파일 경로 (없으면 파일 출력 안 함) */
    private String file;

    /** 이 문자열을 포함한 메시지는 기록하지 않음 */
    private List<String> ignore = new ArrayList<>();

    /** 에러 레코드에 스택 기록 */
    private boolean stackTrace = false;

    /** SimpleErrorCounter 빈 등록 */
    private boolean errorCounter = false;

    /** java.util.logging 출력을 fieldlog로 연결 */
    private boolean legacyBridge = true;

    /** 모든 레코드에 붙는 필드 */
    private Map<String, String> fields = new LinkedHashMap<>();

    /** 비동기 버퍼 설정 */
    private BufferProperties buffer = new BufferProperties();

    @Data
    public static class BufferProperties {

        /** false면 호출 스레드에서 바로 기록 */
        private boolean enabled = true;

        private int size = LogConfig.DEFAULT_BUFFER_SIZE;

        /** 빈 버퍼 재확인 간격 */
        private Duration flushInterval = LogConfig.DEFAULT_FLUSH_INTERVAL;

        /** 폴링 대신 블로킹 대기 */
        private boolean waiter = false;
    }
}
