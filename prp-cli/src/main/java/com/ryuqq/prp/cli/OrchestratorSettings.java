package com.ryuqq.prp.cli;

import com.ryuqq.prp.adapter.runner.QueueWorkerConfig;
import com.ryuqq.prp.core.ratelimit.RateLimitConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 실행 설정.
 *
 * <p>환경 변수와 프로젝트 루트의 {@code .env} 파일에서 읽습니다.
 * 같은 키가 양쪽에 있으면 환경 변수가 우선합니다.</p>
 *
 * <p><strong>설정 키:</strong></p>
 * <ul>
 *   <li>ANTHROPIC_API_KEY: 필수</li>
 *   <li>ENVIRONMENT: 기본 dev</li>
 *   <li>MAX_BATCHES_PER_HOUR: 기본 1 (1 이상)</li>
 *   <li>MIN_BATCH_INTERVAL_MINUTES: 기본 60 (0 이상)</li>
 *   <li>QUEUE_CHECK_INTERVAL_SECONDS: 기본 300 (1 이상)</li>
 *   <li>BATCH_POLL_INTERVAL_SECONDS: 기본 60 (1 이상)</li>
 *   <li>BATCH_TIMEOUT_HOURS: 기본 3 (1 이상)</li>
 * </ul>
 *
 * @param apiKey API key
 * @param environment 실행 환경 이름
 * @param maxBatchesPerHour 시간당 최대 배치 수
 * @param minBatchInterval 배치 간 최소 간격
 * @param queueCheckInterval daemon 큐 확인 간격
 * @param batchPollInterval 배치 상태 폴링 간격
 * @param batchTimeout 배치 제출 타임아웃
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorSettings(
    String apiKey,
    String environment,
    int maxBatchesPerHour,
    Duration minBatchInterval,
    Duration queueCheckInterval,
    Duration batchPollInterval,
    Duration batchTimeout
) {

    public static final String ENV_FILE = ".env";

    static final String API_KEY = "ANTHROPIC_API_KEY";
    static final String ENVIRONMENT = "ENVIRONMENT";
    static final String MAX_BATCHES_PER_HOUR = "MAX_BATCHES_PER_HOUR";
    static final String MIN_BATCH_INTERVAL_MINUTES = "MIN_BATCH_INTERVAL_MINUTES";
    static final String QUEUE_CHECK_INTERVAL_SECONDS = "QUEUE_CHECK_INTERVAL_SECONDS";
    static final String BATCH_POLL_INTERVAL_SECONDS = "BATCH_POLL_INTERVAL_SECONDS";
    static final String BATCH_TIMEOUT_HOURS = "BATCH_TIMEOUT_HOURS";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 값이 유효하지 않은 경우
     */
    public OrchestratorSettings {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(
                API_KEY + " not set! Create " + ENV_FILE + " file with your API key."
            );
        }
        if (environment == null || environment.isBlank()) {
            throw new ConfigurationException(ENVIRONMENT + " cannot be blank");
        }
        if (maxBatchesPerHour < 1) {
            throw new ConfigurationException(
                MAX_BATCHES_PER_HOUR + " must be at least 1 (current: " + maxBatchesPerHour + ")"
            );
        }
        requireAtLeast(MIN_BATCH_INTERVAL_MINUTES, minBatchInterval, Duration.ZERO);
        requireAtLeast(QUEUE_CHECK_INTERVAL_SECONDS, queueCheckInterval, Duration.ofSeconds(1));
        requireAtLeast(BATCH_POLL_INTERVAL_SECONDS, batchPollInterval, Duration.ofSeconds(1));
        requireAtLeast(BATCH_TIMEOUT_HOURS, batchTimeout, Duration.ofHours(1));
    }

    /**
     * 환경 변수와 {@code <projectRoot>/.env}에서 설정 로드.
     *
     * @param projectRoot 프로젝트 루트
     * @param environment 환경 변수 (보통 {@link System#getenv()})
     * @return 검증된 설정
     * @throws ConfigurationException 필수 값 누락, 숫자 형식 오류, 범위 위반, .env 읽기 실패 시
     */
    public static OrchestratorSettings load(Path projectRoot, Map<String, String> environment) {
        Map<String, String> values = new HashMap<>(readEnvFile(projectRoot.resolve(ENV_FILE)));
        values.putAll(environment);
        return from(values);
    }

    /**
     * 키-값 맵에서 설정 생성 (누락된 키는 기본값).
     *
     * @param values 설정 값
     * @return 검증된 설정
     * @throws ConfigurationException 값이 유효하지 않은 경우
     */
    public static OrchestratorSettings from(Map<String, String> values) {
        return new OrchestratorSettings(
            values.getOrDefault(API_KEY, ""),
            values.getOrDefault(ENVIRONMENT, "dev"),
            intValue(values, MAX_BATCHES_PER_HOUR, 1),
            Duration.ofMinutes(intValue(values, MIN_BATCH_INTERVAL_MINUTES, 60)),
            Duration.ofSeconds(intValue(values, QUEUE_CHECK_INTERVAL_SECONDS, 300)),
            Duration.ofSeconds(intValue(values, BATCH_POLL_INTERVAL_SECONDS, 60)),
            Duration.ofHours(intValue(values, BATCH_TIMEOUT_HOURS, 3))
        );
    }

    public RateLimitConfig rateLimitConfig() {
        return new RateLimitConfig(maxBatchesPerHour, minBatchInterval);
    }

    public QueueWorkerConfig workerConfig() {
        return new QueueWorkerConfig(queueCheckInterval, maxBatchesPerHour);
    }

    @Override
    public String toString() {
        return "OrchestratorSettings{environment=" + environment
            + ", maxBatchesPerHour=" + maxBatchesPerHour
            + ", minBatchInterval=" + minBatchInterval
            + ", queueCheckInterval=" + queueCheckInterval
            + ", batchPollInterval=" + batchPollInterval
            + ", batchTimeout=" + batchTimeout
            + ", apiKey=****}";
    }

    private static void requireAtLeast(String key, Duration value, Duration minimum) {
        if (value == null || value.compareTo(minimum) < 0) {
            throw new ConfigurationException(key + " is out of range (current: " + value + ")");
        }
    }

    private static int intValue(Map<String, String> values, String key, int defaultValue) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    /**
     * {@code KEY=VALUE} 형식의 .env 파일 읽기.
     *
     * <p>{@code #} 주석과 값 양쪽의 따옴표를 지원합니다. 파일이 없으면 빈 맵입니다.</p>
     */
    static Map<String, String> readEnvFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        Map<String, String> values = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.startsWith("export ")) {
                    trimmed = trimmed.substring("export ".length()).trim();
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                values.put(trimmed.substring(0, eq).trim(), unquote(trimmed.substring(eq + 1).trim()));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + file, e);
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
