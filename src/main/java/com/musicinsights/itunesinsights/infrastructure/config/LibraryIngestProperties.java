package com.musicinsights.itunesinsights.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 라이브러리 ingest 설정({@code library.*}).
 *
 * <p>주요 설정값: {@code library.export-path}, {@code library.sink.url},
 * {@code library.sink.batch-size}, {@code library.sink.max-attempts}, {@code library.sink.fail-fast}</p>
 *
 * @param exportPath 라이브러리 export(XML plist) 경로
 * @param sink       문서 저장소(Elasticsearch) 쓰기 설정
 */
@Validated
@ConfigurationProperties(prefix = "library")
public record LibraryIngestProperties(
        @NotBlank String exportPath,
        @Valid @NotNull Sink sink
) {

    public LibraryIngestProperties {
        if (sink == null) sink = Sink.defaults();
    }

    /**
     * 문서 저장소 쓰기 설정. 값이 없으면 기본값을 사용한다.
     *
     * @param url              Elasticsearch 엔드포인트
     * @param username         basic auth 사용자(비어 있으면 인증 헤더 없음)
     * @param password         basic auth 비밀번호
     * @param batchSize        bulk 요청 1회당 문서 수
     * @param parallelism      같은 컬렉션에 동시에 보내는 배치 수
     * @param maxAttempts      배치당 최대 시도 횟수(최초 시도 포함)
     * @param initialBackoff   첫 재시도 대기 시간
     * @param maxBackoff       재시도 대기 시간 상한
     * @param requestTimeout   요청 1회 타임아웃
     * @param failFast         복구 불가능한 첫 배치에서 실행 중단 여부
     * @param createIndices    쓰기 전 인덱스 mapping 생성 여부
     * @param refreshAfterWrite 컬렉션 쓰기 후 refresh 여부
     */
    public record Sink(
            @NotBlank String url,
            String username,
            String password,
            @Positive Integer batchSize,
            @Positive Integer parallelism,
            @Min(1) Integer maxAttempts,
            Duration initialBackoff,
            Duration maxBackoff,
            Duration requestTimeout,
            Boolean failFast,
            Boolean createIndices,
            Boolean refreshAfterWrite
    ) {
        public static final int DEFAULT_BATCH_SIZE = 500;

        public Sink {
            if (url == null) url = "http://localhost:9200";
            if (batchSize == null) batchSize = DEFAULT_BATCH_SIZE;
            if (parallelism == null) parallelism = 2;
            if (maxAttempts == null) maxAttempts = 4;
            if (initialBackoff == null) initialBackoff = Duration.ofMillis(500);
            if (maxBackoff == null) maxBackoff = Duration.ofSeconds(5);
            if (requestTimeout == null) requestTimeout = Duration.ofSeconds(30);
            if (failFast == null) failFast = false;
            if (createIndices == null) createIndices = true;
            if (refreshAfterWrite == null) refreshAfterWrite = true;
        }

        public static Sink defaults() {
            return new Sink(null, null, null, null, null, null, null, null, null, null, null, null);
        }

        /** basic auth 사용 여부 */
        public boolean hasCredentials() {
            return username != null && !username.isBlank();
        }
    }
}
