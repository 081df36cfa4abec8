package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.config;

import com.musicinsights.itunesinsights.infrastructure.config.LibraryIngestProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Elasticsearch REST API 호출용 {@link WebClient}를 Bean으로 등록하는 설정 클래스입니다.
 * <p>
 * base URL과 basic 인증 헤더를 기본값으로 설정하여,
 * 저장소 클라이언트에서는 경로와 본문만 지정하면 되도록 합니다.
 */
@Configuration
public class ElasticsearchClientConfig {

    /** bulk 응답 등 큰 응답 본문을 위한 버퍼 상한 */
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * Elasticsearch용 WebClient를 생성합니다.
     *
     * @param properties ingest 설정
     * @return 설정이 적용된 WebClient
     */
    @Bean
    public WebClient elasticsearchWebClient(LibraryIngestProperties properties) {
        return configure(WebClient.builder(), properties.sink()).build();
    }

    /**
     * 주어진 builder에 base URL, 기본 헤더, 인증을 적용합니다.
     *
     * @param builder WebClient builder
     * @param sink    저장소 설정
     * @return 설정이 적용된 builder
     */
    public static WebClient.Builder configure(WebClient.Builder builder, LibraryIngestProperties.Sink sink) {
        return builder
                .baseUrl(sink.url())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .defaultHeaders(h -> {
                    h.setAccept(List.of(MediaType.APPLICATION_JSON));
                    if (sink.hasCredentials()) {
                        h.setBasicAuth(sink.username(), sink.password() == null ? "" : sink.password());
                    }
                })
                .defaultHeader(HttpHeaders.USER_AGENT, "itunes-insights");
    }
}
