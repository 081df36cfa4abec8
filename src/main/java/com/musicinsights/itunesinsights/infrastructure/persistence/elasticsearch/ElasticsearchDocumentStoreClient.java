package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.musicinsights.itunesinsights.infrastructure.config.LibraryIngestProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Elasticsearch REST API 기반 {@link DocumentStoreClient} 구현체입니다.
 * <p>
 * upsert는 {@code _bulk} API의 {@code index} action(문서 ID 지정)으로 수행하므로
 * 같은 ID로 다시 쓰면 기존 문서를 덮어씁니다.
 * <p>
 * 요청마다 {@code request-timeout}을 적용하며, 4xx/5xx 응답은 {@code WebClientResponseException}으로,
 * 연결 실패는 {@code WebClientRequestException}으로 전파됩니다.
 */
@Component
public class ElasticsearchDocumentStoreClient implements DocumentStoreClient {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final WebClient webClient;

    /** bulk 요청 본문 직렬화 / 응답 역직렬화용 ObjectMapper */
    private final ObjectMapper mapper;

    private final Duration requestTimeout;

    private final boolean refreshAfterWrite;

    public ElasticsearchDocumentStoreClient(
            WebClient elasticsearchWebClient,
            ObjectMapper mapper,
            LibraryIngestProperties properties
    ) {
        this.webClient = elasticsearchWebClient;
        this.mapper = mapper;
        this.requestTimeout = properties.sink().requestTimeout();
        this.refreshAfterWrite = properties.sink().refreshAfterWrite();
    }

    @Override
    public Mono<BulkResult> bulkUpsert(String index, List<IndexedDocument> documents) {
        if (documents.isEmpty()) return Mono.just(BulkResult.ok(0));

        return Mono.fromCallable(() -> toBulkBody(index, documents))
                .flatMap(body -> webClient.post()
                        .uri("/_bulk")
                        .contentType(NDJSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(requestTimeout))
                .map(json -> parseBulkResponse(json, documents.size()));
    }

    @Override
    public Mono<Boolean> indexExists(String index) {
        return webClient.head()
                .uri("/{index}", index)
                .exchangeToMono(resp -> {
                    if (resp.statusCode().is2xxSuccessful()) return resp.releaseBody().thenReturn(true);
                    if (resp.statusCode().value() == HttpStatus.NOT_FOUND.value()) return resp.releaseBody().thenReturn(false);
                    return resp.createError();
                })
                .timeout(requestTimeout);
    }

    @Override
    public Mono<Void> createIndex(String index, String mappingJson) {
        return webClient.put()
                .uri("/{index}", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(mappingJson)
                .retrieve()
                .toBodilessEntity()
                .timeout(requestTimeout)
                .then();
    }

    /**
     * {@code _delete_by_query}로 run_id가 다른 문서를 지웁니다.
     * <p>
     * 조회 이후 다시 쓰인 문서는 버전 충돌로 건너뛰도록 {@code conflicts=proceed}를 지정합니다.
     */
    @Override
    public Mono<Long> deleteOtherRuns(String index, String runId) {
        return Mono.fromCallable(() -> otherRunsQuery(runId))
                .flatMap(body -> webClient.post()
                        .uri(b -> b.path("/{index}/_delete_by_query")
                                .queryParam("conflicts", "proceed")
                                .queryParam("refresh", refreshAfterWrite)
                                .build(index))
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(requestTimeout))
                .map(json -> {
                    DeleteByQueryBody result = mapper.readValue(json, DeleteByQueryBody.class);
                    return result.deleted() == null ? 0L : result.deleted();
                })
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.just(0L));
    }

    @Override
    public Mono<Void> refresh(String index) {
        return webClient.post()
                .uri("/{index}/_refresh", index)
                .retrieve()
                .toBodilessEntity()
                .timeout(requestTimeout)
                .then();
    }

    /**
     * run_id가 지정한 값과 다른 문서(필드가 없는 문서 포함)를 찾는 쿼리 본문을 만든다.
     *
     * @param runId 유지할 실행 ID
     * @return 쿼리 JSON
     */
    String otherRunsQuery(String runId) {
        Map<String, Object> query = Map.of("query", Map.of("bool", Map.of("must_not",
                Map.of("term", Map.of(IndexedDocument.RUN_ID_FIELD, runId)))));
        return mapper.writeValueAsString(query);
    }

    /**
     * bulk 요청 본문(NDJSON)을 만든다. 문서마다 action 줄과 본문 줄 2줄이며 마지막 줄도 개행으로 끝난다.
     *
     * @param index     대상 인덱스
     * @param documents 문서 목록
     * @return NDJSON 본문
     */
    String toBulkBody(String index, List<IndexedDocument> documents) {
        StringBuilder sb = new StringBuilder();
        for (IndexedDocument doc : documents) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("_index", index);
            meta.put("_id", doc.id());
            sb.append(mapper.writeValueAsString(Map.of("index", meta))).append('\n');
            sb.append(mapper.writeValueAsString(doc.source())).append('\n');
        }
        return sb.toString();
    }

    /**
     * bulk 응답에서 거부된 항목을 추려 {@link BulkResult}로 만든다.
     *
     * @param json      응답 본문
     * @param attempted 요청한 문서 수
     * @return bulk 결과
     */
    BulkResult parseBulkResponse(String json, int attempted) {
        BulkResponseBody body = mapper.readValue(json, BulkResponseBody.class);
        if (!Boolean.TRUE.equals(body.errors()) || body.items() == null) {
            return BulkResult.ok(attempted);
        }

        List<BulkResult.ItemFailure> failures = new ArrayList<>();
        for (Map<String, BulkItemBody> item : body.items()) {
            for (BulkItemBody r : item.values()) {
                int status = r.status() == null ? 0 : r.status();
                if (r.error() == null && status < 300) continue;
                String reason = (r.error() == null)
                        ? "status " + status
                        : r.error().type() + ": " + r.error().reason();
                failures.add(new BulkResult.ItemFailure(r.id(), status, reason));
            }
        }
        return new BulkResult(attempted, failures);
    }

    /** {@code _bulk} 응답 본문 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record BulkResponseBody(Boolean errors, List<Map<String, BulkItemBody>> items) {}

    /** action 하나의 결과 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record BulkItemBody(@JsonProperty("_id") String id, Integer status, BulkErrorBody error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BulkErrorBody(String type, String reason) {}

    /** {@code _delete_by_query} 응답 본문 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record DeleteByQueryBody(Long deleted) {}
}
