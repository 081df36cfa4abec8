package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import com.musicinsights.itunesinsights.application.common.error.SinkWriteException;
import com.musicinsights.itunesinsights.infrastructure.config.LibraryIngestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 레코드 목록을 배치 단위로 문서 저장소에 upsert 하는 writer입니다.
 * <p>
 * 대량 입력을 {@code batch-size} 단위로 나누어 컬렉션마다 최대 {@code parallelism}개 배치를 동시에 보내고,
 * 일시적 장애는 지수 backoff로 {@code max-attempts}회까지 재시도합니다.
 * <p>
 * 재시도를 소진한 배치는 실패로 기록하고 다음 배치를 계속 처리합니다.
 * {@code fail-fast}가 켜져 있으면 첫 실패 배치에서 {@link SinkWriteException}으로 중단합니다.
 */
@Component
public class DocumentSinkWriter {

    private static final Logger log = LoggerFactory.getLogger(DocumentSinkWriter.class);

    private final DocumentStoreClient client;
    private final LibraryIngestProperties.Sink sink;

    public DocumentSinkWriter(DocumentStoreClient client, LibraryIngestProperties properties) {
        this.client = client;
        this.sink = properties.sink();
    }

    /**
     * 레코드 목록을 문서로 변환해 컬렉션에 upsert 합니다.
     *
     * @param collection 대상 컬렉션
     * @param records    레코드 목록
     * @param toDocument 레코드 → 문서 변환 함수(결정적 ID 포함)
     * @param <T>        레코드 타입
     * @return 컬렉션 쓰기 결과(실패 배치 포함)
     */
    public <T> Mono<CollectionWriteResult> write(
            String collection,
            List<T> records,
            Function<T, IndexedDocument> toDocument
    ) {
        if (records == null || records.isEmpty()) {
            return Mono.just(CollectionWriteResult.of(collection, List.of()));
        }
        return Mono.defer(() -> {
            // fail-fast 중단 시에도 이미 끝난 배치를 보고하기 위해 모아 둔다
            List<BatchResult> finished = new CopyOnWriteArrayList<>();
            return Flux.fromIterable(records)
                    .map(toDocument)
                    .buffer(sink.batchSize())
                    .index()
                    .flatMapSequential(t -> writeBatch(collection, t.getT1().intValue(), t.getT2())
                            .doOnNext(finished::add)
                            .flatMap(this::abortIfFailFast), sink.parallelism())
                    .collectList()
                    .map(results -> CollectionWriteResult.of(collection, results))
                    .onErrorMap(SinkWriteException.class, e -> e.failure() == null ? e
                            : new SinkWriteException(e.failure(), partialResult(collection, finished), e.getCause()));
        })
                .flatMap(result -> refreshIfEnabled(collection).thenReturn(result))
                .doOnNext(this::logResult);
    }

    /**
     * 지정한 실행이 쓰지 않은 문서를 컬렉션에서 삭제합니다.
     * <p>
     * 일시적 장애는 배치와 같은 정책으로 재시도하며, 끝내 실패하면 에러 시그널을 방출합니다.
     *
     * @param collection 대상 컬렉션
     * @param runId      이번 실행 ID
     * @return 삭제한 문서 수
     */
    public Mono<Long> removeOtherRuns(String collection, String runId) {
        return Mono.defer(() -> client.deleteOtherRuns(collection, runId))
                .retryWhen(retryPolicy("stale cleanup of '" + collection + "'"))
                .doOnNext(n -> {
                    if (n > 0) log.info("Removed {} stale documents from '{}'", n, collection);
                });
    }

    private Mono<BatchResult> abortIfFailFast(BatchResult r) {
        if (r.failed() && sink.failFast()) {
            return Mono.error(new SinkWriteException(r.failure(), null));
        }
        return Mono.just(r);
    }

    private static CollectionWriteResult partialResult(String collection, List<BatchResult> finished) {
        List<BatchResult> ordered = finished.stream()
                .sorted(Comparator.comparingInt(BatchResult::batchIndex))
                .toList();
        return CollectionWriteResult.of(collection, ordered);
    }

    private Retry retryPolicy(String what) {
        return Retry.backoff(sink.maxAttempts() - 1, sink.initialBackoff())
                .maxBackoff(sink.maxBackoff())
                .filter(TransientErrors::isTransient)
                .doBeforeRetry(s -> log.warn("Retrying {} (attempt {}/{}): {}",
                        what, s.totalRetries() + 2, sink.maxAttempts(), TransientErrors.describe(s.failure())))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * 배치 하나를 재시도 정책과 함께 씁니다.
     *
     * @param collection 대상 컬렉션
     * @param batchIndex 배치 순번
     * @param batch      문서 목록
     * @return 배치 결과(실패해도 정상 시그널)
     */
    Mono<BatchResult> writeBatch(String collection, int batchIndex, List<IndexedDocument> batch) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<BulkResult> lastResult = new AtomicReference<>();

        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return client.bulkUpsert(collection, batch);
                })
                .flatMap(result -> {
                    lastResult.set(result);
                    if (result.hasRetryableFailures()) {
                        return Mono.<BulkResult>error(new SinkWriteException(
                                result.itemFailures().size() + " documents rejected with retryable status", true));
                    }
                    return Mono.just(result);
                })
                .retryWhen(retryPolicy("batch " + batchIndex + " of '" + collection + "'"))
                .map(result -> toBatchResult(collection, batchIndex, batch, result, attempts.get()))
                .onErrorResume(e -> Mono.just(failedBatch(collection, batchIndex, batch, e, lastResult.get(), attempts.get())));
    }

    private BatchResult toBatchResult(
            String collection, int batchIndex, List<IndexedDocument> batch, BulkResult result, int attempts
    ) {
        if (result.itemFailures().isEmpty()) {
            log.debug("Batch {} of '{}' written: {} documents", batchIndex, collection, batch.size());
            return new BatchResult(collection, batchIndex, batch.size(), batch.size(), null);
        }
        BatchFailure failure = itemFailure(collection, batchIndex, result, attempts);
        log.warn("Batch {} of '{}': {} of {} documents rejected ({})",
                batchIndex, collection, failure.documentIds().size(), batch.size(), failure.reason());
        return new BatchResult(collection, batchIndex, batch.size(), result.written(), failure);
    }

    private BatchResult failedBatch(
            String collection, int batchIndex, List<IndexedDocument> batch,
            Throwable e, BulkResult lastResult, int attempts
    ) {
        // 재시도 가능한 항목 거부로 소진된 경우 마지막 응답 기준으로 실패 문서만 기록
        if (e instanceof SinkWriteException s && s.retryable() && lastResult != null) {
            BatchFailure failure = itemFailure(collection, batchIndex, lastResult, attempts);
            log.error("Batch {} of '{}' gave up after {} attempts: {} documents not written",
                    batchIndex, collection, attempts, failure.documentIds().size());
            return new BatchResult(collection, batchIndex, batch.size(), lastResult.written(), failure);
        }

        List<String> ids = batch.stream().map(IndexedDocument::id).toList();
        BatchFailure failure = new BatchFailure(collection, batchIndex, ids, TransientErrors.describe(e), attempts);
        log.error("Batch {} of '{}' failed after {} attempts ({} documents): {}",
                batchIndex, collection, attempts, ids.size(), failure.reason());
        return new BatchResult(collection, batchIndex, batch.size(), 0, failure);
    }

    private static BatchFailure itemFailure(String collection, int batchIndex, BulkResult result, int attempts) {
        List<String> ids = result.itemFailures().stream().map(BulkResult.ItemFailure::id).toList();
        String reason = result.itemFailures().get(0).reason();
        return new BatchFailure(collection, batchIndex, ids, reason, attempts);
    }

    private Mono<Void> refreshIfEnabled(String collection) {
        if (!sink.refreshAfterWrite()) return Mono.empty();
        return client.refresh(collection)
                .onErrorResume(e -> {
                    log.warn("Refresh of '{}' failed: {}", collection, TransientErrors.describe(e));
                    return Mono.empty();
                });
    }

    private void logResult(CollectionWriteResult r) {
        if (r.hasFailures()) {
            log.warn("Wrote {}/{} documents to '{}' in {} batches, {} batches failed",
                    r.written(), r.attempted(), r.collection(), r.batches(), r.failures().size());
        } else {
            log.info("Wrote {} documents to '{}' in {} batches", r.written(), r.collection(), r.batches());
        }
    }
}
