package com.musicinsights.itunesinsights.application.ingest;

import com.musicinsights.itunesinsights.application.catalog.model.AggregateSet;
import com.musicinsights.itunesinsights.application.catalog.model.Track;
import com.musicinsights.itunesinsights.application.catalog.service.LibraryAggregator;
import com.musicinsights.itunesinsights.application.common.error.SinkWriteException;
import com.musicinsights.itunesinsights.application.common.error.SourceReadException;
import com.musicinsights.itunesinsights.infrastructure.config.LibraryIngestProperties;
import com.musicinsights.itunesinsights.infrastructure.input.plist.PlistLibraryReader;
import com.musicinsights.itunesinsights.infrastructure.input.plist.RawTrackEntry;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.NormalizationResult;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.CollectionWriteResult;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.DocumentMapper;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.DocumentSinkWriter;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.IndexMappingInitializer;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.IndexNames;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.IndexedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * 라이브러리 export를 읽어 트랙/집계 문서를 색인하는 파이프라인 서비스입니다.
 * <p>
 * 단계는 순서대로 실행됩니다:
 * 읽기(전체 수집) → 정규화 → 집계 → 쓰기(tracks → artists → albums → genres)
 * <p>
 * 모든 문서는 결정적 ID로 upsert 하므로 같은 export로 다시 실행해도 저장소 내용은 같습니다.
 * 문서마다 실행 ID(run_id)를 붙이고, 컬렉션을 실패 없이 쓴 뒤에는 현재 export가 만들지 않은 이전 문서를 삭제합니다.
 * 원본 오류와 fail-fast 중단은 {@link PipelineState#FAILED} 요약으로, 나머지 배치 실패는 요약의 실패 목록으로 반환합니다.
 */
@Service
public class LibraryIndexService {

    private static final Logger log = LoggerFactory.getLogger(LibraryIndexService.class);

    private final PlistLibraryReader reader;
    private final TrackNormalizer normalizer;
    private final LibraryAggregator aggregator;
    private final DocumentMapper documents;
    private final DocumentSinkWriter writer;
    private final IndexMappingInitializer indexInitializer;
    private final LibraryIngestProperties properties;

    public LibraryIndexService(
            PlistLibraryReader reader,
            TrackNormalizer normalizer,
            LibraryAggregator aggregator,
            DocumentMapper documents,
            DocumentSinkWriter writer,
            IndexMappingInitializer indexInitializer,
            LibraryIngestProperties properties
    ) {
        this.reader = reader;
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.documents = documents;
        this.writer = writer;
        this.indexInitializer = indexInitializer;
        this.properties = properties;
    }

    /**
     * 설정된 경로({@code library.export-path})의 export로 파이프라인을 실행합니다.
     *
     * @return 실행 요약
     */
    public Mono<RunSummary> run() {
        return run(Path.of(properties.exportPath()));
    }

    /**
     * 지정한 export로 파이프라인을 1회 실행합니다.
     *
     * @param exportPath 라이브러리 export 파일 경로
     * @return 실행 요약(실패해도 에러 시그널 대신 FAILED 요약을 방출)
     */
    public Mono<RunSummary> run(Path exportPath) {
        return Mono.defer(() -> {
            PipelineRun run = new PipelineRun(exportPath, Instant.now());
            run.transitionTo(PipelineState.READING);

            return reader.read(exportPath)
                    .collectList()
                    .flatMap(raw -> {
                        NormalizationResult normalized = normalize(run, raw);
                        AggregateSet aggregates = aggregate(run, normalized.tracks());
                        return write(run, normalized.tracks(), aggregates);
                    })
                    .then(Mono.fromSupplier(run::complete))
                    .onErrorResume(SourceReadException.class, e -> {
                        log.error("Cannot read library export [{}]: {}", e.code(), e.getMessage());
                        return Mono.just(run.fail(e));
                    })
                    .onErrorResume(SinkWriteException.class, e -> {
                        log.error("Aborting run [{}]: {}", e.code(), e.getMessage());
                        return Mono.just(run.fail(e));
                    })
                    .doOnNext(this::logSummary);
        });
    }

    private NormalizationResult normalize(PipelineRun run, List<RawTrackEntry> raw) {
        run.transitionTo(PipelineState.NORMALIZING);
        NormalizationResult result = normalizer.normalizeAll(raw);
        run.normalized(result.tally());
        log.info("Normalized {} of {} entries", result.tally().normalized(), result.tally().read());
        return result;
    }

    private AggregateSet aggregate(PipelineRun run, List<Track> tracks) {
        run.transitionTo(PipelineState.AGGREGATING);
        AggregateSet aggregates = aggregator.aggregate(tracks);
        run.aggregated(aggregates);
        log.info("Aggregated {} artists, {} albums, {} genres",
                aggregates.artists().size(), aggregates.albums().size(), aggregates.genres().size());
        return aggregates;
    }

    private Mono<Void> write(PipelineRun run, List<Track> tracks, AggregateSet aggregates) {
        run.transitionTo(PipelineState.WRITING);
        String runId = run.runId();

        return prepareIndices()
                .thenMany(Flux.concat(
                        writeCollection(IndexNames.TRACKS, tracks, documents::track, runId),
                        writeCollection(IndexNames.ARTISTS, aggregates.artists(), documents::artist, runId),
                        writeCollection(IndexNames.ALBUMS, aggregates.albums(), documents::album, runId),
                        writeCollection(IndexNames.GENRES, aggregates.genres(), documents::genre, runId)
                ))
                .doOnNext(run::written)
                .then();
    }

    /**
     * 컬렉션을 이번 실행 ID로 쓴 뒤, 모든 배치가 성공했을 때만 이전 실행이 남긴 문서를 지웁니다.
     * 실패한 배치가 있으면 해당 문서의 이전 내용을 보존하기 위해 정리를 건너뜁니다.
     */
    private <T> Mono<CollectionWriteResult> writeCollection(
            String collection, List<T> records, Function<T, IndexedDocument> toDocument, String runId
    ) {
        return writer.write(collection, records, r -> toDocument.apply(r).withRunId(runId))
                .flatMap(result -> {
                    if (result.hasFailures()) {
                        log.warn("Keeping earlier documents in '{}': {} batches failed", collection, result.failures().size());
                        return Mono.just(result);
                    }
                    return writer.removeOtherRuns(collection, runId)
                            .map(result::withRemoved)
                            .onErrorResume(e -> {
                                log.warn("Cleanup of earlier documents in '{}' failed, they remain until the next run: {}",
                                        collection, e.toString());
                                return Mono.just(result);
                            });
                });
    }

    /**
     * 인덱스 mapping을 준비합니다. 실패해도 저장소가 첫 쓰기 때 인덱스를 만들므로 실행은 계속합니다.
     */
    private Mono<Void> prepareIndices() {
        if (!properties.sink().createIndices()) return Mono.empty();
        return indexInitializer.ensureIndices()
                .onErrorResume(e -> {
                    log.warn("Index initialization failed, continuing with existing indices: {}", e.toString());
                    return Mono.empty();
                });
    }

    private void logSummary(RunSummary s) {
        var t = s.tally();
        if (s.state() == PipelineState.FAILED) {
            log.error("Run FAILED after {} ms: {} (written={}, failedBatches={})",
                    s.elapsed().toMillis(), s.failureMessage(), s.documentsWritten(), s.failures().size());
            return;
        }
        log.info("Run {} in {} ms: read={}, normalized={}, skippedMissingId={}, skippedUnusable={}, duplicateIds={}, "
                        + "artists={}, albums={}, genres={}, written={}, removed={}",
                s.state(), s.elapsed().toMillis(), t.read(), t.normalized(), t.skippedMissingId(),
                t.skippedUnusable(), t.duplicateIds(), s.artistCount(), s.albumCount(), s.genreCount(),
                s.documentsWritten(), s.documentsRemoved());
        if (!s.failures().isEmpty()) {
            log.warn("{} batches failed ({} documents not written)", s.failures().size(), s.documentsFailed());
            s.failures().forEach(f -> log.warn("  {} batch {}: {} documents, {} attempts, reason={}",
                    f.collection(), f.batchIndex(), f.documentIds().size(), f.attempts(), f.reason()));
        }
    }
}
