package com.musicinsights.itunesinsights.application.ingest;

import com.musicinsights.itunesinsights.application.catalog.model.AggregateSet;
import com.musicinsights.itunesinsights.application.common.error.SinkWriteException;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.Tally;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.BatchFailure;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.CollectionWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 실행 1회의 진행 상태를 기록한다. 실행마다 새로 만들며 실행 간에 공유하지 않는다.
 */
final class PipelineRun {

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

    private final String runId = UUID.randomUUID().toString();
    private final Path source;
    private final Instant startedAt;

    private PipelineState state = PipelineState.NOT_STARTED;
    private final List<PipelineState> history = new ArrayList<>(List.of(PipelineState.NOT_STARTED));

    private Tally tally = Tally.empty();
    private AggregateSet aggregates = new AggregateSet(List.of(), List.of(), List.of());
    private final List<CollectionWriteResult> writeResults = new ArrayList<>();
    private final List<BatchFailure> failures = new ArrayList<>();

    PipelineRun(Path source, Instant startedAt) {
        this.source = source;
        this.startedAt = startedAt;
    }

    /**
     * 다음 단계로 전이한다.
     *
     * @param next 다음 단계
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    synchronized void transitionTo(PipelineState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
        }
        log.info("Pipeline {} -> {} ({}, run {})", state, next, source, runId);
        state = next;
        history.add(next);
    }

    /** 이번 실행이 쓴 문서에 붙는 ID */
    String runId() {
        return runId;
    }

    synchronized PipelineState state() {
        return state;
    }

    synchronized void normalized(Tally tally) {
        this.tally = tally;
    }

    synchronized void aggregated(AggregateSet aggregates) {
        this.aggregates = aggregates;
    }

    synchronized void written(CollectionWriteResult result) {
        writeResults.add(result);
        failures.addAll(result.failures());
    }

    RunSummary complete() {
        transitionTo(PipelineState.COMPLETED);
        return summary(null);
    }

    /**
     * 실행을 실패로 종료한다. fail-fast 중단이면 중단 전까지 쓴 배치 결과와 중단시킨 배치를 요약에 남긴다.
     *
     * @param cause 실패 원인
     * @return 실패 요약
     */
    RunSummary fail(Throwable cause) {
        transitionTo(PipelineState.FAILED);
        if (cause instanceof SinkWriteException s) {
            if (s.partialResult() != null) {
                written(s.partialResult());
            } else if (s.failure() != null) {
                synchronized (this) {
                    failures.add(s.failure());
                }
            }
        }
        return summary(cause.getMessage());
    }

    private synchronized RunSummary summary(String failureMessage) {
        return new RunSummary(
                state,
                history,
                tally,
                aggregates.artists().size(),
                aggregates.albums().size(),
                aggregates.genres().size(),
                writeResults,
                failures,
                failureMessage,
                startedAt,
                Instant.now()
        );
    }
}
