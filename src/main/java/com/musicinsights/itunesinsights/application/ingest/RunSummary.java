package com.musicinsights.itunesinsights.application.ingest;

import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.Tally;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.BatchFailure;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.CollectionWriteResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 파이프라인 1회 실행 결과 요약.
 *
 * @param state          최종 단계(COMPLETED 또는 FAILED)
 * @param stateHistory   거쳐 간 단계 목록(NOT_STARTED부터)
 * @param tally          정규화 집계(읽음/정규화/스킵/중복)
 * @param artistCount    아티스트 집계 레코드 수
 * @param albumCount     앨범 집계 레코드 수
 * @param genreCount     장르 집계 레코드 수
 * @param writeResults   컬렉션별 쓰기 결과(쓰기 순서)
 * @param failures       복구하지 못한 배치 목록
 * @param failureMessage FAILED일 때 원인 메시지, 그 외 null
 * @param startedAt      시작 시각
 * @param finishedAt     종료 시각
 */
public record RunSummary(
        PipelineState state,
        List<PipelineState> stateHistory,
        Tally tally,
        int artistCount,
        int albumCount,
        int genreCount,
        List<CollectionWriteResult> writeResults,
        List<BatchFailure> failures,
        String failureMessage,
        Instant startedAt,
        Instant finishedAt
) {
    public RunSummary {
        stateHistory = List.copyOf(stateHistory);
        writeResults = List.copyOf(writeResults);
        failures = List.copyOf(failures);
        if (tally == null) tally = Tally.empty();
    }

    /**
     * 프로세스 종료 코드.
     * <ul>
     *     <li>0: 모든 배치 성공</li>
     *     <li>1: 완료했지만 실패한 배치가 있음</li>
     *     <li>2: 실행 실패(원본 오류 또는 fail-fast 중단)</li>
     * </ul>
     *
     * @return 종료 코드
     */
    public int exitCode() {
        if (state != PipelineState.COMPLETED) return 2;
        return failures.isEmpty() ? 0 : 1;
    }

    public boolean succeeded() {
        return exitCode() == 0;
    }

    /** 모든 컬렉션에 저장된 문서 수 */
    public long documentsWritten() {
        return writeResults.stream().mapToLong(CollectionWriteResult::written).sum();
    }

    /** 현재 export에 없어 삭제된 이전 실행 문서 수 */
    public long documentsRemoved() {
        return writeResults.stream().mapToLong(CollectionWriteResult::removed).sum();
    }

    public long documentsFailed() {
        return failures.stream().mapToLong(f -> f.documentIds().size()).sum();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
