package com.musicinsights.itunesinsights.application.ingest;

import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.Tally;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.BatchFailure;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.CollectionWriteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link RunSummary} 단위 테스트.
 *
 * <p>최종 단계와 실패 배치 유무에 따른 종료 코드와 합계 계산을 검증한다.</p>
 */
@DisplayName("실행 요약 테스트")
class RunSummaryTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private static RunSummary summary(PipelineState state, List<BatchFailure> failures) {
        CollectionWriteResult tracks = new CollectionWriteResult("tracks", 10, 10 - failures.size(), 5, failures, 2);
        return new RunSummary(state, List.of(PipelineState.NOT_STARTED, state), new Tally(10, 10, 0, 0, 0),
                1, 1, 1, List.of(tracks), failures, null, START, START.plusSeconds(3));
    }

    /**
     * 종료 코드: 성공 0, 실패 배치가 있는 완료 1, FAILED 2.
     */
    @DisplayName("종료 코드 0/1/2 검증")
    @Test
    void exitCode_reflectsOutcome() {
        BatchFailure failure = new BatchFailure("tracks", 2, List.of("5"), "ConnectException: refused", 4);

        assertEquals(0, summary(PipelineState.COMPLETED, List.of()).exitCode());
        assertEquals(1, summary(PipelineState.COMPLETED, List.of(failure)).exitCode());
        assertEquals(2, summary(PipelineState.FAILED, List.of()).exitCode());
        assertTrue(summary(PipelineState.COMPLETED, List.of()).succeeded());
    }

    /**
     * 저장/실패/삭제 문서 수와 소요 시간이 계산되는지 검증한다.
     */
    @DisplayName("합계/소요 시간 계산 검증")
    @Test
    void totals() {
        BatchFailure failure = new BatchFailure("tracks", 2, List.of("5"), "ConnectException: refused", 4);
        RunSummary s = summary(PipelineState.COMPLETED, List.of(failure));

        assertEquals(9, s.documentsWritten());
        assertEquals(1, s.documentsFailed());
        assertEquals(2, s.documentsRemoved());
        assertEquals(3, s.elapsed().getSeconds());
    }
}
