package com.musicinsights.itunesinsights.application.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static com.musicinsights.itunesinsights.application.ingest.PipelineState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link PipelineState} / {@link PipelineRun} 단위 테스트.
 *
 * <p>허용된 단계 전이와, 허용되지 않은 전이에서 {@link IllegalStateException}이 발생하는지 검증한다.</p>
 */
@DisplayName("파이프라인 상태 전이 테스트")
class PipelineStateTest {

    /**
     * 정상 경로의 전이가 모두 허용되는지 검증한다.
     */
    @DisplayName("정상 경로 전이 허용")
    @Test
    void happyPath_isAllowed() {
        assertTrue(NOT_STARTED.canTransitionTo(READING));
        assertTrue(READING.canTransitionTo(NORMALIZING));
        assertTrue(NORMALIZING.canTransitionTo(AGGREGATING));
        assertTrue(AGGREGATING.canTransitionTo(WRITING));
        assertTrue(WRITING.canTransitionTo(COMPLETED));
    }

    /**
     * FAILED는 READING과 WRITING에서만 도달할 수 있는지 검증한다.
     */
    @DisplayName("FAILED는 READING/WRITING에서만 도달")
    @Test
    void failed_onlyFromReadingOrWriting() {
        assertTrue(READING.canTransitionTo(FAILED));
        assertTrue(WRITING.canTransitionTo(FAILED));
        assertFalse(NOT_STARTED.canTransitionTo(FAILED));
        assertFalse(NORMALIZING.canTransitionTo(FAILED));
        assertFalse(AGGREGATING.canTransitionTo(FAILED));
    }

    /**
     * 종료 단계에서는 어떤 전이도 허용되지 않는지 검증한다.
     */
    @DisplayName("종료 단계 이후 전이 불가")
    @Test
    void terminalStates_allowNothing() {
        for (PipelineState next : PipelineState.values()) {
            assertFalse(COMPLETED.canTransitionTo(next));
            assertFalse(FAILED.canTransitionTo(next));
        }
        assertTrue(COMPLETED.isTerminal());
        assertTrue(FAILED.isTerminal());
        assertFalse(WRITING.isTerminal());
    }

    /**
     * 단계를 건너뛰는 전이는 IllegalStateException을 던지는지 검증한다.
     */
    @DisplayName("단계 건너뛰기는 IllegalStateException")
    @Test
    void run_illegalTransition_throws() {
        PipelineRun run = new PipelineRun(Path.of("library.xml"), Instant.now());
        run.transitionTo(READING);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> run.transitionTo(WRITING));
        assertTrue(ex.getMessage().contains("READING -> WRITING"));
        assertEquals(READING, run.state());
    }
}
