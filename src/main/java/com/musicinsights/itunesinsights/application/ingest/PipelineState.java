package com.musicinsights.itunesinsights.application.ingest;

/**
 * 파이프라인 실행 단계.
 *
 * <p>{@code NOT_STARTED → READING → NORMALIZING → AGGREGATING → WRITING → COMPLETED} 순서로만 진행하며,
 * {@code FAILED}는 READING(원본 오류)과 WRITING(fail-fast 중단)에서만 도달할 수 있다.</p>
 */
public enum PipelineState {
    NOT_STARTED,
    READING,
    NORMALIZING,
    AGGREGATING,
    WRITING,
    COMPLETED,
    FAILED;

    /**
     * 현재 단계에서 다음 단계로 전이할 수 있는지 확인한다.
     *
     * @param next 다음 단계
     * @return 허용된 전이이면 true
     */
    public boolean canTransitionTo(PipelineState next) {
        return switch (this) {
            case NOT_STARTED -> next == READING;
            case READING -> next == NORMALIZING || next == FAILED;
            case NORMALIZING -> next == AGGREGATING;
            case AGGREGATING -> next == WRITING;
            case WRITING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
