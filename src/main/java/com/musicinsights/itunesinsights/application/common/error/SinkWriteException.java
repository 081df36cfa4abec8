package com.musicinsights.itunesinsights.application.common.error;

import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.BatchFailure;
import com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch.CollectionWriteResult;

/**
 * 문서 저장소에 배치를 쓰지 못했을 때 발생하는 예외.
 *
 * <p>{@link #retryable()}이 true이면 일시적 장애(연결/타임아웃/429/5xx)로 보고 재시도 대상이 된다.
 * 재시도를 모두 소진한 뒤 fail-fast 모드에서는 실패한 배치 정보({@link #failure()})와
 * 중단 전까지 끝난 배치의 합계({@link #partialResult()})를 담아 실행을 중단시킨다.</p>
 */
public class SinkWriteException extends RuntimeException {
    private final boolean retryable;
    private final BatchFailure failure;
    private final CollectionWriteResult partialResult;

    public SinkWriteException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
        this.failure = null;
        this.partialResult = null;
    }

    public SinkWriteException(BatchFailure failure, Throwable cause) {
        this(failure, null, cause);
    }

    public SinkWriteException(BatchFailure failure, CollectionWriteResult partialResult, Throwable cause) {
        super("Batch " + failure.batchIndex() + " of '" + failure.collection() + "' failed: " + failure.reason(), cause);
        this.retryable = false;
        this.failure = failure;
        this.partialResult = partialResult;
    }

    /**
     * 재시도 가능 여부를 반환한다.
     *
     * @return 일시적 장애이면 true
     */
    public boolean retryable() {
        return retryable;
    }

    /**
     * 실패한 배치 정보를 반환한다. 재시도 전 단계의 예외이면 null.
     *
     * @return 실패한 배치 정보 또는 null
     */
    public BatchFailure failure() {
        return failure;
    }

    /**
     * 중단된 컬렉션에서 중단 전까지 끝난 배치(중단시킨 배치 포함)의 합계를 반환한다. 없으면 null.
     *
     * @return 부분 쓰기 결과 또는 null
     */
    public CollectionWriteResult partialResult() {
        return partialResult;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return retryable ? "SINK_TRANSIENT" : "SINK_WRITE_FAILED";
    }
}
