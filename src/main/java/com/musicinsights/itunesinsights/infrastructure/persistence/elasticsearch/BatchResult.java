package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

/**
 * 배치 1개의 쓰기 결과.
 *
 * @param collection 대상 컬렉션
 * @param batchIndex 배치 순번
 * @param attempted  배치의 문서 수
 * @param written    저장된 문서 수
 * @param failure    실패 정보(전부 성공이면 null)
 */
public record BatchResult(String collection, int batchIndex, int attempted, int written, BatchFailure failure) {

    public boolean failed() {
        return failure != null;
    }
}
