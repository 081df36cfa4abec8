package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import java.util.List;

/**
 * 컬렉션 하나에 대한 쓰기 결과 합계.
 *
 * @param collection 컬렉션 이름
 * @param attempted  쓰려고 한 문서 수
 * @param written    저장된 문서 수
 * @param batches    배치 수
 * @param failures   실패한 배치 목록(배치 순번 순)
 * @param removed    이전 실행이 남겨 삭제한 문서 수
 */
public record CollectionWriteResult(
        String collection,
        long attempted,
        long written,
        int batches,
        List<BatchFailure> failures,
        long removed
) {
    public CollectionWriteResult {
        failures = List.copyOf(failures);
    }

    /**
     * 배치 결과들을 합산한다.
     *
     * @param collection 컬렉션 이름
     * @param results    배치 결과(순서 유지)
     * @return 합산 결과
     */
    public static CollectionWriteResult of(String collection, List<BatchResult> results) {
        long attempted = 0;
        long written = 0;
        for (BatchResult r : results) {
            attempted += r.attempted();
            written += r.written();
        }
        List<BatchFailure> failures = results.stream()
                .filter(BatchResult::failed)
                .map(BatchResult::failure)
                .toList();
        return new CollectionWriteResult(collection, attempted, written, results.size(), failures, 0);
    }

    /**
     * 이전 실행 문서 삭제 수를 채운 사본을 반환한다.
     *
     * @param removed 삭제한 문서 수
     * @return 새 결과
     */
    public CollectionWriteResult withRemoved(long removed) {
        return new CollectionWriteResult(collection, attempted, written, batches, failures, removed);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
