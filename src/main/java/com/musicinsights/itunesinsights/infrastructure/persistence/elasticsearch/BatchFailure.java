package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import java.util.List;

/**
 * 복구하지 못한 배치(또는 배치 안의 일부 문서) 정보.
 *
 * @param collection  대상 컬렉션
 * @param batchIndex  컬렉션 안에서의 배치 순번(0부터)
 * @param documentIds 쓰지 못한 문서 ID
 * @param reason      마지막 실패 사유
 * @param attempts    시도 횟수
 */
public record BatchFailure(
        String collection,
        int batchIndex,
        List<String> documentIds,
        String reason,
        int attempts
) {
    public BatchFailure {
        documentIds = List.copyOf(documentIds);
    }
}
