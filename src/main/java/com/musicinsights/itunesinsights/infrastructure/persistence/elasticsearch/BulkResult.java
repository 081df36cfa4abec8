package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import java.util.List;

/**
 * bulk 요청 1회의 결과.
 *
 * @param attempted    요청한 문서 수
 * @param itemFailures 개별 문서 단위로 거부된 항목
 */
public record BulkResult(int attempted, List<ItemFailure> itemFailures) {

    public BulkResult {
        itemFailures = List.copyOf(itemFailures);
    }

    public static BulkResult ok(int attempted) {
        return new BulkResult(attempted, List.of());
    }

    /**
     * 거부된 문서 하나.
     *
     * @param id     문서 ID
     * @param status 항목별 HTTP 상태
     * @param reason 거부 사유
     */
    public record ItemFailure(String id, int status, String reason) {
        /** 429(too many requests)와 5xx는 다시 보내면 성공할 수 있다. */
        public boolean retryable() {
            return status == 429 || status >= 500;
        }
    }

    public int written() {
        return attempted - itemFailures.size();
    }

    public boolean hasRetryableFailures() {
        return itemFailures.stream().anyMatch(ItemFailure::retryable);
    }
}
