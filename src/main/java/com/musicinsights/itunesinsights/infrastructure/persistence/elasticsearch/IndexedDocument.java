package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 저장소에 쓸 문서 하나.
 *
 * @param id     논리 키에서 유도한 결정적 문서 ID
 * @param source JSON으로 직렬화될 문서 본문(필드 순서 유지)
 */
public record IndexedDocument(String id, Map<String, Object> source) {

    /** 문서를 마지막으로 쓴 실행의 ID. 이전 실행이 남긴 문서를 찾는 데 쓴다. */
    public static final String RUN_ID_FIELD = "run_id";

    /**
     * 실행 ID를 붙인 사본을 반환한다.
     *
     * @param runId 실행 ID
     * @return run_id 필드가 추가된 문서
     */
    public IndexedDocument withRunId(String runId) {
        Map<String, Object> stamped = new LinkedHashMap<>(source);
        stamped.put(RUN_ID_FIELD, runId);
        return new IndexedDocument(id, stamped);
    }
}
