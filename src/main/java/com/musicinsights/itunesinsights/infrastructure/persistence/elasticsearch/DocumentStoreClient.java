package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 문서 저장소에 대한 최소 연산 집합.
 *
 * <p>모든 쓰기는 문서 ID 기준 upsert이므로 같은 요청을 다시 보내도 결과가 같다.</p>
 */
public interface DocumentStoreClient {

    /**
     * 문서 목록을 한 번의 bulk 요청으로 upsert한다.
     * <p>
     * 요청 자체가 실패하면 에러 시그널을, 일부 문서만 거부되면 {@link BulkResult#itemFailures()}를 채워 반환한다.
     *
     * @param index     대상 인덱스
     * @param documents 문서 목록(비어있지 않음)
     * @return bulk 결과
     */
    Mono<BulkResult> bulkUpsert(String index, List<IndexedDocument> documents);

    /**
     * 인덱스 존재 여부를 확인한다.
     *
     * @param index 인덱스 이름
     * @return 존재하면 true
     */
    Mono<Boolean> indexExists(String index);

    /**
     * mapping과 함께 인덱스를 생성한다.
     *
     * @param index       인덱스 이름
     * @param mappingJson 인덱스 생성 요청 본문(JSON)
     * @return 완료 시그널
     */
    Mono<Void> createIndex(String index, String mappingJson);

    /**
     * 지정한 실행이 쓰지 않은 문서(run_id가 다르거나 없는 문서)를 모두 삭제한다.
     * <p>
     * 인덱스가 없으면 삭제할 문서도 없으므로 0을 반환한다.
     *
     * @param index 인덱스 이름
     * @param runId 유지할 실행 ID
     * @return 삭제한 문서 수
     */
    Mono<Long> deleteOtherRuns(String index, String runId);

    /**
     * 쓰기 결과가 검색에 반영되도록 인덱스를 refresh 한다.
     *
     * @param index 인덱스 이름
     * @return 완료 시그널
     */
    Mono<Void> refresh(String index);
}
