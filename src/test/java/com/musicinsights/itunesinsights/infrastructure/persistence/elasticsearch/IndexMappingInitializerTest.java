package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tools.jackson.databind.json.JsonMapper;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * {@link IndexMappingInitializer} 단위 테스트.
 *
 * <p>없는 인덱스만 classpath mapping으로 생성하고, 기존 인덱스는 건드리지 않는지 검증한다.</p>
 */
@DisplayName("인덱스 mapping 초기화 테스트")
class IndexMappingInitializerTest {

    /**
     * 없는 인덱스만 생성하고, 쓰기 순서대로 확인하는지 검증한다.
     */
    @DisplayName("없는 인덱스만 생성")
    @Test
    void ensureIndices_createsOnlyMissing() {
        // given
        DocumentStoreClient client = mock(DocumentStoreClient.class);
        when(client.indexExists(anyString())).thenReturn(Mono.just(false));
        when(client.indexExists(IndexNames.TRACKS)).thenReturn(Mono.just(true));
        when(client.createIndex(anyString(), anyString())).thenReturn(Mono.empty());

        IndexMappingInitializer initializer = new IndexMappingInitializer(client);

        // when / then
        StepVerifier.create(initializer.ensureIndices()).verifyComplete();

        verify(client, never()).createIndex(eq(IndexNames.TRACKS), anyString());
        InOrder inOrder = inOrder(client);
        inOrder.verify(client).indexExists(IndexNames.TRACKS);
        inOrder.verify(client).indexExists(IndexNames.ARTISTS);
        inOrder.verify(client).createIndex(eq(IndexNames.ARTISTS), contains("\"total_play_count\""));
        inOrder.verify(client).indexExists(IndexNames.ALBUMS);
        inOrder.verify(client).createIndex(eq(IndexNames.ALBUMS), anyString());
        inOrder.verify(client).indexExists(IndexNames.GENRES);
        inOrder.verify(client).createIndex(eq(IndexNames.GENRES), anyString());
    }

    /**
     * 확인 요청이 실패하면 에러를 전파하는지 검증한다(계속 진행 여부는 호출하는 쪽이 결정).
     */
    @DisplayName("확인 실패는 에러로 전파")
    @Test
    void ensureIndices_propagatesErrors() {
        DocumentStoreClient client = mock(DocumentStoreClient.class);
        when(client.indexExists(anyString())).thenReturn(Mono.error(new IllegalStateException("security_exception")));

        StepVerifier.create(new IndexMappingInitializer(client).ensureIndices())
                .expectError(IllegalStateException.class)
                .verify();
    }

    /**
     * 네 개 인덱스의 mapping 리소스가 모두 유효한 JSON이며 mappings.properties와 run_id 필드를 가지는지 검증한다.
     */
    @DisplayName("mapping 리소스 JSON 유효성 검증")
    @Test
    void loadMapping_resourcesAreValidJson() {
        IndexMappingInitializer initializer = new IndexMappingInitializer(mock(DocumentStoreClient.class));
        JsonMapper json = JsonMapper.builder().build();

        for (String index : IndexNames.ALL) {
            String mapping = initializer.loadMapping(index).block();
            assertNotNull(mapping, index);

            Map<?, ?> root = json.readValue(mapping, Map.class);
            Map<?, ?> mappings = assertInstanceOf(Map.class, root.get("mappings"));
            Map<?, ?> properties = assertInstanceOf(Map.class, mappings.get("properties"));
            assertTrue(properties.containsKey("name") || properties.containsKey("track_id"), index);
            // 이전 실행 문서 정리에 쓰는 run_id는 keyword여야 term 조회가 가능
            Map<?, ?> runId = assertInstanceOf(Map.class, properties.get(IndexedDocument.RUN_ID_FIELD), index);
            assertEquals("keyword", runId.get("type"), index);
        }
    }
}
