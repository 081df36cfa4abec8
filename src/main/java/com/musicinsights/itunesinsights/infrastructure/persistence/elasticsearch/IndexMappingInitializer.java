package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 쓰기 전에 네 개 인덱스가 mapping과 함께 존재하도록 보장합니다.
 * <p>
 * mapping은 classpath의 {@code elasticsearch/mappings/<index>.json}에서 읽습니다.
 * 이미 존재하는 인덱스는 건드리지 않으며, 데이터를 삭제하지 않습니다.
 */
@Component
public class IndexMappingInitializer {

    private static final Logger log = LoggerFactory.getLogger(IndexMappingInitializer.class);

    static final String MAPPING_LOCATION = "elasticsearch/mappings/%s.json";

    private final DocumentStoreClient client;

    public IndexMappingInitializer(DocumentStoreClient client) {
        this.client = client;
    }

    /**
     * 없는 인덱스만 생성합니다(쓰기 순서대로 하나씩).
     *
     * @return 완료 시그널
     */
    public Mono<Void> ensureIndices() {
        return Flux.fromIterable(IndexNames.ALL)
                .concatMap(this::ensureIndex)
                .then();
    }

    private Mono<Void> ensureIndex(String index) {
        return client.indexExists(index)
                .flatMap(exists -> {
                    if (exists) {
                        log.debug("Index '{}' already exists", index);
                        return Mono.<Void>empty();
                    }
                    return loadMapping(index)
                            .flatMap(mapping -> client.createIndex(index, mapping))
                            .doOnSuccess(v -> log.info("Created index '{}'", index));
                });
    }

    /**
     * classpath에서 인덱스 mapping(JSON)을 읽습니다.
     *
     * @param index 인덱스 이름
     * @return mapping 본문
     */
    Mono<String> loadMapping(String index) {
        return Mono.fromCallable(() -> {
                    ClassPathResource resource = new ClassPathResource(MAPPING_LOCATION.formatted(index));
                    try (InputStream in = resource.getInputStream()) {
                        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Cannot load mapping for index '" + index + "'", e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
