package com.musicinsights.itunesinsights.infrastructure.input.plist;

import java.util.Map;

/**
 * export의 {@code Tracks} dict 안에 있는 "한 항목(= 한 트랙)"을 해석 없이 담는 원본 객체입니다.
 * <p>
 * 값의 타입은 plist 요소에 따라 {@link String}, {@link Long}, {@link Double},
 * {@link java.time.Instant}, {@link Boolean}, 중첩 {@link Map}/{@link java.util.List}가 될 수 있으며,
 * 타입 검증은 Normalizer에서 수행합니다.
 *
 * @param sourceKey {@code Tracks} dict에서 이 항목을 가리키는 key
 * @param fields    필드명(예: "Name", "Play Count") → 원본 값
 */
public record RawTrackEntry(String sourceKey, Map<String, Object> fields) {

    public RawTrackEntry {
        fields = (fields == null) ? Map.of() : fields;
    }

    /**
     * 필드 값을 조회합니다.
     *
     * @param field 필드명
     * @return 원본 값 또는 null
     */
    public Object get(String field) {
        return fields.get(field);
    }
}
