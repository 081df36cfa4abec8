package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import java.util.List;

/**
 * 대상 컬렉션(Elasticsearch 인덱스) 이름.
 */
public final class IndexNames {
    private IndexNames() {}

    public static final String TRACKS = "tracks";
    public static final String ARTISTS = "artists";
    public static final String ALBUMS = "albums";
    public static final String GENRES = "genres";

    /** 쓰기 순서대로 나열한 전체 인덱스 */
    public static final List<String> ALL = List.of(TRACKS, ARTISTS, ALBUMS, GENRES);
}
