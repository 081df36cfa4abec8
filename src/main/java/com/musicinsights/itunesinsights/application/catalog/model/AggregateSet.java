package com.musicinsights.itunesinsights.application.catalog.model;

import java.util.List;

/**
 * 트랙 전체로부터 계산된 집계 결과 묶음. 각 목록은 집계 키 순으로 정렬되어 있다.
 *
 * @param artists 아티스트 집계
 * @param albums  앨범 집계
 * @param genres  장르 집계
 */
public record AggregateSet(
        List<ArtistSummary> artists,
        List<AlbumSummary> albums,
        List<GenreSummary> genres
) {
    public AggregateSet {
        artists = List.copyOf(artists);
        albums = List.copyOf(albums);
        genres = List.copyOf(genres);
    }
}
