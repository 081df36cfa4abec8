package com.musicinsights.itunesinsights.application.catalog.model;

import java.time.Instant;
import java.util.List;

/**
 * 아티스트 단위 집계 레코드.
 *
 * @param name           아티스트 이름(집계 키)
 * @param trackCount     트랙 수
 * @param totalPlayCount 재생 횟수 합계
 * @param totalSkipCount 건너뛴 횟수 합계
 * @param averageRating  평점이 있는 트랙의 평균 평점(없으면 null)
 * @param totalTimeMs    재생 시간 합계(밀리초)
 * @param albums         앨범명 목록(정렬, 중복 제거)
 * @param genres         장르 목록(정렬, 중복 제거)
 * @param firstAdded     가장 이른 추가 시각
 * @param lastPlayed     가장 최근 재생 시각
 */
public record ArtistSummary(
        String name,
        int trackCount,
        long totalPlayCount,
        long totalSkipCount,
        Double averageRating,
        long totalTimeMs,
        List<String> albums,
        List<String> genres,
        Instant firstAdded,
        Instant lastPlayed
) {
    public ArtistSummary {
        albums = List.copyOf(albums);
        genres = List.copyOf(genres);
    }
}
