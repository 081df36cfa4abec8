package com.musicinsights.itunesinsights.application.catalog.model;

import java.time.Instant;
import java.util.List;

/**
 * 앨범 단위 집계 레코드. {@code (artist, name)} 쌍이 집계 키이다.
 *
 * @param artist         아티스트(없으면 "Unknown Artist")
 * @param name           앨범명
 * @param trackCount     트랙 수
 * @param year           트랙 연도의 최빈값(동률이면 더 이른 연도)
 * @param totalPlayCount 재생 횟수 합계
 * @param averageRating  평균 평점(없으면 null)
 * @param totalTimeMs    재생 시간 합계(밀리초)
 * @param averageBitRate 평균 비트레이트(없으면 null)
 * @param genres         장르 목록(정렬, 중복 제거)
 * @param compilation    컴필레이션 트랙 포함 여부
 * @param firstAdded     가장 이른 추가 시각
 * @param lastAdded      가장 늦은 추가 시각
 */
public record AlbumSummary(
        String artist,
        String name,
        int trackCount,
        Integer year,
        long totalPlayCount,
        Double averageRating,
        long totalTimeMs,
        Double averageBitRate,
        List<String> genres,
        boolean compilation,
        Instant firstAdded,
        Instant lastAdded
) {
    public AlbumSummary {
        genres = List.copyOf(genres);
    }
}
