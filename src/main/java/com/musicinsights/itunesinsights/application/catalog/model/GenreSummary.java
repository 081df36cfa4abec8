package com.musicinsights.itunesinsights.application.catalog.model;

/**
 * 장르 단위 집계 레코드.
 *
 * @param name             장르명(집계 키)
 * @param artistCount      서로 다른 아티스트 수(null 아티스트 제외)
 * @param albumCount       서로 다른 (아티스트, 앨범) 수
 * @param trackCount       트랙 수
 * @param totalPlayCount   재생 횟수 합계
 * @param averageRating    평균 평점(없으면 null)
 * @param averagePlayCount 트랙당 평균 재생 횟수
 * @param averageBitRate   평균 비트레이트(없으면 null)
 * @param totalTimeMs      재생 시간 합계(밀리초)
 */
public record GenreSummary(
        String name,
        int artistCount,
        int albumCount,
        int trackCount,
        long totalPlayCount,
        Double averageRating,
        Double averagePlayCount,
        Double averageBitRate,
        long totalTimeMs
) {}
