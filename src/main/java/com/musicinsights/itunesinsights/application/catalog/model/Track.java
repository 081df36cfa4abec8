package com.musicinsights.itunesinsights.application.catalog.model;

import java.time.Instant;

/**
 * 정규화된 트랙 레코드입니다.
 * <p>
 * export의 동적 타입 값은 Normalizer에서 모두 이 타입으로 변환되며,
 * 문자열 필드는 빈 값 대신 null, 카운트 필드는 null 대신 0을 가집니다.
 *
 * @param trackId      export의 Track ID(문서 식별자)
 * @param persistentId export의 Persistent ID
 * @param name         트랙 제목
 * @param artist       아티스트
 * @param albumArtist  앨범 아티스트
 * @param album        앨범명
 * @param genre        장르
 * @param composer     작곡가
 * @param kind         파일 종류(예: "MPEG audio file")
 * @param year         발매 연도
 * @param bitRate      비트레이트(kbps)
 * @param sampleRate   샘플레이트(Hz)
 * @param playCount    재생 횟수(0 이상)
 * @param skipCount    건너뛴 횟수(0 이상)
 * @param rating       평점(0~100)
 * @param totalTimeMs  재생 시간(밀리초)
 * @param trackNumber  트랙 번호
 * @param discNumber   디스크 번호
 * @param sizeBytes    파일 크기(byte)
 * @param dateAdded    라이브러리 추가 시각
 * @param dateModified 수정 시각
 * @param lastPlayed   마지막 재생 시각
 * @param releaseDate  발매 시각
 * @param compilation  컴필레이션 여부
 */
public record Track(
        String trackId,
        String persistentId,
        String name,
        String artist,
        String albumArtist,
        String album,
        String genre,
        String composer,
        String kind,
        Integer year,
        Integer bitRate,
        Integer sampleRate,
        int playCount,
        int skipCount,
        Integer rating,
        Long totalTimeMs,
        Integer trackNumber,
        Integer discNumber,
        Long sizeBytes,
        Instant dateAdded,
        Instant dateModified,
        Instant lastPlayed,
        Instant releaseDate,
        boolean compilation
) {

    /**
     * 핵심 필드만으로 트랙을 생성합니다. 나머지 필드는 null/0/false입니다.
     */
    public static Track of(
            String trackId,
            String name,
            String artist,
            String album,
            String genre,
            Integer year,
            Integer bitRate,
            int playCount,
            Integer rating,
            Long totalTimeMs,
            Instant dateAdded
    ) {
        return new Track(trackId, null, name, artist, null, album, genre, null, null,
                year, bitRate, null, playCount, 0, rating, totalTimeMs,
                null, null, null, dateAdded, null, null, null, false);
    }
}
