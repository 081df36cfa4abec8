package com.musicinsights.itunesinsights.application.catalog.service;

import com.musicinsights.itunesinsights.application.catalog.model.AggregateSet;
import com.musicinsights.itunesinsights.application.catalog.model.AlbumSummary;
import com.musicinsights.itunesinsights.application.catalog.model.ArtistSummary;
import com.musicinsights.itunesinsights.application.catalog.model.GenreSummary;
import com.musicinsights.itunesinsights.application.catalog.model.Track;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 트랙 전체로부터 아티스트/앨범/장르 집계를 계산하는 서비스.
 *
 * <p>순수 함수이며 입력 순서와 무관하게 같은 결과를 만든다.
 * 합계는 정수로 누적하고, 목록은 정렬된 집합으로 모으며, 결과는 집계 키 순으로 정렬한다.</p>
 */
@Service
public class LibraryAggregator {

    /** 아티스트가 없는 트랙을 앨범 집계에서 묶는 키 */
    public static final String UNKNOWN_ARTIST = "Unknown Artist";

    /** 앨범이 없는 트랙을 묶는 앨범 이름 */
    public static final String UNKNOWN_ALBUM = "Unknown";

    /** 장르가 없는 트랙을 묶는 장르 이름 */
    public static final String UNKNOWN_GENRE = "Unknown";

    /**
     * 트랙 목록을 집계한다.
     *
     * <ul>
     *   <li>아티스트: artist가 null인 트랙은 제외(대소문자 구분 정확 일치)</li>
     *   <li>앨범: (artist 또는 "Unknown Artist", album 또는 "Unknown") 기준</li>
     *   <li>장르: genre 또는 "Unknown" 기준</li>
     * </ul>
     * 모든 트랙이 앨범 하나와 장르 하나에 속하므로 앨범/장르의 track_count 합은 트랙 수와 같다.
     *
     * @param tracks 정규화된 트랙 목록
     * @return 집계 결과
     */
    public AggregateSet aggregate(Collection<Track> tracks) {
        Map<String, ArtistAcc> artists = new TreeMap<>();
        Map<AlbumKey, AlbumAcc> albums = new TreeMap<>();
        Map<String, GenreAcc> genres = new TreeMap<>();

        for (Track t : tracks) {
            if (t.artist() != null) {
                artists.computeIfAbsent(t.artist(), k -> new ArtistAcc()).add(t);
            }
            AlbumKey albumKey = albumKey(t);
            albums.computeIfAbsent(albumKey, k -> new AlbumAcc()).add(t);
            String genre = t.genre() == null ? UNKNOWN_GENRE : t.genre();
            genres.computeIfAbsent(genre, k -> new GenreAcc()).add(t, albumKey);
        }

        List<ArtistSummary> artistSummaries = new ArrayList<>(artists.size());
        artists.forEach((name, acc) -> artistSummaries.add(acc.toSummary(name)));

        List<AlbumSummary> albumSummaries = new ArrayList<>(albums.size());
        albums.forEach((key, acc) -> albumSummaries.add(acc.toSummary(key)));

        List<GenreSummary> genreSummaries = new ArrayList<>(genres.size());
        genres.forEach((name, acc) -> genreSummaries.add(acc.toSummary(name)));

        return new AggregateSet(artistSummaries, albumSummaries, genreSummaries);
    }

    private static AlbumKey albumKey(Track t) {
        return new AlbumKey(
                t.artist() == null ? UNKNOWN_ARTIST : t.artist(),
                t.album() == null ? UNKNOWN_ALBUM : t.album());
    }

    /** 앨범 집계 키. artist → album 순으로 정렬된다. */
    record AlbumKey(String artist, String album) implements Comparable<AlbumKey> {
        @Override
        public int compareTo(AlbumKey o) {
            int c = artist.compareTo(o.artist);
            return c != 0 ? c : album.compareTo(o.album);
        }
    }

    /** 세 집계가 공유하는 합계/평균 누적기. */
    private static class Totals {
        int trackCount;
        long playCount;
        long skipCount;
        long timeMs;
        long ratingSum;
        int ratingCount;
        long bitRateSum;
        int bitRateCount;

        void add(Track t) {
            trackCount++;
            playCount += t.playCount();
            skipCount += t.skipCount();
            if (t.totalTimeMs() != null) timeMs += t.totalTimeMs();
            if (t.rating() != null) {
                ratingSum += t.rating();
                ratingCount++;
            }
            if (t.bitRate() != null) {
                bitRateSum += t.bitRate();
                bitRateCount++;
            }
        }

        /** 평점이 있는 트랙이 없으면 null (0으로 나누지 않음) */
        Double averageRating() {
            return ratingCount == 0 ? null : (double) ratingSum / ratingCount;
        }

        Double averageBitRate() {
            return bitRateCount == 0 ? null : (double) bitRateSum / bitRateCount;
        }
    }

    private static final class ArtistAcc extends Totals {
        final Set<String> albums = new TreeSet<>();
        final Set<String> genres = new TreeSet<>();
        Instant firstAdded;
        Instant lastPlayed;

        @Override
        void add(Track t) {
            super.add(t);
            if (t.album() != null) albums.add(t.album());
            if (t.genre() != null) genres.add(t.genre());
            firstAdded = min(firstAdded, t.dateAdded());
            lastPlayed = max(lastPlayed, t.lastPlayed());
        }

        ArtistSummary toSummary(String name) {
            return new ArtistSummary(name, trackCount, playCount, skipCount, averageRating(), timeMs,
                    List.copyOf(albums), List.copyOf(genres), firstAdded, lastPlayed);
        }
    }

    private static final class AlbumAcc extends Totals {
        final Map<Integer, Integer> yearCounts = new TreeMap<>();
        final Set<String> genres = new TreeSet<>();
        boolean compilation;
        Instant firstAdded;
        Instant lastAdded;

        @Override
        void add(Track t) {
            super.add(t);
            if (t.year() != null) yearCounts.merge(t.year(), 1, Integer::sum);
            if (t.genre() != null) genres.add(t.genre());
            compilation |= t.compilation();
            firstAdded = min(firstAdded, t.dateAdded());
            lastAdded = max(lastAdded, t.dateAdded());
        }

        /** 최빈 연도. 동률이면 더 이른 연도(TreeMap 오름차순 + strict 비교). */
        Integer modeYear() {
            Integer best = null;
            int bestCount = 0;
            for (Map.Entry<Integer, Integer> e : yearCounts.entrySet()) {
                if (e.getValue() > bestCount) {
                    best = e.getKey();
                    bestCount = e.getValue();
                }
            }
            return best;
        }

        AlbumSummary toSummary(AlbumKey key) {
            return new AlbumSummary(key.artist(), key.album(), trackCount, modeYear(), playCount,
                    averageRating(), timeMs, averageBitRate(), List.copyOf(genres), compilation,
                    firstAdded, lastAdded);
        }
    }

    private static final class GenreAcc extends Totals {
        final Set<String> artists = new TreeSet<>();
        final Set<AlbumKey> albums = new TreeSet<>();

        void add(Track t, AlbumKey albumKey) {
            super.add(t);
            if (t.artist() != null) artists.add(t.artist());
            albums.add(albumKey);
        }

        GenreSummary toSummary(String name) {
            return new GenreSummary(name, artists.size(), albums.size(), trackCount, playCount,
                    averageRating(), (double) playCount / trackCount, averageBitRate(), timeMs);
        }
    }

    private static Instant min(Instant current, Instant candidate) {
        if (candidate == null) return current;
        return (current == null || candidate.isBefore(current)) ? candidate : current;
    }

    private static Instant max(Instant current, Instant candidate) {
        if (candidate == null) return current;
        return (current == null || candidate.isAfter(current)) ? candidate : current;
    }
}
