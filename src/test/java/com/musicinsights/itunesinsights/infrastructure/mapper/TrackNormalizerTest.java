package com.musicinsights.itunesinsights.infrastructure.mapper;

import com.musicinsights.itunesinsights.application.catalog.model.Track;
import com.musicinsights.itunesinsights.infrastructure.input.plist.RawTrackEntry;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.NormalizationResult;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.NormalizedEntry;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.SkipReason;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.SkippedEntry;
import com.musicinsights.itunesinsights.infrastructure.mapper.TrackNormalizer.Tally;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link TrackNormalizer} 단위 테스트.
 *
 * <p>원본 항목 → {@link Track} 변환 규칙(빈 값 null, 범위 밖 값 null/0),
 * 스킵 사유 분류, 중복 track_id 처리와 집계 불변식을 검증한다.</p>
 */
@DisplayName("트랙 정규화 테스트")
class TrackNormalizerTest {

    private final TrackNormalizer normalizer = new TrackNormalizer();

    private static RawTrackEntry entry(String key, Object... kv) {
        Map<String, Object> fields = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            fields.put((String) kv[i], kv[i + 1]);
        }
        return new RawTrackEntry(key, fields);
    }

    /**
     * 모든 필드가 있는 항목을 Track으로 변환하는지 검증한다.
     */
    @DisplayName("전체 필드 변환 검증")
    @Test
    void normalize_mapsAllFields() {
        RawTrackEntry raw = entry("7",
                "Track ID", 7L,
                "Persistent ID", "ABCDEF0123456789",
                "Name", " Hey Jude ",
                "Artist", "The Beatles",
                "Album Artist", "The Beatles",
                "Album", "Past Masters",
                "Genre", "Rock",
                "Composer", "Lennon-McCartney",
                "Kind", "AAC audio file",
                "Year", 1968L,
                "Bit Rate", 256L,
                "Sample Rate", 44100L,
                "Play Count", 12L,
                "Skip Count", 2L,
                "Rating", 100L,
                "Total Time", 431000L,
                "Track Number", 3L,
                "Disc Number", 2L,
                "Size", 13_000_000L,
                "Date Added", Instant.parse("2015-05-05T05:05:05Z"),
                "Date Modified", "2016-01-01T00:00:00Z",
                "Play Date UTC", Instant.parse("2024-02-02T02:02:02Z"),
                "Release Date", Instant.parse("1968-08-26T00:00:00Z"),
                "Compilation", Boolean.TRUE);

        NormalizedEntry n = normalizer.normalize(raw);

        assertFalse(n.isSkipped());
        Track t = n.track();
        assertEquals("7", t.trackId());
        assertEquals("ABCDEF0123456789", t.persistentId());
        assertEquals("Hey Jude", t.name());
        assertEquals("The Beatles", t.artist());
        assertEquals("Past Masters", t.album());
        assertEquals("Lennon-McCartney", t.composer());
        assertEquals(1968, t.year());
        assertEquals(256, t.bitRate());
        assertEquals(44100, t.sampleRate());
        assertEquals(12, t.playCount());
        assertEquals(2, t.skipCount());
        assertEquals(100, t.rating());
        assertEquals(431000L, t.totalTimeMs());
        assertEquals(3, t.trackNumber());
        assertEquals(2, t.discNumber());
        assertEquals(13_000_000L, t.sizeBytes());
        assertEquals(Instant.parse("2015-05-05T05:05:05Z"), t.dateAdded());
        assertEquals(Instant.parse("2016-01-01T00:00:00Z"), t.dateModified());
        assertEquals(Instant.parse("2024-02-02T02:02:02Z"), t.lastPlayed());
        assertEquals(Instant.parse("1968-08-26T00:00:00Z"), t.releaseDate());
        assertTrue(t.compilation());
    }

    /**
     * 빈 문자열/범위 밖 값이 null 또는 0으로 정리되는지 검증한다.
     */
    @DisplayName("빈 값/범위 밖 값 정리 검증")
    @Test
    void normalize_coercesInvalidValues() {
        RawTrackEntry raw = entry("8",
                "Track ID", "  8 ",
                "Name", "Song",
                "Artist", "",
                "Album", "   ",
                "Year", 0L,
                "Bit Rate", -128L,
                "Play Count", "abc",
                "Rating", 120L,
                "Total Time", -1L,
                "Date Added", "yesterday");

        Track t = normalizer.normalize(raw).track();

        assertEquals("8", t.trackId());
        assertNull(t.artist());
        assertNull(t.album());
        assertNull(t.year());
        assertNull(t.bitRate());
        assertEquals(0, t.playCount());
        assertNull(t.rating());
        assertNull(t.totalTimeMs());
        assertNull(t.dateAdded());
        assertFalse(t.compilation());
    }

    /**
     * 평점 경계값(0, 100)은 유지되는지 검증한다.
     */
    @DisplayName("평점 경계값 0/100 유지 검증")
    @Test
    void normalize_ratingBoundaries() {
        assertEquals(0, normalizer.normalize(entry("1", "Track ID", 1L, "Name", "a", "Rating", 0L)).track().rating());
        assertEquals(100, normalizer.normalize(entry("2", "Track ID", 2L, "Name", "b", "Rating", 100L)).track().rating());
        assertNull(normalizer.normalize(entry("3", "Track ID", 3L, "Name", "c", "Rating", -1L)).track().rating());
    }

    /**
     * Track ID가 없으면 MISSING_ID, Name/Artist 모두 없으면 UNUSABLE로 스킵되는지 검증한다.
     */
    @DisplayName("스킵 사유 분류 검증")
    @Test
    void normalize_classifiesSkips() {
        assertEquals(SkipReason.MISSING_ID,
                normalizer.normalize(entry("1", "Name", "No Id")).skipReason());
        assertEquals(SkipReason.MISSING_ID,
                normalizer.normalize(entry("2", "Track ID", " ", "Name", "Blank Id")).skipReason());
        assertEquals(SkipReason.MISSING_ID,
                normalizer.normalize(entry("3", "Track ID", 1.5, "Name", "Fractional Id")).skipReason());
        assertEquals(SkipReason.UNUSABLE,
                normalizer.normalize(entry("4", "Track ID", 4L, "Genre", "Jazz")).skipReason());

        // 아티스트만 있어도 사용 가능
        assertFalse(normalizer.normalize(entry("5", "Track ID", 5L, "Artist", "Solo")).isSkipped());
    }

    /**
     * 중복 track_id는 마지막 항목이 이기고, 집계 불변식
     * read = normalized + skippedMissingId + skippedUnusable + duplicateIds가 성립하는지 검증한다.
     */
    @DisplayName("중복 track_id 마지막 항목 우선 + 집계 불변식 검증")
    @Test
    void normalizeAll_lastDuplicateWins_andTallyBalances() {
        List<RawTrackEntry> entries = List.of(
                entry("a", "Track ID", 1L, "Name", "First", "Artist", "X"),
                entry("b", "Track ID", 2L, "Name", "Second", "Artist", "X"),
                entry("c", "Name", "Orphan"),
                entry("d", "Track ID", 4L, "Genre", "Jazz"),
                entry("e", "Track ID", 1L, "Name", "First (Remastered)", "Artist", "X"),
                entry("f", "Track ID", 1L, "Name", "First (Live)", "Artist", "X")
        );

        NormalizationResult result = normalizer.normalizeAll(entries);

        assertEquals(List.of("1", "2"), result.tracks().stream().map(Track::trackId).toList());
        assertEquals("First (Live)", result.tracks().get(0).name());

        Tally tally = result.tally();
        assertEquals(new Tally(6, 2, 1, 1, 2), tally);
        assertEquals(tally.read(),
                tally.normalized() + tally.skippedMissingId() + tally.skippedUnusable() + tally.duplicateIds());

        assertEquals(List.of(
                new SkippedEntry("c", SkipReason.MISSING_ID),
                new SkippedEntry("d", SkipReason.UNUSABLE)
        ), result.skipped());
    }

    /**
     * 빈 입력은 빈 결과와 0 집계를 반환하는지 검증한다.
     */
    @DisplayName("빈 입력 검증")
    @Test
    void normalizeAll_empty() {
        NormalizationResult result = normalizer.normalizeAll(List.of());

        assertTrue(result.tracks().isEmpty());
        assertEquals(Tally.empty(), result.tally());
        assertTrue(result.skipped().isEmpty());
    }
}
