package com.musicinsights.itunesinsights.infrastructure.mapper;

import com.musicinsights.itunesinsights.application.catalog.model.Track;
import com.musicinsights.itunesinsights.infrastructure.input.plist.RawTrackEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.musicinsights.itunesinsights.infrastructure.input.plist.NormalizeUtils.*;

/**
 * {@link RawTrackEntry}(동적 타입 map)를 {@link Track} 레코드로 변환한다.
 *
 * <p>타입이 없는 map은 이 단계 이후로 전달되지 않는다.
 * 식별자가 없거나 식별 정보(Artist, Name)가 모두 없는 항목은 건너뛰고 사유별로 집계한다.</p>
 */
@Component
public class TrackNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TrackNormalizer.class);

    /** export 트랙 dict의 필드명 */
    static final String TRACK_ID = "Track ID";
    static final String PERSISTENT_ID = "Persistent ID";
    static final String NAME = "Name";
    static final String ARTIST = "Artist";
    static final String ALBUM_ARTIST = "Album Artist";
    static final String ALBUM = "Album";
    static final String GENRE = "Genre";
    static final String COMPOSER = "Composer";
    static final String KIND = "Kind";
    static final String YEAR = "Year";
    static final String BIT_RATE = "Bit Rate";
    static final String SAMPLE_RATE = "Sample Rate";
    static final String PLAY_COUNT = "Play Count";
    static final String SKIP_COUNT = "Skip Count";
    static final String RATING = "Rating";
    static final String TOTAL_TIME = "Total Time";
    static final String TRACK_NUMBER = "Track Number";
    static final String DISC_NUMBER = "Disc Number";
    static final String SIZE = "Size";
    static final String DATE_ADDED = "Date Added";
    static final String DATE_MODIFIED = "Date Modified";
    static final String PLAY_DATE_UTC = "Play Date UTC";
    static final String RELEASE_DATE = "Release Date";
    static final String COMPILATION = "Compilation";

    /** 항목을 건너뛴 사유. */
    public enum SkipReason {
        /** Track ID 없음 */
        MISSING_ID,
        /** Artist, Name 모두 없음 */
        UNUSABLE
    }

    /**
     * 항목 하나의 정규화 결과. {@code track}과 {@code skipReason} 중 하나만 값을 가진다.
     */
    public record NormalizedEntry(Track track, SkipReason skipReason) {
        static NormalizedEntry of(Track track) { return new NormalizedEntry(track, null); }
        static NormalizedEntry skipped(SkipReason reason) { return new NormalizedEntry(null, reason); }

        public boolean isSkipped() { return skipReason != null; }
    }

    /** 건너뛴 항목(원본 key + 사유). */
    public record SkippedEntry(String sourceKey, SkipReason reason) {}

    /**
     * 정규화 집계.
     * <p>{@code read = normalized + skippedMissingId + skippedUnusable + duplicateIds}가 항상 성립한다.</p>
     *
     * @param read             읽은 항목 수
     * @param normalized       최종 트랙 수(track_id 기준 중복 제거 후)
     * @param skippedMissingId 식별자가 없어 건너뛴 수
     * @param skippedUnusable  Artist/Name이 모두 없어 건너뛴 수
     * @param duplicateIds     같은 track_id가 다시 나와 덮어쓴 수
     */
    public record Tally(long read, long normalized, long skippedMissingId, long skippedUnusable, long duplicateIds) {
        public static Tally empty() { return new Tally(0, 0, 0, 0, 0); }

        public long skipped() { return skippedMissingId + skippedUnusable; }
    }

    /** 전체 정규화 결과(트랙 + 집계 + 건너뛴 항목). */
    public record NormalizationResult(List<Track> tracks, Tally tally, List<SkippedEntry> skipped) {
        public NormalizationResult {
            tracks = List.copyOf(tracks);
            skipped = List.copyOf(skipped);
        }
    }

    /**
     * 항목 하나를 정규화한다.
     *
     * @param raw 원본 항목
     * @return 트랙 또는 건너뛴 사유
     */
    public NormalizedEntry normalize(RawTrackEntry raw) {
        String trackId = trackIdOrNull(raw.get(TRACK_ID));
        if (trackId == null) return NormalizedEntry.skipped(SkipReason.MISSING_ID);

        String name = textOrNull(raw.get(NAME));
        String artist = textOrNull(raw.get(ARTIST));
        if (name == null && artist == null) return NormalizedEntry.skipped(SkipReason.UNUSABLE);

        Long totalTime = toLongOrNull(raw.get(TOTAL_TIME));
        Long size = toLongOrNull(raw.get(SIZE));

        return NormalizedEntry.of(new Track(
                trackId,
                textOrNull(raw.get(PERSISTENT_ID)),
                name,
                artist,
                textOrNull(raw.get(ALBUM_ARTIST)),
                textOrNull(raw.get(ALBUM)),
                textOrNull(raw.get(GENRE)),
                textOrNull(raw.get(COMPOSER)),
                textOrNull(raw.get(KIND)),
                positiveIntOrNull(raw.get(YEAR)),
                positiveIntOrNull(raw.get(BIT_RATE)),
                positiveIntOrNull(raw.get(SAMPLE_RATE)),
                countOrZero(raw.get(PLAY_COUNT)),
                countOrZero(raw.get(SKIP_COUNT)),
                ratingOrNull(raw.get(RATING)),
                (totalTime == null || totalTime < 0) ? null : totalTime,
                positiveIntOrNull(raw.get(TRACK_NUMBER)),
                positiveIntOrNull(raw.get(DISC_NUMBER)),
                (size == null || size < 0) ? null : size,
                toInstantOrNull(raw.get(DATE_ADDED)),
                toInstantOrNull(raw.get(DATE_MODIFIED)),
                toInstantOrNull(raw.get(PLAY_DATE_UTC)),
                toInstantOrNull(raw.get(RELEASE_DATE)),
                isTrue(raw.get(COMPILATION))
        ));
    }

    /**
     * 전체 항목을 정규화하고 사유별 집계를 만든다.
     * <p>
     * 같은 track_id가 여러 번 나오면 마지막 항목이 이긴다(최초 등장 위치는 유지).
     *
     * @param entries 원본 항목 목록
     * @return 정규화 결과
     */
    public NormalizationResult normalizeAll(List<RawTrackEntry> entries) {
        Map<String, Track> byId = new LinkedHashMap<>();
        List<SkippedEntry> skipped = new ArrayList<>();
        long missingId = 0;
        long unusable = 0;
        long duplicates = 0;

        for (RawTrackEntry raw : entries) {
            NormalizedEntry n = normalize(raw);
            if (n.isSkipped()) {
                skipped.add(new SkippedEntry(raw.sourceKey(), n.skipReason()));
                if (n.skipReason() == SkipReason.MISSING_ID) missingId++;
                else unusable++;
                log.debug("Skipped track entry '{}': {}", raw.sourceKey(), n.skipReason());
                continue;
            }
            if (byId.put(n.track().trackId(), n.track()) != null) {
                duplicates++;
                log.debug("Duplicate track_id {} (entry '{}'), last one wins", n.track().trackId(), raw.sourceKey());
            }
        }

        Tally tally = new Tally(entries.size(), byId.size(), missingId, unusable, duplicates);
        if (tally.skipped() > 0 || duplicates > 0) {
            log.warn("Skipped {} entries without Track ID, {} without Artist/Name; {} duplicate track ids overwritten",
                    missingId, unusable, duplicates);
        }
        return new NormalizationResult(new ArrayList<>(byId.values()), tally, skipped);
    }

    /** Track ID는 정수 또는 비어있지 않은 문자열만 허용한다. */
    private static String trackIdOrNull(Object value) {
        if (value instanceof Long || value instanceof Integer) return value.toString();
        if (value instanceof Double d) {
            return (Double.isFinite(d) && d == Math.rint(d)) ? String.valueOf(d.longValue()) : null;
        }
        if (value instanceof String s) return norm(s);
        return null;
    }

    /** 0~100 범위를 벗어난 평점은 null로 처리한다. */
    private static Integer ratingOrNull(Object value) {
        Integer r = toIntOrNull(value);
        return (r == null || r < 0 || r > 100) ? null : r;
    }
}
