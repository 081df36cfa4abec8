package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import com.musicinsights.itunesinsights.application.catalog.model.AlbumSummary;
import com.musicinsights.itunesinsights.application.catalog.model.ArtistSummary;
import com.musicinsights.itunesinsights.application.catalog.model.GenreSummary;
import com.musicinsights.itunesinsights.application.catalog.model.Track;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.musicinsights.itunesinsights.infrastructure.input.plist.NormalizeUtils.sha256Hex;

/**
 * 타입이 있는 레코드를 저장소 문서({@link IndexedDocument})로 변환한다.
 *
 * <p>문서 ID는 논리 키에서 결정적으로 유도되므로, 같은 엔티티를 다시 쓰면 같은 문서를 덮어쓴다.
 * 필드명은 snake_case이며 값이 없는 필드도 null로 포함한다.</p>
 */
@Component
public class DocumentMapper {

    /** 트랙 문서 ID = track_id */
    public static String trackId(Track t) {
        return t.trackId();
    }

    /** 아티스트 문서 ID = sha256("artist|" + name) */
    public static String artistId(String name) {
        return sha256Hex("artist|" + name);
    }

    /** 앨범 문서 ID = sha256("album|" + artist + "|" + album) */
    public static String albumId(String artist, String album) {
        return sha256Hex("album|" + artist + "|" + album);
    }

    /** 장르 문서 ID = sha256("genre|" + name) */
    public static String genreId(String name) {
        return sha256Hex("genre|" + name);
    }

    public IndexedDocument track(Track t) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("track_id", t.trackId());
        doc.put("persistent_id", t.persistentId());
        doc.put("name", t.name());
        doc.put("artist", t.artist());
        doc.put("album_artist", t.albumArtist());
        doc.put("album", t.album());
        doc.put("genre", t.genre());
        doc.put("composer", t.composer());
        doc.put("kind", t.kind());
        doc.put("year", t.year());
        doc.put("bit_rate", t.bitRate());
        doc.put("sample_rate", t.sampleRate());
        doc.put("play_count", t.playCount());
        doc.put("skip_count", t.skipCount());
        doc.put("rating", t.rating());
        doc.put("total_time_ms", t.totalTimeMs());
        doc.put("track_number", t.trackNumber());
        doc.put("disc_number", t.discNumber());
        doc.put("size_bytes", t.sizeBytes());
        doc.put("date_added", iso(t.dateAdded()));
        doc.put("date_modified", iso(t.dateModified()));
        doc.put("last_played", iso(t.lastPlayed()));
        doc.put("release_date", iso(t.releaseDate()));
        doc.put("compilation", t.compilation());
        return new IndexedDocument(trackId(t), doc);
    }

    public IndexedDocument artist(ArtistSummary a) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("name", a.name());
        doc.put("track_count", a.trackCount());
        doc.put("total_play_count", a.totalPlayCount());
        doc.put("total_skip_count", a.totalSkipCount());
        doc.put("average_rating", a.averageRating());
        doc.put("total_time_ms", a.totalTimeMs());
        doc.put("albums", a.albums());
        doc.put("genres", a.genres());
        doc.put("first_added", iso(a.firstAdded()));
        doc.put("last_played", iso(a.lastPlayed()));
        return new IndexedDocument(artistId(a.name()), doc);
    }

    public IndexedDocument album(AlbumSummary a) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("name", a.name());
        doc.put("artist", a.artist());
        doc.put("track_count", a.trackCount());
        doc.put("year", a.year());
        doc.put("total_play_count", a.totalPlayCount());
        doc.put("average_rating", a.averageRating());
        doc.put("total_time_ms", a.totalTimeMs());
        doc.put("average_bit_rate", a.averageBitRate());
        doc.put("genres", a.genres());
        doc.put("compilation", a.compilation());
        doc.put("first_added", iso(a.firstAdded()));
        doc.put("last_added", iso(a.lastAdded()));
        return new IndexedDocument(albumId(a.artist(), a.name()), doc);
    }

    public IndexedDocument genre(GenreSummary g) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("name", g.name());
        doc.put("artist_count", g.artistCount());
        doc.put("album_count", g.albumCount());
        doc.put("track_count", g.trackCount());
        doc.put("total_play_count", g.totalPlayCount());
        doc.put("average_rating", g.averageRating());
        doc.put("average_play_count", g.averagePlayCount());
        doc.put("average_bit_rate", g.averageBitRate());
        doc.put("total_time_ms", g.totalTimeMs());
        return new IndexedDocument(genreId(g.name()), doc);
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
