package com.musicinsights.itunesinsights.infrastructure.input.plist;

import com.musicinsights.itunesinsights.application.common.error.SourceReadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.MalformedInputException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link PlistLibraryReader} 단위 테스트.
 *
 * <p>export 파일에서 {@code Tracks} 항목만 순서대로 읽는 동작과,
 * 파일 없음/손상된 XML의 에러 종류(kind)를 검증한다.</p>
 */
@DisplayName("plist 라이브러리 리더 테스트")
class PlistLibraryReaderTest {

    /** 테스트 대상 리더 */
    private final PlistLibraryReader reader = new PlistLibraryReader();

    static Path fixture(String name) {
        try {
            return Path.of(PlistLibraryReaderTest.class.getResource("/library/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * DOCTYPE과 Playlists가 있는 export에서 Tracks 항목만 등장 순서대로 방출하는지 검증한다.
     */
    @DisplayName("Tracks 항목만 등장 순서대로 방출")
    @Test
    void read_emitsTrackEntriesInDocumentOrder() {
        StepVerifier.create(reader.read(fixture("sample-library.xml")).map(RawTrackEntry::sourceKey))
                .expectNext("101", "102", "103", "104", "105", "106")
                .verifyComplete();
    }

    /**
     * plist 값 요소가 Java 타입(Long/Double/String/Instant/Boolean)으로 변환되는지 검증한다.
     */
    @DisplayName("plist 값 요소를 Java 타입으로 변환")
    @Test
    void read_convertsTypedValues() {
        List<RawTrackEntry> entries = reader.read(fixture("sample-library.xml")).collectList().block();
        assertNotNull(entries);

        Map<String, Object> first = entries.get(0).fields();
        assertEquals(101L, first.get("Track ID"));
        assertEquals("Song A", first.get("Name"));
        assertEquals(256L, first.get("Bit Rate"));
        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), first.get("Date Added"));
        assertEquals(Boolean.TRUE, first.get("Compilation"));

        Map<String, Object> fifth = entries.get(4).fields();
        assertEquals(-7.25, fifth.get("Average Loudness"));
        // 정수로 해석할 수 없는 값은 원본 문자열 그대로
        assertEquals("abc", fifth.get("Play Count"));
        assertEquals("   ", fifth.get("Artist"));
    }

    /**
     * Track ID가 없는 항목도 리더 단계에서는 그대로 방출되는지 검증한다(검증은 정규화 단계의 책임).
     */
    @DisplayName("필드 검증 없이 원본 항목 그대로 방출")
    @Test
    void read_doesNotValidateFields() {
        List<RawTrackEntry> entries = reader.read(fixture("sample-library.xml")).collectList().block();
        assertNotNull(entries);

        RawTrackEntry orphan = entries.get(2);
        assertNull(orphan.get("Track ID"));
        assertEquals("Orphan Without Id", orphan.get("Name"));
    }

    /**
     * Tracks가 없는 export는 빈 시퀀스로 정상 종료되는지 검증한다.
     */
    @DisplayName("Tracks가 없으면 빈 시퀀스로 종료")
    @Test
    void read_withoutTracks_completesEmpty() {
        StepVerifier.create(reader.read(fixture("no-tracks.xml")))
                .verifyComplete();
    }

    /**
     * 파일이 없으면 MISSING 에러를 방출하는지 검증한다.
     */
    @DisplayName("파일이 없으면 MISSING 에러 방출")
    @Test
    void read_missingFile_emitsMissing(@TempDir Path dir) {
        Path path = dir.resolve("does-not-exist.xml");

        StepVerifier.create(reader.read(path))
                .expectErrorSatisfies(e -> {
                    SourceReadException ex = assertInstanceOf(SourceReadException.class, e);
                    assertEquals(SourceReadException.Kind.MISSING, ex.kind());
                    assertEquals(path, ex.path());
                    assertEquals("SOURCE_MISSING", ex.code());
                })
                .verify();
    }

    /**
     * 경로가 일반 파일이 아니면(디렉터리) UNREADABLE 에러를 방출하는지 검증한다.
     */
    @DisplayName("디렉터리 경로는 UNREADABLE 에러 방출")
    @Test
    void read_directory_emitsUnreadable(@TempDir Path dir) {
        StepVerifier.create(reader.read(dir))
                .expectErrorSatisfies(e -> {
                    SourceReadException ex = assertInstanceOf(SourceReadException.class, e);
                    assertEquals(SourceReadException.Kind.UNREADABLE, ex.kind());
                    assertEquals("SOURCE_UNREADABLE", ex.code());
                })
                .verify();
    }

    /**
     * 읽기 도중의 I/O 오류는 UNREADABLE, 그 외 StAX 오류와 인코딩 오류는 MALFORMED로 분류하는지 검증한다.
     */
    @DisplayName("읽기 중 I/O 오류는 UNREADABLE, 내용 오류는 MALFORMED")
    @Test
    void readFailure_classifiesByCause() {
        Path path = Path.of("library.xml");

        SourceReadException io = PlistLibraryReader.readFailure(path,
                new XMLStreamException("read failed", new IOException("Input/output error")));
        assertEquals(SourceReadException.Kind.UNREADABLE, io.kind());
        assertInstanceOf(IOException.class, io.getCause());

        SourceReadException syntax = PlistLibraryReader.readFailure(path,
                new XMLStreamException("Unexpected EOF in prolog"));
        assertEquals(SourceReadException.Kind.MALFORMED, syntax.kind());

        SourceReadException encoding = PlistLibraryReader.readFailure(path,
                new XMLStreamException("bad byte", new MalformedInputException(1)));
        assertEquals(SourceReadException.Kind.MALFORMED, encoding.kind());
    }

    /**
     * 중간에 잘린 파일은 MALFORMED 에러로 끝나는지 검증한다.
     */
    @DisplayName("잘린 파일은 MALFORMED 에러로 종료")
    @Test
    void read_truncatedFile_emitsMalformed() {
        List<RawTrackEntry> seen = new ArrayList<>();

        StepVerifier.create(reader.read(fixture("truncated.xml")).doOnNext(seen::add))
                .thenConsumeWhile(e -> true)
                .expectErrorSatisfies(e -> {
                    SourceReadException ex = assertInstanceOf(SourceReadException.class, e);
                    assertEquals(SourceReadException.Kind.MALFORMED, ex.kind());
                })
                .verify();

        assertTrue(seen.size() <= 1);
    }

    /**
     * Tracks 뒤쪽(Playlists)의 알 수 없는 요소도 MALFORMED로 감지하는지 검증한다.
     */
    @DisplayName("Tracks 뒤쪽 손상도 MALFORMED로 감지")
    @Test
    void read_malformedTrailer_emitsMalformedAfterEntries() {
        StepVerifier.create(reader.read(fixture("bad-trailer.xml")).map(RawTrackEntry::sourceKey))
                .expectNext("1")
                .expectErrorSatisfies(e -> {
                    SourceReadException ex = assertInstanceOf(SourceReadException.class, e);
                    assertEquals(SourceReadException.Kind.MALFORMED, ex.kind());
                    assertTrue(ex.getMessage().contains("widget"));
                })
                .verify();
    }

    /**
     * 루트가 plist가 아니면 MALFORMED 에러를 방출하는지 검증한다.
     */
    @DisplayName("루트가 plist가 아니면 MALFORMED")
    @Test
    void read_nonPlistRoot_emitsMalformed() {
        StepVerifier.create(reader.read(fixture("not-a-plist.xml")))
                .expectErrorSatisfies(e -> assertEquals(
                        SourceReadException.Kind.MALFORMED,
                        assertInstanceOf(SourceReadException.class, e).kind()))
                .verify();
    }

    /**
     * 구독 전에는 파일을 열지 않는지(lazy) 검증한다.
     */
    @DisplayName("구독 전에는 파일을 열지 않음")
    @Test
    void read_isLazy(@TempDir Path dir) {
        // 존재하지 않는 경로여도 구독 전에는 예외가 나지 않아야 함
        assertDoesNotThrow(() -> reader.read(dir.resolve("later.xml")));
    }
}
