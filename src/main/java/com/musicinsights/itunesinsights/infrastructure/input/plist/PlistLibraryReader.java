package com.musicinsights.itunesinsights.infrastructure.input.plist;

import com.musicinsights.itunesinsights.application.common.error.SourceReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.CharConversionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * iTunes/Music 라이브러리 export(XML property list)를 "한 트랙씩" 읽기 위한 리더입니다.
 * <p>
 * StAX로 파일을 스트리밍하면서 최상위 {@code Tracks} dict의 항목만 하나씩 {@link RawTrackEntry}로 만들고,
 * 리소스 생성/사용/해제를 {@link Flux#using}으로 Flux 라이프사이클에 맞춰 관리합니다.
 * <p>
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class PlistLibraryReader {

    private static final Logger log = LoggerFactory.getLogger(PlistLibraryReader.class);

    /** export 최상위 dict에서 트랙 목록을 가리키는 key */
    static final String TRACKS_KEY = "Tracks";

    private final XMLInputFactory xmlInputFactory;

    public PlistLibraryReader() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        // plist DOCTYPE은 무시하고 외부 엔티티는 허용하지 않음
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        this.xmlInputFactory = factory;
    }

    /**
     * export 파일의 트랙 항목을 순서대로 방출하는 lazy {@link Flux}를 반환합니다.
     * <p>
     * 구독 시점에 파일을 열고, 완료/에러/취소 시 파일을 닫습니다.
     * 파일이 없거나 열 수 없거나 XML이 손상된 경우 {@link SourceReadException}으로 에러 시그널을 방출합니다.
     *
     * @param path export 파일 경로
     * @return 트랙 항목 Flux
     */
    public Flux<RawTrackEntry> read(Path path) {
        return Flux.using(
                () -> open(path),
                cursor -> Flux.<RawTrackEntry>generate(sink -> {
                    RawTrackEntry entry = cursor.next();
                    if (entry == null) {
                        sink.complete();
                    } else {
                        sink.next(entry);
                    }
                }),
                TrackCursor::close
        ).subscribeOn(Schedulers.boundedElastic()); // blocking IO는 elastic으로
    }

    private TrackCursor open(Path path) {
        if (!Files.exists(path)) {
            throw SourceReadException.missing(path);
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw SourceReadException.unreadable(path, null);
        }
        InputStream in;
        try {
            in = new BufferedInputStream(Files.newInputStream(path));
        } catch (IOException e) {
            throw SourceReadException.unreadable(path, e);
        }
        try {
            return new TrackCursor(path, in, xmlInputFactory.createXMLStreamReader(in));
        } catch (XMLStreamException e) {
            closeQuietly(in, path);
            throw readFailure(path, e);
        }
    }

    /**
     * StAX 예외를 원인에 따라 분류합니다. 파일 I/O 오류가 감싸져 있으면 UNREADABLE, 그 외는 MALFORMED.
     *
     * @param path export 파일 경로
     * @param e    StAX 예외
     * @return 분류된 예외
     */
    static SourceReadException readFailure(Path path, XMLStreamException e) {
        IOException io = ioCause(e);
        return io != null ? SourceReadException.unreadable(path, io) : SourceReadException.malformed(path, e);
    }

    /** 문자 인코딩 오류는 내용 손상으로 보므로 제외한다. */
    private static IOException ioCause(XMLStreamException e) {
        Throwable t = e.getNestedException() != null ? e.getNestedException() : e.getCause();
        while (t != null && !(t instanceof IOException)) {
            t = t.getCause();
        }
        if (t instanceof CharacterCodingException || t instanceof CharConversionException) return null;
        return (IOException) t;
    }

    private static void closeQuietly(InputStream in, Path path) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Failed to close {}", path, e);
        }
    }

    /**
     * 열린 XML 스트림 위에서 {@code Tracks} 항목을 하나씩 꺼내는 커서.
     *
     * <p>상태: 시작 전 → Tracks 안 → 종료. Tracks를 다 읽은 뒤에도 문서 끝까지 읽어
     * 뒤쪽의 손상도 감지한다.</p>
     */
    static final class TrackCursor {
        private final Path path;
        private final InputStream in;
        private final XMLStreamReader xml;
        private boolean insideTracks;
        private boolean finished;
        private long emitted;

        TrackCursor(Path path, InputStream in, XMLStreamReader xml) {
            this.path = path;
            this.in = in;
            this.xml = xml;
        }

        /**
         * 다음 트랙 항목을 반환합니다.
         *
         * @return 다음 항목, 더 없으면 null
         * @throws SourceReadException XML이 손상된 경우
         */
        RawTrackEntry next() {
            if (finished) return null;
            try {
                if (!insideTracks && !seekTracks()) {
                    finish();
                    return null;
                }
                int event = xml.nextTag();
                if (event == XMLStreamConstants.END_ELEMENT) {
                    expectEnd("dict");
                    insideTracks = false;
                    drainRemainingTopLevel();
                    finish();
                    return null;
                }
                String key = readKey();
                xml.nextTag();
                expectStartTag();
                if (!"dict".equals(xml.getLocalName())) {
                    throw SourceReadException.malformed(path,
                            "track entry '" + key + "' is <" + xml.getLocalName() + ">, expected <dict>");
                }
                emitted++;
                return new RawTrackEntry(key, readDict());
            } catch (XMLStreamException e) {
                throw readFailure(path, e);
            }
        }

        /** plist → 최상위 dict를 확인하고, Tracks dict 시작 위치까지 이동한다. */
        private boolean seekTracks() throws XMLStreamException {
            advanceToRootElement();
            if (!"plist".equals(xml.getLocalName())) {
                throw SourceReadException.malformed(path, "root element is <" + xml.getLocalName() + ">, expected <plist>");
            }
            xml.nextTag();
            expectStartTag();
            if (!"dict".equals(xml.getLocalName())) {
                throw SourceReadException.malformed(path, "top-level value is <" + xml.getLocalName() + ">, expected <dict>");
            }
            while (xml.nextTag() == XMLStreamConstants.START_ELEMENT) {
                String key = readKey();
                xml.nextTag();
                expectStartTag();
                if (TRACKS_KEY.equals(key) && "dict".equals(xml.getLocalName())) {
                    insideTracks = true;
                    return true;
                }
                readValue();
            }
            expectEnd("dict");
            finishDocument();
            log.warn("Library export {} has no '{}' dictionary", path, TRACKS_KEY);
            return false;
        }

        /** DOCTYPE, 주석, 공백을 건너뛰고 루트 요소 시작으로 이동한다. */
        private void advanceToRootElement() throws XMLStreamException {
            while (xml.hasNext()) {
                int event = xml.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT:
                        return;
                    case XMLStreamConstants.DTD:
                    case XMLStreamConstants.COMMENT:
                    case XMLStreamConstants.PROCESSING_INSTRUCTION:
                    case XMLStreamConstants.SPACE:
                        break;
                    case XMLStreamConstants.CHARACTERS:
                        if (!xml.isWhiteSpace()) {
                            throw SourceReadException.malformed(path, "text content before root element");
                        }
                        break;
                    default:
                        throw SourceReadException.malformed(path, "unexpected content before root element");
                }
            }
            throw SourceReadException.malformed(path, "document has no root element");
        }

        private void drainRemainingTopLevel() throws XMLStreamException {
            while (xml.nextTag() == XMLStreamConstants.START_ELEMENT) {
                readKey();
                xml.nextTag();
                expectStartTag();
                readValue();
            }
            expectEnd("dict");
            finishDocument();
        }

        private void finishDocument() throws XMLStreamException {
            xml.nextTag();
            expectEnd("plist");
            while (xml.hasNext()) {
                xml.next();
            }
        }

        private void finish() {
            if (!finished) {
                finished = true;
                log.debug("Read {} track entries from {}", emitted, path);
            }
        }

        /** 현재 위치가 {@code <key>} 시작이어야 하며, key 텍스트를 읽고 END_ELEMENT에 위치한다. */
        private String readKey() throws XMLStreamException {
            expectStartTag();
            if (!"key".equals(xml.getLocalName())) {
                throw SourceReadException.malformed(path, "expected <key>, found <" + xml.getLocalName() + ">");
            }
            return xml.getElementText();
        }

        /** 현재 위치가 {@code <dict>} 시작일 때 key/value 쌍을 순서대로 읽는다. */
        private Map<String, Object> readDict() throws XMLStreamException {
            Map<String, Object> out = new LinkedHashMap<>();
            while (xml.nextTag() == XMLStreamConstants.START_ELEMENT) {
                String key = readKey();
                xml.nextTag();
                expectStartTag();
                out.put(key, readValue());
            }
            expectEnd("dict");
            return out;
        }

        private List<Object> readArray() throws XMLStreamException {
            List<Object> out = new ArrayList<>();
            while (xml.nextTag() == XMLStreamConstants.START_ELEMENT) {
                out.add(readValue());
            }
            expectEnd("array");
            return out;
        }

        /**
         * 현재 START_ELEMENT의 값을 읽어 Java 값으로 변환한다.
         * <p>
         * 요소 타입으로 해석할 수 없는 텍스트(예: {@code <integer>abc</integer>})는 원본 문자열로 남긴다.
         */
        private Object readValue() throws XMLStreamException {
            String element = xml.getLocalName();
            switch (element) {
                case "string":
                case "data":
                    return xml.getElementText();
                case "integer": {
                    String text = xml.getElementText().trim();
                    try {
                        return Long.parseLong(text);
                    } catch (NumberFormatException e) {
                        return text;
                    }
                }
                case "real": {
                    String text = xml.getElementText().trim();
                    try {
                        return Double.parseDouble(text);
                    } catch (NumberFormatException e) {
                        return text;
                    }
                }
                case "date": {
                    String text = xml.getElementText().trim();
                    try {
                        return Instant.parse(text);
                    } catch (DateTimeParseException e) {
                        return text;
                    }
                }
                case "true":
                    xml.getElementText();
                    return Boolean.TRUE;
                case "false":
                    xml.getElementText();
                    return Boolean.FALSE;
                case "dict":
                    return readDict();
                case "array":
                    return readArray();
                default:
                    throw SourceReadException.malformed(path, "unknown plist element <" + element + ">");
            }
        }

        private void expectStartTag() {
            if (xml.getEventType() != XMLStreamConstants.START_ELEMENT) {
                throw SourceReadException.malformed(path, "unexpected end of element at line " + line());
            }
        }

        private void expectEnd(String element) {
            if (xml.getEventType() != XMLStreamConstants.END_ELEMENT || !element.equals(xml.getLocalName())) {
                throw SourceReadException.malformed(path, "expected </" + element + "> at line " + line());
            }
        }

        private int line() {
            return xml.getLocation() == null ? -1 : xml.getLocation().getLineNumber();
        }

        void close() {
            try {
                xml.close();
            } catch (XMLStreamException e) {
                log.debug("Failed to close XML reader for {}", path, e);
            }
            closeQuietly(in, path);
        }
    }
}
