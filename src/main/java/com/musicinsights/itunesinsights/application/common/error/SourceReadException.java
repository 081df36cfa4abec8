package com.musicinsights.itunesinsights.application.common.error;

import java.nio.file.Path;

/**
 * 라이브러리 export 파일을 읽을 수 없을 때 발생하는 예외.
 *
 * <p>실행 전체에 치명적인 오류이며, 어떤 쓰기도 수행되기 전에 실행을 중단시킨다.
 * {@link Kind}로 "파일 없음"과 "내용 손상"을 구분한다.</p>
 */
public class SourceReadException extends RuntimeException {

    /** 원인 분류 */
    public enum Kind {
        /** 파일이 존재하지 않음 */
        MISSING,
        /** 파일은 있지만 열 수 없음 */
        UNREADABLE,
        /** well-formed plist XML이 아님 */
        MALFORMED
    }

    private final Kind kind;
    private final Path path;

    public SourceReadException(Kind kind, Path path, String message) {
        super(message);
        this.kind = kind;
        this.path = path;
    }

    public SourceReadException(Kind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public static SourceReadException missing(Path path) {
        return new SourceReadException(Kind.MISSING, path, "Library export not found: " + path);
    }

    public static SourceReadException unreadable(Path path, Throwable cause) {
        return new SourceReadException(Kind.UNREADABLE, path, "Library export is not readable: " + path, cause);
    }

    public static SourceReadException malformed(Path path, String detail) {
        return new SourceReadException(Kind.MALFORMED, path, "Malformed library export " + path + ": " + detail);
    }

    public static SourceReadException malformed(Path path, Throwable cause) {
        return new SourceReadException(Kind.MALFORMED, path,
                "Malformed library export " + path + ": " + cause.getMessage(), cause);
    }

    /**
     * 원인 분류를 반환한다.
     *
     * @return 원인 분류
     */
    public Kind kind() {
        return kind;
    }

    public Path path() {
        return path;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드(예: SOURCE_MISSING)
     */
    public String code() {
        return "SOURCE_" + kind.name();
    }
}
