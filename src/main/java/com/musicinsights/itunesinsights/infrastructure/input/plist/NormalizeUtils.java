package com.musicinsights.itunesinsights.infrastructure.input.plist;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * ingest 과정에서 반복적으로 사용하는 "정규화/변환" 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리)
 * - plist 값(Long/Double/String/Instant)의 타입 변환
 * - 문서 식별용 해시 생성
 * <p>
 * 모든 변환은 실패 시 예외 대신 null(또는 지정한 기본값)을 반환합니다.
 */
public class NormalizeUtils {

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * plist 값을 표시용 문자열로 변환합니다.
     * <p>
     * 문자열/숫자/불리언만 허용하며, dict/array 같은 중첩 값은 null로 처리합니다.
     *
     * @param value plist 원본 값
     * @return 정규화된 문자열 또는 null
     */
    public static String textOrNull(Object value) {
        if (value instanceof String s) return norm(s);
        if (value instanceof Long || value instanceof Integer || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }

    /**
     * plist 값을 long으로 변환합니다.
     * <p>
     * {@code <integer>}는 그대로, {@code <real>}은 소수점 이하를 버리고,
     * 문자열은 숫자 형식일 때만 변환합니다.
     *
     * @param value plist 원본 값
     * @return 변환된 값 또는 null
     */
    public static Long toLongOrNull(Object value) {
        if (value instanceof Long l) return l;
        if (value instanceof Integer i) return i.longValue();
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) return null;
            return d.longValue();
        }
        if (value instanceof String s) {
            String t = norm(s);
            if (t == null) return null;
            try {
                return Long.parseLong(t);
            } catch (NumberFormatException e) {
                try {
                    double d = Double.parseDouble(t);
                    return Double.isFinite(d) ? (long) d : null;
                } catch (NumberFormatException ignoredAgain) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * plist 값을 int로 변환합니다. int 범위를 벗어나면 null을 반환합니다.
     *
     * @param value plist 원본 값
     * @return 변환된 값 또는 null
     */
    public static Integer toIntOrNull(Object value) {
        Long l = toLongOrNull(value);
        if (l == null || l > Integer.MAX_VALUE || l < Integer.MIN_VALUE) return null;
        return l.intValue();
    }

    /**
     * 양수만 허용하는 int 변환입니다. 0 이하 값은 null로 처리합니다.
     *
     * @param value plist 원본 값
     * @return 양수 값 또는 null
     */
    public static Integer positiveIntOrNull(Object value) {
        Integer i = toIntOrNull(value);
        return (i == null || i <= 0) ? null : i;
    }

    /**
     * 음수가 아닌 카운트 값으로 변환합니다. 없거나 음수이면 0을 반환합니다.
     *
     * @param value plist 원본 값
     * @return 0 이상의 값
     */
    public static int countOrZero(Object value) {
        Integer i = toIntOrNull(value);
        return (i == null || i < 0) ? 0 : i;
    }

    /**
     * plist 날짜 값을 {@link Instant}로 변환합니다.
     * <p>
     * {@code <date>} 요소는 리더에서 이미 Instant로 변환되며,
     * 문자열은 ISO-8601(예: "2019-03-01T10:15:30Z" 또는 offset 포함) 형식만 허용합니다.
     *
     * @param value plist 원본 값
     * @return 변환된 Instant 또는 null
     */
    public static Instant toInstantOrNull(Object value) {
        if (value instanceof Instant i) return i;
        if (value instanceof String s) {
            String t = norm(s);
            if (t == null) return null;
            try {
                return Instant.parse(t);
            } catch (DateTimeParseException e) {
                try {
                    return OffsetDateTime.parse(t).toInstant();
                } catch (DateTimeParseException ignoredAgain) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * plist 불리언 값을 변환합니다. {@code <true/>} 또는 "true"/"yes"만 true로 봅니다.
     *
     * @param value plist 원본 값
     * @return 불리언 값(없으면 false)
     */
    public static boolean isTrue(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof String s) {
            String t = norm(s);
            return t != null && (t.equalsIgnoreCase("true") || t.equalsIgnoreCase("yes"));
        }
        return false;
    }

    /**
     * 입력 문자열을 SHA-256으로 해시한 16진수 문자열을 반환합니다.
     * <p>
     * 집계 문서(artist/album/genre)는 원본 식별자가 없으므로
     * 논리 키(이름 또는 복합 키)를 해시하여 결정적인 문서 ID로 사용합니다.
     *
     * @param input 해시할 원본 문자열
     * @return SHA-256 해시(hex)
     * @throws IllegalStateException 해시 알고리즘 사용에 실패한 경우
     */
    public static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
