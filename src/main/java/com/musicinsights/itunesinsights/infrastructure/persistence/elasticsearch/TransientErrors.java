package com.musicinsights.itunesinsights.infrastructure.persistence.elasticsearch;

import com.musicinsights.itunesinsights.application.common.error.SinkWriteException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * 쓰기 실패가 일시적인지(재시도하면 성공할 수 있는지) 판별한다.
 */
final class TransientErrors {
    private TransientErrors() {}

    /**
     * 연결 실패, 타임아웃, HTTP 429/5xx, 재시도 가능으로 표시된 {@link SinkWriteException}은 일시적 장애로 본다.
     *
     * @param e 발생한 예외
     * @return 재시도 대상이면 true
     */
    static boolean isTransient(Throwable e) {
        if (e instanceof SinkWriteException s) return s.retryable();
        if (e instanceof WebClientResponseException r) {
            int status = r.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        if (e instanceof WebClientRequestException) return true;
        if (e instanceof TimeoutException || e instanceof IOException) return true;

        Throwable cause = e.getCause();
        return cause != null && cause != e && isTransient(cause);
    }

    static String describe(Throwable e) {
        if (e instanceof WebClientResponseException r) {
            return "HTTP " + r.getStatusCode().value() + ": " + r.getResponseBodyAsString();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
