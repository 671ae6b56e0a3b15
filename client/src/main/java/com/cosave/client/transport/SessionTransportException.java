package com.cosave.client.transport;

import lombok.Getter;

/**
 * 세션 서버 호출 실패.
 *
 * - NETWORK / SERVER_ERROR / RATE_LIMITED: 일시 장애. 백오프 후 재시도 대상이고 로그아웃 사유가 아니다.
 * - REJECTED: 서버가 자격 증명을 거절(401/403). 재시도해도 결과가 같으므로 즉시 강제 로그아웃.
 */
@Getter
public class SessionTransportException extends RuntimeException {

    public enum Kind {
        NETWORK(true),
        SERVER_ERROR(true),
        RATE_LIMITED(true),
        REJECTED(false);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }
    }

    private final Kind kind;
    private final Integer status;

    public SessionTransportException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public SessionTransportException(Kind kind, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public boolean isRetryable() {
        return kind.retryable;
    }
}
