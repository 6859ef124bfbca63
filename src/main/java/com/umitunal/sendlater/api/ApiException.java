package com.umitunal.sendlater.api;

/**
 * A request failed; the status tells the transport which response to send.
 */
public class ApiException extends Exception {

    public enum Status {
        BAD_REQUEST(400),
        UNAUTHORIZED(401),
        FORBIDDEN(403),
        SERVICE_UNAVAILABLE(503),
        INTERNAL_ERROR(500);

        private final int httpCode;

        Status(int httpCode) {
            this.httpCode = httpCode;
        }

        public int getHttpCode() {
            return httpCode;
        }
    }

    private final Status status;

    public ApiException(Status status, String detail) {
        super(detail);
        this.status = status;
    }

    public ApiException(Status status, String detail, Throwable cause) {
        super(detail, cause);
        this.status = status;
    }

    public Status getStatus() {
        return status;
    }
}
