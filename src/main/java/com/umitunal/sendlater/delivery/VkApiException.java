package com.umitunal.sendlater.delivery;

/**
 * A VK API call failed, either with an API error or in transport.
 */
public class VkApiException extends Exception {
    public static final int TRANSPORT_ERROR = -1;

    private final int errorCode;

    public VkApiException(int errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public VkApiException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = TRANSPORT_ERROR;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
