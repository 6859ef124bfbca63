package com.umitunal.sendlater.delivery;

/**
 * Result of one outbound delivery call.
 */
public final class DeliveryOutcome {

    public enum Kind {
        DELIVERED,
        REJECTED,
        TRANSPORT_FAILURE
    }

    private final Kind kind;
    private final String externalId;
    private final int errorCode;
    private final String message;

    private DeliveryOutcome(Kind kind, String externalId, int errorCode, String message) {
        this.kind = kind;
        this.externalId = externalId;
        this.errorCode = errorCode;
        this.message = message;
    }

    public static DeliveryOutcome delivered(String externalId) {
        return new DeliveryOutcome(Kind.DELIVERED, externalId, 0, null);
    }

    public static DeliveryOutcome rejected(int errorCode, String message) {
        return new DeliveryOutcome(Kind.REJECTED, null, errorCode, message);
    }

    public static DeliveryOutcome transportFailure(String message) {
        return new DeliveryOutcome(Kind.TRANSPORT_FAILURE, null, 0, message);
    }

    public Kind getKind() { return kind; }
    public boolean isDelivered() { return kind == Kind.DELIVERED; }
    public String getExternalId() { return externalId; }
    public int getErrorCode() { return errorCode; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return switch (kind) {
            case DELIVERED -> "Delivered(" + externalId + ")";
            case REJECTED -> "Rejected(" + errorCode + ", " + message + ")";
            case TRANSPORT_FAILURE -> "TransportFailure(" + message + ")";
        };
    }
}
