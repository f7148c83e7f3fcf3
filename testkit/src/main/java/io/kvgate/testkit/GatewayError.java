// file: testkit/src/main/java/io/kvgate/testkit/GatewayError.java
package io.kvgate.testkit;

/**
 * Store-side failure, rendered as the gateway's error body
 * {@code {"error": ..., "code": ..., "message": ...}}.
 */
final class GatewayError extends RuntimeException {
    static final int INVALID_ARGUMENT = 3;
    static final int NOT_FOUND = 5;
    static final int FAILED_PRECONDITION = 9;
    static final int OUT_OF_RANGE = 11;

    private final int code;

    GatewayError(int code, String message) {
        super(message);
        this.code = code;
    }

    int code() {
        return code;
    }

    int httpStatus() {
        return switch (code) {
            case INVALID_ARGUMENT, FAILED_PRECONDITION, OUT_OF_RANGE -> 400;
            case NOT_FOUND -> 404;
            default -> 500;
        };
    }
}
