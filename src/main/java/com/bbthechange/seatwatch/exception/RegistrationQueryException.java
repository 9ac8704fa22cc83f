package com.bbthechange.seatwatch.exception;

/**
 * Exception thrown when a section query against the registration platform fails.
 * Covers transport failures, the exchange deadline, non-2xx responses and unreadable bodies.
 * An unsuccessful search envelope is not an error; it yields an empty result instead.
 */
public class RegistrationQueryException extends RuntimeException {

    private final ErrorType errorType;

    public enum ErrorType {
        /**
         * Connection refused, reset, interrupted or any other I/O failure.
         */
        TRANSPORT_FAILURE,

        /**
         * The term declaration and search did not complete within the deadline.
         */
        TIMEOUT,

        /**
         * The platform answered with a non-2xx status.
         */
        BAD_STATUS,

        /**
         * The search body could not be parsed as JSON.
         */
        MALFORMED_RESPONSE
    }

    public RegistrationQueryException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public RegistrationQueryException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static RegistrationQueryException transportFailure(String step, Throwable cause) {
        return new RegistrationQueryException(
                ErrorType.TRANSPORT_FAILURE,
                "Registration platform unreachable during " + step + ": " + cause.getMessage(),
                cause
        );
    }

    public static RegistrationQueryException timeout(String step) {
        return new RegistrationQueryException(
                ErrorType.TIMEOUT,
                "Registration platform query timed out during " + step
        );
    }

    public static RegistrationQueryException badStatus(String step, int statusCode) {
        return new RegistrationQueryException(
                ErrorType.BAD_STATUS,
                "Registration platform returned status " + statusCode + " during " + step
        );
    }

    public static RegistrationQueryException malformedResponse(Throwable cause) {
        return new RegistrationQueryException(
                ErrorType.MALFORMED_RESPONSE,
                "Unreadable section search response",
                cause
        );
    }
}
