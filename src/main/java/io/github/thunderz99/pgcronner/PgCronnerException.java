package io.github.thunderz99.pgcronner;

/**
 * Base exception thrown by java-pgcronner. Carries a http-like status code so that callers(e.g. a web handler) can map
 * the failure without inspecting the concrete type.
 */
public class PgCronnerException extends RuntimeException {

    static final long serialVersionUID = 1L;

    /**
     * http-like status code. e.g. 400 / 404 / 409 / 500
     */
    final int statusCode;

    /**
     * String error code. e.g. ValidationFailed / NotFound / Conflict
     */
    final String code;

    /**
     * Constructor using statusCode and message
     *
     * @param statusCode http-like status code
     * @param code       string error code
     * @param message    detail message
     */
    public PgCronnerException(int statusCode, String code, String message) {
        super(message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * Constructor using statusCode, message and cause
     *
     * @param statusCode http-like status code
     * @param code       string error code
     * @param message    detail message
     * @param cause      cause exception
     */
    public PgCronnerException(int statusCode, String code, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * Get the exception's status code. e.g. 404 / 409 / 500
     *
     * @return status code of exception.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Get the string code e.g. NotFound / Conflict / etc
     *
     * @return code for exception
     */
    public String getCode() {
        return code;
    }
}
