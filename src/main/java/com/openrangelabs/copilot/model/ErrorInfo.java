package com.openrangelabs.copilot.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Failure detail carried by {@link ConnectorResult#err(ErrorInfo)}.
 *
 * <p>The message is meant to be shown verbatim to an operator. The remote
 * error code and HTTP status are kept when the remote supplied them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {

    private final ErrorKind kind;
    private final String message;
    private final String code;
    private final Integer httpStatus;

    private ErrorInfo(ErrorKind kind, String message, String code, Integer httpStatus) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public static ErrorInfo of(ErrorKind kind, String message) {
        return new ErrorInfo(kind, message, null, null);
    }

    public static ErrorInfo of(ErrorKind kind, String message, String code, Integer httpStatus) {
        return new ErrorInfo(kind, message, code, httpStatus);
    }

    public static ErrorInfo transport(String message) {
        return new ErrorInfo(ErrorKind.TRANSPORT, message, null, null);
    }

    public static ErrorInfo httpStatus(int status, String message) {
        return new ErrorInfo(ErrorKind.HTTP_STATUS, message, null, status);
    }

    public static ErrorInfo notFound(String message) {
        return new ErrorInfo(ErrorKind.NOT_FOUND, message, null, null);
    }

    public static ErrorInfo invalidArgument(String message) {
        return new ErrorInfo(ErrorKind.INVALID_ARGUMENT, message, null, null);
    }

    public boolean isNotFound() {
        return kind == ErrorKind.NOT_FOUND;
    }

    // Getters
    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public String getCode() { return code; }
    public Integer getHttpStatus() { return httpStatus; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorInfo)) return false;
        ErrorInfo that = (ErrorInfo) o;
        return kind == that.kind
                && message.equals(that.message)
                && Objects.equals(code, that.code)
                && Objects.equals(httpStatus, that.httpStatus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, code, httpStatus);
    }

    @Override
    public String toString() {
        return "ErrorInfo{" +
                "kind=" + kind +
                ", message='" + message + '\'' +
                ", code='" + code + '\'' +
                ", httpStatus=" + httpStatus +
                '}';
    }
}
