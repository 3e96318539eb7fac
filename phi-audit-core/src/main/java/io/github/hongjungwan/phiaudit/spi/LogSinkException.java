package io.github.hongjungwan.phiaudit.spi;

/**
 * sink 쓰기 실패.
 */
public class LogSinkException extends RuntimeException {

    public LogSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
