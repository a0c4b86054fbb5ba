package io.cutpool.core;

public class CutPoolException extends RuntimeException {

    public CutPoolException(Throwable cause) {
        super(cause);
    }

    public CutPoolException(String message, Throwable cause) {
        super(message, cause);
    }

    public CutPoolException(String message) {
        super(message);
    }

}
