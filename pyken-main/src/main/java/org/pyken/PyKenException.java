package org.pyken;

public class PyKenException extends RuntimeException {

    public PyKenException(String message) {
        super(message);
    }

    public PyKenException(String message, Throwable cause) {
        super(message, cause);
    }

    public PyKenException(Throwable cause) {
        super(cause);
    }
}
