package io.sichter.error;

public final class CollaboratorException extends RuntimeException {
    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
