package io.specqueue.storage;

public final class QueueStateException extends RuntimeException {
    public QueueStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
