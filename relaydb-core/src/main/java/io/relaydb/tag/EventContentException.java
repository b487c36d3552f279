package io.relaydb.tag;

/**
 * Unchecked exception raised when stored event content cannot be decoded as an
 * event document with a {@code tags} array of string arrays.
 */
public final class EventContentException extends RuntimeException {
    public EventContentException(String message) {
        super(message);
    }

    public EventContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
