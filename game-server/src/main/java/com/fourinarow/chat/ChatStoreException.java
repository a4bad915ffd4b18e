package com.fourinarow.chat;

/**
 * A chat store could not complete a read or write.
 */
public class ChatStoreException extends RuntimeException {

    public ChatStoreException(String message) {
        super(message);
    }

    public ChatStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
