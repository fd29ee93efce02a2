package com.ghlinker.reactions;

/**
 * The message lives somewhere reactions cannot be managed, such as a direct message.
 */
public class InvalidContextException extends IllegalArgumentException {

    public InvalidContextException(String message) {
        super(message);
    }
}
