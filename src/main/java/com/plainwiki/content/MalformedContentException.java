package com.plainwiki.content;

/**
 * Raised when a page file cannot be split into a metadata header and a body,
 * or when a header line is not a {@code key: value} pair.
 */
public class MalformedContentException extends RuntimeException {

    public MalformedContentException(String message) {
        super(message);
    }
}
