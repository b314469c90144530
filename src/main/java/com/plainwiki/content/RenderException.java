package com.plainwiki.content;

/**
 * The markdown renderer rejected its input.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
