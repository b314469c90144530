package com.plainwiki;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The content file of a page was removed but its history file could not be.
 */
public class IncompleteDeleteException extends IOException {

    private final Path orphan;

    public IncompleteDeleteException(String url, Path orphan, Throwable cause) {
        super("Page " + url + " deleted but history file remains: " + orphan, cause);
        this.orphan = orphan;
    }

    public Path getOrphan() {
        return orphan;
    }
}
