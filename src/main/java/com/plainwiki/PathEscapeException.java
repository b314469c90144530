package com.plainwiki;

import java.nio.file.Path;

/**
 * A url resolved to a location outside the content root. Raised before any
 * file is touched.
 */
public class PathEscapeException extends SecurityException {

    private final String url;

    public PathEscapeException(String url, Path resolved) {
        super("Possible access outside content directory: " + url + " -> " + resolved);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
