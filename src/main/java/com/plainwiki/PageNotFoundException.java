package com.plainwiki;

import java.io.FileNotFoundException;

/**
 * No content file exists for the requested url. The web layer answers 404.
 */
public class PageNotFoundException extends FileNotFoundException {

    private final String url;

    public PageNotFoundException(String url) {
        super("Page not found: " + url);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
