package com.plainwiki.content;

/**
 * Builds a routable path for a named route and a page url.
 * Supplied by the web layer so content processing never depends on routing.
 */
@FunctionalInterface
public interface UrlFormatter {

    String format(String route, String url);
}
