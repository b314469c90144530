package com.plainwiki.content;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns user supplied page names into canonical urls.
 *
 * The result is used both as a lookup key and as the relative file path stem,
 * so "Some  Page\\Child" and "some page/child" address the same file.
 */
public final class UrlNormalizer {

    private static final Pattern REPEATED_SPACES = Pattern.compile("[ ]{2,}");

    private UrlNormalizer() {
    }

    /**
     * Collapse repeated spaces and trim, lowercase and turn spaces into
     * underscores, then convert Windows separators to forward slashes.
     */
    public static String clean(String url) {
        if (url == null || url.isEmpty()) {
            return "";
        }
        String cleaned = REPEATED_SPACES.matcher(url).replaceAll(" ").trim();
        cleaned = cleaned.toLowerCase(Locale.ROOT).replace(' ', '_');
        return cleaned.replace("\\\\", "/").replace('\\', '/');
    }
}
