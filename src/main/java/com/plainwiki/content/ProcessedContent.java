package com.plainwiki.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of running a page through {@link ContentProcessor}.
 */
public final class ProcessedContent {
    private final String html;
    private final String body;
    private final Map<String, String> meta;

    public ProcessedContent(String html, String body, Map<String, String> meta) {
        this.html = html;
        this.body = body;
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /** Final HTML: links resolved, table of contents prepended. */
    public String getHtml() { return html; }

    /** Markdown source without the metadata header. */
    public String getBody() { return body; }

    /** Header values in document order. */
    public Map<String, String> getMeta() { return meta; }
}
