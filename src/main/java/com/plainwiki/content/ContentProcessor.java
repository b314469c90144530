package com.plainwiki.content;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Turns the raw text of a page file into HTML, markdown body and metadata.
 *
 * Stages, in order:
 *   pre-process  -> configured text transforms
 *   render       -> markdown to HTML
 *   split        -> header block / body on the first blank line
 *   parse-meta   -> ordered key/value pairs, keys lowercased
 *   post-process -> configured HTML transforms (wiki links by default)
 *   build-toc    -> contents block for level 1 headings
 *
 * A processor holds no per-page state and can be shared.
 */
public class ContentProcessor {

    private final ProcessorConfig config;

    public ContentProcessor(ProcessorConfig config) {
        this.config = config;
    }

    public ProcessorConfig getConfig() {
        return config;
    }

    public ProcessedContent process(String text) {
        String pre = preProcess(text);
        MarkdownRenderer.RenderedMarkdown rendered = config.getRenderer().render(pre);
        String[] parts = split(pre);
        Map<String, String> meta = parseMeta(parts[0], rendered.getMeta());
        String html = postProcess(rendered.getHtml());
        html = TableOfContents.apply(html);
        return new ProcessedContent(html, parts[1], meta);
    }

    String preProcess(String text) {
        String current = text == null ? "" : text.replace("\r\n", "\n");
        for (UnaryOperator<String> processor : config.getPreProcessors()) {
            current = processor.apply(current);
        }
        return current;
    }

    String postProcess(String html) {
        String current = html;
        for (UnaryOperator<String> processor : config.getPostProcessors()) {
            current = processor.apply(current);
        }
        return current;
    }

    /**
     * Split on the first blank line. A file starting with a blank line has an
     * empty header.
     */
    static String[] split(String text) {
        if (text.startsWith("\n")) {
            return new String[] {"", text.substring(1)};
        }
        int separator = text.indexOf("\n\n");
        if (separator < 0) {
            throw new MalformedContentException("No blank line between metadata header and body");
        }
        return new String[] {text.substring(0, separator), text.substring(separator + 2)};
    }

    Map<String, String> parseMeta(String rawHeader, Map<String, List<String>> rendererMeta) {
        Map<String, String> meta = new LinkedHashMap<>();
        String lastKey = null;
        for (String line : rawHeader.split("\n")) {
            if (line.trim().isEmpty()) {
                continue;
            }
            if (lastKey != null && (line.startsWith("    ") || line.startsWith("\t"))) {
                meta.put(lastKey, meta.get(lastKey) + "\n" + line.trim());
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new MalformedContentException("Metadata line is not 'key: value': " + line);
            }
            lastKey = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            meta.put(lastKey, line.substring(colon + 1).trim());
        }

        // renderer values win; keys it alone recognised go after the raw ones
        for (Map.Entry<String, List<String>> entry : rendererMeta.entrySet()) {
            meta.put(entry.getKey(), String.join("\n", entry.getValue()));
        }

        if (config.isLegacyRatingFold()) {
            RatingStats.legacyFold(meta);
        }
        return meta;
    }
}
