package com.plainwiki.content;

import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.AttributeProvider;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.html.IndependentAttributeProviderFactory;
import com.vladsch.flexmark.html.renderer.AttributablePart;
import com.vladsch.flexmark.html.renderer.LinkResolverContext;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.html.MutableAttributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown to HTML conversion backed by flexmark.
 *
 * Understands a leading key-value header (one {@code key: value} per line,
 * values continued on lines indented by four spaces), which is stripped from
 * the output and returned separately. Tables and fenced code are enabled; code
 * blocks carry the {@code codehilite} class and a {@code language-*} class for
 * client side highlighting.
 *
 * Parser and renderer are immutable and shared. Every call parses into a fresh
 * document, so nothing from one page leaks into the next.
 */
public class MarkdownRenderer {

    public static final String CODE_BLOCK_CLASS = "codehilite";

    private static final Pattern META_LINE = Pattern.compile("^[ ]{0,3}([A-Za-z0-9_-]+):\\s*(.*)$");
    private static final Pattern META_MORE = Pattern.compile("^(?:[ ]{4,}|\\t)(.*)$");

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MarkdownRenderer() {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, List.of(TablesExtension.create()))
            .set(HtmlRenderer.FENCED_CODE_LANGUAGE_CLASS_PREFIX, "language-")
            .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
            .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true)
            .set(TablesExtension.HEADER_SEPARATOR_COLUMN_MATCH, true);

        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options)
            .attributeProviderFactory(new IndependentAttributeProviderFactory() {
                @Override
                public AttributeProvider apply(LinkResolverContext context) {
                    return new CodeBlockClassProvider();
                }
            })
            .build();
    }

    public RenderedMarkdown render(String text) {
        String source = text == null ? "" : text;
        List<String> lines = List.of(source.split("\n", -1));
        Map<String, List<String>> meta = new LinkedHashMap<>();
        int bodyStart = readHeader(lines, meta);
        String markdown = String.join("\n", lines.subList(bodyStart, lines.size()));

        try {
            Node document = parser.parse(markdown);
            return new RenderedMarkdown(renderer.render(document), meta);
        } catch (RuntimeException e) {
            throw new RenderException("Markdown rendering failed: " + e.getMessage(), e);
        }
    }

    /**
     * Consume header lines into {@code meta}; returns the index of the first body line.
     */
    private static int readHeader(List<String> lines, Map<String, List<String>> meta) {
        String lastKey = null;
        int index = 0;
        for (; index < lines.size(); index++) {
            String line = lines.get(index);
            if (line.trim().isEmpty()) {
                index++;
                break;
            }
            Matcher keyMatch = META_LINE.matcher(line);
            if (keyMatch.matches()) {
                lastKey = keyMatch.group(1).toLowerCase(Locale.ROOT);
                meta.computeIfAbsent(lastKey, k -> new ArrayList<>()).add(keyMatch.group(2).trim());
                continue;
            }
            Matcher moreMatch = META_MORE.matcher(line);
            if (lastKey != null && moreMatch.matches()) {
                meta.get(lastKey).add(moreMatch.group(1).trim());
                continue;
            }
            break;
        }
        if (meta.isEmpty()) {
            return 0;
        }
        return index;
    }

    private static class CodeBlockClassProvider implements AttributeProvider {
        @Override
        public void setAttributes(Node node, AttributablePart part, MutableAttributes attributes) {
            if (part == AttributablePart.NODE
                && (node instanceof FencedCodeBlock || node instanceof IndentedCodeBlock)) {
                attributes.addValue("class", CODE_BLOCK_CLASS);
            }
        }
    }

    /**
     * Renderer output: HTML plus the header values it recognised, keys lowercased.
     */
    public static final class RenderedMarkdown {
        private final String html;
        private final Map<String, List<String>> meta;

        public RenderedMarkdown(String html, Map<String, List<String>> meta) {
            this.html = html;
            this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        }

        public String getHtml() { return html; }

        public Map<String, List<String>> getMeta() { return meta; }
    }
}
