package com.plainwiki.content;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer();

    @Test
    void stripsHeaderAndReturnsItsValues() {
        MarkdownRenderer.RenderedMarkdown rendered =
            renderer.render("Title: Hello\ntags: a, b\n\n# Head\n\ntext");

        assertTrue(rendered.getHtml().contains("<h1>Head</h1>"));
        assertTrue(rendered.getHtml().contains("<p>text</p>"));
        assertFalse(rendered.getHtml().contains("Hello"));
        assertEquals(Map.of("title", List.of("Hello"), "tags", List.of("a, b")), rendered.getMeta());
    }

    @Test
    void collectsContinuationLines() {
        MarkdownRenderer.RenderedMarkdown rendered = renderer.render("summary: first\n    second\n\nbody");
        assertEquals(List.of("first", "second"), rendered.getMeta().get("summary"));
        assertFalse(rendered.getHtml().contains("second"));
    }

    @Test
    void textWithoutHeaderIsRenderedWhole() {
        MarkdownRenderer.RenderedMarkdown rendered = renderer.render("Just text\n\nmore");
        assertTrue(rendered.getMeta().isEmpty());
        assertTrue(rendered.getHtml().contains("Just text"));
        assertTrue(rendered.getHtml().contains("more"));
    }

    @Test
    void rendersTables() {
        String html = renderer.render("\n| a | b |\n|---|---|\n| 1 | 2 |\n").getHtml();
        assertTrue(html.contains("<table>"));
        assertTrue(html.contains("1</td>"));
    }

    @Test
    void marksCodeBlocksForHighlighting() {
        String html = renderer.render("\n```java\nint x = 1;\n```\n").getHtml();
        assertTrue(html.contains("class=\"" + MarkdownRenderer.CODE_BLOCK_CLASS + "\""));
        assertTrue(html.contains("language-java"));
        assertTrue(html.contains("int x = 1;"));
    }

    @Test
    void rendersEachDocumentIndependently() {
        String first = renderer.render("\n# One").getHtml();
        String second = renderer.render("\n# Two").getHtml();
        assertFalse(second.contains("One"));
        assertTrue(first.contains("One"));
    }
}
