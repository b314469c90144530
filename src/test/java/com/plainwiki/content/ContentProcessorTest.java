package com.plainwiki.content;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentProcessorTest {

    private final ContentProcessor plain = new ContentProcessor(ProcessorConfig.builder().build());

    @Test
    void headerWithoutBlankLineIsMalformed() {
        assertThrows(MalformedContentException.class, () -> plain.process("title: x\nno blank line"));
    }

    @Test
    void headerLineWithoutKeyIsMalformed() {
        assertThrows(MalformedContentException.class, () -> plain.process("not a pair\n\nbody"));
        assertThrows(MalformedContentException.class, () -> plain.process(":value\n\nbody"));
    }

    @Test
    void metaKeepsDocumentOrderWithLowercaseKeys() {
        ProcessedContent content = plain.process("Title: Hello\nTags: a,b\nCustom: v\n\nbody text");

        assertEquals(List.of("title", "tags", "custom"), List.copyOf(content.getMeta().keySet()));
        assertEquals("Hello", content.getMeta().get("title"));
        assertEquals("a,b", content.getMeta().get("tags"));
        assertEquals("body text", content.getBody());
    }

    @Test
    void leadingBlankLineMeansNoHeader() {
        ProcessedContent content = plain.process("\nJust body");
        assertTrue(content.getMeta().isEmpty());
        assertEquals("Just body", content.getBody());
    }

    @Test
    void windowsLineEndingsAreNormalized() {
        ProcessedContent content = plain.process("title: x\r\n\r\nline1\r\nline2");
        assertEquals("x", content.getMeta().get("title"));
        assertEquals("line1\nline2", content.getBody());
    }

    @Test
    void multiLineValuesAreJoined() {
        ProcessedContent content = plain.process("summary: one\n    two\n\nbody");
        assertEquals("one\ntwo", content.getMeta().get("summary"));
    }

    @Test
    void defaultsResolveWikiLinks() {
        ContentProcessor processor = new ContentProcessor(
            ProcessorConfig.defaults((route, url) -> "/wiki/" + url));
        ProcessedContent content = processor.process("title: x\n\nSee [[Other Page]].");
        assertTrue(content.getHtml().contains("<a href='/wiki/other_page'>Other Page</a>"));
    }

    @Test
    void runsConfiguredProcessorsInOrder() {
        ProcessorConfig config = ProcessorConfig.builder()
            .preProcessor(text -> text.replace("FOO", "bar"))
            .postProcessor(html -> html + "<!--first-->")
            .postProcessor(html -> html + "<!--second-->")
            .build();
        ProcessedContent content = new ContentProcessor(config).process("title: x\n\nFOO");

        assertEquals("bar", content.getBody());
        assertTrue(content.getHtml().contains("<p>bar</p>"));
        assertTrue(content.getHtml().endsWith("<!--first--><!--second-->"));
    }

    @Test
    void levelOneHeadingsGetContents() {
        ProcessedContent content = plain.process("\n# Intro\n\ntext\n\n# Usage Notes\n");
        assertTrue(content.getHtml().startsWith("<div class=\"row\">"));
        assertTrue(content.getHtml().contains("<a href=\"#Usage_Notes\">Usage Notes</a>"));
    }

    @Test
    void readingLeavesRatingAlone() {
        Map<String, String> meta = plain.process("rating: 4\ntotal: 8\ntimesrated: 2\n\nx").getMeta();
        assertEquals("4", meta.get("rating"));
        assertEquals("8", meta.get("total"));
        assertEquals("2", meta.get("timesrated"));
    }

    @Test
    void legacyFoldCountsStoredRatingOnRead() {
        ContentProcessor legacy = new ContentProcessor(ProcessorConfig.builder().legacyRatingFold(true).build());
        Map<String, String> meta = legacy.process("rating: 4\ntotal: 8\ntimesrated: 2\n\nx").getMeta();
        assertEquals("12", meta.get("total"));
        assertEquals("3", meta.get("timesrated"));
        assertEquals("4", meta.get("rating"));
    }

    @Test
    void splitKeepsEverythingAfterFirstBlankLine() {
        String[] parts = ContentProcessor.split("a: 1\n\nbody\n\nmore");
        assertEquals("a: 1", parts[0]);
        assertEquals("body\n\nmore", parts[1]);
    }
}
