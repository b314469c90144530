package com.plainwiki.content;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlNormalizerTest {

    @Test
    void collapsesSpacesAndLowercases() {
        assertEquals("my_page", UrlNormalizer.clean("  My    Page "));
        assertEquals("a_b_c", UrlNormalizer.clean("A B  C"));
    }

    @Test
    void convertsWindowsSeparators() {
        assertEquals("folder/sub/page", UrlNormalizer.clean("Folder\\Sub\\Page"));
        assertEquals("folder/page", UrlNormalizer.clean("folder\\\\page"));
    }

    @Test
    void emptyAndNullBecomeEmpty() {
        assertEquals("", UrlNormalizer.clean(""));
        assertEquals("", UrlNormalizer.clean(null));
        assertEquals("", UrlNormalizer.clean("   "));
    }

    @Test
    void isIdempotent() {
        String[] samples = {
            "Hello World", "  Leading and trailing  ", "Mixed\\Case\\\\Path", "already_clean/page",
            "Tabs\tand  spaces", "ÜBER  Seite", "", "a  \\  b"
        };
        for (String sample : samples) {
            String once = UrlNormalizer.clean(sample);
            assertEquals(once, UrlNormalizer.clean(once), "not idempotent for: " + sample);
        }
    }
}
