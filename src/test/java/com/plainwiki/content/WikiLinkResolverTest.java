package com.plainwiki.content;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WikiLinkResolverTest {

    private final List<String> routes = new ArrayList<>();
    private final WikiLinkResolver resolver = new WikiLinkResolver((route, url) -> {
        routes.add(route);
        return "/wiki/" + url;
    });

    @Test
    void rewritesPlainLink() {
        String html = resolver.apply("<p>See [[Foo]] now</p>");
        assertEquals("<p>See <a href='/wiki/foo'>Foo</a> now</p>", html);
        assertEquals(List.of(WikiLinkResolver.DISPLAY_ROUTE), routes);
    }

    @Test
    void usesDisplayNameAndNormalizesTarget() {
        String html = resolver.apply("<p>[[Some Page/Child Page | The Child]]</p>");
        assertEquals("<p><a href='/wiki/some_page/child_page'>The Child</a></p>", html);
    }

    @Test
    void toleratesMissingWhitespaceAroundPipe() {
        assertEquals("<a href='/wiki/a'>B</a>", resolver.apply("[[a|B]]"));
    }

    @Test
    void replacesEveryLinkLeftToRight() {
        String html = resolver.apply("[[One]] and [[Two|2]] and [[One]]");
        assertEquals("<a href='/wiki/one'>One</a> and <a href='/wiki/two'>2</a> and <a href='/wiki/one'>One</a>", html);
    }

    @Test
    void leavesInlineCodeAlone() {
        String html = resolver.apply("<p><code>[[Foo]]</code> but [[Foo]]</p>");
        assertEquals("<p><code>[[Foo]]</code> but <a href='/wiki/foo'>Foo</a></p>", html);
    }

    @Test
    void leavesCodeBlocksAlone() {
        String html = "<pre class=\"codehilite\"><code class=\"language-text\">x = [[Foo]]\n</code></pre>";
        assertEquals(html, resolver.apply(html));
    }

    @Test
    void textWithoutLinksIsUnchanged() {
        assertEquals("<p>nothing [here]</p>", resolver.apply("<p>nothing [here]</p>"));
        assertTrue(routes.isEmpty());
    }

    @Test
    void requiresFormatter() {
        assertThrows(IllegalArgumentException.class, () -> new WikiLinkResolver(null));
    }
}
