package com.plainwiki.content;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites wiki links in rendered HTML into anchors.
 *
 * Syntax:
 *   [[Target]]              -> link to clean("Target"), text "Target"
 *   [[Target | Some Name]]  -> link to clean("Target"), text "Some Name"
 *
 * Rules:
 *   - Runs after markdown rendering, so it sees HTML.
 *   - Anything inside a {@code <code>} element is left untouched.
 *   - Targets are always absolute; sub pages are written [[page/subpage|Subpage]].
 */
public class WikiLinkResolver implements UnaryOperator<String> {

    public static final String DISPLAY_ROUTE = "wiki.display";

    private static final Pattern LINK_PATTERN = Pattern.compile(
        "\\[\\[([^<\\]|].*?)\\s*(?:\\|\\s*(.+?)\\s*)?]]");
    private static final Pattern CODE_PATTERN = Pattern.compile(
        "<code[^>]*>.*?</code>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final UrlFormatter urlFormatter;

    public WikiLinkResolver(UrlFormatter urlFormatter) {
        if (urlFormatter == null) {
            throw new IllegalArgumentException("urlFormatter required");
        }
        this.urlFormatter = urlFormatter;
    }

    @Override
    public String apply(String html) {
        if (html == null || html.indexOf("[[") < 0) {
            return html;
        }
        List<int[]> codeSpans = findCodeSpans(html);
        Matcher matcher = LINK_PATTERN.matcher(html);
        StringBuilder out = new StringBuilder(html.length());
        while (matcher.find()) {
            if (insideAny(codeSpans, matcher.start())) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            String target = matcher.group(1);
            String display = matcher.group(2) != null ? matcher.group(2) : target;
            matcher.appendReplacement(out, Matcher.quoteReplacement(anchor(target, display)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String anchor(String target, String display) {
        String href = urlFormatter.format(DISPLAY_ROUTE, UrlNormalizer.clean(target));
        return "<a href='" + href + "'>" + display + "</a>";
    }

    private static List<int[]> findCodeSpans(String html) {
        List<int[]> spans = new ArrayList<>();
        Matcher matcher = CODE_PATTERN.matcher(html);
        while (matcher.find()) {
            spans.add(new int[] {matcher.start(), matcher.end()});
        }
        return spans;
    }

    private static boolean insideAny(List<int[]> spans, int position) {
        for (int[] span : spans) {
            if (position >= span[0] && position < span[1]) {
                return true;
            }
        }
        return false;
    }
}
