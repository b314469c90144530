package com.plainwiki.content;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a contents block for pages that use level 1 headings.
 *
 * Each heading gets a named anchor right before it, and the block linking to
 * those anchors is prepended to the page. Anchor names are the heading text
 * with spaces replaced by underscores; case is kept.
 */
public final class TableOfContents {

    private static final Pattern H1 = Pattern.compile("<h1>(.*?)</h1>", Pattern.DOTALL);

    private static final String OPEN =
        "<div class=\"row\"><div class=\"span2\"><h3>Contents</h3><ul class='nav nav-tabs nav-stacked'>";
    private static final String CLOSE = "</ul><br></div></div>";

    private TableOfContents() {
    }

    public static String apply(String html) {
        if (html == null) {
            return null;
        }
        List<int[]> positions = new ArrayList<>();
        List<String> headings = new ArrayList<>();
        Matcher matcher = H1.matcher(html);
        while (matcher.find()) {
            positions.add(new int[] {matcher.start(), matcher.end()});
            headings.add(matcher.group(1));
        }
        if (headings.isEmpty()) {
            return html;
        }

        StringBuilder contents = new StringBuilder(OPEN);
        for (String heading : headings) {
            contents.append("<li><a href=\"#").append(anchorName(heading)).append("\">")
                .append(heading).append("</a></li>");
        }
        contents.append(CLOSE);

        // back to front so earlier offsets stay valid
        StringBuilder body = new StringBuilder(html);
        for (int i = headings.size() - 1; i >= 0; i--) {
            body.insert(positions.get(i)[0], "<a name=\"" + anchorName(headings.get(i)) + "\"></a>");
        }
        return contents.append(body).toString();
    }

    static String anchorName(String heading) {
        return heading.replace(' ', '_');
    }
}
