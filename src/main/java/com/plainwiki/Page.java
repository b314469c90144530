package com.plainwiki;

import com.plainwiki.content.ContentProcessor;
import com.plainwiki.content.ProcessedContent;
import com.plainwiki.content.RatingStats;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One wiki page backed by a markdown file with a metadata header.
 *
 * A page read from disk is loaded and rendered on construction; a bare page
 * (not saved yet) starts with an empty body and no metadata. The history file
 * is opened on first use, so reading pages never creates history files.
 */
public class Page {

    public static final String TITLE = "title";
    public static final String TAGS = "tags";
    public static final String FLAG = "flag";

    private final Path path;
    private final String url;
    private final Path historyPath;
    private final ContentProcessor processor;

    private HistoryStore history;
    private String content = "";
    private String body = "";
    private String html = "";
    private Map<String, String> meta = new LinkedHashMap<>();

    public Page(Path path, String url, Path historyPath, ContentProcessor processor, boolean bare) throws IOException {
        this.path = path;
        this.url = url;
        this.historyPath = historyPath;
        this.processor = processor;
        if (!bare) {
            load();
            render();
        }
    }

    public void load() throws IOException {
        this.content = Files.readString(path, StandardCharsets.UTF_8);
    }

    public void render() {
        ProcessedContent processed = processor.process(content);
        this.html = processed.getHtml();
        this.body = processed.getBody();
        this.meta = new LinkedHashMap<>(processed.getMeta());
    }

    /**
     * Write header and body, record the body in the history and, when
     * {@code update} is set, reload so html and meta reflect the file.
     */
    public void save(String user, boolean update) throws IOException {
        Path folder = path.getParent();
        if (folder != null) {
            Files.createDirectories(folder);
        }
        String normalizedBody = body.replace("\r\n", "\n");

        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, String> entry : meta.entrySet()) {
            out.append(entry.getKey()).append(": ").append(headerValue(entry.getValue())).append('\n');
        }
        out.append('\n').append(normalizedBody);
        Files.writeString(path, out.toString(), StandardCharsets.UTF_8);

        getHistory().append(user, normalizedBody);

        if (update) {
            load();
            render();
        }
    }

    /**
     * One header value, continuation lines indented. Blank lines are dropped:
     * the first blank line in the file ends the header.
     */
    static String headerValue(String value) {
        StringBuilder out = new StringBuilder();
        for (String line : value.replace("\r\n", "\n").split("\n")) {
            if (line.trim().isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append("\n    ");
            }
            out.append(line.trim());
        }
        return out.toString();
    }

    public void save(String user) throws IOException {
        save(user, true);
    }

    /**
     * Fold one score into the stored average and save.
     */
    public void rate(String user, double score) throws IOException {
        RatingStats.fromMeta(meta).withScore(score).writeTo(meta);
        save(user, true);
    }

    public HistoryStore getHistory() throws IOException {
        if (history == null) {
            history = HistoryStore.open(historyPath, url);
        }
        return history;
    }

    /**
     * Value of a named attribute as text: one of url, title, tags, body, html,
     * rating, flag, or any metadata key (empty when absent).
     */
    public String attribute(String name) {
        switch (name) {
            case "url":
                return url;
            case TITLE:
                return getTitle();
            case TAGS:
                return getTags();
            case "body":
                return body;
            case "html":
                return html;
            case RatingStats.RATING:
                return RatingStats.formatNumber(getRating());
            case FLAG:
                return String.valueOf(getFlag());
            default:
                return meta.getOrDefault(name, "");
        }
    }

    public String get(String key) {
        return meta.get(key);
    }

    public void put(String key, String value) {
        meta.put(key, value);
    }

    public String getTitle() {
        String title = meta.get(TITLE);
        return title != null ? title : url;
    }

    public void setTitle(String title) {
        meta.put(TITLE, title);
    }

    public String getTags() {
        String tags = meta.get(TAGS);
        return tags != null ? tags : "";
    }

    public void setTags(String tags) {
        meta.put(TAGS, tags);
    }

    public double getRating() {
        return RatingStats.parseNumber(meta.get(RatingStats.RATING));
    }

    public void setRating(double rating) {
        meta.put(RatingStats.RATING, RatingStats.formatNumber(rating));
    }

    public int getFlag() {
        return (int) RatingStats.parseNumber(meta.get(FLAG));
    }

    public void setFlag(int flag) {
        meta.put(FLAG, String.valueOf(flag));
    }

    public Path getPath() { return path; }

    public String getUrl() { return url; }

    public Path getHistoryPath() { return historyPath; }

    public String getContent() { return content; }

    public String getBody() { return body; }
    public void setBody(String body) { this.body = body == null ? "" : body; }

    public String getHtml() { return html; }

    /**
     * Live, ordered metadata; changes are written on the next save.
     */
    public Map<String, String> getMeta() { return meta; }

    @Override
    public String toString() {
        return "Page[" + url + "@" + path + "]";
    }
}
