package com.plainwiki.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plainwiki.AppLogger;
import com.plainwiki.Page;
import com.plainwiki.WikiRepository;
import com.plainwiki.content.UrlNormalizer;
import com.plainwiki.models.PageSummary;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP surface of the wiki.
 * Handles: index, grouped index, display, source, save, move, delete, rate,
 * history, tags, search. Errors are mapped centrally in Main.
 */
public class WikiController implements Controller {

    private static final String DEFAULT_USER = "anonymous";

    private final WikiRepository wiki;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public WikiController(WikiRepository wiki, ObjectMapper objectMapper) {
        this.wiki = wiki;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/pages", this::listPages);
        app.get("/api/pages/by/{attribute}", this::listPagesBy);
        app.put("/api/pages/<url>", this::savePage);
        app.delete("/api/pages/<url>", this::deletePage);
        app.get("/wiki/<url>", this::displayPage);
        app.get("/api/source/<url>", this::getSource);
        app.post("/api/move", this::movePage);
        app.post("/api/rate/<url>", this::ratePage);
        app.get("/api/history/<url>", this::getHistory);
        app.get("/api/tags", this::listTags);
        app.get("/api/tags/{tag}", this::pagesByTag);
        app.get("/api/search", this::search);
    }

    private void listPages(Context ctx) throws IOException {
        ctx.json(summaries(wiki.index()));
    }

    private void listPagesBy(Context ctx) throws IOException {
        Map<String, List<PageSummary>> grouped = new LinkedHashMap<>();
        wiki.indexBy(ctx.pathParam("attribute")).forEach((value, pages) -> grouped.put(value, summaries(pages)));
        ctx.json(grouped);
    }

    private void displayPage(Context ctx) throws IOException {
        Page page = wiki.getOrFail(url(ctx));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("url", page.getUrl());
        result.put("title", page.getTitle());
        result.put("html", page.getHtml());
        result.put("meta", page.getMeta());
        ctx.json(result);
    }

    private void getSource(Context ctx) throws IOException {
        Page page = wiki.getOrFail(url(ctx));
        ctx.json(Map.of("url", page.getUrl(), "meta", page.getMeta(), "body", page.getBody()));
    }

    private void savePage(Context ctx) throws IOException {
        String url = url(ctx);
        JsonNode json = objectMapper.readTree(ctx.body());
        String user = text(json, "user", DEFAULT_USER);

        Optional<Page> bare = wiki.getBare(url);
        boolean created = bare.isPresent();
        Page page = created ? bare.get() : wiki.getOrFail(url);

        if (json.has("title")) {
            page.setTitle(json.get("title").asText());
        }
        if (json.has("tags")) {
            page.setTags(json.get("tags").asText());
        }
        if (json.has("body")) {
            page.setBody(json.get("body").asText());
        }
        page.save(user);
        logger.info((created ? "Created: " : "Saved: ") + url + " by " + user);
        ctx.status(created ? 201 : 200).json(PageSummary.of(page));
    }

    private void deletePage(Context ctx) throws IOException {
        String url = url(ctx);
        if (!wiki.delete(url)) {
            ctx.status(404).json(Map.of("error", "Page not found: " + url));
            return;
        }
        ctx.json(Map.of("success", true, "message", "Deleted: " + url));
    }

    private void movePage(Context ctx) throws IOException {
        JsonNode json = objectMapper.readTree(ctx.body());
        String from = text(json, "from", null);
        String to = text(json, "to", null);
        if (from == null || to == null) {
            ctx.status(400).json(Map.of("error", "Both 'from' and 'to' urls required"));
            return;
        }
        String newUrl = UrlNormalizer.clean(to);
        wiki.move(UrlNormalizer.clean(from), newUrl);
        ctx.json(Map.of("success", true, "url", newUrl));
    }

    private void ratePage(Context ctx) throws IOException {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (!json.has("score") || !json.get("score").isNumber()) {
            ctx.status(400).json(Map.of("error", "Numeric 'score' required"));
            return;
        }
        Page page = wiki.getOrFail(url(ctx));
        page.rate(text(json, "user", DEFAULT_USER), json.get("score").asDouble());
        ctx.json(PageSummary.of(page));
    }

    private void getHistory(Context ctx) throws IOException {
        Page page = wiki.getOrFail(url(ctx));
        ctx.json(page.getHistory().entries());
    }

    private void listTags(Context ctx) throws IOException {
        Map<String, List<PageSummary>> tags = new LinkedHashMap<>();
        wiki.tags().forEach((tag, pages) -> tags.put(tag, summaries(pages)));
        ctx.json(tags);
    }

    private void pagesByTag(Context ctx) throws IOException {
        ctx.json(summaries(wiki.pagesByTag(ctx.pathParam("tag"))));
    }

    private void search(Context ctx) throws IOException {
        String query = ctx.queryParam("q");
        if (query == null || query.isEmpty()) {
            ctx.status(400).json(Map.of("error", "Query parameter 'q' required"));
            return;
        }
        boolean ignoreCase = !"false".equalsIgnoreCase(ctx.queryParam("ignoreCase"));
        String attrs = ctx.queryParam("attrs");
        List<String> attributes = attrs == null || attrs.isBlank()
            ? WikiRepository.DEFAULT_SEARCH_ATTRIBUTES
            : Arrays.asList(attrs.split(","));
        ctx.json(summaries(wiki.search(query, ignoreCase, attributes)));
    }

    private static String url(Context ctx) {
        return UrlNormalizer.clean(ctx.pathParam("url"));
    }

    private static String text(JsonNode json, String field, String fallback) {
        return json.has(field) && !json.get(field).isNull() ? json.get(field).asText() : fallback;
    }

    private static List<PageSummary> summaries(List<Page> pages) {
        List<PageSummary> result = new ArrayList<>(pages.size());
        for (Page page : pages) {
            result.add(PageSummary.of(page));
        }
        return result;
    }
}
