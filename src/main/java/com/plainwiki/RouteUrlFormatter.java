package com.plainwiki;

import com.plainwiki.content.UrlFormatter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Route name to path table of the web layer; the link resolver builds its
 * hrefs through it.
 */
public class RouteUrlFormatter implements UrlFormatter {

    private final String basePath;
    private final Map<String, String> routes = new LinkedHashMap<>();

    public RouteUrlFormatter() {
        this("");
    }

    public RouteUrlFormatter(String basePath) {
        this.basePath = basePath == null ? "" : basePath.replaceAll("/+$", "");
        routes.put("wiki.display", "/wiki/{url}");
        routes.put("wiki.source", "/api/source/{url}");
        routes.put("wiki.history", "/api/history/{url}");
        routes.put("wiki.tag", "/api/tags/{url}");
    }

    public RouteUrlFormatter route(String name, String template) {
        routes.put(name, template);
        return this;
    }

    @Override
    public String format(String route, String url) {
        String template = routes.get(route);
        if (template == null) {
            throw new IllegalArgumentException("Unknown route: " + route);
        }
        return basePath + template.replace("{url}", url == null ? "" : url);
    }
}
