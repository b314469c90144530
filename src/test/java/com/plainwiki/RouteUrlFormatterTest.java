package com.plainwiki;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RouteUrlFormatterTest {

    @Test
    void formatsKnownRoutes() {
        RouteUrlFormatter routes = new RouteUrlFormatter();
        assertEquals("/wiki/guides/setup", routes.format("wiki.display", "guides/setup"));
        assertEquals("/api/history/home", routes.format("wiki.history", "home"));
    }

    @Test
    void prefixesBasePath() {
        RouteUrlFormatter routes = new RouteUrlFormatter("/docs/");
        assertEquals("/docs/wiki/home", routes.format("wiki.display", "home"));
    }

    @Test
    void acceptsExtraRoutes() {
        RouteUrlFormatter routes = new RouteUrlFormatter().route("wiki.print", "/print/{url}");
        assertEquals("/print/home", routes.format("wiki.print", "home"));
    }

    @Test
    void unknownRouteFails() {
        assertThrows(IllegalArgumentException.class, () -> new RouteUrlFormatter().format("nope", "home"));
    }
}
