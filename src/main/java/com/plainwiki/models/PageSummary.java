package com.plainwiki.models;

import com.plainwiki.Page;

/**
 * What listings (index, tags, search) report per page.
 */
public class PageSummary {
    private String url;
    private String title;
    private String tags;
    private double rating;

    public PageSummary() {
    }

    public PageSummary(String url, String title, String tags, double rating) {
        this.url = url;
        this.title = title;
        this.tags = tags;
        this.rating = rating;
    }

    public static PageSummary of(Page page) {
        return new PageSummary(page.getUrl(), page.getTitle(), page.getTags(), page.getRating());
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getTags() { return tags; }
    public void setTags(String tags) { this.tags = tags; }

    public double getRating() { return rating; }
    public void setRating(double rating) { this.rating = rating; }
}
