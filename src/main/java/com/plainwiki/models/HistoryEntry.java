package com.plainwiki.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One recorded edit: who saved, when (human readable), and the full body at that point.
 */
public class HistoryEntry {
    private String user;
    @JsonProperty("formatted-date")
    private String formattedDate;
    private String version;

    public HistoryEntry() {
        // Default constructor for Jackson
    }

    public HistoryEntry(String user, String formattedDate, String version) {
        this.user = user;
        this.formattedDate = formattedDate;
        this.version = version;
    }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    @JsonProperty("formatted-date")
    public String getFormattedDate() { return formattedDate; }
    @JsonProperty("formatted-date")
    public void setFormattedDate(String formattedDate) { this.formattedDate = formattedDate; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
}
