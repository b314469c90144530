package com.plainwiki;

import com.fasterxml.jackson.core.type.TypeReference;
import com.plainwiki.models.HistoryEntry;
import com.plainwiki.storage.JsonStorage;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Append-only edit log of a single page.
 *
 * Layout: one JSON object per page, {root}/{dir}/history/{name}.json
 *   {
 *     "1697712345.123456": { "user": ..., "formatted-date": ..., "version": full body },
 *     ...
 *   }
 *
 * Keys are epoch seconds with a microsecond fraction and strictly increase;
 * a save landing on the same microsecond as the newest entry is pushed one
 * microsecond past it. Entries are never rewritten or removed.
 */
public class HistoryStore {

    private static final TypeReference<LinkedHashMap<String, HistoryEntry>> ENTRIES_TYPE =
        new TypeReference<>() {};
    private static final BigDecimal MICROSECOND = new BigDecimal("0.000001");
    private static final String DATE_PATTERN = "MMM dd, yyyy 'at' hh:mm:ss a";

    private final Path path;
    private final String url;
    private final Clock clock;
    private final DateTimeFormatter dateFormat;
    private final Map<String, HistoryEntry> entries;

    private HistoryStore(Path path, String url, Clock clock, Map<String, HistoryEntry> entries) {
        this.path = path;
        this.url = url;
        this.clock = clock;
        this.dateFormat = DateTimeFormatter.ofPattern(DATE_PATTERN, Locale.US).withZone(clock.getZone());
        this.entries = entries;
    }

    public static HistoryStore open(Path path, String url) throws IOException {
        return open(path, url, Clock.systemDefaultZone());
    }

    /**
     * Load the history file, creating it as {@code {}} when missing.
     *
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    public static HistoryStore open(Path path, String url, Clock clock) throws IOException {
        if (!Files.exists(path)) {
            Files.createDirectories(path.getParent());
            Files.writeString(path, "{}\n", StandardCharsets.UTF_8);
        }
        LinkedHashMap<String, HistoryEntry> loaded = JsonStorage.readJson(path, ENTRIES_TYPE);
        if (loaded == null) {
            throw new IOException("History file is not a JSON object: " + path);
        }
        return new HistoryStore(path, url, clock, loaded);
    }

    /**
     * Record a new version and rewrite the file.
     *
     * @return the key of the new entry
     */
    public String append(String user, String version) throws IOException {
        Instant now = clock.instant();
        String key = nextKey(now);
        entries.put(key, new HistoryEntry(user, dateFormat.format(now), version));
        JsonStorage.writeJsonAtomic(path, entries);
        return key;
    }

    /**
     * All keys, newest first.
     */
    public List<String> orderedKeys() {
        List<String> keys = new ArrayList<>(entries.keySet());
        keys.sort(Collections.reverseOrder(HistoryStore::compareKeys));
        return keys;
    }

    /**
     * Entries keyed by timestamp, newest first.
     */
    public Map<String, HistoryEntry> entries() {
        Map<String, HistoryEntry> ordered = new LinkedHashMap<>();
        for (String key : orderedKeys()) {
            ordered.put(key, entries.get(key));
        }
        return Collections.unmodifiableMap(ordered);
    }

    public HistoryEntry entry(String key) {
        return entries.get(key);
    }

    public HistoryEntry latest() {
        List<String> keys = orderedKeys();
        return keys.isEmpty() ? null : entries.get(keys.get(0));
    }

    public int size() {
        return entries.size();
    }

    public Path getPath() {
        return path;
    }

    public String getUrl() {
        return url;
    }

    private String nextKey(Instant now) {
        BigDecimal candidate = BigDecimal.valueOf(now.getEpochSecond())
            .add(BigDecimal.valueOf(now.getNano() / 1000, 6));
        for (String existing : entries.keySet()) {
            BigDecimal value = parseKey(existing);
            if (value != null && candidate.compareTo(value) <= 0) {
                candidate = value.add(MICROSECOND);
            }
        }
        return candidate.setScale(6, RoundingMode.DOWN).toPlainString();
    }

    /**
     * Ascending key order. Keys that are not numbers (hand edited files) rank
     * below every timestamp, among themselves by text.
     */
    static int compareKeys(String a, String b) {
        BigDecimal left = parseKey(a);
        BigDecimal right = parseKey(b);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        if (left != null) {
            return 1;
        }
        if (right != null) {
            return -1;
        }
        return a.compareTo(b);
    }

    private static BigDecimal parseKey(String key) {
        try {
            return new BigDecimal(key.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
