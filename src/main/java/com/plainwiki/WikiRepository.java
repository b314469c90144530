package com.plainwiki;

import com.plainwiki.content.ContentProcessor;
import com.plainwiki.content.MalformedContentException;
import com.plainwiki.content.ProcessorConfig;
import com.plainwiki.content.RenderException;
import com.plainwiki.content.UrlFormatter;
import com.plainwiki.content.UrlNormalizer;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The page collection under one content root.
 *
 * Holds no cache: every index, tag or search call walks the tree and renders
 * each page again. Every path handed to the filesystem is checked to stay
 * inside the root first.
 */
public class WikiRepository {

    public static final String CONTENT_EXTENSION = ".md";
    public static final String HISTORY_DIR = "history";
    public static final List<String> DEFAULT_SEARCH_ATTRIBUTES = List.of("title", "tags", "body");

    private final Path root;
    private final ContentProcessor processor;
    private final AppLogger logger = AppLogger.get();

    public WikiRepository(Path root, ContentProcessor processor) {
        this.root = root.toAbsolutePath().normalize();
        this.processor = processor;
    }

    public WikiRepository(Path root, UrlFormatter urlFormatter) {
        this(root, new ContentProcessor(ProcessorConfig.defaults(urlFormatter)));
    }

    public Path getRoot() {
        return root;
    }

    public Path path(String url) {
        return root.resolve(url + CONTENT_EXTENSION);
    }

    /**
     * {@code a/b} keeps its history in {@code {root}/a/history/b.json}.
     */
    public Path historyPath(String url) {
        return historyPathOf(path(url).normalize());
    }

    /**
     * History file of a content file: same folder, {@code history/{stem}.json}.
     */
    Path historyPathOf(Path contentFile) {
        String fileName = contentFile.getFileName().toString();
        String stem = fileName.substring(0, fileName.length() - CONTENT_EXTENSION.length());
        Path folder = contentFile.getParent() != null ? contentFile.getParent() : root;
        return folder.resolve(HISTORY_DIR).resolve(stem + ".json");
    }

    public boolean exists(String url) {
        return Files.exists(path(url));
    }

    public Optional<Page> get(String url) throws IOException {
        Path path = requireInsideRoot(url, path(url));
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(new Page(path, url, historyPath(url), processor, false));
    }

    public Page getOrFail(String url) throws IOException {
        return get(url).orElseThrow(() -> new PageNotFoundException(url));
    }

    /**
     * An unsaved page for {@code url}, or empty if one already exists there.
     */
    public Optional<Page> getBare(String url) throws IOException {
        Path path = requireInsideRoot(url, path(url));
        if (Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(new Page(path, url, historyPath(url), processor, true));
    }

    public Page create(String url, String user, String title, String body) throws IOException {
        Page page = getBare(url)
            .orElseThrow(() -> new FileAlreadyExistsException(path(url).toString(), null, "Page already exists: " + url));
        if (title != null && !title.isBlank()) {
            page.setTitle(title);
        }
        page.setBody(body);
        page.save(user, true);
        logger.info("Page created: " + url + " by " + user);
        return page;
    }

    /**
     * Rename a page and its history. The target must stay inside the content
     * root; nothing is touched otherwise.
     */
    public void move(String url, String newUrl) throws IOException {
        Path source = requireInsideRoot(url, path(url));
        Path target = requireInsideRoot(newUrl, path(newUrl));
        Path sourceHistory = historyPath(url);
        Path targetHistory = requireInsideRoot(newUrl, historyPath(newUrl));

        if (!Files.exists(source)) {
            throw new PageNotFoundException(url);
        }
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString(), null, "Target page already exists: " + newUrl);
        }

        Files.createDirectories(target.getParent());
        Files.move(source, target);

        if (Files.exists(sourceHistory)) {
            try {
                Files.createDirectories(targetHistory.getParent());
                Files.move(sourceHistory, targetHistory);
            } catch (IOException e) {
                Files.move(target, source);
                throw e;
            }
        }
        logger.info("Page moved: " + url + " -> " + newUrl);
    }

    /**
     * Remove a page and its history.
     *
     * @return false if there was no page at {@code url}
     * @throws IncompleteDeleteException if the content file went but the history file stayed
     */
    public boolean delete(String url) throws IOException {
        Path path = requireInsideRoot(url, path(url));
        if (!Files.exists(path)) {
            return false;
        }
        Path history = historyPath(url);
        Files.delete(path);
        try {
            Files.deleteIfExists(history);
        } catch (IOException e) {
            logger.error("History file left behind for " + url + ": " + history, e);
            throw new IncompleteDeleteException(url, history, e);
        }
        logger.info("Page deleted: " + url);
        return true;
    }

    /**
     * Every page under the root, sorted by title ignoring case. Pages whose
     * content cannot be processed are left out and logged. History paths follow
     * the file on disk, so {@code Guides/Setup.md} keeps {@code Guides/history/Setup.json}
     * even though its url is {@code guides/setup}.
     */
    public List<Page> index() throws IOException {
        if (!Files.isDirectory(root)) {
            return new ArrayList<>();
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(CONTENT_EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        }

        List<Page> pages = new ArrayList<>();
        for (Path file : files) {
            String relative = root.relativize(file).toString();
            String url = UrlNormalizer.clean(relative.substring(0, relative.length() - CONTENT_EXTENSION.length()));
            try {
                pages.add(new Page(file, url, historyPathOf(file), processor, false));
            } catch (MalformedContentException | RenderException e) {
                logger.warn("Skipping page " + relative + ": " + e.getMessage());
            }
        }
        pages.sort(Comparator.comparing(Page::getTitle, String.CASE_INSENSITIVE_ORDER));
        return pages;
    }

    /**
     * Group the index by the value of one page attribute.
     */
    public Map<String, List<Page>> indexBy(String attribute) throws IOException {
        Map<String, List<Page>> grouped = new LinkedHashMap<>();
        for (Page page : index()) {
            grouped.computeIfAbsent(page.attribute(attribute), k -> new ArrayList<>()).add(page);
        }
        return grouped;
    }

    /**
     * Tag to pages carrying it, tags sorted.
     */
    public Map<String, List<Page>> tags() throws IOException {
        Map<String, List<Page>> tags = new TreeMap<>();
        for (Page page : index()) {
            for (String tag : page.getTags().split(",")) {
                String trimmed = tag.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                tags.computeIfAbsent(trimmed, k -> new ArrayList<>()).add(page);
            }
        }
        return tags;
    }

    /**
     * Pages whose tag string contains {@code tag}. This is a substring match,
     * so "java" also finds pages tagged "javascript".
     */
    public List<Page> pagesByTag(String tag) throws IOException {
        List<Page> tagged = new ArrayList<>();
        for (Page page : index()) {
            if (page.getTags().contains(tag)) {
                tagged.add(page);
            }
        }
        tagged.sort(Comparator.comparing(Page::getTitle, String.CASE_INSENSITIVE_ORDER));
        return tagged;
    }

    public List<Page> search(String term) throws IOException {
        return search(term, true, DEFAULT_SEARCH_ATTRIBUTES);
    }

    public List<Page> search(String term, boolean ignoreCase) throws IOException {
        return search(term, ignoreCase, DEFAULT_SEARCH_ATTRIBUTES);
    }

    /**
     * Pages where the regular expression {@code term} is found in any of the
     * given attributes.
     *
     * @throws java.util.regex.PatternSyntaxException if {@code term} is not a valid pattern
     */
    public List<Page> search(String term, boolean ignoreCase, List<String> attributes) throws IOException {
        int flags = ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
        Pattern pattern = Pattern.compile(term, flags);
        List<String> attrs = attributes == null || attributes.isEmpty() ? DEFAULT_SEARCH_ATTRIBUTES : attributes;

        List<Page> matched = new ArrayList<>();
        for (Page page : index()) {
            for (String attr : attrs) {
                if (pattern.matcher(page.attribute(attr)).find()) {
                    matched.add(page);
                    break;
                }
            }
        }
        return matched;
    }

    private Path requireInsideRoot(String url, Path candidate) {
        Path normalized = candidate.toAbsolutePath().normalize();
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            throw new PathEscapeException(url, normalized);
        }
        return normalized;
    }
}
