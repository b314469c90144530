package com.plainwiki;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: content root, log location, port and flags.
 */
public class AppConfig {

    private static final String APP_NAME = "PlainWiki";
    public static final int DEFAULT_PORT = 8080;

    private final Path contentPath;
    private final Path logPath;
    private final int port;
    private final int requestedPort;
    private final boolean devMode;
    private final boolean legacyRatingFold;

    private AppConfig(Path contentPath, Path logPath, int port, int requestedPort,
                      boolean devMode, boolean legacyRatingFold) {
        this.contentPath = contentPath;
        this.logPath = logPath;
        this.port = port;
        this.requestedPort = requestedPort;
        this.devMode = devMode;
        this.legacyRatingFold = legacyRatingFold;
    }

    public Path getContentPath() {
        return contentPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    /**
     * The port asked for. Differs from {@link #getPort()} only when the default
     * port was busy and another one was picked.
     */
    public int getRequestedPort() {
        return requestedPort;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public boolean isLegacyRatingFold() {
        return legacyRatingFold;
    }

    /**
     * Default content root.
     * Windows: %USERPROFILE%\Documents\PlainWiki\content
     * macOS: ~/Documents/PlainWiki/content
     * Linux: ~/PlainWiki/content
     */
    public static Path getDefaultContentPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "content");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "content");
        } else {
            return Paths.get(userHome, APP_NAME, "content");
        }
    }

    /**
     * Log directory.
     * Windows: %APPDATA%\PlainWiki\logs
     * macOS: ~/Library/Logs/PlainWiki
     * Linux: ~/.local/share/PlainWiki/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    /**
     * The preferred port if free, otherwise any free port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            // let the server fail on start with a clear message
            return preferredPort;
        }
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path contentPath = null;
        private Path logDirectory = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean portExplicit = false;
        private boolean devMode = false;
        private boolean legacyRatingFold = false;

        public Builder contentPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.contentPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logDirectory(String path) {
            if (path != null && !path.isEmpty()) {
                this.logDirectory = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            this.portExplicit = true;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder legacyRatingFold(boolean legacyRatingFold) {
            this.legacyRatingFold = legacyRatingFold;
            return this;
        }

        /**
         * Accepts --content, --logs and --port (as "--x=v" or "--x v"),
         * --dev and --legacy-rating.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--content=")) {
                    contentPath(arg.substring("--content=".length()));
                } else if ("--content".equals(arg) && i + 1 < args.length) {
                    contentPath(args[++i]);
                } else if (arg.startsWith("--logs=")) {
                    logDirectory(arg.substring("--logs=".length()));
                } else if ("--logs".equals(arg) && i + 1 < args.length) {
                    logDirectory(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else if ("--legacy-rating".equals(arg)) {
                    this.legacyRatingFold = true;
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                port(Integer.parseInt(value));
            } catch (NumberFormatException ignored) {
                // keep the default
            }
        }

        /**
         * A busy port given with --port fails here. A busy default port is
         * replaced by a free one; see {@link AppConfig#getRequestedPort()}.
         */
        public AppConfig build() throws IOException {
            Path content = contentPath != null ? contentPath : getDefaultContentPath();
            Path logDir = logDirectory != null ? logDirectory : getLogDirectory();
            Files.createDirectories(logDir);
            int port;
            if (portExplicit) {
                if (!isPortAvailable(preferredPort)) {
                    throw new IOException("Port " + preferredPort + " is already in use");
                }
                port = preferredPort;
            } else {
                port = findAvailablePort(preferredPort);
            }
            return new AppConfig(content, logDir.resolve("plainwiki.log"), port, preferredPort,
                devMode, legacyRatingFold);
        }
    }
}
