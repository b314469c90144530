package com.plainwiki;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesBothArgumentForms() throws IOException {
        Path content = tempDir.resolve("content");
        Path logs = tempDir.resolve("logs");
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--content=" + content, "--logs", logs.toString(), "--dev", "--legacy-rating"})
            .build();

        assertEquals(content.toAbsolutePath().normalize(), config.getContentPath());
        assertEquals(logs.toAbsolutePath().normalize().resolve("plainwiki.log"), config.getLogPath());
        assertTrue(Files.isDirectory(logs));
        assertTrue(config.isDevMode());
        assertTrue(config.isLegacyRatingFold());
    }

    @Test
    void flagsDefaultOff() throws IOException {
        AppConfig config = new AppConfig.Builder()
            .logDirectory(tempDir.toString())
            .parseArgs(new String[0])
            .build();

        assertFalse(config.isDevMode());
        assertFalse(config.isLegacyRatingFold());
        assertEquals(AppConfig.getDefaultContentPath(), config.getContentPath());
    }

    @Test
    void badPortKeepsDefault() throws IOException {
        AppConfig config = new AppConfig.Builder()
            .logDirectory(tempDir.toString())
            .parseArgs(new String[] {"--port=notanumber", "--port", "0"})
            .build();
        assertEquals(0, config.getPort());
    }

    @Test
    void busyExplicitPortFails() throws IOException {
        try (ServerSocket taken = new ServerSocket(0)) {
            AppConfig.Builder builder = new AppConfig.Builder()
                .logDirectory(tempDir.toString())
                .parseArgs(new String[] {"--port=" + taken.getLocalPort()});
            IOException e = assertThrows(IOException.class, builder::build);
            assertTrue(e.getMessage().contains(String.valueOf(taken.getLocalPort())));
        }
    }

    @Test
    void explicitPortIsReportedAsRequested() throws IOException {
        AppConfig config = new AppConfig.Builder()
            .logDirectory(tempDir.toString())
            .port(0)
            .build();
        assertEquals(config.getRequestedPort(), config.getPort());
    }
}
