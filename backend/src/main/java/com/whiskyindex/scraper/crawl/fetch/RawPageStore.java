package com.whiskyindex.scraper.crawl.fetch;

import com.whiskyindex.scraper.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class RawPageStore {
    private static final Logger log = LoggerFactory.getLogger(RawPageStore.class);

    private final ScraperProperties properties;

    public RawPageStore(ScraperProperties properties) {
        this.properties = properties;
    }

    public boolean isEnabled() {
        String dir = properties.getHttp().getRawDataDir();
        return dir != null && !dir.isBlank();
    }

    public String read(long id) {
        if (!isEnabled()) {
            return null;
        }
        Path file = pathFor(id);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read cached page {}: {}", file, e.getMessage());
            return null;
        }
    }

    public void write(long id, String html) {
        if (!isEnabled() || html == null) {
            return;
        }
        Path file = pathFor(id);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to cache page {}: {}", file, e.getMessage());
        }
    }

    Path pathFor(long id) {
        return Path.of(properties.getHttp().getRawDataDir()).resolve(id + ".html");
    }
}
