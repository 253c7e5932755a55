package com.whiskyindex.scraper.crawl.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whiskyindex.scraper.crawl.model.WhiskyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

public class DeadLetterDrainFailureHandler implements DrainFailureHandler {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterDrainFailureHandler.class);
    static final String FILE_NAME = "whisky-dead-letter.jsonl";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public DeadLetterDrainFailureHandler(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void handle(List<WhiskyRecord> records, Throwable cause) {
        if (records.isEmpty()) {
            return;
        }
        Path file = directory.resolve(FILE_NAME);
        String failedAt = Instant.now().toString();
        String error = cause == null ? null : cause.getMessage();
        try {
            Files.createDirectories(directory);
            try (BufferedWriter writer = Files.newBufferedWriter(
                file,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            )) {
                for (WhiskyRecord record : records) {
                    writer.write(toLine(record, failedAt, error));
                    writer.newLine();
                }
            }
            log.error("Wrote {} unpersisted records to dead-letter file {}", records.size(), file);
        } catch (IOException e) {
            log.error("Failed to write {} records to dead-letter file {}; records are lost", records.size(), file, e);
        }
    }

    private String toLine(WhiskyRecord record, String failedAt, String error) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("failedAt", failedAt);
        node.put("error", error);
        node.set("record", objectMapper.valueToTree(record));
        return objectMapper.writeValueAsString(node);
    }

    public Path file() {
        return directory.resolve(FILE_NAME);
    }
}
