package com.github.revdownloader.service.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.revdownloader.model.BackendProgress;
import lombok.extern.slf4j.Slf4j;

/**
 * Parser for the JSON progress lines yt-dlp prints when started with
 * {@code --progress-template "download:[progress]%(progress)j"}.
 */
@Slf4j
public class YtDlpProgressTemplateParser implements ProgressParser {

    public static final String PROGRESS_PREFIX = "[progress]";

    private final ObjectMapper objectMapper;

    public YtDlpProgressTemplateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public BackendProgress parseLine(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith(PROGRESS_PREFIX)) {
            return null;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed.substring(PROGRESS_PREFIX.length()));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable progress line: {}", trimmed);
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }

        long downloaded = longValue(node, "downloaded_bytes", 0L);
        Long total = optionalLong(node, "total_bytes");

        if ("finished".equals(node.path("status").asText())) {
            return BackendProgress.finished(total != null ? Math.max(total, downloaded) : downloaded, total);
        }
        if (!"downloading".equals(node.path("status").asText())) {
            return null;
        }

        return BackendProgress.builder()
                .downloadedBytes(downloaded)
                .totalBytes(total)
                .totalBytesEstimate(optionalLong(node, "total_bytes_estimate"))
                .fragmentIndex(optionalInt(node, "fragment_index"))
                .fragmentCount(optionalInt(node, "fragment_count"))
                .build();
    }

    @Override
    public void reset() {
        // Every line is self-contained
    }

    private static long longValue(JsonNode node, String field, long defaultValue) {
        Long value = optionalLong(node, field);
        return value != null ? value : defaultValue;
    }

    private static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.asLong();
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.asInt();
    }
}
