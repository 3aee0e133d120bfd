package com.github.revdownloader.service.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.revdownloader.exception.BackendException;
import com.github.revdownloader.model.MediaEntry;
import com.github.revdownloader.model.MediaMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the document printed by {@code yt-dlp --dump-single-json --flat-playlist}.
 */
@Component
@RequiredArgsConstructor
public class YtDlpMetadataParser {

    private final ObjectMapper objectMapper;

    public MediaMetadata parse(String json, String requestedUrl) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new BackendException("Invalid metadata returned by backend: " + e.getOriginalMessage(), e, requestedUrl);
        }
        if (root == null || !root.isObject()) {
            throw new BackendException("No metadata returned by backend", requestedUrl);
        }

        List<MediaEntry> entries = null;
        JsonNode entriesNode = root.get("entries");
        if (entriesNode != null && entriesNode.isArray()) {
            entries = new ArrayList<>();
            for (JsonNode entryNode : entriesNode) {
                entries.add(entryNode == null || entryNode.isNull() ? null : toEntry(entryNode));
            }
        }

        String url = entryUrl(root);
        return MediaMetadata.builder()
                .url(url != null ? url : requestedUrl)
                .title(text(root, "title"))
                .uploader(text(root, "uploader"))
                .type(text(root, "_type"))
                .entries(entries)
                .build();
    }

    private static MediaEntry toEntry(JsonNode node) {
        return MediaEntry.builder()
                .url(entryUrl(node))
                .title(text(node, "title"))
                .uploader(text(node, "uploader"))
                .build();
    }

    // The page URL is stable; "url" may be a direct media link
    private static String entryUrl(JsonNode node) {
        String webpageUrl = text(node, "webpage_url");
        return webpageUrl != null ? webpageUrl : text(node, "url");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
