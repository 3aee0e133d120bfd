package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * What the media backend knows about a URL before anything is downloaded.
 * {@code entries} is null for a plain single video and a (possibly empty)
 * list for anything the backend reported as a container.
 */
@Data
@Builder
public class MediaMetadata {

    private String url;
    private String title;
    private String uploader;
    private String type;

    private List<MediaEntry> entries;

    public boolean hasEntries() {
        return entries != null && !entries.isEmpty();
    }

    public boolean isPlaylistType() {
        return "playlist".equalsIgnoreCase(type);
    }

    public List<MediaEntry> getNonNullEntries() {
        if (entries == null) {
            return List.of();
        }
        List<MediaEntry> result = new ArrayList<>();
        for (MediaEntry entry : entries) {
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }
}
