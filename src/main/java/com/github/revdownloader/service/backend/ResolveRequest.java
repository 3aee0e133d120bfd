package com.github.revdownloader.service.backend;

import com.github.revdownloader.service.coordinator.CancellationToken;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

/**
 * Metadata lookup for one URL.
 */
@Data
@Builder
public class ResolveRequest {

    @NonNull
    private final String sessionId;

    @NonNull
    private final String url;

    /**
     * Whether the backend may expand the URL into a playlist.
     */
    @Builder.Default
    private final boolean playlist = true;

    /**
     * Last playlist entry to resolve; 0 resolves everything.
     */
    private final int playlistEnd;

    @NonNull
    private final CancellationToken cancellation;
}
