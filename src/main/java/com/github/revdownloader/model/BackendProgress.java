package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

/**
 * Progress sample emitted by a media backend for the item it is transferring.
 * Every size field is optional; backends report what they know.
 */
@Data
@Builder
public class BackendProgress {

    public enum Phase {
        DOWNLOADING,
        FINISHED
    }

    @Builder.Default
    private final Phase phase = Phase.DOWNLOADING;

    private final long downloadedBytes;
    private final Long totalBytes;
    private final Long totalBytesEstimate;
    private final Integer fragmentIndex;
    private final Integer fragmentCount;

    // Set by line-scraping backends that only see a percentage
    private final Double fraction;

    public Long getKnownTotalBytes() {
        if (totalBytes != null && totalBytes > 0) {
            return totalBytes;
        }
        if (totalBytesEstimate != null && totalBytesEstimate > 0) {
            return totalBytesEstimate;
        }
        return null;
    }

    public boolean hasFragments() {
        return fragmentIndex != null && fragmentCount != null && fragmentCount > 0;
    }

    public static BackendProgress finished(long downloadedBytes, Long totalBytes) {
        return BackendProgress.builder()
                .phase(Phase.FINISHED)
                .downloadedBytes(downloadedBytes)
                .totalBytes(totalBytes)
                .build();
    }

    public static BackendProgress ofFraction(double fraction) {
        return BackendProgress.builder()
                .fraction(fraction)
                .build();
    }
}
