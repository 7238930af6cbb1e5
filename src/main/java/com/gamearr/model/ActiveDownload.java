package com.gamearr.model;

/**
 * Snapshot of one transfer as reported by the download client. {@code entryId}
 * is recovered from the {@code game-<id>} tag and is null for foreign transfers.
 */
public record ActiveDownload(
        String handle,
        String name,
        double progress,
        DownloadState state,
        String category,
        Long entryId
) {

    public boolean isComplete() {
        return state == DownloadState.COMPLETED || progress >= 1.0;
    }
}
