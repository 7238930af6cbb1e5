package com.gamearr.model;

public record UpdateCandidate(
        long entryId,
        String catalogTitle,
        UpdateType type,
        String title,
        String version,
        String quality,
        long size,
        Integer seeders,
        String downloadUrl,
        String indexer
) {

    public static UpdateCandidate of(CatalogEntry entry, ReleaseCandidate release, UpdateType type,
                                     String version, String quality) {
        return new UpdateCandidate(entry.id(), entry.title(), type, release.title(), version, quality,
                release.size(), release.seeders(), release.downloadUrl(), release.indexer());
    }
}
