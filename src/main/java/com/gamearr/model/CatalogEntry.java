package com.gamearr.model;

/**
 * A title the user tracks. {@code installedVersion} and {@code installedQuality}
 * are only meaningful once the entry has been acquired.
 */
public record CatalogEntry(
        long id,
        String title,
        Integer year,
        boolean monitored,
        CatalogStatus status,
        String installedVersion,
        String installedQuality,
        boolean ignoreUpdates
) {

    public static CatalogEntry wanted(long id, String title, Integer year) {
        return new CatalogEntry(id, title, year, true, CatalogStatus.WANTED, null, null, false);
    }

    public static CatalogEntry acquired(long id, String title, String installedVersion, String installedQuality) {
        return new CatalogEntry(id, title, null, true, CatalogStatus.ACQUIRED, installedVersion, installedQuality, false);
    }

    public CatalogEntry withStatus(CatalogStatus newStatus) {
        return new CatalogEntry(id, title, year, monitored, newStatus, installedVersion, installedQuality, ignoreUpdates);
    }

    public CatalogEntry withInstalled(String version, String quality) {
        return new CatalogEntry(id, title, year, monitored, status, version, quality, ignoreUpdates);
    }
}
