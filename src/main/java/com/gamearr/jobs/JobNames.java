package com.gamearr.jobs;

public final class JobNames {

    public static final String RSS_SYNC = "rss-sync";
    public static final String RELEASE_SEARCH = "release-search";
    public static final String UPDATE_CHECK = "update-check";
    public static final String DOWNLOAD_MONITOR = "download-monitor";

    private JobNames() {}
}
