package com.gamearr;

import com.gamearr.dedup.DedupStore;
import com.gamearr.dedup.ProcessedGuidSnapshotStore;
import com.gamearr.integration.CatalogStore;
import com.gamearr.integration.DownloadClient;
import com.gamearr.integration.MetadataClient;
import com.gamearr.integration.ReleaseFeedClient;
import com.gamearr.jobs.AcquisitionService;
import com.gamearr.jobs.DownloadMonitorJob;
import com.gamearr.jobs.JobNames;
import com.gamearr.jobs.ReleaseSearchJob;
import com.gamearr.jobs.RssSyncJob;
import com.gamearr.jobs.UpdateCheckJob;
import com.gamearr.release.ReleaseMatcher;
import com.gamearr.scheduler.JobStatus;
import com.gamearr.scheduler.RunSummary;
import com.gamearr.scheduler.SingleFlightScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Wires the jobs onto one scheduler and exposes the manual-control surface.
 */
public class ReleaseEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReleaseEngine.class);

    private final SingleFlightScheduler scheduler;
    private final EngineSettings settings;
    private final ReleaseFeedClient feed;
    private final DownloadClient downloadClient;
    private final RssSyncJob rssSync;

    public record Collaborators(
            ReleaseFeedClient feed,
            DownloadClient downloadClient,
            CatalogStore catalog,
            MetadataClient metadata,
            ProcessedGuidSnapshotStore snapshots
    ) {}

    public record Options(
            String downloadCategory,
            int dedupMaxProcessed,
            Duration dedupMaxAge,
            Duration downloadMonitorInterval
    ) {

        public static Options fromConfig() {
            return new Options(Config.getQBittorrentCategory(), Config.getDedupMaxProcessed(),
                    Duration.ofHours(Config.getDedupMaxAgeHours()),
                    Duration.ofSeconds(Math.max(5, Config.getDownloadMonitorIntervalSeconds())));
        }
    }

    public ReleaseEngine(Collaborators collaborators, EngineSettings settings, Options options, Clock clock) {
        this(collaborators, settings, options, clock, new SingleFlightScheduler(clock));
    }

    ReleaseEngine(Collaborators c, EngineSettings settings, Options options, Clock clock, SingleFlightScheduler scheduler) {
        this.scheduler = scheduler;
        this.settings = settings;
        this.feed = c.feed();
        this.downloadClient = c.downloadClient();

        ReleaseMatcher matcher = new ReleaseMatcher(clock);
        AcquisitionService acquisition = new AcquisitionService(c.downloadClient(), c.catalog(), settings, options.downloadCategory());
        DedupStore dedup = new DedupStore(options.dedupMaxProcessed(), options.dedupMaxAge(), clock);
        ProcessedGuidSnapshotStore snapshots = c.snapshots() == null ? ProcessedGuidSnapshotStore.NONE : c.snapshots();

        this.rssSync = new RssSyncJob(c.feed(), c.catalog(), acquisition, matcher, dedup, snapshots, settings, clock);
        ReleaseSearchJob search = new ReleaseSearchJob(c.feed(), c.catalog(), acquisition, matcher, settings, clock);
        UpdateCheckJob updateCheck = new UpdateCheckJob(c.feed(), c.catalog(), c.metadata(), matcher, settings, clock);
        DownloadMonitorJob monitor = new DownloadMonitorJob(c.downloadClient(), c.catalog(), settings, options.downloadCategory(), clock);

        scheduler.register(rssSync, Duration.ofMinutes(settings.rssIntervalMinutes()), Duration.ofSeconds(30));
        scheduler.register(search, Duration.ofMinutes(settings.searchIntervalMinutes()), Duration.ofMinutes(2));
        scheduler.register(updateCheck, settings.updateSchedule().interval(), Duration.ofMinutes(1));
        scheduler.register(monitor, options.downloadMonitorInterval(), options.downloadMonitorInterval());
    }

    public void start() {
        scheduler.startAll();
        log.info("Release engine started ({} mode)", settings.dryRun() ? "dry-run" : "live");
    }

    public boolean hasJob(String name) {
        return scheduler.isRegistered(name);
    }

    /**
     * Starts a run, or joins the one in progress.
     */
    public CompletableFuture<RunSummary> trigger(String name) {
        log.info("Manual trigger of {}", name);
        return scheduler.trigger(name);
    }

    /**
     * Applies a new interval, clamped for the polling jobs, and reinstalls the timer.
     *
     * @return the interval actually applied
     */
    public Duration updateInterval(String name, Duration requested) {
        Duration applied = switch (name) {
            case JobNames.RSS_SYNC -> {
                settings.setRssIntervalMinutes(toMinutes(requested));
                yield Duration.ofMinutes(settings.rssIntervalMinutes());
            }
            case JobNames.RELEASE_SEARCH -> {
                settings.setSearchIntervalMinutes(toMinutes(requested));
                yield Duration.ofMinutes(settings.searchIntervalMinutes());
            }
            default -> requested;
        };
        scheduler.updateInterval(name, applied);
        return applied;
    }

    public void updateSchedule(EngineSettings.UpdateSchedule schedule) {
        settings.setUpdateSchedule(schedule);
        scheduler.updateInterval(JobNames.UPDATE_CHECK, settings.updateSchedule().interval());
    }

    public List<JobStatus> statuses() {
        return scheduler.statuses();
    }

    public Optional<JobStatus> status(String name) {
        return scheduler.status(name);
    }

    public int clearProcessedReleases() {
        int count = rssSync.processedCount();
        rssSync.clearProcessed();
        return count;
    }

    public EngineSettings settings() {
        return settings;
    }

    public ReleaseFeedClient feed() {
        return feed;
    }

    public DownloadClient downloadClient() {
        return downloadClient;
    }

    @Override
    public void close() {
        scheduler.close();
    }

    private static int toMinutes(Duration d) {
        long minutes = (d.toSeconds() + 59) / 60;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0, minutes));
    }
}
