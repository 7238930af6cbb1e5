package com.gamearr;

import Server.ApiServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearr.catalog.JsonCatalogStore;
import com.gamearr.dedup.RedisConfig;
import com.gamearr.dedup.RedisProcessedGuidSnapshotStore;
import com.gamearr.integration.MetadataClient;
import com.gamearr.prowlarr.ProwlarrClient;
import com.gamearr.qbittorrent.QBittorrentClient;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            Config.printStatus();

            ObjectMapper mapper = JacksonConfig.newObjectMapper();
            HttpClient http = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(10))
                    .build();

            JsonCatalogStore catalog = new JsonCatalogStore(Config.getCatalogFile(), mapper);
            catalog.load();

            ProwlarrClient prowlarr = new ProwlarrClient(http, mapper,
                    Config.getProwlarrUrl(), Config.getProwlarrApiKey(), Config.getProwlarrCategories());
            QBittorrentClient qbittorrent = new QBittorrentClient(http, mapper,
                    Config.getQBittorrentHost(), Config.getQBittorrentUsername(), Config.getQBittorrentPassword());

            EngineSettings settings = EngineSettings.fromConfig();
            ReleaseEngine.Options options = ReleaseEngine.Options.fromConfig();
            RedisProcessedGuidSnapshotStore snapshots = new RedisProcessedGuidSnapshotStore(mapper, options.dedupMaxAge());

            ReleaseEngine engine = new ReleaseEngine(
                    new ReleaseEngine.Collaborators(prowlarr, qbittorrent, catalog, MetadataClient.DISABLED, snapshots),
                    settings, options, Clock.systemUTC());

            HttpServer server = ApiServer.start(Config.getPort(), engine);
            engine.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down");
                server.stop(1);
                engine.close();
                RedisConfig.shutdown();
            }, "shutdown"));
        } catch (Exception e) {
            log.error("Failed to start: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
