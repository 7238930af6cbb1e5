package Server;

import Server.routes.HealthRoutes;
import Server.routes.JobRoutes;
import com.gamearr.ReleaseEngine;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.Executors;

/**
 * Thin HTTP surface for manual job control and health reporting.
 */
public class ApiServer {

    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private ApiServer() {}

    public static HttpServer start(int port, ReleaseEngine engine) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);

        new JobRoutes(engine).register(server);
        new HealthRoutes(engine).register(server);

        server.setExecutor(Executors.newFixedThreadPool(4));
        server.start();
        log.info("API server listening on port {}", server.getAddress().getPort());
        return server;
    }
}
