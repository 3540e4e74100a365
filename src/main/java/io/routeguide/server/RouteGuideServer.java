package io.routeguide.server;

import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.routeguide.service.RouteGuideService;
import io.routeguide.store.FeatureLoadException;
import io.routeguide.store.FeatureLoader;
import io.routeguide.store.FeatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Serves {@link RouteGuideService} over gRPC on the address given by {@link ServerConfig}.
 */
public class RouteGuideServer {

    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ServerConfig config;
    private final RouteGuideService service;
    private final CallStatsInterceptor callStats = new CallStatsInterceptor();
    private final Server server;

    public RouteGuideServer(ServerConfig config, FeatureStore featureStore) {
        this.config = config;
        this.service = new RouteGuideService(featureStore);
        NettyServerBuilder builder = NettyServerBuilder
                .forAddress(new InetSocketAddress(config.getHost(), config.getPort()))
                .addService(ServerInterceptors.intercept(service, callStats));
        if (config.isReflectionEnabled()) {
            builder.addService(ProtoReflectionService.newInstance());
        }
        this.server = builder.build();
    }

    public static void main(String[] args) throws Exception {
        final ServerConfig config = ServerConfig.load();
        final FeatureStore featureStore;
        try {
            featureStore = FeatureLoader.load(config.getFeaturesFile());
        } catch (FeatureLoadException e) {
            log.error("Failed to load features. Server will not start.", e);
            System.exit(1);
            return;
        }
        final RouteGuideServer server = new RouteGuideServer(config, featureStore);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down route guide server since JVM is shutting down");
            try {
                server.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        server.blockUntilShutdown();
    }

    public void start() throws IOException {
        server.start();
        log.info("Route guide server started, listening on {}:{}", config.getHost(), getPort());
    }

    /**
     * Stop accepting calls, wait for calls in progress to finish then force the rest to close.
     */
    public void stop() throws InterruptedException {
        server.shutdown();
        if (!server.awaitTermination(config.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
            log.warn("Calls still active after {}s. Forcing shutdown", config.getShutdownTimeoutSeconds());
            server.shutdownNow();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
        log.info("Route guide server stopped");
    }

    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * @return the bound port. Differs from the configured port when that was 0.
     */
    public int getPort() {
        return server.getPort();
    }

    public RouteGuideService getService() {
        return service;
    }

    public Stats getStats() {
        return new Stats(callStats.getActiveCalls());
    }

    public static class Stats {
        private final int activeCalls;

        public Stats(int activeCalls) {
            this.activeCalls = activeCalls;
        }

        public int getActiveCalls() {
            return activeCalls;
        }
    }
}
