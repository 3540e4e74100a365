package io.routeguide.client;

import io.grpc.Channel;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.stub.StreamObserver;
import io.routeguide.geo.GeometryUtils;
import io.routeguide.proto.Feature;
import io.routeguide.proto.Point;
import io.routeguide.proto.Rectangle;
import io.routeguide.proto.RouteGuideGrpc;
import io.routeguide.proto.RouteNote;
import io.routeguide.proto.RouteSummary;
import io.routeguide.server.ServerConfig;
import io.routeguide.store.FeatureLoader;
import io.routeguide.store.FeatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Drives the four route guide calls against a running server and logs the results.
 */
public class RouteGuideClient {

    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final RouteGuideGrpc.RouteGuideBlockingStub blockingStub;
    private final RouteGuideGrpc.RouteGuideStub asyncStub;
    private final long deadlineSeconds;
    private final Random random;
    private long pauseMillis = 100;

    public RouteGuideClient(Channel channel, long deadlineSeconds) {
        this(channel, deadlineSeconds, new Random());
    }

    public RouteGuideClient(Channel channel, long deadlineSeconds, Random random) {
        this.blockingStub = RouteGuideGrpc.newBlockingStub(channel);
        this.asyncStub = RouteGuideGrpc.newStub(channel);
        this.deadlineSeconds = deadlineSeconds;
        this.random = random;
    }

    /**
     * Pause between points sent by {@link #recordRoute}
     */
    public void setPauseMillis(long pauseMillis) {
        this.pauseMillis = pauseMillis;
    }

    public static void main(String[] args) throws Exception {
        final ServerConfig config = ServerConfig.load();
        final String target = args.length > 0 ? args[0] : config.getClientTarget();
        //Route points are picked from the same dataset the server is configured with
        final FeatureStore features = FeatureLoader.load(config.getFeaturesFile());

        ManagedChannel channel = Grpc.newChannelBuilder(target, InsecureChannelCredentials.create()).build();
        try {
            RouteGuideClient client = new RouteGuideClient(channel, config.getClientDeadlineSeconds());
            //Looking for a valid feature
            client.getFeature(409146138, -746188906);
            //Feature missing
            client.getFeature(0, 0);
            //Looking for features between 40, -75 and 42, -73
            client.listFeatures(400000000, -750000000, 420000000, -730000000);
            client.recordRoute(features.getFeatures(), 10);
            client.routeChat();
        } finally {
            channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    public Feature getFeature(int lat, int lon) {
        log.info("*** GetFeature: lat={} lon={}", lat, lon);
        Point request = Point.newBuilder().setLatitude(lat).setLongitude(lon).build();
        final Feature feature = blockingStub.withDeadlineAfter(deadlineSeconds, TimeUnit.SECONDS).getFeature(request);
        if (feature.getName().isEmpty()) {
            log.info("Found no feature at {}", GeometryUtils.format(feature.getLocation()));
        } else {
            log.info("Found feature called \"{}\" at {}", feature.getName(), GeometryUtils.format(feature.getLocation()));
        }
        return feature;
    }

    public List<Feature> listFeatures(int lowLat, int lowLon, int hiLat, int hiLon) {
        log.info("*** ListFeatures: lowLat={} lowLon={} hiLat={} hiLon={}", lowLat, lowLon, hiLat, hiLon);
        Rectangle request = Rectangle.newBuilder()
                .setLo(Point.newBuilder().setLatitude(lowLat).setLongitude(lowLon).build())
                .setHi(Point.newBuilder().setLatitude(hiLat).setLongitude(hiLon).build())
                .build();
        final List<Feature> result = new ArrayList<>();
        final Iterator<Feature> features = blockingStub
                .withDeadlineAfter(deadlineSeconds, TimeUnit.SECONDS)
                .listFeatures(request);
        for (int i = 1; features.hasNext(); i++) {
            Feature feature = features.next();
            log.info("Result #{}: {}", i, feature.getName());
            result.add(feature);
        }
        return result;
    }

    /**
     * Send numPoints points picked at random from features and wait for the route summary.
     */
    public RouteSummary recordRoute(List<Feature> features, int numPoints) throws InterruptedException {
        log.info("*** RecordRoute");
        final StreamWaiter<RouteSummary> waiter = new StreamWaiter<>(TimeUnit.SECONDS.toMillis(deadlineSeconds));
        StreamObserver<Point> requestObserver = asyncStub
                .withDeadlineAfter(deadlineSeconds, TimeUnit.SECONDS)
                .recordRoute(waiter);
        try {
            for (int i = 0; i < numPoints; ++i) {
                Point point = features.get(random.nextInt(features.size())).getLocation();
                log.debug("Visiting point {}", GeometryUtils.format(point));
                requestObserver.onNext(point);
                if (pauseMillis > 0) {
                    Thread.sleep(pauseMillis);
                }
            }
        } catch (RuntimeException | InterruptedException e) {
            //Cancels the call so the server does not wait for the deadline
            requestObserver.onError(e);
            throw e;
        }
        requestObserver.onCompleted();

        final RouteSummary summary = waiter.getSingle();
        log.info("Finished trip with {} points. Passed {} features. Travelled {} meters. It took {} seconds.",
                summary.getPointCount(), summary.getFeatureCount(), summary.getDistance(), summary.getElapsedTime());
        return summary;
    }

    /**
     * Send notes to three locations, twice each, and return every note the server sent back.
     */
    public List<RouteNote> routeChat() {
        log.info("*** RouteChat");
        final StreamWaiter<RouteNote> waiter = new StreamWaiter<>(TimeUnit.SECONDS.toMillis(deadlineSeconds),
                note -> log.info("Got message \"{}\" at {}", note.getMessage(), GeometryUtils.format(note.getLocation())));
        StreamObserver<RouteNote> requestObserver = asyncStub
                .withDeadlineAfter(deadlineSeconds, TimeUnit.SECONDS)
                .routeChat(waiter);

        RouteNote[] requests = {
                newNote("First message", 0, 1),
                newNote("Second message", 0, 2),
                newNote("Third message", 0, 3),
                newNote("Fourth message", 0, 1),
                newNote("Fifth message", 0, 2),
                newNote("Sixth message", 0, 3)};
        try {
            for (RouteNote request : requests) {
                log.info("Sending message \"{}\" at {}", request.getMessage(), GeometryUtils.format(request.getLocation()));
                requestObserver.onNext(request);
            }
        } catch (RuntimeException e) {
            requestObserver.onError(e);
            throw e;
        }
        requestObserver.onCompleted();
        return waiter.getList();
    }

    public static RouteNote newNote(String message, int lat, int lon) {
        return RouteNote.newBuilder().setMessage(message)
                .setLocation(Point.newBuilder().setLatitude(lat).setLongitude(lon).build()).build();
    }
}
