package io.routeguide.service;

import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.routeguide.geo.GeometryUtils;
import io.routeguide.proto.Feature;
import io.routeguide.proto.Point;
import io.routeguide.proto.Rectangle;
import io.routeguide.proto.RouteGuideGrpc;
import io.routeguide.proto.RouteNote;
import io.routeguide.proto.RouteSummary;
import io.routeguide.store.FeatureStore;
import io.routeguide.store.NoteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

public class RouteGuideService extends RouteGuideGrpc.RouteGuideImplBase {

    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final FeatureStore featureStore;
    private final NoteRegistry noteRegistry;
    private final LongSupplier nanoClock;

    public RouteGuideService(FeatureStore featureStore) {
        this(featureStore, new NoteRegistry());
    }

    public RouteGuideService(FeatureStore featureStore, NoteRegistry noteRegistry) {
        this(featureStore, noteRegistry, System::nanoTime);
    }

    /**
     * @param nanoClock source of monotonic time in nanoseconds used to time recorded routes
     */
    RouteGuideService(FeatureStore featureStore, NoteRegistry noteRegistry, LongSupplier nanoClock) {
        this.featureStore = featureStore;
        this.noteRegistry = noteRegistry;
        this.nanoClock = nanoClock;
    }

    public NoteRegistry getNoteRegistry() {
        return noteRegistry;
    }

    /**
     * @param request a single point
     * @param singleResponse the feature at the point or an unnamed feature if there is none
     */
    @Override
    public void getFeature(Point request, StreamObserver<Feature> singleResponse) {
        final Feature feature = featureStore.findExact(request)
                .orElseGet(() -> Feature.newBuilder().setName("").setLocation(request).build());
        singleResponse.onNext(feature);
        singleResponse.onCompleted();
    }

    /**
     * @param request a rectangle with corners in either order
     * @param multipleResponses the features inside the rectangle in store order
     */
    @Override
    public void listFeatures(Rectangle request, StreamObserver<Feature> multipleResponses) {
        final ServerCallStreamObserver<Feature> serverObserver = (ServerCallStreamObserver<Feature>) multipleResponses;
        final Iterator<Feature> features = featureStore.findInRegion(request).iterator();
        int sent = 0;
        while (features.hasNext()) {
            if (serverObserver.isCancelled()) {
                log.debug("listFeatures cancelled after {} features", sent);
                return;
            }
            multipleResponses.onNext(features.next());
            sent++;
        }
        log.debug("listFeatures sent {} features", sent);
        multipleResponses.onCompleted();
    }

    /**
     * @param singleResponse receives one summary of the route when the client completes its stream
     * @return A stream on which the client sends the points of the route
     */
    @Override
    public StreamObserver<Point> recordRoute(StreamObserver<RouteSummary> singleResponse) {

        return new StreamObserver<>() {
            private final long startTime = nanoClock.getAsLong();
            private int pointCount;
            private int featureCount;
            private long distance;
            private Point previous;

            @Override
            public void onNext(Point point) {
                pointCount++;
                //A point visited twice counts its features twice
                featureCount += featureStore.countExact(point);
                if (previous != null) {
                    distance += GeometryUtils.distanceMeters(previous, point);
                }
                previous = point;
            }

            @Override
            public void onError(Throwable t) {
                log.warn("recordRoute aborted after {} points", pointCount, t);
            }

            @Override
            public void onCompleted() {
                long seconds = TimeUnit.NANOSECONDS.toSeconds(nanoClock.getAsLong() - startTime);
                final RouteSummary summary = RouteSummary.newBuilder()
                        .setPointCount(pointCount)
                        .setFeatureCount(featureCount)
                        .setDistance((int) Math.min(distance, Integer.MAX_VALUE))
                        .setElapsedTime((int) seconds)
                        .build();
                log.debug("recordRoute completed: {} points, {} features, {} m", pointCount, featureCount, distance);
                singleResponse.onNext(summary);
                singleResponse.onCompleted();
            }
        };
    }

    /**
     * @param multipleResponses receives, for every note sent, all notes at that note's location
     * @return A stream on which the client sends notes
     */
    @Override
    public StreamObserver<RouteNote> routeChat(StreamObserver<RouteNote> multipleResponses) {
        final ServerCallStreamObserver<RouteNote> serverObserver = (ServerCallStreamObserver<RouteNote>) multipleResponses;

        return new StreamObserver<>() {
            @Override
            public void onNext(RouteNote note) {
                if (serverObserver.isCancelled()) {
                    log.debug("routeChat cancelled. Ignoring note at {}", GeometryUtils.format(note.getLocation()));
                    return;
                }
                final List<RouteNote> notes = noteRegistry.append(note.getLocation(), note);
                for (RouteNote prior : notes) {
                    multipleResponses.onNext(prior);
                }
            }

            @Override
            public void onError(Throwable t) {
                log.warn("routeChat aborted", t);
            }

            @Override
            public void onCompleted() {
                multipleResponses.onCompleted();
            }
        };
    }
}
