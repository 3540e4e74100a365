package io.routeguide.store;

import io.routeguide.geo.GeometryUtils;
import io.routeguide.proto.Feature;
import io.routeguide.proto.Point;
import io.routeguide.proto.Rectangle;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The features known to the service in the order they were loaded.
 * The store cannot be modified after construction so it may be read from any number of threads.
 */
public class FeatureStore {

    private final List<Feature> features;

    public FeatureStore(Collection<Feature> features) {
        this.features = List.copyOf(features);
    }

    public List<Feature> getFeatures() {
        return features;
    }

    public int size() {
        return features.size();
    }

    /**
     * @return The first feature located exactly at point
     */
    public Optional<Feature> findExact(Point point) {
        for (Feature feature : features) {
            if (GeometryUtils.samePoint(feature.getLocation(), point)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The number of features located exactly at point
     */
    public int countExact(Point point) {
        int count = 0;
        for (Feature feature : features) {
            if (GeometryUtils.samePoint(feature.getLocation(), point)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Each call returns a new stream that scans the store from the start.
     * @return The features inside rect (boundary included) in load order
     */
    public Stream<Feature> findInRegion(Rectangle rect) {
        return features.stream().filter(feature -> GeometryUtils.containsPoint(rect, feature.getLocation()));
    }
}
