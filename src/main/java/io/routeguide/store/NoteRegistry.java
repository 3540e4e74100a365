package io.routeguide.store;

import io.routeguide.geo.GeometryUtils;
import io.routeguide.proto.Point;
import io.routeguide.proto.RouteNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Notes left by clients, grouped by the exact location they were left at.
 * <p>
 * Each location has its own {@link Notes} holder. Appends lock only that holder, so appends at other
 * locations never wait on them. The holder's list is immutable and replaced on every append (copy on write).
 * The list returned from {@link #append} is the one that was stored, so the caller can send it without
 * holding any lock and later appends will never change it.
 */
public class NoteRegistry {

    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ConcurrentHashMap<Location, Notes> notesByLocation = new ConcurrentHashMap<>();

    /**
     * Add the note to the location and return every note at that location in the order they were added,
     * ending with this one.
     */
    public List<RouteNote> append(Point location, RouteNote note) {
        final List<RouteNote> notes = notesFor(location).append(note);
        log.debug("Note appended at {}. {} notes at location", GeometryUtils.format(location), notes.size());
        return notes;
    }

    /**
     * @return The notes at location when this was called. Empty if there are none.
     */
    public List<RouteNote> notesAt(Point location) {
        final Notes notes = notesByLocation.get(new Location(location));
        return notes == null ? List.of() : notes.list;
    }

    public int locationCount() {
        return notesByLocation.size();
    }

    public int noteCount() {
        int count = 0;
        for (Notes notes : notesByLocation.values()) {
            count += notes.list.size();
        }
        return count;
    }

    /**
     * The holder for a location, created on first use. Its monitor guards appends at that location.
     */
    Notes notesFor(Point point) {
        final Location location = new Location(point);
        //get() does not lock so only the first note at a location goes through computeIfAbsent
        final Notes notes = notesByLocation.get(location);
        return notes != null ? notes : notesByLocation.computeIfAbsent(location, key -> new Notes());
    }

    static final class Notes {

        private volatile List<RouteNote> list = List.of();

        synchronized List<RouteNote> append(RouteNote note) {
            final List<RouteNote> updated = new ArrayList<>(list.size() + 1);
            updated.addAll(list);
            updated.add(note);
            list = Collections.unmodifiableList(updated);
            return list;
        }
    }

    /**
     * Exact coordinates of a point. Unlike {@link Point} it ignores unknown protobuf fields.
     */
    static final class Location {
        private final int latitude;
        private final int longitude;

        Location(Point point) {
            this.latitude = point.getLatitude();
            this.longitude = point.getLongitude();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Location)) {
                return false;
            }
            Location other = (Location) o;
            return latitude == other.latitude && longitude == other.longitude;
        }

        @Override
        public int hashCode() {
            return 31 * latitude + longitude;
        }
    }
}
