package io.routeguide.store;

import io.routeguide.proto.Point;
import io.routeguide.proto.RouteNote;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestNoteRegistry {

    private static Point point(int lat, int lon) {
        return Point.newBuilder().setLatitude(lat).setLongitude(lon).build();
    }

    private static RouteNote note(String message, Point location) {
        return RouteNote.newBuilder().setMessage(message).setLocation(location).build();
    }

    @Test
    public void testAppendReturnsHistoryAtLocation() {
        NoteRegistry registry = new NoteRegistry();
        Point here = point(0, 1);
        Point there = point(0, 2);
        RouteNote n1 = note("n1", here);
        RouteNote n2 = note("n2", here);
        RouteNote other = note("other", there);

        assertEquals(List.of(n1), registry.append(here, n1));
        assertEquals(List.of(other), registry.append(there, other));
        assertEquals(List.of(n1, n2), registry.append(here, n2));
        assertEquals(List.of(n1, n2), registry.notesAt(here));
        assertEquals(List.of(), registry.notesAt(point(5, 5)));
        assertEquals(2, registry.locationCount());
        assertEquals(3, registry.noteCount());
    }

    @Test
    public void testSnapshotIsIndependent() {
        NoteRegistry registry = new NoteRegistry();
        Point here = point(7, 7);
        List<RouteNote> first = registry.append(here, note("a", here));
        registry.append(here, note("b", here));
        assertEquals(1, first.size());
        assertThrows(UnsupportedOperationException.class, () -> first.add(note("c", here)));
        assertEquals(2, registry.notesAt(here).size());
    }

    @Test
    public void testKeyIsExactLocation() {
        NoteRegistry registry = new NoteRegistry();
        registry.append(point(1, 0), note("a", point(1, 0)));
        assertEquals(1, registry.append(point(0, 1), note("b", point(0, 1))).size());
        assertEquals(1, registry.append(point(1, 1), note("c", point(1, 1))).size());
    }

    @Test
    public void testLocationHashUsesBothAxes() {
        //Points on the diagonal and mirrored points must not all share one hash
        Set<Integer> hashes = new HashSet<>();
        hashes.add(new NoteRegistry.Location(point(1, 1)).hashCode());
        hashes.add(new NoteRegistry.Location(point(409146138, 409146138)).hashCode());
        hashes.add(new NoteRegistry.Location(point(-5, -5)).hashCode());
        hashes.add(new NoteRegistry.Location(point(3, 7)).hashCode());
        hashes.add(new NoteRegistry.Location(point(7, 3)).hashCode());
        assertEquals(5, hashes.size());
        assertEquals(new NoteRegistry.Location(point(3, 7)), new NoteRegistry.Location(point(3, 7)));
        assertNotEquals(new NoteRegistry.Location(point(3, 7)), new NoteRegistry.Location(point(7, 3)));
    }

    @Test
    public void testAppendProceedsWhileAnotherLocationIsBusy() throws Exception {
        final NoteRegistry registry = new NoteRegistry();
        final Point busy = point(1, 1);
        final Point other = point(409146138, 409146138);
        registry.append(busy, note("first", busy));
        registry.append(other, note("first", other));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            //Hold the lock for one location while a note is appended at another
            synchronized (registry.notesFor(busy)) {
                Future<List<RouteNote>> result = executor.submit(() -> registry.append(other, note("second", other)));
                assertEquals(2, result.get(5, TimeUnit.SECONDS).size());

                //An append at the busy location waits until the lock is released
                Future<List<RouteNote>> blocked = executor.submit(() -> registry.append(busy, note("second", busy)));
                Thread.sleep(100);
                assertFalse(blocked.isDone());
            }
            assertEquals(2, waitForSize(registry, busy, 2));
        } finally {
            executor.shutdown();
        }
    }

    private static int waitForSize(NoteRegistry registry, Point location, int size) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (registry.notesAt(location).size() < size && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        return registry.notesAt(location).size();
    }

    @Test
    public void testConcurrentAppendsToSameLocation() throws Exception {
        final NoteRegistry registry = new NoteRegistry();
        final Point here = point(409146138, -746188906);
        final int numThreads = 8;
        final int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        final CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Integer>>> futures = new ArrayList<>();
        for (int t = 0; t < numThreads; t++) {
            final int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                List<Integer> sizes = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    RouteNote n = note(thread + "-" + i, here);
                    List<RouteNote> snapshot = registry.append(here, n);
                    //The snapshot always ends with the note just appended
                    assertEquals(n, snapshot.get(snapshot.size() - 1));
                    sizes.add(snapshot.size());
                }
                return sizes;
            }));
        }
        start.countDown();
        Set<Integer> allSizes = new HashSet<>();
        for (Future<List<Integer>> future : futures) {
            for (Integer size : future.get(30, TimeUnit.SECONDS)) {
                //Every append saw a different history length so none was lost or merged
                assertTrue(allSizes.add(size), "duplicate snapshot size " + size);
            }
        }
        executor.shutdown();

        final int total = numThreads * perThread;
        assertEquals(total, allSizes.size());
        List<RouteNote> notes = registry.notesAt(here);
        assertEquals(total, notes.size());

        //Each thread's notes appear in the order that thread appended them
        for (int t = 0; t < numThreads; t++) {
            int expected = 0;
            for (RouteNote n : notes) {
                if (n.getMessage().startsWith(t + "-")) {
                    assertEquals(t + "-" + expected, n.getMessage());
                    expected++;
                }
            }
            assertEquals(perThread, expected);
        }
    }

    @Test
    public void testConcurrentAppendsToDistinctLocations() throws Exception {
        final NoteRegistry registry = new NoteRegistry();
        final int numThreads = 8;
        final int perThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < numThreads; t++) {
            final Point location = point(t, -t);
            futures.add(executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    //Other threads never touch this location so history grows by exactly one each time
                    assertEquals(i + 1, registry.append(location, note("m" + i, location)).size());
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();
        assertEquals(numThreads, registry.locationCount());
        assertEquals(numThreads * perThread, registry.noteCount());
    }
}
