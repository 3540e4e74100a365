package io.routeguide.client;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Collects the responses of an async call so that the caller can wait for them.
 */
public class StreamWaiter<V> implements StreamObserver<V> {

    private static Logger log = LoggerFactory.getLogger(StreamWaiter.class);

    private final List<V> values = Collections.synchronizedList(new ArrayList<>());
    private volatile Status status = null;

    private boolean used = false;

    private final long timeoutMillis;

    private final Consumer<V> onValue;

    private final CountDownLatch latch = new CountDownLatch(1);


    /**
     * @param onValue called with each value as it arrives, before it is stored
     */
    public StreamWaiter(long timeoutMillis, Consumer<V> onValue) {
        this.timeoutMillis = timeoutMillis;
        this.onValue = onValue;
    }

    public StreamWaiter(long timeoutMillis) {
        this(timeoutMillis, value -> {});
    }


    @Override
    public void onNext(V value) {
        onValue.accept(value);
        this.values.add(value);
    }

    @Override
    public void onError(Throwable t) {
        log.debug("Stream failed", t);
        this.status = Status.fromThrowable(t).withCause(t);
        latch.countDown();
    }

    @Override
    public void onCompleted() {
        latch.countDown();
    }

    /**
     * @return The list of values returned in the stream
     * @throws StatusRuntimeException if onCompleted() is not received before the timeout or if there was an error
     * in the stream
     */
    public List<V> getList() throws StatusRuntimeException {
        if(used){
            throw new StatusRuntimeException(Status.INTERNAL.withDescription("getSingle() or getList() can only be used once"));
        }
        used = true;
        try {
            if(!latch.await(timeoutMillis, TimeUnit.MILLISECONDS)){
                throw new StatusRuntimeException(Status.DEADLINE_EXCEEDED.withDescription("Operation timed out"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StatusRuntimeException(Status.fromThrowable(e));
        }
        if(this.status != null){
            throw new StatusRuntimeException(status);
        }
        synchronized (values) {
            return new ArrayList<>(values);
        }
    }

    /**
     * @return The single value returned in the stream
     * @throws StatusRuntimeException if onCompleted() is not received before the timeout or if there was an error
     * in the stream or if there was not exactly one value in the stream.
     */
    public V getSingle() throws StatusRuntimeException{
        List<V> vals = getList();
        if(vals.size() == 1){
            return vals.get(0);
        }
        if(vals.isEmpty()){
            throw new StatusRuntimeException(Status.UNKNOWN.withDescription("No values received."));
        } else {
            throw new StatusRuntimeException(Status.UNKNOWN.withDescription("More than one value received"));
        }
    }
}
