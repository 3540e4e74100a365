package io.routeguide.server;

import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts the calls that have started but not yet completed or been cancelled.
 */
@Slf4j
public class CallStatsInterceptor implements ServerInterceptor {

    private final AtomicInteger activeCalls = new AtomicInteger();

    public int getActiveCalls() {
        return activeCalls.get();
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> serverCall,
                                                                 Metadata metadata, ServerCallHandler<ReqT, RespT> next) {
        final String method = serverCall.getMethodDescriptor().getFullMethodName();
        activeCalls.incrementAndGet();
        log.debug("Call started: {}", method);
        final AtomicBoolean ended = new AtomicBoolean(false);
        final ServerCall.Listener<ReqT> delegate;
        try {
            delegate = next.startCall(serverCall, metadata);
        } catch (RuntimeException e) {
            activeCalls.decrementAndGet();
            throw e;
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onComplete() {
                end("completed");
                super.onComplete();
            }

            @Override
            public void onCancel() {
                end("cancelled");
                super.onCancel();
            }

            private void end(String how) {
                if (ended.compareAndSet(false, true)) {
                    activeCalls.decrementAndGet();
                    log.debug("Call {}: {}", how, method);
                }
            }
        };
    }
}
