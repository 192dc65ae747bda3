package com.loopfuzz.fuzzer.instrumentation;

import com.loopfuzz.fuzzer.coverage.CoverageBitmap;
import com.loopfuzz.fuzzer.coverage.CoverageReader;
import com.loopfuzz.fuzzer.exec.TargetInfo;
import com.loopfuzz.proto.CoverageProto.CoverageEvent;
import com.loopfuzz.proto.CoverageProto.SubscribeRequest;
import com.loopfuzz.proto.CoverageServiceGrpc;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import io.grpc.netty.shaded.io.netty.channel.EventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.Epoll;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollDomainSocketChannel;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollEventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.unix.DomainSocketAddress;
import io.grpc.stub.StreamObserver;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coverage reader for targets instrumented by a coverage agent. The agent streams one {@link
 * CoverageEvent} per finished request over gRPC; events are matched to runs by request id.
 *
 * <p>{@link #clear(TargetInfo)} registers the run before the request is sent, {@link
 * #read(TargetInfo)} waits for its event. A run whose event does not arrive within the coverage
 * timeout reads as empty coverage.</p>
 */
public final class GrpcCoverageReader implements CoverageReader, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GrpcCoverageReader.class);
    private static final long RESUBSCRIBE_DELAY_MILLIS = 200;

    private final ManagedChannel channel;
    private final CoverageServiceGrpc.CoverageServiceStub stub;
    private final Duration coverageTimeout;
    private final EventLoopGroup eventLoopGroup;
    private final Map<String, CompletableFuture<CoverageBitmap>> pending = new ConcurrentHashMap<>();

    private volatile boolean shutdown;

    private GrpcCoverageReader(
            ManagedChannel channel, Duration coverageTimeout, EventLoopGroup eventLoopGroup) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.stub = CoverageServiceGrpc.newStub(channel);
        this.coverageTimeout = Objects.requireNonNull(coverageTimeout, "coverageTimeout");
        this.eventLoopGroup = eventLoopGroup;
        startSubscription();
    }

    /** Connects to an agent listening on a Unix domain socket. Requires epoll. */
    public static GrpcCoverageReader forUnixDomainSocket(String socketPath, Duration coverageTimeout)
            throws IOException {
        if (!Epoll.isAvailable()) {
            throw new IOException(
                    "epoll is required for Unix domain sockets", Epoll.unavailabilityCause());
        }
        EventLoopGroup group = new EpollEventLoopGroup();
        ManagedChannel channel =
                NettyChannelBuilder.forAddress(new DomainSocketAddress(socketPath))
                        .eventLoopGroup(group)
                        .channelType(EpollDomainSocketChannel.class)
                        .usePlaintext()
                        .build();
        return new GrpcCoverageReader(channel, coverageTimeout, group);
    }

    public static GrpcCoverageReader forAddress(String host, int port, Duration coverageTimeout) {
        ManagedChannel channel = NettyChannelBuilder.forAddress(host, port).usePlaintext().build();
        return new GrpcCoverageReader(channel, coverageTimeout, null);
    }

    /** Uses a channel owned by the caller's setup; it is shut down by {@link #close()}. */
    public static GrpcCoverageReader forChannel(ManagedChannel channel, Duration coverageTimeout) {
        return new GrpcCoverageReader(channel, coverageTimeout, null);
    }

    @Override
    public void clear(TargetInfo targetInfo) {
        if (shutdown) {
            throw new IllegalStateException("Coverage reader has been closed");
        }
        CompletableFuture<CoverageBitmap> stale =
                pending.put(targetInfo.runId(), new CompletableFuture<>());
        if (stale != null) {
            stale.complete(CoverageBitmap.empty());
        }
    }

    @Override
    public CoverageBitmap read(TargetInfo targetInfo) {
        String runId = targetInfo.runId();
        CompletableFuture<CoverageBitmap> future = pending.get(runId);
        if (future == null) {
            throw new IllegalStateException("Run " + runId + " was not cleared before reading");
        }
        try {
            return future.get(coverageTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("No coverage for run {} within {}", runId, coverageTimeout);
            return CoverageBitmap.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled =
                    new CancellationException("Interrupted while waiting for coverage of " + runId);
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Coverage stream failed for run " + runId, e.getCause());
        } finally {
            pending.remove(runId, future);
        }
    }

    /** Number of runs waiting for their coverage event. */
    int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        shutdown = true;
        for (CompletableFuture<CoverageBitmap> future : pending.values()) {
            future.complete(CoverageBitmap.empty());
        }
        pending.clear();
        channel.shutdownNow();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
        }
    }

    private void startSubscription() {
        StreamObserver<CoverageEvent> observer =
                new StreamObserver<>() {
                    @Override
                    public void onNext(CoverageEvent value) {
                        String requestId = value.getRequestId();
                        if (requestId.isBlank()) {
                            return;
                        }
                        CompletableFuture<CoverageBitmap> future = pending.get(requestId);
                        if (future != null) {
                            future.complete(
                                    CoverageBitmap.fromBytes(value.getTraceBitmap().toByteArray()));
                        }
                    }

                    @Override
                    public void onError(Throwable t) {
                        if (shutdown) {
                            return;
                        }
                        log.warn("Coverage stream failed, resubscribing: {}", t.getMessage());
                        for (CompletableFuture<CoverageBitmap> future : pending.values()) {
                            future.completeExceptionally(t);
                        }
                        restartSubscription();
                    }

                    @Override
                    public void onCompleted() {
                        if (!shutdown) {
                            restartSubscription();
                        }
                    }
                };
        try {
            stub.withWaitForReady().subscribe(SubscribeRequest.getDefaultInstance(), observer);
        } catch (StatusRuntimeException e) {
            if (!shutdown) {
                restartSubscription();
            }
        }
    }

    private void restartSubscription() {
        try {
            TimeUnit.MILLISECONDS.sleep(RESUBSCRIBE_DELAY_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (!shutdown) {
            startSubscription();
        }
    }
}
