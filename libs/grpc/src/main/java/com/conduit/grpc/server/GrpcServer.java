package com.conduit.grpc.server;

import io.grpc.Server;
import io.grpc.protobuf.services.HealthStatusManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A bound gRPC server returned by {@link GrpcServerBuilder#build()}.
 * <p>
 * {@link #start()} blocks while the server serves; {@link #stop()} reports NOT_SERVING through
 * the health service, drains in-flight calls and makes {@code start()} return.
 */
public final class GrpcServer {

    private static final Logger log = LoggerFactory.getLogger(GrpcServer.class);

    static final Duration STOP_GRACE = Duration.ofSeconds(30);

    private final Server server;
    private final HealthStatusManager health;
    private final ExecutorService deadlineScheduler;
    private final int port;
    private final AtomicBoolean stopped = new AtomicBoolean();

    GrpcServer(Server server, HealthStatusManager health, ExecutorService deadlineScheduler) {
        this.server = server;
        this.health = health;
        this.deadlineScheduler = deadlineScheduler;
        this.port = server.getPort();
    }

    /**
     * Serves until {@link #stop()} is called, then returns normally.
     *
     * @throws InterruptedException if the calling thread is interrupted while serving
     */
    public void start() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Stops accepting calls, waits for running calls to finish and releases the server's threads.
     * Calls still running after {@link #STOP_GRACE} are cancelled. Later calls do nothing.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping gRPC server on port {}", port);
        health.enterTerminalState();
        server.shutdown();
        try {
            if (!server.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("gRPC server did not drain within {}, cancelling remaining calls", STOP_GRACE);
                server.shutdownNow();
            }
        } catch (InterruptedException e) {
            server.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            deadlineScheduler.shutdownNow();
        }
        log.info("gRPC server stopped");
    }

    /** The bound port, useful when the configured port was 0. */
    public int port() {
        return port;
    }

    public boolean isTerminated() {
        return server.isTerminated();
    }
}
