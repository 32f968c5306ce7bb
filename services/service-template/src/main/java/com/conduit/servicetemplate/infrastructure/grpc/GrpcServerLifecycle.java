package com.conduit.servicetemplate.infrastructure.grpc;

import com.conduit.grpc.server.GrpcServer;
import com.conduit.grpc.server.GrpcServerBuilder;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the gRPC server for the lifetime of the application context.
 *
 * <p>The server is built and bound in {@link #start()}, then served on a non-daemon thread that
 * keeps the JVM alive. {@link #stop()} drains in-flight calls before returning.
 */
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

    private final GrpcServerBuilder builder;
    private volatile GrpcServer server;

    public GrpcServerLifecycle(GrpcServerBuilder builder) {
        this.builder = builder;
    }

    @Override
    public void start() {
        GrpcServer built;
        try {
            built = builder.build();
        } catch (IOException e) {
            throw new IllegalStateException("gRPC server failed to start", e);
        }
        server = built;
        Thread serving = new Thread(() -> {
            try {
                built.start();
            } catch (InterruptedException e) {
                log.warn("gRPC serving thread interrupted");
                Thread.currentThread().interrupt();
            }
        }, "grpc-server");
        serving.setDaemon(false);
        serving.start();
    }

    @Override
    public void stop() {
        GrpcServer running = server;
        server = null;
        if (running != null) {
            running.stop();
        }
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    /**
     * The bound port.
     *
     * @throws IllegalStateException if the server is not running
     */
    public int port() {
        GrpcServer running = server;
        if (running == null) {
            throw new IllegalStateException("gRPC server is not running");
        }
        return running.port();
    }
}
