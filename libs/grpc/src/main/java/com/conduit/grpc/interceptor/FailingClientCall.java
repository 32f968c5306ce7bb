package com.conduit.grpc.interceptor;

import io.grpc.ClientCall;
import io.grpc.Metadata;
import io.grpc.Status;

/**
 * A call that fails with a fixed status as soon as it is started, without touching the network.
 */
final class FailingClientCall<ReqT, RespT> extends ClientCall<ReqT, RespT> {

    private final Status status;

    FailingClientCall(Status status) {
        this.status = status;
    }

    @Override
    public void start(Listener<RespT> responseListener, Metadata headers) {
        responseListener.onClose(status, new Metadata());
    }

    @Override
    public void request(int numMessages) {
        // nothing will arrive
    }

    @Override
    public void cancel(String message, Throwable cause) {
        // already closed
    }

    @Override
    public void halfClose() {
        // already closed
    }

    @Override
    public void sendMessage(ReqT message) {
        // dropped, the call never started
    }
}
