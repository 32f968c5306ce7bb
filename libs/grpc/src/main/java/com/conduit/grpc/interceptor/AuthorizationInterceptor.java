package com.conduit.grpc.interceptor;

import com.conduit.security.CertificateIdentities;
import com.conduit.security.ServiceAuthPolicy;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.security.cert.Certificate;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.Set;

/**
 * Admits a call only if the client certificate of its connection names a client allowed to call
 * the target service.
 * <p>
 * Services without a policy, or with an empty one, accept nobody. Rejected calls are closed with
 * PERMISSION_DENIED before the handler runs.
 */
public class AuthorizationInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationInterceptor.class);

    private final ServiceAuthPolicy policy;

    public AuthorizationInterceptor(ServiceAuthPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        this.policy = policy;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        String service = MethodNames.split(call.getMethodDescriptor().getFullMethodName()).service();
        String denial = check(service, call.getAttributes().get(Grpc.TRANSPORT_ATTR_SSL_SESSION));
        if (denial != null) {
            log.warn("Denying call to {} from {}: {}",
                    call.getMethodDescriptor().getFullMethodName(),
                    call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR), denial);
            call.close(Status.PERMISSION_DENIED.withDescription(denial), new Metadata());
            return new ServerCall.Listener<>() {};
        }
        return next.startCall(call, headers);
    }

    /** Returns why the call must be denied, or null if it is allowed. */
    String check(String service, SSLSession session) {
        Set<String> allowed = policy.acceptedFor(service).orElse(Set.of());
        if (allowed.isEmpty()) {
            return "service \"%s\" has no allowed client names".formatted(service);
        }
        if (session == null) {
            return "grpc connection appears to be plaintext";
        }
        Certificate[] peer;
        try {
            peer = session.getPeerCertificates();
        } catch (SSLPeerUnverifiedException e) {
            return "connection auth not verified";
        }
        if (peer == null || peer.length == 0 || !(peer[0] instanceof X509Certificate leaf)) {
            return "connection auth not verified";
        }
        Set<String> names;
        try {
            names = CertificateIdentities.dnsNames(leaf);
        } catch (CertificateParsingException e) {
            return "client certificate names could not be parsed: " + e.getMessage();
        }
        for (String name : names) {
            if (allowed.contains(name)) {
                return null;
            }
        }
        return "client names %s are not authorized for service \"%s\" (%s)".formatted(names, service, allowed);
    }
}
