package com.lexguard.gateway.infrastructure.grpc;

import com.lexguard.security.TenantSecurityException;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps exceptions escaping a gRPC handler to status codes.
 *
 * <ul>
 *   <li>{@link TenantSecurityException}: authentication → {@code UNAUTHENTICATED}, authorization →
 *       {@code PERMISSION_DENIED}, conflict → {@code ABORTED}, programming error and security
 *       incident → {@code INTERNAL}. The description is the public message.
 *   <li>{@link IllegalArgumentException} → {@code INVALID_ARGUMENT}
 *   <li>{@link IllegalStateException} → {@code FAILED_PRECONDITION}
 *   <li>{@link StatusRuntimeException} keeps its status
 *   <li>anything else → {@code INTERNAL}
 * </ul>
 *
 * <p>Registered with the gRPC server builder, not as a Spring bean.
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall<ReqT, RespT> wrappedCall =
                new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        if (status.getCode() == Status.Code.UNKNOWN && status.getCause() != null) {
                            status = mapException(status.getCause());
                        }
                        super.close(status, trailers);
                    }
                };

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(
                next.startCall(wrappedCall, headers)) {};
    }

    /** Package-private for testing. */
    Status mapException(Throwable throwable) {
        if (throwable instanceof TenantSecurityException tse) {
            return mapTenantSecurity(tse);
        }
        if (throwable instanceof IllegalArgumentException) {
            log.warn("gRPC bad request: {}", throwable.getMessage());
            return Status.INVALID_ARGUMENT
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof IllegalStateException) {
            log.warn("gRPC failed precondition: {}", throwable.getMessage());
            return Status.FAILED_PRECONDITION
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }

    private Status mapTenantSecurity(TenantSecurityException ex) {
        Status status =
                switch (ex.category()) {
                    case AUTHENTICATION -> Status.UNAUTHENTICATED;
                    case AUTHORIZATION -> Status.PERMISSION_DENIED;
                    case CONFLICT -> Status.ABORTED;
                    case PROGRAMMING_ERROR, SECURITY_INCIDENT -> Status.INTERNAL;
                };
        if (status.getCode() == Status.Code.INTERNAL) {
            log.error("gRPC tenant isolation failure ({}): {}", ex.category(), ex.getMessage());
        } else {
            log.warn("gRPC {}: {}", status.getCode(), ex.getMessage());
        }
        return status.withDescription(ex.publicMessage()).withCause(ex);
    }
}
