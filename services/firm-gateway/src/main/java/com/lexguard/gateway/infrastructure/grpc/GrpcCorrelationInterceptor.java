package com.lexguard.gateway.infrastructure.grpc;

import com.lexguard.observability.RequestCorrelation;
import com.lexguard.observability.RequestCorrelationHolder;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.UUID;

/**
 * gRPC counterpart of {@link com.lexguard.gateway.infrastructure.web.CorrelationIdFilter}.
 *
 * <p>Listener callbacks may run on different executor threads, so the correlation is bound around
 * each callback rather than once per call.
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> CORRELATION_ID_KEY =
            Metadata.Key.of("x-correlation-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String header = headers.get(CORRELATION_ID_KEY);
        String correlationId = header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
        RequestCorrelation correlation = RequestCorrelation.of(correlationId);

        ServerCall.Listener<ReqT> delegate =
                RequestCorrelationHolder.callWithCorrelation(correlation, () -> next.startCall(call, headers));

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                RequestCorrelationHolder.callWithCorrelation(correlation, () -> {
                    super.onMessage(message);
                    return null;
                });
            }

            @Override
            public void onHalfClose() {
                RequestCorrelationHolder.callWithCorrelation(correlation, () -> {
                    super.onHalfClose();
                    return null;
                });
            }

            @Override
            public void onCancel() {
                RequestCorrelationHolder.callWithCorrelation(correlation, () -> {
                    super.onCancel();
                    return null;
                });
            }

            @Override
            public void onComplete() {
                RequestCorrelationHolder.callWithCorrelation(correlation, () -> {
                    super.onComplete();
                    return null;
                });
            }
        };
    }
}
