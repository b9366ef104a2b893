package com.lexguard.gateway.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.lexguard.observability.RequestCorrelationHolder;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GrpcCorrelationInterceptor")
class GrpcCorrelationInterceptorTest {

    private final GrpcCorrelationInterceptor interceptor = new GrpcCorrelationInterceptor();

    @AfterEach
    void cleanup() {
        RequestCorrelationHolder.clear();
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("binds the metadata correlation ID while the handler runs and clears it afterwards")
    void bindsAroundCallbacks() {
        var metadata = new Metadata();
        metadata.put(GrpcCorrelationInterceptor.CORRELATION_ID_KEY, "grpc-test-123");
        var seenAtHalfClose = new AtomicReference<String>();

        ServerCall<String, String> call = mock(ServerCall.class);
        ServerCallHandler<String, String> handler = mock(ServerCallHandler.class);
        when(handler.startCall(any(), any())).thenReturn(new ServerCall.Listener<>() {
            @Override
            public void onHalfClose() {
                seenAtHalfClose.set(RequestCorrelationHolder.currentCorrelationId());
            }
        });

        ServerCall.Listener<String> listener = interceptor.interceptCall(call, metadata, handler);
        assertThat(RequestCorrelationHolder.get()).isEmpty();

        listener.onHalfClose();

        assertThat(seenAtHalfClose.get()).isEqualTo("grpc-test-123");
        assertThat(RequestCorrelationHolder.get()).isEmpty();
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("generates a correlation ID when absent from metadata")
    void generatesCorrelationIdWhenAbsent() {
        var seenAtStart = new AtomicReference<String>();
        ServerCall<String, String> call = mock(ServerCall.class);
        ServerCallHandler<String, String> handler = mock(ServerCallHandler.class);
        when(handler.startCall(any(), any())).thenAnswer(invocation -> {
            seenAtStart.set(RequestCorrelationHolder.currentCorrelationId());
            return new ServerCall.Listener<String>() {};
        });

        interceptor.interceptCall(call, new Metadata(), handler);

        assertThat(seenAtStart.get()).isNotBlank();
    }
}
