package com.lexguard.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("RequestCorrelationHolder")
class RequestCorrelationHolderTest {

    @AfterEach
    void cleanup() {
        RequestCorrelationHolder.clear();
    }

    @Nested
    @DisplayName("set / get / clear")
    class Lifecycle {

        @Test
        @DisplayName("populates MDC with every non-null field")
        void populatesMdc() {
            RequestCorrelationHolder.set(new RequestCorrelation("corr-1", "req-1", "user-1", "firm:F1"));

            assertThat(MDC.get(RequestCorrelation.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(RequestCorrelation.MDC_REQUEST_ID)).isEqualTo("req-1");
            assertThat(MDC.get(RequestCorrelation.MDC_USER_ID)).isEqualTo("user-1");
            assertThat(MDC.get(RequestCorrelation.MDC_SCOPE)).isEqualTo("firm:F1");
        }

        @Test
        @DisplayName("null fields are removed from MDC")
        void nullFieldsRemoved() {
            RequestCorrelationHolder.set(new RequestCorrelation("corr-1", "req-1", "user-1", "firm:F1"));
            RequestCorrelationHolder.set(RequestCorrelation.of("corr-2"));

            assertThat(MDC.get(RequestCorrelation.MDC_CORRELATION_ID)).isEqualTo("corr-2");
            assertThat(MDC.get(RequestCorrelation.MDC_USER_ID)).isNull();
            assertThat(MDC.get(RequestCorrelation.MDC_SCOPE)).isNull();
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clearRemovesEverything() {
            RequestCorrelationHolder.set(new RequestCorrelation("corr-1", null, "user-1", null));
            RequestCorrelationHolder.clear();

            assertThat(RequestCorrelationHolder.get()).isEmpty();
            assertThat(RequestCorrelationHolder.currentCorrelationId()).isNull();
            assertThat(MDC.get(RequestCorrelation.MDC_CORRELATION_ID)).isNull();
        }

        @Test
        @DisplayName("rejects null correlation")
        void rejectsNull() {
            assertThatThrownBy(() -> RequestCorrelationHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects blank correlation id")
        void rejectsBlankId() {
            assertThatThrownBy(() -> RequestCorrelation.of(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("bindActor()")
    class BindActor {

        @Test
        @DisplayName("enriches the bound correlation with user and scope")
        void enrichesBoundCorrelation() {
            RequestCorrelationHolder.set(RequestCorrelation.of("corr-9"));

            RequestCorrelationHolder.bindActor("user-9", "lawyer:user-9");

            assertThat(RequestCorrelationHolder.get()).hasValueSatisfying(c -> {
                assertThat(c.correlationId()).isEqualTo("corr-9");
                assertThat(c.userId()).isEqualTo("user-9");
                assertThat(c.scope()).isEqualTo("lawyer:user-9");
            });
            assertThat(MDC.get(RequestCorrelation.MDC_SCOPE)).isEqualTo("lawyer:user-9");
        }

        @Test
        @DisplayName("is a no-op when nothing is bound")
        void noOpWhenUnbound() {
            RequestCorrelationHolder.bindActor("user-9", "firm:F1");

            assertThat(RequestCorrelationHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("callWithCorrelation()")
    class CallWithCorrelation {

        @Test
        @DisplayName("restores the previous correlation afterwards")
        void restoresPrevious() {
            RequestCorrelationHolder.set(RequestCorrelation.of("outer"));

            String seen = RequestCorrelationHolder.callWithCorrelation(
                    RequestCorrelation.of("inner"), RequestCorrelationHolder::currentCorrelationId);

            assertThat(seen).isEqualTo("inner");
            assertThat(RequestCorrelationHolder.currentCorrelationId()).isEqualTo("outer");
        }

        @Test
        @DisplayName("clears when nothing was bound before, even on failure")
        void clearsOnFailure() {
            assertThatThrownBy(() -> RequestCorrelationHolder.callWithCorrelation(
                    RequestCorrelation.of("inner"), () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(RequestCorrelationHolder.get()).isEmpty();
        }
    }
}
