package com.conduit.grpc.codec;

import static org.assertj.core.api.Assertions.assertThat;

import com.conduit.errormodel.ConduitException;
import com.conduit.errormodel.ErrorEnvelope;
import com.conduit.errormodel.ErrorType;
import com.conduit.errormodel.Identifier;
import com.conduit.errormodel.SubError;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorCodec")
class ErrorCodecTest {

    /** What the client sees: the status the server closed with, plus its trailers. */
    private static Throwable roundTrip(Throwable err) {
        Metadata trailers = new Metadata();
        Status status = ErrorCodec.wrapError(err, trailers);
        return ErrorCodec.unwrapError(status.asRuntimeException(trailers), trailers);
    }

    private static StatusRuntimeException failure(Metadata trailers) {
        return Status.UNKNOWN.withDescription("boom").asRuntimeException(trailers);
    }

    @Nested
    @DisplayName("wrapError()")
    class Wrap {

        @Test
        @DisplayName("returns null for no error")
        void nullInNullOut() {
            assertThat(ErrorCodec.wrapError(null, new Metadata())).isNull();
        }

        @Test
        @DisplayName("puts only the error type for a plain domain error")
        void plainDomainError() {
            Metadata trailers = new Metadata();

            Status status = ErrorCodec.wrapError(ConduitException.notFound("no such order"), trailers);

            assertThat(status.getCode()).isEqualTo(Status.Code.UNKNOWN);
            assertThat(status.getDescription()).isEqualTo("no such order");
            assertThat(trailers.get(ErrorCodec.ERROR_TYPE_KEY)).isEqualTo("4");
            assertThat(trailers.containsKey(ErrorCodec.SUB_ERRORS_KEY)).isFalse();
            assertThat(trailers.containsKey(ErrorCodec.RETRY_AFTER_KEY)).isFalse();
        }

        @Test
        @DisplayName("adds the retry hint when set")
        void retryHint() {
            Metadata trailers = new Metadata();

            ErrorCodec.wrapError(ConduitException.rateLimit(Duration.ofMillis(1500), "slow down"), trailers);

            assertThat(trailers.get(ErrorCodec.ERROR_TYPE_KEY)).isEqualTo("5");
            assertThat(trailers.get(ErrorCodec.RETRY_AFTER_KEY)).isEqualTo("1.5s");
        }

        @Test
        @DisplayName("passes opaque errors as UNKNOWN with their message only")
        void opaqueError() {
            Metadata trailers = new Metadata();

            Status status = ErrorCodec.wrapError(new IllegalStateException("disk on fire"), trailers);

            assertThat(status.getCode()).isEqualTo(Status.Code.UNKNOWN);
            assertThat(status.getDescription()).isEqualTo("disk on fire");
            assertThat(trailers.keys()).isEmpty();
        }
    }

    @Nested
    @DisplayName("unwrapError()")
    class Unwrap {

        @Test
        @DisplayName("returns null for no error")
        void nullInNullOut() {
            assertThat(ErrorCodec.unwrapError(null, new Metadata())).isNull();
        }

        @Test
        @DisplayName("leaves errors without an error type alone")
        void noErrorType() {
            StatusRuntimeException err = failure(new Metadata());

            assertThat(ErrorCodec.unwrapError(err, new Metadata())).isSameAs(err);
            assertThat(ErrorCodec.unwrapError(err, null)).isSameAs(err);
        }

        @Test
        @DisplayName("rebuilds an equal domain error with sub-errors and retry hint")
        void roundTripsEverything() {
            var sub = new SubError(Identifier.dns("a.example"),
                    new ErrorEnvelope(ErrorType.RATE_LIMIT, "too many", List.of(), Duration.ofSeconds(3)));
            ConduitException sent = ConduitException.rejectedIdentifier("2 identifiers rejected")
                    .withSubErrors(List.of(sub))
                    .withRetryAfter(Duration.ofMinutes(1));

            Throwable received = roundTrip(sent);

            assertThat(received).isInstanceOfSatisfying(ConduitException.class,
                    ce -> assertThat(ce.envelope()).isEqualTo(sent.envelope()));
        }

        @Test
        @DisplayName("keeps opaque errors opaque")
        void opaqueStaysOpaque() {
            Throwable received = roundTrip(new RuntimeException("opaque"));

            assertThat(received).isInstanceOf(StatusRuntimeException.class);
            assertThat(Status.fromThrowable(received).getDescription()).isEqualTo("opaque");
        }

        @Test
        @DisplayName("rejects more than one error type")
        void multipleErrorTypes() {
            Metadata trailers = new Metadata();
            trailers.put(ErrorCodec.ERROR_TYPE_KEY, "2");
            trailers.put(ErrorCodec.ERROR_TYPE_KEY, "4");

            assertInternal(ErrorCodec.unwrapError(failure(trailers), trailers), "multiple errortype");
        }

        @Test
        @DisplayName("rejects a non-integer error type")
        void nonIntegerErrorType() {
            Metadata trailers = new Metadata();
            trailers.put(ErrorCodec.ERROR_TYPE_KEY, "malformed");

            assertInternal(ErrorCodec.unwrapError(failure(trailers), trailers), "to int");
        }

        @Test
        @DisplayName("rejects an unknown error type")
        void unknownErrorType() {
            Metadata trailers = new Metadata();
            trailers.put(ErrorCodec.ERROR_TYPE_KEY, "9");

            assertInternal(ErrorCodec.unwrapError(failure(trailers), trailers), "unknown errortype 9");
        }

        @Test
        @DisplayName("rejects unparseable sub-errors")
        void badSubErrors() {
            Metadata trailers = new Metadata();
            trailers.put(ErrorCodec.ERROR_TYPE_KEY, "2");
            trailers.put(ErrorCodec.SUB_ERRORS_KEY, "[{oops");

            assertInternal(ErrorCodec.unwrapError(failure(trailers), trailers), "suberrors");
        }

        @Test
        @DisplayName("rejects an unparseable retry hint")
        void badRetryAfter() {
            Metadata trailers = new Metadata();
            trailers.put(ErrorCodec.ERROR_TYPE_KEY, "5");
            trailers.put(ErrorCodec.RETRY_AFTER_KEY, "soon");

            assertInternal(ErrorCodec.unwrapError(failure(trailers), trailers), "retryafter");
        }

        @Test
        @DisplayName("rejects more than one retry hint")
        void multipleRetryAfter() {
            Metadata trailers = new Metadata();
            trailers.put(ErrorCodec.ERROR_TYPE_KEY, "5");
            trailers.put(ErrorCodec.RETRY_AFTER_KEY, "1s");
            trailers.put(ErrorCodec.RETRY_AFTER_KEY, "2s");

            assertInternal(ErrorCodec.unwrapError(failure(trailers), trailers), "multiple retryafter");
        }

        private void assertInternal(Throwable t, String messagePart) {
            assertThat(t).isInstanceOfSatisfying(ConduitException.class, ce -> {
                assertThat(ce.type()).isEqualTo(ErrorType.INTERNAL_SERVER);
                assertThat(ce.detail()).contains(messagePart);
            });
        }
    }

    @Nested
    @DisplayName("domainError()")
    class DomainError {

        @Test
        @DisplayName("finds a domain error already decoded into the cause chain")
        void findsDecoded() {
            ConduitException ce = ConduitException.duplicate("again");
            StatusRuntimeException err = Status.UNKNOWN.withCause(ce).asRuntimeException();

            assertThat(ErrorCodec.domainError(err)).containsSame(ce);
        }

        @Test
        @DisplayName("decodes a domain error from the status trailers")
        void decodesTrailers() {
            Metadata trailers = new Metadata();
            Status status = ErrorCodec.wrapError(ConduitException.malformed("bad CSR"), trailers);

            assertThat(ErrorCodec.domainError(status.asRuntimeException(trailers)))
                    .hasValueSatisfying(ce -> {
                        assertThat(ce.type()).isEqualTo(ErrorType.MALFORMED);
                        assertThat(ce.detail()).isEqualTo("bad CSR");
                    });
        }

        @Test
        @DisplayName("is empty for opaque failures")
        void emptyForOpaque() {
            assertThat(ErrorCodec.domainError(Status.UNAVAILABLE.asRuntimeException())).isEmpty();
        }
    }
}
