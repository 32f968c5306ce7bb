package com.conduit.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpanHelper}.
 * <p>
 * Uses {@link InMemorySpanExporter} directly (rather than OpenTelemetryExtension)
 * for reliable span collection in nested JUnit 5 test classes.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otelSdk.getTracer(SpanHelper.INSTRUMENTATION_NAME));
    }

    @AfterEach
    void cleanup() {
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Nested
    @DisplayName("start/end")
    class StartEnd {

        @Test
        @DisplayName("should export a span with kind and attributes once ended")
        void shouldExportEndedSpan() {
            Span span = spanHelper.start("Chiller/Chill", SpanKind.SERVER, Context.root(),
                    Map.of("rpc.system", "grpc"));

            assertThat(spanExporter.getFinishedSpanItems()).isEmpty();
            spanHelper.end(span, true, null);

            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).getName()).isEqualTo("Chiller/Chill");
            assertThat(spans.get(0).getKind()).isEqualTo(SpanKind.SERVER);
            assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
            assertThat(spans.get(0).getAttributes().get(AttributeKey.stringKey("rpc.system")))
                    .isEqualTo("grpc");
        }

        @Test
        @DisplayName("should parent the span on the given context")
        void shouldUseParentContext() {
            Span parent = spanHelper.start("parent", SpanKind.INTERNAL, Context.root(), Map.of());
            Span child = spanHelper.start("child", SpanKind.CLIENT, Context.root().with(parent), Map.of());
            spanHelper.end(child, true, null);
            spanHelper.end(parent, true, null);

            SpanData childData = spanExporter.getFinishedSpanItems().get(0);
            assertThat(childData.getParentSpanId()).isEqualTo(parent.getSpanContext().getSpanId());
            assertThat(childData.getTraceId()).isEqualTo(parent.getSpanContext().getTraceId());
        }

        @Test
        @DisplayName("should mark failed work with an error status")
        void shouldMarkFailure() {
            Span span = spanHelper.start("op", SpanKind.CLIENT, Context.root(), Map.of());
            spanHelper.end(span, false, "DEADLINE_EXCEEDED");

            SpanData data = spanExporter.getFinishedSpanItems().get(0);
            assertThat(data.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(data.getStatus().getDescription()).isEqualTo("DEADLINE_EXCEEDED");
        }

        @Test
        @DisplayName("should record the exception when ended with one")
        void shouldRecordException() {
            Span span = spanHelper.start("op", SpanKind.SERVER, Context.root(), Map.of());
            spanHelper.end(span, new IllegalStateException("boom"));

            SpanData data = spanExporter.getFinishedSpanItems().get(0);
            assertThat(data.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(data.getStatus().getDescription()).contains("boom");
            assertThat(data.getEvents()).isNotEmpty();
        }
    }
}
