package io.github.hide212131.rayskillkit.infra.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.trace.ReadableSpan;
import java.util.Map;
import java.util.function.Supplier;

/**
 * ルーティングや更新インストールなどのランタイム操作をスパンで包む。
 */
public final class SkillTracer {

    private final Tracer tracer;
    private final boolean enabled;

    public SkillTracer(Tracer tracer, boolean enabled) {
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static SkillTracer noop() {
        return new SkillTracer(OpenTelemetry.noop().getTracer("noop"), false);
    }

    /**
     * 操作をトレース付きで実行する。例外はスパンを失敗としてから再送出する。
     */
    public <T> T trace(String operationName, Map<String, Object> attributes, Supplier<T> operation) {
        if (!enabled) {
            return operation.get();
        }

        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (value instanceof String str) {
                    builder.setAttribute(key, str);
                } else if (value instanceof Long l) {
                    builder.setAttribute(key, l);
                } else if (value instanceof Integer i) {
                    builder.setAttribute(key, i.longValue());
                } else if (value instanceof Double d) {
                    builder.setAttribute(key, d);
                } else if (value instanceof Boolean b) {
                    builder.setAttribute(key, b);
                } else if (value != null) {
                    builder.setAttribute(key, value.toString());
                }
            });
        }
        Span span = builder.startSpan();

        try (Scope scope = span.makeCurrent()) {
            T result = operation.get();
            if (span.isRecording() && !failed(span)) {
                span.setStatus(StatusCode.OK);
            }
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Marks the current span as failed for operations that report errors as values instead of throwing.
     */
    public void recordFailure(String description, Throwable error) {
        if (!enabled) {
            return;
        }
        Span current = Span.current();
        if (current.isRecording()) {
            current.setStatus(StatusCode.ERROR, description);
            if (error != null) {
                current.recordException(error);
            }
        }
    }

    /**
     * Adds an event to the current span.
     */
    public void addEvent(String eventName, Map<String, String> attributes) {
        if (!enabled) {
            return;
        }
        Span current = Span.current();
        if (current.isRecording()) {
            if (attributes == null || attributes.isEmpty()) {
                current.addEvent(eventName);
            } else {
                AttributesBuilder builder = Attributes.builder();
                attributes.forEach(builder::put);
                current.addEvent(eventName, builder.build());
            }
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static boolean failed(Span span) {
        return span instanceof ReadableSpan readable
                && readable.toSpanData().getStatus().getStatusCode() == StatusCode.ERROR;
    }
}
