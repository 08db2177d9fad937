package com.charthost.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Batch correlation for log lines.
 *
 * <p>A batch pipeline is tagged once with {@link #withBatchId}; per-item operators read the id
 * back from the signal's context and log through {@link #logInBatch}, which exposes the id as the
 * {@code batchId} MDC key for that one call only.
 */
public final class TraceContextUtil {

    public static final String BATCH_ID_KEY = "batchId";

    static final String NO_BATCH = "none";

    private TraceContextUtil() {}

    /** Short random id, enough to tell concurrent batches apart in a log stream. */
    public static String newBatchId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /** Tags the whole pipeline; {@code contextWrite} reaches upstream, so apply it last. */
    public static <T> Mono<T> withBatchId(Mono<T> pipeline, String batchId) {
        return pipeline.contextWrite(ctx -> ctx.put(BATCH_ID_KEY, batchId));
    }

    public static String batchId(ContextView ctx) {
        return ctx.getOrDefault(BATCH_ID_KEY, NO_BATCH);
    }

    public static void logInBatch(ContextView ctx, Consumer<String> logLine) {
        String id = batchId(ctx);
        MDC.put(BATCH_ID_KEY, id);
        try {
            logLine.accept(id);
        } finally {
            MDC.remove(BATCH_ID_KEY);
        }
    }
}
