package ai.attackframework.tools.bulkloader.utils.opensearch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.ErrorCause;
import org.opensearch.client.opensearch.core.BulkRequest;
import org.opensearch.client.opensearch.core.BulkResponse;
import org.opensearch.client.opensearch.core.bulk.BulkResponseItem;

import ai.attackframework.tools.bulkloader.dataset.Document;
import ai.attackframework.tools.bulkloader.utils.Logger;

/**
 * Sends documents as concurrent {@code _bulk} requests.
 *
 * <p>Documents are pulled from the source iterator in chunks of {@code chunkSize}; each chunk
 * becomes one bulk request run on a per-call pool of {@code threadCount} workers. A chunk is
 * only pulled once one of {@code threadCount + queueSize} slots is free, so at most that many
 * chunks are in memory at once and a lazy source is never materialized. A failing item or
 * request is logged and counted; it does not cancel other chunks. {@link #index(Iterator)}
 * returns once every submitted chunk has finished, even when the calling thread is
 * interrupted; the interrupt stops further submissions and is restored on return.</p>
 */
public final class ParallelBulkIndexer {

    static final int STATUS_CREATED = 201;

    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final OpenSearchClient client;
    private final String baseUrl;
    private final int threadCount;
    private final int chunkSize;
    private final int queueSize;

    public ParallelBulkIndexer(OpenSearchClient client, String baseUrl, int threadCount, int chunkSize, int queueSize) {
        this.client = Objects.requireNonNull(client, "client");
        this.baseUrl = baseUrl;
        if (threadCount <= 0 || chunkSize <= 0 || queueSize < 0) {
            throw new IllegalArgumentException("threadCount and chunkSize must be positive, queueSize non-negative");
        }
        this.threadCount = threadCount;
        this.chunkSize = chunkSize;
        this.queueSize = queueSize;
    }

    /**
     * Indexes every document from {@code documents}, blocking until all chunks are acknowledged or failed.
     *
     * <p>Exceptions thrown by the source iterator itself propagate after already-submitted chunks finish.</p>
     */
    public BulkInsertSummary index(Iterator<Document> documents) {
        Objects.requireNonNull(documents, "documents");
        ExecutorService pool = Executors.newFixedThreadPool(threadCount, threadFactory());
        Semaphore inFlight = new Semaphore(threadCount + queueSize);
        List<Future<?>> futures = new ArrayList<>();
        Counters counters = new Counters();

        boolean interrupted = false;
        try {
            while (documents.hasNext()) {
                // A permit is held before the chunk is pulled, so unsent chunks never pile up here.
                inFlight.acquire();
                int batchNo = counters.batches.get();
                List<Document> chunk;
                try {
                    chunk = nextChunk(documents);
                    futures.add(pool.submit(() -> {
                        try {
                            sendChunk(batchNo, chunk, counters);
                        } finally {
                            inFlight.release();
                        }
                    }));
                } catch (RuntimeException e) {
                    inFlight.release();
                    throw e;
                }
                counters.submitted.addAndGet(chunk.size());
                counters.batches.incrementAndGet();
            }
        } catch (InterruptedException e) {
            interrupted = true;
            Logger.logWarn("[BulkInsert] Interrupted; no further batches will be submitted.");
        } finally {
            interrupted |= awaitAll(futures);
            pool.shutdown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        BulkInsertSummary summary = counters.toSummary();
        Logger.logInfo("[BulkInsert] Finished: " + summary.submitted() + " documents in " + summary.batches()
                + " batches; created=" + summary.created() + ", notCreated=" + summary.notCreated()
                + ", failedBatches=" + summary.failedBatches());
        return summary;
    }

    private List<Document> nextChunk(Iterator<Document> documents) {
        List<Document> chunk = new ArrayList<>(chunkSize);
        while (chunk.size() < chunkSize && documents.hasNext()) {
            chunk.add(documents.next());
        }
        return chunk;
    }

    /** One bulk request. Never throws; all failures are logged and counted. */
    void sendChunk(int batchNo, List<Document> chunk, Counters counters) {
        try {
            BulkRequest.Builder builder = new BulkRequest.Builder();
            for (Document doc : chunk) {
                builder.operations(o -> o.index(i -> i.index(doc.collection()).id(doc.id()).document(doc.body())));
            }
            Logger.logDebug("[BulkInsert] Request:\n" + OpenSearchLogFormat.indentRaw(
                    OpenSearchLogFormat.buildRawRequest(baseUrl, "POST", "/_bulk",
                            "<" + chunk.size() + " index operations, batch " + batchNo + ">")));

            BulkResponse response = client.bulk(builder.build());
            for (BulkResponseItem item : response.items()) {
                if (item.status() == STATUS_CREATED) {
                    counters.created.incrementAndGet();
                } else {
                    counters.notCreated.incrementAndGet();
                    reportItem(item);
                }
            }
        } catch (Exception e) {
            counters.failedBatches.incrementAndGet();
            Logger.logError("[BulkInsert] Batch " + batchNo + " of " + chunk.size() + " documents failed: "
                    + OpenSearchLogFormat.conciseRootCause(e), e);
        }
    }

    private static void reportItem(BulkResponseItem item) {
        StringBuilder sb = new StringBuilder("[BulkInsert] Document not created: index=")
                .append(item.index())
                .append(", id=").append(item.id())
                .append(", status=").append(item.status())
                .append(", result=").append(item.result());
        ErrorCause error = item.error();
        if (error != null) {
            sb.append(", error=").append(error.type()).append(": ").append(error.reason());
            Logger.logError(sb.toString());
        } else {
            Logger.logWarn(sb.toString());
        }
    }

    /**
     * Waits for every future, even across interrupts.
     *
     * @return whether the caller was interrupted while waiting; the caller restores the flag
     */
    private static boolean awaitAll(List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> f : futures) {
            while (true) {
                try {
                    f.get();
                    break;
                } catch (InterruptedException e) {
                    if (!interrupted) {
                        Logger.logWarn("[BulkInsert] Interrupted; still waiting for submitted batches to finish.");
                    }
                    interrupted = true;
                } catch (ExecutionException e) {
                    Logger.logError("[BulkInsert] Batch worker failed", e.getCause());
                    break;
                }
            }
        }
        return interrupted;
    }

    private static ThreadFactory threadFactory() {
        int pool = POOL_SEQ.incrementAndGet();
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "bulk-insert-" + pool + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    static final class Counters {
        final AtomicInteger submitted = new AtomicInteger();
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger notCreated = new AtomicInteger();
        final AtomicInteger failedBatches = new AtomicInteger();
        final AtomicInteger batches = new AtomicInteger();

        BulkInsertSummary toSummary() {
            return new BulkInsertSummary(submitted.get(), created.get(), notCreated.get(),
                    failedBatches.get(), batches.get());
        }
    }
}
