package com.smartgallery.app.sync;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartgallery.app.database.FileRecord;
import com.smartgallery.app.database.IndexStore;
import com.smartgallery.app.metadata.SamplerRecord;

/**
 * Reconciles the files on disk with the index.
 * <p>
 * A pass scans, diffs against the index, hands new and changed files to a fixed worker pool,
 * commits results in batches as they come back, deletes vanished paths, then publishes by
 * invalidating cached aggregates. Passes are serialized; queries may run alongside.
 */
public final class SyncEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SyncEngine.class);

    private final SyncSettings settings;
    private final IndexStore store;
    private final FileProcessor processor;
    private final Runnable onPublish;
    private final ExecutorService pool;
    private final ReentrantLock passLock = new ReentrantLock();

    public SyncEngine(SyncSettings settings, IndexStore store) {
        this(settings, store, () -> { });
    }

    /** @param onPublish run after the store's own caches are invalidated at the end of a changing pass */
    public SyncEngine(SyncSettings settings, IndexStore store, Runnable onPublish) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.store = Objects.requireNonNull(store, "store");
        this.onPublish = Objects.requireNonNull(onPublish, "onPublish");
        this.processor = new FileProcessor(settings);
        this.pool = Executors.newFixedThreadPool(settings.workers(), namedFactory("gallery-sync-"));
    }

    public SyncSettings settings() {
        return settings;
    }

    /** Diff of the whole output tree against the whole index, without applying it. */
    public SyncDiff planFullSync() throws IOException {
        DiskScanner scanner = new DiskScanner(settings.extensions(), settings.excludedDirNames());
        return SyncDiff.compute(scanner.scanTree(settings.root()), store.allPathMtimes());
    }

    /** Blocking full pass over the output tree. */
    public SyncSummary runFullSync() throws IOException {
        passLock.lock();
        try {
            SyncMetrics metrics = new SyncMetrics();
            logger.info("Full sync of {} started", settings.root());

            SyncDiff diff = planFullSync();
            logger.info("Sync plan: {} new, {} modified, {} removed, {} unchanged",
                    diff.toAdd().size(), diff.toUpdate().size(), diff.toDelete().size(), diff.unchanged());

            apply(diff, metrics, (done, total, path) -> {
                if (done % 1000 == 0 || done == total) logger.info("Processed {}/{} files", done, total);
            });

            SyncSummary summary = metrics.snapshot();
            logSummary("Full sync", summary);
            return summary;
        } finally {
            passLock.unlock();
        }
    }

    /**
     * Pass over the media files directly inside {@code folder}, reporting progress after every
     * file. A failure is reported as a final error event and then rethrown.
     */
    public SyncSummary runFolderSync(Path folder, Consumer<SyncProgress> progress) {
        Objects.requireNonNull(progress, "progress");
        progress.accept(SyncProgress.step("Checking folder for changes...", 0, 1));

        passLock.lock();
        try {
            SyncMetrics metrics = new SyncMetrics();
            DiskScanner scanner = new DiskScanner(settings.extensions(), settings.excludedDirNames());
            SyncDiff diff = SyncDiff.compute(scanner.scanFolder(folder), store.pathMtimesIn(folder));

            if (diff.isEmpty()) {
                progress.accept(SyncProgress.done("Folder is up-to-date.", SyncProgress.STATUS_NO_CHANGES, 1, 1));
                return metrics.snapshot();
            }

            int total = diff.toAdd().size() + diff.toUpdate().size();
            if (total > 0) {
                progress.accept(SyncProgress.step("Found " + total + " new/modified files. Processing...", 0, total));
            }
            apply(diff, metrics, (done, n, path) ->
                    progress.accept(SyncProgress.step("Processing: " + Path.of(path).getFileName(), done, n)));

            progress.accept(SyncProgress.done("Sync complete. Reloading...", SyncProgress.STATUS_RELOADING, total, total));
            SyncSummary summary = metrics.snapshot();
            logSummary("Folder sync of " + folder, summary);
            return summary;
        } catch (RuntimeException e) {
            logger.error("Error during sync of {}", folder, e);
            progress.accept(SyncProgress.failed("Error during sync: " + e.getMessage()));
            throw e;
        } finally {
            passLock.unlock();
        }
    }

    @FunctionalInterface
    private interface FileDone {
        void accept(int done, int total, String path);
    }

    private void apply(SyncDiff diff, SyncMetrics metrics, FileDone onFileDone) {
        List<String> work = diff.filesToProcess();
        if (!work.isEmpty()) {
            dispatch(work, diff, metrics, onFileDone);
        }

        if (!diff.toDelete().isEmpty()) {
            int removed = store.deleteByPath(new ArrayList<>(diff.toDelete()));
            metrics.deleted.add(removed);
            logger.info("Removed {} stale entries from the index", removed);
        }

        if (!diff.isEmpty()) {
            store.invalidateCaches();
            onPublish.run();
        }
    }

    private void dispatch(List<String> work, SyncDiff diff, SyncMetrics metrics, FileDone onFileDone) {
        CompletionService<ProcessedFile> completion = new ExecutorCompletionService<>(pool);
        Map<Future<ProcessedFile>, String> submitted = new HashMap<>(work.size() * 2);
        for (String path : work) {
            submitted.put(completion.submit(() -> processor.process(Path.of(path), metrics)), path);
        }

        List<ProcessedFile> batch = new ArrayList<>(Math.min(work.size(), settings.batchSize()));
        try {
            for (int done = 1; done <= work.size(); done++) {
                Future<ProcessedFile> future = completion.take();
                String path = submitted.get(future);
                try {
                    ProcessedFile result = future.get();
                    metrics.record(result);
                    batch.add(result);
                    if (batch.size() >= settings.batchSize()) {
                        commit(batch, diff, metrics);
                        batch.clear();
                    }
                } catch (ExecutionException e) {
                    metrics.failed.increment();
                    logger.warn("Worker failed for {}: {}", path, String.valueOf(e.getCause()));
                }
                onFileDone.accept(done, work.size(), path);
            }
            if (!batch.isEmpty()) {
                commit(batch, diff, metrics);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (Future<ProcessedFile> f : submitted.keySet()) f.cancel(true);
            throw new IllegalStateException("Sync interrupted", e);
        }
    }

    private void commit(List<ProcessedFile> batch, SyncDiff diff, SyncMetrics metrics) {
        List<FileRecord> files = new ArrayList<>(batch.size());
        Map<String, List<SamplerRecord>> samplers = new HashMap<>(batch.size() * 2);
        for (ProcessedFile r : batch) {
            files.add(r.file());
            samplers.put(r.file().id(), r.samplers());
        }
        store.commitBatch(files, samplers);

        for (FileRecord f : files) {
            if (diff.toAdd().contains(f.path())) metrics.added.increment();
            else metrics.updated.increment();
        }
        logger.debug("Committed batch of {} files", files.size());
    }

    private static void logSummary(String label, SyncSummary s) {
        logger.info("{} finished in {} ms: {} processed, {} failed, {} added, {} updated, {} deleted",
                label, s.elapsedMillis(), s.processed(), s.failed(), s.added(), s.updated(), s.deleted());
        logger.info("Metadata: {} with workflow, {} extracted ({} samplers), {} not extracted, {} failed, {} without metadata",
                s.withWorkflow(), s.workflowsExtracted(), s.totalSamplers(), s.workflowsNotExtracted(),
                s.metadataFailed(), s.withoutMetadata());
        if (s.parseErrors() > SyncMetrics.LOGGED_PARSE_ERRORS) {
            logger.warn("{} metadata errors in total, only the first {} were logged",
                    s.parseErrors(), SyncMetrics.LOGGED_PARSE_ERRORS);
        }
    }

    private static ThreadFactory namedFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory base = Executors.defaultThreadFactory();
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override public Thread newThread(Runnable r) {
                Thread t = base.newThread(r);
                t.setName(prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Sync workers did not stop in time, interrupting");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
