package com.smartgallery.app;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartgallery.app.config.GalleryConfig;
import com.smartgallery.app.sync.SyncSummary;

/**
 * Opens the index for the configured output folder, runs a full sync and keeps the process alive
 * until it is asked to stop.
 */
public final class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private Main() {}

    public static void main(String[] args) {
        GalleryConfig config = GalleryConfig.load();
        GalleryIndexer indexer = new GalleryIndexer(config);
        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch closed = new CountDownLatch(1);

        // the hook holds the JVM open until the index is closed
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown requested");
            shutdown.countDown();
            try {
                closed.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "gallery-shutdown"));

        int exitCode = 0;
        try {
            indexer.start();
            SyncSummary summary = indexer.runFullSync();
            logger.info("Startup sync done: {} added, {} updated, {} deleted",
                    summary.added(), summary.updated(), summary.deleted());
            logger.info("Serving gallery index for {}", config.outputPath());
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Gallery indexer failed to start", e);
            exitCode = 1;
        } finally {
            indexer.close();
            closed.countDown();
        }
        if (exitCode != 0) System.exit(exitCode);
    }
}
