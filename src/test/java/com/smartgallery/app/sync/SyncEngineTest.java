package com.smartgallery.app.sync;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.smartgallery.app.TestMedia;
import com.smartgallery.app.analyze.Hashes;
import com.smartgallery.app.cache.BoundedCache;
import com.smartgallery.app.database.FileRecord;
import com.smartgallery.app.database.IndexDatabase;
import com.smartgallery.app.database.IndexStore;
import com.smartgallery.app.metadata.SamplerRecord;

import static com.smartgallery.app.graph.GraphTestSupport.json;
import static com.smartgallery.app.graph.GraphTestSupport.resource;
import static org.junit.jupiter.api.Assertions.*;

public class SyncEngineTest {

    private Path root;
    private IndexStore store;
    private SyncEngine engine;
    private final AtomicInteger publishes = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        Path temp = Files.createTempDirectory("gallery-sync-");
        root = temp.resolve("output");
        Files.createDirectories(root);
        store = new IndexStore(new IndexDatabase(temp.resolve("index.sqlite"), 4),
                new BoundedCache<>(50, Duration.ofMinutes(5)));
        store.init();
        engine = new SyncEngine(new SyncSettings(root, null, null, 4, 100, null, null, null), store,
                publishes::incrementAndGet);
    }

    @AfterEach
    void tearDown() {
        engine.close();
        store.close();
    }

    private Path generated(String relative, String graphResource) throws Exception {
        String prompt = json(resource(graphResource)).toString();
        return TestMedia.png(root.resolve(relative), 8, 8, Map.of("prompt", prompt));
    }

    @Test
    void fullSyncIndexesFilesAndSamplers() throws Exception {
        Path fox = generated("fox.png", "txt2img_inline.json");
        Path castle = generated("sub/castle.png", "two_pass_inline.json");
        TestMedia.png(root.resolve("plain.png"));
        Files.writeString(root.resolve("fox.json"), "{}");
        TestMedia.png(root.resolve(".thumbnails_cache/abc.png"));

        SyncSummary summary = engine.runFullSync();

        assertEquals(3, summary.processed());
        assertEquals(3, summary.added());
        assertEquals(2, summary.workflowsExtracted());
        assertEquals(3, summary.totalSamplers());
        assertEquals(1, summary.withoutMetadata());
        assertEquals(3, store.countFiles());
        assertEquals(1, publishes.get());

        FileRecord foxRow = store.findByPath(fox.toString()).orElseThrow();
        assertEquals(Hashes.fileId(fox.toString()), foxRow.id());
        assertTrue(foxRow.hasWorkflow());
        assertEquals("a red fox in the snow", foxRow.promptPreview());
        assertEquals("euler", foxRow.samplerNames());
        assertEquals("8x8", foxRow.dimensions());

        FileRecord castleRow = store.findByPath(castle.toString()).orElseThrow();
        List<SamplerRecord> samplers = store.samplers(castleRow.id());
        assertEquals(2, samplers.size());
        assertEquals(0, samplers.get(0).samplerIndex());
        assertEquals("dpmpp_2m, euler_ancestral", castleRow.samplerNames());
    }

    @Test
    void secondPassIsANoOp() throws Exception {
        generated("fox.png", "txt2img_inline.json");
        generated("a/b/c.png", "two_pass_inline.json");
        engine.runFullSync();
        long samplers = store.countSamplers();

        SyncSummary second = engine.runFullSync();

        assertEquals(0, second.added());
        assertEquals(0, second.updated());
        assertEquals(0, second.deleted());
        assertEquals(0, second.processed());
        assertFalse(second.changedIndex());
        assertEquals(samplers, store.countSamplers());
        assertEquals(1, publishes.get(), "nothing published for an unchanged tree");
    }

    @Test
    void modifiedAndRemovedFilesAreReconciled() throws Exception {
        Path fox = generated("fox.png", "txt2img_inline.json");
        Path doomed = generated("doomed.png", "txt2img_inline.json");
        engine.runFullSync();
        String foxId = Hashes.fileId(fox.toString());
        store.setFavorite(List.of(foxId), true);

        generated("fox.png", "two_pass_inline.json");
        Files.setLastModifiedTime(fox, FileTime.fromMillis(System.currentTimeMillis() + 60_000));
        Files.delete(doomed);

        SyncSummary summary = engine.runFullSync();

        assertEquals(1, summary.updated());
        assertEquals(1, summary.deleted());
        assertEquals(1, store.countFiles());
        assertEquals(2, store.samplers(foxId).size(), "sampler rows are replaced, not appended");
        assertTrue(store.findFile(foxId).orElseThrow().isFavorite());
    }

    @Test
    void planOnlyReportsTheNewFiles() throws Exception {
        for (int i = 0; i < 600; i++) {
            TestMedia.png(root.resolve("batch" + (i % 6) + "/old_" + i + ".png"));
        }
        engine.runFullSync();
        assertEquals(600, store.countFiles());
        for (int i = 0; i < 400; i++) {
            TestMedia.png(root.resolve("batch" + (i % 4) + "/new_" + i + ".png"));
        }

        SyncDiff plan = engine.planFullSync();

        assertEquals(400, plan.toAdd().size());
        assertTrue(plan.toUpdate().isEmpty());
        assertTrue(plan.toDelete().isEmpty());
        assertEquals(600, plan.unchanged());

        SyncSummary summary = engine.runFullSync();
        assertEquals(400, summary.added());
        assertEquals(1000, store.countFiles());
    }

    @Test
    void folderSyncReportsProgress() throws Exception {
        Path folder = root.resolve("day1");
        generated("day1/one.png", "txt2img_inline.json");
        generated("day1/two.png", "txt2img_linked.json");
        generated("day1/nested/skip.png", "txt2img_inline.json");
        Files.writeString(folder.resolve("notes.txt"), "not media");
        List<SyncProgress> events = new ArrayList<>();

        SyncSummary summary = engine.runFolderSync(folder, events::add);

        assertEquals(2, summary.added());
        assertEquals(2, store.countFiles(), "subfolders are left to their own sync");
        assertEquals(5, events.size());
        assertEquals("Checking folder for changes...", events.get(0).message());
        assertEquals("Found 2 new/modified files. Processing...", events.get(1).message());
        assertTrue(events.get(2).message().startsWith("Processing: "));
        assertEquals(1, events.get(2).current());
        assertEquals(2, events.get(3).current());
        assertEquals(2, events.get(3).total());
        SyncProgress last = events.get(4);
        assertEquals(SyncProgress.STATUS_RELOADING, last.status());
        assertEquals("Sync complete. Reloading...", last.message());
        assertTrue(last.finished());

        events.clear();
        engine.runFolderSync(folder, events::add);

        assertEquals(2, events.size());
        assertEquals(SyncProgress.STATUS_NO_CHANGES, events.get(1).status());
        assertEquals("Folder is up-to-date.", events.get(1).message());
    }

    @Test
    void folderSyncOfDeletionsOnly() throws Exception {
        Path one = generated("day1/one.png", "txt2img_inline.json");
        engine.runFolderSync(root.resolve("day1"), p -> { });
        Files.delete(one);
        List<SyncProgress> events = new ArrayList<>();

        SyncSummary summary = engine.runFolderSync(root.resolve("day1"), events::add);

        assertEquals(1, summary.deleted());
        assertEquals(0, store.countFiles());
        assertEquals(SyncProgress.STATUS_RELOADING, events.get(events.size() - 1).status());
    }

    @Test
    void fullAndFolderSyncAgreeOnWhatIsIndexed() throws Exception {
        Path folder = root.resolve("day1");
        generated("day1/a.png", "txt2img_inline.json");
        Files.writeString(folder.resolve("notes.txt"), "not media");

        assertEquals(1, engine.runFullSync().added());
        assertEquals(1, store.countFiles());

        List<SyncProgress> events = new ArrayList<>();
        SyncSummary folderPass = engine.runFolderSync(folder, events::add);
        assertEquals(0, folderPass.deleted());
        assertEquals(SyncProgress.STATUS_NO_CHANGES, events.get(events.size() - 1).status());

        SyncSummary fullAgain = engine.runFullSync();
        assertFalse(fullAgain.changedIndex());
        assertEquals(1, store.countFiles());
        assertEquals(1, publishes.get());
    }

    @Test
    void folderSyncFailureEndsWithAnErrorEvent() throws Exception {
        generated("day1/one.png", "txt2img_inline.json");
        store.close();
        List<SyncProgress> events = new ArrayList<>();

        assertThrows(RuntimeException.class, () -> engine.runFolderSync(root.resolve("day1"), events::add));

        SyncProgress last = events.get(events.size() - 1);
        assertTrue(last.error());
        assertEquals(SyncProgress.STATUS_ERROR, last.status());
        assertTrue(last.message().startsWith("Error during sync: "));
    }

    @Test
    void unreadableMetadataIsCountedNotFatal() throws Exception {
        generated("fox.png", "txt2img_inline.json");
        TestMedia.png(root.resolve("other.png"));
        SyncSettings failing = new SyncSettings(root, null, null, 2, 10, null, null, null)
                .withMetadataSource(file -> {
                    throw new java.io.IOException("boom");
                });

        try (SyncEngine broken = new SyncEngine(failing, store)) {
            SyncSummary summary = broken.runFullSync();

            assertEquals(2, summary.processed());
            assertEquals(2, summary.metadataFailed());
            assertEquals(2, summary.parseErrors());
            assertEquals(2, store.countFiles());
            assertEquals(0, store.countSamplers());
        }
    }
}
