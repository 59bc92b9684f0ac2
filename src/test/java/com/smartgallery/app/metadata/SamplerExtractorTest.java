package com.smartgallery.app.metadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.smartgallery.app.analyze.PixelSize;
import com.smartgallery.app.graph.GraphDocument;
import org.junit.jupiter.api.Test;

import static com.smartgallery.app.graph.GraphTestSupport.document;
import static com.smartgallery.app.graph.GraphTestSupport.json;
import static org.junit.jupiter.api.Assertions.*;

public class SamplerExtractorTest {

    private final SamplerExtractor extractor = new SamplerExtractor(p -> Optional.empty());

    @Test
    void extractsAllFieldsFromSimpleGraph() throws Exception {
        List<SamplerRecord> records = extractor.extractAll(document("txt2img_inline.json"));

        assertEquals(1, records.size());
        SamplerRecord r = records.get(0);
        assertEquals(0, r.samplerIndex());
        assertEquals("sdxl_base", r.modelName(), "directory and extension are stripped");
        assertEquals("euler", r.samplerName());
        assertEquals("normal", r.scheduler());
        assertEquals("a red fox in the snow", r.positivePrompt());
        assertEquals("blurry, watermark", r.negativePrompt());
        assertEquals(1024, r.width());
        assertEquals(768, r.height());
        assertEquals(7.5, r.cfg());
        assertEquals(25, r.steps());
    }

    @Test
    void linkedAndInlineSerializationsYieldTheSameRecords() throws Exception {
        assertEquals(extractor.extractAll(document("txt2img_inline.json")),
                extractor.extractAll(document("txt2img_linked.json")));
    }

    @Test
    void multipleSamplersAreOrderedByNumericNodeId() throws Exception {
        List<SamplerRecord> records = extractor.extractAll(document("two_pass_inline.json"));

        assertEquals(2, records.size());

        SamplerRecord first = records.get(0);
        assertEquals(0, first.samplerIndex());
        assertEquals("euler_ancestral", first.samplerName(), "node 3 sorts before node 10");
        assertEquals("sdxl_base", first.modelName(), "traced through the LoRA loader");
        assertEquals("castle on a hill", first.positivePrompt(), "text_g fallback");
        assertNull(first.negativePrompt(), "empty prompt is stored as null");
        assertEquals(6.5, first.cfg(), "cfg from primitive node");
        assertEquals(30, first.steps(), "numeric text is coerced");
        assertEquals(832, first.width());
        assertEquals(1216, first.height());

        SamplerRecord second = records.get(1);
        assertEquals(1, second.samplerIndex());
        assertEquals("sd_xl_refiner_1.0", second.modelName(), "windows separators are handled");
        assertEquals("dpmpp_2m", second.samplerName());
        assertEquals("karras", second.scheduler());
        assertEquals(5.0, second.cfg());
        assertEquals(12, second.steps());
    }

    @Test
    void documentWithoutSamplersYieldsEmptyList() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            { "4": { "class_type": "CheckpointLoaderSimple", "inputs": { "ckpt_name": "a.safetensors" } } }
            """));
        assertTrue(extractor.extractAll(doc).isEmpty());
    }

    @Test
    void helperSelectorNodesAreNotSamplers() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            {
              "1": { "class_type": "KSamplerSelect", "inputs": { "sampler_name": "euler" } },
              "2": { "class_type": "BasicScheduler", "inputs": { "scheduler": "simple", "steps": 20 } }
            }
            """));
        assertTrue(extractor.extractAll(doc).isEmpty());
    }

    @Test
    void customSamplerResolvesHelpersThroughConnections() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            {
              "13": { "class_type": "SamplerCustomAdvanced",
                      "inputs": { "sampler": ["16", 0], "sigmas": ["17", 0], "latent_image": ["27", 0] } },
              "16": { "class_type": "KSamplerSelect", "inputs": { "sampler_name": "euler" } },
              "17": { "class_type": "BasicScheduler", "inputs": { "scheduler": "simple", "steps": 20, "model": ["12", 0] } },
              "12": { "class_type": "UNETLoader", "inputs": { "unet_name": "flux1-dev.safetensors" } },
              "27": { "class_type": "EmptySD3LatentImage", "inputs": { "width": 1024, "height": 1024, "batch_size": 1 } }
            }
            """));

        SamplerRecord r = extractor.extractAll(doc).get(0);
        assertEquals("euler", r.samplerName());
        assertEquals("simple", r.scheduler());
        assertEquals(20, r.steps());
        assertEquals(1024, r.width());
        assertNull(r.modelName(), "no model input on the sampler itself");
        assertNull(r.cfg());
    }

    @Test
    void brokenFieldsLeaveTheRestIntact() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            {
              "1": { "class_type": "KSampler",
                     "inputs": { "steps": "many", "cfg": {"nested": true}, "sampler_name": 42,
                                 "scheduler": "normal", "model": ["2", 0], "latent_image": ["404", 0] } },
              "2": { "class_type": "CheckpointLoaderSimple", "inputs": { "ckpt_name": "dreamshaper_8.ckpt" } }
            }
            """));

        SamplerRecord r = extractor.extractAll(doc).get(0);
        assertNull(r.steps());
        assertNull(r.cfg());
        assertNull(r.samplerName());
        assertNull(r.width());
        assertEquals("normal", r.scheduler());
        assertEquals("dreamshaper_8", r.modelName());
    }

    @Test
    void cyclicModelChainLeavesModelEmpty() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            {
              "1": { "class_type": "KSampler", "inputs": { "steps": 10, "model": ["2", 0] } },
              "2": { "class_type": "LoraLoader", "inputs": { "model": ["3", 0] } },
              "3": { "class_type": "LoraLoader", "inputs": { "model": ["2", 0] } }
            }
            """));

        SamplerRecord r = extractor.extractAll(doc).get(0);
        assertNull(r.modelName());
        assertEquals(10, r.steps());
    }

    @Test
    void pixelSizeFallbackOnlyForStillImageFiles() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SamplerExtractor withPixels = new SamplerExtractor(p -> {
            calls.incrementAndGet();
            return Optional.of(new PixelSize(640, 480));
        });
        GraphDocument doc = GraphDocument.of(json("""
            { "1": { "class_type": "KSampler", "inputs": { "steps": 10 } } }
            """));

        SamplerRecord fromPng = withPixels.extractAll(doc, Path.of("out", "image.PNG")).get(0);
        assertEquals(640, fromPng.width());
        assertEquals(480, fromPng.height());

        SamplerRecord fromVideo = withPixels.extractAll(doc, Path.of("out", "clip.mp4")).get(0);
        assertNull(fromVideo.width());
        assertEquals(1, calls.get());
    }

    @Test
    void samplerThatCannotBeBuiltIsDroppedWithAWarning() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            {
              "1": { "class_type": "KSampler", "inputs": { "steps": 10, "latent_image": ["3", 0] } },
              "2": { "class_type": "KSampler", "inputs": { "steps": 20 } },
              "3": { "class_type": "EmptyLatentImage", "inputs": { "width": 512, "height": 512, "batch_size": 1 } }
            }
            """));
        Logger logger = (Logger) LoggerFactory.getLogger(SamplerExtractor.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            // a source path with no file name breaks the pixel fallback of node 2 only
            List<SamplerRecord> records = extractor.extractAll(doc, Path.of("/"));

            assertEquals(1, records.size());
            assertEquals(0, records.get(0).samplerIndex());
            assertEquals(10, records.get(0).steps());
            assertEquals(1, appender.list.size());
            ILoggingEvent event = appender.list.get(0);
            assertEquals(Level.WARN, event.getLevel());
            assertTrue(event.getFormattedMessage().startsWith("Dropping sampler node 2"));
        } finally {
            logger.detachAppender(appender);
        }
    }
}
