package com.smartgallery.app.metadata;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static com.smartgallery.app.graph.GraphTestSupport.json;
import static com.smartgallery.app.graph.GraphTestSupport.resource;
import static org.junit.jupiter.api.Assertions.*;

public class MetadataServiceTest {

    private final MetadataService service =
            new MetadataService(new SamplerExtractor(p -> Optional.empty()), DebugSink.NONE);

    @Test
    void malformedOrEmptyInputYieldsEmptyList() {
        assertTrue(service.extract("{not json".getBytes(StandardCharsets.UTF_8)).isEmpty());
        assertTrue(service.extract(new byte[0]).isEmpty());
        assertTrue(service.extract((byte[]) null).isEmpty());
        assertTrue(service.extract("[1,2,3]".getBytes(StandardCharsets.UTF_8)).isEmpty());
        assertTrue(service.extract("{\"foo\": \"bar\"}".getBytes(StandardCharsets.UTF_8)).isEmpty());
    }

    @Test
    void formatIndependence() {
        List<SamplerRecord> inline = service.extract(resource("txt2img_inline.json").getBytes(StandardCharsets.UTF_8));
        List<SamplerRecord> linked = service.extract(resource("txt2img_linked.json").getBytes(StandardCharsets.UTF_8));

        assertEquals(1, inline.size());
        assertEquals(inline, linked);
    }

    @Test
    void nestedPromptObjectOrTextIsPreferred() {
        String inline = resource("txt2img_inline.json");
        String asObject = "{\"prompt\": " + inline + ", \"workflow\": {\"nodes\": []}}";
        String asText = "{\"Prompt\": " + JsonSupport.MAPPER.valueToTree(inline) + "}";

        assertEquals("nested_prompt", MetadataService.detect(json(asObject)).orElseThrow().format());
        assertEquals(1, service.extract(asObject.getBytes(StandardCharsets.UTF_8)).size());
        assertEquals(1, service.extract(asText.getBytes(StandardCharsets.UTF_8)).size());
    }

    @Test
    void linkedDocumentPrefersExtraPrompt() {
        ObjectNode linked = (ObjectNode) json(resource("txt2img_linked.json"));
        ObjectNode api = (ObjectNode) json(resource("two_pass_inline.json"));
        linked.putObject("extra").set("prompt", api);

        MetadataService.Detection d = MetadataService.detect(linked).orElseThrow();
        assertEquals("linked_extra_prompt", d.format());

        List<SamplerRecord> records = service.extract(linked.toString().getBytes(StandardCharsets.UTF_8));
        assertEquals(2, records.size(), "samplers come from the embedded API prompt");
    }

    @Test
    void detectionOfBareDocuments() {
        assertEquals("linked", MetadataService.detect(json(resource("txt2img_linked.json"))).orElseThrow().format());
        assertEquals("inline", MetadataService.detect(json(resource("txt2img_inline.json"))).orElseThrow().format());
        assertTrue(MetadataService.detect(json("{\"a\": {\"inputs\": {}}}")).isEmpty());
    }

    @Test
    void debugSinkReceivesEveryStage() throws Exception {
        Path dir = Files.createTempDirectory("gallery-debug-");
        MetadataService debugging = new MetadataService(new SamplerExtractor(p -> Optional.empty()),
                DebugSink.forDirectory(dir));

        List<SamplerRecord> records = debugging.extract(resource("txt2img_inline.json"), Path.of("out", "fox_00001_.png"));
        assertEquals(1, records.size());

        Path stageDir = dir.resolve("fox_00001_");
        assertTrue(Files.isRegularFile(stageDir.resolve("01_raw_string.json")));
        assertTrue(Files.isRegularFile(stageDir.resolve("02_parsed_json.json")));
        assertTrue(Files.isRegularFile(stageDir.resolve("03_format_detection_inline.json")));
        assertTrue(Files.isRegularFile(stageDir.resolve("04_parser_input_inline.json")));
        assertTrue(Files.isRegularFile(stageDir.resolve("05_parser_output_inline.json")));
        assertTrue(Files.isRegularFile(stageDir.resolve("05_parser_output_summary.txt")));

        String output = Files.readString(stageDir.resolve("05_parser_output_inline.json"));
        assertTrue(output.contains("\"modelName\" : \"sdxl_base\""), output);
        try (Stream<Path> files = Files.list(stageDir)) {
            assertEquals(10, files.count());
        }
    }

    @Test
    void disabledSinkWritesNothing() {
        assertFalse(DebugSink.NONE.enabled());
        assertSame(DebugSink.NONE, DebugSink.forDirectory(null));
    }
}
