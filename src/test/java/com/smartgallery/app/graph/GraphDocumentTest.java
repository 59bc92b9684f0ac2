package com.smartgallery.app.graph;

import org.junit.jupiter.api.Test;

import static com.smartgallery.app.graph.GraphTestSupport.document;
import static com.smartgallery.app.graph.GraphTestSupport.json;
import static org.junit.jupiter.api.Assertions.*;

public class GraphDocumentTest {

    @Test
    void detectsVariantFromShape() throws Exception {
        assertEquals(GraphDocument.Variant.LINKED, document("txt2img_linked.json").variant());
        assertEquals(GraphDocument.Variant.INLINE, document("txt2img_inline.json").variant());
    }

    @Test
    void rejectsDocumentsMatchingNeitherShape() {
        assertThrows(UnrecognizedFormatException.class, () -> GraphDocument.of(json("[1, 2, 3]")));
        assertThrows(UnrecognizedFormatException.class, () -> GraphDocument.of(json("{\"a\": 1, \"b\": \"x\"}")));
        assertThrows(UnrecognizedFormatException.class,
                () -> GraphDocument.of(json("{\"1\": {\"inputs\": {}}}")), "node map without class_type");
        assertThrows(UnrecognizedFormatException.class, () -> GraphDocument.of(null));
    }

    @Test
    void bothVariantsExposeTheSameCapabilities() throws Exception {
        for (String name : new String[] {"txt2img_linked.json", "txt2img_inline.json"}) {
            GraphDocument doc = document(name);

            assertEquals("KSampler", doc.nodeType("3"), name);
            assertEquals("4", doc.inputSource("3", "model"), name);
            assertEquals("6", doc.inputSource("3", "positive"), name);
            assertEquals("5", doc.inputSource("3", "latent_image"), name);
            assertNull(doc.inputSource("3", "cfg"), "a literal has no source node in " + name);

            assertEquals(25, doc.widgetValue("3", "steps").asInt(), name);
            assertEquals(7.5, doc.widgetValue("3", "cfg").asDouble(), 1e-9, name);
            assertEquals("euler", doc.widgetValue("3", "sampler_name").asText(), name);
            assertEquals("models/sdxl_base.safetensors", doc.widgetValue("4", "ckpt_name").asText(), name);
            assertNull(doc.widgetValue("3", "model"), "connections are never widget values in " + name);
        }
    }

    @Test
    void linkedInputResolvesToConnectionOrLiteral() throws Exception {
        GraphDocument doc = document("txt2img_linked.json");

        InputRef model = doc.input("3", "model");
        assertInstanceOf(InputRef.Connection.class, model);
        assertEquals("4", ((InputRef.Connection) model).nodeId());
        assertEquals(0, ((InputRef.Connection) model).slot());

        InputRef clip = doc.input("6", "clip");
        assertEquals(1, ((InputRef.Connection) clip).slot());

        InputRef steps = doc.input("3", "steps");
        assertInstanceOf(InputRef.Literal.class, steps);
    }

    @Test
    void linkedWidgetIndexMapTakesPrecedenceOverPositionTable() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            {
              "nodes": [
                { "id": 1, "type": "KSampler", "widgets_values": ["dpmpp_2m", "karras", 30, 4.5] }
              ],
              "links": [],
              "widget_idx_map": { "1": { "sampler_name": 0, "scheduler": 1, "steps": 2, "cfg": 3 } }
            }
            """));

        assertEquals("dpmpp_2m", doc.widgetValue("1", "sampler_name").asText());
        assertEquals("karras", doc.widgetValue("1", "scheduler").asText());
        assertEquals(30, doc.widgetValue("1", "steps").asInt());
    }

    @Test
    void linkedObjectLinksAndObjectWidgets() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            {
              "nodes": [
                { "id": 1, "type": "KSampler", "inputs": [ { "name": "model", "link": 9 } ],
                  "widgets_values": { "steps": 20 } },
                { "id": 2, "type": "UNETLoader", "widgets_values": { "unet_name": "flux1-dev.safetensors" } }
              ],
              "links": [ { "id": 9, "origin_id": 2, "origin_slot": 0, "target_id": 1, "target_slot": 0 } ]
            }
            """));

        assertEquals("2", doc.inputSource("1", "model"));
        assertEquals(20, doc.widgetValue("1", "steps").asInt());
        assertEquals("flux1-dev.safetensors", doc.widgetValue("2", "unet_name").asText());
    }

    @Test
    void connectionToMissingNodeHasNoSource() throws Exception {
        GraphDocument doc = GraphDocument.of(json("""
            { "1": { "class_type": "KSampler", "inputs": { "model": ["99", 0] } } }
            """));

        assertInstanceOf(InputRef.Connection.class, doc.input("1", "model"));
        assertNull(doc.inputSource("1", "model"));
        assertFalse(doc.contains("99"));
    }

    @Test
    void unknownWidgetPositionsAreNotGuessed() {
        assertEquals(-1, WidgetPositions.indexOf("SomeCustomNode", "steps"));
        assertEquals(-1, WidgetPositions.indexOf("KSampler", "no_such_param"));
        assertEquals(2, WidgetPositions.indexOf("KSampler", "steps"));
        assertEquals(1, WidgetPositions.VERSION);
    }
}
