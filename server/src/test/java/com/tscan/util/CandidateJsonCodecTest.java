package com.tscan.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;
import com.tscan.server.detect.Verdict;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class CandidateJsonCodecTest {

    @Test
    public void testWireFieldNames() throws Exception {
        Candidate c = new Candidate(12, 34);
        c.setCheapScore(1.5);
        c.setValB(200);
        c.setAiScore(0.75);
        c.setVerdict(Verdict.BOGUS);

        JsonNode node = CandidateJsonCodec.mapper().readTree(CandidateJsonCodec.candidatesToJson(List.of(c))).get(0);
        Assertions.assertEquals(12, node.get("x").asInt());
        Assertions.assertEquals(1.5, node.get("cheap_score").asDouble(), 1e-9);
        Assertions.assertEquals(200, node.get("val_b").asDouble(), 1e-9);
        Assertions.assertEquals(0.75, node.get("ai_score").asDouble(), 1e-9);
        Assertions.assertEquals("bogus", node.get("verdict").asText());
        Assertions.assertFalse(node.has("saved"));
        Assertions.assertFalse(node.has("human_curated"));
        Assertions.assertFalse(node.has("humanCurated"));
    }

    @Test
    public void testDecodeToleratesUnknownAndMissingFields() {
        List<Candidate> list = CandidateJsonCodec.candidatesFromJson(
                "[{\"x\": 3, \"y\": 4, \"manual\": true, \"verdict\": \"maybe\", \"extra\": 1}]");
        Assertions.assertEquals(1, list.size());
        Candidate c = list.get(0);
        Assertions.assertTrue(c.isManual());
        Assertions.assertEquals(Verdict.UNKNOWN, c.getVerdict());
        Assertions.assertNull(c.getAiScore());
        Assertions.assertFalse(c.hasVerdict());
        Assertions.assertTrue(c.isHumanCurated());
    }

    @Test
    public void testEmpty() {
        Assertions.assertEquals("[]", CandidateJsonCodec.candidatesToJson(null));
        Assertions.assertTrue(CandidateJsonCodec.candidatesFromJson(null).isEmpty());
        Assertions.assertTrue(CandidateJsonCodec.candidatesFromJson("[]").isEmpty());
    }

    @Test
    public void testCropRectAsArray() {
        Assertions.assertEquals("[1,2,30,40]", CandidateJsonCodec.cropRectToJson(new CropRect(1, 2, 30, 40)));
        Assertions.assertEquals(new CropRect(5, 6, 7, 8), CandidateJsonCodec.cropRectFromJson("[5, 6, 7, 8]"));
        Assertions.assertNull(CandidateJsonCodec.cropRectFromJson(null));
        Assertions.assertNull(CandidateJsonCodec.cropRectToJson(null));
    }

    @Test
    public void testMalformedInputThrows() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CandidateJsonCodec.candidatesFromJson("{oops"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CandidateJsonCodec.cropRectFromJson("[1,2]"));
    }
}
