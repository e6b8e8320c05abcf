package com.tscan.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tscan.server.detect.Candidate;
import com.tscan.server.detect.CropRect;

import java.util.ArrayList;
import java.util.List;

public class CandidateJsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Candidate>> CANDIDATE_LIST = new TypeReference<List<Candidate>>() {
    };

    public static String candidatesToJson(List<Candidate> candidates) {
        if (candidates == null) {
            return "[]";
        }
        try {
            return MAPPER.writeValueAsString(candidates);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode candidates", e);
        }
    }

    public static List<Candidate> candidatesFromJson(String json) {
        if (json == null || json.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            List<Candidate> out = MAPPER.readValue(json, CANDIDATE_LIST);
            return out != null ? out : new ArrayList<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode candidates", e);
        }
    }

    public static String cropRectToJson(CropRect rect) {
        if (rect == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(rect);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode crop_rect", e);
        }
    }

    public static CropRect cropRectFromJson(String json) {
        if (json == null || json.isEmpty() || "null".equals(json)) {
            return null;
        }
        try {
            return MAPPER.readValue(json, CropRect.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode crop_rect", e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
