package com.tscan.server.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.detect.ProcessingConfig;
import com.tscan.util.CandidateJsonCodec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cache invalidation key. Covers exactly the inputs that change what stage A
 * and the classifier produce; crowd penalty knobs, worker and writer tuning,
 * the inference chunk size and the auto-clear switch are left out.
 */
public class ParamsHash {

    public static String compute(DetectionParameters p, ProcessingConfig config, String modelIdentity) {
        Map<String, Object> key = new TreeMap<>();
        key.put("thresh", p.thresh);
        key.put("min_area", p.minArea);
        key.put("sharpness", p.sharpness);
        key.put("max_sharpness", p.maxSharpness);
        key.put("contrast", p.contrast);
        key.put("edge_margin", p.edgeMargin);
        key.put("kill_flat", p.killFlat);
        key.put("kill_hist", p.killHist);
        key.put("kill_dipole", p.killDipole);
        key.put("kill_no_rise", p.killNoRise);
        key.put("min_rise", p.minRise);
        key.put("dynamic_thresh", p.dynamicThresh);
        key.put("max_area", p.maxArea);
        key.put("auto_crop", p.autoCrop);
        key.put("model", modelIdentity != null ? modelIdentity : "");
        key.put("topk_cheap", config.topkCheap);
        key.put("topk_union", config.topkUnion);
        key.put("topk_rise", config.topkRise);
        key.put("topk_contrast", config.topkContrast);
        key.put("crop_size", config.cropSize);
        key.put("resize_hw", config.resizeHw);
        key.put("cheap_mode", config.cheapMode.name());
        key.put("w_rise", config.wRise);
        key.put("w_contrast", config.wContrast);
        key.put("w_sharp", config.wSharp);
        key.put("w_area_penalty", config.wAreaPenalty);

        try {
            String json = CandidateJsonCodec.mapper().writeValueAsString(key);
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(json.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1)
                    hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to compute parameter hash", e);
        }
    }
}
