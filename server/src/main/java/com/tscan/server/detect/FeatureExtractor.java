package com.tscan.server.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Stage A: crop detection, blob detection, feature computation, cheap scoring,
 * top-K filtering and patch preparation for one triplet. Stateless, so one
 * instance is shared by all worker threads.
 */
public class FeatureExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FeatureExtractor.class);

    private static final int RISE_RADIUS = 3;
    private static final int DIPOLE_PAD = 4;
    private static final int DIPOLE_FLOOR = 15;
    private static final double SOLID_AREA = 20;
    private static final double SOLID_EXTENT = 0.90;
    private static final double MAX_ASPECT = 3.0;
    private static final double MIN_ASPECT = 0.33;

    private final DetectionParameters params;
    private final CheapScorer cheapScorer;
    private final TopKSelector topKSelector;
    private final PatchPreparer patchPreparer;

    public FeatureExtractor(DetectionParameters params, ProcessingConfig config) {
        this.params = params;
        this.cheapScorer = new CheapScorer(config);
        this.topKSelector = new TopKSelector(config);
        this.patchPreparer = new PatchPreparer(config.cropSize);
    }

    public StageAResult extract(String name, TripletPaths paths) throws IOException {
        return extract(ImageLoader.readTriplet(name, paths));
    }

    public StageAResult extract(ImageTriplet full) {
        long t0 = System.currentTimeMillis();

        CropRect cropRect = params.autoCrop
                ? BlobFinder.autoCrop(full.getDiff())
                : CropRect.fullFrame(full.getDiff().getWidth(), full.getDiff().getHeight());
        ImageTriplet triplet = full.crop(cropRect);

        List<Candidate> raw = detect(triplet);

        List<Candidate> top;
        if (raw.isEmpty()) {
            top = new ArrayList<>();
        } else {
            cheapScorer.score(raw);
            top = topKSelector.select(raw);
        }

        List<Candidate> kept = new ArrayList<>(top.size());
        List<PatchTensor> patches = new ArrayList<>(top.size());
        for (Candidate c : top) {
            try {
                patches.add(patchPreparer.prepare(triplet, c.getX(), c.getY()));
                c.setId(kept.size());
                kept.add(c);
            } catch (RuntimeException e) {
                logger.debug("Dropping candidate ({}, {}) of {}: patch failed: {}",
                        c.getX(), c.getY(), full.getName(), e.getMessage());
            }
        }

        long elapsed = System.currentTimeMillis() - t0;
        logger.debug("Stage A {}: raw={}, kept={}, crop={}, {} ms",
                full.getName(), raw.size(), kept.size(), cropRect, elapsed);
        return new StageAResult(full.getName(), cropRect, kept, patches, raw.size(), elapsed);
    }

    /**
     * Heuristic blob detection on the cropped triplet. Returns every blob that
     * passes the rejection rules, in scan order.
     */
    public List<Candidate> detect(ImageTriplet triplet) {
        GrayImage a = triplet.getDiff();
        GrayImage b = triplet.getFresh();
        GrayImage c = triplet.getReference();
        int w = a.getWidth();
        int h = a.getHeight();

        double threshold = params.thresh;
        if (params.dynamicThresh) {
            threshold = a.median() + params.thresh;
        }
        List<BlobFinder.Blob> blobs = BlobFinder.findAbove(a.gaussianBlur3(), threshold);

        List<Candidate> out = new ArrayList<>();
        for (BlobFinder.Blob blob : blobs) {
            double area = blob.area;
            if (area < params.minArea || area > params.maxArea) {
                continue;
            }
            int bx = blob.minX;
            int by = blob.minY;
            int bw = blob.width();
            int bh = blob.height();
            int edge = params.edgeMargin;
            if (bx < edge || by < edge || bx + bw > w - edge || by + bh > h - edge) {
                continue;
            }

            int cx = blob.centroidX();
            int cy = blob.centroidY();

            GrayImage.WindowStats winB = b.stats(cx - RISE_RADIUS, cy - RISE_RADIUS,
                    cx + RISE_RADIUS + 1, cy + RISE_RADIUS + 1);
            GrayImage.WindowStats winC = c.stats(cx - RISE_RADIUS, cy - RISE_RADIUS,
                    cx + RISE_RADIUS + 1, cy + RISE_RADIUS + 1);
            if (winB == null || winC == null) {
                continue;
            }
            double valB = winB.max;
            double valC = winC.max;
            double rise = valB - valC;
            if (params.killNoRise && rise < params.minRise) {
                continue;
            }

            GrayImage.WindowStats spot = a.stats(bx, by, bx + bw, by + bh);
            if (spot == null) {
                continue;
            }
            double peak = spot.max;
            double sharpness = peak / (spot.mean + 1e-6);
            double contrast = peak - spot.median;

            if (params.killFlat) {
                if (sharpness < params.sharpness || sharpness > params.maxSharpness
                        || contrast < params.contrast) {
                    continue;
                }
            }

            double extent = area / (bw * bh);
            double aspect = (double) bw / bh;
            if (area > SOLID_AREA && extent > SOLID_EXTENT) {
                continue;
            }
            if (aspect > MAX_ASPECT || aspect < MIN_ASPECT) {
                continue;
            }

            if (params.killDipole) {
                GrayImage.WindowStats around = a.stats(bx - DIPOLE_PAD, by - DIPOLE_PAD,
                        bx + bw + DIPOLE_PAD, by + bh + DIPOLE_PAD);
                if (around != null && around.min < DIPOLE_FLOOR) {
                    continue;
                }
            }

            Candidate cand = new Candidate(cx, cy);
            cand.setArea(area);
            cand.setSharp(sharpness);
            cand.setContrast(contrast);
            cand.setPeak(peak);
            cand.setRise(rise);
            cand.setValB(valB);
            cand.setValC(valC);
            out.add(cand);
        }
        return out;
    }
}
