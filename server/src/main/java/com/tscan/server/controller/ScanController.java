package com.tscan.server.controller;

import com.tscan.db.CacheRecord;
import com.tscan.server.detect.DetectionParameters;
import com.tscan.server.infer.ClassifierException;
import com.tscan.server.service.ScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

@RestController
public class ScanController {

    private static final Logger logger = LoggerFactory.getLogger(ScanController.class);
    private final ScanService scanService;

    public ScanController(ScanService scanService) {
        this.scanService = scanService;
    }

    public static class ScanRequest {
        public String directory;
    }

    public static class StatusRequest {
        public String status;
    }

    @PostMapping("/scan")
    public ResponseEntity<?> startScan(@RequestBody ScanRequest request) {
        if (request.directory == null || request.directory.isEmpty()) {
            return ResponseEntity.badRequest().body("Missing directory.");
        }
        if (scanService.isRunning()) {
            return ResponseEntity.status(409).body("A scan is already running.");
        }
        try {
            return ResponseEntity.accepted().body(scanService.startScan(request.directory));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(409).body(e.getMessage());
        } catch (ClassifierException e) {
            logger.error("Classifier unavailable", e);
            return ResponseEntity.status(503).body("Classifier unavailable: " + e.getMessage());
        } catch (IOException e) {
            return ResponseEntity.badRequest().body("Cannot read directory: " + e.getMessage());
        }
    }

    @GetMapping("/scan/status")
    public ResponseEntity<?> status() {
        return ResponseEntity.ok(scanService.getStatus());
    }

    @PostMapping("/scan/stop")
    public ResponseEntity<?> stop() {
        return ResponseEntity.ok(Map.of("stopped", scanService.stop()));
    }

    @GetMapping("/parameters")
    public ResponseEntity<?> parameters() {
        return ResponseEntity.ok(scanService.getParameters());
    }

    @PutMapping("/parameters")
    public ResponseEntity<?> updateParameters(@RequestBody DetectionParameters parameters) {
        scanService.updateParameters(parameters);
        return ResponseEntity.ok(scanService.getParameters());
    }

    @GetMapping("/records")
    public ResponseEntity<?> listRecords() {
        return ResponseEntity.ok(scanService.listRecords());
    }

    @GetMapping("/records/{stem}")
    public ResponseEntity<?> getRecord(@PathVariable String stem) {
        Optional<CacheRecord> record = scanService.getRecord(stem);
        if (record.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(record.get());
    }

    @PutMapping("/records/{stem}/status")
    public ResponseEntity<?> markStatus(@PathVariable String stem, @RequestBody StatusRequest request) {
        if (request.status == null || request.status.isEmpty()) {
            return ResponseEntity.badRequest().body("Missing status.");
        }
        if (!scanService.markStatus(stem, request.status)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/records/{stem}")
    public ResponseEntity<?> delete(@PathVariable String stem) {
        if (!scanService.delete(stem)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/records")
    public ResponseEntity<?> clearAll() {
        logger.info("Clearing all records");
        scanService.clearAll();
        return ResponseEntity.noContent().build();
    }
}
