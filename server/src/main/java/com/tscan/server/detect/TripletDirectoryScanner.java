package com.tscan.server.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Groups the images of a directory into triplets. A file named
 * {@code <stem>a.png}, {@code <stem>b.png} or {@code <stem>c.png} (also jpg/jpeg)
 * contributes the a/b/c frame of group {@code <stem>}.
 */
public class TripletDirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(TripletDirectoryScanner.class);

    private final Map<String, TripletPaths> complete = new TreeMap<>();
    private final List<String> incomplete = new ArrayList<>();

    public static TripletDirectoryScanner scan(Path dir) throws IOException {
        TripletDirectoryScanner scanner = new TripletDirectoryScanner();
        Map<String, Map<Character, Path>> byStem = new TreeMap<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                String fileName = file.getFileName().toString();
                String lower = fileName.toLowerCase(Locale.ROOT);
                if (!(lower.endsWith(".png") || lower.endsWith(".jpg") || lower.endsWith(".jpeg"))) {
                    return;
                }
                String base = fileName.substring(0, fileName.lastIndexOf('.'));
                if (base.length() < 2) {
                    return;
                }
                char suffix = Character.toLowerCase(base.charAt(base.length() - 1));
                if (suffix != 'a' && suffix != 'b' && suffix != 'c') {
                    return;
                }
                String stem = base.substring(0, base.length() - 1);
                byStem.computeIfAbsent(stem, k -> new HashMap<>()).put(suffix, file);
            });
        }

        for (Map.Entry<String, Map<Character, Path>> e : byStem.entrySet()) {
            Map<Character, Path> frames = e.getValue();
            List<Character> missing = new ArrayList<>();
            for (char k : new char[] { 'a', 'b', 'c' }) {
                if (!frames.containsKey(k)) {
                    missing.add(k);
                }
            }
            if (missing.isEmpty()) {
                scanner.complete.put(e.getKey(),
                        new TripletPaths(frames.get('a'), frames.get('b'), frames.get('c')));
            } else {
                scanner.incomplete.add(e.getKey() + ": missing " + missing);
            }
        }

        if (!scanner.incomplete.isEmpty()) {
            logger.warn("{} incomplete groups in {} will be skipped", scanner.incomplete.size(), dir);
            for (String msg : scanner.incomplete.subList(0, Math.min(20, scanner.incomplete.size()))) {
                logger.warn("  {}", msg);
            }
        }
        logger.info("Found {} complete triplets in {}", scanner.complete.size(), dir);
        return scanner;
    }

    public Map<String, TripletPaths> getCompleteGroups() {
        return complete;
    }

    public List<String> getIncompleteGroups() {
        return incomplete;
    }
}
