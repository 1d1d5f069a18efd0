package com.tessera.core.report;

import com.tessera.core.model.CellPhotoCache;
import com.tessera.core.model.CellUsage;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the {@code Name,UseCount,X,Y} usage CSV: one row per placement, and a single row with
 * empty coordinates for a photo that was never placed.
 */
public final class UsageReportWriter {

    static final String HEADER = "Name,UseCount,X,Y";

    private UsageReportWriter() {
    }

    public static void write(Path target, List<CellPhotoCache> cache, List<CellUsage> usages) throws IOException {
        Map<Path, List<CellUsage>> byPhoto = new LinkedHashMap<>();
        for (CellUsage usage : usages) {
            byPhoto.computeIfAbsent(usage.path(), ignored -> new ArrayList<>()).add(usage);
        }

        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            for (CellPhotoCache item : cache) {
                String name = quote(fileName(item.path()));
                List<CellUsage> entries = byPhoto.get(item.path());
                if (entries == null || entries.isEmpty()) {
                    writer.write(name + "," + item.useCount() + ",,");
                    writer.newLine();
                    continue;
                }
                for (CellUsage entry : entries) {
                    writer.write(name + "," + item.useCount() + "," + entry.x() + "," + entry.y());
                    writer.newLine();
                }
            }
        }
    }

    static String quote(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
