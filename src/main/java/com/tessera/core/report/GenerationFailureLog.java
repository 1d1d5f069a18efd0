package com.tessera.core.report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Appends failed generation runs to a CSV in the build output directory so they can be
 * reviewed after the fact.
 */
public final class GenerationFailureLog {

    private static final Path DEFAULT_FILE = Paths.get("target", "mosaic-generation-errors.csv");
    private static final String HEADER = "timestamp,stage,primary_image,photo_count,exception_type,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private final Path logFile;

    public GenerationFailureLog() {
        this(DEFAULT_FILE);
    }

    public GenerationFailureLog(Path logFile) {
        this.logFile = logFile;
    }

    public Path logFile() {
        return logFile;
    }

    public void logFailure(String stage, Path primaryImage, int photoCount, Throwable exception) {
        String message = exception == null ? "" : exception.getMessage();
        String[] columns = {
            TIMESTAMP_FORMAT.format(Instant.now()),
            stage == null ? "" : stage,
            primaryImage == null ? "" : primaryImage.toString(),
            Integer.toString(photoCount),
            exception == null ? "" : exception.getClass().getName(),
            message == null ? "" : message
        };
        writeRow(columns);
    }

    private void writeRow(String[] columns) {
        synchronized (GenerationFailureLog.class) {
            try {
                if (logFile.getParent() != null) {
                    Files.createDirectories(logFile.getParent());
                }
                boolean fileExists = Files.exists(logFile);
                try (BufferedWriter writer = Files.newBufferedWriter(
                    logFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                )) {
                    if (!fileExists) {
                        writer.write(HEADER);
                        writer.newLine();
                    }
                    writer.write(toCsv(columns));
                    writer.newLine();
                }
            } catch (IOException ioEx) {
                System.err.println("Failed to write generation failure log: " + ioEx.getMessage());
            }
        }
    }

    static String toCsv(String[] columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(columns[i]));
        }
        return sb.toString();
    }

    private static String escape(String value) {
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        return needsQuotes ? "\"" + escaped + "\"" : escaped;
    }
}
