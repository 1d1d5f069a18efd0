package com.tessera.core.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationFailureLogTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsRowsUnderASingleHeader() throws IOException {
        GenerationFailureLog log = new GenerationFailureLog(tempDir.resolve("logs/errors.csv"));

        log.logFailure("Creating Mosaic", Path.of("primary.jpg"), 12, new IllegalStateException("boom"));
        log.logFailure("Saving Results", null, 0, new IOException("disk full, retry"));

        List<String> lines = Files.readAllLines(log.logFile());
        assertEquals(3, lines.size());
        assertEquals("timestamp,stage,primary_image,photo_count,exception_type,message", lines.get(0));
        assertTrue(lines.get(1).endsWith(",Creating Mosaic,primary.jpg,12,java.lang.IllegalStateException,boom"));
        assertTrue(lines.get(2).endsWith(",Saving Results,,0,java.io.IOException,\"disk full, retry\""));
    }

    @Test
    void quotesOnlyWhatNeedsQuoting() {
        assertEquals("plain,\"a,b\",\"say \"\"hi\"\"\"",
            GenerationFailureLog.toCsv(new String[] {"plain", "a,b", "say \"hi\""}));
    }
}
