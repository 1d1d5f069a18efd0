package com.tessera.core.grid;

import com.tessera.core.model.PatternInfo;
import com.tessera.core.model.PatternKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PatternParserTest {

    @Test
    void parsesSimplePatternsCaseInsensitively() {
        assertEquals(PatternKind.SQUARE, PatternParser.parse("Square").kind());
        assertEquals(PatternKind.LANDSCAPE_ONLY, PatternParser.parse("LANDSCAPE").kind());
        assertEquals(PatternKind.PORTRAIT_ONLY, PatternParser.parse(" portrait ").kind());
    }

    @Test
    void parsesParquetRatio() {
        assertEquals(PatternInfo.parquet(2, 1), PatternParser.parse("Parquet 2L 1P"));
        assertEquals(PatternInfo.parquet(3, 4), PatternParser.parse("parquet 3l4p"));
    }

    @Test
    void bareParquetIsOneToOne() {
        assertEquals(PatternInfo.parquet(1, 1), PatternParser.parse("Parquet"));
        assertEquals(PatternInfo.parquet(1, 1), PatternParser.parse("Parquet 0L 2P"));
    }

    @Test
    void unknownDescriptorFallsBackToSquare() {
        assertEquals(PatternInfo.square(), PatternParser.parse("Herringbone"));
        assertEquals(PatternInfo.square(), PatternParser.parse(null));
    }
}
