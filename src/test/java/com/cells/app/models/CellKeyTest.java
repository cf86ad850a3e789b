package com.cells.app.models;

import com.cells.app.exceptions.InvalidCellKeyException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellKeyTest {

    @Test
    void testParseNormalizesColumn() {
        CellKey key = CellKey.parse("c12");
        assertEquals(ColumnKey.of('C'), key.getColumn());
        assertEquals(12, key.getRow());
        assertEquals("C12", key.toString());
        assertEquals(CellKey.parse("C12"), key);
        assertEquals(CellKey.parse("C12").hashCode(), key.hashCode());
    }

    @Test
    void testBounds() {
        assertEquals(1, CellKey.parse("A1").getRow());
        assertEquals(CellKey.MAX_ROW, CellKey.parse("Z99").getRow());
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A0"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A100"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A1000"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.of(ColumnKey.of('A'), -1));
    }

    @Test
    void testLeadingZerosInRow() {
        assertEquals(CellKey.parse("A7"), CellKey.parse("A007"));
        assertEquals(CellKey.parse("A7"), CellKey.parse("A0007"));
        assertEquals(CellKey.parse("C12"), CellKey.parse("c000000012"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A0000"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A00100"));
        assertEquals(-1, CellKey.parseRow("1000"));
        assertEquals(0, CellKey.parseRow("000"));
    }

    @Test
    void testMalformedKeys() {
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse(null));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("1A"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("AA1"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A-1"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("A 1"));
        assertThrows(InvalidCellKeyException.class, () -> CellKey.parse("@1"));
    }

    @Test
    void testOrderingIsColumnThenRow() {
        List<CellKey> keys = new ArrayList<>(Arrays.asList(
                CellKey.parse("B1"), CellKey.parse("A10"), CellKey.parse("A2"), CellKey.parse("A1")));
        Collections.sort(keys);
        assertEquals(Arrays.asList(
                CellKey.parse("A1"), CellKey.parse("A2"), CellKey.parse("A10"), CellKey.parse("B1")), keys);
    }

    @Test
    void testColumnKeys() {
        assertEquals(26, ColumnKey.all().size());
        assertEquals("A", ColumnKey.all().get(0).toString());
        assertEquals("Z", ColumnKey.all().get(25).toString());
        assertSame(ColumnKey.of('q'), ColumnKey.of('Q'));
        assertEquals(16, ColumnKey.of('Q').getIndex());
        assertFalse(ColumnKey.tryOf('[').isPresent());
        assertFalse(ColumnKey.tryOf('`').isPresent());

        // labels are case-exact
        assertSame(ColumnKey.of('C'), ColumnKey.fromLabel("C"));
        assertThrows(InvalidCellKeyException.class, () -> ColumnKey.fromLabel("c"));
        assertThrows(InvalidCellKeyException.class, () -> ColumnKey.fromLabel("AB"));
    }
}
