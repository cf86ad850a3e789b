package com.cells.app.models;

import com.cells.app.exceptions.MissingDependencyException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class CellTest {

    private static final Map<CellKey, Double> NO_VALUES = Collections.emptyMap();

    @Test
    void testNewCellIsBlank() throws Exception {
        Cell cell = new Cell();
        assertEquals("", cell.getInput());
        assertEquals("", cell.getDisplay());
        assertFalse(cell.isError());
        assertFalse(cell.tryEvaluate(NO_VALUES).isPresent());
    }

    @Test
    void testPlainText() throws Exception {
        Cell cell = new Cell("Some values");
        assertNull(cell.getFormula());
        assertFalse(cell.tryEvaluate(NO_VALUES).isPresent());
        assertEquals("Some values", cell.getDisplay());
    }

    @Test
    void testPlainNumberKeepsInputAsDisplay() throws Exception {
        Cell cell = new Cell("3.50");
        assertEquals(OptionalDouble.of(3.5), cell.tryEvaluate(NO_VALUES));
        assertEquals("3.50", cell.getDisplay());
    }

    @Test
    void testFormulaUpdatesDisplay() throws Exception {
        Cell cell = new Cell("=A1*2");
        assertNotNull(cell.getFormula());
        // nothing computed yet
        assertEquals("=A1*2", cell.getDisplay());

        OptionalDouble value = cell.tryEvaluate(Map.of(CellKey.parse("A1"), 6.0));
        assertEquals(OptionalDouble.of(12.0), value);
        assertEquals("12", cell.getDisplay());
        assertEquals("=A1*2", cell.getInput());
    }

    @Test
    void testFormulaWaitsForDependency() {
        Cell cell = new Cell("=A1*2");
        MissingDependencyException ex = assertThrows(MissingDependencyException.class,
                () -> cell.tryEvaluate(NO_VALUES));
        assertEquals(CellKey.parse("A1"), ex.getKey());
    }

    @Test
    void testParseErrorIsNaN() throws Exception {
        Cell cell = new Cell("=1+");
        assertTrue(cell.isParseError());
        assertTrue(cell.isError());
        assertNull(cell.getFormula());
        assertEquals(Cell.BAD_FORMULA, cell.getDisplay());

        OptionalDouble value = cell.tryEvaluate(NO_VALUES);
        assertTrue(value.isPresent());
        assertTrue(Double.isNaN(value.getAsDouble()));
        assertEquals(Cell.BAD_FORMULA, cell.getDisplay());
    }

    @Test
    void testUpdateReplacesState() throws Exception {
        Cell cell = new Cell("=2*3");
        cell.tryEvaluate(NO_VALUES);
        assertEquals("6", cell.getDisplay());

        // a stale computed value must not survive an edit
        cell.update("hello");
        assertNull(cell.getFormula());
        assertEquals("hello", cell.getDisplay());

        cell.update("=(");
        assertTrue(cell.isParseError());

        cell.update("=1");
        assertFalse(cell.isParseError());
        assertEquals("=1", cell.getDisplay());

        cell.update(null);
        assertEquals("", cell.getInput());
    }

    /**
     * A formula nested past the parser limit lands in the BAD FORMULA state,
     * replacing whatever the cell held before.
     */
    @Test
    void testDeeplyNestedFormulaIsBadFormula() throws Exception {
        Cell cell = new Cell("=A9");
        cell.markReferenceError();

        String text = "=" + "(".repeat(20000) + "1" + ")".repeat(20000);
        cell.update(text);

        assertEquals(text, cell.getInput());
        assertTrue(cell.isParseError());
        assertFalse(cell.isReferenceError());
        assertTrue(cell.isError());
        assertNull(cell.getFormula());
        assertEquals(Cell.BAD_FORMULA, cell.getDisplay());
        assertTrue(Double.isNaN(cell.tryEvaluate(NO_VALUES).getAsDouble()));
    }

    @Test
    void testReferenceErrorMarker() {
        Cell cell = new Cell("=A1");
        cell.markReferenceError();
        assertTrue(cell.isReferenceError());
        assertTrue(cell.isError());
        assertEquals(Cell.REFERENCE_ERROR, cell.getDisplay());

        cell.clearReferenceError();
        assertFalse(cell.isError());
        assertEquals("=A1", cell.getDisplay());
    }

    @Test
    void testSnapshot() {
        CellSnapshot snapshot = new Cell("=1+").toSnapshot();
        assertEquals("=1+", snapshot.getInput());
        assertEquals(Cell.BAD_FORMULA, snapshot.getDisplay());
        assertTrue(snapshot.isError());
        assertFalse(snapshot.isBlank());
        assertTrue(new Cell().toSnapshot().isBlank());
    }

    @Test
    void testFormatValue() {
        assertEquals("12", Cell.formatValue(12.0));
        assertEquals("4.5", Cell.formatValue(4.5));
        assertEquals("-0.25", Cell.formatValue(-0.25));
        assertEquals("0", Cell.formatValue(0.0));
        assertEquals("0", Cell.formatValue(-0.0));
        assertEquals("0.30000000000000004", Cell.formatValue(0.1 + 0.2));
        assertEquals("NaN", Cell.formatValue(Double.NaN));
        assertEquals("Infinity", Cell.formatValue(Double.POSITIVE_INFINITY));
        assertEquals("-Infinity", Cell.formatValue(Double.NEGATIVE_INFINITY));
        assertEquals("1.0E20", Cell.formatValue(1e20));
    }
}
