package com.cells.app.models;

import com.cells.app.exceptions.FormulaParseException;
import com.cells.app.exceptions.MissingDependencyException;
import com.cells.app.formula.Formula;
import com.cells.app.formula.FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Represents a single grid cell.
 * Stores:
 * - input (the raw text as typed, "" when empty)
 * - formula (only when the input starts with '=' and parses)
 * - parseError flag for input that starts with '=' but doesn't parse
 * - referenceError flag set by the last recalculation pass
 * - display (the last computed text; falls back to input when empty)
 */
public class Cell {

    public static final String BAD_FORMULA = "BAD FORMULA";
    public static final String REFERENCE_ERROR = "Ref error";

    private static final Logger logger = LoggerFactory.getLogger(Cell.class);

    private String input = "";
    private Formula formula;
    private boolean parseError;
    private boolean referenceError;
    private String display = "";

    public Cell() {
    }

    public Cell(String input) {
        update(input);
    }

    /**
     * Replaces the input and re-parses it. Does not touch any other cell;
     * the grid has to be recalculated afterwards.
     */
    public void update(String newInput) {
        String text = newInput == null ? "" : newInput;
        Formula parsed = null;
        boolean failed = false;
        try {
            parsed = FormulaParser.parse(text).orElse(null);
        } catch (FormulaParseException ex) {
            logger.debug("Parse error in '{}': {}", text, ex.getMessage());
            failed = true;
        }
        input = text;
        formula = parsed;
        parseError = failed;
        referenceError = false;
        display = failed ? BAD_FORMULA : "";
    }

    /**
     * Computes this cell's numeric value against the values known so far.
     *
     * @return the value, NaN for a parse error, or empty for non-numeric text
     * @throws MissingDependencyException if the formula references a cell with no value yet
     */
    public OptionalDouble tryEvaluate(Map<CellKey, Double> values) throws MissingDependencyException {
        if (parseError) {
            // shown as BAD FORMULA here, but dependents see NaN
            return OptionalDouble.of(Double.NaN);
        }
        if (formula != null) {
            double value = formula.evaluate(values);
            display = formatValue(value);
            return OptionalDouble.of(value);
        }
        return FormulaParser.parseNumber(input);
    }

    public void markReferenceError() {
        referenceError = true;
        display = REFERENCE_ERROR;
    }

    public void clearReferenceError() {
        if (referenceError) {
            referenceError = false;
            display = "";
        }
    }

    public String getInput() {
        return input;
    }

    public Formula getFormula() {
        return formula;
    }

    public boolean isParseError() {
        return parseError;
    }

    public boolean isReferenceError() {
        return referenceError;
    }

    public boolean isError() {
        return parseError || referenceError;
    }

    public String getDisplay() {
        return display.isEmpty() ? input : display;
    }

    public CellSnapshot toSnapshot() {
        return new CellSnapshot(input, getDisplay(), isError());
    }

    /**
     * Renders a computed value: integral values without a fraction,
     * NaN and infinities by name.
     */
    static String formatValue(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        double magnitude = Math.abs(value);
        if (magnitude >= 1e15 || (magnitude != 0 && magnitude < 1e-6)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
