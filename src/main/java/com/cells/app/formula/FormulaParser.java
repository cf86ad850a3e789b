package com.cells.app.formula;

import com.cells.app.exceptions.FormulaParseException;
import com.cells.app.models.CellKey;
import com.cells.app.models.ColumnKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for cell text.
 *
 * <pre>
 * cell       := formula | text
 * formula    := '=' summation
 * summation  := product (('+' | '-') product)*
 * product    := value (('*' | '/') value)*
 * value      := number | reference | '(' summation ')'
 * reference  := letter digits
 * </pre>
 *
 * Whitespace is allowed between tokens. A sign is only accepted as part of
 * a numeric literal; there is no unary minus on references or groups.
 */
public final class FormulaParser {

    public static final char FORMULA_MARKER = '=';

    /** Deepest allowed parenthesis nesting; keeps the recursion off the stack limit. */
    public static final int MAX_NESTING = 256;

    private static final Pattern NUMBER =
            Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private final String source;
    private final Matcher numberMatcher;
    private int pos;
    private int depth;

    private FormulaParser(String source, int start) {
        this.source = source;
        this.numberMatcher = NUMBER.matcher(source);
        this.pos = start;
    }

    /**
     * Parses raw cell text.
     *
     * @return the formula tree, or empty if the text is plain content
     * @throws FormulaParseException if the text starts with '=' but is not a valid formula
     */
    public static Optional<Formula> parse(String text) {
        if (text.isEmpty() || text.charAt(0) != FORMULA_MARKER) {
            return Optional.empty();
        }
        FormulaParser parser = new FormulaParser(text, 1);
        Formula formula = parser.parseSummation();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("Unexpected '" + parser.peek() + "'");
        }
        return Optional.of(formula);
    }

    /**
     * Reads plain cell content as a number, if the whole text is a numeric literal.
     */
    public static OptionalDouble parseNumber(String text) {
        if (NUMBER.matcher(text).matches()) {
            return OptionalDouble.of(Double.parseDouble(text));
        }
        return OptionalDouble.empty();
    }

    private Formula parseSummation() {
        List<Term> terms = new ArrayList<>();
        terms.add(Term.of(parseProduct()));
        while (true) {
            skipWhitespace();
            if (atEnd() || (peek() != '+' && peek() != '-')) {
                break;
            }
            boolean subtract = source.charAt(pos++) == '-';
            terms.add(new Term(parseProduct(), subtract));
        }
        return terms.size() == 1 ? terms.get(0).getFormula() : new Formula.Summation(terms);
    }

    private Formula parseProduct() {
        List<Term> terms = new ArrayList<>();
        terms.add(Term.of(parseValue()));
        while (true) {
            skipWhitespace();
            if (atEnd() || (peek() != '*' && peek() != '/')) {
                break;
            }
            boolean divide = source.charAt(pos++) == '/';
            terms.add(new Term(parseValue(), divide));
        }
        return terms.size() == 1 ? terms.get(0).getFormula() : new Formula.Product(terms);
    }

    private Formula parseValue() {
        skipWhitespace();
        if (atEnd()) {
            throw error("Expected a number, reference or '(' but found end of input");
        }
        char c = peek();
        if (c == '(') {
            if (depth == MAX_NESTING) {
                throw error("Formula nested too deeply");
            }
            pos++;
            depth++;
            Formula inner = parseSummation();
            depth--;
            skipWhitespace();
            if (atEnd() || peek() != ')') {
                throw error("Expected ')'");
            }
            pos++;
            return inner;
        }
        Optional<ColumnKey> column = ColumnKey.tryOf(c);
        if (column.isPresent()) {
            return parseReference(column.get());
        }
        numberMatcher.region(pos, source.length());
        if (numberMatcher.lookingAt()) {
            pos = numberMatcher.end();
            return new Formula.Value(Double.parseDouble(numberMatcher.group()));
        }
        throw error("Expected a number, reference or '(' but found '" + c + "'");
    }

    private Formula parseReference(ColumnKey column) {
        int start = pos;
        pos++;
        int digitsStart = pos;
        while (!atEnd() && peek() >= '0' && peek() <= '9') {
            pos++;
        }
        if (pos == digitsStart) {
            throw error("Expected a row number after column " + column);
        }
        String digits = source.substring(digitsStart, pos);
        int row = CellKey.parseRow(digits);
        if (!CellKey.isValidRow(row)) {
            pos = start;
            throw error("Row " + digits + " is outside 1.." + CellKey.MAX_ROW);
        }
        return new Formula.Reference(CellKey.of(column, row));
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private FormulaParseException error(String message) {
        return new FormulaParseException(message, pos);
    }
}
