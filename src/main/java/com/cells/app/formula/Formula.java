package com.cells.app.formula;

import com.cells.app.exceptions.MissingDependencyException;
import com.cells.app.models.CellKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed cell formula. A tree of numeric literals, cell references,
 * summations and products, produced by {@link FormulaParser}.
 */
public abstract class Formula {

    /**
     * Reduces this formula to a number using the values already known in
     * the current recalculation pass.
     *
     * @param values numeric cell values resolved so far
     * @return the computed value; division by zero follows IEEE semantics
     * @throws MissingDependencyException if a referenced cell has no value yet
     */
    public abstract double evaluate(Map<CellKey, Double> values) throws MissingDependencyException;

    /**
     * A numeric literal.
     */
    public static final class Value extends Formula {
        private final double value;

        public Value(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public double evaluate(Map<CellKey, Double> values) {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Value && Double.compare(((Value) o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * A reference to another cell's value.
     */
    public static final class Reference extends Formula {
        private final CellKey key;

        public Reference(CellKey key) {
            this.key = Objects.requireNonNull(key, "key");
        }

        public CellKey getKey() {
            return key;
        }

        @Override
        public double evaluate(Map<CellKey, Double> values) throws MissingDependencyException {
            Double value = values.get(key);
            if (value == null) {
                throw new MissingDependencyException(key);
            }
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Reference && ((Reference) o).key.equals(key);
        }

        @Override
        public int hashCode() {
            return key.hashCode();
        }

        @Override
        public String toString() {
            return key.toString();
        }
    }

    /**
     * Terms added left to right starting from 0; inverted terms are subtracted.
     */
    public static final class Summation extends Formula {
        private final List<Term> terms;

        public Summation(List<Term> terms) {
            this.terms = checkTerms(terms);
        }

        public List<Term> getTerms() {
            return terms;
        }

        @Override
        public double evaluate(Map<CellKey, Double> values) throws MissingDependencyException {
            double sum = 0.0;
            for (Term term : terms) {
                double x = term.getFormula().evaluate(values);
                if (term.isInverted()) {
                    sum -= x;
                } else {
                    sum += x;
                }
            }
            return sum;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Summation && ((Summation) o).terms.equals(terms);
        }

        @Override
        public int hashCode() {
            return 31 + terms.hashCode();
        }

        @Override
        public String toString() {
            return render(terms, '+', '-');
        }
    }

    /**
     * Terms multiplied left to right starting from 1; inverted terms divide.
     */
    public static final class Product extends Formula {
        private final List<Term> terms;

        public Product(List<Term> terms) {
            this.terms = checkTerms(terms);
        }

        public List<Term> getTerms() {
            return terms;
        }

        @Override
        public double evaluate(Map<CellKey, Double> values) throws MissingDependencyException {
            double product = 1.0;
            for (Term term : terms) {
                double x = term.getFormula().evaluate(values);
                if (term.isInverted()) {
                    product /= x;
                } else {
                    product *= x;
                }
            }
            return product;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Product && ((Product) o).terms.equals(terms);
        }

        @Override
        public int hashCode() {
            return 37 + terms.hashCode();
        }

        @Override
        public String toString() {
            return render(terms, '*', '/');
        }
    }

    private static List<Term> checkTerms(List<Term> terms) {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("at least one term is required");
        }
        return Collections.unmodifiableList(new ArrayList<>(terms));
    }

    private static String render(List<Term> terms, char op, char invertedOp) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < terms.size(); i++) {
            Term term = terms.get(i);
            if (i > 0 || term.isInverted()) {
                sb.append(term.isInverted() ? invertedOp : op);
            }
            sb.append(term.getFormula());
        }
        return sb.append(')').toString();
    }
}
