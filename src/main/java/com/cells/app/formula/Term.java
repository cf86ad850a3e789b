package com.cells.app.formula;

import java.util.Objects;

/**
 * One operand of a {@link Formula.Summation} or {@link Formula.Product}.
 * An inverted term is subtracted (in a summation) or divides (in a product).
 */
public final class Term {
    private final Formula formula;
    private final boolean inverted;

    public Term(Formula formula, boolean inverted) {
        this.formula = Objects.requireNonNull(formula, "formula");
        this.inverted = inverted;
    }

    public static Term of(Formula formula) {
        return new Term(formula, false);
    }

    public static Term inverted(Formula formula) {
        return new Term(formula, true);
    }

    public Formula getFormula() {
        return formula;
    }

    public boolean isInverted() {
        return inverted;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Term)) {
            return false;
        }
        Term other = (Term) o;
        return inverted == other.inverted && formula.equals(other.formula);
    }

    @Override
    public int hashCode() {
        return formula.hashCode() * 2 + (inverted ? 1 : 0);
    }
}
