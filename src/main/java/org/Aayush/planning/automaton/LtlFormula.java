package org.Aayush.planning.automaton;

import java.util.Objects;
import java.util.Set;

/**
 * Abstract syntax of propositional linear temporal logic.
 * <p>
 * Derived operators (implication, eventually, always, weak until) are expanded by the
 * factories below into the core connectives, so translation only handles the eight node
 * types declared here. Nodes are immutable value types with structural equality.
 * </p>
 */
public interface LtlFormula {

    Constant TRUE = new Constant(true);
    Constant FALSE = new Constant(false);

    /**
     * @return equivalent formula with negations pushed down to atoms.
     */
    LtlFormula nnf();

    /**
     * @return negation normal form of {@code !this}.
     */
    LtlFormula negatedNnf();

    /**
     * Adds every atomic proposition name to {@code sink}.
     */
    void collectAtoms(Set<String> sink);

    static LtlFormula atom(String name) {
        return new Atom(name);
    }

    static LtlFormula not(LtlFormula operand) {
        return new Not(operand);
    }

    static LtlFormula and(LtlFormula left, LtlFormula right) {
        return new And(left, right);
    }

    static LtlFormula or(LtlFormula left, LtlFormula right) {
        return new Or(left, right);
    }

    static LtlFormula implies(LtlFormula left, LtlFormula right) {
        return new Or(new Not(left), right);
    }

    static LtlFormula iff(LtlFormula left, LtlFormula right) {
        return new Or(new And(left, right), new And(new Not(left), new Not(right)));
    }

    static LtlFormula next(LtlFormula operand) {
        return new Next(operand);
    }

    static LtlFormula until(LtlFormula left, LtlFormula right) {
        return new Until(left, right);
    }

    static LtlFormula release(LtlFormula left, LtlFormula right) {
        return new Release(left, right);
    }

    static LtlFormula eventually(LtlFormula operand) {
        return new Until(TRUE, operand);
    }

    static LtlFormula always(LtlFormula operand) {
        return new Release(FALSE, operand);
    }

    /**
     * {@code a W b == b R (a || b)}.
     */
    static LtlFormula weakUntil(LtlFormula left, LtlFormula right) {
        return new Release(right, new Or(left, right));
    }

    /**
     * @return true for constants, atoms and negated atoms.
     */
    static boolean isLiteral(LtlFormula formula) {
        return formula instanceof Constant
                || formula instanceof Atom
                || (formula instanceof Not && ((Not) formula).operand() instanceof Atom);
    }

    record Constant(boolean value) implements LtlFormula {
        @Override
        public LtlFormula nnf() {
            return this;
        }

        @Override
        public LtlFormula negatedNnf() {
            return value ? FALSE : TRUE;
        }

        @Override
        public void collectAtoms(Set<String> sink) {
        }

        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }

    record Atom(String name) implements LtlFormula {
        public Atom {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public LtlFormula nnf() {
            return this;
        }

        @Override
        public LtlFormula negatedNnf() {
            return new Not(this);
        }

        @Override
        public void collectAtoms(Set<String> sink) {
            sink.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Not(LtlFormula operand) implements LtlFormula {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public LtlFormula nnf() {
            return operand.negatedNnf();
        }

        @Override
        public LtlFormula negatedNnf() {
            return operand.nnf();
        }

        @Override
        public void collectAtoms(Set<String> sink) {
            operand.collectAtoms(sink);
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    record And(LtlFormula left, LtlFormula right) implements LtlFormula {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LtlFormula nnf() {
            return new And(left.nnf(), right.nnf());
        }

        @Override
        public LtlFormula negatedNnf() {
            return new Or(left.negatedNnf(), right.negatedNnf());
        }

        @Override
        public void collectAtoms(Set<String> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public String toString() {
            return "(" + left + " && " + right + ")";
        }
    }

    record Or(LtlFormula left, LtlFormula right) implements LtlFormula {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LtlFormula nnf() {
            return new Or(left.nnf(), right.nnf());
        }

        @Override
        public LtlFormula negatedNnf() {
            return new And(left.negatedNnf(), right.negatedNnf());
        }

        @Override
        public void collectAtoms(Set<String> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public String toString() {
            return "(" + left + " || " + right + ")";
        }
    }

    record Next(LtlFormula operand) implements LtlFormula {
        public Next {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public LtlFormula nnf() {
            return new Next(operand.nnf());
        }

        @Override
        public LtlFormula negatedNnf() {
            return new Next(operand.negatedNnf());
        }

        @Override
        public void collectAtoms(Set<String> sink) {
            operand.collectAtoms(sink);
        }

        @Override
        public String toString() {
            return "X " + operand;
        }
    }

    record Until(LtlFormula left, LtlFormula right) implements LtlFormula {
        public Until {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LtlFormula nnf() {
            return new Until(left.nnf(), right.nnf());
        }

        @Override
        public LtlFormula negatedNnf() {
            return new Release(left.negatedNnf(), right.negatedNnf());
        }

        @Override
        public void collectAtoms(Set<String> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public String toString() {
            return "(" + left + " U " + right + ")";
        }
    }

    record Release(LtlFormula left, LtlFormula right) implements LtlFormula {
        public Release {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public LtlFormula nnf() {
            return new Release(left.nnf(), right.nnf());
        }

        @Override
        public LtlFormula negatedNnf() {
            return new Until(left.negatedNnf(), right.negatedNnf());
        }

        @Override
        public void collectAtoms(Set<String> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public String toString() {
            return "(" + left + " R " + right + ")";
        }
    }
}
