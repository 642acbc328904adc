package net.littleredcomputer.hilbert;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The reason a line of a proof may be written down: either it is an instance of an axiom schema,
 * or it follows from two earlier lines by Modus Ponens.
 */
public abstract class Justification {
    private static final Joiner.MapJoiner assignmentJoiner = Joiner.on(", ").withKeyValueSeparator("=");

    private Justification() {}

    public abstract boolean isModusPonens();

    static Justification axiom(AxiomSchema schema, Map<String, String> assignment) {
        return new Axiom(schema, assignment);
    }

    /**
     * @param antecedentLine 1-based line holding p
     * @param implicationLine 1-based line holding (p → q)
     */
    static Justification modusPonens(int antecedentLine, int implicationLine) {
        if (antecedentLine < 1 || implicationLine < 1) throw new IllegalArgumentException("proof lines are numbered from 1");
        if (antecedentLine == implicationLine) throw new IllegalArgumentException("Modus Ponens needs two distinct lines");
        return new ModusPonensStep(antecedentLine, implicationLine);
    }

    public static final class Axiom extends Justification {
        private final AxiomSchema schema;
        private final ImmutableMap<String, String> assignment;

        private Axiom(AxiomSchema schema, Map<String, String> assignment) {
            this.schema = schema;
            this.assignment = ImmutableMap.copyOf(assignment);
        }

        public AxiomSchema schema() { return schema; }
        public Map<String, String> assignment() { return assignment; }

        @Override public boolean isModusPonens() { return false; }

        @Override
        public String toString() {
            return schema.name() + " [" + assignmentJoiner.join(assignment) + "]";
        }
    }

    public static final class ModusPonensStep extends Justification {
        private final int antecedentLine;
        private final int implicationLine;

        private ModusPonensStep(int antecedentLine, int implicationLine) {
            this.antecedentLine = antecedentLine;
            this.implicationLine = implicationLine;
        }

        public int antecedentLine() { return antecedentLine; }
        public int implicationLine() { return implicationLine; }

        @Override public boolean isModusPonens() { return true; }

        @Override
        public String toString() {
            return "MP (" + antecedentLine + "," + implicationLine + ")";
        }
    }
}
