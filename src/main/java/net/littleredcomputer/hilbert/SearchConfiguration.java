package net.littleredcomputer.hilbert;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed inputs of a proof search: how long proofs may grow, which ground formulas may be
 * substituted for schema variables, and which schemas are available.
 * <p>
 * Layer sizes grow combinatorially in all three: layer k holds at least |instances|^k proofs.
 * The nine standard basis formulas give 891 axiom instances, so only lengths up to about 2
 * finish with them; the two-atom basis reaches length 4.
 */
public final class SearchConfiguration {
    private static final Logger log = LogManager.getFormatterLogger(SearchConfiguration.class);

    public static final int DEFAULT_MAX_LENGTH = 5;
    static final int FEASIBLE_BASIS_SIZE = 20;
    static final int FEASIBLE_MAX_LENGTH = 6;

    public static final ImmutableList<String> STANDARD_BASIS = ImmutableList.of(
            "a", "b",
            "(¬a)", "(¬b)",
            "(a → a)",
            "(a → b)",
            "(¬(¬a))",
            "((¬a) → (¬b))",
            "((¬b) → (¬a))");

    public static final ImmutableList<String> SMALL_BASIS = ImmutableList.of(
            "a", "b",
            "(¬a)",
            "(a → a)",
            "(a → b)");

    private final int maxLength;
    private final ImmutableList<String> basis;
    private final ImmutableList<AxiomSchema> schemas;

    public SearchConfiguration(int maxLength, List<String> basis) {
        this(maxLength, basis, AxiomSchema.STANDARD);
    }

    public SearchConfiguration(int maxLength, List<String> basis, List<AxiomSchema> schemas) {
        if (maxLength < 1) throw new IllegalArgumentException("max length must be at least 1");
        if (basis.isEmpty()) throw new IllegalArgumentException("basis must contain at least one formula");
        if (schemas.isEmpty()) throw new IllegalArgumentException("at least one axiom schema is required");
        Set<String> variables = new HashSet<>();
        schemas.forEach(s -> variables.addAll(s.variables()));
        for (String f : basis) {
            if (f.trim().isEmpty()) throw new IllegalArgumentException("blank formula in basis");
            for (String v : variables) {
                if (Substitution.containsVariable(f, v)) {
                    throw new IllegalArgumentException("basis formula " + f + " is not ground: contains " + v);
                }
            }
        }
        if (basis.size() > FEASIBLE_BASIS_SIZE) {
            log.warn("basis of %d formulas exceeds %d; the search is unlikely to finish", basis.size(), FEASIBLE_BASIS_SIZE);
        }
        if (maxLength > FEASIBLE_MAX_LENGTH) {
            log.warn("max length %d exceeds %d; the search is unlikely to fit in memory", maxLength, FEASIBLE_MAX_LENGTH);
        }
        this.maxLength = maxLength;
        this.basis = ImmutableList.copyOf(basis);
        this.schemas = ImmutableList.copyOf(schemas);
    }

    public static SearchConfiguration standard() {
        return new SearchConfiguration(DEFAULT_MAX_LENGTH, STANDARD_BASIS);
    }

    public int maxLength() { return maxLength; }
    public List<String> basis() { return basis; }
    public List<AxiomSchema> schemas() { return schemas; }
}
