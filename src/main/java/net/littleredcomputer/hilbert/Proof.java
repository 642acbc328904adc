package net.littleredcomputer.hilbert;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A sequence of formulas, each with its justification. Proofs are immutable; a longer proof is
 * made by extending a shorter one with a single line. Only the formulas take part in equality,
 * so two derivations of the same sequence by different means are the same proof.
 */
public final class Proof {
    private final ImmutableList<String> steps;
    private final ImmutableList<Justification> justifications;

    private Proof(ImmutableList<String> steps, ImmutableList<Justification> justifications) {
        this.steps = steps;
        this.justifications = justifications;
    }

    static Proof of(String formula, Justification justification) {
        return new Proof(ImmutableList.of(formula), ImmutableList.of(justification));
    }

    Proof extend(String formula, Justification justification) {
        return new Proof(
                ImmutableList.<String>builderWithExpectedSize(steps.size() + 1).addAll(steps).add(formula).build(),
                ImmutableList.<Justification>builderWithExpectedSize(steps.size() + 1).addAll(justifications).add(justification).build());
    }

    public List<String> steps() { return steps; }
    public List<Justification> justifications() { return justifications; }
    public int length() { return steps.size(); }
    public String step(int i) { return steps.get(i); }

    /** @return the formula this proof proves, i.e. its last line */
    public String theorem() { return steps.get(steps.size() - 1); }

    /** @return total length of all formulas; used only to rank proofs of the same theorem */
    public int complexity() {
        int c = 0;
        for (String s : steps) c += s.length();
        return c;
    }

    public boolean usesModusPonens() {
        return justifications.stream().anyMatch(Justification::isModusPonens);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proof)) return false;
        return steps.equals(((Proof) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
