package net.littleredcomputer.hilbert;

import java.util.Optional;

final class ModusPonens {
    private ModusPonens() {}

    /**
     * Detach the consequent of an implication whose antecedent is p. The match is purely textual:
     * maybeImplication must read "(" + p + " → " + q + ")" for some nonempty q.
     *
     * @param p a formula already established
     * @param maybeImplication a formula that may be (p → q)
     * @return q, or empty if maybeImplication does not have that shape
     */
    static Optional<String> apply(String p, String maybeImplication) {
        final String prefix = "(" + p + " → ";
        if (!maybeImplication.startsWith(prefix) || !maybeImplication.endsWith(")")) return Optional.empty();
        if (maybeImplication.length() <= prefix.length() + 1) return Optional.empty();
        return Optional.of(maybeImplication.substring(prefix.length(), maybeImplication.length() - 1));
    }
}
