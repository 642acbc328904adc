// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.hilbert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selects one proof per theorem from the output of a search.
 */
public final class TheoremMinimizer {
    /** Proofs shorter than this are never reported. */
    public static final int MIN_REPORTED_LENGTH = 3;

    /** The order in which proofs are reported: fewer lines first, then by theorem text. */
    public static final Comparator<Proof> REPORT_ORDER =
            Comparator.comparingInt(Proof::length).thenComparing(Proof::theorem);

    private final Map<String, Proof> best;
    private final int modusPonensProofCount;

    private TheoremMinimizer(Map<String, Proof> best, int modusPonensProofCount) {
        this.best = Collections.unmodifiableMap(best);
        this.modusPonensProofCount = modusPonensProofCount;
    }

    /**
     * Among the proofs that use Modus Ponens at least once, keep for each theorem the proof of
     * least complexity, and among those the shortest. Proofs that tie on both keep whichever
     * came first.
     *
     * @param proofs candidates, in search order
     */
    public static TheoremMinimizer of(Iterator<Proof> proofs) {
        Map<String, Proof> best = new LinkedHashMap<>();
        int count = 0;
        while (proofs.hasNext()) {
            Proof p = proofs.next();
            if (!p.usesModusPonens()) continue;
            ++count;
            best.merge(p.theorem(), p, (incumbent, challenger) -> simpler(challenger, incumbent) ? challenger : incumbent);
        }
        return new TheoremMinimizer(best, count);
    }

    /**
     * Minimize the reportable proofs of a search: those of length at least
     * {@link #MIN_REPORTED_LENGTH}.
     */
    public static TheoremMinimizer of(SearchResult result) {
        return of(result.proofs(MIN_REPORTED_LENGTH, result.maxLength()).iterator());
    }

    static boolean simpler(Proof p, Proof q) {
        int pc = p.complexity(), qc = q.complexity();
        return pc < qc || (pc == qc && p.length() < q.length());
    }

    /** @return theorem to its simplest proof, in order of first discovery */
    public Map<String, Proof> bestProofs() { return best; }

    /** @return how many candidate proofs used Modus Ponens */
    public int modusPonensProofCount() { return modusPonensProofCount; }

    public int theoremCount() { return best.size(); }

    /** @return the best proofs in {@link #REPORT_ORDER} */
    public List<Proof> sorted() {
        List<Proof> ps = new ArrayList<>(best.values());
        ps.sort(REPORT_ORDER);
        return ps;
    }
}
