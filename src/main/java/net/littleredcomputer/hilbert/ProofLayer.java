package net.littleredcomputer.hilbert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All distinct proofs of a single length, in the order they were found.
 */
final class ProofLayer {
    private final int length;
    private final List<Proof> proofs = new ArrayList<>();
    private Set<List<String>> seen = new HashSet<>();

    ProofLayer(int length) {
        if (length < 1) throw new IllegalArgumentException("proof length must be positive");
        this.length = length;
    }

    int length() { return length; }

    /**
     * Accept p unless a proof with the same sequence of formulas is already present.
     * @return true if p was added
     */
    boolean add(Proof p) {
        if (p.length() != length) {
            throw new IllegalArgumentException("proof of length " + p.length() + " offered to layer " + length);
        }
        if (seen == null) throw new IllegalStateException("layer " + length + " is sealed");
        if (!seen.add(p.steps())) return false;
        proofs.add(p);
        return true;
    }

    // Drops the duplicate-detection set. Nothing may be added afterward.
    void seal() {
        seen = null;
    }

    boolean isSealed() { return seen == null; }

    List<Proof> proofs() { return Collections.unmodifiableList(proofs); }
    int size() { return proofs.size(); }
    boolean isEmpty() { return proofs.isEmpty(); }
}
