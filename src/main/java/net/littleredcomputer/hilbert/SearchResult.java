package net.littleredcomputer.hilbert;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * The layers produced by a {@link ProofSearch}. Layer k holds the proofs of length k; layers
 * beyond the point where the search stopped are absent.
 */
public final class SearchResult {
    private final int maxLength;
    private final ImmutableList<List<Proof>> layers;
    private final long totalProofCount;

    SearchResult(int maxLength, List<ProofLayer> layers) {
        this.maxLength = maxLength;
        List<List<Proof>> ls = new ArrayList<>(layers.size());
        long total = 0;
        for (ProofLayer l : layers) {
            ls.add(l.proofs());
            total += l.size();
        }
        this.layers = ImmutableList.copyOf(ls);
        this.totalProofCount = total;
    }

    public int maxLength() { return maxLength; }

    /** @return the longest length for which a layer was built */
    public int lengthReached() { return layers.size(); }

    public List<Proof> proofsOfLength(int length) {
        if (length < 1) throw new IllegalArgumentException("proof lengths start at 1");
        return length <= layers.size() ? layers.get(length - 1) : Collections.emptyList();
    }

    /** @return every proof whose length lies in [from, to], shorter proofs first, each layer in search order */
    public Stream<Proof> proofs(int from, int to) {
        return layers.stream()
                .skip(Math.max(from, 1) - 1)
                .limit(Math.max(0, Math.min(to, layers.size()) - Math.max(from, 1) + 1))
                .flatMap(List::stream);
    }

    /** @return number of distinct proofs found, all lengths together */
    public long totalProofCount() { return totalProofCount; }
}
