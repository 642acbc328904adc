// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.hilbert;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Breadth-first enumeration of Hilbert-style proofs by length.
 * <p>
 * Every proof of length k is a proof of length k-1 with one more line: either an axiom instance
 * or the Modus Ponens consequence of two distinct earlier lines. Proofs of a given length are
 * kept only once per sequence of formulas, and the first derivation found wins. The order of
 * enumeration is fixed (previous layer in insertion order; axiom lines before Modus Ponens lines;
 * antecedent line ascending, then implication line ascending) so that results are reproducible.
 */
public class ProofSearch {
    private static final Logger log = LogManager.getFormatterLogger(ProofSearch.class);
    private static final double feasibleLayerSize = 1e8;
    private final SearchConfiguration config;
    private SearchListener listener = SearchListener.NONE;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private final List<ProofLayer> layers = new ArrayList<>();

    public ProofSearch(SearchConfiguration config) {
        this.config = config;
    }

    public ProofSearch setListener(SearchListener listener) {
        this.listener = listener;
        return this;
    }

    public SearchResult run() {
        stopwatch.reset().start();
        layers.clear();
        final ProofLayer axioms = AxiomInstances.generate(config);
        layers.add(axioms);
        log.info("%d axiom instances from a basis of %d formulas", axioms.size(), config.basis().size());
        // Axiom extensions alone make layer k at least |axioms|^k.
        final double lowerBound = Math.pow(axioms.size(), config.maxLength());
        if (lowerBound > feasibleLayerSize) {
            log.warn("layer %d will hold at least %.3g proofs; expect the search to exhaust memory", config.maxLength(), lowerBound);
        }
        listener.axiomsGenerated(config, axioms.size());
        listener.searchStarted(config.maxLength());

        for (int k = 2; k <= config.maxLength(); ++k) {
            ProofLayer previous = layers.get(k - 2);
            if (previous.isEmpty()) {
                log.info("no proofs of length %d; stopping", k - 1);
                listener.nothingToExtend(k - 1);
                break;
            }
            listener.layerStarted(k, previous.size());
            ProofLayer next = extend(previous, axioms, k);
            layers.add(next);
            final int length = k;
            log.info(() -> new FormattedMessage("length %d: %d proofs from %d %s", length, next.size(), previous.size(), stopwatch));
            listener.layerCompleted(k, next.size());
            if (next.isEmpty()) {
                log.info("no new proofs of length %d; stopping", k);
                listener.nothingNew(k);
                break;
            }
            previous.seal();
        }

        layers.forEach(ProofLayer::seal);
        SearchResult result = new SearchResult(config.maxLength(), layers);
        stopwatch.stop();
        log.info("search complete: %d proofs in %s", result.totalProofCount(), stopwatch);
        listener.searchCompleted(result);
        return result;
    }

    /** @return the layer of the given length built so far by the current or last run */
    ProofLayer layer(int length) {
        return layers.get(length - 1);
    }

    /**
     * Build every proof of length k from the proofs of length k-1.
     */
    static ProofLayer extend(ProofLayer previous, ProofLayer axioms, int k) {
        ProofLayer next = new ProofLayer(k);
        for (Proof p : previous.proofs()) {
            // Option A: append an axiom instance.
            for (Proof a : axioms.proofs()) {
                next.add(p.extend(a.step(0), a.justifications().get(0)));
            }
            // Option B: append the consequent of line j, given its antecedent on line i.
            for (int i = 0; i < k - 1; ++i) {
                for (int j = 0; j < k - 1; ++j) {
                    if (i == j) continue;
                    Optional<String> q = ModusPonens.apply(p.step(i), p.step(j));
                    if (q.isPresent()) next.add(p.extend(q.get(), Justification.modusPonens(i + 1, j + 1)));
                }
            }
        }
        return next;
    }
}
