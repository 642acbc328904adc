package net.littleredcomputer.hilbert;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

final class AxiomInstances {
    private AxiomInstances() {}

    /**
     * Instantiate every schema with every assignment of basis formulas to its variables. Schemas
     * are taken in configured order, and within a schema the assignments run lexicographically
     * over the basis with the last variable varying fastest. An instance whose formula has
     * already been produced is dropped.
     *
     * @return the proofs of length 1
     */
    static ProofLayer generate(SearchConfiguration config) {
        ProofLayer layer = new ProofLayer(1);
        for (AxiomSchema schema : config.schemas()) {
            List<String> variables = schema.variables();
            List<List<String>> choices = Collections.nCopies(variables.size(), config.basis());
            for (List<String> combo : Lists.cartesianProduct(choices)) {
                ImmutableMap.Builder<String, String> assignment = ImmutableMap.builder();
                for (int i = 0; i < variables.size(); ++i) assignment.put(variables.get(i), combo.get(i));
                ImmutableMap<String, String> a = assignment.build();
                layer.add(Proof.of(schema.instantiate(a), Justification.axiom(schema, a)));
            }
        }
        return layer;
    }
}
