package net.littleredcomputer.hilbert;

/**
 * Receives progress from a {@link ProofSearch} at layer boundaries. Nothing is announced from
 * inside the construction of a layer.
 */
public interface SearchListener {
    SearchListener NONE = new SearchListener() {};

    default void axiomsGenerated(SearchConfiguration config, int instanceCount) {}
    default void searchStarted(int maxLength) {}
    default void layerStarted(int length, int previousLayerSize) {}
    default void layerCompleted(int length, int size) {}
    /** The layer of the given length had nothing in it to extend. */
    default void nothingToExtend(int length) {}
    /** Extending the previous layer produced no proofs of the given length. */
    default void nothingNew(int length) {}
    default void searchCompleted(SearchResult result) {}
}
