package org.fol.support;

/**
 * Profondità di annidamento oltre il limite configurato.
 *
 * @see AnalysisConfiguration#maxNestingDepth()
 */
public class DepthLimitExceededException extends FolException {

    private final int limit;
    private final int depth;

    public DepthLimitExceededException(int limit, int depth) {
        super("Profondità di annidamento " + depth + " oltre il limite configurato di " + limit);
        this.limit = limit;
        this.depth = depth;
    }

    public int getLimit() {
        return limit;
    }

    /** Profondità misurata al momento del superamento del limite. */
    public int getDepth() {
        return depth;
    }
}
