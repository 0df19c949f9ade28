package org.opennext.okh.ontology2wikibase.conversion;

/**
 * Progress of an ontology node through a conversion run.
 * A node only moves forward: {@code UNVISITED -> SKELETON_CREATED -> CLAIMS_SUBMITTED}, or {@code UNVISITED -> SKIPPED}.
 *
 * @since 0.1.0
 */
public enum NodeState {

    UNVISITED,
    SKELETON_CREATED,
    CLAIMS_SUBMITTED,
    SKIPPED;

    public boolean canMoveTo(NodeState next) {
        switch (this) {
        case UNVISITED:
            return next == SKELETON_CREATED || next == SKIPPED;
        case SKELETON_CREATED:
            return next == CLAIMS_SUBMITTED;
        default:
            return false;
        }
    }
}
