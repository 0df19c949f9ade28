package org.opennext.okh.ontology2wikibase.conversion;

/**
 * What a conversion run did with an ontology node.
 *
 * @since 0.1.0
 */
public enum NodeOutcome {
    /**
     * A new entity was created.
     */
    CREATED,
    /**
     * The entity of a previous run, or a pinned one, was used.
     */
    REUSED,
    /**
     * The node has no entity.
     */
    SKIPPED
}
