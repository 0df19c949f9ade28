package org.opennext.okh.ontology2wikibase.mapping;

/**
 * How the object of a mapped triple becomes a claim value.
 *
 * @since 0.1.0
 */
public enum ValueTransform {

    /**
     * The literal is passed through as a string, URL or quantity.
     */
    LITERAL,
    /**
     * The object URI is resolved to the identifier of its entity.
     */
    REFERENCE,
    /**
     * The object is looked up in an enumeration of constant targets.
     */
    CONSTANT
}
