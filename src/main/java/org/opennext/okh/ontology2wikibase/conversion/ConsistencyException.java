package org.opennext.okh.ontology2wikibase.conversion;

/**
 * A claim about to be submitted references an identifier that no correspondence knows.
 * This is a bug of the converter, not a problem of the ontology.
 *
 * @since 0.1.0
 */
public class ConsistencyException extends IllegalStateException {

    public ConsistencyException(String message) {
        super(message);
    }
}
