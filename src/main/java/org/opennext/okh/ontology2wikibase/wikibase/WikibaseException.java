package org.opennext.okh.ontology2wikibase.wikibase;

/**
 * A call to the Wikibase API failed. Fatal for the current conversion run.
 *
 * @since 0.1.0
 */
public class WikibaseException extends Exception {

    public WikibaseException(String message) {
        super(message);
    }

    public WikibaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
