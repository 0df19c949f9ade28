package org.opennext.okh.ontology2wikibase.wikibase;

/**
 * The Wikibase instance rejected the given credentials.
 *
 * @since 0.1.0
 */
public class AuthenticationException extends WikibaseException {

    public AuthenticationException(String message) {
        super(message);
    }
}
