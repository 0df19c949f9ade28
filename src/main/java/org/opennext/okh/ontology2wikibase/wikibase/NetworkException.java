package org.opennext.okh.ontology2wikibase.wikibase;

import java.io.IOException;

/**
 * The Wikibase API could not be reached, or its answer could not be read.
 *
 * @since 0.1.0
 */
public class NetworkException extends WikibaseException {

    public NetworkException(String message, IOException cause) {
        super(message, cause);
    }
}
