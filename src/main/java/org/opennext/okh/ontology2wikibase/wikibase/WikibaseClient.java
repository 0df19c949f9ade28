package org.opennext.okh.ontology2wikibase.wikibase;

import java.io.Closeable;

/**
 * The operations the converter needs from a Wikibase instance.
 * All of them are blocking remote calls that may fail.
 *
 * @since 0.1.0
 */
public interface WikibaseClient extends Closeable {

    /**
     * @throws AuthenticationException if the credentials are rejected.
     */
    void login(String user, String password) throws WikibaseException;

    /**
     * Create an item with the labels, descriptions and claims of the given entity.
     *
     * @return the new item identifier, e.g., {@code Q42}.
     */
    String createItem(TargetEntity entity) throws WikibaseException;

    /**
     * Create a property with the datatype, labels, descriptions and claims of the given entity.
     *
     * @return the new property identifier, e.g., {@code P31}.
     */
    String createProperty(TargetEntity entity) throws WikibaseException;

    /**
     * Replace the content of an existing entity with the given one, claims included.
     * Submitting the same entity twice leaves the same content.
     */
    void submitClaims(String entityId, TargetEntity entity) throws WikibaseException;
}
