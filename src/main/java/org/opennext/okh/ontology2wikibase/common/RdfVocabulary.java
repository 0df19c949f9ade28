package org.opennext.okh.ontology2wikibase.common;

import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * A set of RDF namespaces and URIs used by the ontology converter, on top of the ones shipped by
 * {@link org.openrdf.model.vocabulary}.
 *
 * @since 0.1.0
 */
public final class RdfVocabulary {

    public static final String SCHEMA_NAMESPACE = "http://schema.org/";
    public static final String SPDX_NAMESPACE = "http://spdx.org/rdf/terms#";
    public static final String OBO_NAMESPACE = "http://purl.obolibrary.org/obo/";
    public static final String EPO_NAMESPACE = "http://data.epo.org/linked-data/def/patent/";
    public static final String OWL_NAMESPACE = "http://www.w3.org/2002/07/owl#";

    private static final ValueFactory VF = ValueFactoryImpl.getInstance();

    /**
     * Couples an ontology URI with its Wikibase identifier in the links file.
     */
    public static final URI SCHEMA_IDENTIFIER = schema("identifier");
    /**
     * OWL 2 term, missing from {@link org.openrdf.model.vocabulary.OWL}.
     */
    public static final URI OWL_NAMED_INDIVIDUAL = VF.createURI(OWL_NAMESPACE, "NamedIndividual");
    /**
     * OWL 2 term, missing from {@link org.openrdf.model.vocabulary.OWL}.
     */
    public static final URI OWL_ANNOTATION_PROPERTY = VF.createURI(OWL_NAMESPACE, "AnnotationProperty");

    private RdfVocabulary() {
    }

    public static URI schema(String localName) {
        return VF.createURI(SCHEMA_NAMESPACE, localName);
    }

    public static URI spdx(String localName) {
        return VF.createURI(SPDX_NAMESPACE, localName);
    }

    public static URI obo(String localName) {
        return VF.createURI(OBO_NAMESPACE, localName);
    }

    public static URI epo(String localName) {
        return VF.createURI(EPO_NAMESPACE, localName);
    }
}
