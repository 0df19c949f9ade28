package org.opennext.okh.ontology2wikibase.mapping;

import java.util.Locale;

import org.openrdf.model.URI;

import com.google.common.base.Preconditions;

/**
 * An external vocabulary term used, but not declared, by the ontology.
 * The converter creates a local stand-in entity for it, since the target Wikibase does not share Wikidata entities.
 *
 * @since 0.1.0
 */
public final class SubstituteTerm {

    private final URI uri;
    private final EntityKind kind;
    private final String label;
    private final Datatype datatype;
    private final String wikidataEquivalent;

    private SubstituteTerm(URI uri, EntityKind kind, String label, Datatype datatype, String wikidataEquivalent) {
        this.uri = Preconditions.checkNotNull(uri);
        this.kind = Preconditions.checkNotNull(kind);
        this.label = Preconditions.checkNotNull(label);
        this.datatype = datatype;
        this.wikidataEquivalent = wikidataEquivalent;
    }

    /**
     * @param wikidataEquivalent the Wikidata property the stand-in mirrors, e.g., {@code P279}, or <code>null</code> if none.
     */
    public static SubstituteTerm property(URI uri, String label, Datatype datatype, String wikidataEquivalent) {
        return new SubstituteTerm(uri, EntityKind.PROPERTY, label, Preconditions.checkNotNull(datatype), wikidataEquivalent);
    }

    public static SubstituteTerm item(URI uri, String label, String wikidataEquivalent) {
        return new SubstituteTerm(uri, EntityKind.ITEM, label, null, wikidataEquivalent);
    }

    public URI getUri() {
        return uri;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the property datatype, <code>null</code> for items.
     */
    public Datatype getDatatype() {
        return datatype;
    }

    public String getWikidataEquivalent() {
        return wikidataEquivalent;
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%s '%s' for <%s>", kind.apiName(), label, uri);
    }
}
