package org.opennext.okh.ontology2wikibase.mapping;

import org.opennext.okh.ontology2wikibase.common.WikibaseIdentifiers;

/**
 * Wikibase property datatypes supported by the converter.
 * See https://www.wikidata.org/wiki/Special:ListDatatypes
 *
 * @since 0.1.0
 */
public enum Datatype {

    STRING("string", "string"),
    // Yes, URL values have type "string"
    URL("url", "string"),
    ITEM("wikibase-item", "wikibase-entityid"),
    PROPERTY("wikibase-property", "wikibase-entityid"),
    QUANTITY("quantity", "quantity");

    private final String id;
    private final String valueType;

    Datatype(String id, String valueType) {
        this.id = id;
        this.valueType = valueType;
    }

    /**
     * The datatype identifier, as given to {@code wbeditentity} when creating a property.
     */
    public String id() {
        return id;
    }

    /**
     * The type of the {@code datavalue} in a claim main snak.
     */
    public String valueType() {
        return valueType;
    }

    public boolean isEntity() {
        return this == ITEM || this == PROPERTY;
    }

    /**
     * The entity datatype matching the given identifier, i.e., {@link #ITEM} for {@code Q42}.
     */
    public static Datatype forEntity(String id) {
        return WikibaseIdentifiers.entityType(id).equals(WikibaseIdentifiers.ITEM) ? ITEM : PROPERTY;
    }
}
