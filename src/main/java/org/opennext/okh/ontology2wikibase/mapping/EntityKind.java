package org.opennext.okh.ontology2wikibase.mapping;

/**
 * The two kinds of Wikibase entities an ontology node can become.
 *
 * @since 0.1.0
 */
public enum EntityKind {

    ITEM("item"),
    PROPERTY("property");

    private final String apiName;

    EntityKind(String apiName) {
        this.apiName = apiName;
    }

    /**
     * The value of the {@code new} parameter of {@code wbeditentity}.
     */
    public String apiName() {
        return apiName;
    }
}
