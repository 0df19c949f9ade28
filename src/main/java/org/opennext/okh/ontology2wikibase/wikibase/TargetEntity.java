package org.opennext.okh.ontology2wikibase.wikibase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.opennext.okh.ontology2wikibase.mapping.Datatype;
import org.opennext.okh.ontology2wikibase.mapping.EntityKind;

import com.google.common.base.Preconditions;

/**
 * The definition of a Wikibase item or property: labels and descriptions per language, plus an ordered set of claims.
 * Claims are kept in insertion order, a duplicate claim is added once.
 *
 * @since 0.1.0
 */
public final class TargetEntity {

    private final EntityKind kind;
    private final Datatype datatype;
    private final Map<String, String> labels = new LinkedHashMap<>();
    private final Map<String, String> descriptions = new LinkedHashMap<>();
    private final Set<Claim> claims = new LinkedHashSet<>();

    private TargetEntity(EntityKind kind, Datatype datatype) {
        this.kind = Preconditions.checkNotNull(kind);
        this.datatype = datatype;
    }

    public static TargetEntity item() {
        return new TargetEntity(EntityKind.ITEM, null);
    }

    public static TargetEntity property(Datatype datatype) {
        return new TargetEntity(EntityKind.PROPERTY, Preconditions.checkNotNull(datatype));
    }

    public TargetEntity label(String language, String text) {
        labels.put(language, text);
        return this;
    }

    public TargetEntity description(String language, String text) {
        descriptions.put(language, text);
        return this;
    }

    public TargetEntity claim(Claim claim) {
        claims.add(claim);
        return this;
    }

    public EntityKind getKind() {
        return kind;
    }

    /**
     * @return the property datatype, <code>null</code> for items.
     */
    public Datatype getDatatype() {
        return datatype;
    }

    public Map<String, String> getLabels() {
        return Collections.unmodifiableMap(labels);
    }

    public Map<String, String> getDescriptions() {
        return Collections.unmodifiableMap(descriptions);
    }

    public List<Claim> getClaims() {
        return Collections.unmodifiableList(new ArrayList<>(claims));
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%s %s; %d claims", kind.apiName(), labels, claims.size());
    }
}
