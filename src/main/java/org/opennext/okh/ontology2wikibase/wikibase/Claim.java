package org.opennext.okh.ontology2wikibase.wikibase;

import java.util.Locale;
import java.util.Objects;

import org.opennext.okh.ontology2wikibase.common.WikibaseIdentifiers;
import org.opennext.okh.ontology2wikibase.mapping.Datatype;

import com.google.common.base.Preconditions;

/**
 * A property and value pair attached to an entity.
 * The value is an entity identifier, a string, a URL or an amount.
 *
 * @since 0.1.0
 */
public final class Claim {

    /**
     * Unit of dimensionless quantities.
     */
    public static final String NO_UNIT = "1";

    private final String propertyId;
    private final Datatype datatype;
    private final String value;
    private final String unit;

    private Claim(String propertyId, Datatype datatype, String value, String unit) {
        Preconditions.checkArgument(WikibaseIdentifiers.isValidTerm(propertyId, WikibaseIdentifiers.PROPERTY), "Not a property: %s", propertyId);
        this.propertyId = propertyId;
        this.datatype = Preconditions.checkNotNull(datatype);
        this.value = Preconditions.checkNotNull(value);
        this.unit = unit;
    }

    public static Claim string(String propertyId, String value) {
        return new Claim(propertyId, Datatype.STRING, value, null);
    }

    public static Claim url(String propertyId, String url) {
        return new Claim(propertyId, Datatype.URL, url, null);
    }

    /**
     * A claim pointing to an item or a property, depending on the given identifier.
     */
    public static Claim entity(String propertyId, String entityId) {
        return new Claim(propertyId, Datatype.forEntity(entityId), entityId, null);
    }

    public static Claim quantity(String propertyId, String amount, String unit) {
        return new Claim(propertyId, Datatype.QUANTITY, amount, unit == null ? NO_UNIT : unit);
    }

    public String getPropertyId() {
        return propertyId;
    }

    public Datatype getDatatype() {
        return datatype;
    }

    /**
     * The entity identifier, the text, the URL or the amount.
     */
    public String getValue() {
        return value;
    }

    /**
     * @return the quantity unit, <code>null</code> for other datatypes.
     */
    public String getUnit() {
        return unit;
    }

    public boolean isEntityValue() {
        return datatype.isEntity();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Claim)) return false;
        Claim other = (Claim) o;
        return propertyId.equals(other.propertyId) && datatype == other.datatype && value.equals(other.value) && Objects.equals(unit, other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyId, datatype, value, unit);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%s = %s (%s)", propertyId, value, datatype.id());
    }
}
