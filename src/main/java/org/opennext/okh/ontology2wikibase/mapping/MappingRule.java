package org.opennext.okh.ontology2wikibase.mapping;

import java.util.Locale;
import java.util.Map;

import org.openrdf.model.URI;
import org.openrdf.model.Value;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Tell how a source predicate becomes a claim: which target property it uses, which datatype the value has,
 * and how the triple object is transformed.
 *
 * @since 0.1.0
 */
public final class MappingRule {

    private final URI source;
    private final URI targetProperty;
    private final Datatype datatype;
    private final ValueTransform transform;
    private final Map<Value, URI> constants;

    private MappingRule(URI source, URI targetProperty, Datatype datatype, ValueTransform transform, Map<Value, URI> constants) {
        this.source = Preconditions.checkNotNull(source);
        this.targetProperty = Preconditions.checkNotNull(targetProperty);
        this.datatype = Preconditions.checkNotNull(datatype);
        this.transform = Preconditions.checkNotNull(transform);
        this.constants = ImmutableMap.copyOf(constants);
    }

    public static MappingRule literal(URI source, Datatype datatype) {
        Preconditions.checkArgument(!datatype.isEntity(), "Literal rules need a literal datatype, got %s", datatype);
        return new MappingRule(source, source, datatype, ValueTransform.LITERAL, ImmutableMap.of());
    }

    public static MappingRule reference(URI source, Datatype datatype) {
        return reference(source, source, datatype);
    }

    /**
     * A reference rule whose claims use the property created for {@code targetProperty} instead of the one of {@code source}.
     */
    public static MappingRule reference(URI source, URI targetProperty, Datatype datatype) {
        Preconditions.checkArgument(datatype.isEntity(), "Reference rules need an entity datatype, got %s", datatype);
        return new MappingRule(source, targetProperty, datatype, ValueTransform.REFERENCE, ImmutableMap.of());
    }

    /**
     * @param constants enumerated source values mapped to the URIs whose entities they stand for.
     */
    public static MappingRule constant(URI source, Datatype datatype, Map<? extends Value, URI> constants) {
        Preconditions.checkArgument(datatype.isEntity(), "Constant rules need an entity datatype, got %s", datatype);
        return new MappingRule(source, source, datatype, ValueTransform.CONSTANT, ImmutableMap.copyOf(constants));
    }

    public URI getSource() {
        return source;
    }

    /**
     * The key of the target property in the correspondence store.
     */
    public URI getTargetProperty() {
        return targetProperty;
    }

    public Datatype getDatatype() {
        return datatype;
    }

    public ValueTransform getTransform() {
        return transform;
    }

    /**
     * @return the URI standing for the given enumerated value, or <code>null</code> if it is not enumerated.
     */
    public URI constantFor(Value value) {
        return constants.get(value);
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "%s -> %s (%s, %s)", source, targetProperty, transform, datatype.id());
    }
}
