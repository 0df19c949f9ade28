package org.opennext.okh.ontology2wikibase.mapping;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The lookup table translating RDF classes and predicates into Wikibase items, properties and claims.
 * A URI absent from the table is <i>unmapped</i>.
 * <p>
 * The fixed part lives in {@link OkhLoshRules}. The rules for the properties and classes the ontology declares itself
 * are derived once per run, see {@link #forOntology(Model)}.
 *
 * @since 0.1.0
 */
public final class RuleTable {

    private static final Set<URI> NUMERIC_DATATYPES = ImmutableSet.of(
        XMLSchema.DECIMAL, XMLSchema.INTEGER, XMLSchema.INT, XMLSchema.LONG, XMLSchema.SHORT, XMLSchema.DOUBLE, XMLSchema.FLOAT,
        XMLSchema.NON_NEGATIVE_INTEGER, XMLSchema.POSITIVE_INTEGER, XMLSchema.NEGATIVE_INTEGER, XMLSchema.NON_POSITIVE_INTEGER);
    private static final Logger log = LoggerFactory.getLogger(RuleTable.class);

    private final Map<URI, EntityKind> classRules;
    private final Set<URI> ignoredTypes;
    private final Set<URI> classDeclarationTypes;
    private final Map<URI, MappingRule> predicateRules;
    private final Set<URI> nonClaimPredicates;
    private final Set<Value> metaValues;
    private final Map<URI, SubstituteTerm> substitutes;
    private final Map<URI, String> pins;

    private RuleTable(Builder builder) {
        this.classRules = ImmutableMap.copyOf(builder.classRules);
        this.ignoredTypes = ImmutableSet.copyOf(builder.ignoredTypes);
        this.classDeclarationTypes = ImmutableSet.copyOf(builder.classDeclarationTypes);
        this.predicateRules = ImmutableMap.copyOf(builder.predicateRules);
        this.nonClaimPredicates = ImmutableSet.copyOf(builder.nonClaimPredicates);
        this.metaValues = ImmutableSet.copyOf(builder.metaValues);
        this.substitutes = ImmutableMap.copyOf(builder.substitutes);
        this.pins = ImmutableMap.copyOf(builder.pins);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the entity kind of the nodes having the given <code>rdf:type</code>, or <code>null</code> if the type is unmapped.
     */
    public EntityKind classRule(URI type) {
        return classRules.get(type);
    }

    /**
     * Nodes with an ignored type, like the <code>owl:Ontology</code> header, are never converted.
     */
    public boolean isIgnoredType(URI type) {
        return ignoredTypes.contains(type);
    }

    public boolean hasIgnoredType(Collection<? extends Value> types) {
        for (Value type : types) {
            if (ignoredTypes.contains(type)) return true;
        }
        return false;
    }

    /**
     * Whether a node with the given <code>rdf:type</code> declares a class, as opposed to being an individual.
     */
    public boolean isClassDeclarationType(URI type) {
        return classDeclarationTypes.contains(type);
    }

    /**
     * @return the rule of the given predicate, or <code>null</code> if it is unmapped.
     */
    public MappingRule rule(URI predicate) {
        return predicateRules.get(predicate);
    }

    /**
     * Labels, descriptions and OWL restrictions are not rendered as claims.
     */
    public boolean isNonClaim(URI predicate) {
        return nonClaimPredicates.contains(predicate);
    }

    /**
     * Meta-vocabulary values, e.g., <code>owl:Class</code> as the object of <code>rdf:type</code>, are not rendered as claims.
     */
    public boolean isMetaValue(Value value) {
        return metaValues.contains(value);
    }

    /**
     * @return the substitute for the given external term, or <code>null</code> if there is none.
     */
    public SubstituteTerm substitute(URI uri) {
        return substitutes.get(uri);
    }

    public Collection<SubstituteTerm> substitutes() {
        return substitutes.values();
    }

    /**
     * URIs bound to entities that already exist in the target Wikibase.
     */
    public Map<URI, String> pins() {
        return pins;
    }

    /**
     * Extend this table with the rules for the properties and classes declared by the given ontology.
     * Rules already in the table take precedence.
     * <ul>
     * <li><code>owl:ObjectProperty</code>: reference to an item;</li>
     * <li><code>owl:DatatypeProperty</code>: literal, URL if the range is <code>xsd:anyURI</code>, quantity if numeric, string otherwise;</li>
     * <li>other property types: string literal;</li>
     * <li>declared classes: their individuals become items.</li>
     * </ul>
     */
    public RuleTable forOntology(Model ontology) {
        Builder extended = toBuilder();
        int derived = 0;
        for (Resource subject : ontology.subjects()) {
            if (!(subject instanceof URI)) continue;
            URI node = (URI) subject;
            Set<Value> types = ontology.filter(node, RDF.TYPE, null).objects();
            if (containsAny(types, classDeclarationTypes)) {
                if (!extended.classRules.containsKey(node)) {
                    extended.classRule(node, EntityKind.ITEM);
                    derived++;
                }
            } else if (kindOf(types) == EntityKind.PROPERTY && !extended.predicateRules.containsKey(node)) {
                extended.rule(deriveRule(ontology, node, types));
                derived++;
            }
        }
        log.info("Derived {} rules from the ontology declarations", derived);
        return extended.build();
    }

    private MappingRule deriveRule(Model ontology, URI property, Set<Value> types) {
        if (types.contains(OWL.OBJECTPROPERTY)) return MappingRule.reference(property, Datatype.ITEM);
        if (types.contains(OWL.DATATYPEPROPERTY)) {
            Set<Value> ranges = ontology.filter(property, RDFS.RANGE, null).objects();
            if (ranges.contains(XMLSchema.ANYURI)) return MappingRule.literal(property, Datatype.URL);
            if (!ranges.isEmpty() && NUMERIC_DATATYPES.containsAll(ranges)) return MappingRule.literal(property, Datatype.QUANTITY);
        }
        return MappingRule.literal(property, Datatype.STRING);
    }

    /**
     * The entity kind of a node with the given types. An item type wins over a property type.
     *
     * @return the kind, or <code>null</code> if no type is mapped.
     */
    public EntityKind kindOf(Collection<? extends Value> types) {
        EntityKind kind = null;
        for (Value type : types) {
            EntityKind current = type instanceof URI ? classRules.get(type) : null;
            if (current == EntityKind.ITEM) return current;
            if (current != null) kind = current;
        }
        return kind;
    }

    private static boolean containsAny(Set<Value> values, Set<URI> candidates) {
        for (Value value : values) {
            if (candidates.contains(value)) return true;
        }
        return false;
    }

    private Builder toBuilder() {
        Builder builder = new Builder();
        builder.classRules.putAll(classRules);
        builder.ignoredTypes.addAll(ignoredTypes);
        builder.classDeclarationTypes.addAll(classDeclarationTypes);
        builder.predicateRules.putAll(predicateRules);
        builder.nonClaimPredicates.addAll(nonClaimPredicates);
        builder.metaValues.addAll(metaValues);
        builder.substitutes.putAll(substitutes);
        builder.pins.putAll(pins);
        return builder;
    }

    /**
     * Collects the rules. Later rules for the same URI replace earlier ones.
     */
    public static final class Builder {

        private final Map<URI, EntityKind> classRules = new LinkedHashMap<>();
        private final Set<URI> ignoredTypes = new LinkedHashSet<>();
        private final Set<URI> classDeclarationTypes = new LinkedHashSet<>();
        private final Map<URI, MappingRule> predicateRules = new LinkedHashMap<>();
        private final Set<URI> nonClaimPredicates = new LinkedHashSet<>();
        private final Set<Value> metaValues = new LinkedHashSet<>();
        private final Map<URI, SubstituteTerm> substitutes = new LinkedHashMap<>();
        private final Map<URI, String> pins = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder classRule(URI type, EntityKind kind) {
            classRules.put(type, kind);
            return this;
        }

        /**
         * Map a type declaring classes. Its nodes become items, and their individuals too.
         */
        public Builder classDeclaration(URI type) {
            classDeclarationTypes.add(type);
            return classRule(type, EntityKind.ITEM);
        }

        public Builder ignoreType(URI type) {
            ignoredTypes.add(type);
            return this;
        }

        public Builder rule(MappingRule rule) {
            predicateRules.put(rule.getSource(), rule);
            return this;
        }

        public Builder nonClaim(URI... predicates) {
            for (URI predicate : predicates) nonClaimPredicates.add(predicate);
            return this;
        }

        public Builder metaValue(Value... values) {
            for (Value value : values) metaValues.add(value);
            return this;
        }

        /**
         * Register a substitute entity. A property substitute also maps its URI as a predicate, by reference for entity
         * datatypes and by literal otherwise, unless a rule for it already exists.
         */
        public Builder substitute(SubstituteTerm term) {
            substitutes.put(term.getUri(), term);
            if (term.getKind() == EntityKind.PROPERTY && !predicateRules.containsKey(term.getUri())) {
                Datatype datatype = term.getDatatype();
                rule(datatype.isEntity() ? MappingRule.reference(term.getUri(), datatype) : MappingRule.literal(term.getUri(), datatype));
            }
            return this;
        }

        public Builder pin(URI uri, String targetId) {
            Preconditions.checkNotNull(targetId);
            pins.put(uri, targetId);
            return this;
        }

        public RuleTable build() {
            return new RuleTable(this);
        }
    }
}
