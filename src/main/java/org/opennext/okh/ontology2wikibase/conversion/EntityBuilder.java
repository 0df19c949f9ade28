package org.opennext.okh.ontology2wikibase.conversion;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import org.opennext.okh.ontology2wikibase.common.Utils;
import org.opennext.okh.ontology2wikibase.mapping.Datatype;
import org.opennext.okh.ontology2wikibase.mapping.EntityKind;
import org.opennext.okh.ontology2wikibase.mapping.MappingGapException;
import org.opennext.okh.ontology2wikibase.mapping.MappingRule;
import org.opennext.okh.ontology2wikibase.mapping.RuleTable;
import org.opennext.okh.ontology2wikibase.wikibase.Claim;
import org.opennext.okh.ontology2wikibase.wikibase.TargetEntity;
import org.opennext.okh.ontology2wikibase.wikibase.WikibaseException;
import org.openrdf.model.Literal;
import org.openrdf.model.Model;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translate the triples of an ontology node into the full definition of its entity, claims included.
 * <p>
 * A triple that cannot become a claim is skipped with a warning, so the entity is built with whatever is mappable.
 * Labels, descriptions, cardinalities, domains and meta-vocabulary values are not claims and are skipped silently.
 *
 * @since 0.1.0
 */
public class EntityBuilder {

    private static final Logger log = LoggerFactory.getLogger(EntityBuilder.class);

    private final Model ontology;
    private final RuleTable rules;
    private final EntityResolver resolver;

    EntityBuilder(Model ontology, RuleTable rules, EntityResolver resolver) {
        this.ontology = ontology;
        this.rules = rules;
        this.resolver = resolver;
    }

    /**
     * @param warnings collects a message per skipped triple.
     * @throws MappingGapException if the node itself has no mapped type.
     * @throws WikibaseException   if an entity referenced by a claim cannot be created.
     */
    public TargetEntity build(URI node, List<String> warnings) throws MappingGapException, WikibaseException {
        TargetEntity entity = resolver.skeleton(node);
        for (Statement statement : ontology.filter(node, null, null)) {
            URI predicate = statement.getPredicate();
            Value object = statement.getObject();
            if (rules.isNonClaim(predicate) || rules.isMetaValue(object)) continue;
            MappingRule rule = rules.rule(predicate);
            if (rule == null) {
                warn(warnings, node, "unmapped predicate <%s>", predicate);
                continue;
            }
            try {
                Claim claim = claim(rule, object);
                if (claim != null) {
                    entity.claim(claim);
                } else {
                    warn(warnings, node, "cannot render %s as a %s value of <%s>", object, rule.getDatatype().id(), predicate);
                }
            } catch (MappingGapException mge) {
                warn(warnings, node, "no entity for the claim <%s> %s: %s", predicate, object, mge.getMessage());
            }
        }
        log.debug("Built {} for <{}>", entity, node);
        return entity;
    }

    /**
     * @return the claim, or <code>null</code> if the value does not fit the rule.
     */
    private Claim claim(MappingRule rule, Value object) throws MappingGapException, WikibaseException {
        switch (rule.getTransform()) {
        case LITERAL:
            return literal(rule, object);
        case CONSTANT:
            URI constant = rule.constantFor(object);
            if (constant != null) return reference(rule, constant);
            return object instanceof URI ? reference(rule, (URI) object) : null;
        case REFERENCE:
            return object instanceof URI ? reference(rule, (URI) object) : null;
        default:
            throw new IllegalStateException("Unknown value transform: " + rule.getTransform());
        }
    }

    private Claim literal(MappingRule rule, Value object) throws MappingGapException, WikibaseException {
        if (!(object instanceof Literal) && !(object instanceof URI)) return null;
        String text = object instanceof Literal ? ((Literal) object).getLabel() : object.stringValue();
        String propertyId = resolver.resolve(rule.getTargetProperty());
        switch (rule.getDatatype()) {
        case URL:
            return Utils.isUrl(text) ? Claim.url(propertyId, text.trim()) : null;
        case QUANTITY:
            if (!(object instanceof Literal)) return null;
            try {
                return Claim.quantity(propertyId, new BigDecimal(text.trim()).toPlainString(), Claim.NO_UNIT);
            } catch (NumberFormatException nfe) {
                return null;
            }
        default:
            return text.trim().isEmpty() ? null : Claim.string(propertyId, text);
        }
    }

    /**
     * The value entity must be of the kind the property expects, e.g., an item for {@link Datatype#ITEM}.
     * The kind is checked before resolving, so a rejected value never gets an entity.
     */
    private Claim reference(MappingRule rule, URI object) throws MappingGapException, WikibaseException {
        EntityKind expected = rule.getDatatype() == Datatype.ITEM ? EntityKind.ITEM : EntityKind.PROPERTY;
        EntityKind kind = resolver.kindOf(object);
        if (kind != null && kind != expected) return null;
        String valueId = resolver.resolve(object);
        if (Datatype.forEntity(valueId) != rule.getDatatype()) return null;
        return Claim.entity(resolver.resolve(rule.getTargetProperty()), valueId);
    }

    private static void warn(List<String> warnings, URI node, String format, Object... args) {
        String warning = "<" + node + ">: " + String.format(Locale.ENGLISH, format, args);
        log.warn("Skipping claim of {}", warning);
        warnings.add(warning);
    }
}
