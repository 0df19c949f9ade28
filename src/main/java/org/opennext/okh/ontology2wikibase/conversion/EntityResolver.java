package org.opennext.okh.ontology2wikibase.conversion;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.opennext.okh.ontology2wikibase.mapping.Datatype;
import org.opennext.okh.ontology2wikibase.mapping.EntityKind;
import org.opennext.okh.ontology2wikibase.mapping.MappingGapException;
import org.opennext.okh.ontology2wikibase.mapping.MappingRule;
import org.opennext.okh.ontology2wikibase.mapping.RuleTable;
import org.opennext.okh.ontology2wikibase.mapping.SubstituteTerm;
import org.opennext.okh.ontology2wikibase.wikibase.TargetEntity;
import org.opennext.okh.ontology2wikibase.wikibase.WikibaseClient;
import org.opennext.okh.ontology2wikibase.wikibase.WikibaseException;
import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Give every ontology URI its Wikibase identifier, creating a skeleton entity the first time the URI is met.
 * A skeleton has labels, descriptions and, for properties, the datatype: claims come later, see {@link EntityBuilder}.
 * <p>
 * This is the only writer of the {@link CorrespondenceStore}, so each URI is created at most once.
 *
 * @since 0.1.0
 */
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final Model ontology;
    private final RuleTable rules;
    private final CorrespondenceStore store;
    private final WikibaseClient client;
    private final Labels labels;
    private final Set<URI> created = new HashSet<>();

    EntityResolver(Model ontology, RuleTable rules, CorrespondenceStore store, WikibaseClient client, Labels labels) {
        this.ontology = ontology;
        this.rules = rules;
        this.store = store;
        this.client = client;
        this.labels = labels;
    }

    /**
     * Record the pinned correspondences, then make sure every substitute term has its entity.
     * A pin never overrides a loaded correspondence.
     */
    public void seed() throws WikibaseException {
        for (Map.Entry<URI, String> pin : rules.pins().entrySet()) {
            String known = store.lookup(pin.getKey());
            if (known == null) {
                store.record(pin.getKey(), pin.getValue());
            } else if (!known.equals(pin.getValue())) {
                log.warn("<{}> is pinned to {}, but the links file says {}: keeping {}", pin.getKey(), pin.getValue(), known, known);
            }
        }
        for (SubstituteTerm substitute : rules.substitutes()) {
            if (store.contains(substitute.getUri())) continue;
            String id = create(substitute.getUri(), substituteSkeleton(substitute));
            log.info("Substitute {} is {}", substitute, id);
        }
    }

    /**
     * @return the identifier of the entity the given URI corresponds to, created if needed.
     * @throws MappingGapException if the URI is neither pinned nor a substitute and its types are unmapped or ignored,
     *                             even when the links file knows it.
     */
    public String resolve(URI uri) throws MappingGapException, WikibaseException {
        SubstituteTerm substitute = rules.substitute(uri);
        if (substitute == null && !isPinned(uri)) checkMapped(uri);
        String known = store.lookup(uri);
        if (known != null) return known;
        TargetEntity skeleton = substitute == null ? skeleton(uri) : substituteSkeleton(substitute);
        return create(uri, skeleton);
    }

    /**
     * Pinned URIs stand for entities that exist in the Wikibase independently of the ontology:
     * their content is never replaced.
     */
    public boolean isPinned(URI uri) {
        return rules.pins().containsKey(uri);
    }

    /**
     * The kind of entity the given URI corresponds to, without creating anything.
     *
     * @return <code>null</code> if the URI cannot have an entity.
     */
    public EntityKind kindOf(URI uri) {
        SubstituteTerm substitute = rules.substitute(uri);
        if (substitute != null) return substitute.getKind();
        String known = store.lookup(uri);
        if (isPinned(uri)) return kindOfIdentifier(known == null ? rules.pins().get(uri) : known);
        Set<Value> types = ontology.filter(uri, RDF.TYPE, null).objects();
        if (rules.hasIgnoredType(types)) return null;
        EntityKind kind = rules.kindOf(types);
        if (kind == null || known == null) return kind;
        return kindOfIdentifier(known);
    }

    /**
     * Whether the entity of the given URI was created during this run, as opposed to loaded or pinned.
     */
    public boolean wasCreated(URI uri) {
        return created.contains(uri);
    }

    /**
     * Nodes with an ignored type, e.g., the ontology header, have no entity.
     */
    public boolean isIgnored(URI uri) {
        return rules.hasIgnoredType(ontology.filter(uri, RDF.TYPE, null).objects());
    }

    /**
     * The labels, descriptions and datatype of the entity for the given ontology node.
     *
     * @throws MappingGapException if none of the node types is mapped.
     */
    TargetEntity skeleton(URI uri) throws MappingGapException {
        EntityKind kind = checkMapped(uri);
        TargetEntity skeleton = kind == EntityKind.ITEM ? TargetEntity.item() : TargetEntity.property(datatypeOf(uri));
        for (Map.Entry<String, String> label : labels.labels(uri).entrySet()) skeleton.label(label.getKey(), label.getValue());
        for (Map.Entry<String, String> description : labels.descriptions(uri).entrySet()) {
            skeleton.description(description.getKey(), description.getValue());
        }
        return skeleton;
    }

    private EntityKind checkMapped(URI uri) throws MappingGapException {
        Set<Value> types = ontology.filter(uri, RDF.TYPE, null).objects();
        if (rules.hasIgnoredType(types)) throw new MappingGapException(uri, "<" + uri + "> has an ignored type");
        EntityKind kind = rules.kindOf(types);
        if (kind == null) {
            throw new MappingGapException(uri, "<" + uri + "> has no mapped type, got " + (types.isEmpty() ? "none" : types));
        }
        return kind;
    }

    private static EntityKind kindOfIdentifier(String id) {
        return Datatype.forEntity(id) == Datatype.ITEM ? EntityKind.ITEM : EntityKind.PROPERTY;
    }

    private Datatype datatypeOf(URI property) {
        MappingRule rule = rules.rule(property);
        return rule == null ? Datatype.STRING : rule.getDatatype();
    }

    private TargetEntity substituteSkeleton(SubstituteTerm substitute) {
        TargetEntity skeleton = substitute.getKind() == EntityKind.ITEM ? TargetEntity.item() : TargetEntity.property(substitute.getDatatype());
        return skeleton.label(labels.defaultLanguage(), substitute.getLabel());
    }

    private String create(URI uri, TargetEntity skeleton) throws WikibaseException {
        log.info("Creating the {} for <{}> ...", skeleton.getKind().apiName(), uri);
        String id = skeleton.getKind() == EntityKind.ITEM ? client.createItem(skeleton) : client.createProperty(skeleton);
        store.record(uri, id);
        created.add(uri);
        log.info("<{}> is represented by {}", uri, id);
        return id;
    }
}
