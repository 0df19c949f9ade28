package org.opennext.okh.ontology2wikibase.conversion;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.opennext.okh.ontology2wikibase.mapping.MappingGapException;
import org.opennext.okh.ontology2wikibase.mapping.RuleTable;
import org.opennext.okh.ontology2wikibase.wikibase.Claim;
import org.opennext.okh.ontology2wikibase.wikibase.TargetEntity;
import org.opennext.okh.ontology2wikibase.wikibase.WikibaseClient;
import org.opennext.okh.ontology2wikibase.wikibase.WikibaseException;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convert a whole ontology in two phases.
 * <ol>
 * <li>every node gets its skeleton entity, in dependency order;</li>
 * <li>every node gets its claims, which can now reference any other node.</li>
 * </ol>
 * Submitting the claims replaces the entity content, so running the conversion again on the same links file
 * reuses all the entities and leaves them as they are.
 * <p>
 * Pinned nodes map to entities that live in the Wikibase on their own: they are reused as they are and stay
 * {@link NodeState#SKELETON_CREATED}.
 * <p>
 * The links file is saved after the first phase and whenever the run ends, so that a failed run can be resumed.
 *
 * @since 0.1.0
 */
public class ConversionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversionOrchestrator.class);

    private final RuleTable baseRules;
    private final CorrespondenceStore store;
    private final WikibaseClient client;
    private final Path linksFile;
    private final String defaultLanguage;

    /**
     * @param linksFile where to persist the store, <code>null</code> to keep it in memory only.
     */
    public ConversionOrchestrator(RuleTable baseRules, CorrespondenceStore store, WikibaseClient client, Path linksFile, String defaultLanguage) {
        this.baseRules = baseRules;
        this.store = store;
        this.client = client;
        this.linksFile = linksFile;
        this.defaultLanguage = defaultLanguage;
    }

    /**
     * @throws WikibaseException if a Wikibase call fails. The run stops.
     * @throws IOException       if the links file cannot be saved.
     */
    public ConversionReport run(Model ontology) throws WikibaseException, IOException {
        RuleTable rules = baseRules.forOntology(ontology);
        Labels labels = new Labels(ontology, defaultLanguage);
        EntityResolver resolver = new EntityResolver(ontology, rules, store, client, labels);
        EntityBuilder builder = new EntityBuilder(ontology, rules, resolver);
        ConversionReport report = new ConversionReport();
        try {
            resolver.seed();
            List<URI> nodes = DependencyOrder.sort(nodes(ontology), ontology, rules);
            log.info("Converting {} ontology nodes", nodes.size());
            createSkeletons(nodes, resolver, report);
            persist();
            submitClaims(nodes, resolver, builder, report);
            persist();
        } catch (WikibaseException | IOException | RuntimeException e) {
            persistAfterFailure(e);
            throw e;
        }
        log.info("Conversion done: {}", report);
        return report;
    }

    private void createSkeletons(List<URI> nodes, EntityResolver resolver, ConversionReport report) throws WikibaseException {
        for (URI node : nodes) {
            report.visit(node);
            if (resolver.isIgnored(node)) {
                log.info("Skipping <{}>, its type is ignored", node);
                skip(node, report);
                continue;
            }
            try {
                String id = resolver.resolve(node);
                report.outcome(node, resolver.wasCreated(node) ? NodeOutcome.CREATED : NodeOutcome.REUSED);
                report.moveTo(node, NodeState.SKELETON_CREATED);
                log.info("Subject <{}> is represented by {}", node, id);
            } catch (MappingGapException mge) {
                log.warn("Skipping <{}>: {}", node, mge.getMessage());
                report.warn(mge.getMessage());
                skip(node, report);
            }
        }
    }

    private void submitClaims(List<URI> nodes, EntityResolver resolver, EntityBuilder builder, ConversionReport report)
        throws WikibaseException {
        for (URI node : nodes) {
            if (report.state(node) != NodeState.SKELETON_CREATED) continue;
            String id = store.lookup(node);
            if (resolver.isPinned(node)) {
                log.info("<{}> is pinned to {}, leaving its content untouched", node, id);
                continue;
            }
            TargetEntity entity;
            try {
                entity = builder.build(node, report.warningSink());
            } catch (MappingGapException mge) {
                throw new ConsistencyException("<" + node + "> has an entity but no mapped type: " + mge.getMessage());
            }
            checkReferences(node, entity);
            log.info("Submitting {} claims on {} for <{}> ...", entity.getClaims().size(), id, node);
            client.submitClaims(id, entity);
            report.moveTo(node, NodeState.CLAIMS_SUBMITTED);
        }
    }

    private void checkReferences(URI node, TargetEntity entity) {
        for (Claim claim : entity.getClaims()) {
            if (!store.containsIdentifier(claim.getPropertyId())) {
                throw new ConsistencyException("Claim " + claim + " of <" + node + "> uses an unknown property");
            }
            if (claim.isEntityValue() && !store.containsIdentifier(claim.getValue())) {
                throw new ConsistencyException("Claim " + claim + " of <" + node + "> references an unknown entity");
            }
        }
    }

    private static void skip(URI node, ConversionReport report) {
        report.outcome(node, NodeOutcome.SKIPPED);
        report.moveTo(node, NodeState.SKIPPED);
    }

    /**
     * The URI subjects of the ontology, in document order. Blank nodes are never converted.
     */
    private static List<URI> nodes(Model ontology) {
        Set<URI> nodes = new LinkedHashSet<>();
        for (Resource subject : ontology.subjects()) {
            if (subject instanceof URI) nodes.add((URI) subject);
        }
        return new ArrayList<>(nodes);
    }

    private void persist() throws IOException {
        if (linksFile != null) store.save(linksFile);
    }

    private void persistAfterFailure(Exception failure) {
        try {
            persist();
        } catch (IOException ioe) {
            log.error("Could not save the links file after a failed run", ioe);
            failure.addSuppressed(ioe);
        }
    }
}
