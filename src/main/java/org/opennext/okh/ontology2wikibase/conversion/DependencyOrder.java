package org.opennext.okh.ontology2wikibase.conversion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import org.opennext.okh.ontology2wikibase.mapping.EntityKind;
import org.opennext.okh.ontology2wikibase.mapping.RuleTable;
import org.openrdf.model.Model;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sort ontology nodes so that a node comes after the properties it uses as predicates and after its types.
 * Ties are broken by kind (properties, then classes, then individuals) and then by input order.
 * Nodes on a cycle are released in the same tie-break order.
 *
 * @since 0.1.0
 */
final class DependencyOrder {

    private static final int PROPERTY_TIER = 0;
    private static final int CLASS_TIER = 1;
    private static final int INDIVIDUAL_TIER = 2;
    private static final int UNMAPPED_TIER = 3;
    private static final Logger log = LoggerFactory.getLogger(DependencyOrder.class);

    private DependencyOrder() {
    }

    static List<URI> sort(List<URI> nodes, Model ontology, RuleTable rules) {
        Map<URI, Integer> position = new HashMap<>();
        for (URI node : nodes) position.putIfAbsent(node, position.size());
        Map<URI, Integer> tier = new HashMap<>();
        Map<URI, Set<URI>> dependents = new HashMap<>();
        Map<URI, Integer> pending = new HashMap<>();
        for (URI node : position.keySet()) {
            tier.put(node, tierOf(node, ontology, rules));
            Set<URI> dependencies = dependencies(node, ontology, position);
            pending.put(node, dependencies.size());
            for (URI dependency : dependencies) dependents.computeIfAbsent(dependency, k -> new LinkedHashSet<>()).add(node);
        }

        Comparator<URI> tieBreak = Comparator.<URI>comparingInt(tier::get).thenComparingInt(position::get);
        PriorityQueue<URI> ready = new PriorityQueue<>(tieBreak);
        PriorityQueue<URI> waiting = new PriorityQueue<>(tieBreak);
        for (URI node : position.keySet()) {
            if (pending.get(node) == 0) ready.add(node);
            else waiting.add(node);
        }

        List<URI> sorted = new ArrayList<>(position.size());
        while (sorted.size() < position.size()) {
            URI next = ready.poll();
            if (next == null) {
                // Only cycles are left
                next = waiting.poll();
                log.debug("Dependency cycle, releasing <{}>", next);
            } else {
                waiting.remove(next);
            }
            if (pending.get(next) < 0) continue;
            pending.put(next, -1);
            sorted.add(next);
            for (URI dependent : dependents.getOrDefault(next, new LinkedHashSet<>())) {
                int left = pending.get(dependent);
                if (left <= 0) continue;
                pending.put(dependent, left - 1);
                if (left == 1) {
                    waiting.remove(dependent);
                    ready.add(dependent);
                }
            }
        }
        return sorted;
    }

    /**
     * The predicates and types of the node that are themselves nodes to sort, excluding the node.
     */
    private static Set<URI> dependencies(URI node, Model ontology, Map<URI, Integer> position) {
        Set<URI> dependencies = new LinkedHashSet<>();
        for (Statement statement : ontology.filter(node, null, null)) {
            URI predicate = statement.getPredicate();
            if (position.containsKey(predicate)) dependencies.add(predicate);
            if (RDF.TYPE.equals(predicate) && statement.getObject() instanceof URI && position.containsKey(statement.getObject())) {
                dependencies.add((URI) statement.getObject());
            }
        }
        dependencies.remove(node);
        return dependencies;
    }

    private static int tierOf(URI node, Model ontology, RuleTable rules) {
        Set<Value> types = ontology.filter(node, RDF.TYPE, null).objects();
        EntityKind kind = rules.kindOf(types);
        if (kind == EntityKind.PROPERTY) return PROPERTY_TIER;
        if (kind == null) return UNMAPPED_TIER;
        for (Value type : types) {
            if (type instanceof URI && rules.isClassDeclarationType((URI) type)) return CLASS_TIER;
        }
        return INDIVIDUAL_TIER;
    }
}
