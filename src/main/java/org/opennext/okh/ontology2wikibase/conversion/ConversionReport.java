package org.opennext.okh.ontology2wikibase.conversion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.openrdf.model.URI;

/**
 * The outcome and state of every ontology node of a conversion run, plus the warnings collected on the way.
 *
 * @since 0.1.0
 */
public class ConversionReport {

    private final Map<URI, NodeState> states = new LinkedHashMap<>();
    private final Map<URI, NodeOutcome> outcomes = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    void visit(URI node) {
        states.putIfAbsent(node, NodeState.UNVISITED);
    }

    /**
     * @throws IllegalStateException if the node would move backwards.
     */
    void moveTo(URI node, NodeState next) {
        NodeState current = state(node);
        if (!current.canMoveTo(next)) throw new IllegalStateException("<" + node + "> cannot move from " + current + " to " + next);
        states.put(node, next);
    }

    void outcome(URI node, NodeOutcome outcome) {
        outcomes.put(node, outcome);
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    List<String> warningSink() {
        return warnings;
    }

    public NodeState state(URI node) {
        NodeState state = states.get(node);
        return state == null ? NodeState.UNVISITED : state;
    }

    /**
     * @return the node outcome, <code>null</code> if the node was not processed.
     */
    public NodeOutcome outcome(URI node) {
        return outcomes.get(node);
    }

    public Map<URI, NodeOutcome> outcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int count(NodeOutcome outcome) {
        int count = 0;
        for (NodeOutcome current : outcomes.values()) {
            if (current == outcome) count++;
        }
        return count;
    }

    @Override
    public String toString() {
        Map<NodeOutcome, Integer> counts = new EnumMap<>(NodeOutcome.class);
        for (NodeOutcome outcome : NodeOutcome.values()) counts.put(outcome, count(outcome));
        return String.format(Locale.ENGLISH, "%d nodes %s, %d warnings", outcomes.size(), counts, warnings.size());
    }
}
