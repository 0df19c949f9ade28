package org.opennext.okh.ontology2wikibase.mapping;

import org.openrdf.model.Value;

/**
 * An RDF type, predicate or value has no rule in the {@link RuleTable}.
 * The ontology evolves faster than the rules, so callers skip the offending node or claim and carry on.
 *
 * @since 0.1.0
 */
public class MappingGapException extends Exception {

    private final transient Value subject;

    public MappingGapException(Value subject, String message) {
        super(message);
        this.subject = subject;
    }

    /**
     * The node or value lacking a rule.
     */
    public Value getSubject() {
        return subject;
    }
}
