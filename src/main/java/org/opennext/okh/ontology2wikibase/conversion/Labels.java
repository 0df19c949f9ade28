package org.opennext.okh.ontology2wikibase.conversion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.opennext.okh.ontology2wikibase.common.Config;
import org.opennext.okh.ontology2wikibase.common.Utils;
import org.opennext.okh.ontology2wikibase.mapping.OkhLoshRules;
import org.openrdf.model.Literal;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

/**
 * Extract the labels and descriptions of ontology nodes, per language.
 *
 * @since 0.1.0
 */
class Labels {

    private final Model ontology;
    private final String defaultLanguage;

    Labels(Model ontology, String defaultLanguage) {
        this.ontology = ontology;
        this.defaultLanguage = defaultLanguage;
    }

    /**
     * Values of the first label predicate the node has. Without any, the local name of the node in the default language.
     */
    Map<String, String> labels(Resource node) {
        Map<String, String> labels = collect(node, OkhLoshRules.LABEL_PREDICATES);
        if (labels.isEmpty()) labels.put(defaultLanguage, Utils.localName(node));
        return labels;
    }

    /**
     * Values of the first description predicate the node has, cut to the length Wikibase accepts.
     */
    Map<String, String> descriptions(Resource node) {
        Map<String, String> descriptions = collect(node, OkhLoshRules.DESCRIPTION_PREDICATES);
        for (Map.Entry<String, String> description : descriptions.entrySet()) {
            description.setValue(Utils.truncate(description.getValue(), Config.MAX_DESCRIPTION_LENGTH));
        }
        return descriptions;
    }

    String defaultLanguage() {
        return defaultLanguage;
    }

    private Map<String, String> collect(Resource node, List<URI> predicates) {
        Map<String, String> texts = new LinkedHashMap<>();
        for (URI predicate : predicates) {
            for (Value value : ontology.filter(node, predicate, null).objects()) {
                if (!(value instanceof Literal)) continue;
                Literal literal = (Literal) value;
                String language = literal.getLanguage() == null ? defaultLanguage : literal.getLanguage();
                String text = literal.getLabel().trim();
                if (text.isEmpty()) continue;
                String previous = texts.get(language);
                texts.put(language, previous == null ? text : previous + Config.TEXT_SEPARATOR + text);
            }
            if (!texts.isEmpty()) break;
        }
        return texts;
    }
}
