package org.opennext.okh.ontology2wikibase.common;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableMap;

/**
 * Validate Wikibase entity identifiers and tell their entity type.
 * <ul>
 * <li>item, e.g., <code>Q9521</code>;</li>
 * <li>property, e.g., <code>P18</code>.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class WikibaseIdentifiers {

    public static final String ITEM = "item";
    public static final String PROPERTY = "property";

    private static final Map<String, Pattern> TERM_VALIDATORS = ImmutableMap.of(
        ITEM, Pattern.compile("^Q\\d+$"),
        PROPERTY, Pattern.compile("^P\\d+$"));

    private WikibaseIdentifiers() {
    }

    /**
     * Validate the given identifier.
     *
     * @param term             the identifier to validate.
     * @param expectedTermType one of <i>item</i>, <i>property</i>.
     * @return <i>true</i> if the identifier is valid, <i>false</i> otherwise.
     */
    public static boolean isValidTerm(String term, String expectedTermType) {
        Pattern regex = TERM_VALIDATORS.get(expectedTermType);
        if (regex == null) throw new IllegalArgumentException("Unknown term type: " + expectedTermType);
        Matcher matcher = regex.matcher(term);
        return matcher.matches();
    }

    public static boolean isValid(String term) {
        return isValidTerm(term, ITEM) || isValidTerm(term, PROPERTY);
    }

    /**
     * @return <i>item</i> or <i>property</i>.
     * @throws IllegalArgumentException if the identifier is neither.
     */
    public static String entityType(String id) {
        if (isValidTerm(id, ITEM)) return ITEM;
        if (isValidTerm(id, PROPERTY)) return PROPERTY;
        throw new IllegalArgumentException("Not a Wikibase item or property identifier: " + id);
    }

    public static int numericId(String id) {
        entityType(id);
        return Integer.parseInt(id.substring(1));
    }
}
