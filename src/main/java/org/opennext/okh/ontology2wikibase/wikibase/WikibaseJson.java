package org.opennext.okh.ontology2wikibase.wikibase;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.opennext.okh.ontology2wikibase.common.WikibaseIdentifiers;
import org.opennext.okh.ontology2wikibase.mapping.EntityKind;

/**
 * Serialize entities to the <a href="https://www.mediawiki.org/wiki/Wikibase/DataModel/JSON">Wikibase JSON</a> expected
 * by the {@code wbeditentity} API action, and read its answers.
 *
 * @since 0.1.0
 */
final class WikibaseJson {

    private static final Pattern EXISTING_ITEM = Pattern.compile("\\[\\[Item:(Q[0-9]+)");
    private static final Pattern EXISTING_PROPERTY = Pattern.compile("\\[\\[Property:(P[0-9]+)");
    private static final String CONFLICT_MARKER = " already has ";

    private WikibaseJson() {
    }

    /**
     * The {@code data} parameter of {@code wbeditentity}.
     *
     * @param withDatatype whether to include the property datatype, which can only be set on creation.
     */
    static JSONObject entityData(TargetEntity entity, boolean withDatatype) {
        JSONObject data = new JSONObject();
        data.put("labels", terms(entity.getLabels()));
        data.put("descriptions", terms(entity.getDescriptions()));
        if (withDatatype && entity.getKind() == EntityKind.PROPERTY) data.put("datatype", entity.getDatatype().id());
        if (!entity.getClaims().isEmpty()) {
            JSONObject claims = new JSONObject();
            for (Claim claim : entity.getClaims()) {
                JSONArray statements = (JSONArray) claims.get(claim.getPropertyId());
                if (statements == null) {
                    statements = new JSONArray();
                    claims.put(claim.getPropertyId(), statements);
                }
                statements.add(statement(claim));
            }
            data.put("claims", claims);
        }
        return data;
    }

    private static JSONObject terms(Map<String, String> texts) {
        JSONObject terms = new JSONObject();
        for (Map.Entry<String, String> text : texts.entrySet()) {
            JSONObject term = new JSONObject();
            term.put("language", text.getKey());
            term.put("value", text.getValue());
            terms.put(text.getKey(), term);
        }
        return terms;
    }

    static JSONObject statement(Claim claim) {
        JSONObject dataValue = new JSONObject();
        dataValue.put("value", value(claim));
        dataValue.put("type", claim.getDatatype().valueType());
        JSONObject mainSnak = new JSONObject();
        mainSnak.put("snaktype", "value");
        mainSnak.put("property", claim.getPropertyId());
        mainSnak.put("datatype", claim.getDatatype().id());
        mainSnak.put("datavalue", dataValue);
        JSONObject statement = new JSONObject();
        statement.put("mainsnak", mainSnak);
        statement.put("type", "statement");
        statement.put("rank", "normal");
        return statement;
    }

    private static Object value(Claim claim) {
        switch (claim.getDatatype()) {
        case ITEM:
        case PROPERTY:
            JSONObject entityId = new JSONObject();
            entityId.put("entity-type", WikibaseIdentifiers.entityType(claim.getValue()));
            entityId.put("id", claim.getValue());
            entityId.put("numeric-id", WikibaseIdentifiers.numericId(claim.getValue()));
            return entityId;
        case QUANTITY:
            JSONObject quantity = new JSONObject();
            quantity.put("amount", signedAmount(claim.getValue()));
            quantity.put("unit", claim.getUnit());
            return quantity;
        default:
            return claim.getValue();
        }
    }

    /**
     * Wikibase amounts carry an explicit sign, e.g., {@code +42}.
     */
    static String signedAmount(String amount) {
        String trimmed = amount.trim();
        if (trimmed.startsWith("+") || trimmed.startsWith("-")) return trimmed;
        return "+" + trimmed;
    }

    static JSONObject parse(String answer) throws ParseException {
        Object parsed = new JSONParser().parse(answer);
        if (!(parsed instanceof JSONObject)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, parsed);
        return (JSONObject) parsed;
    }

    /**
     * Follow the given path of object keys.
     *
     * @return the string at the end of the path, or <code>null</code> if any step is missing.
     */
    static String stringAt(JSONObject json, String... path) {
        Object current = json;
        for (String key : path) {
            if (!(current instanceof JSONObject)) return null;
            current = ((JSONObject) current).get(key);
        }
        return current == null ? null : current.toString();
    }

    /**
     * Wikibase refuses to create an entity with the label of an existing one, and names the existing entity in the error.
     *
     * @return the identifier of the existing entity, or <code>null</code> if the error is not a label conflict.
     */
    static String conflictingEntity(String errorInfo, EntityKind kind) {
        if (errorInfo == null || !errorInfo.contains(CONFLICT_MARKER)) return null;
        Matcher matcher = (kind == EntityKind.ITEM ? EXISTING_ITEM : EXISTING_PROPERTY).matcher(errorInfo);
        return matcher.find() ? matcher.group(1) : null;
    }
}
