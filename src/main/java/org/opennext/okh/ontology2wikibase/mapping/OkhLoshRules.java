package org.opennext.okh.ontology2wikibase.mapping;

import static org.opennext.okh.ontology2wikibase.common.RdfVocabulary.OWL_ANNOTATION_PROPERTY;
import static org.opennext.okh.ontology2wikibase.common.RdfVocabulary.OWL_NAMED_INDIVIDUAL;
import static org.opennext.okh.ontology2wikibase.common.RdfVocabulary.epo;
import static org.opennext.okh.ontology2wikibase.common.RdfVocabulary.obo;
import static org.opennext.okh.ontology2wikibase.common.RdfVocabulary.schema;
import static org.opennext.okh.ontology2wikibase.common.RdfVocabulary.spdx;

import java.util.List;

import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.DC;
import org.openrdf.model.vocabulary.DCTERMS;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.SKOS;
import org.openrdf.model.vocabulary.XMLSchema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The fixed rules for the <a href="https://github.com/OPEN-NEXT/OKH-LOSH">OKH-LOSH</a> ontology.
 * Edit this class when the ontology starts using a new external predicate:
 * unmapped predicates are skipped with a warning during the conversion.
 * <p>
 * Most substitutes mirror a Wikidata property, which is kept for reference only:
 * the target Wikibase does not share Wikidata identifiers.
 *
 * @since 0.1.0
 */
public final class OkhLoshRules {

    /**
     * Tried in order: the first predicate with at least one value provides the labels.
     */
    public static final List<URI> LABEL_PREDICATES = ImmutableList.of(RDFS.LABEL, SKOS.PREF_LABEL, DCTERMS.TITLE, DC.TITLE);
    /**
     * Tried in order: the first predicate with at least one value provides the descriptions.
     */
    public static final List<URI> DESCRIPTION_PREDICATES = ImmutableList.of(RDFS.COMMENT, SKOS.DEFINITION, DCTERMS.DESCRIPTION, DC.DESCRIPTION);

    private OkhLoshRules() {
    }

    public static RuleTable create() {
        RuleTable.Builder rules = RuleTable.builder()
            .classDeclaration(OWL.CLASS)
            .classDeclaration(RDFS.CLASS)
            .classRule(OWL_NAMED_INDIVIDUAL, EntityKind.ITEM)
            .classRule(OWL.OBJECTPROPERTY, EntityKind.PROPERTY)
            .classRule(OWL.DATATYPEPROPERTY, EntityKind.PROPERTY)
            .classRule(OWL_ANNOTATION_PROPERTY, EntityKind.PROPERTY)
            .classRule(RDF.PROPERTY, EntityKind.PROPERTY)
            .ignoreType(OWL.ONTOLOGY)
            .nonClaim(LABEL_PREDICATES.toArray(new URI[0]))
            .nonClaim(DESCRIPTION_PREDICATES.toArray(new URI[0]))
            .nonClaim(RDFS.DOMAIN, OWL.CARDINALITY, OWL.MAXCARDINALITY, OWL.MINCARDINALITY)
            .metaValue(OWL.CLASS, RDFS.CLASS, OWL.THING, OWL_NAMED_INDIVIDUAL, OWL.OBJECTPROPERTY, OWL.DATATYPEPROPERTY,
                OWL_ANNOTATION_PROPERTY, RDF.PROPERTY, OWL.ONTOLOGY);

        rules.substitute(SubstituteTerm.property(RDF.TYPE, "instanceOf", Datatype.ITEM, "P31"));
        rules.substitute(SubstituteTerm.property(RDFS.SUBCLASSOF, "subClassOf", Datatype.ITEM, "P279"));
        rules.substitute(SubstituteTerm.property(RDFS.SUBPROPERTYOF, "subPropertyOf", Datatype.PROPERTY, "P1647"));
        rules.substitute(SubstituteTerm.property(schema("inLanguage"), "inLanguage", Datatype.STRING, "P305"));
        rules.substitute(SubstituteTerm.property(schema("version"), "version", Datatype.STRING, "P348"));
        rules.substitute(SubstituteTerm.property(schema("isBasedOn"), "isBasedOn", Datatype.PROPERTY, "P144"));
        rules.substitute(SubstituteTerm.property(schema("copyrightHolder"), "copyrightHolder", Datatype.ITEM, "P3931"));
        rules.substitute(SubstituteTerm.property(schema("licenseDeclared"), "licenseDeclared", Datatype.ITEM, "P2479"));
        // aka version type
        rules.substitute(SubstituteTerm.property(schema("creativeWorkStatus"), "creativeWorkStatus", Datatype.STRING, "P548"));
        // aka Commons compatible image available at URL
        rules.substitute(SubstituteTerm.property(schema("image"), "image", Datatype.URL, "P4765"));
        rules.substitute(SubstituteTerm.property(schema("hasPart"), "hasPart", Datatype.ITEM, "P527"));
        rules.substitute(SubstituteTerm.property(schema("codeRepository"), "sourceCodeRepository", Datatype.URL, "P1324"));
        // aka supported metadata
        rules.substitute(SubstituteTerm.property(schema("value"), "supportedMetaData", Datatype.STRING, "P8203"));
        // BFO function, aka scope and content
        rules.substitute(SubstituteTerm.property(obo("BFO_0000016"), "scopeAndContent", Datatype.STRING, "P7535"));
        rules.substitute(SubstituteTerm.property(schema("amount"), "quantity", Datatype.STRING, "P1114"));
        rules.substitute(SubstituteTerm.property(spdx("licenseDeclared"), "spdxLicenseDeclared", Datatype.STRING, "P2479"));
        rules.substitute(SubstituteTerm.property(epo("classificationIPCInventive"), "classificationIPCInventive", Datatype.STRING, "P5778"));
        rules.substitute(SubstituteTerm.property(schema("fileFormat"), "fileFormat", Datatype.STRING, null));
        rules.substitute(SubstituteTerm.property(RDFS.RANGE, "range", Datatype.ITEM, null));

        // Stand-ins for the literal ranges of datatype properties
        rules.substitute(SubstituteTerm.item(schema("URL"), "URL", null));
        rules.substitute(SubstituteTerm.item(XMLSchema.STRING, "text", null));
        rules.substitute(SubstituteTerm.item(XMLSchema.DECIMAL, "number", null));
        rules.substitute(SubstituteTerm.item(XMLSchema.BOOLEAN, "boolean", null));
        rules.substitute(SubstituteTerm.item(XMLSchema.DATETIME, "point in time", null));

        // Literal ranges are enumerated, class ranges resolve like any other reference
        rules.rule(MappingRule.constant(RDFS.RANGE, Datatype.ITEM, ImmutableMap.<Value, URI>builder()
            .put(XMLSchema.ANYURI, schema("URL"))
            .put(XMLSchema.STRING, XMLSchema.STRING)
            .put(XMLSchema.DECIMAL, XMLSchema.DECIMAL)
            .put(XMLSchema.INTEGER, XMLSchema.DECIMAL)
            .put(XMLSchema.NON_NEGATIVE_INTEGER, XMLSchema.DECIMAL)
            .put(XMLSchema.POSITIVE_INTEGER, XMLSchema.DECIMAL)
            .put(XMLSchema.INT, XMLSchema.DECIMAL)
            .put(XMLSchema.DOUBLE, XMLSchema.DECIMAL)
            .put(XMLSchema.FLOAT, XMLSchema.DECIMAL)
            .put(XMLSchema.BOOLEAN, XMLSchema.BOOLEAN)
            .put(XMLSchema.DATETIME, XMLSchema.DATETIME)
            .put(XMLSchema.DATE, XMLSchema.DATETIME)
            .build()));
        return rules.build();
    }
}
