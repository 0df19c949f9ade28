package org.opennext.okh.ontology2wikibase.mapping;

import static org.junit.Assert.*;

import java.io.InputStream;

import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.opennext.okh.ontology2wikibase.common.RdfVocabulary;
import org.opennext.okh.ontology2wikibase.common.Utils;
import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;
import org.openrdf.rio.RDFFormat;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;

/**
 * @since 0.1.0
 */
@RunWith(RandomizedRunner.class)
public class RuleTableUnitTest extends RandomizedTest {

    private static final String OKH = "http://example.org/okh#";
    private static final ValueFactory VF = ValueFactoryImpl.getInstance();

    private static Model ontology;

    @BeforeClass
    public static void setUpOnce() throws Exception {
        try (InputStream input = Resources.asByteSource(Resources.getResource("okh_sample.ttl")).openBufferedStream()) {
            ontology = Utils.parse(input, "http://example.org/okh", RDFFormat.TURTLE);
        }
    }

    private static URI okh(String localName) {
        return VF.createURI(OKH, localName);
    }

    @Test
    public void testFixedRules() {
        RuleTable rules = OkhLoshRules.create();
        assertEquals(EntityKind.ITEM, rules.classRule(OWL.CLASS));
        assertEquals(EntityKind.PROPERTY, rules.classRule(OWL.DATATYPEPROPERTY));
        assertEquals(EntityKind.ITEM, rules.classRule(RdfVocabulary.OWL_NAMED_INDIVIDUAL));
        assertTrue(rules.isIgnoredType(OWL.ONTOLOGY));
        assertTrue(rules.isNonClaim(RDFS.LABEL));
        assertTrue(rules.isNonClaim(RDFS.DOMAIN));
        assertFalse(rules.isNonClaim(RDF.TYPE));
        assertTrue(rules.isMetaValue(OWL.OBJECTPROPERTY));
        assertNull(rules.rule(okh("name")));
        assertNull(rules.classRule(okh("Module")));
    }

    @Test
    public void testSubstitutesMapTheirPredicates() {
        RuleTable rules = OkhLoshRules.create();
        SubstituteTerm subClassOf = rules.substitute(RDFS.SUBCLASSOF);
        assertEquals(EntityKind.PROPERTY, subClassOf.getKind());
        assertEquals("P279", subClassOf.getWikidataEquivalent());
        MappingRule rule = rules.rule(RDFS.SUBCLASSOF);
        assertEquals(ValueTransform.REFERENCE, rule.getTransform());
        assertEquals(Datatype.ITEM, rule.getDatatype());

        MappingRule image = rules.rule(RdfVocabulary.schema("image"));
        assertEquals(ValueTransform.LITERAL, image.getTransform());
        assertEquals(Datatype.URL, image.getDatatype());

        assertEquals(EntityKind.ITEM, rules.substitute(XMLSchema.STRING).getKind());
    }

    @Test
    public void testRangesAreEnumerated() {
        MappingRule range = OkhLoshRules.create().rule(RDFS.RANGE);
        assertEquals(ValueTransform.CONSTANT, range.getTransform());
        assertEquals(RdfVocabulary.schema("URL"), range.constantFor(XMLSchema.ANYURI));
        assertEquals(XMLSchema.DECIMAL, range.constantFor(XMLSchema.INTEGER));
        assertNull(range.constantFor(okh("Part")));
    }

    @Test
    public void testRulesDerivedFromTheOntology() {
        RuleTable rules = OkhLoshRules.create().forOntology(ontology);
        assertEquals(EntityKind.ITEM, rules.classRule(okh("Module")));
        assertEquals(EntityKind.ITEM, rules.classRule(okh("Gadget")));
        assertNull(rules.classRule(okh("Undeclared")));

        assertEquals(ValueTransform.REFERENCE, rules.rule(okh("hasComponent")).getTransform());
        assertEquals(Datatype.ITEM, rules.rule(okh("hasComponent")).getDatatype());
        assertEquals(Datatype.STRING, rules.rule(okh("name")).getDatatype());
        assertEquals(Datatype.QUANTITY, rules.rule(okh("weight")).getDatatype());
        assertEquals(Datatype.URL, rules.rule(okh("repo")).getDatatype());
        assertNull(rules.rule(okh("unmapped")));
    }

    @Test
    public void testExistingRulesTakePrecedence() {
        RuleTable rules = RuleTable.builder()
            .classDeclaration(OWL.CLASS)
            .classRule(OWL.DATATYPEPROPERTY, EntityKind.PROPERTY)
            .rule(MappingRule.literal(okh("weight"), Datatype.STRING))
            .build()
            .forOntology(ontology);
        assertEquals(Datatype.STRING, rules.rule(okh("weight")).getDatatype());
        assertEquals(Datatype.URL, rules.rule(okh("repo")).getDatatype());
        // Object properties are not mapped by this table, so their nodes are not properties
        assertNull(rules.rule(okh("hasComponent")));
    }

    @Test
    public void testKindOf() {
        RuleTable rules = OkhLoshRules.create();
        assertEquals(EntityKind.ITEM, rules.kindOf(ImmutableList.of(RdfVocabulary.OWL_NAMED_INDIVIDUAL, OWL.OBJECTPROPERTY)));
        assertEquals(EntityKind.PROPERTY, rules.kindOf(ImmutableList.of(okh("Undeclared"), OWL.OBJECTPROPERTY)));
        assertNull(rules.kindOf(ImmutableList.of(okh("Undeclared"))));
        assertTrue(rules.hasIgnoredType(ImmutableList.of(OWL.ONTOLOGY)));
    }

    @Test
    public void testPins() {
        String id = "P" + randomIntBetween(1, 1000);
        RuleTable rules = RuleTable.builder().pin(okh("hasLicense"), id).build();
        assertEquals(ImmutableMap.of(okh("hasLicense"), id), rules.pins());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLiteralRuleNeedsLiteralDatatype() {
        MappingRule.literal(okh("name"), Datatype.ITEM);
    }
}
