package org.opennext.okh.ontology2wikibase.common;

import static org.junit.Assert.*;

import org.junit.Test;
import org.junit.runner.RunWith;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;

/**
 * @since 0.1.0
 */
@RunWith(RandomizedRunner.class)
public class WikibaseIdentifiersUnitTest extends RandomizedTest {

    @Test
    public void testValidTerms() {
        int number = randomIntBetween(1, Integer.MAX_VALUE);
        assertTrue(WikibaseIdentifiers.isValidTerm("Q" + number, WikibaseIdentifiers.ITEM));
        assertTrue(WikibaseIdentifiers.isValidTerm("P" + number, WikibaseIdentifiers.PROPERTY));
        assertFalse(WikibaseIdentifiers.isValidTerm("P" + number, WikibaseIdentifiers.ITEM));
        assertFalse(WikibaseIdentifiers.isValid("L" + number));
        assertFalse(WikibaseIdentifiers.isValid("Q"));
        assertFalse(WikibaseIdentifiers.isValid("q12"));
        assertFalse(WikibaseIdentifiers.isValid(" Q12"));
    }

    @Test
    public void testEntityType() {
        assertEquals(WikibaseIdentifiers.ITEM, WikibaseIdentifiers.entityType("Q3"));
        assertEquals(WikibaseIdentifiers.PROPERTY, WikibaseIdentifiers.entityType("P7"));
        assertEquals(7, WikibaseIdentifiers.numericId("P7"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEntityType() {
        WikibaseIdentifiers.entityType("M12");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownTermType() {
        WikibaseIdentifiers.isValidTerm("Q1", "lexeme");
    }
}
