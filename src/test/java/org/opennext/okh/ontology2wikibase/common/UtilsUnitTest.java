package org.opennext.okh.ontology2wikibase.common;

import static org.junit.Assert.*;

import java.nio.file.Paths;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.rio.RDFParseException;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.google.common.io.Resources;

/**
 * @since 0.1.0
 */
@RunWith(RandomizedRunner.class)
public class UtilsUnitTest extends RandomizedTest {

    private static final String BASE_URI = "http://example.org/okh";
    private static final ValueFactory VF = ValueFactoryImpl.getInstance();

    @Test
    public void testLoadOntologyFromFile() throws Exception {
        Model ontology = Utils.loadOntology(resourcePath("okh_sample.ttl"), BASE_URI);
        URI module = VF.createURI("http://example.org/okh#Module");
        assertTrue(ontology.contains(module, RDF.TYPE, OWL.CLASS));
        assertTrue(ontology.contains(VF.createURI(BASE_URI), RDF.TYPE, OWL.ONTOLOGY));
    }

    @Test(expected = RDFParseException.class)
    public void testLoadBadOntology() throws Exception {
        Utils.loadOntology(resourcePath("just_bad_rdf.ttl"), BASE_URI);
    }

    @Test
    public void testLocalName() {
        assertEquals("Module", Utils.localName(VF.createURI("http://example.org/okh#Module")));
        assertEquals("okh", Utils.localName(VF.createURI("http://example.org/okh")));
    }

    @Test
    public void testTruncate() {
        String shortText = randomAsciiLettersOfLength(randomIntBetween(1, 250));
        assertSame(shortText, Utils.truncate(shortText, 250));
        String longText = randomAsciiLettersOfLength(randomIntBetween(251, 1000));
        String truncated = Utils.truncate(longText, 250);
        assertEquals(250, truncated.length());
        assertEquals(longText.substring(0, 247) + "...", truncated);
    }

    @Test
    public void testIsUrl() {
        assertTrue(Utils.isUrl("https://github.com/OPEN-NEXT/OKH-LOSH"));
        assertTrue(Utils.isUrl(" http://example.org/repo "));
        assertTrue(Utils.isUrl("ftp://ftp.example.org/file.stl"));
        assertFalse(Utils.isUrl("MIT"));
        assertFalse(Utils.isUrl("mailto:someone@example.org"));
        assertFalse(Utils.isUrl("https://"));
        assertFalse(Utils.isUrl("not a url at all"));
    }

    static String resourcePath(String name) throws Exception {
        return Paths.get(Resources.getResource(name).toURI()).toString();
    }
}
