package org.opennext.okh.ontology2wikibase.cli;

import static org.junit.Assert.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Assume;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.opennext.okh.ontology2wikibase.common.Config;
import org.opennext.okh.ontology2wikibase.conversion.CorrespondenceStore;
import org.openrdf.model.impl.ValueFactoryImpl;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.google.common.io.Resources;

/**
 * @since 0.1.0
 */
@RunWith(RandomizedRunner.class)
public class ConvertCommandUnitTest extends RandomizedTest {

    private static String sample() throws Exception {
        return Paths.get(Resources.getResource("okh_sample.ttl").toURI()).toString();
    }

    @Test
    public void testDryRun() throws Exception {
        Path linksFile = Files.createTempDirectory("cli").resolve("links.ttl");
        int status = ConvertCommand.run("--dry", "--ontology", sample(), "--links", linksFile.toString());
        assertEquals(Config.SUCCESS_EXIT_CODE, status);

        CorrespondenceStore store = CorrespondenceStore.load(linksFile);
        // Dry runs number entities from 1
        assertEquals("Q1", store.lookup(ValueFactoryImpl.getInstance().createURI("http://schema.org/URL")));
        assertNotNull(store.lookup(ValueFactoryImpl.getInstance().createURI("http://example.org/okh#myModule")));

        // Again, on the same links file
        assertEquals(Config.SUCCESS_EXIT_CODE, ConvertCommand.run("-d", "-o", sample(), "-l", linksFile.toString()));
        assertEquals(store.size(), CorrespondenceStore.load(linksFile).size());
    }

    @Test
    public void testHelpAndVersion() {
        assertEquals(Config.SUCCESS_EXIT_CODE, ConvertCommand.run("--help"));
        assertEquals(Config.SUCCESS_EXIT_CODE, ConvertCommand.run("-v"));
    }

    @Test
    public void testSyntaxError() {
        assertEquals(ConvertCommand.INVALID_INPUT_EXIT_CODE, ConvertCommand.run("--no-such-option"));
        assertEquals(ConvertCommand.INVALID_INPUT_EXIT_CODE, ConvertCommand.run("--dry", "--links"));
    }

    @Test
    public void testMissingOntology() throws Exception {
        Path directory = Files.createTempDirectory("cli");
        int status = ConvertCommand.run("--dry", "-o", directory.resolve("missing.ttl").toString(), "-l", directory.resolve("links.ttl").toString());
        assertEquals(ConvertCommand.FAILURE_EXIT_CODE, status);
        assertFalse(Files.exists(directory.resolve("links.ttl")));
    }

    @Test
    public void testInvalidArguments() {
        assertEquals(ConvertCommand.INVALID_INPUT_EXIT_CODE, ConvertCommand.run("-a", "http://wiki base/api.php", "someone", "secret"));
        Assume.assumeTrue(System.getenv("PASSWD") == null);
        assertEquals(ConvertCommand.INVALID_INPUT_EXIT_CODE, ConvertCommand.run("someone"));
    }

    @Test
    public void testFailuresWhileConvertingAreNotInputErrors() throws Exception {
        Path directory = Files.createTempDirectory("cli");
        // Loading fails with an IllegalArgumentException, the space is not valid in a URI
        int status = ConvertCommand.run("--dry", "-o", "http://example.org/okh losh.ttl", "-l", directory.resolve("links.ttl").toString());
        assertEquals(ConvertCommand.FAILURE_EXIT_CODE, status);
    }
}
