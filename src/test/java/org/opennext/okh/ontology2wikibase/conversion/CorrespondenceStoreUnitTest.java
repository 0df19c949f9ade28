package org.opennext.okh.ontology2wikibase.conversion;

import static org.junit.Assert.*;
import static org.opennext.okh.ontology2wikibase.conversion.Fixtures.okh;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

import org.junit.Test;
import org.junit.runner.RunWith;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.google.common.io.Resources;

/**
 * @since 0.1.0
 */
@RunWith(RandomizedRunner.class)
public class CorrespondenceStoreUnitTest extends RandomizedTest {

    @Test
    public void testRecordAndLookup() {
        CorrespondenceStore store = new CorrespondenceStore();
        assertNull(store.lookup(okh("Module")));
        String id = "Q" + randomIntBetween(1, 10000);
        CorrespondenceRecord record = store.record(okh("Module"), id);
        assertEquals(id, store.lookup(okh("Module")));
        assertTrue(store.contains(okh("Module")));
        assertTrue(store.containsIdentifier(id));
        assertFalse(store.containsIdentifier("P1"));
        assertNotNull(record.getCreated());
        // Same correspondence again: nothing changes
        assertSame(record, store.record(okh("Module"), id));
        assertEquals(1, store.size());
    }

    @Test(expected = IllegalStateException.class)
    public void testRecordsAreNeverOverwritten() {
        CorrespondenceStore store = new CorrespondenceStore();
        store.record(okh("Module"), "Q1");
        store.record(okh("Module"), "Q2");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRecordNeedsIdentifier() {
        new CorrespondenceStore().record(okh("Module"), "Module");
    }

    @Test
    public void testSaveThenLoad() throws Exception {
        Path linksFile = Files.createTempDirectory("links").resolve("ont2wb_links.ttl");
        CorrespondenceStore store = new CorrespondenceStore();
        store.record(okh("Module"), "Q1");
        store.record(okh("name"), "P1");
        store.save(linksFile);
        store.record(okh("Part"), "Q2");
        store.save(linksFile);

        CorrespondenceStore loaded = CorrespondenceStore.load(linksFile);
        assertEquals(3, loaded.size());
        assertEquals("Q1", loaded.lookup(okh("Module")));
        assertEquals("P1", loaded.lookup(okh("name")));
        assertEquals("Q2", loaded.lookup(okh("Part")));
        for (CorrespondenceRecord record : loaded.records()) {
            assertNotNull(record.getCreated());
        }
    }

    @Test
    public void testLoadMissingFile() throws Exception {
        Path linksFile = Files.createTempDirectory("links").resolve("missing.ttl");
        assertEquals(0, CorrespondenceStore.load(linksFile).size());
    }

    @Test
    public void testLoadLinksOfPreviousVersions() throws Exception {
        CorrespondenceStore store = CorrespondenceStore.load(Paths.get(Resources.getResource(Fixtures.LINKS).toURI()));
        assertEquals(3, store.size());
        assertEquals("P4", store.lookup(okh("name")));
        // Several identifiers: the first one wins
        assertEquals("Q13", store.lookup(okh("Part")));
        assertFalse(store.containsIdentifier("Q14"));
        assertFalse(store.contains(okh("broken")));
        for (CorrespondenceRecord record : store.records()) {
            if (record.getSource().equals(okh("Module"))) {
                assertEquals(Instant.parse("2021-08-24T10:15:30Z"), record.getCreated());
            } else {
                assertNull(record.getCreated());
            }
        }
    }
}
