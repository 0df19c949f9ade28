package org.opennext.okh.ontology2wikibase.conversion;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.opennext.okh.ontology2wikibase.common.RdfVocabulary;
import org.opennext.okh.ontology2wikibase.common.Utils;
import org.opennext.okh.ontology2wikibase.common.WikibaseIdentifiers;
import org.openrdf.model.Literal;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.DCTERMS;
import org.openrdf.model.vocabulary.XMLSchema;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.Rio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * The correspondences between ontology URIs and Wikibase identifiers.
 * Records are only added: once a URI has an identifier, it keeps it.
 * <p>
 * The store is persisted as a Turtle links file, one subject per URI:
 * <pre>
 * &lt;https://example.org/okh#Module&gt; schema:identifier "Q12" ;
 *     dcterms:created "2021-08-24T10:00:00Z"^^xsd:dateTime .
 * </pre>
 *
 * @since 0.1.0
 */
public class CorrespondenceStore {

    private static final ValueFactory VF = ValueFactoryImpl.getInstance();
    private static final Logger log = LoggerFactory.getLogger(CorrespondenceStore.class);

    private final Map<URI, CorrespondenceRecord> records = new LinkedHashMap<>();
    private final Set<String> identifiers = new HashSet<>();

    /**
     * @return the Wikibase identifier of the given URI, or <code>null</code> if it has none yet.
     */
    public String lookup(URI source) {
        CorrespondenceRecord record = records.get(source);
        return record == null ? null : record.getTargetId();
    }

    public boolean contains(URI source) {
        return records.containsKey(source);
    }

    /**
     * Whether some URI corresponds to the given Wikibase identifier.
     */
    public boolean containsIdentifier(String targetId) {
        return identifiers.contains(targetId);
    }

    /**
     * Add a correspondence. Recording the same one twice is a no-op.
     *
     * @throws IllegalStateException if the URI already corresponds to another identifier.
     */
    public CorrespondenceRecord record(URI source, String targetId) {
        return record(source, targetId, Instant.now());
    }

    private CorrespondenceRecord record(URI source, String targetId, Instant created) {
        Preconditions.checkArgument(WikibaseIdentifiers.isValid(targetId), "Not a Wikibase identifier: %s", targetId);
        CorrespondenceRecord existing = records.get(source);
        if (existing != null) {
            if (existing.getTargetId().equals(targetId)) return existing;
            throw new IllegalStateException("<" + source + "> already corresponds to " + existing.getTargetId() + ", refusing " + targetId);
        }
        CorrespondenceRecord record = new CorrespondenceRecord(source, targetId, created);
        records.put(source, record);
        identifiers.add(targetId);
        log.debug("Recorded {}", record);
        return record;
    }

    public Collection<CorrespondenceRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public int size() {
        return records.size();
    }

    /**
     * Load the links file of a previous run. A missing file gives an empty store.
     * A URI with several identifiers keeps the first one.
     *
     * @throws IOException       if the file cannot be read.
     * @throws RDFParseException if the file is not valid Turtle.
     */
    public static CorrespondenceStore load(Path linksFile) throws IOException, RDFParseException {
        CorrespondenceStore store = new CorrespondenceStore();
        if (!Files.exists(linksFile)) {
            log.info("No links file at '{}', starting from scratch", linksFile);
            return store;
        }
        Model links;
        try (InputStream input = Files.newInputStream(linksFile)) {
            links = Utils.parse(input, linksFile.toUri().toString(), RDFFormat.TURTLE);
        }
        for (Statement statement : links.filter(null, RdfVocabulary.SCHEMA_IDENTIFIER, null)) {
            Resource subject = statement.getSubject();
            String targetId = statement.getObject().stringValue();
            if (!(subject instanceof URI) || !WikibaseIdentifiers.isValid(targetId)) {
                log.warn("Skipping malformed link in '{}': {}", linksFile, statement);
                continue;
            }
            URI source = (URI) subject;
            String known = store.lookup(source);
            if (known != null) {
                if (!known.equals(targetId)) log.warn("<{}> has several identifiers in '{}', keeping {} over {}", source, linksFile, known, targetId);
                continue;
            }
            store.record(source, targetId, created(links, source));
        }
        log.info("Loaded {} links from '{}'", store.size(), linksFile);
        return store;
    }

    private static Instant created(Model links, URI source) {
        for (Value value : links.filter(source, DCTERMS.CREATED, null).objects()) {
            if (!(value instanceof Literal)) continue;
            try {
                return ((Literal) value).calendarValue().toGregorianCalendar().toInstant();
            } catch (IllegalArgumentException iae) {
                log.warn("Invalid creation time for <{}>: {}", source, value);
            }
        }
        return null;
    }

    /**
     * Write all the records to the given links file, replacing it.
     */
    public void save(Path linksFile) throws IOException {
        Model links = new LinkedHashModel();
        links.setNamespace("schema", RdfVocabulary.SCHEMA_NAMESPACE);
        links.setNamespace("dcterms", DCTERMS.NAMESPACE);
        links.setNamespace("xsd", XMLSchema.NAMESPACE);
        for (CorrespondenceRecord record : records.values()) {
            links.add(record.getSource(), RdfVocabulary.SCHEMA_IDENTIFIER, VF.createLiteral(record.getTargetId()));
            if (record.getCreated() != null) {
                links.add(record.getSource(), DCTERMS.CREATED, VF.createLiteral(record.getCreated().toString(), XMLSchema.DATETIME));
            }
        }
        Path absolute = linksFile.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        Path temporary = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
        try (Writer writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
            Rio.write(links, writer, RDFFormat.TURTLE);
        } catch (RDFHandlerException rhe) {
            Files.deleteIfExists(temporary);
            throw new IOException("Failed serializing the links to '" + linksFile + "'", rhe);
        }
        Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING);
        log.info("Saved {} links to '{}'", records.size(), linksFile);
    }
}
