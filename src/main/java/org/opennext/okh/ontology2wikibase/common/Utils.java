package org.opennext.okh.ontology2wikibase.common;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Locale;

import org.apache.http.client.fluent.Request;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.Rio;
import org.openrdf.rio.helpers.StatementCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * @since 0.1.0
 */
public final class Utils {

    /**
     * The ontology is published in Turtle, which is also the fallback for files with an unknown extension.
     */
    public static final RDFFormat DEFAULT_RDF_FORMAT = RDFFormat.TURTLE;
    private static final String ELLIPSIS = "...";
    private static final Logger log = LoggerFactory.getLogger(Utils.class);

    private Utils() {
    }

    /**
     * Parse the whole ontology in memory, keeping the statements in document order.
     *
     * @param location a local file path or an HTTP(S) URL.
     * @param baseURI  the base URI to resolve relative URIs against.
     * @return the parsed ontology graph.
     * @throws IOException       if the ontology cannot be read.
     * @throws RDFParseException if the ontology is not valid RDF.
     */
    public static Model loadOntology(String location, String baseURI) throws IOException, RDFParseException {
        RDFFormat format = Rio.getParserFormatForFileName(location, DEFAULT_RDF_FORMAT);
        log.info("Loading the ontology from '{}' as {}", location, format.getName());
        try (InputStream ontology = openLocation(location)) {
            return parse(ontology, baseURI, format);
        }
    }

    public static Model parse(InputStream input, String baseURI, RDFFormat format) throws IOException, RDFParseException {
        Model model = new LinkedHashModel();
        RDFParser parser = Rio.createParser(format);
        parser.setRDFHandler(new StatementCollector(model));
        try {
            parser.parse(input, baseURI);
        } catch (RDFHandlerException rhe) {
            // Only thrown by handlers, the collector never does
            throw new IOException("Failed collecting the parsed statements", rhe);
        }
        log.debug("Parsed {} statements", model.size());
        return model;
    }

    private static InputStream openLocation(String location) throws IOException {
        String lower = location.toLowerCase(Locale.ENGLISH);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return Request.Get(location)
                .execute()
                .returnContent().asStream();
        }
        return Files.newInputStream(Paths.get(location));
    }

    /**
     * The part of the URI after the last {@code #} or {@code /}, e.g., {@code Module} for {@code http://example.org/okh#Module}.
     */
    public static String localName(Resource resource) {
        if (resource instanceof URI) {
            String localName = ((URI) resource).getLocalName();
            if (!localName.isEmpty()) return localName;
        }
        return resource.stringValue().replaceAll(".*[#/]", "");
    }

    /**
     * Cut the given text to at most {@code maxLength} characters, ending with an ellipsis when it is cut.
     */
    public static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Only absolute HTTP(S) and FTP URLs with a host are considered URLs.
     */
    public static boolean isUrl(String value) {
        java.net.URI uri;
        try {
            uri = new java.net.URI(value.trim());
        } catch (URISyntaxException use) {
            return false;
        }
        String scheme = uri.getScheme();
        if (scheme == null || uri.getHost() == null) return false;
        scheme = scheme.toLowerCase(Locale.ENGLISH);
        return scheme.equals("http") || scheme.equals("https") || scheme.equals("ftp");
    }
}
