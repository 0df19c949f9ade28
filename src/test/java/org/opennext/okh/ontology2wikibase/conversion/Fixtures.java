package org.opennext.okh.ontology2wikibase.conversion;

import java.io.IOException;
import java.io.InputStream;

import org.opennext.okh.ontology2wikibase.common.Utils;
import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFParseException;

import com.google.common.io.Resources;

/**
 * Test ontologies under {@code src/test/resources}.
 */
final class Fixtures {

    static final String SAMPLE = "okh_sample.ttl";
    static final String SCENARIO = "okh_scenario.ttl";
    static final String LINKS = "okh_links.ttl";
    static final String BASE_URI = "http://example.org/okh";
    static final String OKH = BASE_URI + "#";

    private static final ValueFactory VF = ValueFactoryImpl.getInstance();

    private Fixtures() {
    }

    static Model load(String fileName) throws IOException, RDFParseException {
        try (InputStream input = Resources.asByteSource(Resources.getResource(fileName)).openBufferedStream()) {
            return Utils.parse(input, BASE_URI, RDFFormat.TURTLE);
        }
    }

    static URI okh(String localName) {
        return VF.createURI(OKH, localName);
    }

    /**
     * The <code>owl:Ontology</code> node of the sample.
     */
    static URI header() {
        return VF.createURI(BASE_URI);
    }
}
