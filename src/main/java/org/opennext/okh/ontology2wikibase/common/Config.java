package org.opennext.okh.ontology2wikibase.common;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.Ints;

/**
 * A set of configuration constants and parameters used by the ontology converter.
 * Parameters are passed through the environment variables listed below, each one has a default.
 * <ul>
 * <li>{@code WIKIBASE_API}: URL of the target Wikibase {@code api.php}, e.g., {@code http://losh.ose-germany.de/api.php};</li>
 * <li>{@code ONTOLOGY}: local path or URL of the OKH-LOSH Turtle file;</li>
 * <li>{@code ONTOLOGY_BASE_URI}: base URI used to parse the ontology, also the URI of its {@code owl:Ontology} header;</li>
 * <li>{@code LINKS_FILE}: Turtle file holding the correspondences between ontology URIs and Wikibase identifiers;</li>
 * <li>{@code DEFAULT_LANGUAGE}: language code assigned to labels and descriptions without a language tag;</li>
 * <li>{@code SUCCESS_EXIT_CODE}: process exit status of a successful conversion, e.g., {@code 0}.</li>
 * </ul>
 * Command line options override the corresponding values, see {@link org.opennext.okh.ontology2wikibase.cli.ConvertCommand}.
 *
 * @since 0.1.0
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    /**
     * The OHO Wikibase instance.
     */
    public static final String DEFAULT_WIKIBASE_API = "http://losh.ose-germany.de/api.php";
    public static final String LOCAL_ONTOLOGY = "../LOSH/OKH-LOSH.ttl";
    public static final String REMOTE_ONTOLOGY = "https://raw.githubusercontent.com/OPEN-NEXT/OKH-LOSH/master/OKH-LOSH.ttl";

    public static final String WIKIBASE_API = env("WIKIBASE_API", DEFAULT_WIKIBASE_API);
    public static final String ONTOLOGY = env("ONTOLOGY", Files.exists(Paths.get(LOCAL_ONTOLOGY)) ? LOCAL_ONTOLOGY : REMOTE_ONTOLOGY);
    public static final String ONTOLOGY_BASE_URI = env("ONTOLOGY_BASE_URI", "https://github.com/OPEN-NEXT/OKH-LOSH/raw/master/OKH-LOSH.ttl");
    public static final Path LINKS_FILE = Paths.get(env("LINKS_FILE", "ont2wb_links.ttl"));
    public static final String DEFAULT_LANGUAGE = env("DEFAULT_LANGUAGE", "en");
    public static final int SUCCESS_EXIT_CODE = intValue("SUCCESS_EXIT_CODE", System.getenv("SUCCESS_EXIT_CODE"), 0);
    /**
     * Wikibase rejects longer descriptions.
     */
    public static final int MAX_DESCRIPTION_LENGTH = 250;
    /**
     * Joins several labels or descriptions in the same language.
     */
    public static final String TEXT_SEPARATOR = "\n\n";

    private Config() {
    }

    private static String env(String name, String defaultValue) {
        return MoreObjects.firstNonNull(System.getenv(name), defaultValue);
    }

    /**
     * A malformed value falls back to the default, with a warning.
     */
    static int intValue(String name, String value, int defaultValue) {
        if (value == null) return defaultValue;
        Integer parsed = Ints.tryParse(value.trim());
        if (parsed == null) {
            log.warn("The {} environment variable should be an integer, got '{}'. Using {} instead", name, value, defaultValue);
            return defaultValue;
        }
        return parsed;
    }
}
