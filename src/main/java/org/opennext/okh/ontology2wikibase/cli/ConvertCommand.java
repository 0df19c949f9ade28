package org.opennext.okh.ontology2wikibase.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.opennext.okh.ontology2wikibase.common.Config;
import org.opennext.okh.ontology2wikibase.common.Utils;
import org.opennext.okh.ontology2wikibase.conversion.ConversionOrchestrator;
import org.opennext.okh.ontology2wikibase.conversion.ConversionReport;
import org.opennext.okh.ontology2wikibase.conversion.CorrespondenceStore;
import org.opennext.okh.ontology2wikibase.mapping.OkhLoshRules;
import org.opennext.okh.ontology2wikibase.wikibase.ApiWikibaseClient;
import org.opennext.okh.ontology2wikibase.wikibase.DryRunWikibaseClient;
import org.opennext.okh.ontology2wikibase.wikibase.WikibaseClient;
import org.openrdf.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * Command line entry point: convert the OKH-LOSH ontology into items and properties of a Wikibase instance.
 * <pre>
 * convert [OPTIONS] USER PASSWORD
 * </pre>
 * The credentials default to the {@code USER} and {@code PASSWD} environment variables.
 *
 * @since 0.1.0
 */
public final class ConvertCommand {

    static final int INVALID_INPUT_EXIT_CODE = -1;
    static final int FAILURE_EXIT_CODE = -2;

    private static final String USAGE = "convert [OPTIONS] USER PASSWORD";
    private static final String HEADER = "Converts the OKH-LOSH RDF ontology into items and properties in a Wikibase instance, "
        + "through its API (api.php). Already converted URIs are read from and written to the links file.";
    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    private ConvertCommand() {
    }

    public static void main(String... args) {
        System.exit(run(args));
    }

    /**
     * @return the process exit status.
     */
    static int run(String... args) {
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options(), args);
        } catch (ParseException pe) {
            System.err.println("SYNTAX ERROR. " + pe.getMessage());
            printHelp();
            return INVALID_INPUT_EXIT_CODE;
        }
        if (cmd.hasOption('h')) {
            printHelp();
            return Config.SUCCESS_EXIT_CODE;
        }
        if (cmd.hasOption('v')) {
            System.out.println("convert (OKH-LOSH ontology to Wikibase) " + version());
            return Config.SUCCESS_EXIT_CODE;
        }
        if (cmd.hasOption("debug")) enableDebug();

        boolean dry = cmd.hasOption('d');
        List<String> arguments = cmd.getArgList();
        String user = arguments.size() > 0 ? arguments.get(0) : System.getenv("USER");
        String password = arguments.size() > 1 ? arguments.get(1) : System.getenv("PASSWD");
        if (!dry && (user == null || password == null)) {
            System.err.println("INVALID INPUT. Missing credentials: pass USER and PASSWORD, or set the USER and PASSWD environment variables");
            return INVALID_INPUT_EXIT_CODE;
        }
        String ontologyLocation = cmd.getOptionValue('o', Config.ONTOLOGY);
        Path linksFile;
        WikibaseClient client;
        try {
            linksFile = cmd.hasOption('l') ? Paths.get(cmd.getOptionValue('l')) : Config.LINKS_FILE;
            client = dry ? new DryRunWikibaseClient() : new ApiWikibaseClient(cmd.getOptionValue('a', Config.WIKIBASE_API));
        } catch (IllegalArgumentException iae) {
            System.err.println("INVALID INPUT. " + iae.getMessage());
            return INVALID_INPUT_EXIT_CODE;
        }

        try (WikibaseClient session = client) {
            Model ontology = Utils.loadOntology(ontologyLocation, Config.ONTOLOGY_BASE_URI);
            CorrespondenceStore store = CorrespondenceStore.load(linksFile);
            session.login(user, password);
            ConversionOrchestrator orchestrator = new ConversionOrchestrator(OkhLoshRules.create(), store, session, linksFile, Config.DEFAULT_LANGUAGE);
            ConversionReport report = orchestrator.run(ontology);
            for (String warning : report.warnings()) System.out.println("WARNING: " + warning);
            System.out.println("done. " + report);
            return Config.SUCCESS_EXIT_CODE;
        } catch (Exception e) {
            log.error("Conversion failed", e);
            System.err.println("EXECUTION FAILED. " + e.getMessage());
            return FAILURE_EXIT_CODE;
        }
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("d").longOpt("dry").desc("log what would be done, without touching the Wikibase").build());
        options.addOption(Option.builder().longOpt("debug").desc("log the API requests and answers").build());
        options.addOption(Option.builder("o").longOpt("ontology").hasArg().argName("FILE|URL")
            .desc("read the ontology from FILE or URL (default: " + Config.ONTOLOGY + ")").build());
        options.addOption(Option.builder("l").longOpt("links").hasArg().argName("FILE")
            .desc("read and write the URI to identifier links in FILE (default: " + Config.LINKS_FILE + ")").build());
        options.addOption(Option.builder("a").longOpt("api").hasArg().argName("URL")
            .desc("use the Wikibase API at URL (default: " + Config.WIKIBASE_API + ")").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this help message and exit").build());
        options.addOption(Option.builder("v").longOpt("version").desc("print version information and exit").build());
        return options;
    }

    private static void printHelp() {
        PrintWriter out = new PrintWriter(System.out);
        new HelpFormatter().printHelp(out, 100, USAGE, HEADER, options(), 2, 2, null);
        out.flush();
    }

    private static String version() {
        String version = ConvertCommand.class.getPackage().getImplementationVersion();
        return version == null ? "(development build)" : version;
    }

    private static void enableDebug() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
