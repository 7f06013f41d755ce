package com.pricetracker.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Developer entry point for working with patterns outside the fetch pipeline.
 * <p>
 * Commands:
 * <ul>
 *   <li>{@code test <pattern.json> <page.html> [page-url]} applies a pattern to a saved page and prints the
 *       extraction and validation as JSON.</li>
 *   <li>{@code health-report <out.csv>} exports the health of every stored pattern; needs DB_URL.</li>
 * </ul>
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_ERROR = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs a command.
     * @param args command-line arguments
     * @param out where reports are printed
     * @return process exit code
     */
    static int run(String[] args, PrintStream out) {
        if (args == null || args.length == 0) {
            printUsage(out);
            return EXIT_USAGE;
        }
        try {
            switch (args[0]) {
                case "test":
                    if (args.length < 3) {
                        printUsage(out);
                        return EXIT_USAGE;
                    }
                    return testPattern(Paths.get(args[1]), Paths.get(args[2]), args.length > 3 ? args[3] : null, out);
                case "health-report":
                    if (args.length < 2) {
                        printUsage(out);
                        return EXIT_USAGE;
                    }
                    return healthReport(Paths.get(args[1]));
                default:
                    printUsage(out);
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            logger.error("Failed to read input: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (StorageException e) {
            logger.error("Storage failure: {}", e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static int testPattern(Path patternFile, Path pageFile, String pageUrl, PrintStream out) throws IOException {
        Pattern pattern = PatternCodec.readPattern(Files.readString(patternFile, StandardCharsets.UTF_8));
        String html = Files.readString(pageFile, StandardCharsets.UTF_8);
        String url = pageUrl != null ? pageUrl : "https://" + pattern.domain() + "/";
        logger.info("Testing pattern for {} against {}", pattern.domain(), pageFile);

        ExtractionResult extraction = new Extractor().extract(PageSnapshot.ofHtml(html, url), pattern);
        ValidationResult validation = new Validator(ValidationSettings.fromEnvironment()).validate(extraction);

        ObjectNode report = MAPPER.createObjectNode();
        report.put("domain", pattern.domain());
        report.set("extraction", MAPPER.readTree(PatternCodec.writeExtraction(extraction)));
        ObjectNode v = report.putObject("validation");
        v.put("valid", validation.valid());
        v.put("confidence", validation.confidence());
        ArrayNode errors = v.putArray("errors");
        validation.errors().forEach(errors::add);
        ArrayNode warnings = v.putArray("warnings");
        validation.warnings().forEach(warnings::add);
        out.println(MAPPER.writeValueAsString(report));
        return validation.valid() ? EXIT_OK : EXIT_INVALID;
    }

    private static int healthReport(Path outFile) throws IOException, StorageException {
        Optional<PostgresService> db = PostgresService.fromEnvironment();
        if (db.isEmpty()) {
            logger.error("DB_URL is not set; cannot read patterns.");
            return EXIT_USAGE;
        }
        PostgresService postgres = db.get();
        List<Pattern> patterns = new ArrayList<>();
        for (String domain : postgres.findAllDomains()) {
            postgres.findByDomain(domain).ifPresent(patterns::add);
        }
        new CsvService().writePatternHealthToCSV(patterns, outFile);
        return EXIT_OK;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage:");
        out.println("  test <pattern.json> <page.html> [page-url]");
        out.println("  health-report <out.csv>");
    }
}
