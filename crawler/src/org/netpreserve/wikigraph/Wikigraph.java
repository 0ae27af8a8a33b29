package org.netpreserve.wikigraph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.wikigraph.archive.ExtractionException;
import org.netpreserve.wikigraph.archive.IndexBuilder;
import org.netpreserve.wikigraph.archive.IndexDatabase;
import org.netpreserve.wikigraph.config.JobConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class Wikigraph {
    private static final Logger log = LoggerFactory.getLogger(Wikigraph.class);

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of("data");
        Path output = null;
        Integer bound = null;
        boolean dumpConfig = false;
        String command = null;
        var arguments = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--bound", "-b" -> bound = Integer.parseInt(args[++i]);
                case "--job-dir", "-j" -> jobDir = Path.of(args[++i]);
                case "--output", "-o" -> output = Path.of(args[++i]);
                case "--help", "-h" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    if (command == null) {
                        command = args[i];
                    } else {
                        arguments.add(args[i]);
                    }
                }
            }
        }

        var mapper = newConfigMapper();
        JobConfig config = loadConfig(mapper, jobDir);
        if (bound != null) {
            config = config.withCrawl(config.crawl().withBound(bound));
        }
        if (dumpConfig) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }
        if (command == null) {
            printUsage();
            System.exit(1);
        }

        switch (command) {
            case "build-index" -> {
                if (arguments.size() != 1) {
                    System.err.println("Usage: wikigraph build-index LISTING");
                    System.exit(1);
                }
                buildIndex(jobDir, config, Path.of(arguments.get(0)));
            }
            case "extract" -> {
                if (arguments.size() != 1) {
                    System.err.println("Usage: wikigraph extract TITLE [-o FILE]");
                    System.exit(1);
                }
                if (output == null) output = jobDir.resolve("one_article.xml");
                if (!extract(jobDir, config, arguments.get(0), output)) System.exit(2);
            }
            case "crawl" -> {
                List<String> seeds = arguments.isEmpty() ? config.crawl().seeds() : arguments;
                if (seeds == null || seeds.isEmpty()) {
                    System.err.println("No seeds given on the command line or in the configuration");
                    System.exit(1);
                }
                try (var job = new Job(jobDir, config)) {
                    var stats = job.crawl(seeds);
                    System.out.println(stats);
                }
            }
            default -> {
                System.err.println("Unknown command: " + command);
                printUsage();
                System.exit(1);
            }
        }
    }

    private static void printUsage() {
        System.out.println("Usage: wikigraph [options] COMMAND [ARG...]");
        System.out.println("Commands:");
        System.out.println("  build-index LISTING      Build the index database from a multistream index listing");
        System.out.println("  extract TITLE            Write the XML of a single page to a file");
        System.out.println("  crawl [SEED...]          Crawl the link graph starting from the given titles");
        System.out.println("Options:");
        System.out.println("  -b, --bound N            Stop after N articles have been accepted");
        System.out.println("      --dump-config        Print the effective configuration and exit");
        System.out.println("  -h, --help");
        System.out.println("  -j, --job-dir DIR        Directory for job data and config.yaml (default: data)");
        System.out.println("  -o, --output FILE        Output file for extract");
    }

    static void buildIndex(Path jobDir, JobConfig config, Path listing) throws IOException {
        Path indexPath = jobDir.resolve(config.archive().index());
        Files.createDirectories(indexPath.toAbsolutePath().getParent());
        try (var index = IndexDatabase.open(indexPath)) {
            var result = new IndexBuilder(index).build(listing);
            System.out.println("Indexed " + result.entries() + " pages in " + result.streams() + " streams into " +
                               indexPath);
        }
    }

    static boolean extract(Path jobDir, JobConfig config, String title, Path output) throws IOException {
        try (var job = new Job(jobDir, config)) {
            var document = job.extract(title);
            Files.writeString(output, document.rawText(), StandardCharsets.UTF_8);
            log.info("Wrote page {} ({}) to {}", document.title(), document.documentId(), output);
            return true;
        } catch (ExtractionException e) {
            log.error("Unable to extract {}: {}", title, e.getMessage());
            return false;
        }
    }

    static ObjectMapper newConfigMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads the built-in defaults overlaid with the job directory's {@code config.yaml}, if there is one.
     */
    static JobConfig loadConfig(ObjectMapper mapper, Path jobDir) throws IOException {
        Path configFile = jobDir.resolve("config.yaml");
        var configTree = mapper.readTree(Wikigraph.class.getResourceAsStream("config/defaults.yaml"));
        if (Files.exists(configFile)) {
            JsonNode overrides = mapper.readTree(configFile.toFile());
            if (overrides != null && !overrides.isMissingNode()) configTree = deepMerge(configTree, overrides);
        }
        return mapper.treeToValue(configTree, JobConfig.class);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                JsonNode baseValue = merged.get(key);
                merged.set(key, deepMerge(baseValue, overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
