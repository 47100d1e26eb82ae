package org.carball.bom.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.bom.aggregator.Order;
import org.carball.bom.aggregator.OrderAggregator;
import org.carball.bom.catalog.PartCatalog;
import org.carball.bom.config.BomOptimizerConfig;
import org.carball.bom.config.ConfigurationLoader;
import org.carball.bom.config.OptimizerSettings;
import org.carball.bom.config.OutputFormat;
import org.carball.bom.config.ShippingProfile;
import org.carball.bom.model.order.OrderResult;
import org.carball.bom.model.order.PartSelection;
import org.carball.bom.model.order.VendorExclusion;
import org.carball.bom.output.OrderReport;
import org.carball.bom.parser.CatalogDefinitionParser;
import org.carball.bom.parser.OrderDefinitionParser;
import org.carball.bom.quote.JsonFileQuoteProvider;
import org.carball.bom.quote.QuoteCache;
import org.carball.bom.quote.QuoteProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Arrays;

@Slf4j
public class BomOptimizerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            BOM Vendor Optimizer v%s                        ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;
    private static final String DEFAULT_CACHE_FILE = "quote-cache.json";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            return args.length < 2 && !isHelpRequested(args) ? 1 : 0;
        }

        try {
            BomOptimizerConfig config = parseArgs(args);

            System.out.println("\n🔍 Starting order optimization...");
            System.out.println("   Catalog: " + config.getCatalogFile());
            System.out.println("   Order: " + config.getOrderFile());
            System.out.println("   Quote cache: " + config.getCacheFile());
            if (config.getQuoteFeedFile() != null) {
                System.out.println("   Quote feed: " + config.getQuoteFeedFile());
            }
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            ConfigurationLoader loader = new ConfigurationLoader();
            OptimizerSettings settings = loader.loadConfiguration(config.getProfileName(), config.getSettingsFile(), args);

            // Step 1: catalog and order definitions
            System.out.print("📚 Loading part catalog... ");
            PartCatalog catalog = new CatalogDefinitionParser().parse(config.getCatalogFile());
            System.out.println("✓ (" + catalog.size() + " parts)");

            System.out.print("📋 Loading order... ");
            Order order = new OrderDefinitionParser().parse(config.getOrderFile());
            config.getExcludedVendors().forEach(order::excludeVendor);
            config.getAllowedVendors().forEach(order::allowVendor);
            System.out.println("✓ (" + order.getBoards().size() + " boards)");

            // Step 2: quote sources
            System.out.print("💾 Loading quote cache... ");
            QuoteCache cache = new QuoteCache(config.getCacheFile(), settings.getCacheTtl(), Clock.systemUTC());
            int stale = cache.load();
            System.out.println("✓ (" + cache.size() + " parts, " + stale + " stale quotes dropped)");

            QuoteProvider provider = config.getQuoteFeedFile() == null
                    ? QuoteProvider.none()
                    : new JsonFileQuoteProvider(config.getQuoteFeedFile(), settings.toExchangeRates(), Clock.systemUTC());

            // Step 3: selection and vendor reduction
            System.out.print("⚙️  Selecting vendors... ");
            OrderAggregator aggregator = new OrderAggregator(catalog, cache, provider, settings);
            OrderResult result = aggregator.process(order);
            System.out.println("✓");

            // Step 4: output
            System.out.print("📝 Writing results... ");
            outputResults(result, settings, config);
            System.out.println("✓");

            printSummary(result, config);

            System.out.println("\n✅ Optimization complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }

            if (result.missingPartsCount() > 0 || result.errorCount() > 0) {
                System.out.println("\n💡 " + result.missingPartsCount() + " parts could not be sourced and "
                        + result.errorCount() + " board parts were not in the catalog.");
            }
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar bom-optimizer.jar <catalog-file> <order-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  catalog-file        Part catalog definition (.yaml, .yml or .json)");
        System.out.println("  order-file          Order definition listing boards and their parts");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the order report (default: order.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --cache             Quote cache file (default: " + DEFAULT_CACHE_FILE + ")");
        System.out.println("  --quotes            JSON quote feed used for parts missing from the cache");
        System.out.println("  --profile           Shipping profile: " + ShippingProfile.getAvailableProfiles());
        System.out.println("  --settings          YAML file with optimizer settings (optional)");
        System.out.println("  --exclude-vendor    Never order from this vendor (repeatable)");
        System.out.println("  --allow-vendor      Only order from allowed vendors (repeatable)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.print(ShippingProfile.getProfileHelp());
        System.out.println();
        System.out.print(ConfigurationLoader.getSettingsHelp());
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Price an order from cached and fed quotes");
        System.out.println("  java -jar bom-optimizer.jar catalog.yaml order.yaml --quotes quotes.json");
        System.out.println();
        System.out.println("  # Consolidate into as few vendors as practical, Markdown report");
        System.out.println("  java -jar bom-optimizer.jar catalog.yaml order.yaml --profile consolidate -f markdown");
    }

    static BomOptimizerConfig parseArgs(String[] args) {
        BomOptimizerConfig config = new BomOptimizerConfig();
        config.setCatalogFile(Paths.get(args[0]));
        config.setOrderFile(Paths.get(args[1]));

        config.setOutputFile("order.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setCacheFile(Paths.get(DEFAULT_CACHE_FILE));
        config.setVerbose(false);

        for (int i = 2; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--settings.")) {
                // Value is applied by ConfigurationLoader
                requireValue(args, i, "Value for " + arg);
                i++;
                continue;
            }

            switch (arg) {
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file"));
                    break;

                case "--format":
                case "-f":
                    String formatName = requireValue(args, i++, "Output format");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(formatName.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--cache":
                    config.setCacheFile(Paths.get(requireValue(args, i++, "Quote cache file")));
                    break;

                case "--quotes":
                    config.setQuoteFeedFile(Paths.get(requireValue(args, i++, "Quote feed file")));
                    break;

                case "--profile":
                    String profileName = requireValue(args, i++, "Profile");
                    ShippingProfile.fromName(profileName);
                    config.setProfileName(profileName);
                    break;

                case "--settings":
                    config.setSettingsFile(Paths.get(requireValue(args, i++, "Settings file")));
                    break;

                case "--exclude-vendor":
                    config.getExcludedVendors().add(requireValue(args, i++, "Excluded vendor"));
                    break;

                case "--allow-vendor":
                    config.getAllowedVendors().add(requireValue(args, i++, "Allowed vendor"));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        String baseFileName = removeFileExtension(config.getOutputFile());
        switch (config.getOutputFormat()) {
            case MARKDOWN:
                config.setOutputFile(baseFileName + ".md");
                break;
            case BOTH:
            case JSON:
            default:
                config.setOutputFile(baseFileName + ".json");
                break;
        }

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int i, String what) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[i + 1];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(BomOptimizerConfig config) {
        if (!Files.exists(config.getCatalogFile())) {
            throw new IllegalArgumentException("Catalog file not found: " + config.getCatalogFile());
        }
        if (!Files.exists(config.getOrderFile())) {
            throw new IllegalArgumentException("Order file not found: " + config.getOrderFile());
        }
        if (config.getQuoteFeedFile() != null && !Files.exists(config.getQuoteFeedFile())) {
            throw new IllegalArgumentException("Quote feed file not found: " + config.getQuoteFeedFile());
        }
        if (config.getSettingsFile() != null && !Files.exists(config.getSettingsFile())) {
            throw new IllegalArgumentException("Settings file not found: " + config.getSettingsFile());
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static void outputResults(OrderResult result, OptimizerSettings settings,
                                      BomOptimizerConfig config) throws IOException {

        OrderReport report = new OrderReport(result, settings);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".json" : config.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".md" : config.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printSummary(OrderResult result, BomOptimizerConfig config) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ORDER SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nChoice parts: " + result.selections().size());
        System.out.println("Missing parts: " + result.missingPartsCount());
        System.out.println("Errors: " + result.errorCount());

        if (!result.vendorExclusions().isEmpty()) {
            System.out.println("\nVendor reduction:");
            for (VendorExclusion exclusion : result.vendorExclusions()) {
                System.out.println("  " + exclusion.message());
            }
        }

        if (config.isVerbose()) {
            System.out.println("\nSelections:");
            System.out.println("-".repeat(60));
            for (PartSelection selection : result.selections()) {
                if (selection.isFulfilled()) {
                    System.out.printf("  %-24s x%-5d %-16s %10s%n", selection.name(), selection.requiredQuantity(),
                            selection.vendorName(), String.format("$%.2f", selection.totalCost()));
                } else {
                    System.out.printf("  %-24s x%-5d %-16s%n", selection.name(), selection.requiredQuantity(),
                            "MISSING");
                }
            }
        }

        System.out.println("\nFinal vendors: " + String.join(", ", result.finalVendorNames()));
        System.out.printf("Total cost: $%.2f%n", result.totalCost());
    }
}
