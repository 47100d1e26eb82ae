package org.carball.bom.aggregator;

import lombok.extern.slf4j.Slf4j;
import org.carball.bom.catalog.PartCatalog;
import org.carball.bom.config.OptimizerSettings;
import org.carball.bom.model.order.ExclusionReason;
import org.carball.bom.model.order.OrderResult;
import org.carball.bom.model.order.PartDemand;
import org.carball.bom.model.order.PartSelection;
import org.carball.bom.model.order.SelectionResult;
import org.carball.bom.model.order.VendorExclusion;
import org.carball.bom.model.order.VendorReduction;
import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.part.ActualPartKey;
import org.carball.bom.model.part.Board;
import org.carball.bom.model.part.BoardPart;
import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.part.SchematicPart;
import org.carball.bom.model.quote.VendorQuote;
import org.carball.bom.optimizer.VendorSetOptimizer;
import org.carball.bom.quote.QuoteCache;
import org.carball.bom.quote.QuoteProvider;
import org.carball.bom.quote.QuoteProviderException;
import org.carball.bom.resolver.DemandLedger;
import org.carball.bom.resolver.PartResolver;
import org.carball.bom.selector.ChoicePartSelector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns an {@link Order} into one priced selection per choice part.
 * <p>
 * Quotes are fetched after every board part has been resolved and before any selection is made;
 * each manufacturer part is looked up in the cache first and fetched at most once per run. A board
 * part whose schematic name is unknown is counted as an error and skipped.
 */
@Slf4j
public class OrderAggregator {

    private final PartCatalog catalog;
    private final QuoteCache quoteCache;
    private final QuoteProvider quoteProvider;
    private final OptimizerSettings settings;
    private final PartResolver resolver;
    private final ChoicePartSelector selector;

    private final Set<ActualPartKey> fetchedThisRun = new HashSet<>();
    private int fetchCount;

    public OrderAggregator(PartCatalog catalog, QuoteCache quoteCache, QuoteProvider quoteProvider,
                           OptimizerSettings settings) {
        this.catalog = catalog;
        this.quoteCache = quoteCache;
        this.quoteProvider = quoteProvider;
        this.settings = settings;
        this.resolver = new PartResolver();
        this.selector = new ChoicePartSelector();
    }

    public OrderResult process(Order order) throws IOException {
        log.info("Processing order for {} boards", order.getBoards().size());
        catalog.deduplicateActualParts();

        // Step 1: resolve board parts into choice parts
        DemandLedger ledger = new DemandLedger();
        Map<String, ChoicePart> choiceParts = new TreeMap<>();
        int errorCount = 0;

        List<Board> boards = new ArrayList<>(order.getBoards());
        boards.sort(Comparator.comparing(Board::getName));
        for (Board board : boards) {
            for (BoardPart boardPart : board.getSortedBoardParts()) {
                Optional<SchematicPart> schematicPart = catalog.lookup(boardPart.schematicPartName());
                if (schematicPart.isEmpty()) {
                    log.error("{}: {} uses '{}', which is not in the catalog",
                            board.getName(), boardPart.reference(), boardPart.schematicPartName());
                    errorCount++;
                    continue;
                }
                for (ChoicePart choicePart : resolver.resolve(schematicPart.get(), board, boardPart, ledger)) {
                    choiceParts.putIfAbsent(choicePart.getName(), choicePart);
                }
            }
        }
        log.info("Resolved {} distinct choice parts ({} errors)", choiceParts.size(), errorCount);

        // Step 2: load quotes for every referenced actual part
        loadQuotes(choiceParts.values());

        // Step 3: required quantities
        List<PartDemand> demands = new ArrayList<>();
        for (ChoicePart choicePart : choiceParts.values()) {
            demands.add(new PartDemand(choicePart, resolver.requiredQuantity(choicePart, ledger)));
        }

        // Step 4: vendor restrictions, then vendor set reduction
        List<VendorExclusion> exclusions = new ArrayList<>();
        Set<String> initialExclusions = initialExclusions(order, demands, exclusions);
        VendorSetOptimizer optimizer = new VendorSetOptimizer(selector, settings);
        VendorReduction reduction = optimizer.optimize(demands, initialExclusions, order.hasAllowList());
        exclusions.addAll(reduction.exclusions());

        // Step 5: final selection
        List<PartSelection> selections = new ArrayList<>();
        Set<String> finalVendorNames = new TreeSet<>();
        int missingParts = 0;
        double totalCost = 0.0;
        for (PartDemand demand : demands) {
            ChoicePart choicePart = demand.choicePart();
            SelectionResult selection = selector
                    .select(choicePart, demand.requiredQuantity(), reduction.excludedVendorNames())
                    .orElse(null);
            if (selection == null) {
                log.warn("No vendor parts found for part '{}' (need {})", choicePart.getName(), demand.requiredQuantity());
                missingParts++;
            } else {
                finalVendorNames.add(selection.vendorName());
                totalCost += selection.totalCost();
            }
            selections.add(new PartSelection(choicePart, demand.requiredQuantity(),
                    ledger.referencesText(choicePart), selection));
        }

        log.info("Order complete: {} parts, {} missing, {} errors, {} vendors, total {}",
                selections.size(), missingParts, errorCount, finalVendorNames.size(),
                String.format("%.2f", totalCost));
        return new OrderResult(selections, missingParts, errorCount, reduction.excludedVendorNames(),
                exclusions, new ArrayList<>(finalVendorNames), totalCost);
    }

    /**
     * Number of calls made to the quote provider by this aggregator.
     */
    public int getFetchCount() {
        return fetchCount;
    }

    private void loadQuotes(Iterable<ChoicePart> choiceParts) throws IOException {
        Set<ActualPartKey> seen = new HashSet<>();
        for (ChoicePart choicePart : choiceParts) {
            for (ActualPart actualPart : choicePart.getActualParts()) {
                if (seen.add(actualPart.getKey())) {
                    actualPart.addQuotes(quotesFor(actualPart));
                }
            }
        }
        quoteCache.save();
    }

    private List<VendorQuote> quotesFor(ActualPart actualPart) throws IOException {
        ActualPartKey key = actualPart.getKey();
        Optional<List<VendorQuote>> cached = quoteCache.get(key);
        if (cached.isPresent()) {
            log.debug("Using {} cached quotes for {}", cached.get().size(), key);
            return cached.get();
        }
        if (!fetchedThisRun.add(key)) {
            return List.of();
        }

        log.info("Fetching quotes for {}", key);
        fetchCount++;
        List<VendorQuote> quotes;
        try {
            quotes = quoteProvider.fetch(actualPart);
        } catch (QuoteProviderException | RuntimeException e) {
            log.warn("Quote lookup for {} failed; treating it as no quotes: {}", key, e.getMessage());
            log.debug("Quote lookup failure details", e);
            return List.of();
        }

        if (quotes == null) {
            quotes = List.of();
        }
        if (quotes.isEmpty()) {
            log.warn("No vendor quotes found for {}", key);
        }
        quoteCache.put(key, quotes);
        quoteCache.save();
        return quotes;
    }

    private Set<String> initialExclusions(Order order, List<PartDemand> demands, List<VendorExclusion> exclusions) {
        Set<String> excluded = new LinkedHashSet<>();
        for (String vendorName : order.getExcludedVendorNames()) {
            excluded.add(vendorName);
            exclusions.add(VendorExclusion.of(vendorName, ExclusionReason.EXPLICIT));
        }

        if (order.hasAllowList()) {
            Set<String> vendorNames = new TreeSet<>();
            for (PartDemand demand : demands) {
                vendorNames.addAll(demand.choicePart().vendorNames(excluded));
            }
            for (String vendorName : vendorNames) {
                if (!order.getAllowedVendorNames().contains(vendorName)) {
                    excluded.add(vendorName);
                    exclusions.add(VendorExclusion.of(vendorName, ExclusionReason.NOT_ALLOWED));
                }
            }
        }
        return excluded;
    }
}
