package org.carball.bom.aggregator;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.bom.catalog.PartCatalog;
import org.carball.bom.config.OptimizerSettings;
import org.carball.bom.model.order.ExclusionReason;
import org.carball.bom.model.order.OrderResult;
import org.carball.bom.model.order.PartSelection;
import org.carball.bom.model.order.VendorExclusion;
import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.part.ActualPartKey;
import org.carball.bom.model.quote.InlineOffer;
import org.carball.bom.model.quote.PriceBreak;
import org.carball.bom.model.quote.VendorQuote;
import org.carball.bom.quote.QuoteCache;
import org.carball.bom.quote.QuoteProvider;
import org.carball.bom.quote.QuoteProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

public class OrderAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final ActualPartKey YAGEO_10K = new ActualPartKey("Yageo", "RC0603FR-0710KL");
    private static final ActualPartKey MURATA_100N = new ActualPartKey("Murata", "GRM188R71C104KA01D");

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    private PartCatalog catalog;
    private QuoteCache cache;
    private OptimizerSettings settings;
    private Map<ActualPartKey, List<VendorQuote>> feed;
    private List<ActualPartKey> fetched;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(OrderAggregator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);

        catalog = new PartCatalog();
        catalog.registerChoicePart("10K;1608", "", "Drawer 3", "").actualPart("Yageo", "RC0603FR-0710KL");
        catalog.registerChoicePart("10K;1608:pullup", "", "Drawer 3", "").actualPart("Yageo", "RC0603FR-0710KL");
        catalog.registerChoicePart("100NF;1608", "", "Drawer 5", "").actualPart("Murata", "GRM188R71C104KA01D");
        catalog.registerAliasPart("PULLUP;1608", "", "10K;1608:pullup");

        cache = new QuoteCache(tempDir.resolve("cache.json"), QuoteCache.DEFAULT_TTL, Clock.fixed(NOW, ZoneOffset.UTC));
        settings = OptimizerSettings.builder().vendorMinimums(Map.of()).build();

        feed = new HashMap<>();
        feed.put(YAGEO_10K, List.of(quote(YAGEO_10K, "Digi-Key", 0.10), quote(YAGEO_10K, "Mouser", 0.11)));
        feed.put(MURATA_100N, List.of(quote(MURATA_100N, "Digi-Key", 0.05), quote(MURATA_100N, "Mouser", 0.04)));
        fetched = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldSelectOnePartPerChoicePartSortedByName() throws Exception {
        // Given
        Order order = new Order();
        order.board("main", "A", 10)
                .boardPart("R2", "10K;1608")
                .boardPart("R1", "10K;1608")
                .boardPart("C1", "100NF;1608");
        OrderAggregator aggregator = new OrderAggregator(catalog, cache, countingProvider(), settings);

        // When
        OrderResult result = aggregator.process(order);

        // Then
        assertThat(result.selections()).extracting(PartSelection::name).containsExactly("100NF;1608", "10K;1608");
        PartSelection resistor = result.selections().get(1);
        assertThat(resistor.requiredQuantity()).isEqualTo(20);
        assertThat(resistor.references()).isEqualTo("[main: R1 R2]");
        assertThat(result.missingPartsCount()).isZero();
        assertThat(result.errorCount()).isZero();
        assertThat(result.finalVendorNames()).isNotEmpty();
        assertThat(result.totalCost()).isCloseTo(
                result.selections().stream().mapToDouble(PartSelection::totalCost).sum(), within(1e-9));
    }

    @Test
    void shouldCountUnknownSchematicPartsAsErrors() throws Exception {
        // Given
        Order order = new Order();
        order.board("main", "A", 1)
                .boardPart("R1", "10K;1608")
                .boardPart("U1", "LM358;SOIC8");
        OrderAggregator aggregator = new OrderAggregator(catalog, cache, countingProvider(), settings);

        // When
        OrderResult result = aggregator.process(order);

        // Then
        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(result.selections()).hasSize(1);
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.ERROR
                        && event.getFormattedMessage().contains("'LM358;SOIC8'"));
    }

    @Test
    void shouldFetchEachActualPartAtMostOnce() throws Exception {
        // Given: the alias and the direct part share one manufacturer part after deduplication
        Order order = new Order();
        order.board("main", "A", 2).boardPart("R1", "10K;1608").boardPart("R2", "PULLUP;1608");
        order.board("aux", "A", 1).boardPart("R1", "10K;1608").boardPart("C1", "100NF;1608");
        OrderAggregator aggregator = new OrderAggregator(catalog, cache, countingProvider(), settings);

        // When
        aggregator.process(order);

        // Then
        assertThat(fetched).containsExactlyInAnyOrder(YAGEO_10K, MURATA_100N);
        assertThat(aggregator.getFetchCount()).isEqualTo(2);
        assertThat(Files.exists(tempDir.resolve("cache.json"))).isTrue();
    }

    @Test
    void shouldUseCachedQuotesInsteadOfFetching() throws Exception {
        // Given
        cache.put(YAGEO_10K, List.of(quote(YAGEO_10K, "Arrow", 0.02)));
        Order order = new Order();
        order.board("main", "A", 1).boardPart("R1", "10K;1608");
        OrderAggregator aggregator = new OrderAggregator(catalog, cache, countingProvider(), settings);

        // When
        OrderResult result = aggregator.process(order);

        // Then
        assertThat(fetched).isEmpty();
        assertThat(result.selections().get(0).vendorName()).isEqualTo("Arrow");
    }

    @Test
    void shouldTreatProviderFailureAsNoQuotes() throws Exception {
        // Given
        QuoteProvider failing = actualPart -> {
            throw new QuoteProviderException("service unavailable");
        };
        Order order = new Order();
        order.board("main", "A", 1).boardPart("R1", "10K;1608");
        OrderAggregator aggregator = new OrderAggregator(catalog, cache, failing, settings);

        // When
        OrderResult result = aggregator.process(order);

        // Then
        assertThat(result.missingPartsCount()).isEqualTo(1);
        assertThat(result.missingParts()).extracting(PartSelection::name).containsExactly("10K;1608");
        assertThat(result.totalCost()).isZero();
        assertThat(cache.contains(YAGEO_10K)).isFalse();
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains("service unavailable"));
    }

    @Test
    void shouldApplyExplicitExclusionsAndAllowList() throws Exception {
        // Given
        Order order = new Order()
                .excludeVendor("Mouser")
                .allowVendor("Digi-Key");
        order.board("main", "A", 1).boardPart("R1", "10K;1608").boardPart("C1", "100NF;1608");
        feed.put(MURATA_100N, List.of(quote(MURATA_100N, "Digi-Key", 0.05), quote(MURATA_100N, "Arrow", 0.01)));
        OrderAggregator aggregator = new OrderAggregator(catalog, cache, countingProvider(), settings);

        // When
        OrderResult result = aggregator.process(order);

        // Then
        assertThat(result.vendorExclusions())
                .extracting(VendorExclusion::vendorName, VendorExclusion::reason)
                .containsExactly(
                        tuple("Mouser", ExclusionReason.EXPLICIT),
                        tuple("Arrow", ExclusionReason.NOT_ALLOWED));
        assertThat(result.finalVendorNames()).containsExactly("Digi-Key");
        assertThat(result.excludedVendorNames()).containsExactlyInAnyOrder("Mouser", "Arrow");
    }

    @Test
    void shouldBuyWholePiecesForFractionalParts() throws Exception {
        // Given
        catalog.registerChoicePart("HDR1X40;M1X40", "", "Drawer 9", "")
                .actualPart("Samtec", "TSW-140-07-G-S",
                        new InlineOffer("Digi-Key", "SAM1029-40-ND", "1/2.00 10/1.50"));
        catalog.registerFractionalPart("HDR1X4;M1X4", "", "HDR1X40;M1X40", 4, 40, "4 pin header");
        Order order = new Order();
        order.board("main", "A", 25).boardPart("J1", "HDR1X4;M1X4");
        OrderAggregator aggregator = new OrderAggregator(catalog, cache, QuoteProvider.none(), settings);

        // When
        OrderResult result = aggregator.process(order);

        // Then
        PartSelection header = result.selections().get(0);
        assertThat(header.requiredQuantity()).isEqualTo(3);
        assertThat(header.selection().orderQuantity()).isEqualTo(3);
        assertThat(header.totalCost()).isCloseTo(6.0, within(1e-9));
        assertThat(header.references()).isEqualTo("[main: J1]");
    }

    private QuoteProvider countingProvider() {
        return (ActualPart actualPart) -> {
            fetched.add(actualPart.getKey());
            return feed.getOrDefault(actualPart.getKey(), List.of());
        };
    }

    private static VendorQuote quote(ActualPartKey key, String vendorName, double unitPrice) {
        return new VendorQuote(key, vendorName, vendorName + "-" + key.manufacturerPartName(), 100_000,
                List.of(new PriceBreak(1, unitPrice)), NOW);
    }
}
