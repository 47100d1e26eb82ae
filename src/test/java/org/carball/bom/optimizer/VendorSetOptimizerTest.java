package org.carball.bom.optimizer;

import org.carball.bom.config.OptimizerSettings;
import org.carball.bom.model.order.ExclusionReason;
import org.carball.bom.model.order.PartDemand;
import org.carball.bom.model.order.VendorExclusion;
import org.carball.bom.model.order.VendorReduction;
import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.quote.PriceBreak;
import org.carball.bom.model.quote.VendorQuote;
import org.carball.bom.selector.ChoicePartSelector;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class VendorSetOptimizerTest {

    private static final OptimizerSettings NO_MINIMUMS = OptimizerSettings.builder()
            .vendorMinimums(Map.of())
            .build();

    @Test
    void shouldDropOneOfTwoVendorsWithEqualCost() {
        // Given
        List<PartDemand> parts = List.of(demand("P1;X", 1, offer("VendorA", 50.0), offer("VendorB", 50.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), NO_MINIMUMS);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.exclusions()).extracting(VendorExclusion::vendorName).containsExactly("VendorA");
        assertThat(reduction.exclusions().get(0).reason()).isEqualTo(ExclusionReason.NO_SAVINGS);
        assertThat(optimizer.vendorNames(parts, reduction.excludedVendorNames())).containsExactly("VendorB");
        assertThat(optimizer.evaluate(parts, reduction.excludedVendorNames()).totalCost())
                .isCloseTo(50.0, within(1e-9));
    }

    @Test
    void shouldDropLowPriorityVendorFirstAmongEqualCosts() {
        // Given
        List<PartDemand> parts = List.of(demand("P1;X", 1, offer("Digi-Key", 50.0), offer("Verical", 50.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), NO_MINIMUMS);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.excludedVendorNames()).containsExactly("Verical");
    }

    @Test
    void shouldKeepVendorsThatSaveMoreThanShipping() {
        // Given
        List<PartDemand> parts = List.of(
                demand("P1;X", 1, offer("VendorA", 100.0), offer("VendorB", 130.0)),
                demand("P2;X", 1, offer("VendorA", 40.0), offer("VendorB", 10.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), NO_MINIMUMS);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.exclusions()).isEmpty();
        assertThat(optimizer.vendorNames(parts, reduction.excludedVendorNames()))
                .containsExactly("VendorA", "VendorB");
    }

    @Test
    void shouldDropVendorWhoseSavingsAreBelowShippingThreshold() {
        // Given
        List<PartDemand> parts = List.of(
                demand("P1;X", 1, offer("VendorA", 100.0), offer("VendorB", 105.0)),
                demand("P2;X", 1, offer("VendorA", 12.0), offer("VendorB", 10.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), NO_MINIMUMS);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.exclusions()).hasSize(1);
        VendorExclusion exclusion = reduction.exclusions().get(0);
        assertThat(exclusion.vendorName()).isEqualTo("VendorB");
        assertThat(exclusion.reason()).isEqualTo(ExclusionReason.SHIPPING_NOT_JUSTIFIED);
        assertThat(exclusion.amount()).isCloseTo(2.0, within(1e-9));
        assertThat(exclusion.limit()).isEqualTo(15.0);
        assertThat(optimizer.evaluate(parts, reduction.excludedVendorNames()).totalCost())
                .isCloseTo(112.0, within(1e-9));
    }

    @Test
    void shouldNeverAutoExcludeConfiguredVendor() {
        // Given
        List<PartDemand> parts = List.of(
                demand("P1;X", 1, offer("VendorA", 100.0), offer("VendorB", 105.0)),
                demand("P2;X", 1, offer("VendorA", 12.0), offer("VendorB", 10.0)));
        OptimizerSettings settings = NO_MINIMUMS.toBuilder().neverExcludeVendor("VendorB").build();
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), settings);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.excludedVendorNames()).isEmpty();
    }

    @Test
    void shouldStillDropZeroSavingsVendorWhenNeverExcludeVendorRanksFirst() {
        // Given
        List<PartDemand> parts = List.of(demand("P1;X", 1, offer("VendorA", 50.0), offer("VendorB", 50.0)));
        OptimizerSettings settings = NO_MINIMUMS.toBuilder().neverExcludeVendor("VendorA").build();
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), settings);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.exclusions()).extracting(VendorExclusion::vendorName).containsExactly("VendorB");
        assertThat(reduction.exclusions().get(0).reason()).isEqualTo(ExclusionReason.NO_SAVINGS);
        assertThat(optimizer.vendorNames(parts, reduction.excludedVendorNames())).containsExactly("VendorA");
    }

    @Test
    void shouldIgnoreVendorMinimumWithoutAmount() {
        // Given
        Map<String, Double> minimums = new HashMap<>();
        minimums.put("Verical", null);
        OptimizerSettings settings = NO_MINIMUMS.toBuilder().vendorMinimums(minimums).build();
        List<PartDemand> parts = List.of(demand("P1;X", 20, offer("Verical", 1.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), settings);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.excludedVendorNames()).isEmpty();
    }

    @Test
    void shouldExcludeVendorBelowMinimumOrder() {
        // Given
        List<PartDemand> parts = List.of(demand("P1;X", 20, offer("Verical", 1.0), offer("Mouser", 1.5)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), OptimizerSettings.defaults());

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.exclusions()).hasSize(1);
        VendorExclusion exclusion = reduction.exclusions().get(0);
        assertThat(exclusion.vendorName()).isEqualTo("Verical");
        assertThat(exclusion.reason()).isEqualTo(ExclusionReason.BELOW_MINIMUM_ORDER);
        assertThat(exclusion.amount()).isCloseTo(20.0, within(1e-9));
        assertThat(exclusion.limit()).isEqualTo(100.0);
        assertThat(exclusion.message()).isEqualTo("Excluding 'Verical': needed order 20.00 < minimum order 100.00");
    }

    @Test
    void shouldKeepVendorThatMeetsMinimumOrder() {
        // Given
        List<PartDemand> parts = List.of(demand("P1;X", 200, offer("Verical", 1.0), offer("Mouser", 1.5)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), OptimizerSettings.defaults());

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then: Mouser saves nothing once Verical is kept
        assertThat(reduction.excludedVendorNames()).containsExactly("Mouser");
    }

    @Test
    void shouldSkipShippingReductionWithAllowList() {
        // Given
        List<PartDemand> parts = List.of(demand("P1;X", 1, offer("VendorA", 50.0), offer("VendorB", 50.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), NO_MINIMUMS);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of("VendorC"), true);

        // Then
        assertThat(reduction.exclusions()).isEmpty();
        assertThat(reduction.excludedVendorNames()).containsExactly("VendorC");
    }

    @Test
    void shouldNotLeavePartsUnfulfilled() {
        // Given
        List<PartDemand> parts = List.of(
                demand("P1;X", 1, offer("VendorA", 50.0)),
                demand("P2;X", 1, offer("VendorB", 1.0)),
                demand("P3;X", 1, offer("VendorA", 10.0), offer("VendorB", 9.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), NO_MINIMUMS);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.exclusions()).isEmpty();
        assertThat(optimizer.evaluate(parts, reduction.excludedVendorNames()).missingParts()).isZero();
    }

    @Test
    void shouldNotDropBothSoleSuppliersOfAPart() {
        // Given: excluding either A or B alone saves nothing, excluding both loses P1
        List<PartDemand> parts = List.of(
                demand("P1;X", 1, offer("VendorA", 50.0), offer("VendorB", 50.0)),
                demand("P2;X", 1, offer("VendorC", 5.0)));
        VendorSetOptimizer optimizer = new VendorSetOptimizer(new ChoicePartSelector(), NO_MINIMUMS);

        // When
        VendorReduction reduction = optimizer.optimize(parts, Set.of(), false);

        // Then
        assertThat(reduction.excludedVendorNames()).containsExactly("VendorA");
        assertThat(optimizer.evaluate(parts, reduction.excludedVendorNames()).missingParts()).isZero();
        assertThat(optimizer.vendorNames(parts, reduction.excludedVendorNames()))
                .containsExactly("VendorB", "VendorC");
    }

    @Test
    void shouldAssignStablePrioritiesToUnknownVendors() {
        // Given
        VendorPriorities priorities = new VendorPriorities(Map.of("Digi-Key", 1004), 10);

        // Then
        assertThat(priorities.priorityOf("Zeta")).isEqualTo(10);
        assertThat(priorities.priorityOf("Alpha")).isEqualTo(11);
        assertThat(priorities.priorityOf("Zeta")).isEqualTo(10);
        assertThat(priorities.priorityOf("Digi-Key")).isEqualTo(1004);
    }

    private static PartDemand demand(String name, int quantity, Offer... offers) {
        ChoicePart choicePart = new ChoicePart(name, "", "", "").actualPart("Acme", name);
        ActualPart actualPart = choicePart.getActualParts().get(0);
        List<VendorQuote> quotes = new ArrayList<>();
        for (Offer offer : offers) {
            quotes.add(new VendorQuote(actualPart.getKey(), offer.vendorName(), offer.vendorName() + "-" + name,
                    10_000, List.of(new PriceBreak(1, offer.unitPrice())), Instant.EPOCH));
        }
        actualPart.addQuotes(quotes);
        return new PartDemand(choicePart, quantity);
    }

    private static Offer offer(String vendorName, double unitPrice) {
        return new Offer(vendorName, unitPrice);
    }

    private record Offer(String vendorName, double unitPrice) {
    }
}
