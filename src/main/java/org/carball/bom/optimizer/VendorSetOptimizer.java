package org.carball.bom.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.carball.bom.config.OptimizerSettings;
import org.carball.bom.model.order.ExclusionReason;
import org.carball.bom.model.order.PartDemand;
import org.carball.bom.model.order.SelectionResult;
import org.carball.bom.model.order.VendorExclusion;
import org.carball.bom.model.order.VendorReduction;
import org.carball.bom.selector.ChoicePartSelector;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Narrows the set of vendors an order is split across.
 * <p>
 * First, vendors whose share of the order would not reach their minimum order are dropped. Then,
 * unless the caller fixed the vendors with an allow-list, vendors are dropped greedily one at a time
 * while doing so costs less than one extra shipment. The search is greedy, not globally optimal, but
 * deterministic for the same quotes and settings. It never drops the last vendor and never makes
 * an order less complete than it was when the shipping pass began.
 */
@Slf4j
public class VendorSetOptimizer {

    // Totals are sums of doubles; differences below this are rounding noise
    static final double COST_EPSILON = 1e-9;

    private final ChoicePartSelector selector;
    private final OptimizerSettings settings;
    private final VendorPriorities priorities;

    public VendorSetOptimizer(ChoicePartSelector selector, OptimizerSettings settings) {
        this(selector, settings, new VendorPriorities(settings.getVendorPriorities(), settings.getAutoPriorityStart()));
    }

    public VendorSetOptimizer(ChoicePartSelector selector, OptimizerSettings settings, VendorPriorities priorities) {
        this.selector = selector;
        this.settings = settings;
        this.priorities = priorities;
    }

    public VendorReduction optimize(List<PartDemand> parts, Set<String> initialExclusions, boolean allowListGiven) {
        Set<String> excluded = new LinkedHashSet<>(initialExclusions);
        List<VendorExclusion> exclusions = new ArrayList<>();

        excludeVendorsWithHighMinimums(parts, excluded, exclusions);
        if (allowListGiven) {
            log.info("Vendor allow-list given; skipping shipping cost reduction");
        } else {
            excludeVendorsToReduceShippingCosts(parts, excluded, exclusions);
        }

        log.info("Vendor optimization excluded {} vendors; {} remain",
                exclusions.size(), vendorNames(parts, excluded).size());
        return new VendorReduction(excluded, exclusions);
    }

    /**
     * Drops every quoting vendor with a configured minimum order that its share of the order does not reach.
     */
    void excludeVendorsWithHighMinimums(List<PartDemand> parts, Set<String> excluded,
                                        List<VendorExclusion> exclusions) {
        Map<String, Double> minimums = new TreeMap<>(settings.getVendorMinimums());
        for (Map.Entry<String, Double> entry : minimums.entrySet()) {
            String vendorName = entry.getKey();
            if (entry.getValue() == null || excluded.contains(vendorName)
                    || !vendorNames(parts, excluded).contains(vendorName)) {
                continue;
            }
            double minimum = entry.getValue();

            double vendorTotal = 0.0;
            for (PartDemand part : parts) {
                Optional<SelectionResult> selection = selector.select(part.choicePart(), part.requiredQuantity(), excluded);
                if (selection.isPresent() && selection.get().vendorName().equals(vendorName)) {
                    vendorTotal += selection.get().totalCost();
                }
            }

            if (vendorTotal < minimum) {
                exclude(new VendorExclusion(vendorName, ExclusionReason.BELOW_MINIMUM_ORDER, vendorTotal, minimum),
                        excluded, exclusions);
            }
        }
    }

    /**
     * Drops one vendor per round. A vendor that saves nothing always goes, unless it is the
     * never-exclude vendor. Otherwise the vendor whose absence raises the order total the least goes
     * while its savings stay under the shipping threshold; the pass stops if that vendor is the
     * never-exclude vendor. Vendors whose absence would leave more parts unfulfilled than at the
     * start of the pass are never candidates.
     */
    void excludeVendorsToReduceShippingCosts(List<PartDemand> parts, Set<String> excluded,
                                             List<VendorExclusion> exclusions) {
        int startingMissingParts = evaluate(parts, excluded).missingParts();
        double threshold = settings.getShippingThreshold();

        while (true) {
            OrderCost base = evaluate(parts, excluded);
            Set<String> vendorNames = vendorNames(parts, excluded);
            if (vendorNames.size() < 2) {
                break;
            }

            List<TrialCost> trials = new ArrayList<>();
            for (String vendorName : vendorNames) {
                Set<String> trialExcluded = new LinkedHashSet<>(excluded);
                trialExcluded.add(vendorName);
                OrderCost trial = evaluate(parts, trialExcluded);
                if (trial.missingParts() > startingMissingParts) {
                    log.debug("Keeping {}: excluding it leaves {} parts unfulfilled", vendorName, trial.missingParts());
                    continue;
                }
                trials.add(new TrialCost(trial.missingParts(), trial.totalCost(),
                        priorities.priorityOf(vendorName), vendorName));
            }
            if (trials.isEmpty()) {
                break;
            }
            trials.sort(TrialCost.ORDER);

            Optional<TrialCost> free = trials.stream()
                    .filter(trial -> !isNeverExcluded(trial.vendorName()))
                    .filter(trial -> trial.totalCost() - base.totalCost() < COST_EPSILON)
                    .findFirst();
            if (free.isPresent()) {
                exclude(VendorExclusion.of(free.get().vendorName(), ExclusionReason.NO_SAVINGS), excluded, exclusions);
                continue;
            }

            TrialCost lowest = trials.get(0);
            double savings = lowest.totalCost() - base.totalCost();
            if (isNeverExcluded(lowest.vendorName())) {
                log.debug("Stopping: {} is never excluded automatically", lowest.vendorName());
                break;
            }
            if (savings < threshold) {
                exclude(new VendorExclusion(lowest.vendorName(), ExclusionReason.SHIPPING_NOT_JUSTIFIED,
                        savings, threshold), excluded, exclusions);
            } else {
                log.debug("Stopping: dropping {} would cost {} more", lowest.vendorName(), savings);
                break;
            }
        }
    }

    /**
     * Selects every part under {@code excluded} and totals the result.
     */
    public OrderCost evaluate(List<PartDemand> parts, Set<String> excluded) {
        int missingParts = 0;
        double totalCost = 0.0;
        for (PartDemand part : parts) {
            Optional<SelectionResult> selection = selector.select(part.choicePart(), part.requiredQuantity(), excluded);
            if (selection.isPresent()) {
                totalCost += selection.get().totalCost();
            } else {
                missingParts++;
            }
        }
        return new OrderCost(missingParts, totalCost);
    }

    /**
     * Every vendor that could still supply any of {@code parts}, sorted by name.
     */
    public Set<String> vendorNames(List<PartDemand> parts, Set<String> excluded) {
        Set<String> vendorNames = new TreeSet<>();
        for (PartDemand part : parts) {
            vendorNames.addAll(part.choicePart().vendorNames(excluded));
        }
        return vendorNames;
    }

    private boolean isNeverExcluded(String vendorName) {
        return vendorName.equals(settings.getNeverExcludeVendor());
    }

    private void exclude(VendorExclusion exclusion, Set<String> excluded, List<VendorExclusion> exclusions) {
        excluded.add(exclusion.vendorName());
        exclusions.add(exclusion);
        log.info(exclusion.message());
    }
}
