package org.carball.bom.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.bom.config.OptimizerSettings;
import org.carball.bom.model.order.OrderResult;
import org.carball.bom.model.order.PartSelection;
import org.carball.bom.model.order.SelectionResult;
import org.carball.bom.model.order.VendorExclusion;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Slf4j
public class OrderReport {

    private final OrderResult result;
    private final OptimizerSettings settings;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public OrderReport(OrderResult result, OptimizerSettings settings) {
        this(result, settings, LocalDateTime.now());
    }

    public OrderReport(OrderResult result, OptimizerSettings settings, LocalDateTime timestamp) {
        this.result = result;
        this.settings = settings;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Parts Order Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Settings:** ").append(settings.getConfigurationSummary()).append("  \n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Choice Parts | ").append(result.selections().size()).append(" |\n");
        md.append("| Missing Parts | ").append(result.missingPartsCount()).append(" |\n");
        md.append("| Errors | ").append(result.errorCount()).append(" |\n");
        md.append("| Vendors | ").append(result.finalVendorNames().size()).append(" |\n");
        md.append("| Total Cost | ").append(money(result.totalCost())).append(" |\n\n");

        md.append("## Vendors\n\n");
        if (result.finalVendorNames().isEmpty()) {
            md.append("**No vendor can supply any part of this order.**\n\n");
        } else {
            Map<String, Double> totals = vendorTotals();
            md.append("| Vendor | Parts Cost |\n");
            md.append("|--------|------------|\n");
            totals.forEach((vendor, total) ->
                    md.append("| ").append(vendor).append(" | ").append(money(total)).append(" |\n"));
            md.append("\n");
        }

        if (!result.vendorExclusions().isEmpty()) {
            md.append("## Vendor Reduction\n\n");
            for (VendorExclusion exclusion : result.vendorExclusions()) {
                md.append("- ").append(exclusion.message()).append("\n");
            }
            md.append("\n");
        }

        md.append("## Selections\n\n");
        md.append("| Part | Qty | Vendor | Vendor Part | Manufacturer Part | Order Qty | Unit Price | Cost | References |\n");
        md.append("|------|-----|--------|-------------|-------------------|-----------|------------|------|------------|\n");
        for (PartSelection selection : result.selections()) {
            SelectionResult chosen = selection.selection();
            md.append("| ").append(selection.name())
                    .append(" | ").append(selection.requiredQuantity());
            if (chosen == null) {
                md.append(" | **missing** | | | | | |");
            } else {
                md.append(" | ").append(chosen.vendorName())
                        .append(" | ").append(chosen.vendorQuote().vendorPartName())
                        .append(" | ").append(chosen.actualPart().getManufacturerName()).append(' ')
                        .append(chosen.actualPart().getManufacturerPartName())
                        .append(" | ").append(chosen.orderQuantity())
                        .append(" | ").append(String.format("$%.4f", chosen.priceBreak().unitPrice()))
                        .append(" | ").append(money(chosen.totalCost())).append(" |");
            }
            md.append(' ').append(selection.references()).append(" |\n");
        }
        md.append("\n");

        if (result.missingPartsCount() > 0) {
            md.append("## Missing Parts\n\n");
            for (PartSelection missing : result.missingParts()) {
                md.append("- `").append(missing.name()).append("` x").append(missing.requiredQuantity())
                        .append(' ').append(missing.references()).append("\n");
            }
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Generated by BOM Optimizer*\n");
        return md.toString();
    }

    Map<String, Double> vendorTotals() {
        return result.selections().stream()
                .filter(PartSelection::isFulfilled)
                .collect(Collectors.groupingBy(PartSelection::vendorName, TreeMap::new,
                        Collectors.summingDouble(PartSelection::totalCost)));
    }

    private static String money(double amount) {
        return String.format("$%.2f", amount);
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setMetadata(new ReportMetadata(timestamp, settings.getProfileName(), settings.getShippingThreshold(),
                result.selections().size(), result.missingPartsCount(), result.errorCount()));
        report.setVendors(result.finalVendorNames());
        report.setVendorTotals(vendorTotals());
        report.setTotalCost(result.totalCost());
        report.setExcludedVendors(result.vendorExclusions().stream()
                .map(exclusion -> new ExcludedVendor(exclusion.vendorName(), exclusion.reason().name(),
                        exclusion.message()))
                .collect(Collectors.toList()));
        report.setSelections(result.selections().stream()
                .map(OrderReport::toLine)
                .collect(Collectors.toList()));
        return report;
    }

    private static SelectionLine toLine(PartSelection selection) {
        SelectionLine line = new SelectionLine();
        line.setPart(selection.name());
        line.setRequiredQuantity(selection.requiredQuantity());
        line.setReferences(selection.references());
        line.setFulfilled(selection.isFulfilled());

        SelectionResult chosen = selection.selection();
        if (chosen != null) {
            line.setManufacturer(chosen.actualPart().getManufacturerName());
            line.setManufacturerPartName(chosen.actualPart().getManufacturerPartName());
            line.setVendor(chosen.vendorName());
            line.setVendorPartName(chosen.vendorQuote().vendorPartName());
            line.setOrderQuantity(chosen.orderQuantity());
            line.setUnitPrice(chosen.priceBreak().unitPrice());
            line.setCost(chosen.totalCost());
        }
        return line;
    }

    // Inner classes for JSON structure
    @lombok.Data
    static class ReportData {
        private ReportMetadata metadata;
        private List<String> vendors;
        private Map<String, Double> vendorTotals;
        private double totalCost;
        private List<ExcludedVendor> excludedVendors;
        private List<SelectionLine> selections;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    static class ReportMetadata {
        private LocalDateTime timestamp;
        private String profile;
        private double shippingThreshold;
        private int choiceParts;
        private int missingParts;
        private int errors;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    static class ExcludedVendor {
        private String vendor;
        private String reason;
        private String message;
    }

    @lombok.Data
    static class SelectionLine {
        private String part;
        private int requiredQuantity;
        private String references;
        private boolean fulfilled;
        private String manufacturer;
        private String manufacturerPartName;
        private String vendor;
        private String vendorPartName;
        private Integer orderQuantity;
        private Double unitPrice;
        private Double cost;
    }
}
