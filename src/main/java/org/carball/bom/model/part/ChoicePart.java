package org.carball.bom.model.part;

import lombok.Getter;
import lombok.Setter;
import org.carball.bom.model.quote.InlineOffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A schematic part that can actually be bought: one or more interchangeable
 * {@link ActualPart}s in order of preference.
 */
@Getter
public class ChoicePart extends SchematicPart {

    private final String location;
    private final String description;
    private final List<ActualPart> actualParts = new ArrayList<>();

    // Placement metadata for assembly, in degrees and millimeters
    @Setter
    private double rotation;
    @Setter
    private double pickDx;
    @Setter
    private double pickDy;
    @Setter
    private double height;

    public ChoicePart(String schematicPartName, String footprint, String location, String description) {
        super(schematicPartName, footprint);
        this.location = location == null ? "" : location;
        this.description = description == null ? "" : description;
    }

    @Override
    public PartKind getKind() {
        return PartKind.CHOICE;
    }

    public List<ActualPart> getActualParts() {
        return Collections.unmodifiableList(actualParts);
    }

    /**
     * Adds a manufacturer part, optionally with offers known up front. Returns {@code this}
     * so catalog definitions can chain alternatives.
     */
    public ChoicePart actualPart(String manufacturerName, String manufacturerPartName, InlineOffer... offers) {
        ActualPart actualPart = new ActualPart(manufacturerName, manufacturerPartName);
        for (InlineOffer offer : offers) {
            actualPart.addQuotes(List.of(offer.toQuote(actualPart.getKey())));
        }
        actualParts.add(actualPart);
        return this;
    }

    public ChoicePart placement(double rotation, double pickDx, double pickDy, double height) {
        this.rotation = rotation;
        this.pickDx = pickDx;
        this.pickDy = pickDy;
        this.height = height;
        return this;
    }

    /**
     * Swaps {@code duplicate} for {@code canonical} so equal manufacturer parts share one instance.
     */
    public boolean replaceActualPart(ActualPart duplicate, ActualPart canonical) {
        for (int i = 0; i < actualParts.size(); i++) {
            if (actualParts.get(i) == duplicate) {
                actualParts.set(i, canonical);
                return true;
            }
        }
        return false;
    }

    /**
     * Every vendor offering any of the actual parts, minus {@code excludedVendorNames}.
     */
    public Set<String> vendorNames(Set<String> excludedVendorNames) {
        Set<String> vendorNames = new TreeSet<>();
        for (ActualPart actualPart : actualParts) {
            actualPart.collectVendorNames(vendorNames, excludedVendorNames);
        }
        return vendorNames;
    }
}
