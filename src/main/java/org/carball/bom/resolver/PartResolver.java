package org.carball.bom.resolver;

import lombok.extern.slf4j.Slf4j;
import org.carball.bom.model.part.AliasPart;
import org.carball.bom.model.part.AliasTarget;
import org.carball.bom.model.part.Board;
import org.carball.bom.model.part.BoardPart;
import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.part.FractionalPart;
import org.carball.bom.model.part.SchematicPart;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens alias and fractional parts into the choice parts that can actually be bought, and works
 * out how many pieces of each choice part an order needs.
 */
@Slf4j
public class PartResolver {

    public List<ChoicePart> resolve(SchematicPart part) {
        List<ChoicePart> choiceParts = new ArrayList<>();
        for (Resolution resolution : resolveWithOrigins(part)) {
            choiceParts.add(resolution.choicePart());
        }
        return choiceParts;
    }

    /**
     * Resolves {@code part} and records one {@link PartUsage} per resulting choice part in {@code ledger}.
     */
    public List<ChoicePart> resolve(SchematicPart part, Board board, BoardPart boardPart, DemandLedger ledger) {
        List<ChoicePart> choiceParts = new ArrayList<>();
        for (Resolution resolution : resolveWithOrigins(part)) {
            ledger.record(resolution.choicePart(), new PartUsage(board, boardPart, resolution.via()));
            choiceParts.add(resolution.choicePart());
        }
        return choiceParts;
    }

    public List<Resolution> resolveWithOrigins(SchematicPart part) {
        List<Resolution> resolutions = new ArrayList<>();
        collect(part, null, resolutions);
        return resolutions;
    }

    private void collect(SchematicPart part, FractionalPart via, List<Resolution> resolutions) {
        switch (part.getKind()) {
            case CHOICE -> resolutions.add(new Resolution((ChoicePart) part, via));
            case ALIAS -> {
                for (AliasTarget target : ((AliasPart) part).getTargets()) {
                    for (int i = 0; i < target.count(); i++) {
                        collect(target.part(), via, resolutions);
                    }
                }
            }
            case FRACTIONAL -> {
                FractionalPart fractionalPart = (FractionalPart) part;
                resolutions.add(new Resolution(fractionalPart.getChoicePart(), fractionalPart));
            }
        }
    }

    /**
     * Number of pieces of {@code choicePart} to buy.
     * <p>
     * Without fractional use this is one piece per board built. With fractional use, slices are cut
     * from whole pieces in order: a slice that does not fit in the remainder of the current piece
     * starts a new one. Direct uses of the same part count as a whole piece each.
     *
     * @throws InconsistentFractionalDenominatorException if fractional parts of {@code choicePart}
     *                                                    disagree on the denominator
     */
    public int requiredQuantity(ChoicePart choicePart, DemandLedger ledger) {
        List<PartUsage> usages = ledger.usages(choicePart);
        List<FractionalPart> fractionalParts = ledger.fractionalParts(choicePart);

        if (fractionalParts.isEmpty()) {
            int count = 0;
            for (PartUsage usage : usages) {
                count += usage.board().getCount();
            }
            return count;
        }

        FractionalPart first = fractionalParts.get(0);
        int denominator = first.getDenominator();
        for (FractionalPart other : fractionalParts.subList(1, fractionalParts.size())) {
            if (other.getDenominator() != denominator) {
                throw new InconsistentFractionalDenominatorException(String.format(
                        "'%s' has a denominator of %d and '%s' has one of %d (both slice '%s')",
                        first.getName(), denominator, other.getName(), other.getDenominator(),
                        choicePart.getName()));
            }
        }

        int units = 0;
        int remainder = 0;
        for (PartUsage usage : usages) {
            int numerator = usage.isFractional() ? usage.fractionalPart().getNumerator() : denominator;
            for (int i = 0; i < usage.board().getCount(); i++) {
                if (remainder + numerator > denominator) {
                    units++;
                    remainder = 0;
                }
                remainder += numerator;
            }
        }
        if (remainder > 0) {
            units++;
        }

        log.debug("{} needs {} pieces for {} fractional uses", choicePart.getName(), units, usages.size());
        return units;
    }
}
