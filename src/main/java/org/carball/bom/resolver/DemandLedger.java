package org.carball.bom.resolver;

import org.carball.bom.model.part.Board;
import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.part.FractionalPart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records which board parts (and fractional parts) use each choice part during one order run.
 * Keyed by choice part name so that catalog objects carry no per-order state.
 */
public class DemandLedger {

    private final Map<String, List<PartUsage>> usagesByChoicePart = new LinkedHashMap<>();

    public void record(ChoicePart choicePart, PartUsage usage) {
        usagesByChoicePart.computeIfAbsent(choicePart.getName(), name -> new ArrayList<>()).add(usage);
    }

    public List<PartUsage> usages(ChoicePart choicePart) {
        return Collections.unmodifiableList(usagesByChoicePart.getOrDefault(choicePart.getName(), List.of()));
    }

    /**
     * Distinct fractional parts registered against {@code choicePart}, in first-use order.
     */
    public List<FractionalPart> fractionalParts(ChoicePart choicePart) {
        Set<FractionalPart> fractions = new LinkedHashSet<>();
        for (PartUsage usage : usages(choicePart)) {
            if (usage.isFractional()) {
                fractions.add(usage.fractionalPart());
            }
        }
        return new ArrayList<>(fractions);
    }

    public boolean isUsed(ChoicePart choicePart) {
        return usagesByChoicePart.containsKey(choicePart.getName());
    }

    /**
     * References grouped by board, e.g. {@code [main: C1 C4][daughter: C2]}.
     */
    public String referencesText(ChoicePart choicePart) {
        StringBuilder text = new StringBuilder();
        Board previous = null;
        for (PartUsage usage : usages(choicePart)) {
            if (usage.board() != previous) {
                if (previous != null) {
                    text.append(']');
                }
                text.append('[').append(usage.board().getName()).append(':');
                previous = usage.board();
            }
            text.append(' ').append(usage.boardPart().reference());
        }
        if (previous != null) {
            text.append(']');
        }
        return text.toString();
    }

    public int size() {
        return usagesByChoicePart.size();
    }
}
