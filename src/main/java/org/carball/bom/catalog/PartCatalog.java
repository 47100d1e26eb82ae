package org.carball.bom.catalog;

import lombok.extern.slf4j.Slf4j;
import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.part.ActualPartKey;
import org.carball.bom.model.part.AliasPart;
import org.carball.bom.model.part.AliasTarget;
import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.part.FractionalPart;
import org.carball.bom.model.part.PartKind;
import org.carball.bom.model.part.SchematicPart;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every known schematic part keyed by name, plus the deduplicated manufacturer parts they reference.
 * <p>
 * Registration problems (duplicate names, dangling alias targets) are logged and counted but never
 * abort loading; the first registration of a name wins.
 */
@Slf4j
public class PartCatalog {

    private final Map<String, SchematicPart> schematicParts = new LinkedHashMap<>();
    private final Map<ActualPartKey, ActualPart> actualParts = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    public ChoicePart registerChoicePart(String schematicPartName, String footprint,
                                         String location, String description) {
        ChoicePart choicePart = new ChoicePart(schematicPartName, footprint, location, description);
        // A rejected duplicate is still returned so chained actualPart() calls land on a detached instance
        insert(choicePart);
        return choicePart;
    }

    /**
     * Registers an alias whose targets are used once each.
     */
    public AliasPart registerAliasPart(String schematicPartName, String footprint, String... targetNames) {
        List<AliasRef> refs = new ArrayList<>();
        for (String targetName : targetNames) {
            refs.add(AliasRef.of(targetName));
        }
        return registerAliasPart(schematicPartName, footprint, refs);
    }

    /**
     * Registers an alias from {@code (count, name)} targets, in order.
     */
    public AliasPart registerAliasPart(String schematicPartName, String footprint, List<AliasRef> refs) {
        List<AliasTarget> targets = new ArrayList<>();
        for (AliasRef ref : refs) {
            SchematicPart target = schematicParts.get(ref.name());
            if (target == null) {
                warn(String.format("Part '%s' not found for alias '%s'", ref.name(), schematicPartName));
            } else {
                targets.add(new AliasTarget(ref.count(), target));
            }
        }

        AliasPart aliasPart = new AliasPart(schematicPartName, footprint, targets);
        insert(aliasPart);
        return aliasPart;
    }

    public Optional<FractionalPart> registerFractionalPart(String schematicPartName, String footprint,
                                                           String wholePartName, int numerator,
                                                           int denominator, String description) {
        SchematicPart whole = schematicParts.get(wholePartName);
        if (whole == null) {
            warn(String.format("Whole part '%s' not found for fractional part '%s'", wholePartName, schematicPartName));
            return Optional.empty();
        }
        if (whole.getKind() != PartKind.CHOICE) {
            warn(String.format("Whole part '%s' of fractional part '%s' is a %s part, not a choice part",
                    wholePartName, schematicPartName, whole.getKind()));
            return Optional.empty();
        }

        FractionalPart fractionalPart = new FractionalPart(schematicPartName, footprint,
                (ChoicePart) whole, numerator, denominator, description);
        return insert(fractionalPart) ? Optional.of(fractionalPart) : Optional.empty();
    }

    public Optional<SchematicPart> lookup(String schematicPartName) {
        return Optional.ofNullable(schematicParts.get(schematicPartName));
    }

    public boolean contains(String schematicPartName) {
        return schematicParts.containsKey(schematicPartName);
    }

    public Collection<SchematicPart> getSchematicParts() {
        return Collections.unmodifiableCollection(schematicParts.values());
    }

    public List<ChoicePart> getChoiceParts() {
        List<ChoicePart> choiceParts = new ArrayList<>();
        for (SchematicPart part : schematicParts.values()) {
            if (part instanceof ChoicePart choicePart) {
                choiceParts.add(choicePart);
            }
        }
        return choiceParts;
    }

    /**
     * Collects every distinct {@link ActualPart} referenced by a choice part. When the same
     * (manufacturer, part number) appears twice, the later instance is discarded and the choice part
     * is pointed at the first one.
     *
     * @return the distinct actual parts in registration order
     */
    public List<ActualPart> deduplicateActualParts() {
        actualParts.clear();
        for (ChoicePart choicePart : getChoiceParts()) {
            for (ActualPart actualPart : List.copyOf(choicePart.getActualParts())) {
                ActualPart first = actualParts.get(actualPart.getKey());
                if (first == null) {
                    actualParts.put(actualPart.getKey(), actualPart);
                } else if (first != actualPart) {
                    warn(String.format("Actual part '%s' is duplicated (in '%s'); keeping the first definition",
                            actualPart.getKey(), choicePart.getName()));
                    choicePart.replaceActualPart(actualPart, first);
                }
            }
        }
        log.info("Catalog holds {} schematic parts and {} distinct actual parts",
                schematicParts.size(), actualParts.size());
        return new ArrayList<>(actualParts.values());
    }

    public Optional<ActualPart> getActualPart(ActualPartKey key) {
        return Optional.ofNullable(actualParts.get(key));
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int size() {
        return schematicParts.size();
    }

    private boolean insert(SchematicPart part) {
        String name = part.getName();
        if (schematicParts.containsKey(name)) {
            warn(String.format("'%s' is registered more than once; keeping the first registration", name));
            return false;
        }
        schematicParts.put(name, part);
        log.debug("Registered {}", part);
        return true;
    }

    private void warn(String message) {
        warnings.add(message);
        log.warn(message);
    }
}
