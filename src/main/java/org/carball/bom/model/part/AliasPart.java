package org.carball.bom.model.part;

import java.util.List;

/**
 * A pure redirect to one or more other schematic parts.
 */
public class AliasPart extends SchematicPart {

    private final List<AliasTarget> targets;

    public AliasPart(String schematicPartName, String footprint, List<AliasTarget> targets) {
        super(schematicPartName, footprint);
        this.targets = List.copyOf(targets);
    }

    @Override
    public PartKind getKind() {
        return PartKind.ALIAS;
    }

    public List<AliasTarget> getTargets() {
        return targets;
    }
}
