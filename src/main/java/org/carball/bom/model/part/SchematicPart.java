package org.carball.bom.model.part;

import lombok.Getter;

/**
 * A logical part used in a schematic. Always one of {@link ChoicePart}, {@link AliasPart} or
 * {@link FractionalPart}; callers dispatch on {@link #getKind()}.
 */
@Getter
public abstract class SchematicPart {

    private final SchematicPartName partName;
    private final String footprint;

    protected SchematicPart(String schematicPartName, String footprint) {
        this.partName = SchematicPartName.parse(schematicPartName);
        this.footprint = footprint == null ? "" : footprint;
    }

    public abstract PartKind getKind();

    public String getName() {
        return partName.fullName();
    }

    @Override
    public String toString() {
        return getKind() + "(" + getName() + ")";
    }
}
