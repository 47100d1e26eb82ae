package org.carball.bom.model.part;

/**
 * One substitution target of an {@link AliasPart}, used {@code count} times.
 */
public record AliasTarget(int count, SchematicPart part) {

    public AliasTarget {
        if (count < 1) {
            throw new IllegalArgumentException("Alias target count must be positive: " + count);
        }
    }

    public static AliasTarget once(SchematicPart part) {
        return new AliasTarget(1, part);
    }
}
