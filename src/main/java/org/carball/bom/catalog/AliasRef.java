package org.carball.bom.catalog;

/**
 * A by-name alias target used during registration: {@code name} repeated {@code count} times.
 */
public record AliasRef(int count, String name) {

    public AliasRef {
        if (count < 1) {
            throw new IllegalArgumentException("Alias target '" + name + "' count must be positive: " + count);
        }
    }

    public static AliasRef of(String name) {
        return new AliasRef(1, name);
    }

    public static AliasRef of(int count, String name) {
        return new AliasRef(count, name);
    }
}
