package org.carball.bom.model.part;

/**
 * A schematic part name of the form {@code base;footprint} or {@code base;footprint:comment}.
 * The short footprint only has to disambiguate the footprints used with one base name
 * (e.g. {@code 1608}, {@code SOIC8}).
 */
public record SchematicPartName(String fullName, String baseName, String shortFootprint, String comment) {

    public static SchematicPartName parse(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            throw new IllegalArgumentException("Schematic part name must not be blank");
        }

        String[] halves = fullName.split(";", -1);
        if (halves.length != 2) {
            throw new IllegalArgumentException("Schematic part name '" + fullName
                    + "' must contain exactly one ';' separator");
        }

        String baseName = halves[0];
        String footprint = halves[1];
        String comment = "";
        int colon = footprint.indexOf(':');
        if (colon >= 0) {
            comment = footprint.substring(colon + 1);
            footprint = footprint.substring(0, colon);
        }

        if (baseName.isEmpty() || footprint.isEmpty()) {
            throw new IllegalArgumentException("Schematic part name '" + fullName
                    + "' needs both a base name and a footprint");
        }
        return new SchematicPartName(fullName, baseName, footprint, comment);
    }

    /**
     * The name without its comment.
     */
    public String shortName() {
        return baseName + ";" + shortFootprint;
    }

    @Override
    public String toString() {
        return fullName;
    }
}
