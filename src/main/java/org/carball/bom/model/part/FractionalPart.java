package org.carball.bom.model.part;

import lombok.Getter;

/**
 * A slice of a {@link ChoicePart}, e.g. a 6 pin piece broken off a 40 pin header
 * ({@code numerator = 6}, {@code denominator = 40}).
 */
@Getter
public class FractionalPart extends SchematicPart {

    private final ChoicePart choicePart;
    private final int numerator;
    private final int denominator;
    private final String description;

    public FractionalPart(String schematicPartName, String footprint, ChoicePart choicePart,
                          int numerator, int denominator, String description) {
        super(schematicPartName, footprint);
        if (denominator < 1) {
            throw new IllegalArgumentException("Fractional part '" + schematicPartName
                    + "' needs a positive denominator, got " + denominator);
        }
        if (numerator < 1 || numerator > denominator) {
            throw new IllegalArgumentException("Fractional part '" + schematicPartName
                    + "' numerator " + numerator + " is not within 1.." + denominator);
        }
        this.choicePart = choicePart;
        this.numerator = numerator;
        this.denominator = denominator;
        this.description = description == null ? "" : description;
    }

    @Override
    public PartKind getKind() {
        return PartKind.FRACTIONAL;
    }
}
