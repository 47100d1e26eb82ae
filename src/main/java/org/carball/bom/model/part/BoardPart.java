package org.carball.bom.model.part;

import java.util.Comparator;

/**
 * One placed component on a board: its reference designator (e.g. {@code R123}) and the schematic
 * part name it was drawn with. A comment of {@code DNI} marks a part that is not installed.
 */
public record BoardPart(String boardName, String reference, String schematicPartName, String comment) {

    public static final String DO_NOT_INSTALL = "DNI";

    /**
     * Orders references alphabetically by prefix, then numerically, so {@code R2} sorts before {@code R10}.
     */
    public static final Comparator<BoardPart> REFERENCE_ORDER = Comparator
            .comparing((BoardPart part) -> referencePrefix(part.reference()))
            .thenComparingInt(part -> referenceNumber(part.reference()))
            .thenComparing(BoardPart::reference);

    public BoardPart {
        comment = comment == null ? "" : comment;
    }

    public boolean isInstalled() {
        return !DO_NOT_INSTALL.equals(comment);
    }

    static String referencePrefix(String reference) {
        StringBuilder prefix = new StringBuilder();
        for (char c : reference.toCharArray()) {
            if (Character.isLetter(c)) prefix.append(Character.toUpperCase(c));
        }
        return prefix.toString();
    }

    static int referenceNumber(String reference) {
        StringBuilder digits = new StringBuilder();
        for (char c : reference.toCharArray()) {
            if (Character.isDigit(c)) digits.append(c);
        }
        if (digits.isEmpty()) {
            return -1;
        }
        try {
            return Integer.parseInt(digits.toString());
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
