package org.carball.bom.resolver;

import org.carball.bom.model.part.Board;
import org.carball.bom.model.part.BoardPart;
import org.carball.bom.model.part.FractionalPart;

/**
 * One use of a choice part by a board part. {@code fractionalPart} is set when the board part
 * reached the choice part through a {@link FractionalPart}.
 */
public record PartUsage(Board board, BoardPart boardPart, FractionalPart fractionalPart) {

    public boolean isFractional() {
        return fractionalPart != null;
    }
}
