package org.carball.bom.resolver;

import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.part.FractionalPart;

/**
 * A resolved choice part together with the fractional part it was reached through, if any.
 */
public record Resolution(ChoicePart choicePart, FractionalPart via) {
}
