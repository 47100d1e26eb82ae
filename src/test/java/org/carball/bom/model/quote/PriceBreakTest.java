package org.carball.bom.model.quote;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class PriceBreakTest {

    @Test
    void shouldParseAndSortPriceBreaks() {
        // When
        List<PriceBreak> breaks = PriceBreak.parseAll("10/0.05  1/$0.10 100/0.031");

        // Then
        assertThat(breaks).containsExactly(
                new PriceBreak(1, 0.10),
                new PriceBreak(10, 0.05),
                new PriceBreak(100, 0.031));
    }

    @Test
    void shouldReturnNoBreaksForBlankText() {
        assertThat(PriceBreak.parseAll("")).isEmpty();
        assertThat(PriceBreak.parseAll("   ")).isEmpty();
        assertThat(PriceBreak.parseAll(null)).isEmpty();
    }

    @Test
    void shouldRejectMalformedPairs() {
        assertThatThrownBy(() -> PriceBreak.parseAll("1-0.10"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quantity/price");
        assertThatThrownBy(() -> PriceBreak.parseAll("ten/0.10"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not an integer");
        assertThatThrownBy(() -> PriceBreak.parseAll("1/cheap"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a number");
    }

    @Test
    void shouldRejectNonPositiveQuantityAndNegativePrice() {
        assertThatThrownBy(() -> new PriceBreak(0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PriceBreak(1, -0.01)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRoundOrderQuantityUpToBreakQuantity() {
        // Given
        PriceBreak priceBreak = new PriceBreak(10, 0.05);

        // Then
        assertThat(priceBreak.orderQuantity(3)).isEqualTo(10);
        assertThat(priceBreak.orderQuantity(25)).isEqualTo(25);
        assertThat(priceBreak.cost(3)).isCloseTo(0.50, within(1e-9));
    }

    @Test
    void shouldFormatBreaks() {
        assertThat(PriceBreak.format(List.of(new PriceBreak(1, 0.1), new PriceBreak(10, 0.05))))
                .isEqualTo("1/$0.100 10/$0.050");
    }
}
