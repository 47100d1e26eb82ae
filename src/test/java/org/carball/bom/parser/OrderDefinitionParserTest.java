package org.carball.bom.parser;

import org.carball.bom.aggregator.Order;
import org.carball.bom.model.part.Board;
import org.carball.bom.model.part.BoardPart;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OrderDefinitionParserTest {

    @TempDir
    Path tempDir;

    private final OrderDefinitionParser parser = new OrderDefinitionParser();

    @Test
    void shouldParseBoardsAndVendorRestrictions() throws IOException {
        // Given
        Path file = tempDir.resolve("order.yaml");
        Files.writeString(file, """
                exclude_vendors: [Verical]
                allow_vendors: [Digi-Key, Mouser]
                boards:
                  - name: main
                    revision: B
                    count: 25
                    parts:
                      - reference: R1
                        part: "10K;1608"
                      - reference: R2
                        part: "10K;1608"
                        comment: DNI
                  - name: aux
                    parts:
                      - reference: C1
                        part: "100NF;1608"
                """);

        // When
        Order order = parser.parse(file);

        // Then
        assertThat(order.getExcludedVendorNames()).containsExactly("Verical");
        assertThat(order.getAllowedVendorNames()).containsExactly("Digi-Key", "Mouser");
        assertThat(order.hasAllowList()).isTrue();
        assertThat(order.getBoards()).extracting(Board::getName).containsExactly("main", "aux");

        Board main = order.getBoards().get(0);
        assertThat(main.getRevision()).isEqualTo("B");
        assertThat(main.getCount()).isEqualTo(25);
        assertThat(main.getUninstalledBoardParts()).extracting(BoardPart::reference).containsExactly("R2");
        assertThat(order.getBoards().get(1).getCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectBoardPartWithoutSchematicName() throws IOException {
        // Given
        Path file = tempDir.resolve("order.json");
        Files.writeString(file, """
                {"boards": [{"name": "main", "count": 1, "parts": [{"reference": "R1"}]}]}
                """);

        // When/Then
        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Part of board 'main' is missing 'part'");
    }

    @Test
    void shouldRejectNonMappingDocument() throws IOException {
        // Given
        Path file = tempDir.resolve("order.yaml");
        Files.writeString(file, "- just\n- a list\n");

        // When/Then
        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("mapping");
    }
}
