package org.carball.bom.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.bom.aggregator.Order;
import org.carball.bom.model.part.Board;

import java.io.IOException;
import java.nio.file.Path;

import static org.carball.bom.parser.DefinitionFiles.array;
import static org.carball.bom.parser.DefinitionFiles.intValue;
import static org.carball.bom.parser.DefinitionFiles.requiredText;
import static org.carball.bom.parser.DefinitionFiles.text;

/**
 * Builds an {@link Order} from a YAML or JSON order definition:
 * <pre>
 * exclude_vendors: [Verical]
 * allow_vendors: []
 * boards:
 *   - name: main
 *     revision: B
 *     count: 25
 *     parts:
 *       - reference: R1
 *         part: "10K;1608"
 *       - reference: R2
 *         part: "10K;1608"
 *         comment: DNI
 * </pre>
 */
@Slf4j
public class OrderDefinitionParser {

    public Order parse(Path path) throws IOException {
        JsonNode root = DefinitionFiles.read(path, "Order");
        Order order = new Order();

        for (JsonNode vendor : array(root, "exclude_vendors")) {
            order.excludeVendor(vendor.asText());
        }
        for (JsonNode vendor : array(root, "allow_vendors")) {
            order.allowVendor(vendor.asText());
        }

        int boardPartCount = 0;
        for (JsonNode boardNode : array(root, "boards")) {
            String boardName = requiredText(boardNode, "name", "Board");
            Board board = order.board(boardName, text(boardNode, "revision"), intValue(boardNode, "count", 1));
            for (JsonNode partNode : array(boardNode, "parts")) {
                String context = "Part of board '" + boardName + "'";
                board.boardPart(requiredText(partNode, "reference", context),
                        requiredText(partNode, "part", context), text(partNode, "comment"));
                boardPartCount++;
            }
        }

        log.info("Loaded order with {} boards and {} board parts from {}",
                order.getBoards().size(), boardPartCount, path);
        return order;
    }
}
