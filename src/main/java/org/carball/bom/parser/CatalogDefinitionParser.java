package org.carball.bom.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.bom.catalog.AliasRef;
import org.carball.bom.catalog.PartCatalog;
import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.quote.InlineOffer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.carball.bom.parser.DefinitionFiles.array;
import static org.carball.bom.parser.DefinitionFiles.doubleValue;
import static org.carball.bom.parser.DefinitionFiles.intValue;
import static org.carball.bom.parser.DefinitionFiles.requiredText;
import static org.carball.bom.parser.DefinitionFiles.text;

/**
 * Builds a {@link PartCatalog} from a YAML or JSON catalog definition:
 * <pre>
 * choice_parts:
 *   - name: "10K;1608"
 *     location: "Drawer 3"
 *     actual_parts:
 *       - manufacturer: Yageo
 *         part: RC0603FR-0710KL
 *         offers:
 *           - vendor: Digi-Key
 *             vendor_part: 311-10.0KHRCT-ND
 *             price_breaks: "1/0.10 10/0.05"
 * fractional_parts:
 *   - name: "HDR1X1;M1X1"
 *     whole: "HDR1X40;M1X40"
 *     numerator: 1
 *     denominator: 40
 * alias_parts:
 *   - name: "PULLUP;1608"
 *     targets:
 *       - name: "10K;1608"
 *         count: 1
 * </pre>
 * Sections are registered in the order shown so aliases may point at choice and fractional parts.
 */
@Slf4j
public class CatalogDefinitionParser {

    public PartCatalog parse(Path path) throws IOException {
        JsonNode root = DefinitionFiles.read(path, "Catalog");
        PartCatalog catalog = new PartCatalog();

        for (JsonNode node : array(root, "choice_parts")) {
            parseChoicePart(catalog, node);
        }
        for (JsonNode node : array(root, "fractional_parts")) {
            parseFractionalPart(catalog, node);
        }
        for (JsonNode node : array(root, "alias_parts")) {
            parseAliasPart(catalog, node);
        }

        log.info("Loaded {} schematic parts from {} ({} warnings)",
                catalog.size(), path, catalog.getWarnings().size());
        return catalog;
    }

    private void parseChoicePart(PartCatalog catalog, JsonNode node) {
        String name = requiredText(node, "name", "Choice part");
        ChoicePart choicePart = catalog.registerChoicePart(name, text(node, "footprint"),
                text(node, "location"), text(node, "description"));
        choicePart.placement(doubleValue(node, "rotation", 0.0), doubleValue(node, "pick_dx", 0.0),
                doubleValue(node, "pick_dy", 0.0), doubleValue(node, "height", 0.0));

        for (JsonNode actual : array(node, "actual_parts")) {
            String context = "Actual part of '" + name + "'";
            List<InlineOffer> offers = new ArrayList<>();
            for (JsonNode offer : array(actual, "offers")) {
                offers.add(new InlineOffer(requiredText(offer, "vendor", "Offer in " + context),
                        text(offer, "vendor_part"), requiredText(offer, "price_breaks", "Offer in " + context)));
            }
            choicePart.actualPart(requiredText(actual, "manufacturer", context),
                    requiredText(actual, "part", context), offers.toArray(new InlineOffer[0]));
        }
    }

    private void parseFractionalPart(PartCatalog catalog, JsonNode node) {
        String name = requiredText(node, "name", "Fractional part");
        String context = "Fractional part '" + name + "'";
        catalog.registerFractionalPart(name, text(node, "footprint"), requiredText(node, "whole", context),
                intValue(node, "numerator", 0), intValue(node, "denominator", 0), text(node, "description"));
    }

    private void parseAliasPart(PartCatalog catalog, JsonNode node) {
        String name = requiredText(node, "name", "Alias part");
        List<AliasRef> refs = new ArrayList<>();
        for (JsonNode target : array(node, "targets")) {
            if (target.isTextual()) {
                refs.add(AliasRef.of(target.asText()));
            } else {
                refs.add(AliasRef.of(intValue(target, "count", 1),
                        requiredText(target, "name", "Target of alias '" + name + "'")));
            }
        }
        catalog.registerAliasPart(name, text(node, "footprint"), refs);
    }
}
