package org.carball.bom.aggregator;

import lombok.Getter;
import org.carball.bom.model.part.Board;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The boards to buy parts for, plus any vendor restrictions the buyer imposes up front.
 */
@Getter
public class Order {

    private final List<Board> boards = new ArrayList<>();
    private final Set<String> excludedVendorNames = new LinkedHashSet<>();
    private final Set<String> allowedVendorNames = new LinkedHashSet<>();

    public Board board(String name, String revision, int count) {
        Board board = new Board(name, revision, count);
        boards.add(board);
        return board;
    }

    public Order excludeVendor(String vendorName) {
        excludedVendorNames.add(vendorName);
        return this;
    }

    /**
     * Restricts the order to the allowed vendors. Once any vendor is allowed, every other vendor is
     * excluded and the shipping cost reduction is skipped.
     */
    public Order allowVendor(String vendorName) {
        allowedVendorNames.add(vendorName);
        return this;
    }

    public boolean hasAllowList() {
        return !allowedVendorNames.isEmpty();
    }

    public List<Board> getBoards() {
        return Collections.unmodifiableList(boards);
    }

    public Set<String> getExcludedVendorNames() {
        return Collections.unmodifiableSet(excludedVendorNames);
    }

    public Set<String> getAllowedVendorNames() {
        return Collections.unmodifiableSet(allowedVendorNames);
    }
}
