package org.carball.bom.model.part;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A PCB design built {@code count} times.
 */
@Getter
public class Board {

    private final String name;
    private final String revision;
    private final int count;
    private final List<BoardPart> boardParts = new ArrayList<>();

    public Board(String name, String revision, int count) {
        this.name = Objects.requireNonNull(name, "name");
        this.revision = revision == null ? "" : revision;
        if (count < 0) {
            throw new IllegalArgumentException("Board '" + name + "' count must not be negative: " + count);
        }
        this.count = count;
    }

    public Board boardPart(String reference, String schematicPartName) {
        return boardPart(reference, schematicPartName, "");
    }

    public Board boardPart(String reference, String schematicPartName, String comment) {
        boardParts.add(new BoardPart(name, reference, schematicPartName, comment));
        return this;
    }

    public List<BoardPart> getBoardParts() {
        return Collections.unmodifiableList(boardParts);
    }

    public List<BoardPart> getInstalledBoardParts() {
        return boardParts.stream().filter(BoardPart::isInstalled).toList();
    }

    public List<BoardPart> getUninstalledBoardParts() {
        return boardParts.stream().filter(part -> !part.isInstalled()).toList();
    }

    public List<BoardPart> getSortedBoardParts() {
        List<BoardPart> sorted = new ArrayList<>(boardParts);
        sorted.sort(BoardPart.REFERENCE_ORDER);
        return sorted;
    }
}
