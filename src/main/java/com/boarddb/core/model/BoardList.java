package com.boarddb.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered collection of boards loaded from a board database.
 * <p>
 * Selection state is not stored on the boards; callers pass the
 * {@link SelectionResult} produced by the selector instead.
 */
public class BoardList {

    private final List<Board> boards = new ArrayList<>();

    /**
     * Adds a board. Callers are expected not to add the same target twice.
     */
    public void add(Board board) {
        boards.add(board);
    }

    public List<Board> boards() {
        return Collections.unmodifiableList(boards);
    }

    public int size() {
        return boards.size();
    }

    /** Boards keyed by target, in load order. A repeated target keeps the later board. */
    public Map<String, Board> byTarget() {
        var map = new LinkedHashMap<String, Board>();
        for (Board board : boards) {
            map.put(board.target(), board);
        }
        return map;
    }

    public List<Board> selected(SelectionResult selection) {
        return boards.stream()
                .filter(b -> selection.isSelected(b.target()))
                .toList();
    }

    public Map<String, Board> selectedByTarget(SelectionResult selection) {
        var map = new LinkedHashMap<String, Board>();
        for (Board board : selected(selection)) {
            map.put(board.target(), board);
        }
        return map;
    }

    public List<String> selectedNames(SelectionResult selection) {
        return selected(selection).stream().map(Board::target).toList();
    }
}
