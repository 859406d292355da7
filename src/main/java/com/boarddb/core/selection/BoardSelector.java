package com.boarddb.core.selection;

import com.boarddb.core.model.Board;
import com.boarddb.core.model.SelectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects boards from a board list using terms, explicit names and exclusions.
 * <p>
 * For each board, in order:
 * <ol>
 *   <li>if terms were given, the first term that matches selects the board and
 *       is recorded as its provenance; later terms are not tried</li>
 *   <li>otherwise, if explicit names were given, the board is selected when its
 *       target is one of them</li>
 *   <li>otherwise every board is selected</li>
 * </ol>
 * A board matching any exclusion expression is never selected.
 */
@Service
public class BoardSelector {

    private static final Logger log = LoggerFactory.getLogger(BoardSelector.class);

    /**
     * @param boards        boards to choose from
     * @param args          term arguments; empty for none
     * @param exclude       exclusion expressions; empty for none
     * @param explicitNames targets to build; empty for none
     * @return the selection, with a "not found" warning for explicit names matching no board
     */
    public SelectionResult select(List<Board> boards, List<String> args,
                                  List<String> exclude, List<String> explicitNames) {
        List<Term> terms = TermParser.buildTerms(args);
        List<Expr> excludeExprs = exclude.stream().map(Expr::new).toList();
        Set<String> names = new LinkedHashSet<>(explicitNames);

        var byTerm = new LinkedHashMap<String, List<String>>();
        byTerm.put(SelectionResult.ALL, new ArrayList<>());
        for (Term term : terms) {
            byTerm.put(term.toString(), new ArrayList<>());
        }

        var selected = new LinkedHashSet<String>();
        var found = new HashSet<String>();
        for (Board board : boards) {
            List<String> props = board.props();
            String matchingTerm = null;
            boolean buildIt = false;

            if (!terms.isEmpty()) {
                for (Term term : terms) {
                    if (term.matches(props)) {
                        matchingTerm = term.toString();
                        buildIt = true;
                        break;
                    }
                }
            } else if (!names.isEmpty()) {
                if (names.contains(board.target())) {
                    buildIt = true;
                    found.add(board.target());
                }
            } else {
                buildIt = true;
            }

            if (buildIt && isExcluded(excludeExprs, props)) {
                log.debug("Board {} excluded", board.target());
                buildIt = false;
            }

            if (buildIt) {
                selected.add(board.target());
                if (matchingTerm != null) {
                    byTerm.get(matchingTerm).add(board.target());
                }
                byTerm.get(SelectionResult.ALL).add(board.target());
            }
        }

        var warnings = new ArrayList<String>();
        if (!names.isEmpty()) {
            var remaining = new ArrayList<String>();
            for (String name : names) {
                if (!found.contains(name)) {
                    remaining.add(name);
                }
            }
            if (!remaining.isEmpty()) {
                warnings.add("Boards not found: " + String.join(", ", remaining));
            }
        }

        log.debug("Selected {} of {} boards", selected.size(), boards.size());
        return new SelectionResult(freeze(byTerm), Collections.unmodifiableSet(selected), List.copyOf(warnings));
    }

    private static boolean isExcluded(List<Expr> excludeExprs, List<String> props) {
        for (Expr expr : excludeExprs) {
            if (expr.matches(props)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, List<String>> freeze(LinkedHashMap<String, List<String>> byTerm) {
        var copy = new LinkedHashMap<String, List<String>>();
        byTerm.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
