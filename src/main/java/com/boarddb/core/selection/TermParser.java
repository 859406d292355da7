package com.boarddb.core.selection;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns selection arguments into {@link Term}s.
 * <p>
 * Arguments are split on whitespace; each word is one term unless joined to
 * its neighbour with {@code &}. For example {@code ["arm & freescale sandbox", "tegra"]}
 * yields three terms: {@code arm&freescale}, {@code sandbox} and {@code tegra}.
 */
public final class TermParser {

    private static final String AND = "&";

    private TermParser() {}

    public static List<Term> buildTerms(List<String> args) {
        var syms = new ArrayList<String>();
        for (String arg : args) {
            for (String word : arg.trim().split("\\s+")) {
                if (word.isEmpty()) {
                    continue;
                }
                var symBuild = new ArrayList<String>();
                for (String part : word.split(AND, -1)) {
                    if (!part.isEmpty()) {
                        symBuild.add(part);
                    }
                    symBuild.add(AND);
                }
                syms.addAll(symBuild.subList(0, symBuild.size() - 1));
            }
        }

        var terms = new ArrayList<Term>();
        Term term = null;
        boolean pendingAnd = false;
        for (String sym : syms) {
            if (AND.equals(sym)) {
                pendingAnd = true;
            } else if (pendingAnd && term != null) {
                term.addExpr(sym);
                pendingAnd = false;
            } else {
                if (term != null) {
                    terms.add(term);
                }
                term = new Term();
                term.addExpr(sym);
                pendingAnd = false;
            }
        }
        if (term != null) {
            terms.add(term);
        }
        return terms;
    }
}
