package com.boarddb.dispatch.cli;

import com.boarddb.core.model.SelectionResult;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the boarddb CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BOARDDB]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Warnings go to stderr verbatim so they can be grepped and diffed.
     */
    public static void warnings(List<String> warnings) {
        for (String warning : warnings) {
            System.err.println(warning);
        }
    }

    public static void selection(SelectionResult result) {
        for (Map.Entry<String, List<String>> entry : result.byTerm().entrySet()) {
            if (SelectionResult.ALL.equals(entry.getKey())) {
                continue;
            }
            List<String> targets = entry.getValue();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold,fg(yellow) " + entry.getKey() + "|@: " + targets.size()
                    + " board" + (targets.size() != 1 ? "s" : "")));
            for (String target : targets) {
                System.out.println("  " + target);
            }
        }
        int total = result.all().size();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Total|@: " + total + " board" + (total != 1 ? "s" : "") + " selected"));
    }

    public static void boardList(List<String> targets) {
        for (String target : targets) {
            System.out.println(target);
        }
    }
}
