package com.boarddb.dispatch.cli;

import com.boarddb.config.BoardDbProperties;
import com.boarddb.core.database.BoardDatabaseReader;
import com.boarddb.core.logging.MdcContext;
import com.boarddb.core.model.BoardList;
import com.boarddb.core.model.SelectionResult;
import com.boarddb.core.selection.BoardSelector;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: boarddb select [TERM...]
 * <p>
 * Loads the board database and prints the boards matched by each term. Terms
 * are regular expressions matched against the start of a board's target, arch,
 * CPU, board, vendor, SoC and config names; {@code &} joins expressions that
 * must all match.
 */
@Command(name = "select", mixinStandardHelpOptions = true, description = "Select boards from the board database")
@Component
public class SelectCommand implements Callable<Integer> {

    @Mixin
    private TreeOptions tree = new TreeOptions();

    @Parameters(description = "Terms, e.g. 'arm & freescale' sandbox", arity = "0..*")
    private List<String> terms = new ArrayList<>();

    @Option(names = {"--exclude", "-x"}, description = "Expression of boards to exclude", split = ",")
    private List<String> exclude = new ArrayList<>();

    @Option(names = {"--boards", "-b"}, description = "Explicit board targets to select", split = ",")
    private List<String> boards = new ArrayList<>();

    @Option(names = {"--list", "-l"}, description = "Print only the selected targets, one per line")
    private boolean list;

    @Option(names = {"--json"}, description = "Print the selection as JSON")
    private boolean json;

    private final BoardDatabaseReader reader;
    private final BoardSelector selector;
    private final BoardDbProperties properties;

    public SelectCommand(BoardDatabaseReader reader, BoardSelector selector, BoardDbProperties properties) {
        this.reader = reader;
        this.selector = selector;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("select");
        try {
            Path output = tree.output(properties);
            if (!Files.exists(output)) {
                ConsoleOutput.error("Board database not found: " + output + " (run 'boarddb build' first)");
                return 2;
            }

            BoardList boardList = reader.read(output);
            SelectionResult result = selector.select(boardList.boards(), terms, exclude, boards);

            if (json) {
                var doc = new LinkedHashMap<String, Object>();
                doc.put("terms", result.byTerm());
                doc.put("warnings", result.warnings());
                System.out.println(new ObjectMapper()
                        .enable(SerializationFeature.INDENT_OUTPUT)
                        .writeValueAsString(doc));
            } else if (list) {
                ConsoleOutput.boardList(boardList.selectedNames(result));
            } else {
                ConsoleOutput.selection(result);
            }
            ConsoleOutput.warnings(result.warnings());
            return result.warnings().isEmpty() ? 0 : 1;
        } finally {
            MdcContext.clear();
        }
    }
}
