package org.huarongdao.app;

import org.huarongdao.PuzzleException;
import org.huarongdao.board.Board;
import org.huarongdao.board.BoardText;
import org.huarongdao.core.SolveResponse;
import org.huarongdao.core.SolverCore;
import org.huarongdao.core.SolverService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <p>Usage: {@code Main <board-file> [dfs-output] [astar-output]}. The board file holds one
 * board in {@link BoardText} format. Each solution is written as its sequence of snapshots
 * separated by blank lines, to the given output file or to standard output when omitted.</p>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /**
     * Launches the solver CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs both searches for one board file.
     *
     * @return process exit status.
     */
    static int run(String[] args) {
        if (args == null || args.length < 1 || args.length > 3) {
            LOGGER.error("Usage: Main <board-file> [dfs-output] [astar-output]");
            return EXIT_USAGE;
        }
        try {
            Board board = BoardText.parse(Files.readAllLines(Path.of(args[0]), StandardCharsets.UTF_8));
            LOGGER.info("Loaded board from {}\n{}", args[0], board);

            SolverService solver = SolverCore.builder().build();
            SolveResponse dfs = solver.solveDfs(board);
            LOGGER.info("DFS found {} moves after expanding {} boards", dfs.moveCount(), dfs.getExpandedNodes());
            write(dfs, args.length > 1 ? args[1] : null);

            SolveResponse aStar = solver.solveAStar(board);
            LOGGER.info("A* found {} moves after expanding {} boards", aStar.moveCount(), aStar.getExpandedNodes());
            write(aStar, args.length > 2 ? args[2] : null);
            return EXIT_OK;
        } catch (IOException ex) {
            LOGGER.error("Cannot read or write puzzle files: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        } catch (PuzzleException ex) {
            LOGGER.error("Cannot solve puzzle: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void write(SolveResponse response, String target) throws IOException {
        String text = BoardText.formatSequence(response.getPath()) + "\n";
        if (target == null) {
            System.out.print(text);
            System.out.flush();
        } else {
            Files.writeString(Path.of(target), text, StandardCharsets.UTF_8);
        }
    }
}
