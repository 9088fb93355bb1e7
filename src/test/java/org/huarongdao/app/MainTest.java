package org.huarongdao.app;

import org.huarongdao.board.Board;
import org.huarongdao.board.BoardText;
import org.huarongdao.board.Direction;
import org.huarongdao.testutil.PuzzleFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Command-Line Entry Point Tests")
class MainTest {

    @TempDir
    Path tempDir;

    private static Path boardResource(String name) throws URISyntaxException {
        return Path.of(MainTest.class.getResource("/boards/" + name).toURI());
    }

    private static List<Board> readSequence(Path file) throws Exception {
        String text = Files.readString(file, StandardCharsets.UTF_8).strip();
        return Arrays.stream(text.split("\\R\\R"))
                .map(BoardText::parse)
                .toList();
    }

    @Test
    @DisplayName("Writes both solutions as blank-line separated board sequences")
    void testWritesSolutions() throws Exception {
        Path dfsOut = tempDir.resolve("dfs.txt");
        Path aStarOut = tempDir.resolve("astar.txt");

        int status = Main.run(new String[]{boardResource("one-move.txt").toString(), dfsOut.toString(), aStarOut.toString()});

        assertEquals(Main.EXIT_OK, status);
        Board oneMove = PuzzleFixtures.oneMove();
        Board solved = oneMove.applyMove(oneMove.blockPieceId(), Direction.DOWN);
        String expected = "2334\n2554\n6117\n6117\n7007\n\n2334\n2554\n6007\n6117\n7117\n";
        assertEquals(BoardText.formatSequence(List.of(oneMove, solved)) + "\n", expected);
        assertEquals(expected, Files.readString(dfsOut, StandardCharsets.UTF_8));
        assertEquals(expected, Files.readString(aStarOut, StandardCharsets.UTF_8));
        assertFalse(Files.readString(dfsOut, StandardCharsets.UTF_8).contains("\r"),
                "output uses one line ending throughout");
    }

    @Test
    @DisplayName("Classic board: A* output is the 116-slide optimum")
    void testClassicBoard() throws Exception {
        Path dfsOut = tempDir.resolve("dfs.txt");
        Path aStarOut = tempDir.resolve("astar.txt");

        int status = Main.run(new String[]{boardResource("classic.txt").toString(), dfsOut.toString(), aStarOut.toString()});

        assertEquals(Main.EXIT_OK, status);
        List<Board> aStarPath = readSequence(aStarOut);
        List<Board> dfsPath = readSequence(dfsOut);
        assertEquals(PuzzleFixtures.CLASSIC_SHORTEST_MOVES + 1, aStarPath.size());
        assertEquals(PuzzleFixtures.classic(), aStarPath.get(0));
        assertTrue(aStarPath.get(aStarPath.size() - 1).isGoal());
        assertTrue(dfsPath.size() >= aStarPath.size());
        assertTrue(dfsPath.get(dfsPath.size() - 1).isGoal());
    }

    @Test
    @DisplayName("Unsolvable, malformed or missing input fails with status 1")
    void testFailures() throws Exception {
        Path malformed = tempDir.resolve("bad.txt");
        Files.writeString(malformed, "2113\n2113\n4665\n", StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{boardResource("unsolvable.txt").toString(),
                tempDir.resolve("dfs.txt").toString()}));
        assertFalse(Files.exists(tempDir.resolve("dfs.txt")));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{malformed.toString()}));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{tempDir.resolve("missing.txt").toString()}));
    }

    @Test
    @DisplayName("Wrong argument count fails with usage status")
    void testUsage() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[0]));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"a", "b", "c", "d"}));
        assertEquals(Main.EXIT_USAGE, Main.run(null));
    }
}
