package org.nchoosek.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nchoosek.search.SequenceEnumerator;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class Tt2NckTest {

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String stdin, String... args) {
        return run(stdin.getBytes(StandardCharsets.UTF_8), args);
    }

    private int run(byte[] stdin, String... args) {
        CommandLine cmd = new CommandLine(new Tt2Nck(new ByteArrayInputStream(stdin)));
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private List<String> outputLines() {
        return out.toString().lines().collect(Collectors.toList());
    }

    private static String resource(String name) throws URISyntaxException {
        return Path.of(Tt2NckTest.class.getResource(name).toURI()).toString();
    }

    @Nested
    @DisplayName("成功时输出三行 (Success)")
    class SuccessTests {

        @Test
        @DisplayName("从标准输入读取 AND 真值表")
        void testAndFromStdin() {
            int exitCode = run("0 0 0\n0 1 0\n1 0 0\n1 1 1\n");

            assertEquals(Tt2Nck.EXIT_OK, exitCode);
            assertEquals(List.of(
                    "Repetitions: [1,1,2] (4 total)",
                    "Tallies:     [0,1,4]",
                    "Example:     nck([A,B,C,C], [0,1,4])"), outputLines());
            assertEquals("", err.toString());
        }

        @Test
        @DisplayName("从标准输入读取 OR 真值表")
        void testOrFromStdin() {
            assertEquals(Tt2Nck.EXIT_OK, run("0 0 0\n0 1 1\n1 0 1\n1 1 1\n"));
            assertEquals("Tallies:     [0,3,4]", outputLines().get(1));
        }

        @Test
        @DisplayName("从文件读取，带注释")
        void testFromFile() throws URISyntaxException {
            int exitCode = run("", resource("/and.tt"));

            assertEquals(Tt2Nck.EXIT_OK, exitCode);
            assertEquals("Example:     nck([A,B,C,C], [0,1,4])", outputLines().get(2));
        }

        @Test
        @DisplayName("XOR 文件使用 F/T 记号")
        void testXorFile() throws URISyntaxException {
            assertEquals(Tt2Nck.EXIT_OK, run("", "-w", "2", "-c", "1", resource("/xor.tt")));
            assertEquals(List.of(
                    "Repetitions: [1,1,1] (3 total)",
                    "Tallies:     [0,2]",
                    "Example:     nck([A,B,C], [0,2])"), outputLines());
        }
    }

    @Nested
    @DisplayName("失败时返回非零状态 (Failure)")
    class FailureTests {

        @Test
        @DisplayName("无法识别的记号")
        void testBadToken() {
            int exitCode = run("0 0 0\n0 X 1\n");

            assertEquals(Tt2Nck.EXIT_BAD_INPUT, exitCode);
            assertEquals("tt2nck: Failed to parse \"X\" as a Boolean value", err.toString().trim());
            assertEquals("", out.toString());
        }

        @Test
        @DisplayName("列数不一致")
        void testInconsistentWidth() {
            assertEquals(Tt2Nck.EXIT_BAD_INPUT, run("0 0 0\n0 1\n"));
            assertEquals("tt2nck: Not all truth-table rows contain the same number of columns", err.toString().trim());
        }

        @Test
        @DisplayName("空输入")
        void testEmpty() {
            assertEquals(Tt2Nck.EXIT_BAD_INPUT, run("# only a comment\n\n"));
            assertEquals("tt2nck: Truth table is empty", err.toString().trim());
        }

        @Test
        @DisplayName("文件不存在时给出文件名和原因")
        void testMissingFile() {
            String path = new File("/no/such/truth-table.tt").getPath();

            assertEquals(Tt2Nck.EXIT_BAD_INPUT, run("", path));
            assertEquals("tt2nck: " + path + ": no such file", err.toString().trim());
            assertEquals("", out.toString());
        }

        @Test
        @DisplayName("超过 62 列的表")
        void testTooManyColumns() {
            String row = String.join(" ", Collections.nCopies(SequenceEnumerator.MAX_WIDTH + 1, "0"));

            assertEquals(Tt2Nck.EXIT_BAD_INPUT, run(row + "\n"));
            assertEquals("tt2nck: Too many columns to enumerate: 63", err.toString().trim());
            assertEquals("", out.toString());
        }

        @Test
        @DisplayName("非正的块大小")
        void testInvalidChunkSize() {
            assertEquals(Tt2Nck.EXIT_BAD_INPUT, run("1\n", "--chunk-size", "0"));
            assertTrue(err.toString().startsWith("tt2nck: "), err.toString());
        }
    }

    @Nested
    @DisplayName("文件与标准输入的解码一致 (Decoding)")
    class DecodingTests {

        // 0xE9 是 Latin-1 的 é，不是合法的 UTF-8
        private final byte[] latin1 = {'0', ' ', '1', ' ', '#', ' ', (byte) 0xE9, '\n'};

        @TempDir
        Path dir;

        @Test
        @DisplayName("文件中的非法 UTF-8")
        void testMalformedFile() throws IOException {
            Path file = Files.write(dir.resolve("latin1.tt"), latin1);

            assertEquals(Tt2Nck.EXIT_BAD_INPUT, run("", file.toString()));
            assertEquals("tt2nck: " + file + ": input is not valid UTF-8", err.toString().trim());
        }

        @Test
        @DisplayName("标准输入中的非法 UTF-8")
        void testMalformedStdin() {
            assertEquals(Tt2Nck.EXIT_BAD_INPUT, run(latin1));
            assertEquals("tt2nck: <stdin>: input is not valid UTF-8", err.toString().trim());
            assertEquals("", out.toString());
        }

        @Test
        @DisplayName("注释中的 UTF-8 字符在两条路径上都被接受")
        void testUtf8Comment() throws IOException {
            String text = "0 1 # 注释\n1 1\n";
            Path file = Files.writeString(dir.resolve("utf8.tt"), text);

            assertEquals(Tt2Nck.EXIT_OK, run("", file.toString()));
            List<String> fromFile = outputLines();
            out.getBuffer().setLength(0);
            assertEquals(Tt2Nck.EXIT_OK, run(text));
            assertEquals(fromFile, outputLines());
        }
    }
}
