package org.nchoosek.cli;

import org.apache.commons.lang3.StringUtils;
import org.nchoosek.core.CoefficientVector;
import org.nchoosek.core.TallySet;
import org.nchoosek.core.TruthTable;
import org.nchoosek.expressions.ConstraintFormatter;
import org.nchoosek.parser.TruthTableParser;
import org.nchoosek.search.CoefficientSearch;
import org.nchoosek.search.SearchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.CharacterCodingException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.Callable;

/**
 * 命令行入口：读取真值表，输出等价的 nck 约束。
 */
@Command(
        name = Tt2Nck.NAME,
        mixinStandardHelpOptions = true,
        version = Tt2Nck.NAME + " 1.0",
        description = {
                "Convert a truth table to an NchooseK constraint.",
                "",
                "Rows are whitespace-separated 0/1 (or F/T, f/t) values, one row per line.",
                "Comments run from # to the end of the line. The rows listed are the valid",
                "rows; every other row of the same width is invalid.",
        })
public class Tt2Nck implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(Tt2Nck.class);

    static final String NAME = "tt2nck";

    static final int EXIT_OK = 0;
    static final int EXIT_BAD_INPUT = 1;

    static final String STDIN = "<stdin>";

    @Spec
    private CommandSpec spec;

    @Parameters(
            arity = "0..1",
            paramLabel = "FILE",
            description = "Truth-table file. Standard input is read if omitted.")
    private File file;

    @Option(
            names = {"-w", "--max-workers"},
            paramLabel = "N",
            description = "Maximum number of chunks evaluated in parallel (default: ${sys:nchoosek.maxWorkers:-10 x cores}).")
    private Integer maxWorkers;

    @Option(
            names = {"-c", "--chunk-size"},
            paramLabel = "N",
            description = "Number of candidate vectors per chunk (default: ${sys:nchoosek.chunkSize:-1000}).")
    private Integer chunkSize;

    private final InputStream stdin;

    public Tt2Nck() {
        this(System.in);
    }

    Tt2Nck(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Tt2Nck()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            TruthTable table = readTruthTable();
            SearchOptions options = searchOptions();

            CoefficientVector coeffs;
            try (CoefficientSearch search = new CoefficientSearch(options)) {
                coeffs = search.findFirstSeparating(table);
            }
            TallySet tallies = coeffs.tallies(table.getRows());

            for (String line : ConstraintFormatter.report(coeffs, tallies)) {
                out.println(line);
            }
            out.flush();
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            // 包括 TruthTableException 和过宽的表
            return fail(err, e.getMessage());
        } catch (IOException e) {
            logger.debug("读取真值表失败: {}", source(), e);
            return fail(err, source() + ": " + describe(e));
        }
    }

    private static int fail(PrintWriter err, String reason) {
        err.println(NAME + ": " + reason);
        err.flush();
        return EXIT_BAD_INPUT;
    }

    private String source() {
        return file == null ? STDIN : file.getPath();
    }

    /**
     * 把 I/O 异常转为简短的原因。NIO 的异常消息通常只有文件名。
     */
    static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "no such file";
        }
        if (e instanceof AccessDeniedException) {
            return "permission denied";
        }
        if (e instanceof CharacterCodingException) {
            return "input is not valid UTF-8";
        }
        if (e instanceof FileSystemException && ((FileSystemException) e).getReason() != null) {
            return ((FileSystemException) e).getReason();
        }
        return StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
    }

    private TruthTable readTruthTable() throws IOException {
        if (file == null) {
            logger.debug("从标准输入读取真值表");
            return TruthTableParser.parse(stdin);
        }
        return TruthTableParser.parse(file.toPath());
    }

    private SearchOptions searchOptions() {
        SearchOptions options = SearchOptions.fromSystemProperties();
        if (maxWorkers != null) {
            options = options.withMaxWorkers(maxWorkers);
        }
        if (chunkSize != null) {
            options = options.withChunkSize(chunkSize);
        }
        return options;
    }
}
