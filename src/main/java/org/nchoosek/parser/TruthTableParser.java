package org.nchoosek.parser;

import org.apache.commons.lang3.StringUtils;
import org.nchoosek.core.BooleanRow;
import org.nchoosek.core.TruthTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 把按行组织的文本解析为 TruthTable。
 * <p>
 * 每行是一个真值表行，记号之间以空白分隔；0/F/f 表示假，1/T/t 表示真；
 * {@code #} 到行尾是注释；空行和只有注释的行被忽略。
 * 所有错误都在解析阶段一次性检出：先检查记号，再检查是否为空，最后检查列数。
 */
public final class TruthTableParser {

    private static final Logger logger = LoggerFactory.getLogger(TruthTableParser.class);

    private static final String COMMENT = "#";

    private TruthTableParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 解析若干行文本。
     * @param lines 输入文本的各行。
     * @return 解析后的 TruthTable。
     * @throws TokenParseException 如果某个记号不是布尔值。
     * @throws EmptyTableException 如果没有任何数据行。
     * @throws InconsistentWidthException 如果各行列数不同。
     */
    public static TruthTable parse(List<String> lines) {
        Objects.requireNonNull(lines, "Lines cannot be null");

        // 1. 逐行解析记号，同时记录行号
        List<BooleanRow> rows = new ArrayList<>();
        List<Integer> lineNumbers = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            List<Boolean> values = parseLine(lines.get(i), i + 1);
            if (values.isEmpty()) {
                continue;
            }
            boolean[] row = new boolean[values.size()];
            for (int j = 0; j < row.length; j++) {
                row[j] = values.get(j);
            }
            rows.add(BooleanRow.of(row));
            lineNumbers.add(i + 1);
        }

        // 2. 空表
        if (rows.isEmpty()) {
            logger.error("真值表为空 (共 {} 行输入)", lines.size());
            throw new EmptyTableException();
        }

        // 3. 列数一致性，以第一行为准
        int ncols = rows.get(0).width();
        for (int i = 1; i < rows.size(); i++) {
            if (rows.get(i).width() != ncols) {
                logger.error("第 {} 行有 {} 列，而第一行有 {} 列", lineNumbers.get(i), rows.get(i).width(), ncols);
                throw new InconsistentWidthException(ncols, rows.get(i).width(), lineNumbers.get(i));
            }
        }

        logger.debug("解析得到 {} 行，{} 列", rows.size(), ncols);
        return TruthTable.of(rows);
    }

    /**
     * 解析一段文本。
     */
    public static TruthTable parse(String text) {
        Objects.requireNonNull(text, "Text cannot be null");
        return parse(text.lines().collect(Collectors.toList()));
    }

    /**
     * 从 Reader 读取全部内容并解析。调用方负责关闭 reader。
     */
    public static TruthTable parse(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "Reader cannot be null");
        BufferedReader buffered = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = buffered.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    /**
     * 按 UTF-8 解码字节流并解析。非法的 UTF-8 序列不会被替换，而是抛出
     * {@link java.nio.charset.MalformedInputException}。调用方负责关闭流。
     */
    public static TruthTable parse(InputStream in) throws IOException {
        Objects.requireNonNull(in, "Input stream cannot be null");
        return parse(new InputStreamReader(in, strictUtf8()));
    }

    /**
     * 读取 UTF-8 文件并解析，解码规则与 {@link #parse(InputStream)} 相同。
     */
    public static TruthTable parse(Path file) throws IOException {
        Objects.requireNonNull(file, "File cannot be null");
        logger.debug("读取真值表文件 {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        }
    }

    private static CharsetDecoder strictUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    /**
     * 解析一行：去掉注释后按空白切分。
     * @param line 一行文本。
     * @param lineNumber 从 1 开始的行号，用于报错。
     * @return 该行的布尔值；空行返回空列表。
     */
    static List<Boolean> parseLine(String line, int lineNumber) {
        String noComments = StringUtils.substringBefore(line, COMMENT);
        String[] tokens = StringUtils.split(noComments);
        List<Boolean> values = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            values.add(parseToken(token, lineNumber));
        }
        return values;
    }

    static boolean parseToken(String token, int lineNumber) {
        switch (token) {
            case "0":
            case "F":
            case "f":
                return false;
            case "1":
            case "T":
            case "t":
                return true;
            default:
                logger.error("第 {} 行: 无法把 \"{}\" 解析为布尔值", lineNumber, token);
                throw new TokenParseException(token, lineNumber);
        }
    }
}
