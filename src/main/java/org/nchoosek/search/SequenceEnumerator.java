package org.nchoosek.search;

import org.apache.commons.lang3.tuple.Pair;
import org.nchoosek.core.BooleanRow;
import org.nchoosek.core.TruthTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * 枚举宽度为 n 的全部 2^n 个布尔行。
 * 第 i 个元素的第 j 列是 i 的第 j 位，所以第一列变化最快：
 * 000, 100, 010, 110, 001, ...
 */
public final class SequenceEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(SequenceEnumerator.class);

    // long 的位数限制
    public static final int MAX_WIDTH = 62;

    private SequenceEnumerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 惰性生成宽度为 n 的全部布尔行，每次调用顺序相同。
     * @param n 列数，1 <= n <= {@link #MAX_WIDTH}。
     * @return 含 2^n 个元素的顺序流。
     */
    public static Stream<BooleanRow> allBooleanVectors(int n) {
        checkWidth(n);
        return LongStream.range(0, 1L << n).mapToObj(mask -> BooleanRow.ofBits(mask, n));
    }

    /**
     * 按谓词把全部 2^ncols 行划分为合法行和非法行。
     * @param ncols 列数。
     * @param isValid 合法行判定。
     * @return (合法行, 非法行)，各自保持枚举顺序。
     */
    public static Pair<List<BooleanRow>, List<BooleanRow>> partition(int ncols, Predicate<BooleanRow> isValid) {
        Objects.requireNonNull(isValid, "Predicate cannot be null");
        Map<Boolean, List<BooleanRow>> parts = allBooleanVectors(ncols)
                .collect(Collectors.partitioningBy(isValid));
        List<BooleanRow> valid = parts.get(true);
        List<BooleanRow> invalid = parts.get(false);
        logger.debug("{} 列的全部行中有 {} 个合法行，{} 个非法行", ncols, valid.size(), invalid.size());
        return Pair.of(valid, invalid);
    }

    /**
     * 表中出现的行为合法行，其补集为非法行。
     */
    public static Pair<List<BooleanRow>, List<BooleanRow>> partition(TruthTable table) {
        Objects.requireNonNull(table, "Truth table cannot be null");
        return partition(table.getNcols(), table::contains);
    }

    static void checkWidth(int n) {
        if (n <= 0) {
            logger.error("SequenceEnumerator: 非正的列数 {}", n);
            throw new IllegalArgumentException("Non-positive number of columns: " + n);
        }
        if (n > MAX_WIDTH) {
            logger.error("SequenceEnumerator: 列数 {} 超过上限 {}", n, MAX_WIDTH);
            throw new IllegalArgumentException("Too many columns to enumerate: " + n);
        }
    }
}
