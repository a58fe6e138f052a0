package org.nchoosek.search;

import lombok.Getter;
import org.nchoosek.core.BooleanRow;
import org.nchoosek.core.CoefficientVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.Collection;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 判断一个系数向量能否区分合法行与非法行：
 * 合法行的 tally 集合与非法行的 tally 集合不相交。
 * <p>
 * 实例在构造时把两组行预处理为"为真的列号"数组，之后只读，可以被多个线程共享。
 */
public final class DisjointnessTester implements Predicate<int[]> {

    private static final Logger logger = LoggerFactory.getLogger(DisjointnessTester.class);

    @Getter
    private final int width;

    // 每一行中为真的列号
    private final int[][] validColumns;
    private final int[][] invalidColumns;

    private DisjointnessTester(int width, Collection<BooleanRow> validRows, Collection<BooleanRow> invalidRows) {
        Objects.requireNonNull(validRows, "Valid rows cannot be null");
        Objects.requireNonNull(invalidRows, "Invalid rows cannot be null");
        this.width = width;
        this.validColumns = trueColumns(width, validRows);
        this.invalidColumns = trueColumns(width, invalidRows);
        logger.debug("创建 DisjointnessTester: 宽度 {}，{} 个合法行，{} 个非法行",
                width, validColumns.length, invalidColumns.length);
    }

    /**
     * 工厂方法：创建 DisjointnessTester 实例。
     * @param width 列数。
     * @param validRows 合法行。
     * @param invalidRows 非法行。
     * @return DisjointnessTester 实例。
     */
    public static DisjointnessTester of(int width, Collection<BooleanRow> validRows, Collection<BooleanRow> invalidRows) {
        return new DisjointnessTester(width, validRows, invalidRows);
    }

    /**
     * 一次性判断：直接计算两组 tally 集合并检查是否相交。
     * 比 {@link #test(int[])} 慢，但不依赖预处理。
     * @param coeffs 系数向量。
     * @param validRows 合法行。
     * @param invalidRows 非法行。
     * @return true 如果两组 tally 不相交。
     */
    public static boolean isSeparating(CoefficientVector coeffs, Collection<BooleanRow> validRows,
                                       Collection<BooleanRow> invalidRows) {
        Objects.requireNonNull(coeffs, "Coefficients cannot be null");
        return coeffs.tallies(validRows).isDisjoint(coeffs.tallies(invalidRows));
    }

    public boolean isSeparating(CoefficientVector coeffs) {
        return test(coeffs.toArray());
    }

    /**
     * @param coeffs 长度必须等于 {@link #getWidth()}，元素非负。
     * @return true 如果两组 tally 不相交。
     */
    @Override
    public boolean test(int[] coeffs) {
        if (coeffs.length != width) {
            throw new IllegalArgumentException("Expected " + width + " coefficients but got " + coeffs.length);
        }
        if (validColumns.length == 0 || invalidColumns.length == 0) {
            return true;
        }
        BitSet validTallies = new BitSet();
        for (int[] columns : validColumns) {
            validTallies.set(tally(coeffs, columns));
        }
        for (int[] columns : invalidColumns) {
            if (validTallies.get(tally(coeffs, columns))) {
                return false;
            }
        }
        return true;
    }

    private static int tally(int[] coeffs, int[] columns) {
        int sum = 0;
        for (int column : columns) {
            sum += coeffs[column];
        }
        return sum;
    }

    private static int[][] trueColumns(int width, Collection<BooleanRow> rows) {
        int[][] result = new int[rows.size()][];
        int r = 0;
        for (BooleanRow row : rows) {
            Objects.requireNonNull(row, "Row cannot be null");
            if (row.width() != width) {
                logger.error("DisjointnessTester: 行 {} 的宽度不是 {}", row, width);
                throw new IllegalArgumentException("Row width " + row.width() + " does not match " + width);
            }
            int[] columns = new int[row.countTrue()];
            int k = 0;
            for (int j = 0; j < width; j++) {
                if (row.get(j)) {
                    columns[k++] = j;
                }
            }
            result[r++] = columns;
        }
        return result;
    }
}
