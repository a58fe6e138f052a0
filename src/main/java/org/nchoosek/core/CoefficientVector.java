package org.nchoosek.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 每一列的重复次数 c1, c2, ..., cn。
 * 与一行真值表的内积 c1*b1 + c2*b2 + ... + cn*bn 称为该行的 tally。
 * 自然顺序即规范顺序：先按总和升序，总和相同时按字典序升序。
 * 此类是不可变的。
 */
public final class CoefficientVector implements Comparable<CoefficientVector> {

    private static final Logger logger = LoggerFactory.getLogger(CoefficientVector.class);

    private final int[] coefficients;

    private final int total;

    private final int hashCode;

    /**
     * 私有构造函数，调用方负责传入已拷贝的数组。
     * @param coefficients 每一列的重复次数，不能为负。
     */
    private CoefficientVector(int[] coefficients) {
        if (coefficients.length == 0) {
            throw new IllegalArgumentException("Coefficient vector cannot be empty");
        }
        int sum = 0;
        for (int c : coefficients) {
            if (c < 0) {
                logger.error("CoefficientVector-构造函数: 系数 {} 为负数", c);
                throw new IllegalArgumentException("Coefficients cannot be negative: " + Arrays.toString(coefficients));
            }
            sum = Math.addExact(sum, c);
        }
        this.coefficients = coefficients;
        this.total = sum;
        this.hashCode = Arrays.hashCode(coefficients);
        logger.debug("创建 CoefficientVector: {}，总和为{}", this, total);
    }

    /**
     * 工厂方法：创建 CoefficientVector 实例。
     * @param coefficients 每一列的重复次数。
     * @return CoefficientVector 实例。
     */
    public static CoefficientVector of(int... coefficients) {
        Objects.requireNonNull(coefficients, "Coefficients cannot be null");
        return new CoefficientVector(coefficients.clone());
    }

    /**
     * 工厂方法：从整数列表创建 CoefficientVector 实例。
     * @param coefficients 每一列的重复次数。
     * @return CoefficientVector 实例。
     */
    public static CoefficientVector of(List<Integer> coefficients) {
        Objects.requireNonNull(coefficients, "Coefficients cannot be null");
        return new CoefficientVector(coefficients.stream().mapToInt(Integer::intValue).toArray());
    }

    public int size() {
        return coefficients.length;
    }

    public int get(int column) {
        return coefficients[column];
    }

    /**
     * @return 所有系数之和，即约束中变量实例的总数。
     */
    public int total() {
        return total;
    }

    public int[] toArray() {
        return coefficients.clone();
    }

    public List<Integer> toList() {
        return Arrays.stream(coefficients).boxed().collect(Collectors.toList());
    }

    /**
     * 计算与一行真值表的内积。
     * @param row 宽度必须与系数个数相同。
     * @return 该行的 tally。
     */
    public int tally(BooleanRow row) {
        if (row.width() != coefficients.length) {
            logger.error("CoefficientVector.tally: 行 {} 的宽度与 {} 不一致", row, this);
            throw new IllegalArgumentException("Row width " + row.width()
                    + " does not match coefficient count " + coefficients.length);
        }
        int result = 0;
        for (int j = 0; j < coefficients.length; j++) {
            if (row.get(j)) {
                result += coefficients[j];
            }
        }
        return result;
    }

    /**
     * 计算一组行的所有不同 tally。
     * @param rows 真值表的行。
     * @return TallySet 实例。
     */
    public TallySet tallies(Collection<BooleanRow> rows) {
        TreeSet<Integer> values = new TreeSet<>();
        for (BooleanRow row : rows) {
            values.add(tally(row));
        }
        logger.debug("{} 在 {} 行上的 tally 为 {}", this, rows.size(), values);
        return TallySet.of(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CoefficientVector that = (CoefficientVector) o;
        return Arrays.equals(coefficients, that.coefficients);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 形如 [1,1,2]，与输出格式一致。
     */
    @Override
    public String toString() {
        return Arrays.stream(coefficients)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public int compareTo(CoefficientVector other) {
        // 1. 比较长度
        int cmp = Integer.compare(this.coefficients.length, other.coefficients.length);
        if (cmp != 0) {
            return cmp;
        }
        // 2. 比较总和
        cmp = Integer.compare(this.total, other.total);
        if (cmp != 0) {
            return cmp;
        }
        // 3. 逐项比较
        return Arrays.compare(this.coefficients, other.coefficients);
    }
}
