package org.nchoosek.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 真值表中的一行：长度固定的 0/1 序列。
 * 此类是不可变的。
 */
public final class BooleanRow implements Comparable<BooleanRow> {

    private static final Logger logger = LoggerFactory.getLogger(BooleanRow.class);

    private final boolean[] values;

    private final int hashCode;

    /**
     * 私有构造函数，调用方负责传入已拷贝的数组。
     * @param values 每一列的取值。
     */
    private BooleanRow(boolean[] values) {
        this.values = values;
        this.hashCode = Arrays.hashCode(values);
        logger.debug("创建 BooleanRow: {}", this);
    }

    /**
     * 工厂方法：从 boolean 数组创建 BooleanRow 实例。
     * @param values 每一列的取值。
     * @return BooleanRow 实例。
     */
    public static BooleanRow of(boolean... values) {
        Objects.requireNonNull(values, "Row values cannot be null");
        return new BooleanRow(values.clone());
    }

    /**
     * 工厂方法：从 0/1 整数创建 BooleanRow 实例 (例如 of(List.of(1, 0, 1)))。
     * @param bits 只能包含 0 或 1。
     * @return BooleanRow 实例。
     */
    public static BooleanRow of(List<Integer> bits) {
        Objects.requireNonNull(bits, "Row bits cannot be null");
        boolean[] values = new boolean[bits.size()];
        for (int i = 0; i < values.length; i++) {
            int bit = Objects.requireNonNull(bits.get(i), "Row bit cannot be null");
            if (bit != 0 && bit != 1) {
                logger.error("BooleanRow.of: 第 {} 列的值 {} 不是 0 或 1", i, bit);
                throw new IllegalArgumentException("Row bit must be 0 or 1 but was " + bit);
            }
            values[i] = bit == 1;
        }
        return new BooleanRow(values);
    }

    /**
     * 工厂方法：取 mask 的低 width 位，第 j 列对应第 j 位。
     * @param mask 位模式。
     * @param width 列数。
     * @return BooleanRow 实例。
     */
    public static BooleanRow ofBits(long mask, int width) {
        boolean[] values = new boolean[width];
        for (int j = 0; j < width; j++) {
            values[j] = ((mask >>> j) & 1L) == 1L;
        }
        return new BooleanRow(values);
    }

    public int width() {
        return values.length;
    }

    public boolean get(int column) {
        return values[column];
    }

    /**
     * @return 第 column 列的 0/1 整数值。
     */
    public int bit(int column) {
        return values[column] ? 1 : 0;
    }

    /**
     * 为真的列数。
     */
    public int countTrue() {
        int count = 0;
        for (boolean value : values) {
            if (value) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BooleanRow that = (BooleanRow) o;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(values.length * 2);
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(values[i] ? '1' : '0');
        }
        return sb.toString();
    }

    @Override
    public int compareTo(BooleanRow other) {
        // 先比较宽度，再逐列比较 (false < true)
        int cmp = Integer.compare(this.values.length, other.values.length);
        if (cmp != 0) {
            return cmp;
        }
        return Arrays.compare(this.values, other.values);
    }
}
