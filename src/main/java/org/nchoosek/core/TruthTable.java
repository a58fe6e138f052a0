package org.nchoosek.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 一张真值表：宽度相同的互不相同的行。表中出现的行是合法行，
 * 其余 2^ncols 行中的行是非法行。
 * 此类是不可变的。
 */
@Getter
public final class TruthTable {

    private static final Logger logger = LoggerFactory.getLogger(TruthTable.class);

    // 保持输入顺序
    private final Set<BooleanRow> rows;

    private final int ncols;

    private final int hashCode;

    private TruthTable(Collection<BooleanRow> rows) {
        Objects.requireNonNull(rows, "Rows cannot be null");
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Truth table cannot be empty");
        }
        Set<BooleanRow> distinct = new LinkedHashSet<>();
        int width = -1;
        for (BooleanRow row : rows) {
            Objects.requireNonNull(row, "Row cannot be null");
            if (width < 0) {
                width = row.width();
            } else if (row.width() != width) {
                logger.error("TruthTable-构造函数: 行 {} 的宽度 {} 与第一行的宽度 {} 不一致", row, row.width(), width);
                throw new IllegalArgumentException("All rows must have width " + width + " but found " + row.width());
            }
            if (!distinct.add(row)) {
                logger.warn("真值表中出现重复的行: {}", row);
            }
        }
        if (width < 1) {
            throw new IllegalArgumentException("Truth table must have at least one column");
        }
        this.rows = Collections.unmodifiableSet(distinct);
        this.ncols = width;
        this.hashCode = Objects.hash(this.rows);
        logger.debug("创建 TruthTable: {} 列，{} 个不同的行", ncols, this.rows.size());
    }

    /**
     * 工厂方法：创建 TruthTable 实例，重复的行只保留一个。
     * @param rows 非空，且宽度一致。
     * @return TruthTable 实例。
     */
    public static TruthTable of(Collection<BooleanRow> rows) {
        return new TruthTable(rows);
    }

    public static TruthTable of(BooleanRow... rows) {
        return new TruthTable(List.of(rows));
    }

    /**
     * 检查某一行是否为合法行。
     */
    public boolean contains(BooleanRow row) {
        return rows.contains(row);
    }

    public int size() {
        return rows.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TruthTable that = (TruthTable) o;
        return ncols == that.ncols && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return rows.stream()
                .map(BooleanRow::toString)
                .collect(Collectors.joining(" / ", "TruthTable{", "}"));
    }
}
