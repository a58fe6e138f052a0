package org.nchoosek.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 合法行在某个 CoefficientVector 下的 tally 集合，即 nck 约束允许的真值个数。
 * 内部有序存储，输出顺序稳定。
 * 此类是不可变的。
 */
@Getter
public final class TallySet implements Iterable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(TallySet.class);

    private final SortedSet<Integer> values;

    private final int hashCode;

    private TallySet(Collection<Integer> values) {
        Objects.requireNonNull(values, "Tally values cannot be null");
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer value : values) {
            Objects.requireNonNull(value, "Tally value cannot be null");
            if (value < 0) {
                logger.error("TallySet-构造函数: tally {} 为负数", value);
                throw new IllegalArgumentException("Tally values cannot be negative: " + value);
            }
            sorted.add(value);
        }
        this.values = Collections.unmodifiableSortedSet(sorted);
        this.hashCode = Objects.hash(this.values);
        logger.debug("创建 TallySet: {}", this);
    }

    /**
     * 工厂方法：从整数集合创建 TallySet 实例，重复值只保留一个。
     * @param values 非负整数集合。
     * @return TallySet 实例。
     */
    public static TallySet of(Collection<Integer> values) {
        return new TallySet(values);
    }

    public static TallySet of(Integer... values) {
        return new TallySet(List.of(values));
    }

    public boolean contains(int tally) {
        return values.contains(tally);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 检查两个集合是否没有公共元素。
     * @param other 另一个 TallySet。
     * @return true 如果不相交。
     */
    public boolean isDisjoint(TallySet other) {
        return Collections.disjoint(this.values, other.values);
    }

    @Override
    public Iterator<Integer> iterator() {
        return values.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TallySet that = (TallySet) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 形如 [0,1,4]。
     */
    @Override
    public String toString() {
        return values.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",", "[", "]"));
    }
}
