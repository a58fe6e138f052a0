package org.nchoosek.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * nck 约束中的一个变量，对应真值表的一列。
 * 默认命名规则是双射 26 进制：0 -> A, 25 -> Z, 26 -> AA, 27 -> AB, 52 -> BA, 702 -> AAA。
 */
@Getter
public final class NckVariable implements Comparable<NckVariable> {

    private static final Logger logger = LoggerFactory.getLogger(NckVariable.class);

    private static final int RADIX = 26;

    private final int index;
    private final String name;
    private final int hashCode;

    private NckVariable(int index, String name) {
        this.index = index;
        this.name = name;
        this.hashCode = Objects.hash(index);
        logger.debug("创建了一个NckVariable: {} with index {}", name, index);
    }

    /**
     * 第 index 列对应的变量。
     * @param index 列号，从 0 开始。
     * @return NckVariable 实例。
     */
    public static NckVariable ofColumn(int index) {
        return new NckVariable(index, nameOf(index));
    }

    /**
     * 根据变量名创建变量。
     * @param name 只能由大写字母 A-Z 组成。
     * @return NckVariable 实例。
     */
    public static NckVariable ofName(String name) {
        return new NckVariable(indexOf(name), name);
    }

    /**
     * 列号转换为变量名 (没有零的 26 进制)。
     * @param index 非负列号。
     * @return 变量名。
     */
    public static String nameOf(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index cannot be negative: " + index);
        }
        StringBuilder sb = new StringBuilder();
        long n = (long) index + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + (n % RADIX)));
            n /= RADIX;
        }
        return sb.reverse().toString();
    }

    /**
     * {@link #nameOf(int)} 的逆运算。
     * @param name 变量名。
     * @return 列号。
     */
    public static int indexOf(String name) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        long n = 0;
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (ch < 'A' || ch > 'Z') {
                logger.error("NckVariable.indexOf: 变量名 '{}' 包含非法字符 '{}'", name, ch);
                throw new IllegalArgumentException("Not a column variable name: " + name);
            }
            n = n * RADIX + (ch - 'A' + 1);
            if (n - 1 > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Column variable name too long: " + name);
            }
        }
        return (int) (n - 1);
    }

    @Override
    public int compareTo(NckVariable o) {
        return Integer.compare(this.index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NckVariable that = (NckVariable) o;
        return index == that.index;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
