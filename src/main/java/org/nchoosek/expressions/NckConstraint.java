package org.nchoosek.expressions;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.nchoosek.core.CoefficientVector;
import org.nchoosek.core.NckVariable;
import org.nchoosek.core.TallySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 代表一个 nck 约束 nck([V1, V2, ...], [k1, k2, ...])：
 * 变量列表 (允许重复) 中为真的个数必须属于允许的个数集合。
 * 此类是不可变的。
 */
@Getter
public final class NckConstraint {

    private static final Logger logger = LoggerFactory.getLogger(NckConstraint.class);

    private static final Pattern SYNTAX = Pattern.compile(
            "^\\s*nck\\(\\s*\\[([^\\]]*)\\]\\s*,\\s*\\[([^\\]]*)\\]\\s*\\)\\s*$");

    // 变量按出现顺序排列，可以重复
    private final List<NckVariable> variables;

    private final TallySet tallies;

    private final int hashCode;

    private NckConstraint(List<NckVariable> variables, TallySet tallies) {
        Objects.requireNonNull(variables, "Variables cannot be null");
        Objects.requireNonNull(tallies, "Tallies cannot be null");
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.tallies = tallies;
        this.hashCode = Objects.hash(this.variables, this.tallies);
        logger.debug("创建 NckConstraint: {}", this);
    }

    /**
     * 工厂方法：第 j 列的变量重复 coeffs[j] 次。
     * @param coeffs 每一列的重复次数。
     * @param tallies 允许的真值个数。
     * @return NckConstraint 实例。
     */
    public static NckConstraint of(CoefficientVector coeffs, TallySet tallies) {
        Objects.requireNonNull(coeffs, "Coefficients cannot be null");
        List<NckVariable> variables = new ArrayList<>(coeffs.total());
        for (int j = 0; j < coeffs.size(); j++) {
            NckVariable variable = NckVariable.ofColumn(j);
            for (int r = 0; r < coeffs.get(j); r++) {
                variables.add(variable);
            }
        }
        return new NckConstraint(variables, tallies);
    }

    public static NckConstraint of(List<NckVariable> variables, TallySet tallies) {
        return new NckConstraint(variables, tallies);
    }

    /**
     * 解析 {@link #toString()} 的输出，例如 {@code nck([A,B,C,C], [0,1,4])}。
     * @param text 约束文本。
     * @return NckConstraint 实例。
     * @throws IllegalArgumentException 如果文本格式不正确。
     */
    public static NckConstraint parse(String text) {
        Objects.requireNonNull(text, "Constraint text cannot be null");
        Matcher matcher = SYNTAX.matcher(text);
        if (!matcher.matches()) {
            logger.error("无法解析 nck 约束: {}", text);
            throw new IllegalArgumentException("Not an nck constraint: " + text);
        }
        List<NckVariable> variables = new ArrayList<>();
        for (String name : splitList(matcher.group(1))) {
            variables.add(NckVariable.ofName(name));
        }
        List<Integer> counts = new ArrayList<>();
        for (String count : splitList(matcher.group(2))) {
            try {
                counts.add(Integer.parseInt(count));
            } catch (NumberFormatException e) {
                logger.error("nck 约束 {} 中的个数 '{}' 不是整数", text, count);
                throw new IllegalArgumentException("Not a count: " + count, e);
            }
        }
        return new NckConstraint(variables, TallySet.of(counts));
    }

    /**
     * 每个变量出现的次数，按列号排列；向量长度为出现过的最大列号加一。
     */
    public CoefficientVector toCoefficients() {
        int width = variables.stream().mapToInt(NckVariable::getIndex).max().orElse(-1) + 1;
        return toCoefficients(width);
    }

    /**
     * 每个变量出现的次数，按列号排列。
     * @param width 列数，不小于出现过的最大列号加一。
     * @return CoefficientVector 实例。
     */
    public CoefficientVector toCoefficients(int width) {
        int[] counts = new int[width];
        for (NckVariable variable : variables) {
            if (variable.getIndex() >= width) {
                throw new IllegalArgumentException("Variable " + variable + " is outside " + width + " columns");
            }
            counts[variable.getIndex()]++;
        }
        return CoefficientVector.of(counts);
    }

    private static List<String> splitList(String body) {
        if (StringUtils.isBlank(body)) {
            return Collections.emptyList();
        }
        List<String> items = new ArrayList<>();
        for (String item : body.split(",", -1)) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("Empty list element in: [" + body + "]");
            }
            items.add(trimmed);
        }
        return items;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NckConstraint that = (NckConstraint) o;
        return variables.equals(that.variables) && tallies.equals(that.tallies);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "nck(" +
                variables.stream()
                        .map(NckVariable::getName)
                        .collect(Collectors.joining(",", "[", "]")) +
                ", " + tallies + ")";
    }
}
