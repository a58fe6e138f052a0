package org.nchoosek.expressions;

import org.nchoosek.core.CoefficientVector;
import org.nchoosek.core.TallySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 把系数向量和 tally 集合格式化为文本。输出形如：
 * <pre>
 * Repetitions: [1,1,2] (4 total)
 * Tallies:     [0,1,4]
 * Example:     nck([A,B,C,C], [0,1,4])
 * </pre>
 */
public final class ConstraintFormatter {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintFormatter.class);

    public static final String REPETITIONS_LABEL = "Repetitions: ";
    public static final String TALLIES_LABEL = "Tallies:     ";
    public static final String EXAMPLE_LABEL = "Example:     ";

    private ConstraintFormatter() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return 形如 {@code nck([A,B,B,C,C,C], [0,1,5])} 的约束文本。
     */
    public static String format(CoefficientVector coeffs, TallySet tallies) {
        return NckConstraint.of(coeffs, tallies).toString();
    }

    public static String formatRepetitions(CoefficientVector coeffs) {
        Objects.requireNonNull(coeffs, "Coefficients cannot be null");
        return REPETITIONS_LABEL + coeffs + " (" + coeffs.total() + " total)";
    }

    public static String formatTallies(TallySet tallies) {
        Objects.requireNonNull(tallies, "Tallies cannot be null");
        return TALLIES_LABEL + tallies;
    }

    /**
     * 完整的三行报告。
     */
    public static List<String> report(CoefficientVector coeffs, TallySet tallies) {
        List<String> lines = List.of(
                formatRepetitions(coeffs),
                formatTallies(tallies),
                EXAMPLE_LABEL + format(coeffs, tallies));
        logger.debug("格式化结果: {}", lines);
        return lines;
    }
}
