package org.nchoosek.search;

import org.apache.commons.lang3.tuple.Pair;
import org.nchoosek.core.BooleanRow;
import org.nchoosek.core.TruthTable;
import org.nchoosek.parser.TruthTableParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SequenceEnumeratorTest {

    @Test
    @DisplayName("宽度为 3 时第一列变化最快")
    void testOrder() {
        List<String> rows = SequenceEnumerator.allBooleanVectors(3)
                .map(BooleanRow::toString)
                .collect(Collectors.toList());

        assertEquals(List.of("0 0 0", "1 0 0", "0 1 0", "1 1 0", "0 0 1", "1 0 1", "0 1 1", "1 1 1"), rows);
    }

    @Test
    @DisplayName("2^n 个互不相同的行，且顺序稳定")
    void testCountAndDeterminism() {
        List<BooleanRow> first = SequenceEnumerator.allBooleanVectors(10).collect(Collectors.toList());
        List<BooleanRow> second = SequenceEnumerator.allBooleanVectors(10).collect(Collectors.toList());

        assertAll("Full domain of width 10",
                () -> assertEquals(1024, first.size()),
                () -> assertEquals(1024, new HashSet<>(first).size()),
                () -> assertEquals(first, second)
        );
    }

    @Test
    @DisplayName("按真值表划分：补集为非法行")
    void testPartitionByTable() {
        TruthTable and = TruthTableParser.parse(List.of("0 0 0", "0 1 0", "1 0 0", "1 1 1"));
        Pair<List<BooleanRow>, List<BooleanRow>> partition = SequenceEnumerator.partition(and);

        assertAll("AND partition",
                () -> assertEquals(4, partition.getLeft().size()),
                () -> assertEquals(4, partition.getRight().size()),
                () -> assertTrue(partition.getLeft().containsAll(and.getRows())),
                () -> assertTrue(partition.getRight().contains(BooleanRow.of(true, true, false))),
                () -> assertTrue(partition.getRight().contains(BooleanRow.of(false, false, true)))
        );
    }

    @Test
    @DisplayName("全部行合法时非法行为空")
    void testPartitionAllValid() {
        Pair<List<BooleanRow>, List<BooleanRow>> partition = SequenceEnumerator.partition(2, row -> true);
        assertEquals(4, partition.getLeft().size());
        assertTrue(partition.getRight().isEmpty());
    }

    @Test
    @DisplayName("非正或过大的宽度应抛出异常")
    void testInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> SequenceEnumerator.allBooleanVectors(0));
        assertThrows(IllegalArgumentException.class,
                () -> SequenceEnumerator.allBooleanVectors(SequenceEnumerator.MAX_WIDTH + 1));
    }
}
