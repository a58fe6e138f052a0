package org.nchoosek.search;

import lombok.Getter;
import org.nchoosek.core.CoefficientVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 惰性枚举长度为 n 的非负整数向量，永不结束。
 * <p>
 * 规范顺序：总和 s = 1, 2, 3, ... 依次递增；同一总和内按字典序升序，
 * 即第一个坐标从 0 到 s 变化最慢，其余坐标递归地按同样的规则排列。
 * 例如 n = 3 时：[0,0,1], [0,1,0], [1,0,0], [0,0,2], [0,1,1], [0,2,0], [1,0,1], ...
 * <p>
 * 生成器只保存当前向量，不依赖递归，可以分块取出。不是线程安全的。
 */
public final class CompositionGenerator implements Iterator<int[]> {

    private static final Logger logger = LoggerFactory.getLogger(CompositionGenerator.class);

    @Getter
    private final int width;

    private final int[] current;

    @Getter
    private int sum;

    // 下一个要返回的元素在规范顺序中的位置，从 0 开始
    @Getter
    private long index;

    private CompositionGenerator(int width) {
        if (width <= 0) {
            logger.error("CompositionGenerator: 非正的宽度 {}", width);
            throw new IllegalArgumentException("Non-positive tally of numbers: " + width);
        }
        this.width = width;
        this.current = new int[width];
        this.sum = 1;
        this.current[width - 1] = 1;
        this.index = 0;
        logger.debug("创建 CompositionGenerator，宽度为 {}", width);
    }

    /**
     * 从头开始枚举长度为 n 的向量。
     * @param n 向量长度，必须为正。
     * @return 新的生成器。
     */
    public static CompositionGenerator compositions(int n) {
        return new CompositionGenerator(n);
    }

    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public int[] next() {
        int[] result = current.clone();
        advance();
        return result;
    }

    /**
     * 取出接下来的 size 个向量。
     * @param size 块大小，必须为正。
     * @return 按规范顺序排列的 size 个向量。
     */
    public List<int[]> nextChunk(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + size);
        }
        List<int[]> chunk = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            chunk.add(next());
        }
        return chunk;
    }

    /**
     * 剩余序列的无限顺序流，与本生成器共享状态。
     */
    public Stream<CoefficientVector> stream() {
        Iterator<CoefficientVector> it = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public CoefficientVector next() {
                return CoefficientVector.of(CompositionGenerator.this.next());
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * 移到规范顺序中的下一个向量：
     * 找到最右边的位置 i (i < n-1)，使其右侧仍有非零元素；
     * 令 current[i] 加一，其右侧剩余的总和减一后全部放到最后一个坐标。
     * 找不到这样的位置时，当前总和已枚举完，进入 s + 1。
     */
    private void advance() {
        index++;
        int tail = current[width - 1];
        for (int i = width - 2; i >= 0; i--) {
            if (tail > 0) {
                current[i]++;
                Arrays.fill(current, i + 1, width - 1, 0);
                current[width - 1] = tail - 1;
                return;
            }
            tail += current[i];
        }
        sum = Math.addExact(sum, 1);
        Arrays.fill(current, 0);
        current[width - 1] = sum;
        logger.debug("宽度 {} 的枚举进入总和 {}，已生成 {} 个向量", width, sum, index);
    }
}
