package org.nchoosek.search;

import lombok.Getter;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.commons.lang3.tuple.Pair;
import org.nchoosek.core.BooleanRow;
import org.nchoosek.core.CoefficientVector;
import org.nchoosek.core.TruthTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Predicate;

/**
 * 按规范顺序 (见 {@link CompositionGenerator}) 查找能区分合法行与非法行的系数向量。
 * <p>
 * 生成器在调用线程上按块取出候选向量，每块交给线程池求值，最多同时有
 * {@link SearchOptions#getMaxWorkers()} 个块在途。结果按提交顺序从队首取出，
 * 所以输出顺序与生成顺序一致，与线程的完成顺序无关；第一个输出一定是规范顺序中
 * 最小的可区分向量。
 * <p>
 * 可区分向量一定存在：各项为互不相同的 2 的幂的向量使内积在所有行上互不相同，
 * 而规范顺序在有限步内会到达这样的向量，所以搜索总会结束。
 */
public final class CoefficientSearch implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CoefficientSearch.class);

    @Getter
    private final SearchOptions options;

    private final ExecutorService pool;

    public CoefficientSearch(SearchOptions options) {
        this.options = Objects.requireNonNull(options, "Search options cannot be null");
        this.pool = Executors.newFixedThreadPool(options.getMaxWorkers(),
                new BasicThreadFactory.Builder()
                        .namingPattern("nck-search-%d")
                        .daemon(true)
                        .build());
        logger.debug("创建 CoefficientSearch: {}", options);
    }

    public CoefficientSearch() {
        this(SearchOptions.fromSystemProperties());
    }

    /**
     * 规范顺序中第一个可区分 valid 与 invalid 的向量。
     * @param ncols 列数，必须为正。
     * @param validRows 合法行。
     * @param invalidRows 非法行。
     * @return 总和最小、同总和下字典序最小的可区分向量。
     */
    public CoefficientVector findFirstSeparating(int ncols, Collection<BooleanRow> validRows,
                                                 Collection<BooleanRow> invalidRows) {
        try (SeparatingVectors vectors = separating(ncols, validRows, invalidRows)) {
            CoefficientVector first = vectors.next();
            logger.info("找到第一个可区分向量 {}，共检查了约 {} 个候选", first, vectors.getExamined());
            return first;
        }
    }

    /**
     * 表中的行为合法行，其补集为非法行。
     */
    public CoefficientVector findFirstSeparating(TruthTable table) {
        Objects.requireNonNull(table, "Truth table cannot be null");
        Pair<List<BooleanRow>, List<BooleanRow>> partition = SequenceEnumerator.partition(table);
        return findFirstSeparating(table.getNcols(), partition.getLeft(), partition.getRight());
    }

    /**
     * 规范顺序中前 count 个可区分向量。
     * @param table 真值表。
     * @param count 需要的个数，不能为负。
     * @return 按规范顺序排列的向量。
     */
    public List<CoefficientVector> findSeparating(TruthTable table, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative: " + count);
        }
        List<CoefficientVector> result = new ArrayList<>(count);
        try (SeparatingVectors vectors = separating(table)) {
            while (result.size() < count) {
                result.add(vectors.next());
            }
        }
        return result;
    }

    /**
     * 全部可区分向量组成的无限有序序列。用完后必须关闭，以取消未完成的块。
     */
    public SeparatingVectors separating(int ncols, Collection<BooleanRow> validRows,
                                        Collection<BooleanRow> invalidRows) {
        DisjointnessTester tester = DisjointnessTester.of(ncols, validRows, invalidRows);
        return new SeparatingVectors(CompositionGenerator.compositions(ncols), tester);
    }

    /**
     * 合法行由谓词给出，非法行是全部 2^ncols 行中的其余部分。
     */
    public SeparatingVectors separating(int ncols, Predicate<BooleanRow> isValid) {
        Pair<List<BooleanRow>, List<BooleanRow>> partition = SequenceEnumerator.partition(ncols, isValid);
        return separating(ncols, partition.getLeft(), partition.getRight());
    }

    public SeparatingVectors separating(TruthTable table) {
        Objects.requireNonNull(table, "Truth table cannot be null");
        return separating(table.getNcols(), table::contains);
    }

    @Override
    public void close() {
        pool.shutdownNow();
        logger.debug("CoefficientSearch 线程池已关闭");
    }

    /**
     * 可区分向量的迭代器。{@link #hasNext()} 在关闭前总是返回 true。
     * 不是线程安全的。
     */
    public final class SeparatingVectors implements Iterator<CoefficientVector>, AutoCloseable {

        private final CompositionGenerator generator;
        private final DisjointnessTester tester;

        // 在途的块，按块号排列
        private final Deque<Future<List<int[]>>> inFlight = new ArrayDeque<>();
        // 已取出的块中尚未返回的可区分向量
        private final Deque<int[]> ready = new ArrayDeque<>();

        private long chunksConsumed;

        private boolean closed;

        private SeparatingVectors(CompositionGenerator generator, DisjointnessTester tester) {
            this.generator = generator;
            this.tester = tester;
            logger.info("开始搜索 {} 列的系数向量: {}", generator.getWidth(), options);
        }

        /**
         * 已经被取出结果的候选向量个数。
         */
        public long getExamined() {
            return chunksConsumed * options.getChunkSize();
        }

        /**
         * 尚未取出结果的块与尚未返回的向量个数之和；关闭后为 0。
         */
        int pending() {
            return inFlight.size() + ready.size();
        }

        @Override
        public boolean hasNext() {
            return !closed;
        }

        @Override
        public CoefficientVector next() {
            if (closed) {
                throw new NoSuchElementException("Search has been closed");
            }
            while (ready.isEmpty()) {
                fill();
                ready.addAll(await(inFlight.removeFirst()));
                chunksConsumed++;
            }
            return CoefficientVector.of(ready.removeFirst());
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            int cancelled = 0;
            for (Future<List<int[]>> future : inFlight) {
                if (future.cancel(true)) {
                    cancelled++;
                }
            }
            inFlight.clear();
            ready.clear();
            logger.debug("搜索结束，取消了 {} 个在途的块", cancelled);
        }

        private void fill() {
            while (inFlight.size() < options.getMaxWorkers()) {
                List<int[]> chunk = generator.nextChunk(options.getChunkSize());
                inFlight.addLast(pool.submit(evaluate(chunk)));
            }
        }

        private Callable<List<int[]>> evaluate(List<int[]> chunk) {
            return () -> {
                List<int[]> accepted = new ArrayList<>();
                for (int[] coeffs : chunk) {
                    if (Thread.currentThread().isInterrupted()) {
                        // 已被取消，结果不会被读取
                        return accepted;
                    }
                    if (tester.test(coeffs)) {
                        accepted.add(coeffs);
                    }
                }
                return accepted;
            };
        }

        private List<int[]> await(Future<List<int[]>> future) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new IllegalStateException("Interrupted while searching for coefficients", e);
            } catch (CancellationException e) {
                close();
                throw new IllegalStateException("Coefficient search was cancelled", e);
            } catch (ExecutionException e) {
                close();
                logger.error("求值块时出错", e.getCause());
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw new IllegalStateException("Failed to evaluate candidate coefficients", e.getCause());
            }
        }
    }
}
