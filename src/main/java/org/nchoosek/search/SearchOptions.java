package org.nchoosek.search;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 并行搜索的参数。
 * <ul>
 *     <li>maxWorkers: 同时在途的块的最大数量，也是线程池的大小。</li>
 *     <li>chunkSize: 每个块包含的候选向量个数。</li>
 * </ul>
 * 此类是不可变的。
 */
@Getter
public final class SearchOptions {

    private static final Logger logger = LoggerFactory.getLogger(SearchOptions.class);

    public static final String MAX_WORKERS_PROPERTY = "nchoosek.maxWorkers";
    public static final String CHUNK_SIZE_PROPERTY = "nchoosek.chunkSize";

    // 每个核心超额分配，减少空闲时间
    public static final int WORKERS_PER_CORE = 10;
    public static final int DEFAULT_CHUNK_SIZE = 1000;

    private final int maxWorkers;
    private final int chunkSize;

    private SearchOptions(int maxWorkers, int chunkSize) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.maxWorkers = maxWorkers;
        this.chunkSize = chunkSize;
    }

    public static SearchOptions of(int maxWorkers, int chunkSize) {
        return new SearchOptions(maxWorkers, chunkSize);
    }

    /**
     * 默认值：可用处理器数的 {@value #WORKERS_PER_CORE} 倍，块大小 {@value #DEFAULT_CHUNK_SIZE}。
     */
    public static SearchOptions defaults() {
        int cores = Runtime.getRuntime().availableProcessors();
        return new SearchOptions(cores * WORKERS_PER_CORE, DEFAULT_CHUNK_SIZE);
    }

    /**
     * 在默认值之上应用 JVM 系统属性 {@value #MAX_WORKERS_PROPERTY} 和 {@value #CHUNK_SIZE_PROPERTY}。
     * @return SearchOptions 实例。
     * @throws IllegalArgumentException 如果属性值不是正整数。
     */
    public static SearchOptions fromSystemProperties() {
        SearchOptions defaults = defaults();
        int maxWorkers = intProperty(MAX_WORKERS_PROPERTY, defaults.maxWorkers);
        int chunkSize = intProperty(CHUNK_SIZE_PROPERTY, defaults.chunkSize);
        SearchOptions options = new SearchOptions(maxWorkers, chunkSize);
        logger.debug("从系统属性得到搜索参数: {}", options);
        return options;
    }

    public SearchOptions withMaxWorkers(int maxWorkers) {
        return new SearchOptions(maxWorkers, this.chunkSize);
    }

    public SearchOptions withChunkSize(int chunkSize) {
        return new SearchOptions(this.maxWorkers, chunkSize);
    }

    private static int intProperty(String name, int defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.error("系统属性 {} 的值 '{}' 不是整数", name, value);
            throw new IllegalArgumentException("Property " + name + " is not an integer: " + value, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SearchOptions that = (SearchOptions) o;
        return maxWorkers == that.maxWorkers && chunkSize == that.chunkSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxWorkers, chunkSize);
    }

    @Override
    public String toString() {
        return "SearchOptions{maxWorkers=" + maxWorkers + ", chunkSize=" + chunkSize + "}";
    }
}
