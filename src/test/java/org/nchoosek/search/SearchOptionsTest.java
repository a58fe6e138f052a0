package org.nchoosek.search;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchOptionsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SearchOptions.MAX_WORKERS_PROPERTY);
        System.clearProperty(SearchOptions.CHUNK_SIZE_PROPERTY);
    }

    @Test
    @DisplayName("默认值与处理器数成比例")
    void testDefaults() {
        SearchOptions options = SearchOptions.defaults();
        int cores = Runtime.getRuntime().availableProcessors();

        assertEquals(cores * SearchOptions.WORKERS_PER_CORE, options.getMaxWorkers());
        assertEquals(SearchOptions.DEFAULT_CHUNK_SIZE, options.getChunkSize());
    }

    @Test
    @DisplayName("系统属性覆盖默认值")
    void testSystemProperties() {
        System.setProperty(SearchOptions.MAX_WORKERS_PROPERTY, "3");
        System.setProperty(SearchOptions.CHUNK_SIZE_PROPERTY, " 17 ");

        assertEquals(SearchOptions.of(3, 17), SearchOptions.fromSystemProperties());
    }

    @Test
    @DisplayName("非法的属性值应抛出异常")
    void testInvalidProperties() {
        System.setProperty(SearchOptions.MAX_WORKERS_PROPERTY, "many");
        assertThrows(IllegalArgumentException.class, SearchOptions::fromSystemProperties);

        System.setProperty(SearchOptions.MAX_WORKERS_PROPERTY, "0");
        assertThrows(IllegalArgumentException.class, SearchOptions::fromSystemProperties);
    }

    @Test
    @DisplayName("with 方法返回修改后的副本")
    void testWithers() {
        SearchOptions options = SearchOptions.of(2, 10);

        assertEquals(SearchOptions.of(5, 10), options.withMaxWorkers(5));
        assertEquals(SearchOptions.of(2, 1), options.withChunkSize(1));
        assertEquals(SearchOptions.of(2, 10), options);
        assertThrows(IllegalArgumentException.class, () -> options.withChunkSize(0));
    }
}
