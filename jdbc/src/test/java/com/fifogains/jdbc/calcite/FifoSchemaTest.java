package com.fifogains.jdbc.calcite;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.testing.TestResources;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.calcite.jdbc.CalciteSchema;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.Table;
import org.junit.jupiter.api.Test;

final class FifoSchemaTest {

    @Test
    void tablesAreBuiltOnceUnderConcurrentAccess() throws Exception {
        SchemaPlus root = CalciteSchema.createRootSchema(false).plus();
        FifoSchema schema =
                new FifoSchema(
                        root,
                        CalciteConnectionFactory.SCHEMA_NAME,
                        TestResources.fixture(TestResources.TRADES_CSV),
                        FifoOptions.fromProperties(TestResources.tradesOptions()));
        root.add(CalciteConnectionFactory.SCHEMA_NAME, schema);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Map<String, Table>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<Map<String, Table>> task =
                        () -> {
                            start.await();
                            return schema.getTableMap();
                        };
                futures.add(pool.submit(task));
            }
            start.countDown();
            Map<String, Table> first = futures.get(0).get(30, TimeUnit.SECONDS);
            for (Future<Map<String, Table>> future : futures) {
                assertSame(first, future.get(30, TimeUnit.SECONDS));
            }
            assertTrue(first.containsKey("realized_gains"));
        } finally {
            pool.shutdownNow();
        }
    }
}
