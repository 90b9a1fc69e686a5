package com.relengine.query.processor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.relengine.query.domain.Row;
import com.relengine.query.domain.Table;
import com.relengine.query.exception.QueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Throwables.throwIfUnchecked;

/**
 * Equi-join that indexes the right table once and probes it from several threads.
 *
 * <p>The left table is cut into {@code numThreads} contiguous chunks of
 * {@code ceil(|left| / numThreads)} rows; trailing chunks may be short or empty.
 * Each worker appends to its own buffer, and the buffers are concatenated in
 * chunk order once every worker has finished. The output order is therefore
 * fixed: left order, then right order within a left row, whatever the thread
 * scheduling. Left rows lacking the join column or without a match are dropped.
 */
public class ParallelHashJoiner {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelHashJoiner.class);

    private static final String THREAD_NAME_FORMAT = "hash-join-probe-%d";

    private ParallelHashJoiner() {
    }

    public static Table innerJoin(Table left, Table right, String leftColumn, String rightColumn, int numThreads) {
        checkArgument(numThreads > 0, "numThreads must be positive: %s", numThreads);

        HashJoinIndex index = HashJoinIndex.build(right, rightColumn);
        int chunkSize = (left.size() + numThreads - 1) / numThreads;
        LOG.debug("[HashJoin] {}={}: built index with {} keys over {} rows, probing {} rows in {} chunks of {}",
                leftColumn, rightColumn, index.keyCount(), right.size(), left.size(), numThreads, chunkSize);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads,
                new ThreadFactoryBuilder().setNameFormat(THREAD_NAME_FORMAT).setDaemon(true).build());
        try {
            List<Future<List<Row>>> futures = new ArrayList<>(numThreads);
            for (int chunk = 0; chunk < numThreads; chunk++) {
                int start = (int) Math.min((long) chunk * chunkSize, left.size());
                int end = (int) Math.min((long) start + chunkSize, left.size());
                futures.add(executor.submit(() -> probe(left, start, end, leftColumn, index)));
            }

            List<List<Row>> buffers = new ArrayList<>(numThreads);
            int total = 0;
            for (Future<List<Row>> future : futures) {
                List<Row> buffer = future.get();
                buffers.add(buffer);
                total += buffer.size();
            }

            // all workers are done at this point
            List<Row> merged = new ArrayList<>(total);
            for (List<Row> buffer : buffers) {
                merged.addAll(buffer);
            }
            LOG.debug("[HashJoin] {}={}: produced {} rows", leftColumn, rightColumn, merged.size());
            return Table.of(merged);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryException("Interrupted while waiting for hash join workers", e);
        } catch (ExecutionException e) {
            throwIfUnchecked(e.getCause());
            throw new QueryException("Hash join worker failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<Row> probe(Table left, int start, int end, String leftColumn, HashJoinIndex index) {
        List<Row> buffer = new ArrayList<>();
        for (int i = start; i < end; i++) {
            Row leftRow = left.getRow(i);
            String key = leftRow.getFieldValue(leftColumn);
            if (key == null) {
                continue;
            }
            for (int rightIndex : index.lookup(key)) {
                buffer.add(leftRow.mergeFields(index.row(rightIndex)));
            }
        }
        return buffer;
    }
}
