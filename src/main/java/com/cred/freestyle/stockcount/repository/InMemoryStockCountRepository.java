package com.cred.freestyle.stockcount.repository;

import com.cred.freestyle.stockcount.domain.model.StockCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * {@link StockCountRepository} backed by an insertion-ordered map.
 *
 * Concurrency:
 * - One read/write lock guards the map and the id counter
 * - create (assign id + insert) and updateFirst (find + mutate) run under the write lock
 * - Reads copy matching counts under the read lock
 *
 * Identifier assignment:
 * - Counter starts at the highest seeded id (0 when nothing is seeded)
 * - Each create takes counter + 1, so ids stay unique even on an empty store
 *
 * @author Stock Count Team
 */
public class InMemoryStockCountRepository implements StockCountRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStockCountRepository.class);

    private final Map<Integer, StockCount> stockCounts = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private int lastAssignedId;

    public InMemoryStockCountRepository(List<StockCount> seed) {
        for (StockCount stockCount : seed) {
            if (stockCounts.putIfAbsent(stockCount.getStockCountId(), stockCount) != null) {
                throw new IllegalArgumentException("Duplicate stock count id in seed: " + stockCount.getStockCountId());
            }
            lastAssignedId = Math.max(lastAssignedId, stockCount.getStockCountId());
        }
        logger.info("Initialised stock count repository with {} in-progress counts", stockCounts.size());
    }

    @Override
    public Optional<StockCount> findById(Integer stockCountId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(stockCounts.get(stockCountId)).map(StockCount::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StockCount> findAll(Predicate<StockCount> filter) {
        lock.readLock().lock();
        try {
            return stockCounts.values().stream()
                    .filter(filter)
                    .map(StockCount::snapshot)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public StockCount create(IntFunction<StockCount> factory) {
        lock.writeLock().lock();
        try {
            int stockCountId = lastAssignedId + 1;
            StockCount stockCount = factory.apply(stockCountId);
            if (stockCount.getStockCountId() == null || stockCount.getStockCountId() != stockCountId) {
                throw new IllegalStateException("Stock count must use assigned id " + stockCountId);
            }
            stockCounts.put(stockCountId, stockCount);
            lastAssignedId = stockCountId;
            logger.debug("Stored stock count: {}", stockCountId);
            return stockCount.snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<StockCount> updateFirst(Predicate<StockCount> filter, Consumer<StockCount> update) {
        lock.writeLock().lock();
        try {
            Optional<StockCount> match = stockCounts.values().stream()
                    .filter(filter)
                    .findFirst();
            match.ifPresent(update);
            return match.map(StockCount::snapshot);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return stockCounts.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
