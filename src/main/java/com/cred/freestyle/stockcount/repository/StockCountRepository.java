package com.cred.freestyle.stockcount.repository;

import com.cred.freestyle.stockcount.domain.model.StockCount;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Repository for in-progress stock counts.
 *
 * Implementations keep counts in insertion order and make every method atomic
 * with respect to the others. Returned counts are snapshots: changing the
 * repository afterwards does not change them.
 *
 * @author Stock Count Team
 */
public interface StockCountRepository {

    /**
     * Find stock count by ID.
     *
     * @param stockCountId Stock count ID
     * @return Optional containing a snapshot of the count if found
     */
    Optional<StockCount> findById(Integer stockCountId);

    /**
     * Find all counts matching a filter, in insertion order.
     *
     * @param filter Filter to apply
     * @return Snapshots of matching counts, empty when nothing matches
     */
    List<StockCount> findAll(Predicate<StockCount> filter);

    /**
     * Assign the next identifier and store the count built for it.
     * Identifiers are never reused.
     *
     * @param factory Builds the count for the assigned identifier
     * @return Snapshot of the stored count
     */
    StockCount create(IntFunction<StockCount> factory);

    /**
     * Apply an in-place update to the first count (insertion order) matching a filter.
     *
     * @param filter Selects the count to update
     * @param update Mutation applied to the stored count
     * @return Snapshot of the updated count, empty when nothing matched
     */
    Optional<StockCount> updateFirst(Predicate<StockCount> filter, Consumer<StockCount> update);

    long count();
}
