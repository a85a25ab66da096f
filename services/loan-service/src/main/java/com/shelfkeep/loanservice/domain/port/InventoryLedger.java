package com.shelfkeep.loanservice.domain.port;

import com.shelfkeep.loanservice.domain.model.InventoryItem;
import java.util.Optional;

/**
 * Copy counters of catalog items. Every mutation is a single conditional write whose outcome is
 * reported by the return value; callers never read a counter and write it back.
 */
public interface InventoryLedger {

    Optional<InventoryItem> find(String itemId);

    /**
     * Takes one copy off the shelf if one is available.
     *
     * @return {@code false} when no copy was available (or the item does not exist)
     */
    boolean takeCopy(String itemId);

    /**
     * Puts one copy back on the shelf unless the counter is already at the total.
     *
     * @return {@code false} when the counter was already full
     */
    boolean releaseCopy(String itemId);

    /**
     * Changes the total copy count keeping the number of copies on loan constant.
     *
     * @return {@code false} when more copies are on loan than {@code newTotalCopies}
     */
    boolean resize(String itemId, int newTotalCopies);
}
