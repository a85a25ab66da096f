package com.shelfkeep.loanservice.infrastructure.persistence;

import com.shelfkeep.loanservice.domain.model.InventoryItem;
import com.shelfkeep.loanservice.domain.port.InventoryLedger;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link InventoryLedger} over the {@code items} table.
 *
 * <p>The WHERE clause of each UPDATE carries the precondition, so the affected-row count is the
 * outcome of the check and the write together.
 */
@Repository
public class JdbcInventoryLedger implements InventoryLedger {

    private static final String SELECT_ITEM =
            "SELECT id, tenant_id, total_copies, available_copies FROM items WHERE id = :id";

    private static final String TAKE_COPY =
            "UPDATE items SET available_copies = available_copies - 1"
                    + " WHERE id = :id AND available_copies > 0";

    private static final String RELEASE_COPY =
            "UPDATE items SET available_copies = available_copies + 1"
                    + " WHERE id = :id AND available_copies < total_copies";

    private static final String RESIZE =
            "UPDATE items SET available_copies = available_copies + (:total - total_copies),"
                    + " total_copies = :total"
                    + " WHERE id = :id AND total_copies - available_copies <= :total";

    private static final RowMapper<InventoryItem> ITEM_MAPPER =
            (rs, rowNum) ->
                    new InventoryItem(
                            rs.getString("id"),
                            rs.getString("tenant_id"),
                            rs.getInt("total_copies"),
                            rs.getInt("available_copies"));

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcInventoryLedger(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<InventoryItem> find(String itemId) {
        return jdbc.query(SELECT_ITEM, Map.of("id", itemId), ITEM_MAPPER).stream().findFirst();
    }

    @Override
    public boolean takeCopy(String itemId) {
        return jdbc.update(TAKE_COPY, Map.of("id", itemId)) == 1;
    }

    @Override
    public boolean releaseCopy(String itemId) {
        return jdbc.update(RELEASE_COPY, Map.of("id", itemId)) == 1;
    }

    @Override
    public boolean resize(String itemId, int newTotalCopies) {
        return jdbc.update(RESIZE, Map.of("id", itemId, "total", newTotalCopies)) == 1;
    }
}
