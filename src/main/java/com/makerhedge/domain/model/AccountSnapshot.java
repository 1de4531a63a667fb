package com.makerhedge.domain.model;

import com.makerhedge.domain.vo.AccountSummary;
import com.makerhedge.domain.vo.PositionSnapshot;
import com.makerhedge.exchange.ExchangeOrder;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Value;

/**
 * Everything polled from one account in one loop iteration: positions by instrument,
 * open orders grouped by instrument, and the account summary when it could be fetched.
 *
 * <p>A failed query leaves the corresponding map empty and clears its availability flag;
 * the engine does not trade a symbol on an incomplete snapshot.
 */
@Value
public class AccountSnapshot {

    Map<String, PositionSnapshot> positions;
    Map<String, List<ExchangeOrder>> openOrders;
    AccountSummary summary;
    boolean positionsAvailable;
    boolean openOrdersAvailable;

    public static AccountSnapshot of(
            Optional<Map<String, PositionSnapshot>> positions,
            Optional<Map<String, List<ExchangeOrder>>> openOrders,
            Optional<AccountSummary> summary) {
        return new AccountSnapshot(
                positions.orElse(Map.of()),
                openOrders.orElse(Map.of()),
                summary.orElse(null),
                positions.isPresent(),
                openOrders.isPresent());
    }

    public PositionSnapshot position(String instrument) {
        return positions.getOrDefault(instrument, PositionSnapshot.FLAT);
    }

    public List<ExchangeOrder> openOrders(String instrument) {
        return openOrders.getOrDefault(instrument, List.of());
    }

    public Optional<AccountSummary> summary() {
        return Optional.ofNullable(summary);
    }

    public boolean isComplete() {
        return positionsAvailable && openOrdersAvailable;
    }
}
