package com.makerhedge.core.engine;

import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.model.AccountSnapshot;
import com.makerhedge.domain.vo.AccountSummary;
import com.makerhedge.exchange.AccountRuntime;
import com.makerhedge.exchange.ExchangeGateway;
import com.makerhedge.exchange.HedgeAccounts;
import com.makerhedge.risk.MarginRatioMonitor;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Polls positions, open orders and the account summary of both legs once per loop iteration,
 * running the maintenance-margin check on each summary as it arrives.
 */
@Component
public class SnapshotCollector {

    private final ExchangeGateway exchangeGateway;
    private final HedgeAccounts accounts;
    private final MarginRatioMonitor marginRatioMonitor;

    public SnapshotCollector(
            ExchangeGateway exchangeGateway, HedgeAccounts accounts, MarginRatioMonitor marginRatioMonitor) {
        this.exchangeGateway = exchangeGateway;
        this.accounts = accounts;
        this.marginRatioMonitor = marginRatioMonitor;
    }

    public Map<LegLabel, AccountSnapshot> collect() {
        Map<LegLabel, AccountSnapshot> snapshots = new EnumMap<>(LegLabel.class);
        for (LegLabel leg : LegLabel.values()) {
            AccountRuntime account = accounts.get(leg);
            Optional<AccountSummary> summary = exchangeGateway.accountSummary(account);
            marginRatioMonitor.check(account.getName(), summary);
            snapshots.put(
                    leg,
                    AccountSnapshot.of(
                            exchangeGateway.positions(account), exchangeGateway.openOrders(account), summary));
        }
        return snapshots;
    }
}
