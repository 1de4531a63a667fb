package com.makerhedge.exchange;

import com.makerhedge.domain.enums.LegLabel;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** The two account runtimes of the hedge, keyed by leg. */
public class HedgeAccounts {

    private final Map<LegLabel, AccountRuntime> runtimes = new EnumMap<>(LegLabel.class);

    public HedgeAccounts(AccountRuntime legA, AccountRuntime legB) {
        if (legA.getLeg() != LegLabel.A || legB.getLeg() != LegLabel.B) {
            throw new IllegalArgumentException("Runtimes must be passed in leg order A, B");
        }
        runtimes.put(LegLabel.A, legA);
        runtimes.put(LegLabel.B, legB);
    }

    public AccountRuntime get(LegLabel leg) {
        return runtimes.get(leg);
    }

    public Collection<AccountRuntime> all() {
        return Collections.unmodifiableCollection(runtimes.values());
    }
}
