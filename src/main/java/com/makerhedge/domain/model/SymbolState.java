package com.makerhedge.domain.model;

import com.makerhedge.domain.enums.LegLabel;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/**
 * All mutable hedge state for one instrument: the FIFO lot queue, the managed orders
 * (insertion ordered, keyed by exchange order id), placement cooldown, and alert flags.
 *
 * <p>Only the hedge loop thread touches a SymbolState, so nothing here is synchronized.
 */
@Getter
public class SymbolState {

    private final SymbolConfig config;
    private final Deque<FillLot> lots = new ArrayDeque<>();
    private final Map<String, ManagedOrder> managedOrders = new LinkedHashMap<>();
    private final Set<LegLabel> foreignOrderAlerted = EnumSet.noneOf(LegLabel.class);

    @Setter
    private Instant cooldownUntil = Instant.EPOCH;

    @Setter
    private Instant unhedgedSince;

    @Setter
    private boolean stuckAlertSent;

    public SymbolState(SymbolConfig config) {
        this.config = config;
    }

    public String getInstrument() {
        return config.getInstrument();
    }

    public boolean isInCooldown(Instant now) {
        return now.isBefore(cooldownUntil);
    }

    public void register(ManagedOrder order) {
        managedOrders.put(order.getOrderId(), order);
    }

    /** Moves a managed order from a placeholder key to the id the exchange finally assigned. */
    public void rekey(String oldOrderId, String newOrderId) {
        ManagedOrder order = managedOrders.remove(oldOrderId);
        if (order != null) {
            order.setOrderId(newOrderId);
            managedOrders.put(newOrderId, order);
        }
    }
}
