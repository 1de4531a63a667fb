package com.makerhedge.domain.model;

import com.makerhedge.domain.enums.CloseReason;
import com.makerhedge.domain.enums.ExchangeOrderStatus;
import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import lombok.Builder;
import lombok.Data;

/**
 * Local view of one exchange order owned by the hedge strategy.
 *
 * <p>Created when the placer submits an order (before the exchange lists it as open) or when
 * an unknown strategy-tagged order shows up in an open-order snapshot. The exchange may
 * acknowledge a submission with a placeholder id ("0x00..."); the tracker swaps in the real
 * id once the order appears live under the same client order id.
 *
 * <p>{@code appliedTradedSize} is the traded size already pushed into the fill ledger. It never
 * decreases, which is what keeps repeated syncs from double-counting fills.
 */
@Data
@Builder
public class ManagedOrder {

    private String orderId;
    private String clientOrderId;
    private LegLabel leg;
    private String instrument;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal size;
    private BigDecimal notional;
    private Instant createdAt;
    private boolean strategyOwned;

    /** Last poll in which the order was listed as open. Null until first seen live. */
    private Instant lastSeenAt;

    @Builder.Default
    private BigDecimal appliedTradedSize = BigDecimal.ZERO;

    /** First poll at which an in-flight partial fill was observed. */
    private Instant partialSince;

    /**
     * Set once a cancel has been acknowledged. The order stops counting as active but stays
     * open until a status lookup has applied its final traded size.
     */
    private CloseReason pendingCloseReason;

    private boolean closed;
    private CloseReason closeReason;
    private Instant closedAt;

    public boolean hasPlaceholderId() {
        return isPlaceholderId(orderId);
    }

    public boolean isCancelRequested() {
        return pendingCloseReason != null;
    }

    public void requestCancel(CloseReason reason) {
        this.pendingCloseReason = reason;
    }

    public void close(CloseReason reason, Instant at) {
        this.closed = true;
        this.closeReason = reason;
        this.closedAt = at;
    }

    /** Closes on a terminal exchange status, keeping the reason of an earlier cancel request. */
    public void closeOnTerminal(ExchangeOrderStatus status, Instant at) {
        close(pendingCloseReason != null ? pendingCloseReason : CloseReason.fromTerminalStatus(status), at);
    }

    /** True for ids the exchange returns before it has assigned a real one. */
    public static boolean isPlaceholderId(String orderId) {
        String id = orderId == null ? "" : orderId.trim().toLowerCase(Locale.ROOT);
        return id.isEmpty() || id.equals("0") || id.equals("0x0") || id.startsWith("0x00");
    }

    /**
     * Local key for an order acknowledged with a placeholder. Both legs can be waiting on a
     * placeholder in the same cycle, so the client order id is appended to keep keys unique.
     */
    public static String provisionalId(String clientOrderId) {
        return "0x00:" + clientOrderId;
    }
}
