package com.makerhedge.ledger;

import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.model.FillLot;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.domain.vo.PositionSnapshot;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * FIFO matching of fills between the two legs.
 *
 * <p>Every fill first offsets the oldest unmatched inventory of the other leg that was created
 * on the opposite side, and only at a price no worse than that inventory:
 * <ul>
 *   <li>a SELL fill matches an older BUY lot only if it sells at or above the lot price</li>
 *   <li>a BUY fill matches an older SELL lot only if it buys at or below the lot price</li>
 * </ul>
 * Whatever is left over becomes a new lot at the back of the queue. Lots that cannot be matched
 * keep their place, so queue order always reflects creation order.
 *
 * <p>A match retires the same notional from the incoming fill and from the lot, so for every
 * symbol the remaining lot notional plus twice the matched notional equals the fill notional
 * applied.
 */
@Component
public class FillLotLedger {

    private static final Logger log = LoggerFactory.getLogger(FillLotLedger.class);

    private final Clock clock;

    public FillLotLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Applies one fill to the symbol's lot queue.
     *
     * @return the notional matched against existing lots (0 when the whole fill became a new lot)
     */
    public BigDecimal applyFill(
            SymbolState state, LegLabel sourceLeg, OrderSide sourceSide, BigDecimal fillPrice, BigDecimal fillNotional) {
        if (fillNotional.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        OrderSide opposite = sourceSide.opposite();
        BigDecimal remaining = fillNotional;
        BigDecimal matchedTotal = BigDecimal.ZERO;

        Iterator<FillLot> it = state.getLots().iterator();
        while (it.hasNext() && remaining.signum() > 0) {
            FillLot lot = it.next();
            if (lot.getRemainingNotional().signum() <= 0) {
                it.remove();
                continue;
            }
            boolean candidate = lot.getSourceLeg() != sourceLeg && lot.getSourceSide() == opposite;
            if (!candidate || !priceAcceptable(sourceSide, fillPrice, lot.getPrice())) {
                continue;
            }
            BigDecimal matched = remaining.min(lot.getRemainingNotional());
            lot.setRemainingNotional(lot.getRemainingNotional().subtract(matched));
            remaining = remaining.subtract(matched);
            matchedTotal = matchedTotal.add(matched);
            if (lot.getRemainingNotional().signum() <= 0) {
                it.remove();
            }
        }

        if (remaining.signum() > 0) {
            state.getLots()
                    .addLast(FillLot.builder()
                            .sourceLeg(sourceLeg)
                            .sourceSide(sourceSide)
                            .price(fillPrice)
                            .remainingNotional(remaining)
                            .createdAt(clock.instant())
                            .synthetic(false)
                            .build());
        }

        log.debug(
                "[{}] fill {} {} {} @ {}: matched={} new lot={}",
                state.getInstrument(),
                sourceLeg,
                sourceSide,
                fillNotional,
                fillPrice,
                matchedTotal,
                remaining);
        return matchedTotal;
    }

    /**
     * Seeds one synthetic lot for a position that existed before the engine started,
     * priced at the entry price. Flat positions or positions without an entry price are ignored.
     */
    public boolean seedSyntheticLot(SymbolState state, LegLabel leg, PositionSnapshot position) {
        if (position.getAbsNotional().signum() <= 0 || position.getEntryPrice().signum() <= 0) {
            return false;
        }
        OrderSide side = position.isLong() ? OrderSide.BUY : OrderSide.SELL;
        state.getLots()
                .addLast(FillLot.builder()
                        .sourceLeg(leg)
                        .sourceSide(side)
                        .price(position.getEntryPrice())
                        .remainingNotional(position.getAbsNotional())
                        .createdAt(clock.instant())
                        .synthetic(true)
                        .build());
        log.info(
                "[{}] seeded synthetic lot leg={} side={} notional={} @ {}",
                state.getInstrument(),
                leg,
                side,
                position.getAbsNotional(),
                position.getEntryPrice());
        return true;
    }

    /** Oldest lot with remaining notional that the given leg does not own. */
    public Optional<FillLot> oldestOpposingLot(SymbolState state, LegLabel targetLeg) {
        for (FillLot lot : state.getLots()) {
            if (lot.getRemainingNotional().signum() > 0 && lot.getSourceLeg() != targetLeg) {
                return Optional.of(lot);
            }
        }
        return Optional.empty();
    }

    /** Sum of remaining notional across all lots of the symbol. */
    public BigDecimal openNotional(SymbolState state) {
        Deque<FillLot> lots = state.getLots();
        return lots.stream().map(FillLot::getRemainingNotional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static boolean priceAcceptable(OrderSide fillSide, BigDecimal fillPrice, BigDecimal lotPrice) {
        return fillSide == OrderSide.SELL ? fillPrice.compareTo(lotPrice) >= 0 : fillPrice.compareTo(lotPrice) <= 0;
    }
}
