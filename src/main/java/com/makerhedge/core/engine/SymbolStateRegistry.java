package com.makerhedge.core.engine;

import com.makerhedge.config.SymbolConfigLoader;
import com.makerhedge.domain.enums.LegLabel;
import com.makerhedge.domain.model.SymbolConfig;
import com.makerhedge.domain.model.SymbolState;
import com.makerhedge.exchange.ExchangeGateway;
import com.makerhedge.exchange.ExchangeResult;
import com.makerhedge.exchange.HedgeAccounts;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the per-symbol runtime state for the life of the process.
 *
 * <p>Built once at startup: the symbols file is loaded and each configured instrument name is
 * resolved against leg A's active instrument list. If that list cannot be fetched the names
 * are used as written. State objects are mutated only by the hedge loop thread.
 */
@Component
public class SymbolStateRegistry {

    private static final Logger log = LoggerFactory.getLogger(SymbolStateRegistry.class);

    private final Map<String, SymbolState> states;

    public SymbolStateRegistry(
            SymbolConfigLoader symbolConfigLoader, ExchangeGateway exchangeGateway, HedgeAccounts accounts) {
        ExchangeResult<List<String>> active = exchangeGateway.activeInstruments(accounts.get(LegLabel.A));
        List<String> activeInstruments = active.value().orElseGet(() -> {
            log.warn(
                    "Failed to preload instruments, continuing without name normalization: account={} {}",
                    accounts.get(LegLabel.A).getName(),
                    active.getError());
            return List.of();
        });
        if (!activeInstruments.isEmpty()) {
            log.info("Loaded {} active instruments for symbol normalization", activeInstruments.size());
        }

        Map<String, SymbolState> loaded = new LinkedHashMap<>();
        for (SymbolConfig config : symbolConfigLoader.load(activeInstruments)) {
            loaded.put(config.getInstrument(), new SymbolState(config));
        }
        this.states = Collections.unmodifiableMap(loaded);
        log.info("Configured symbols: {}", describe());
    }

    public Collection<SymbolState> all() {
        return states.values();
    }

    public List<SymbolState> enabled() {
        return states.values().stream().filter(s -> s.getConfig().isEnabled()).collect(Collectors.toList());
    }

    public Optional<SymbolState> get(String instrument) {
        return Optional.ofNullable(states.get(instrument));
    }

    /** {@code instrument:mode} pairs, comma separated, for the startup banner. */
    public String describe() {
        return states.values().stream()
                .map(s -> s.getInstrument() + ":" + s.getConfig().getPositionMode())
                .collect(Collectors.joining(","));
    }
}
