package com.makerhedge.config;

import com.makerhedge.domain.enums.OrderSide;
import com.makerhedge.domain.enums.PositionMode;
import com.makerhedge.domain.model.SymbolConfig;
import com.makerhedge.exception.ConfigurationException;
import com.makerhedge.exception.ErrorCode;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Loads and validates the per-symbol settings from the JSON array named by
 * {@code hedge.symbols-file}. A {@code classpath:} prefix reads from the classpath; anything
 * else is a filesystem path.
 *
 * <p>Every problem (missing file, bad JSON, empty array, unknown instrument, invalid side or
 * mode, inconsistent bounds) is fatal and surfaces as a {@link ConfigurationException}.
 */
@Component
public class SymbolConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(SymbolConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    static final BigDecimal DEFAULT_ORDER_NOTIONAL = new BigDecimal("1000");
    static final BigDecimal DEFAULT_IMBALANCE_LIMIT = new BigDecimal("1000");
    static final BigDecimal DEFAULT_MAX_TOTAL_POSITION = new BigDecimal("20000");

    private final HedgeProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SymbolConfigLoader(HedgeProperties properties) {
        this.properties = properties;
    }

    /**
     * Reads the configured symbols file.
     *
     * @param activeInstruments canonical instrument names from the exchange, or empty to skip
     *     name normalization
     */
    public List<SymbolConfig> load(Collection<String> activeInstruments) {
        String location = properties.getSymbolsFile() == null ? "" : properties.getSymbolsFile().trim();
        if (location.isEmpty()) {
            throw new ConfigurationException("hedge.symbols-file is required");
        }
        Resource resource = location.startsWith(CLASSPATH_PREFIX)
                ? new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()))
                : new FileSystemResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Symbols config file not found: " + location);
        }
        String json;
        try (InputStream in = resource.getInputStream()) {
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read symbols config file (" + location + ")", e);
        }
        List<SymbolConfig> configs = parse(json, new InstrumentNameResolver(activeInstruments));
        log.info("Loaded {} symbol configs from {}", configs.size(), location);
        return configs;
    }

    public List<SymbolConfig> parse(String json, InstrumentNameResolver resolver) {
        SymbolConfigEntry[] entries;
        try {
            entries = objectMapper.readValue(json, SymbolConfigEntry[].class);
        } catch (JacksonException e) {
            throw new ConfigurationException("Invalid symbols config JSON: " + e.getOriginalMessage(), e);
        }
        if (entries == null || entries.length == 0) {
            throw new ConfigurationException("Symbols config file must be a non-empty JSON array");
        }

        List<SymbolConfig> configs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SymbolConfigEntry entry : entries) {
            if (entry == null) {
                throw new ConfigurationException("Each symbol config must be an object");
            }
            SymbolConfig config = toConfig(entry, resolver);
            if (!seen.add(config.getInstrument())) {
                throw new ConfigurationException("Duplicate symbol config for " + config.getInstrument());
            }
            configs.add(config);
        }
        return configs;
    }

    private SymbolConfig toConfig(SymbolConfigEntry entry, InstrumentNameResolver resolver) {
        String raw = entry.getInstrument() == null ? "" : entry.getInstrument().trim();
        if (raw.isEmpty()) {
            throw new ConfigurationException("Symbol config missing instrument");
        }
        String instrument = resolver.resolve(raw).orElseThrow(() -> unknownInstrument(raw, resolver));
        if (!raw.equals(instrument)) {
            log.info("Normalized instrument {} -> {}", raw, instrument);
        }

        SymbolConfig config = SymbolConfig.builder()
                .instrument(instrument)
                .enabled(entry.getEnabled() == null || entry.getEnabled())
                .orderNotional(orDefault(entry.getOrderNotionalUsdt(), DEFAULT_ORDER_NOTIONAL))
                .imbalanceLimit(orDefault(entry.getImbalanceLimitUsdt(), DEFAULT_IMBALANCE_LIMIT))
                .maxTotalPosition(orDefault(entry.getMaxTotalPositionUsdt(), DEFAULT_MAX_TOTAL_POSITION))
                .minTotalPosition(orDefault(entry.getMinTotalPositionUsdt(), BigDecimal.ZERO))
                .tieBreakSide(parseSide(instrument, entry.getTieBreakSide()))
                .positionMode(parseMode(instrument, entry.getPositionMode()))
                .build();
        validateBounds(config);
        return config;
    }

    private static void validateBounds(SymbolConfig config) {
        String instrument = config.getInstrument();
        if (config.getMaxTotalPosition().signum() < 0) {
            throw invalid(instrument + " invalid max_total_position_usdt: " + config.getMaxTotalPosition());
        }
        if (config.getMinTotalPosition().signum() < 0) {
            throw invalid(instrument + " invalid min_total_position_usdt: " + config.getMinTotalPosition());
        }
        if (config.getMinTotalPosition().compareTo(config.getMaxTotalPosition()) > 0) {
            throw invalid(instrument + " min_total_position_usdt > max_total_position_usdt: "
                    + config.getMinTotalPosition() + " > " + config.getMaxTotalPosition());
        }
    }

    private static OrderSide parseSide(String instrument, String value) {
        try {
            return value == null ? OrderSide.BUY : OrderSide.parse(value);
        } catch (IllegalArgumentException e) {
            throw invalid(instrument + " invalid a_side_when_equal: " + value);
        }
    }

    private static PositionMode parseMode(String instrument, String value) {
        try {
            return value == null ? PositionMode.INCREASE : PositionMode.parse(value);
        } catch (IllegalArgumentException e) {
            throw invalid(instrument + " invalid position_mode: " + value);
        }
    }

    private static BigDecimal orDefault(BigDecimal value, BigDecimal fallback) {
        return value == null ? fallback : value;
    }

    private static ConfigurationException invalid(String message) {
        return new ConfigurationException(ErrorCode.INVALID_CONFIGURATION, message);
    }

    private static ConfigurationException unknownInstrument(String raw, InstrumentNameResolver resolver) {
        List<String> suggestions = resolver.suggest(raw);
        String suffix = suggestions.isEmpty() ? "" : ", maybe: " + String.join(", ", suggestions);
        return new ConfigurationException(
                ErrorCode.UNKNOWN_INSTRUMENT,
                "Unknown instrument '" + raw + "'" + suffix,
                Map.of("instrument", raw, "suggestions", suggestions));
    }
}
