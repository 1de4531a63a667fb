package com.makerhedge.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Maps instrument names as written in the symbols file onto the exchange's canonical names.
 *
 * <p>Matching is exact, then upper case, then lower case, after a trailing {@code _PERP} in any
 * case has been rewritten to {@code _Perp}. With no known instruments every name resolves to
 * itself.
 */
public class InstrumentNameResolver {

    private static final int MAX_SUGGESTIONS = 6;
    private static final String PERP_SUFFIX = "_PERP";

    private final Map<String, String> aliases = new HashMap<>();
    private final TreeSet<String> canonical = new TreeSet<>();

    public InstrumentNameResolver(Collection<String> activeInstruments) {
        for (String raw : activeInstruments) {
            String name = raw == null ? "" : raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            canonical.add(name);
            aliases.put(name, name);
            aliases.put(name.toUpperCase(Locale.ROOT), name);
            aliases.put(name.toLowerCase(Locale.ROOT), name);
        }
    }

    public boolean isEmpty() {
        return canonical.isEmpty();
    }

    public Optional<String> resolve(String raw) {
        String instrument = raw == null ? "" : raw.trim();
        if (instrument.isEmpty()) {
            return Optional.empty();
        }
        if (instrument.toUpperCase(Locale.ROOT).endsWith(PERP_SUFFIX)) {
            instrument = instrument.substring(0, instrument.length() - PERP_SUFFIX.length()) + "_Perp";
        }
        if (isEmpty()) {
            return Optional.of(instrument);
        }
        String resolved = aliases.get(instrument);
        if (resolved == null) {
            resolved = aliases.get(instrument.toUpperCase(Locale.ROOT));
        }
        if (resolved == null) {
            resolved = aliases.get(instrument.toLowerCase(Locale.ROOT));
        }
        return Optional.ofNullable(resolved);
    }

    /** Known names sharing the base token of {@code raw}: prefix matches first, then substring matches. */
    public List<String> suggest(String raw) {
        List<String> suggestions = new ArrayList<>();
        if (isEmpty()) {
            return suggestions;
        }
        String token = (raw == null ? "" : raw.trim()).split("_", -1)[0].toUpperCase(Locale.ROOT);
        if (token.isEmpty()) {
            canonical.stream().limit(MAX_SUGGESTIONS).forEach(suggestions::add);
            return suggestions;
        }
        String prefix = token + "_";
        for (String name : canonical) {
            if (name.toUpperCase(Locale.ROOT).startsWith(prefix)) {
                suggestions.add(name);
            }
        }
        if (suggestions.size() < MAX_SUGGESTIONS) {
            for (String name : canonical) {
                if (suggestions.size() >= MAX_SUGGESTIONS) {
                    break;
                }
                if (name.toUpperCase(Locale.ROOT).contains(token) && !suggestions.contains(name)) {
                    suggestions.add(name);
                }
            }
        }
        return suggestions.size() > MAX_SUGGESTIONS ? suggestions.subList(0, MAX_SUGGESTIONS) : suggestions;
    }
}
