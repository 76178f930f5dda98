package com.paxkun.magpie.service.source;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registered source adapters, keyed by the command line option that selects them.
 */
@Component
public class SourceRegistry {

    private final Map<String, SourceAdapter> adaptersByFlag = new LinkedHashMap<>();

    public SourceRegistry(List<SourceAdapter> adapters) {
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = adaptersByFlag.put(adapter.cliFlag(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate source flag: " + adapter.cliFlag());
            }
        }
    }

    public Optional<SourceAdapter> byFlag(String flag) {
        return Optional.ofNullable(adaptersByFlag.get(flag));
    }

    public Set<String> flags() {
        return adaptersByFlag.keySet();
    }
}
