package com.okazje.scanner.scan.discovery;

import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Platform;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class DiscoveryService {
    private final Map<Platform, DiscoveryAdapter> adapters = new EnumMap<>(Platform.class);

    public DiscoveryService(List<DiscoveryAdapter> adapters) {
        for (DiscoveryAdapter adapter : adapters) {
            this.adapters.put(adapter.platform(), adapter);
        }
    }

    public List<Listing> search(Platform platform, String keyword, BigDecimal priceCeiling) {
        DiscoveryAdapter adapter = adapters.get(platform);
        if (adapter == null) {
            throw new IllegalArgumentException("Discovery is not supported for " + platform.label());
        }
        return adapter.search(keyword, priceCeiling);
    }

    public List<DiscoveryAdapter> adapters() {
        return List.copyOf(adapters.values());
    }

    public List<Platform> platforms() {
        return List.copyOf(adapters.keySet());
    }
}
