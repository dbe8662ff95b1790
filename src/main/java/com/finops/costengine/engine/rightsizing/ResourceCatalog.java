package com.finops.costengine.engine.rightsizing;

import com.finops.costengine.model.CatalogEntry;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of catalog entries, ordered by capacity: vCPU, then memory, then type name.
 */
public final class ResourceCatalog {

    public static final Comparator<CatalogEntry> CAPACITY_ORDER = Comparator
            .comparingDouble(CatalogEntry::getVcpu)
            .thenComparingDouble(CatalogEntry::getMemoryGb)
            .thenComparing(CatalogEntry::getTypeName);

    private final List<CatalogEntry> entries;
    private final Map<String, CatalogEntry> byTypeName;

    private ResourceCatalog(List<CatalogEntry> entries, Map<String, CatalogEntry> byTypeName) {
        this.entries = entries;
        this.byTypeName = byTypeName;
    }

    /**
     * Builds a catalog, rejecting blank names, duplicate names and non-positive capacities or prices.
     */
    public static ResourceCatalog of(List<CatalogEntry> entries) {
        Map<String, CatalogEntry> byTypeName = new HashMap<>();
        for (CatalogEntry entry : entries) {
            validate(entry);
            CatalogEntry copy = entry.toBuilder().build();
            if (byTypeName.putIfAbsent(copy.getTypeName(), copy) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry: " + copy.getTypeName());
            }
        }
        List<CatalogEntry> ordered = byTypeName.values().stream().sorted(CAPACITY_ORDER).toList();
        return new ResourceCatalog(ordered, Map.copyOf(byTypeName));
    }

    private static void validate(CatalogEntry entry) {
        if (entry.getTypeName() == null || entry.getTypeName().isBlank()) {
            throw new IllegalArgumentException("Catalog entry without a type name");
        }
        if (entry.getVcpu() <= 0 || entry.getMemoryGb() <= 0) {
            throw new IllegalArgumentException("Catalog entry " + entry.getTypeName() + " has non-positive capacity");
        }
        if (entry.getHourlyPrice() <= 0) {
            throw new IllegalArgumentException("Catalog entry " + entry.getTypeName() + " has non-positive price");
        }
    }

    public Optional<CatalogEntry> find(String typeName) {
        return Optional.ofNullable(byTypeName.get(typeName)).map(e -> e.toBuilder().build());
    }

    public List<CatalogEntry> entries() {
        return entries.stream().map(e -> e.toBuilder().build()).toList();
    }

    public int size() {
        return entries.size();
    }
}
