package com.strata.storage;

import com.strata.domain.DataTier;
import com.strata.domain.TechnologyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Registry of storage providers by technology class and of the provider that
 * currently owns each logical table.
 *
 * Lookups follow registration order, so the same tier or table resolves to
 * the same provider for the lifetime of the registry. Table ownership comes
 * from an explicit assignment map; the optional default provider only serves
 * tables that were never assigned.
 */
public class ProviderRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);
    
    private final List<StorageProvider> providers = new CopyOnWriteArrayList<>();
    private final Map<String, StorageProvider> providersByName = new ConcurrentHashMap<>();
    private final Map<String, String> tableAssignments = new ConcurrentHashMap<>();
    private volatile String defaultProviderName;
    
    /**
     * Registers a provider
     *
     * @param provider the provider to register
     * @throws IllegalArgumentException if a provider with the same name is already registered
     */
    public void register(StorageProvider provider) {
        StorageProvider existing = providersByName.putIfAbsent(provider.getName(), provider);
        if (existing != null) {
            throw new IllegalArgumentException("Provider already registered: " + provider.getName());
        }
        providers.add(provider);
        logger.info("Registered storage provider {} ({})", provider.getName(), provider.getTechnologyType());
    }
    
    /**
     * Assigns a table to the provider that holds its data
     *
     * @param tableName logical table name
     * @param providerName name of a registered provider
     */
    public void assignTable(String tableName, String providerName) {
        requireProvider(providerName);
        String previous = tableAssignments.put(tableName, providerName);
        if (previous == null) {
            logger.debug("Table {} assigned to provider {}", tableName, providerName);
        } else if (!previous.equals(providerName)) {
            logger.info("Table {} reassigned from provider {} to {}", tableName, previous, providerName);
        }
    }
    
    /**
     * Sets the provider used for tables without an explicit assignment.
     * Pass {@code null} to require explicit assignments for every table.
     */
    public void setDefaultProvider(String providerName) {
        if (providerName != null) {
            requireProvider(providerName);
        }
        this.defaultProviderName = providerName;
    }
    
    public Optional<StorageProvider> getProvider(String providerName) {
        return Optional.ofNullable(providersByName.get(providerName));
    }
    
    public List<StorageProvider> getAllProviders() {
        return List.copyOf(providers);
    }
    
    public List<StorageProvider> getProvidersByType(TechnologyType technologyType) {
        return providers.stream()
            .filter(provider -> provider.getTechnologyType() == technologyType)
            .collect(Collectors.toList());
    }
    
    /**
     * Providers serving a tier, ordered by the tier's technology preference
     * and then by registration order.
     *
     * @throws ProviderResolutionException if no provider serves the tier
     */
    public List<StorageProvider> providersForTier(DataTier tier) {
        List<StorageProvider> result = new ArrayList<>();
        for (TechnologyType technology : tier.getTechnologies()) {
            result.addAll(getProvidersByType(technology));
        }
        if (result.isEmpty()) {
            throw new ProviderResolutionException("No storage provider registered for tier " + tier
                + " (technologies " + tier.getTechnologies() + ")");
        }
        return result;
    }
    
    /**
     * Provider currently holding the table's data
     *
     * @throws ProviderResolutionException if the table is not assigned and no default provider is set
     */
    public StorageProvider providerForTable(String tableName) {
        String providerName = tableAssignments.get(tableName);
        if (providerName == null) {
            providerName = defaultProviderName;
        }
        if (providerName == null) {
            throw new ProviderResolutionException("No storage provider assigned to table " + tableName);
        }
        return requireProvider(providerName);
    }
    
    public Map<String, String> getTableAssignments() {
        return Map.copyOf(tableAssignments);
    }
    
    private StorageProvider requireProvider(String providerName) {
        StorageProvider provider = providersByName.get(providerName);
        if (provider == null) {
            throw new ProviderResolutionException("Unknown storage provider: " + providerName);
        }
        return provider;
    }
}
