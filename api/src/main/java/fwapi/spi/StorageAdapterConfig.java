package fwapi.spi;

import java.util.Optional;

/**
 * Read-only view of the settings a rule storage provider may consult.
 *
 * <p>Keys are full property names, by convention
 * {@code fwapi.rules.storage.<provider>.<setting>}. Blank values read as unset.
 */
public interface StorageAdapterConfig {

    Optional<String> get(String key);

    String getOrDefault(String key, String defaultValue);
}
