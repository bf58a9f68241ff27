package com.driverlens.core.analysis;

import com.driverlens.core.model.DriverMetadata;

import java.util.Optional;

/**
 * Source of human-readable driver descriptions used to enrich a ranking.
 *
 * <p>
 * Keys are bare driver names, without any KPI-value prefix. Absence of an
 * entry is not an error.
 * </p>
 *
 * @since 1.0.0
 */
public interface DriverMetadataProvider {

    /**
     * @param driverKey driver name with the value prefix stripped
     * @return metadata for the driver, if known
     */
    Optional<DriverMetadata> find(String driverKey);

    /**
     * Human-readable label for a driver: {@code "description (unit)"}, the
     * bare description when no unit is known, or {@code "Driver <key>"} when
     * the driver has no description.
     *
     * @param driverKey driver name with the value prefix stripped
     * @return the label, never {@code null}
     */
    default String displayName(String driverKey) {
        Optional<DriverMetadata> entry = find(driverKey);
        String description = entry.map(DriverMetadata::getDescription)
                .filter(d -> !d.isBlank())
                .orElse("Driver " + driverKey);
        return entry.map(DriverMetadata::getUnit)
                .filter(u -> !u.isBlank())
                .map(u -> description + " (" + u + ")")
                .orElse(description);
    }

    /**
     * @return a provider that knows no drivers
     */
    static DriverMetadataProvider none() {
        return driverKey -> Optional.empty();
    }
}
