package com.resourcex.collection;

import com.resourcex.exception.DatasetNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Resource domain of a collection. Decides which variables make up a SAM
 * bundle; the query surface is the same for every domain.
 */
public enum ResourceDomain {

    GENERIC(List.of()),
    SOLAR(List.of("dhi", "dni", "ghi", "wind_speed", "air_temperature")),
    NSRDB(List.of("dhi", "dni", "ghi", "dew_point", "air_temperature", "surface_pressure",
            "wind_direction", "wind_speed", "surface_albedo")),
    WIND(List.of()),
    WAVE(List.of("significant_wave_height", "energy_period"));

    public static final String BUNDLE_DATASET = "SAM";

    private final List<String> bundleVariables;

    ResourceDomain(List<String> bundleVariables) {
        this.bundleVariables = bundleVariables;
    }

    public boolean supportsHubHeight() {
        return this == WIND;
    }

    /**
     * Default bundle variables. Generic collections bundle every dataset.
     *
     * @throws UnsupportedOperationException for wind, whose bundles depend on a hub height
     */
    public List<String> bundleVariables(Set<String> available) {
        if (this == WIND) {
            throw new UnsupportedOperationException("Wind bundles need a hub height");
        }
        if (this == GENERIC) {
            return new ArrayList<>(available);
        }
        return bundleVariables;
    }

    /**
     * Wind variables at a hub height: pressure, temperature and wind speed
     * always, wind direction when present or required, and 2 m relative
     * humidity for icing runs.
     */
    public static List<String> hubHeightVariables(int hubHeight, HubHeightOptions options,
                                                  Set<String> available, String source) {
        List<String> variables = new ArrayList<>();
        variables.add("pressure_" + hubHeight + "m");
        variables.add("temperature_" + hubHeight + "m");
        variables.add("windspeed_" + hubHeight + "m");

        String direction = "winddirection_" + hubHeight + "m";
        if (available.contains(direction)) {
            variables.add(direction);
        } else if (options.isRequireWindDirection()) {
            throw new DatasetNotFoundException(direction, source);
        }
        if (options.isIcing()) {
            variables.add("relativehumidity_2m");
        }
        return variables;
    }

    public static String hubHeightDataset(int hubHeight) {
        return BUNDLE_DATASET + "_" + hubHeight + "m";
    }
}
