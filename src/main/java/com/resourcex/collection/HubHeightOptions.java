package com.resourcex.collection;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for wind bundles at a hub height.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HubHeightOptions {

    /** Fail when the wind direction dataset for the height is missing. */
    private boolean requireWindDirection;

    /** Add 2 m relative humidity for icing losses. */
    private boolean icing;

    public static HubHeightOptions defaults() {
        return new HubHeightOptions();
    }
}
