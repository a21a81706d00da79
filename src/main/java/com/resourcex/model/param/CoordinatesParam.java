package com.resourcex.model.param;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ordered (lat, lon) pairs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatesParam {

    @NotEmpty
    private List<List<Double>> coordinates;

    /**
     * @return one row per pair; rows keep whatever length the caller sent so
     *         malformed pairs are rejected by the index
     */
    public double[][] toArray() {
        double[][] latLon = new double[coordinates.size()][];
        for (int i = 0; i < coordinates.size(); i++) {
            List<Double> pair = coordinates.get(i);
            latLon[i] = pair == null ? null : pair.stream()
                    .mapToDouble(v -> v == null ? Double.NaN : v)
                    .toArray();
        }
        return latLon;
    }
}
