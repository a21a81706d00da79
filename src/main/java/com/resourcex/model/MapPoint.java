package com.resourcex.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapPoint {
    private int gid;
    private double longitude;
    private double latitude;
    private double value;
}
