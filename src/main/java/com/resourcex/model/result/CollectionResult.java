package com.resourcex.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.resourcex.collection.ResourceCollection;
import com.resourcex.collection.ResourceDomain;
import com.resourcex.collection.StorageLayout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of an open collection
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CollectionResult {

    private String name;
    private ResourceDomain domain;
    private StorageLayout layout;
    private String sourceName;
    private String cacheKey;
    private Integer sites;
    private Integer timeSteps;
    private List<String> datasets;
    private List<Integer> years;

    public static CollectionResult of(ResourceCollection collection) {
        return CollectionResult.builder()
                .name(collection.getName())
                .domain(collection.getDomain())
                .layout(collection.getLayout())
                .sourceName(collection.getSourceName())
                .cacheKey(collection.getCacheKey())
                .sites(collection.getSiteTable().size())
                .timeSteps(collection.getTimeAxis().size())
                .datasets(new ArrayList<>(collection.getDatasets()))
                .years(new ArrayList<>(collection.getYears()))
                .build();
    }
}
