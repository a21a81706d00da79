package com.resourcex.model.param;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.resourcex.collection.CollectionRequest;
import com.resourcex.collection.ResourceDomain;
import com.resourcex.collection.StorageLayout;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parameter class for opening a collection
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenCollectionParam {

    @NotBlank
    private String name;

    /**
     * File, directory or {@code prefix*suffix} pattern
     */
    @NotBlank
    private String resourcePath;

    private ResourceDomain domain;
    private StorageLayout layout;
    private List<Integer> years;

    public CollectionRequest toRequest() {
        return CollectionRequest.builder()
                .name(name)
                .resourcePath(resourcePath)
                .domain(domain != null ? domain : ResourceDomain.GENERIC)
                .layout(layout != null ? layout : StorageLayout.SINGLE_FILE)
                .years(years)
                .build();
    }
}
