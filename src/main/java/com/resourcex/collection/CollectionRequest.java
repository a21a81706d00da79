package com.resourcex.collection;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What to open: a resource path in one of the forms {@code /dir/file.json},
 * {@code /dir/} or {@code /dir/prefix*suffix}, its domain and layout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionRequest {

    private String name;

    @Builder.Default
    private ResourceDomain domain = ResourceDomain.GENERIC;

    @Builder.Default
    private StorageLayout layout = StorageLayout.SINGLE_FILE;

    private String resourcePath;

    /** Years to open for multi-year collections; all years found when empty. */
    private List<Integer> years;
}
