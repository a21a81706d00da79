package com.resourcex.model.param;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.resourcex.collection.HubHeightOptions;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parameter class for SAM bundle export
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExportBundleParam {

    @NotEmpty
    private List<Integer> gids;

    /**
     * A {@code .csv} file, or an existing directory to write {@code <bundle name>.csv} into
     */
    @NotBlank
    private String destination;

    /**
     * Wind collections only
     */
    private Integer hubHeight;
    private boolean requireWindDirection;
    private boolean icing;

    public int[] gidArray() {
        return gids.stream().mapToInt(Integer::intValue).toArray();
    }

    public HubHeightOptions hubHeightOptions() {
        return HubHeightOptions.builder()
                .requireWindDirection(requireWindDirection)
                .icing(icing)
                .build();
    }
}
