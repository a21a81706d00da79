package com.resourcex.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Files written by a bundle export, in request order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportResult {

    private List<String> files;
}
