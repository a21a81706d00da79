package com.resourcex.model.result;

import com.resourcex.model.SiteRecord;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A resolved site and its metadata
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SiteResult {

    private int gid;
    private Map<String, Object> attributes;

    public static SiteResult of(SiteRecord record) {
        return new SiteResult(record.getGid(), record.getAttributes());
    }
}
