package com.resourcex.model;

import lombok.Value;

import java.util.Map;

/**
 * One row of a {@link SiteTable}, attributes in column order.
 */
@Value
public class SiteRecord {
    int gid;
    Map<String, Object> attributes;

    public Object get(String column) {
        return attributes.get(column);
    }
}
