package com.resourcex.index;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of reading a cached coordinate index. A lookup never throws;
 * callers rebuild on anything but {@link Status#HIT}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CacheLookup {

    public enum Status {
        HIT,
        MISS,
        /** Cache entry present but unreadable, corrupt or not an index. */
        DEGRADED
    }

    private final String key;
    private final Status status;
    private final CoordinateIndex index;
    private final String reason;

    public static CacheLookup hit(String key, CoordinateIndex index) {
        return new CacheLookup(key, Status.HIT, index, null);
    }

    public static CacheLookup miss(String key) {
        return new CacheLookup(key, Status.MISS, null, null);
    }

    public static CacheLookup degraded(String key, String reason) {
        return new CacheLookup(key, Status.DEGRADED, null, reason);
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public Optional<CoordinateIndex> index() {
        return Optional.ofNullable(index);
    }

    @Override
    public String toString() {
        return "CacheLookup(" + key + ", " + status + (reason != null ? ", " + reason : "") + ")";
    }
}
