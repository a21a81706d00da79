package com.resourcex.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Strictly increasing sequence of UTC timestamps. A timestamp maps to at
 * most one position.
 */
public final class TimeAxis {

    private final List<Instant> instants;

    private TimeAxis(List<Instant> instants) {
        for (int i = 1; i < instants.size(); i++) {
            if (!instants.get(i).isAfter(instants.get(i - 1))) {
                throw new IllegalArgumentException(String.format(
                        "Time axis is not strictly increasing at position %d: %s after %s",
                        i, instants.get(i), instants.get(i - 1)));
            }
        }
        this.instants = Collections.unmodifiableList(new ArrayList<>(instants));
    }

    public static TimeAxis of(List<Instant> instants) {
        return new TimeAxis(instants);
    }

    public static TimeAxis concat(List<TimeAxis> parts) {
        List<Instant> all = new ArrayList<>();
        for (TimeAxis part : parts) {
            all.addAll(part.instants);
        }
        return new TimeAxis(all);
    }

    public int size() {
        return instants.size();
    }

    public Instant get(int position) {
        return instants.get(position);
    }

    public List<Instant> getInstants() {
        return instants;
    }

    /**
     * @return the position of the timestamp, or -1 if it is not on the axis
     */
    public int positionOf(Instant instant) {
        int idx = Collections.binarySearch(instants, instant);
        return idx >= 0 ? idx : -1;
    }

    public SortedSet<Integer> years() {
        SortedSet<Integer> years = new TreeSet<>();
        for (Instant instant : instants) {
            years.add(yearOf(instant));
        }
        return years;
    }

    /**
     * Positions whose UTC year is one of the given years, ascending.
     */
    public int[] positionsInYears(Collection<Integer> years) {
        return IntStream.range(0, instants.size())
                .filter(i -> years.contains(yearOf(instants.get(i))))
                .toArray();
    }

    public static int yearOf(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).getYear();
    }

    public static int[] allPositions(int size) {
        return IntStream.range(0, size).toArray();
    }

    @Override
    public String toString() {
        if (instants.isEmpty()) {
            return "TimeAxis[]";
        }
        return "TimeAxis[" + instants.get(0) + " .. " + instants.get(instants.size() - 1)
                + ", n=" + instants.size() + "]";
    }
}
