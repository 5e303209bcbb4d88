package com.dagnet.analytics.slice;

import com.dagnet.analytics.model.ParameterValue;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity key of a slice family: aggregation mode plus context/case dimensions.
 * At most one stored slice per family survives a merge.
 */
public final class SliceFamily implements Serializable {
    private static final long serialVersionUID = 1L;

    private final SliceMode mode;
    private final String dimensions;

    private SliceFamily(SliceMode mode, String dimensions) {
        this.mode = mode;
        this.dimensions = dimensions == null ? "" : dimensions;
    }

    public static SliceFamily of(SliceMode mode, String dimensions) {
        return new SliceFamily(mode, dimensions);
    }

    public static SliceFamily of(ParameterValue value) {
        SliceMode mode = value.isCohortMode() ? SliceMode.COHORT : SliceMode.WINDOW;
        return new SliceFamily(mode, SliceIsolation.extractDimensions(value.sliceDsl));
    }

    /**
     * Family targeted by a query or slice DSL; window mode unless the text names a cohort.
     */
    public static SliceFamily ofDsl(String sliceDsl) {
        SliceMode mode = SliceDsl.isCohort(sliceDsl) ? SliceMode.COHORT : SliceMode.WINDOW;
        return new SliceFamily(mode, SliceIsolation.extractDimensions(sliceDsl));
    }

    public SliceMode mode() {
        return mode;
    }

    public String dimensions() {
        return dimensions;
    }

    public boolean isContexted() {
        return !dimensions.isEmpty();
    }

    public boolean contains(ParameterValue value) {
        return equals(of(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SliceFamily)) {
            return false;
        }
        SliceFamily other = (SliceFamily) o;
        return mode == other.mode && dimensions.equals(other.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, dimensions);
    }

    @Override
    public String toString() {
        return mode.function() + (dimensions.isEmpty() ? "" : "|" + dimensions);
    }
}
