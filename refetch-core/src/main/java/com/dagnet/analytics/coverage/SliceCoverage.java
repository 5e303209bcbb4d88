package com.dagnet.analytics.coverage;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Day-by-day classification of a requested window against one cached slice.
 */
public final class SliceCoverage {

    public enum MatureCoverage {
        FULL,
        PARTIAL,
        NONE
    }

    public final MatureCoverage matureCoverage;
    public final List<LocalDate> immatureDates;
    public final List<LocalDate> missingMatureDates;

    SliceCoverage(MatureCoverage matureCoverage, List<LocalDate> immatureDates, List<LocalDate> missingMatureDates) {
        this.matureCoverage = matureCoverage;
        this.immatureDates = Collections.unmodifiableList(immatureDates);
        this.missingMatureDates = Collections.unmodifiableList(missingMatureDates);
    }

    @Override
    public String toString() {
        return "SliceCoverage{" + matureCoverage
                + ", immature=" + immatureDates.size()
                + ", missingMature=" + missingMatureDates.size() + "}";
    }
}
