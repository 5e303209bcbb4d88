package com.dagnet.analytics.policy;

import com.dagnet.analytics.config.RefetchPolicyConfig;
import com.dagnet.analytics.maturity.MaturityModel;
import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.LatencyConfig;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.util.CalendarDates;
import com.dagnet.analytics.util.StringSemantics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Decides how much of a requested window must be re-fetched given what is cached and how
 * mature the cached days are.
 *
 * <p>Window slices refetch only their immature tail. Cohort slices are replaced wholesale when
 * any cohort is still immature or the data is older than the maturity horizon. A maturity-driven
 * refetch is downgraded to {@code gaps_only} while the slice is inside the cooldown period.</p>
 */
public final class RefetchPolicy {
    private static final Logger LOG = LoggerFactory.getLogger(RefetchPolicy.class);

    private RefetchPolicy() {}

    public static RefetchDecision shouldRefetch(
            ParameterValue existingSlice,
            LatencyConfig latencyConfig,
            DateRange requestedWindow,
            boolean isCohortQuery,
            Instant referenceDate) {
        return shouldRefetch(existingSlice, latencyConfig, requestedWindow, isCohortQuery, referenceDate,
                RefetchPolicyConfig.defaults());
    }

    public static RefetchDecision shouldRefetch(
            ParameterValue existingSlice,
            LatencyConfig latencyConfig,
            DateRange requestedWindow,
            boolean isCohortQuery,
            Instant referenceDate,
            RefetchPolicyConfig config) {
        if (requestedWindow == null) {
            throw new IllegalArgumentException("requestedWindow is required");
        }
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate is required");
        }
        RefetchDecision decision;
        if (!LatencyConfig.isEnabled(latencyConfig)) {
            decision = RefetchDecision.gapsOnly(RefetchReasons.LATENCY_DISABLED);
        } else {
            int maturityDays = MaturityModel.effectiveMaturity(latencyConfig, isCohortQuery, config);
            decision = isCohortQuery
                    ? evaluateCohort(existingSlice, maturityDays, referenceDate, config)
                    : evaluateWindow(existingSlice, maturityDays, requestedWindow, referenceDate, config);
        }
        LOG.debug("Refetch decision {} for window {} (cohort={}, reference={})",
                decision, requestedWindow, isCohortQuery, referenceDate);
        return decision;
    }

    private static RefetchDecision evaluateWindow(
            ParameterValue existingSlice,
            int maturityDays,
            DateRange requestedWindow,
            Instant referenceDate,
            RefetchPolicyConfig config) {
        // One extra buffer day on top of the maturity horizon.
        Instant cutoff = referenceDate.minus(Duration.ofDays(maturityDays + 1L));
        LocalDate matureCutoff = CalendarDates.utcDate(cutoff);

        if (CalendarDates.startOfDay(requestedWindow.end()).isBefore(cutoff)) {
            return RefetchDecision.gapsOnly(RefetchReasons.WINDOW_FULLY_MATURE);
        }

        LocalDate immatureStart = matureCutoff.isAfter(requestedWindow.start()) ? matureCutoff : requestedWindow.start();
        DateRange refetchWindow = DateRange.of(immatureStart, requestedWindow.end());

        RefetchDecision.CooldownInfo cooldown = cooldownFor(existingSlice, referenceDate, config);
        if (cooldown != null) {
            LOG.info("Suppressing immature window refetch {}: last fetch {} is {} minutes old (cooldown {} minutes)",
                    refetchWindow, cooldown.lastRetrievedAt,
                    Math.round(cooldown.lastRetrievedAgeMinutes), cooldown.cooldownMinutes);
            return RefetchDecision.cooldown(cooldown, refetchWindow, null);
        }
        return RefetchDecision.partial(matureCutoff, refetchWindow);
    }

    private static RefetchDecision evaluateCohort(
            ParameterValue existingSlice,
            int maturityDays,
            Instant referenceDate,
            RefetchPolicyConfig config) {
        if (existingSlice == null) {
            return RefetchDecision.replaceSlice(RefetchReasons.NO_EXISTING_SLICE, true, null);
        }
        List<String> cohortDates = existingSlice.dates;
        if (cohortDates == null || cohortDates.isEmpty()) {
            return RefetchDecision.replaceSlice(RefetchReasons.NO_COHORT_DATES, true, null);
        }

        Instant cutoff = referenceDate.minus(Duration.ofDays(maturityDays));
        boolean hasImmatureCohorts = false;
        for (String date : cohortDates) {
            if (!CalendarDates.startOfDay(CalendarDates.parse(date)).isBefore(cutoff)) {
                hasImmatureCohorts = true;
                break;
            }
        }

        if (hasImmatureCohorts) {
            RefetchDecision.CooldownInfo cooldown = cooldownFor(existingSlice, referenceDate, config);
            if (cooldown != null) {
                LOG.info("Suppressing immature cohort replacement: last fetch {} is {} minutes old (cooldown {} minutes)",
                        cooldown.lastRetrievedAt, Math.round(cooldown.lastRetrievedAgeMinutes), cooldown.cooldownMinutes);
                return RefetchDecision.cooldown(cooldown, null, Boolean.TRUE);
            }
            return RefetchDecision.replaceSlice(RefetchReasons.IMMATURE_COHORTS, true, CalendarDates.utcDate(cutoff));
        }

        Instant retrievedAt = retrievedAtOf(existingSlice);
        if (retrievedAt != null && retrievedAt.isBefore(cutoff)) {
            return RefetchDecision.replaceSlice(RefetchReasons.STALE_DATA, false, null);
        }
        return RefetchDecision.useCache();
    }

    /**
     * Cooldown metadata when the slice was fetched at most {@code cooldownMinutes} ago; null otherwise.
     * A retrieval time in the future relative to the reference date never counts.
     */
    static RefetchDecision.CooldownInfo cooldownFor(
            ParameterValue existingSlice,
            Instant referenceDate,
            RefetchPolicyConfig config) {
        Instant retrievedAt = retrievedAtOf(existingSlice);
        if (retrievedAt == null) {
            return null;
        }
        long ageMillis = Duration.between(retrievedAt, referenceDate).toMillis();
        long cooldownMillis = Duration.ofMinutes(config.cooldownMinutes).toMillis();
        if (ageMillis < 0L || ageMillis > cooldownMillis) {
            return null;
        }
        return new RefetchDecision.CooldownInfo(
                config.cooldownMinutes,
                existingSlice.retrievedAt(),
                ageMillis / 60_000.0);
    }

    private static Instant retrievedAtOf(ParameterValue slice) {
        if (slice == null) {
            return null;
        }
        String raw = slice.retrievedAt();
        if (StringSemantics.isBlank(raw)) {
            return null;
        }
        Instant parsed = CalendarDates.parseTimestamp(raw);
        if (parsed == null) {
            LOG.warn("Ignoring unparseable retrieved_at '{}' on slice {}", raw, slice.sliceDsl);
        }
        return parsed;
    }
}
