package com.dagnet.analytics.policy;

import com.dagnet.analytics.model.DateRange;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Outcome of a refetch policy evaluation. Exactly one of four variants; consumers branch with
 * {@link #accept(Visitor)} so a new variant breaks every caller at compile time.
 *
 * <p>Decisions are created per evaluation and never persisted.</p>
 */
public abstract class RefetchDecision {

    public enum Type {
        GAPS_ONLY("gaps_only"),
        PARTIAL("partial"),
        REPLACE_SLICE("replace_slice"),
        USE_CACHE("use_cache");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public interface Visitor<R> {
        R gapsOnly(GapsOnly decision);

        R partial(Partial decision);

        R replaceSlice(ReplaceSlice decision);

        R useCache(UseCache decision);
    }

    public final Type type;
    public final String reason;

    private RefetchDecision(Type type, String reason) {
        this.type = Objects.requireNonNull(type, "type");
        this.reason = reason;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public boolean isCooldownApplied() {
        return false;
    }

    /**
     * Cutoff day for maturity; null for variants that do not carry one.
     */
    public LocalDate matureCutoff() {
        return null;
    }

    @Override
    public String toString() {
        return type.wireName() + (reason == null ? "" : "(" + reason + ")");
    }

    public static GapsOnly gapsOnly(String reason) {
        return new GapsOnly(reason, null, null, null);
    }

    public static GapsOnly cooldown(CooldownInfo cooldown, DateRange wouldRefetchWindow, Boolean hasImmatureCohorts) {
        return new GapsOnly(RefetchReasons.RECENT_FETCH_COOLDOWN, cooldown, wouldRefetchWindow, hasImmatureCohorts);
    }

    public static Partial partial(LocalDate matureCutoff, DateRange refetchWindow) {
        return new Partial(matureCutoff, refetchWindow);
    }

    public static ReplaceSlice replaceSlice(String reason, boolean hasImmatureCohorts, LocalDate matureCutoff) {
        return new ReplaceSlice(reason, hasImmatureCohorts, matureCutoff);
    }

    public static UseCache useCache() {
        return new UseCache();
    }

    /**
     * Only fill dates missing from the cache. When produced by a cooldown, carries what the
     * suppressed refetch would have done.
     */
    public static final class GapsOnly extends RefetchDecision {
        public final CooldownInfo cooldown;
        public final DateRange wouldRefetchWindow;
        public final Boolean hasImmatureCohorts;

        private GapsOnly(String reason, CooldownInfo cooldown, DateRange wouldRefetchWindow, Boolean hasImmatureCohorts) {
            super(Type.GAPS_ONLY, reason);
            this.cooldown = cooldown;
            this.wouldRefetchWindow = wouldRefetchWindow;
            this.hasImmatureCohorts = hasImmatureCohorts;
        }

        @Override
        public boolean isCooldownApplied() {
            return cooldown != null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.gapsOnly(this);
        }
    }

    /**
     * Re-fetch the immature tail of a window; the mature head is served from cache.
     */
    public static final class Partial extends RefetchDecision {
        public final LocalDate matureCutoff;
        public final DateRange refetchWindow;

        private Partial(LocalDate matureCutoff, DateRange refetchWindow) {
            super(Type.PARTIAL, RefetchReasons.IMMATURE_WINDOW);
            this.matureCutoff = Objects.requireNonNull(matureCutoff, "matureCutoff");
            this.refetchWindow = Objects.requireNonNull(refetchWindow, "refetchWindow");
        }

        @Override
        public LocalDate matureCutoff() {
            return matureCutoff;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.partial(this);
        }
    }

    public static final class ReplaceSlice extends RefetchDecision {
        public final boolean hasImmatureCohorts;
        public final LocalDate matureCutoff;

        private ReplaceSlice(String reason, boolean hasImmatureCohorts, LocalDate matureCutoff) {
            super(Type.REPLACE_SLICE, reason);
            this.hasImmatureCohorts = hasImmatureCohorts;
            this.matureCutoff = matureCutoff;
        }

        @Override
        public LocalDate matureCutoff() {
            return matureCutoff;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.replaceSlice(this);
        }
    }

    public static final class UseCache extends RefetchDecision {
        private UseCache() {
            super(Type.USE_CACHE, RefetchReasons.COHORTS_MATURE_AND_FRESH);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.useCache(this);
        }
    }

    /**
     * Why a maturity-driven refetch was suppressed: the slice was fetched too recently.
     */
    public static final class CooldownInfo {
        public final int cooldownMinutes;
        public final String lastRetrievedAt;
        public final double lastRetrievedAgeMinutes;

        public CooldownInfo(int cooldownMinutes, String lastRetrievedAt, double lastRetrievedAgeMinutes) {
            this.cooldownMinutes = cooldownMinutes;
            this.lastRetrievedAt = lastRetrievedAt;
            this.lastRetrievedAgeMinutes = lastRetrievedAgeMinutes;
        }
    }
}
