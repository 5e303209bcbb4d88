package com.dagnet.analytics.config;

/**
 * Tuning knobs shared by the refetch policy, coverage analysis and merge, sourced from environment variables.
 */
public class RefetchPolicyConfig implements java.io.Serializable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_COOLDOWN_MINUTES = 720;
    public static final int DEFAULT_T95_DAYS = 30;
    public static final double DEFAULT_RECENCY_HALF_LIFE_DAYS = 30.0;

    private static final RefetchPolicyConfig DEFAULTS = new RefetchPolicyConfig(
            DEFAULT_COOLDOWN_MINUTES,
            DEFAULT_T95_DAYS,
            DEFAULT_RECENCY_HALF_LIFE_DAYS);

    // Minimum age of the last fetch before a maturity-driven refetch may fire again.
    public final int cooldownMinutes;
    // Horizon used when no positive t95/path_t95 is known.
    public final int defaultT95Days;
    public final double recencyHalfLifeDays;

    private RefetchPolicyConfig(int cooldownMinutes, int defaultT95Days, double recencyHalfLifeDays) {
        this.cooldownMinutes = cooldownMinutes;
        this.defaultT95Days = defaultT95Days;
        this.recencyHalfLifeDays = recencyHalfLifeDays;
    }

    public static RefetchPolicyConfig defaults() {
        return DEFAULTS;
    }

    public static RefetchPolicyConfig of(int cooldownMinutes, int defaultT95Days, double recencyHalfLifeDays) {
        if (cooldownMinutes < 0) {
            throw new IllegalArgumentException("cooldownMinutes must be >= 0");
        }
        if (defaultT95Days <= 0) {
            throw new IllegalArgumentException("defaultT95Days must be > 0");
        }
        if (!(recencyHalfLifeDays > 0.0)) {
            throw new IllegalArgumentException("recencyHalfLifeDays must be > 0");
        }
        return new RefetchPolicyConfig(cooldownMinutes, defaultT95Days, recencyHalfLifeDays);
    }

    public static RefetchPolicyConfig fromEnv() {
        int cooldownMinutes = envInt("DAGNET_REFETCH_COOLDOWN_MINUTES", DEFAULT_COOLDOWN_MINUTES);
        int defaultT95Days = envInt("DAGNET_DEFAULT_T95_DAYS", DEFAULT_T95_DAYS);
        double halfLife = envDouble("DAGNET_RECENCY_HALF_LIFE_DAYS", DEFAULT_RECENCY_HALF_LIFE_DAYS);

        return new RefetchPolicyConfig(
                cooldownMinutes < 0 ? DEFAULT_COOLDOWN_MINUTES : cooldownMinutes,
                defaultT95Days <= 0 ? DEFAULT_T95_DAYS : defaultT95Days,
                halfLife > 0.0 ? halfLife : DEFAULT_RECENCY_HALF_LIFE_DAYS);
    }

    public RefetchPolicyConfig withCooldownMinutes(int minutes) {
        return of(minutes, defaultT95Days, recencyHalfLifeDays);
    }

    private static int envInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static double envDouble(String key, double defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "RefetchPolicyConfig{cooldownMinutes=" + cooldownMinutes
                + ", defaultT95Days=" + defaultT95Days
                + ", recencyHalfLifeDays=" + recencyHalfLifeDays + "}";
    }
}
