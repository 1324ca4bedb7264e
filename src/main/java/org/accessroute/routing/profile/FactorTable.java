package org.accessroute.routing.profile;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable multiplicative factor lookup keyed by one closed attribute category.
 *
 * <p>Every constant of the key enum has a factor; constants without an explicit entry are
 * neutral ({@code 1.0}). Factors must be finite and {@code >= 1.0}; the {@code UNKNOWN}
 * member, when the enum has one, must stay neutral.</p>
 *
 * @param <E> attribute category.
 */
public final class FactorTable<E extends Enum<E>> {
    public static final double NEUTRAL = 1.0d;

    public static final String REASON_FACTOR_NON_FINITE = "PROFILE_FACTOR_NON_FINITE";
    public static final String REASON_FACTOR_BELOW_NEUTRAL = "PROFILE_FACTOR_BELOW_NEUTRAL";
    public static final String REASON_UNKNOWN_NOT_NEUTRAL = "PROFILE_UNKNOWN_NOT_NEUTRAL";

    private static final String UNKNOWN_MEMBER = "UNKNOWN";

    private final Class<E> category;
    private final double[] factorsByOrdinal;

    private FactorTable(Class<E> category, double[] factorsByOrdinal) {
        this.category = category;
        this.factorsByOrdinal = factorsByOrdinal;
    }

    /**
     * Returns a table where every category value is neutral.
     */
    public static <E extends Enum<E>> FactorTable<E> neutral(Class<E> category) {
        return of(category, Map.of());
    }

    /**
     * Creates a validated table from explicit entries.
     *
     * @throws ProfileConfigurationException when an entry is non-finite, below 1.0, or
     *                                       makes an {@code UNKNOWN} value non-neutral.
     */
    public static <E extends Enum<E>> FactorTable<E> of(Class<E> category, Map<E, Double> entries) {
        Objects.requireNonNull(category, "category");
        E[] constants = category.getEnumConstants();
        double[] factors = new double[constants.length];
        Arrays.fill(factors, NEUTRAL);
        if (entries != null) {
            for (Map.Entry<E, Double> entry : entries.entrySet()) {
                E key = Objects.requireNonNull(entry.getKey(), "factor key");
                double factor = entry.getValue() == null ? NEUTRAL : entry.getValue();
                validate(category, key, factor);
                factors[key.ordinal()] = factor;
            }
        }
        return new FactorTable<>(category, factors);
    }

    public static <E extends Enum<E>> Builder<E> builder(Class<E> category) {
        return new Builder<>(category);
    }

    /**
     * @return factor for the value, neutral when the value is {@code null}.
     */
    public double factor(E value) {
        if (value == null) {
            return NEUTRAL;
        }
        return factorsByOrdinal[value.ordinal()];
    }

    public Class<E> category() {
        return category;
    }

    /**
     * @return explicit non-neutral entries, for serialization and debugging.
     */
    public Map<E, Double> nonNeutralEntries() {
        EnumMap<E, Double> entries = new EnumMap<>(category);
        for (E constant : category.getEnumConstants()) {
            double factor = factorsByOrdinal[constant.ordinal()];
            if (factor != NEUTRAL) {
                entries.put(constant, factor);
            }
        }
        return entries;
    }

    private static <E extends Enum<E>> void validate(Class<E> category, E key, double factor) {
        String label = category.getSimpleName() + "." + key.name();
        if (!Double.isFinite(factor)) {
            throw new ProfileConfigurationException(REASON_FACTOR_NON_FINITE, label + " factor must be finite, got " + factor);
        }
        if (factor < NEUTRAL) {
            throw new ProfileConfigurationException(
                    REASON_FACTOR_BELOW_NEUTRAL,
                    label + " factor must be >= 1.0, got " + factor
            );
        }
        if (UNKNOWN_MEMBER.equals(key.name()) && factor != NEUTRAL) {
            throw new ProfileConfigurationException(
                    REASON_UNKNOWN_NOT_NEUTRAL,
                    label + " must stay neutral (1.0), got " + factor
            );
        }
    }

    @Override
    public String toString() {
        return category.getSimpleName() + nonNeutralEntries();
    }

    /**
     * Fluent builder collecting entries before validation.
     */
    public static final class Builder<E extends Enum<E>> {
        private final Class<E> category;
        private final EnumMap<E, Double> entries;

        private Builder(Class<E> category) {
            this.category = Objects.requireNonNull(category, "category");
            this.entries = new EnumMap<>(category);
        }

        public Builder<E> set(E value, double factor) {
            entries.put(Objects.requireNonNull(value, "value"), factor);
            return this;
        }

        public FactorTable<E> build() {
            return FactorTable.of(category, entries);
        }
    }
}
