package dev.blanke.formfields;

import java.time.ZoneId;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Classifies objects by whether they have a stable identity which can be used for reference comparisons.
 * <p>
 * Instances of the JDK's value-based classes (see the {@code java.lang} package documentation) do not: two
 * {@link Integer}s boxed from the same {@code int} may or may not be the same instance.
 */
final class ReferenceTypes {

    private static final Set<Class<?>> VALUE_BASED_CLASSES = Set.of(
        Boolean.class,
        Character.class,
        Byte.class,
        Short.class,
        Integer.class,
        Long.class,
        Float.class,
        Double.class,
        Optional.class,
        OptionalInt.class,
        OptionalLong.class,
        OptionalDouble.class);

    private static final String JAVA_TIME_PACKAGE_PREFIX = "java.time.";

    // Prevent instantiation of utility class.
    private ReferenceTypes() {
    }

    /**
     * Checks whether the provided {@code type} is a value-based class.
     *
     * @param type The runtime class of a candidate model.
     *
     * @return {@code true} if instances of the {@code type} lack a stable identity, otherwise {@code false}.
     */
    static boolean isValueBased(final Class<?> type) {
        if (VALUE_BASED_CLASSES.contains(type))
            return true;
        // Dates, times, durations, periods, offsets, and zones. DayOfWeek and Month are enums with stable identity.
        return type.getName().startsWith(JAVA_TIME_PACKAGE_PREFIX) && !type.isEnum()
            && (TemporalAccessor.class.isAssignableFrom(type)
                || TemporalAmount.class.isAssignableFrom(type)
                || ZoneId.class.isAssignableFrom(type));
    }
}
