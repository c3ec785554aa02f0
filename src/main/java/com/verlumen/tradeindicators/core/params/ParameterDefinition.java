package com.verlumen.tradeindicators.core.params;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.common.collect.Range;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.Source;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A named, typed parameter of an indicator configuration together with the accessors used to read
 * and write it from text.
 *
 * @param <C> the configuration type that owns the parameter
 * @param <V> the parameter value type
 */
@AutoValue
public abstract class ParameterDefinition<C, V extends Comparable<? super V>> {
  public abstract String name();

  public abstract ParameterType type();

  /** Values accepted by {@link #apply(Object, String)}. */
  public abstract Range<V> domain();

  abstract Function<String, Optional<V>> parser();

  abstract Function<C, V> getter();

  abstract BiConsumer<C, V> setter();

  public static <C> ParameterDefinition<C, Integer> ofInteger(
      String name,
      Range<Integer> domain,
      Function<C, Integer> getter,
      BiConsumer<C, Integer> setter) {
    return create(
        name, ParameterType.INTEGER, domain, ParameterDefinition::parseInt, getter, setter);
  }

  public static <C> ParameterDefinition<C, Double> ofDouble(
      String name, Range<Double> domain, Function<C, Double> getter, BiConsumer<C, Double> setter) {
    return create(
        name, ParameterType.DOUBLE, domain, ParameterDefinition::parseDouble, getter, setter);
  }

  public static <C> ParameterDefinition<C, Source> ofSource(
      String name, Function<C, Source> getter, BiConsumer<C, Source> setter) {
    return create(name, ParameterType.SOURCE, Range.all(), Source::parse, getter, setter);
  }

  public static <C> ParameterDefinition<C, Boolean> ofBoolean(
      String name, Function<C, Boolean> getter, BiConsumer<C, Boolean> setter) {
    return create(
        name,
        ParameterType.BOOLEAN,
        Range.all(),
        ParameterDefinition::parseBoolean,
        getter,
        setter);
  }

  private static <C, V extends Comparable<? super V>> ParameterDefinition<C, V> create(
      String name,
      ParameterType type,
      Range<V> domain,
      Function<String, Optional<V>> parser,
      Function<C, V> getter,
      BiConsumer<C, V> setter) {
    checkArgument(!name.isEmpty(), "Parameter name must not be empty");
    return new AutoValue_ParameterDefinition<>(name, type, domain, parser, getter, setter);
  }

  /**
   * Parses {@code value}, checks it against {@link #domain()} and only then stores it in {@code
   * config}.
   */
  public void apply(C config, String value) throws IndicatorException {
    V parsed =
        parser()
            .apply(value)
            .orElseThrow(
                () ->
                    IndicatorException.invalidParameter(
                        String.format(
                            "Cannot parse %s parameter '%s' from '%s'", type(), name(), value)));
    if (!domain().contains(parsed)) {
      throw IndicatorException.invalidParameter(
          String.format(
              "Value %s of parameter '%s' is outside of %s", parsed, name(), domain()));
    }
    setter().accept(config, parsed);
  }

  public V get(C config) {
    return getter().apply(config);
  }

  private static Optional<Integer> parseInt(String value) {
    return Optional.ofNullable(Ints.tryParse(value.trim()));
  }

  private static Optional<Double> parseDouble(String value) {
    return Optional.ofNullable(Doubles.tryParse(value.trim())).filter(Double::isFinite);
  }

  private static Optional<Boolean> parseBoolean(String value) {
    String normalized = Ascii.toLowerCase(value.trim());
    if (normalized.equals("true")) {
      return Optional.of(true);
    }
    if (normalized.equals("false")) {
      return Optional.of(false);
    }
    return Optional.empty();
  }
}
