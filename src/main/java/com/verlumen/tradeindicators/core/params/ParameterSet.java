package com.verlumen.tradeindicators.core.params;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.verlumen.tradeindicators.core.IndicatorException;
import java.util.Optional;

/**
 * The parameters of one indicator kind, keyed by name. Built once per kind and shared by all of its
 * configurations.
 *
 * @param <C> the configuration type the parameters belong to
 */
public final class ParameterSet<C> {
  private final ImmutableMap<String, ParameterDefinition<C, ?>> definitions;

  private ParameterSet(ImmutableMap<String, ParameterDefinition<C, ?>> definitions) {
    this.definitions = definitions;
  }

  public static <C> Builder<C> builder() {
    return new Builder<>();
  }

  public ImmutableSet<String> names() {
    return definitions.keySet();
  }

  public Optional<ParameterDefinition<C, ?>> get(String name) {
    return Optional.ofNullable(definitions.get(name));
  }

  /**
   * Sets the parameter {@code name} of {@code config} from its text form.
   *
   * @throws IndicatorException if the name is unknown or the value is missing or rejected; {@code
   *     config} is left unchanged in that case
   */
  public void apply(C config, String name, String value) throws IndicatorException {
    checkNotNull(name, "name");
    ParameterDefinition<C, ?> definition = definitions.get(name);
    if (definition == null) {
      throw IndicatorException.invalidParameter(
          String.format("Unknown parameter '%s', expected one of %s", name, names()));
    }
    if (value == null) {
      throw IndicatorException.invalidParameter(
          String.format("Parameter '%s' has no value", name));
    }
    definition.apply(config, value);
  }

  /** Returns the current value of every parameter of {@code config}, in declaration order. */
  public ImmutableMap<String, Object> valuesOf(C config) {
    ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();
    definitions.forEach((name, definition) -> values.put(name, definition.get(config)));
    return values.buildOrThrow();
  }

  public static final class Builder<C> {
    private final ImmutableMap.Builder<String, ParameterDefinition<C, ?>> definitions =
        ImmutableMap.builder();

    private Builder() {}

    public Builder<C> add(ParameterDefinition<C, ?> definition) {
      definitions.put(definition.name(), definition);
      return this;
    }

    /**
     * @throws IllegalArgumentException if two parameters share a name
     */
    public ParameterSet<C> build() {
      return new ParameterSet<>(definitions.buildOrThrow());
    }
  }
}
