package com.verlumen.tradeindicators.configurable;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Text description of a named group of indicators evaluated over the same candles. */
public final class IndicatorGroupSpec implements Serializable {
  private static final long serialVersionUID = 1L;

  private String name;
  private String description;
  private List<IndicatorSpec> indicators;

  public IndicatorGroupSpec() {}

  public IndicatorGroupSpec(String name, String description, List<IndicatorSpec> indicators) {
    this.name = name;
    this.description = description;
    this.indicators = indicators;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public List<IndicatorSpec> getIndicators() {
    return indicators;
  }

  public void setIndicators(List<IndicatorSpec> indicators) {
    this.indicators = indicators;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    IndicatorGroupSpec that = (IndicatorGroupSpec) o;
    return Objects.equals(name, that.name)
        && Objects.equals(description, that.description)
        && Objects.equals(indicators, that.indicators);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, indicators);
  }

  @Override
  public String toString() {
    return "IndicatorGroupSpec{"
        + "name='"
        + name
        + '\''
        + ", description='"
        + description
        + '\''
        + ", indicators="
        + indicators
        + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private final List<IndicatorSpec> indicators = new ArrayList<>();

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder addIndicator(IndicatorSpec indicator) {
      this.indicators.add(indicator);
      return this;
    }

    public IndicatorGroupSpec build() {
      return new IndicatorGroupSpec(name, description, new ArrayList<>(indicators));
    }
  }
}
