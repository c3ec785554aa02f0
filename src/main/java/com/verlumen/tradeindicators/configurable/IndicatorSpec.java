package com.verlumen.tradeindicators.configurable;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Text description of a single indicator: an id unique within its group, the indicator type and
 * its parameters as strings.
 */
public final class IndicatorSpec implements Serializable {
  private static final long serialVersionUID = 1L;

  private String id;
  private String type;
  private Map<String, String> params;

  public IndicatorSpec() {}

  public IndicatorSpec(String id, String type, Map<String, String> params) {
    this.id = id;
    this.type = type;
    this.params = params;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public Map<String, String> getParams() {
    return params;
  }

  public void setParams(Map<String, String> params) {
    this.params = params;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    IndicatorSpec that = (IndicatorSpec) o;
    return Objects.equals(id, that.id)
        && Objects.equals(type, that.type)
        && Objects.equals(params, that.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, params);
  }

  @Override
  public String toString() {
    return "IndicatorSpec{" + "id='" + id + '\'' + ", type='" + type + '\'' + ", params=" + params
        + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String id;
    private String type;
    private final Map<String, String> params = new LinkedHashMap<>();

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder param(String name, String value) {
      this.params.put(name, value);
      return this;
    }

    public Builder params(Map<String, String> params) {
      this.params.putAll(params);
      return this;
    }

    public IndicatorSpec build() {
      return new IndicatorSpec(id, type, new LinkedHashMap<>(params));
    }
  }
}
