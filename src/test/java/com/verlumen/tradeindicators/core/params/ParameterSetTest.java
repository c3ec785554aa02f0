package com.verlumen.tradeindicators.core.params;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.IndicatorException.Kind;
import com.verlumen.tradeindicators.core.Source;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ParameterSetTest {
  private static final class Settings {
    int length = 5;
    double factor = 0.5;
    Source source = Source.CLOSE;
    boolean adjusted = false;
  }

  private static final ParameterSet<Settings> PARAMETERS =
      ParameterSet.<Settings>builder()
          .add(
              ParameterDefinition.<Settings>ofInteger(
                  "length", Range.closed(1, 100), s -> s.length, (s, v) -> s.length = v))
          .add(
              ParameterDefinition.<Settings>ofDouble(
                  "factor", Range.closedOpen(0.0, 1.0), s -> s.factor, (s, v) -> s.factor = v))
          .add(
              ParameterDefinition.<Settings>ofSource(
                  "source", s -> s.source, (s, v) -> s.source = v))
          .add(
              ParameterDefinition.<Settings>ofBoolean(
                  "adjusted", s -> s.adjusted, (s, v) -> s.adjusted = v))
          .build();

  @Test
  public void apply_validValues_setsEachType() throws Exception {
    Settings settings = new Settings();

    PARAMETERS.apply(settings, "length", " 42 ");
    PARAMETERS.apply(settings, "factor", "0.25");
    PARAMETERS.apply(settings, "source", "hl2");
    PARAMETERS.apply(settings, "adjusted", "TRUE");

    assertThat(PARAMETERS.valuesOf(settings))
        .containsExactly("length", 42, "factor", 0.25, "source", Source.HL2, "adjusted", true)
        .inOrder();
  }

  @Test
  public void apply_rejectedValue_leavesSettingsUnchanged(
      @TestParameter({
            "length:0",
            "length:101",
            "length:4.5",
            "factor:1.0",
            "factor:NaN",
            "factor:Infinity",
            "factor:half",
            "source:median",
            "adjusted:yes"
          })
          String assignment) {
    Settings settings = new Settings();
    ImmutableMap<String, Object> before = PARAMETERS.valuesOf(settings);
    String[] parts = assignment.split(":", 2);

    IndicatorException thrown =
        assertThrows(
            IndicatorException.class, () -> PARAMETERS.apply(settings, parts[0], parts[1]));

    assertThat(thrown.getKind()).isEqualTo(Kind.INVALID_PARAMETER);
    assertThat(PARAMETERS.valuesOf(settings)).isEqualTo(before);
  }

  @Test
  public void apply_missingValue_failsWithInvalidParameter() {
    Settings settings = new Settings();

    IndicatorException thrown =
        assertThrows(IndicatorException.class, () -> PARAMETERS.apply(settings, "length", null));

    assertThat(thrown.getKind()).isEqualTo(Kind.INVALID_PARAMETER);
    assertThat(thrown).hasMessageThat().contains("'length'");
    assertThat(settings.length).isEqualTo(5);
  }

  @Test
  public void apply_unknownName_listsKnownNames() {
    IndicatorException thrown =
        assertThrows(
            IndicatorException.class, () -> PARAMETERS.apply(new Settings(), "Length", "5"));

    assertThat(thrown.getKind()).isEqualTo(Kind.INVALID_PARAMETER);
    assertThat(thrown).hasMessageThat().contains("Unknown parameter 'Length'");
    assertThat(thrown).hasMessageThat().contains("length");
  }

  @Test
  public void get_returnsDefinitionByName() {
    assertThat(PARAMETERS.get("factor").map(ParameterDefinition::type))
        .hasValue(ParameterType.DOUBLE);
    assertThat(PARAMETERS.get("missing")).isEmpty();
    assertThat(PARAMETERS.names())
        .containsExactly("length", "factor", "source", "adjusted")
        .inOrder();
  }

  @Test
  public void build_duplicateName_throws() {
    ParameterSet.Builder<Settings> builder =
        ParameterSet.<Settings>builder()
            .add(
                ParameterDefinition.<Settings>ofBoolean(
                    "adjusted", s -> s.adjusted, (s, v) -> s.adjusted = v))
            .add(
                ParameterDefinition.<Settings>ofBoolean(
                    "adjusted", s -> s.adjusted, (s, v) -> s.adjusted = v));

    assertThrows(IllegalArgumentException.class, builder::build);
  }
}
