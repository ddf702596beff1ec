package verigraph.workflow;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WorkflowConfigTest {
  @Test
  void referenceDefaults() {
    WorkflowConfig config = WorkflowConfig.defaults();

    assertThat(config.layout().propertySpacingY()).isEqualTo(600.0);
    assertThat(config.layout().querySpacing()).isEqualTo(40.0);
    assertThat(config.layout().blockWidth()).isEqualTo(180.0);
    assertThat(config.edges().controlPointRoundness()).isEqualTo(100.0);
    assertThat(config.status().propagateConnectorStatus()).isTrue();
  }

  @Test
  void overridesFromConfig() {
    Config overrides = ConfigFactory.parseString(
            "verigraph.workflow.layout.querySpacing = 60\n"
                    + "verigraph.workflow.status.propagateConnectorStatus = false");

    WorkflowConfig config = WorkflowConfig.fromConfig(overrides.withFallback(ConfigFactory.defaultReference()));

    assertThat(config.layout().querySpacing()).isEqualTo(60.0);
    assertThat(config.layout().blockWidth()).isEqualTo(180.0);
    assertThat(config.status().propagateConnectorStatus()).isFalse();
  }

  @Test
  void overridesFromBuilder() {
    WorkflowConfig config = WorkflowConfig.builder()
            .edges(ImmutableEdgeSettings.builder().controlPointRoundness(25).build())
            .build();

    assertThat(config.edges().controlPointRoundness()).isEqualTo(25.0);
    assertThat(config.layout()).isEqualTo(WorkflowConfig.defaults().layout());
  }

  @Test
  void overriddenSpacingChangesTheLayout() {
    WorkflowConfig config = WorkflowConfig.fromConfig(ConfigFactory
            .parseString("verigraph.workflow.layout { querySpacing = 20, blockWidth = 100 }")
            .withFallback(ConfigFactory.defaultReference()));
    VerificationWorkflow workflow = new VerificationWorkflow(config);

    int property = workflow.addProperty(Quantifier.ForAll, "p");
    int q1 = workflow.addQuery(property, true, null);
    workflow.addQuery(property, true, null);

    assertThat(workflow.scene().block(q1).position().x()).isEqualTo(-60.0);
  }

  @Test
  void rejectsBadValues() {
    Config badType = ConfigFactory.parseString("verigraph.workflow.layout.blockWidth = wide")
            .withFallback(ConfigFactory.defaultReference());
    Config negativeSize = ConfigFactory.parseString("verigraph.workflow.layout.blockHeight = -1")
            .withFallback(ConfigFactory.defaultReference());

    assertThrows(ConfigException.BadValue.class, () -> WorkflowConfig.fromConfig(badType));
    assertThrows(ConfigException.BadValue.class, () -> WorkflowConfig.fromConfig(negativeSize));
    assertThrows(ConfigException.Missing.class, () -> WorkflowConfig.fromConfig(ConfigFactory.empty()));
  }
}
