package verigraph.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tunable constants of a workflow, read from the {@value #CONFIG_PATH} section of the typesafe config
 * (defaults in {@code reference.conf}).
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableWorkflowConfig.class)
public interface WorkflowConfig {
  String CONFIG_PATH = "verigraph.workflow";
  ObjectMapper MAPPER = new ObjectMapper();

  /**
   * Reads {@value #CONFIG_PATH} from the application config, with system properties and {@code reference.conf}
   * defaults applied.
   */
  static WorkflowConfig load() {
    return fromConfig(ConfigFactory.load());
  }

  static WorkflowConfig defaults() {
    return fromConfig(ConfigFactory.defaultReference());
  }

  /**
   * @throws ConfigException if the section is missing, or holds a value of the wrong type or an unrecognized key
   */
  static WorkflowConfig fromConfig(Config config) {
    Object unwrapped = config.getValue(CONFIG_PATH).unwrapped();
    try {
      return MAPPER.convertValue(unwrapped, WorkflowConfig.class);
    } catch (IllegalArgumentException e) {
      throw new ConfigException.BadValue(CONFIG_PATH, e.getMessage(), e);
    }
  }

  /**
   * A builder pre-populated with the {@code reference.conf} defaults.
   */
  static ImmutableWorkflowConfig.Builder builder() {
    return ImmutableWorkflowConfig.builder().from(defaults());
  }

  LayoutSettings layout();

  EdgeSettings edges();

  StatusSettings status();

  @Value.Immutable
  @JsonDeserialize(as = ImmutableLayoutSettings.class)
  interface LayoutSettings {
    double propertyX();

    double startY();

    double propertySpacingY();

    double queryYOffset();

    double witnessYOffset();

    double querySpacing();

    double blockWidth();

    double blockHeight();

    @Value.Check
    default void checkDimensions() {
      checkArgument(blockWidth() > 0 && blockHeight() > 0, "Block size must be positive: %s x %s",
              blockWidth(), blockHeight());
      checkArgument(querySpacing() >= 0, "querySpacing must not be negative: %s", querySpacing());
    }
  }

  @Value.Immutable
  @JsonDeserialize(as = ImmutableEdgeSettings.class)
  interface EdgeSettings {
    /**
     * Vertical control-point offset used when an edge folds back on itself.
     */
    double controlPointRoundness();
  }

  @Value.Immutable
  @JsonDeserialize(as = ImmutableStatusSettings.class)
  interface StatusSettings {
    /**
     * Whether AND/OR connectors derive a status from their children, rather than staying Unknown.
     */
    boolean propagateConnectorStatus();
  }
}
