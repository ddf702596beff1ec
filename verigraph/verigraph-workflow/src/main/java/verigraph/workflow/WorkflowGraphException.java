package verigraph.workflow;

/**
 * Base type for failures of a single {@link Scene} operation. The scene is left unchanged when one is thrown.
 */
public class WorkflowGraphException extends RuntimeException {
  public WorkflowGraphException(String message) {
    super(message);
  }
}
