package verigraph.workflow.plan;

/**
 * Thrown when a plan document is not valid JSON or lacks the structure of a verification plan.
 */
public class PlanFormatException extends RuntimeException {
  public PlanFormatException(String message) {
    super(message);
  }

  public PlanFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
