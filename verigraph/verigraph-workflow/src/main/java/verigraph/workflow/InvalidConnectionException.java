package verigraph.workflow;

import com.google.common.base.Strings;

public class InvalidConnectionException extends WorkflowGraphException {
  public InvalidConnectionException(String format, Object... args) {
    super(Strings.lenientFormat(format, args));
  }
}
