package verigraph.workflow;

public enum SocketDirection {
  Input,
  Output
}
