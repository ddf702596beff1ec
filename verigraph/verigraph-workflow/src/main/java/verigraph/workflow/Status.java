package verigraph.workflow;

public enum Status {
  Unknown,
  Verified,
  Disproven;

  public boolean isResolved() {
    return this != Unknown;
  }
}
