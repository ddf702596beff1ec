package verigraph.workflow;

public enum Quantifier {
  ForAll,
  Exists
}
