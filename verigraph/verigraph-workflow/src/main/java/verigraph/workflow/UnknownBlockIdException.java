package verigraph.workflow;

public class UnknownBlockIdException extends WorkflowGraphException {
  private final int blockId;

  public UnknownBlockIdException(int blockId) {
    this("Unknown block id: " + blockId, blockId);
  }

  UnknownBlockIdException(String message, int blockId) {
    super(message);
    this.blockId = blockId;
  }

  public static UnknownBlockIdException forQuerySequence(int sequenceNumber) {
    return new UnknownBlockIdException("No query with sequence number: " + sequenceNumber, sequenceNumber);
  }

  /**
   * The id (or query sequence number) that could not be resolved.
   */
  public int blockId() {
    return blockId;
  }
}
