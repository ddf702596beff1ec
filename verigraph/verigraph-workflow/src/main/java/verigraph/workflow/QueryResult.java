package verigraph.workflow;

import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

/**
 * A verifier outcome for the query with the given sequence number.
 */
@Value.Immutable
@Tuple
public interface QueryResult {
  static QueryResult of(int sequenceNumber, Status outcome) {
    return ImmutableQueryResult.of(sequenceNumber, outcome);
  }

  static QueryResult verified(int sequenceNumber) {
    return of(sequenceNumber, Status.Verified);
  }

  static QueryResult disproven(int sequenceNumber) {
    return of(sequenceNumber, Status.Disproven);
  }

  int sequenceNumber();

  Status outcome();
}
