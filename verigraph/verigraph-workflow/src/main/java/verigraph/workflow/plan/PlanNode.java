package verigraph.workflow.plan;

import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * One item of a verification plan: a query node (one or more subqueries), a nested disjunction or conjunction, or a
 * node whose tag was not recognized.
 */
public abstract class PlanNode {
  PlanNode() {
  }

  public static QueryNode query(Subquery... subqueries) {
    return ImmutableQueryNode.of(ImmutableList.copyOf(subqueries));
  }

  public static QueryNode query(List<Subquery> subqueries) {
    return ImmutableQueryNode.of(subqueries);
  }

  public static DisjunctNode disjunct(PlanNode... children) {
    return ImmutableDisjunctNode.of(ImmutableList.copyOf(children));
  }

  public static DisjunctNode disjunct(List<PlanNode> children) {
    return ImmutableDisjunctNode.of(children);
  }

  public static ConjunctNode conjunct(PlanNode... children) {
    return ImmutableConjunctNode.of(ImmutableList.copyOf(children));
  }

  public static ConjunctNode conjunct(List<PlanNode> children) {
    return ImmutableConjunctNode.of(children);
  }

  public static UnrecognizedNode unrecognized(String tag) {
    return ImmutableUnrecognizedNode.of(tag);
  }

  public abstract <O> O visit(Visitor<O> visitor);

  public interface Visitor<O> {
    O onQuery(QueryNode query);

    O onDisjunct(DisjunctNode disjunct);

    O onConjunct(ConjunctNode conjunct);

    O onUnrecognized(UnrecognizedNode node);
  }

  @Value.Immutable
  @Tuple
  public abstract static class QueryNode extends PlanNode {
    public abstract List<Subquery> subqueries();

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onQuery(this);
    }
  }

  @Value.Immutable
  @Tuple
  public abstract static class DisjunctNode extends PlanNode {
    public abstract List<PlanNode> children();

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onDisjunct(this);
    }
  }

  @Value.Immutable
  @Tuple
  public abstract static class ConjunctNode extends PlanNode {
    public abstract List<PlanNode> children();

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onConjunct(this);
    }
  }

  /**
   * A node whose tag is missing or not one of the known kinds. Parsing skips it, and its subtree, with a diagnostic.
   */
  @Value.Immutable
  @Tuple
  public abstract static class UnrecognizedNode extends PlanNode {
    public abstract String tag();

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onUnrecognized(this);
    }
  }

  /**
   * A single query to be handed to the verifier.
   */
  @Value.Immutable
  @Tuple
  public interface Subquery {
    static Subquery of(@Nullable String sourceReference) {
      return ImmutableSubquery.of(Optional.ofNullable(sourceReference));
    }

    static Subquery anonymous() {
      return of(null);
    }

    Optional<String> sourceReference();
  }
}
