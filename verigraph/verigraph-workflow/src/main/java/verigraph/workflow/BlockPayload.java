package verigraph.workflow;

import org.immutables.value.Value;
import verigraph.util.annotations.Tuple;

import javax.annotation.Nullable;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The kind-specific data carried by a {@link Block}. Each subtype corresponds to one or more {@link BlockKind}s, and
 * callers dispatch over them with {@link #visit} rather than probing for capabilities.
 */
public abstract class BlockPayload {
  BlockPayload() {
  }

  public static PropertyPayload property(Quantifier quantifier, String title) {
    return ImmutablePropertyPayload.builder().quantifier(quantifier).title(title).build();
  }

  public static PropertyPayload property(Quantifier quantifier, String title, boolean negated) {
    return ImmutablePropertyPayload.builder().quantifier(quantifier).title(title).negated(negated).build();
  }

  public static QueryPayload query(boolean negated, @Nullable String sourceReference) {
    return ImmutableQueryPayload.builder()
            .negated(negated)
            .sourceReference(Optional.ofNullable(sourceReference))
            .build();
  }

  public static WitnessPayload witness(boolean counterexample, @Nullable String dataReference) {
    return ImmutableWitnessPayload.builder()
            .counterexample(counterexample)
            .dataReference(Optional.ofNullable(dataReference))
            .build();
  }

  public static ConnectorPayload connector(BlockKind kind) {
    return ImmutableConnectorPayload.of(kind);
  }

  public abstract BlockKind kind();

  public abstract <O> O visit(Visitor<O> visitor);

  public interface Visitor<O> {
    O onProperty(PropertyPayload property);

    O onQuery(QueryPayload query);

    O onWitness(WitnessPayload witness);

    O onConnector(ConnectorPayload connector);
  }

  @Value.Immutable
  public abstract static class PropertyPayload extends BlockPayload {
    public abstract Quantifier quantifier();

    public abstract String title();

    /**
     * Whether the queries of this property are checked by refutation (the quantifier was negated before being handed
     * to the verifier). Universal properties are negated unless stated otherwise.
     */
    @Value.Default
    public boolean negated() {
      return quantifier() == Quantifier.ForAll;
    }

    @Override
    public BlockKind kind() {
      return BlockKind.Property;
    }

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onProperty(this);
    }
  }

  @Value.Immutable
  public abstract static class QueryPayload extends BlockPayload {
    public abstract boolean negated();

    /**
     * Opaque pointer to the query text (typically a file written by the verifier); owned by the host.
     */
    public abstract Optional<String> sourceReference();

    @Override
    public BlockKind kind() {
      return BlockKind.Query;
    }

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onQuery(this);
    }
  }

  @Value.Immutable
  public abstract static class WitnessPayload extends BlockPayload {
    public abstract boolean counterexample();

    public abstract Optional<String> dataReference();

    @Override
    public BlockKind kind() {
      return BlockKind.Witness;
    }

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onWitness(this);
    }
  }

  @Value.Immutable
  @Tuple
  public abstract static class ConnectorPayload extends BlockPayload {
    @Override
    public abstract BlockKind kind();

    @Override
    public <O> O visit(Visitor<O> visitor) {
      return visitor.onConnector(this);
    }

    @Value.Check
    void checkConnector() {
      checkArgument(kind().isConnector(), "Not a logical connector: %s", kind());
    }
  }
}
