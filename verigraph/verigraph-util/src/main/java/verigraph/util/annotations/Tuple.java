package verigraph.util.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Style for small positional value types (points, sizes, edge endpoints): combined with {@link Value.Immutable},
 * the generated type exposes a static {@code of} factory taking every attribute in declaration order, and no builder.
 * @see Value.Style#allParameters
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Value.Style(allParameters = true, defaults = @Value.Immutable(builder = false))
public @interface Tuple {
}
