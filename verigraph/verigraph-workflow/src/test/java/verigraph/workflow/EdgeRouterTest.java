package verigraph.workflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import verigraph.util.geometry.CubicPath;
import verigraph.util.geometry.Point;

import java.util.OptionalInt;

import static com.google.common.truth.Truth.assertThat;

class EdgeRouterTest {
  private static final double ROUNDNESS = 100;

  private Scene scene;
  private WorkflowLayout layout;
  private EdgeRouter router;

  @BeforeEach
  void setUp() {
    WorkflowConfig config = WorkflowConfig.defaults();
    scene = new Scene();
    layout = new WorkflowLayout(scene, config.layout());
    router = new EdgeRouter(scene, config);
    scene.subscribe(router);
  }

  @Test
  void controlPointsMeetHalfwayWhenHeadingOutward() {
    CubicPath path = EdgeRouter.route(Point.of(0, 60), SocketDirection.Output, Point.of(220, 150), ROUNDNESS);

    assertThat(path.start()).isEqualTo(Point.of(0, 60));
    assertThat(path.control1()).isEqualTo(Point.of(110, 60));
    assertThat(path.control2()).isEqualTo(Point.of(110, 150));
    assertThat(path.end()).isEqualTo(Point.of(220, 150));
  }

  @Test
  void foldsBackWithVerticalRoundness() {
    CubicPath path = EdgeRouter.route(Point.of(200, 60), SocketDirection.Output, Point.of(0, 150), ROUNDNESS);

    assertThat(path.control1()).isEqualTo(Point.of(300, -40));
    assertThat(path.control2()).isEqualTo(Point.of(-100, 250));
  }

  @Test
  void foldsBackFromInputSockets() {
    CubicPath path = EdgeRouter.route(Point.of(0, 150), SocketDirection.Input, Point.of(200, 60), ROUNDNESS);

    assertThat(path.control1()).isEqualTo(Point.of(-100, 250));
    assertThat(path.control2()).isEqualTo(Point.of(300, -40));
  }

  @Test
  void zeroVerticalDeltaAddsNoRoundness() {
    CubicPath path = EdgeRouter.route(Point.of(200, 50), SocketDirection.Output, Point.of(0, 50), ROUNDNESS);

    assertThat(path.control1()).isEqualTo(Point.of(300, 50));
    assertThat(path.control2()).isEqualTo(Point.of(-100, 50));
  }

  @Test
  void signOfZeroIsZero() {
    assertThat(EdgeRouter.sign(0)).isEqualTo(0.0);
    assertThat(EdgeRouter.sign(-42)).isEqualTo(-1.0);
    assertThat(EdgeRouter.sign(0.5)).isEqualTo(1.0);
  }

  @Test
  void anchorsEdgesAtSockets() {
    int property = scene.addProperty(Quantifier.ForAll, "p");
    int query = scene.addQuery(property, true, null);
    layout.layout();

    assertThat(router.socketAnchor(scene.block(property), SocketDirection.Output)).isEqualTo(Point.of(90, 60));
    assertThat(router.socketAnchor(scene.block(query), SocketDirection.Input)).isEqualTo(Point.of(90, 150));

    int edgeId = scene.edgesTouching(query).get(0).id();
    assertThat(router.path(edgeId)).hasValue(
            CubicPath.of(Point.of(90, 60), Point.of(90, 60), Point.of(90, 150), Point.of(90, 150)));
  }

  @Test
  void keepsPathsInStepWithTheScene() {
    int property = scene.addProperty(Quantifier.ForAll, "p");
    int q1 = scene.addQuery(property, true, null);
    int edgeId = scene.edgesTouching(q1).get(0).id();
    CubicPath beforeLayout = router.path(edgeId).orElseThrow();

    int q2 = scene.addQuery(property, true, null);
    layout.layout();

    assertThat(router.paths()).hasSize(2);
    assertThat(router.path(edgeId).orElseThrow()).isNotEqualTo(beforeLayout);
    assertThat(router.path(edgeId).orElseThrow().end()).isEqualTo(Point.of(-20, 150));

    scene.removeBlock(q2);
    assertThat(router.paths().keySet()).containsExactly(edgeId);

    scene.clear();
    assertThat(router.paths()).isEmpty();
  }

  @Test
  void routesEdgesAddedByConnect() {
    int property = scene.addProperty(Quantifier.ForAll, "p");
    int query = scene.addBlock(BlockKind.Query, OptionalInt.empty(), BlockPayload.query(true, null));
    layout.layout();
    assertThat(router.paths()).isEmpty();

    int edge = scene.connect(property, query);

    assertThat(router.path(edge)).isPresent();
    assertThat(router.path(edge).get().start()).isEqualTo(Point.of(90, 60));
  }

  @Test
  void rerouteAllRebuildsEveryPath() {
    int property = scene.addProperty(Quantifier.ForAll, "p");
    scene.addQuery(property, true, null);
    scene.addQuery(property, true, null);
    layout.layout();

    router.onCleared();
    assertThat(router.paths()).isEmpty();

    router.rerouteAll();
    assertThat(router.paths()).hasSize(2);
    scene.edges().forEach(edge -> assertThat(router.path(edge.id())).hasValue(router.route(edge)));
  }
}
