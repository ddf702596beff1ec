package verigraph.workflow;

import java.util.Set;

/**
 * Receives notification of {@link Scene} changes, after each change has completed. Presentation code keeps its own
 * {@code blockId -> drawable} table and uses these callbacks to redraw incrementally.
 * <p/>
 * Callbacks arrive on the thread that mutated the scene.
 */
public interface SceneListener {
  default void onBlockAdded(int blockId) {
  }

  /**
   * Called when {@link Scene#connect} attaches an existing block. Edges created along with a new block are reported
   * through {@link #onBlockAdded} only.
   */
  default void onEdgeAdded(int edgeId) {
  }

  default void onPositionsChanged(Set<Integer> blockIds) {
  }

  default void onStatusChanged(Set<Integer> blockIds) {
  }

  /**
   * @param blockIds every block removed by a cascading removal, the removed root first
   */
  default void onBlocksRemoved(Set<Integer> blockIds) {
  }

  default void onCleared() {
  }

  interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
