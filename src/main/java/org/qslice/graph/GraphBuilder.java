/*
 * Copyright 2025 The QSlice Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.qslice.graph;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.qslice.trace.Action;
import org.qslice.trace.ActionKind;
import org.qslice.trace.Trace;
import org.qslice.trace.Wire;

/**
 * Builds the {@link DependencyGraph} of a {@link Trace}.
 *
 * <ul>
 *   <li>Each wire's Actions, ordered by (time, line), become nodes joined by {@link
 *       EdgeKind#TEMPORAL} edges.
 *   <li>A measurement also gets a {@link EdgeKind#MEASUREMENT} edge from the node before it, and
 *       if it stores its result, a {@link EdgeKind#QUANTUM_TO_CLASSICAL} edge to the definition
 *       node of the stored location. There is one definition node per location; later
 *       measurements into the same location link to the same node.
 *   <li>Actions other than measurements that share a (time, line) are coupled by {@link
 *       EdgeKind#ENTANGLEMENT} edges in both directions: each control with each target if there
 *       are both, otherwise every pair.
 * </ul>
 *
 * The trace is only read, so one Trace can be used for any number of builds.
 */
public final class GraphBuilder {

  /** Settings for a graph build. */
  public static final class Options {
    public static final Options DEFAULT = new Options(true);

    /** If false, the Actions of physical ({@code $n}) wires are left out of the graph. */
    public final boolean includePhysical;

    private Options(boolean includePhysical) {
      this.includePhysical = includePhysical;
    }

    public static Options includePhysical(boolean includePhysical) {
      return includePhysical ? DEFAULT : new Options(false);
    }
  }

  /** Orders Actions on a wire by time, then line. */
  private static final Comparator<Action> WIRE_ORDER =
      Comparator.<Action>comparingInt(a -> a.time).thenComparingInt(a -> a.line);

  private final DependencyGraph.Builder graph = DependencyGraph.builder();

  /** The non-measurement nodes recorded at each (time, line), with the kinds of their Actions. */
  private final Map<List<Integer>, List<Map.Entry<Node, ActionKind>>> groups =
      new LinkedHashMap<>();

  private GraphBuilder() {}

  public static DependencyGraph build(Trace trace) {
    return build(trace, Options.DEFAULT);
  }

  public static DependencyGraph build(Trace trace, Options options) {
    GraphBuilder builder = new GraphBuilder();
    for (Wire wire : trace.wires()) {
      if (isMetadata(wire.id) || (!options.includePhysical && Wire.isPhysical(wire.id))) {
        continue;
      }
      builder.addWire(wire);
    }
    builder.addEntanglement();
    return builder.graph.build();
  }

  /** True for ids that name metadata rather than a wire. */
  public static boolean isMetadata(String id) {
    return id.startsWith("_");
  }

  private void addWire(Wire wire) {
    List<Action> actions = new ArrayList<>(wire.actions);
    actions.sort(WIRE_ORDER);
    Node previous = null;
    for (Action action : actions) {
      Node node = Node.of(wire.id, action);
      graph.addNode(node);
      if (previous != null) {
        if (action.kind == ActionKind.MEASURE) {
          graph.addEdge(previous, node, EdgeKind.MEASUREMENT);
        }
        graph.addEdge(previous, node, EdgeKind.TEMPORAL);
      }
      if (action.kind == ActionKind.MEASURE && action.store != null) {
        addDefinition(node, action.store);
      }
      if (action.kind != ActionKind.MEASURE) {
        groups
            .computeIfAbsent(ImmutableList.of(action.time, action.line), k -> new ArrayList<>())
            .add(Map.entry(node, action.kind));
      }
      previous = node;
    }
  }

  private void addDefinition(Node measurement, String store) {
    Node definition = graph.definitionOf(store);
    if (definition == null) {
      definition = Node.definition(store, measurement.time, measurement.line);
      graph.addNode(definition);
    }
    graph.addEdge(measurement, definition, EdgeKind.QUANTUM_TO_CLASSICAL);
    graph.setDefinition(store, definition);
  }

  private void addEntanglement() {
    for (List<Map.Entry<Node, ActionKind>> group : groups.values()) {
      if (group.size() < 2) {
        continue;
      }
      List<Node> controls = new ArrayList<>();
      List<Node> targets = new ArrayList<>();
      for (Map.Entry<Node, ActionKind> entry : group) {
        ActionKind kind = entry.getValue();
        if (kind == ActionKind.CTRL) {
          controls.add(entry.getKey());
        } else if (kind.isTargetLike()) {
          targets.add(entry.getKey());
        }
      }
      if (!controls.isEmpty() && !targets.isEmpty()) {
        for (Node control : controls) {
          for (Node target : targets) {
            couple(control, target);
          }
        }
      } else {
        for (int i = 0; i < group.size(); i++) {
          for (int j = i + 1; j < group.size(); j++) {
            couple(group.get(i).getKey(), group.get(j).getKey());
          }
        }
      }
    }
  }

  /** Adds entanglement edges both ways between nodes on different wires. */
  private void couple(Node a, Node b) {
    if (a.wire.equals(b.wire)) {
      return;
    }
    graph.addEdge(a, b, EdgeKind.ENTANGLEMENT);
    graph.addEdge(b, a, EdgeKind.ENTANGLEMENT);
  }
}
