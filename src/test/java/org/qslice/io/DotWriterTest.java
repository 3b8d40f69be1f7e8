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

package org.qslice.io;

import static com.google.common.truth.Truth.assertThat;
import static org.qslice.graph.GraphBuilderTest.BELL;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qslice.graph.DependencyGraph;
import org.qslice.graph.GraphBuilderTest;
import org.qslice.slice.Criterion;
import org.qslice.slice.Direction;
import org.qslice.slice.Slicer;

@RunWith(JUnit4.class)
public class DotWriterTest {

  private final DependencyGraph bell = GraphBuilderTest.graph(BELL);

  @Test
  public void clustersAndEdgeStyles() {
    String dot = new DotWriter().render(bell);
    assertThat(dot).startsWith("digraph QDG {\n  rankdir=LR;\n");
    assertThat(dot).endsWith("}\n");
    assertThat(dot).contains("label=\"a\";");
    assertThat(dot).contains("label=\"c\";");
    assertThat(dot).contains("n4 [shape=ellipse, label=\"def\"];");
    assertThat(dot).contains("n0 -> n1 [style=\"solid\"];");
    assertThat(dot).contains("n1 -> n2 [style=\"dashed\", penwidth=2];");
    assertThat(dot).contains("n2 -> n3 [style=\"dotted\"];");
    assertThat(dot).contains("n3 -> n4 [style=\"bold\"];");
    assertThat(dot).contains("n0 -> n1 [style=invis, weight=10];");
    assertThat(dot).doesNotContain("fillcolor");
  }

  @Test
  public void clustersFollowFirstAppearance() {
    String dot = new DotWriter().render(bell);
    assertThat(dot.indexOf("label=\"a\";")).isLessThan(dot.indexOf("label=\"b\";"));
    assertThat(dot.indexOf("label=\"b\";")).isLessThan(dot.indexOf("label=\"c\";"));
  }

  @Test
  public void highlightsSlice() {
    Criterion criterion = Criterion.builder().wire("a").time(1).build();
    String dot =
        new DotWriter(Slicer.slice(bell, criterion, Direction.BACKWARD), -1).render(bell);
    assertThat(dot)
        .contains("n1 [style=\"filled\", fillcolor=\"lightgray\", label=\"ctrl\"];");
    assertThat(dot).contains("n3 [label=\"measure\"];");
  }

  @Test
  public void limitsNodes() {
    String dot = new DotWriter(null, 2).render(bell);
    assertThat(dot).contains("n0 [");
    assertThat(dot).contains("n1 [");
    assertThat(dot).doesNotContain("n2 [");
    assertThat(dot).doesNotContain("dashed");
  }
}
