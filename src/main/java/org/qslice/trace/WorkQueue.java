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

package org.qslice.trace;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.qslice.ast.Statement;

/**
 * The pending work of a {@link TraceBuilder}: statements still to be executed, interleaved with
 * markers that pop a scope frame or push and pop a guard condition.
 *
 * <p>Inlining a call, unrolling a loop or entering a conditional block replaces one statement with
 * a batch of items that must all run before anything already queued, so new work is always added
 * as a batch at the front. A marker queued after a batch therefore runs exactly when the batch
 * (and everything the batch itself expands into) has finished.
 */
final class WorkQueue {

  enum Kind {
    STATEMENT,
    PUSH_CONDITION,
    POP_CONDITION,
    POP_SCOPE
  }

  /** One queued unit of work. */
  static final class Item {
    final Kind kind;
    final @Nullable Statement statement;
    final @Nullable String condition;

    private Item(Kind kind, @Nullable Statement statement, @Nullable String condition) {
      this.kind = kind;
      this.statement = statement;
      this.condition = condition;
    }

    @Override
    public String toString() {
      switch (kind) {
        case STATEMENT:
          return String.valueOf(statement);
        case PUSH_CONDITION:
          return "<push-condition " + condition + ">";
        default:
          return "<" + kind.name().toLowerCase().replace('_', '-') + ">";
      }
    }
  }

  static final Item POP_CONDITION = new Item(Kind.POP_CONDITION, null, null);
  static final Item POP_SCOPE = new Item(Kind.POP_SCOPE, null, null);

  static Item statement(Statement statement) {
    return new Item(Kind.STATEMENT, Preconditions.checkNotNull(statement), null);
  }

  static Item pushCondition(String condition) {
    return new Item(Kind.PUSH_CONDITION, null, condition);
  }

  /** Returns an item for each of the given statements, in order. */
  static ImmutableList<Item> statements(List<Statement> statements) {
    return statements.stream().map(WorkQueue::statement).collect(ImmutableList.toImmutableList());
  }

  private final ArrayDeque<Item> items = new ArrayDeque<>();

  /**
   * Adds the given items to the front of the queue, so that the first of them is the next item
   * returned by {@link #poll} and the rest follow in order.
   */
  void pushFront(List<Item> batch) {
    for (int i = batch.size() - 1; i >= 0; i--) {
      items.addFirst(batch.get(i));
    }
  }

  boolean isEmpty() {
    return items.isEmpty();
  }

  /** Removes and returns the first item; the queue must not be empty. */
  Item poll() {
    Item result = items.pollFirst();
    Preconditions.checkState(result != null);
    return result;
  }

  int size() {
    return items.size();
  }
}
