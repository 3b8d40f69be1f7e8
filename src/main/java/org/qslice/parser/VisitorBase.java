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

package org.qslice.parser;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * The common superclass of the parse-tree visitors in this package.
 *
 * <p>Every grammar rule that can reach a visitor must have its own visit method; a rule without
 * one fails with an AssertionError instead of quietly returning null, which would otherwise lose a
 * statement or an operand from the program. While a node is visited it is remembered, so the
 * {@code error} methods can report a {@link SyntaxError} at the line of the construct being built.
 */
class VisitorBase<T> extends QasmBaseVisitor<T> {

  /** The node currently being visited. */
  private ParseTree currentNode;

  @Override
  protected final T defaultResult() {
    // Only reached from an inherited visit method, i.e. a rule nobody handles.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Applies {@code visitor} to {@code node} with {@code node} as the current node. A visitor that
   * has thrown is never reused, so the previous node is only restored on normal return.
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  /** The token at which the node being visited starts. */
  Token currentToken() {
    return ((ParserRuleContext) currentNode).start;
  }

  /** Returns a {@link SyntaxError} pointing at the current node. */
  SyntaxError error(String msg) {
    return QasmFrontEnd.error(currentToken(), msg);
  }

  /** Returns a {@link SyntaxError} pointing at the current node. */
  @FormatMethod
  SyntaxError error(String fmt, Object... fmtArgs) {
    return QasmFrontEnd.error(currentToken(), fmt, fmtArgs);
  }
}
