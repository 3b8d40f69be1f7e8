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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.qslice.ast.Expr;
import org.qslice.parser.QasmParser.AdditiveExpressionContext;
import org.qslice.parser.QasmParser.AndExpressionContext;
import org.qslice.parser.QasmParser.BitAndExpressionContext;
import org.qslice.parser.QasmParser.BitOrExpressionContext;
import org.qslice.parser.QasmParser.BitXorExpressionContext;
import org.qslice.parser.QasmParser.CallExpressionContext;
import org.qslice.parser.QasmParser.ComparisonExpressionContext;
import org.qslice.parser.QasmParser.EqualityExpressionContext;
import org.qslice.parser.QasmParser.ExpressionContext;
import org.qslice.parser.QasmParser.ExpressionListContext;
import org.qslice.parser.QasmParser.IdentifierExpressionContext;
import org.qslice.parser.QasmParser.IndexExpressionContext;
import org.qslice.parser.QasmParser.IndexedExpressionContext;
import org.qslice.parser.QasmParser.LiteralExpressionContext;
import org.qslice.parser.QasmParser.MultiplicativeExpressionContext;
import org.qslice.parser.QasmParser.OrExpressionContext;
import org.qslice.parser.QasmParser.ParenExpressionContext;
import org.qslice.parser.QasmParser.PowerExpressionContext;
import org.qslice.parser.QasmParser.ShiftExpressionContext;
import org.qslice.parser.QasmParser.UnaryExpressionContext;

/** Converts expression parse trees into {@link Expr}s. */
class ExpressionBuilder extends VisitorBase<Expr> {

  /** Converts each element of the given list (which may be null) to an Expr. */
  ImmutableList<Expr> visitAll(ExpressionListContext list) {
    if (list == null) {
      return ImmutableList.of();
    }
    return list.expression().stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Expr visitParenExpression(ParenExpressionContext ctx) {
    // Parentheses don't change the interpretation of the parenthesized expression.
    return visit(ctx.expression());
  }

  @Override
  public Expr visitCallExpression(CallExpressionContext ctx) {
    return new Expr.Call(ctx.Identifier().getText(), visitAll(ctx.expressionList()));
  }

  @Override
  public Expr visitIndexedExpression(IndexedExpressionContext ctx) {
    return new Expr.Indexed(ctx.Identifier().getText(), visit(ctx.indexExpression()));
  }

  /** Returns a single index, or a {@link Expr.Range} if the index has two or three parts. */
  @Override
  public Expr visitIndexExpression(IndexExpressionContext ctx) {
    List<ExpressionContext> parts = ctx.expression();
    switch (parts.size()) {
      case 1:
        return visit(parts.get(0));
      case 2:
        return new Expr.Range(visit(parts.get(0)), null, visit(parts.get(1)));
      case 3:
        return new Expr.Range(visit(parts.get(0)), visit(parts.get(1)), visit(parts.get(2)));
      default:
        throw new AssertionError();
    }
  }

  @Override
  public Expr visitUnaryExpression(UnaryExpressionContext ctx) {
    Expr operand = visit(ctx.expression());
    // Fold negative literals so that "-1" prints and compares as a single literal.
    if (ctx.op.getText().equals("-") && operand instanceof Expr.Literal lit) {
      return new Expr.Literal(-lit.value, "-" + lit.text);
    }
    return new Expr.Unary(ctx.op.getText(), operand);
  }

  private Expr binary(ExpressionContext left, String op, ExpressionContext right) {
    return new Expr.Binary(op, visit(left), visit(right));
  }

  @Override
  public Expr visitPowerExpression(PowerExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitMultiplicativeExpression(MultiplicativeExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitAdditiveExpression(AdditiveExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitShiftExpression(ShiftExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitComparisonExpression(ComparisonExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitEqualityExpression(EqualityExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitBitAndExpression(BitAndExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitBitXorExpression(BitXorExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitBitOrExpression(BitOrExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitAndExpression(AndExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitOrExpression(OrExpressionContext ctx) {
    return binary(ctx.expression(0), ctx.op.getText(), ctx.expression(1));
  }

  @Override
  public Expr visitLiteralExpression(LiteralExpressionContext ctx) {
    String text = ctx.getText();
    if (ctx.BooleanLiteral() != null) {
      return new Expr.Literal(text.equals("true") ? 1 : 0, text);
    } else if (ctx.IntegerLiteral() != null) {
      try {
        return new Expr.Literal(Long.parseLong(text.replace("_", "")), text);
      } catch (NumberFormatException e) {
        throw error("Integer literal out of range: %s", text);
      }
    } else {
      return new Expr.Literal(Double.parseDouble(text), text);
    }
  }

  @Override
  public Expr visitIdentifierExpression(IdentifierExpressionContext ctx) {
    return new Expr.Identifier(ctx.getText());
  }
}
