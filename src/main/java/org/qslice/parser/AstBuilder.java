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
import org.antlr.v4.runtime.ParserRuleContext;
import org.jspecify.annotations.Nullable;
import org.qslice.ast.Expr;
import org.qslice.ast.Modifier;
import org.qslice.ast.Operand;
import org.qslice.ast.Parameter;
import org.qslice.ast.Statement;
import org.qslice.parser.QasmParser.AliasDeclarationContext;
import org.qslice.parser.QasmParser.ArgumentDefinitionContext;
import org.qslice.parser.QasmParser.AssignmentStatementContext;
import org.qslice.parser.QasmParser.BarrierStatementContext;
import org.qslice.parser.QasmParser.BoxStatementContext;
import org.qslice.parser.QasmParser.ClassicalArgumentContext;
import org.qslice.parser.QasmParser.ClassicalDeclarationContext;
import org.qslice.parser.QasmParser.ConstDeclarationContext;
import org.qslice.parser.QasmParser.DesignatorContext;
import org.qslice.parser.QasmParser.ForStatementContext;
import org.qslice.parser.QasmParser.FunctionDefinitionContext;
import org.qslice.parser.QasmParser.GateCallStatementContext;
import org.qslice.parser.QasmParser.GateDefinitionContext;
import org.qslice.parser.QasmParser.GateModifierContext;
import org.qslice.parser.QasmParser.GateOperandContext;
import org.qslice.parser.QasmParser.GateOperandListContext;
import org.qslice.parser.QasmParser.IdentifierListContext;
import org.qslice.parser.QasmParser.IfStatementContext;
import org.qslice.parser.QasmParser.IncludeStatementContext;
import org.qslice.parser.QasmParser.MeasureStatementContext;
import org.qslice.parser.QasmParser.ProgramContext;
import org.qslice.parser.QasmParser.QregArgumentContext;
import org.qslice.parser.QasmParser.QubitArgumentContext;
import org.qslice.parser.QasmParser.QubitDeclarationContext;
import org.qslice.parser.QasmParser.RangeSourceContext;
import org.qslice.parser.QasmParser.RegisterDeclarationContext;
import org.qslice.parser.QasmParser.ResetStatementContext;
import org.qslice.parser.QasmParser.ReturnStatementContext;
import org.qslice.parser.QasmParser.ScopeContext;
import org.qslice.parser.QasmParser.SetSourceContext;
import org.qslice.parser.QasmParser.StatementContext;
import org.qslice.parser.QasmParser.StatementOrScopeContext;

/**
 * Converts a program parse tree into {@link Statement}s. Each visit method returns the statements
 * produced by one parse node: usually one, none for constructs that have no effect on qubits
 * (includes, classical assignments), and two for a declaration initialized by a measurement.
 */
class AstBuilder extends VisitorBase<ImmutableList<Statement>> {
  private final ExpressionBuilder exprs = new ExpressionBuilder();

  private static int line(ParserRuleContext ctx) {
    return ctx.start.getLine();
  }

  private ImmutableList<Statement> visitEach(List<? extends ParserRuleContext> nodes) {
    ImmutableList.Builder<Statement> result = ImmutableList.builder();
    nodes.forEach(node -> result.addAll(visit(node)));
    return result.build();
  }

  @Override
  public ImmutableList<Statement> visitProgram(ProgramContext ctx) {
    return visitEach(ctx.statement());
  }

  @Override
  public ImmutableList<Statement> visitStatement(StatementContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public ImmutableList<Statement> visitScope(ScopeContext ctx) {
    return visitEach(ctx.statement());
  }

  @Override
  public ImmutableList<Statement> visitStatementOrScope(StatementOrScopeContext ctx) {
    return (ctx.scope() != null) ? visit(ctx.scope()) : visit(ctx.statement());
  }

  @Override
  public ImmutableList<Statement> visitIncludeStatement(IncludeStatementContext ctx) {
    // The built-in gate table stands in for the standard include files.
    return ImmutableList.of();
  }

  private @Nullable Expr size(DesignatorContext designator) {
    return (designator == null) ? null : exprs.visit(designator.expression());
  }

  @Override
  public ImmutableList<Statement> visitQubitDeclaration(QubitDeclarationContext ctx) {
    return ImmutableList.of(
        new Statement.QubitDeclaration(
            line(ctx), ctx.Identifier().getText(), size(ctx.designator())));
  }

  @Override
  public ImmutableList<Statement> visitRegisterDeclaration(RegisterDeclarationContext ctx) {
    String name = ctx.Identifier().getText();
    Expr size = size(ctx.designator());
    if (ctx.kind.getType() == QasmParser.QREG) {
      return ImmutableList.of(new Statement.QubitDeclaration(line(ctx), name, size));
    }
    String type = (size == null) ? "bit" : "bit[" + size + "]";
    return ImmutableList.of(new Statement.ClassicalDeclaration(line(ctx), type, name, null));
  }

  @Override
  public ImmutableList<Statement> visitConstDeclaration(ConstDeclarationContext ctx) {
    return ImmutableList.of(
        new Statement.ConstDeclaration(
            line(ctx), ctx.Identifier().getText(), exprs.visit(ctx.expression())));
  }

  @Override
  public ImmutableList<Statement> visitClassicalDeclaration(ClassicalDeclarationContext ctx) {
    String type = ctx.scalarType().getText();
    String name = ctx.Identifier().getText();
    if (ctx.MEASURE() != null) {
      // "bit c = measure q;" declares c and then measures into it.
      return ImmutableList.of(
          new Statement.ClassicalDeclaration(line(ctx), type, name, null),
          new Statement.MeasureAssign(
              line(ctx), Operand.named(name), operand(ctx.gateOperand())));
    }
    Expr init = (ctx.expression() == null) ? null : exprs.visit(ctx.expression());
    return ImmutableList.of(new Statement.ClassicalDeclaration(line(ctx), type, name, init));
  }

  @Override
  public ImmutableList<Statement> visitAliasDeclaration(AliasDeclarationContext ctx) {
    return ImmutableList.of(
        new Statement.AliasDeclaration(
            line(ctx), ctx.Identifier().getText(), operand(ctx.gateOperand())));
  }

  private static ImmutableList<String> names(IdentifierListContext list) {
    return list.Identifier().stream()
        .map(id -> id.getText())
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public ImmutableList<Statement> visitGateDefinition(GateDefinitionContext ctx) {
    // The qubit list is always the last identifierList; if there are two, the first one holds
    // the classical parameters.
    List<IdentifierListContext> lists = ctx.identifierList();
    ImmutableList<String> qubits = names(lists.get(lists.size() - 1));
    ImmutableList<String> params = (lists.size() == 2) ? names(lists.get(0)) : ImmutableList.of();
    return ImmutableList.of(
        new Statement.GateDefinition(
            line(ctx), ctx.Identifier().getText(), params, qubits, visit(ctx.scope())));
  }

  @Override
  public ImmutableList<Statement> visitFunctionDefinition(FunctionDefinitionContext ctx) {
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    for (ArgumentDefinitionContext arg : ctx.argumentDefinition()) {
      if (arg instanceof QubitArgumentContext qubit) {
        params.add(
            new Parameter(qubit.Identifier().getText(), true, size(qubit.designator())));
      } else if (arg instanceof QregArgumentContext qreg) {
        params.add(new Parameter(qreg.Identifier().getText(), true, size(qreg.designator())));
      } else {
        params.add(
            new Parameter(((ClassicalArgumentContext) arg).Identifier().getText(), false, null));
      }
    }
    return ImmutableList.of(
        new Statement.FunctionDefinition(
            line(ctx), ctx.Identifier().getText(), params.build(), visit(ctx.scope())));
  }

  @Override
  public ImmutableList<Statement> visitResetStatement(ResetStatementContext ctx) {
    return ImmutableList.of(new Statement.Reset(line(ctx), operand(ctx.gateOperand())));
  }

  @Override
  public ImmutableList<Statement> visitMeasureStatement(MeasureStatementContext ctx) {
    List<GateOperandContext> operands = ctx.gateOperand();
    Operand store = (operands.size() > 1) ? operand(operands.get(1)) : null;
    return ImmutableList.of(new Statement.Measure(line(ctx), operand(operands.get(0)), store));
  }

  @Override
  public ImmutableList<Statement> visitAssignmentStatement(AssignmentStatementContext ctx) {
    if (ctx.MEASURE() == null) {
      // Purely classical; nothing to trace.
      return ImmutableList.of();
    }
    return ImmutableList.of(
        new Statement.MeasureAssign(
            line(ctx), operand(ctx.gateOperand(0)), operand(ctx.gateOperand(1))));
  }

  @Override
  public ImmutableList<Statement> visitGateCallStatement(GateCallStatementContext ctx) {
    ImmutableList.Builder<Modifier> modifiers = ImmutableList.builder();
    for (GateModifierContext modifier : ctx.gateModifier()) {
      Expr argument = (modifier.expression() == null) ? null : exprs.visit(modifier.expression());
      modifiers.add(new Modifier(modifier.Identifier().getText(), argument));
    }
    return ImmutableList.of(
        new Statement.GateCall(
            line(ctx),
            ctx.Identifier().getText(),
            modifiers.build(),
            exprs.visitAll(ctx.expressionList()),
            operands(ctx.gateOperandList())));
  }

  @Override
  public ImmutableList<Statement> visitIfStatement(IfStatementContext ctx) {
    ImmutableList<Statement> elseBody =
        (ctx.elseBody == null) ? ImmutableList.of() : visit(ctx.elseBody);
    return ImmutableList.of(
        new Statement.If(
            line(ctx), exprs.visit(ctx.expression()), visit(ctx.thenBody), elseBody));
  }

  @Override
  public ImmutableList<Statement> visitForStatement(ForStatementContext ctx) {
    String variable = ctx.Identifier().getText();
    ImmutableList<Statement> body = visit(ctx.statementOrScope());
    if (ctx.forSource() instanceof RangeSourceContext rangeSource) {
      Expr range = exprs.visit(rangeSource.indexExpression());
      if (!(range instanceof Expr.Range)) {
        throw error("Loop range must have the form [start:stop] or [start:step:stop]");
      }
      return ImmutableList.of(
          new Statement.For(line(ctx), variable, (Expr.Range) range, ImmutableList.of(), body));
    }
    ImmutableList<Expr> values =
        ((SetSourceContext) ctx.forSource())
            .expression().stream().map(exprs::visit).collect(ImmutableList.toImmutableList());
    return ImmutableList.of(new Statement.For(line(ctx), variable, null, values, body));
  }

  @Override
  public ImmutableList<Statement> visitBoxStatement(BoxStatementContext ctx) {
    return ImmutableList.of(new Statement.Box(line(ctx), visit(ctx.scope())));
  }

  @Override
  public ImmutableList<Statement> visitBarrierStatement(BarrierStatementContext ctx) {
    return ImmutableList.of(new Statement.Barrier(line(ctx), operands(ctx.gateOperandList())));
  }

  @Override
  public ImmutableList<Statement> visitReturnStatement(ReturnStatementContext ctx) {
    if (ctx.MEASURE() == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(new Statement.Measure(line(ctx), operand(ctx.gateOperand()), null));
  }

  private Operand operand(GateOperandContext ctx) {
    if (ctx.HardwareQubit() != null) {
      return Operand.named(ctx.HardwareQubit().getText());
    }
    Expr index = (ctx.indexExpression() == null) ? null : exprs.visit(ctx.indexExpression());
    return new Operand(ctx.Identifier().getText(), index);
  }

  private ImmutableList<Operand> operands(GateOperandListContext list) {
    if (list == null) {
      return ImmutableList.of();
    }
    return list.gateOperand().stream().map(this::operand).collect(ImmutableList.toImmutableList());
  }
}
