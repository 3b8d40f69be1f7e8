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
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.qslice.ast.Expr;
import org.qslice.ast.Modifier;
import org.qslice.ast.Operand;
import org.qslice.ast.Parameter;
import org.qslice.ast.Program;
import org.qslice.ast.Statement;
import org.qslice.trace.CallableTable.Callable;

/**
 * Symbolically executes a {@link Program} and records, for each wire, the sequence of Actions
 * applied to it.
 *
 * <p>Statements are taken one at a time from a {@link WorkQueue}. Anything that expands into
 * other statements (a call of a user-defined gate or function, a loop, a conditional block, an
 * operation broadcast over a register) pushes its expansion onto the front of the queue together
 * with the markers that undo its scope or condition, so expansion is depth-first and no recursion
 * is needed.
 *
 * <p>Every construct that records Actions first allocates a new logical time, and all of its
 * Actions share that time. Gate modifiers allocate the call's time before the gate is dispatched.
 *
 * <p>Any {@link org.qslice.AnalysisError} aborts the build.
 */
public final class TraceBuilder implements Statement.Visitor<Void>, Timeline {

  /** Settings for a trace build. */
  public static final class Options {
    public static final Options DEFAULT = new Options(6);

    /**
     * The number of physical wires ({@code $0}, {@code $1}, ...) registered before the program
     * starts. Physical wires beyond these are registered when first used.
     */
    public final int physicalWires;

    private Options(int physicalWires) {
      Preconditions.checkArgument(physicalWires >= 0);
      this.physicalWires = physicalWires;
    }

    public static Options withPhysicalWires(int physicalWires) {
      return new Options(physicalWires);
    }
  }

  /** Builds the trace of the given program with the default options. */
  public static Trace build(Program program) {
    return build(program, Options.DEFAULT);
  }

  public static Trace build(Program program, Options options) {
    TraceBuilder builder = new TraceBuilder(options);
    builder.run(program.statements);
    return builder.finish(program.source);
  }

  /** A wire under construction. */
  private static final class WireRecord {
    final String id;
    final WireKind kind;
    final int index;

    /** The position of this wire in registration order. */
    final int order;

    final List<Action> actions = new ArrayList<>();

    WireRecord(String id, WireKind kind, int index, int order) {
      this.id = id;
      this.kind = kind;
      this.index = index;
      this.order = order;
    }
  }

  /** A resolved qubit argument: the wire, and the argument as it was written. */
  private record QubitArg(String wire, String localName) {}

  private final ConstantEvaluator constants = new ConstantEvaluator();
  private final CallableTable callables = new CallableTable();
  private final WorkQueue queue = new WorkQueue();

  /** The top of the stack is the frame in effect. */
  private final ArrayDeque<ScopeFrame> frames = new ArrayDeque<>();

  /** The guards in effect, innermost first. */
  private final ArrayDeque<String> conditions = new ArrayDeque<>();

  private final Map<String, WireRecord> wires = new LinkedHashMap<>();

  /** The size of each declared register. */
  private final Map<String, Integer> registerSizes = new HashMap<>();

  /** Every recorded Action, keyed by time. */
  private final ListMultimap<Integer, Entry> recorded = ArrayListMultimap.create();

  private int nextTime;

  private TraceBuilder(Options options) {
    frames.push(ScopeFrame.EMPTY);
    for (int i = 0; i < options.physicalWires; i++) {
      addWire("$" + i, WireKind.PHYSICAL, -1, 0);
    }
  }

  private void run(List<Statement> statements) {
    queue.pushFront(WorkQueue.statements(statements));
    while (!queue.isEmpty()) {
      WorkQueue.Item item = queue.poll();
      switch (item.kind) {
        case STATEMENT -> item.statement.accept(this);
        case PUSH_CONDITION -> conditions.push(item.condition);
        case POP_CONDITION -> conditions.pop();
        case POP_SCOPE -> frames.pop();
      }
    }
    Preconditions.checkState(frames.size() == 1 && conditions.isEmpty());
  }

  private Trace finish(String source) {
    ImmutableList<Wire> result =
        wires.values().stream()
            .map(w -> new Wire(w.id, w.kind, w.index, ImmutableList.copyOf(w.actions)))
            .collect(ImmutableList.toImmutableList());
    return new Trace(source, result);
  }

  @Override
  public List<Entry> at(int time) {
    List<Entry> entries = recorded.get(time);
    if (entries.size() < 2) {
      return entries;
    }
    List<Entry> sorted = new ArrayList<>(entries);
    // List.sort is stable, so Actions on the same wire stay in recording order.
    sorted.sort(Comparator.comparingInt(e -> wires.get(e.wire()).order));
    return sorted;
  }

  private int newTime() {
    return nextTime++;
  }

  private void addWire(String id, WireKind kind, int index, int line) {
    if (wires.containsKey(id)) {
      throw DeclarationError.of(line, "Qubit '%s' is already declared", id);
    }
    wires.put(id, new WireRecord(id, kind, index, wires.size()));
  }

  /** Appends an Action to a wire, attaching the conditions currently in effect. */
  private void record(String wire, Action.Builder builder) {
    String condition = conditions.isEmpty() ? null : String.join(",", conditions);
    Action action = builder.condition(condition).build();
    wires.get(wire).actions.add(action);
    recorded.put(action.time, new Entry(wire, action));
  }

  private ScopeFrame frame() {
    return frames.peek();
  }

  private void replaceFrame(ScopeFrame frame) {
    frames.pop();
    frames.push(frame);
  }

  // Resolving operands

  /** Returns the operand's name, followed by its index folded to an integer if possible. */
  private String key(Operand operand) {
    if (operand.index == null) {
      return operand.name;
    }
    OptionalLong index = constants.tryEvaluateInt(operand.index);
    String indexText =
        index.isPresent() ? Long.toString(index.getAsLong()) : operand.index.toString();
    return operand.name + "[" + indexText + "]";
  }

  /**
   * Returns the name that {@code operand} stands for in the current scope: the binding of the
   * operand itself if there is one; otherwise, for an indexed operand, the binding of its base
   * name re-indexed; otherwise the operand as written. The result isn't necessarily a wire.
   */
  private String resolve(Operand operand) {
    String key = key(operand);
    String result = frame().lookup(key);
    if (result == null && operand.index != null) {
      String base = frame().lookup(operand.name);
      if (base != null) {
        result = base + key.substring(operand.name.length());
      }
    }
    if (result == null) {
      result = key;
    }
    if (Wire.isPhysical(result) && !wires.containsKey(result)) {
      addWire(result, WireKind.PHYSICAL, -1, 0);
    }
    return result;
  }

  /** Resolves an operand that must denote a single wire. */
  private QubitArg single(Operand operand, int line) {
    String wire = resolve(operand);
    if (!wires.containsKey(wire)) {
      throw DeclarationError.undeclared(wire, line);
    }
    return new QubitArg(wire, operand.toString());
  }

  /**
   * If {@code operand} denotes several wires (a range, a whole register, or a name bound element
   * by element), returns how many; otherwise returns -1.
   */
  private int aggregateSize(Operand operand, int line) {
    if (operand.index instanceof Expr.Range range) {
      return rangeValues(range, line).size();
    } else if (operand.index != null) {
      return -1;
    }
    Integer aliasSize = frame().aliasSize(operand.name);
    if (aliasSize != null) {
      return aliasSize;
    }
    String resolved = resolve(operand);
    Integer registerSize = wires.containsKey(resolved) ? null : registerSizes.get(resolved);
    return (registerSize == null) ? -1 : registerSize;
  }

  /** Returns the operand for the {@code i}th element of an aggregate operand. */
  private Operand element(Operand operand, int i, int line) {
    if (operand.index instanceof Expr.Range range) {
      return operand.withIndex(Expr.of(rangeValues(range, line).get(i)));
    }
    return operand.withIndex(Expr.of(i));
  }

  /** Returns the index of the {@code i}th element of an aggregate operand. */
  private long elementIndex(Operand operand, int i, int line) {
    if (operand.index instanceof Expr.Range range) {
      return rangeValues(range, line).get(i);
    }
    return i;
  }

  /** Resolves an operand to all of the wires it denotes. */
  private ImmutableList<QubitArg> expand(Operand operand, int line) {
    int size = aggregateSize(operand, line);
    if (size < 0) {
      return ImmutableList.of(single(operand, line));
    }
    ImmutableList.Builder<QubitArg> result = ImmutableList.builder();
    for (int i = 0; i < size; i++) {
      result.add(single(element(operand, i, line), line));
    }
    return result.build();
  }

  /** Returns the values of an inclusive range, which must have constant bounds. */
  private ImmutableList<Long> rangeValues(Expr.Range range, int line) {
    long start = foldInt(range.start, line);
    long step = (range.step == null) ? 1 : foldInt(range.step, line);
    long stop = foldInt(range.stop, line);
    if (step == 0) {
      throw DeclarationError.of(line, "Range '%s' has a step of zero", range);
    }
    ImmutableList.Builder<Long> result = ImmutableList.builder();
    for (long v = start; (step > 0) ? v <= stop : v >= stop; v += step) {
      result.add(v);
    }
    return result.build();
  }

  private long foldInt(Expr expr, int line) {
    OptionalLong value = constants.tryEvaluateInt(expr);
    if (value.isEmpty()) {
      throw DeclarationError.of(line, "'%s' is not an integer constant", expr);
    }
    return value.getAsLong();
  }

  // Declarations and definitions

  private void checkNotDeclared(String name, int line) {
    if (wires.containsKey(name) || registerSizes.containsKey(name)) {
      throw DeclarationError.of(line, "Qubit '%s' is already declared", name);
    }
  }

  @Override
  public Void visitQubitDeclaration(Statement.QubitDeclaration stmt) {
    checkNotDeclared(stmt.name, stmt.line);
    if (stmt.size == null) {
      addWire(stmt.name, WireKind.NAMED, -1, stmt.line);
      return null;
    }
    long size = foldInt(stmt.size, stmt.line);
    if (size < 1 || size > Integer.MAX_VALUE) {
      throw DeclarationError.of(stmt.line, "Register '%s' has invalid size %s", stmt.name, size);
    }
    registerSizes.put(stmt.name, (int) size);
    for (int i = 0; i < size; i++) {
      addWire(stmt.name + "[" + i + "]", WireKind.ARRAY, i, stmt.line);
    }
    return null;
  }

  @Override
  public Void visitConstDeclaration(Statement.ConstDeclaration stmt) {
    OptionalDouble value = constants.tryEvaluate(stmt.value);
    if (value.isEmpty()) {
      throw DeclarationError.of(
          stmt.line, "Constant '%s' has a non-constant value '%s'", stmt.name, stmt.value);
    }
    constants.define(stmt.name, value.getAsDouble());
    return null;
  }

  @Override
  public Void visitClassicalDeclaration(Statement.ClassicalDeclaration stmt) {
    return null;
  }

  @Override
  public Void visitAliasDeclaration(Statement.AliasDeclaration stmt) {
    Operand target = stmt.target;
    if (aggregateSize(target, stmt.line) < 0) {
      String resolved = resolve(target);
      if (!wires.containsKey(resolved) && !registerSizes.containsKey(resolved)) {
        throw DeclarationError.undeclared(resolved, stmt.line);
      }
      replaceFrame(frame().extend(ImmutableMap.of(stmt.name, resolved), ImmutableMap.of()));
      return null;
    }
    // A range or an element-wise alias: bind each element.
    ImmutableList<QubitArg> elements = expand(target, stmt.line);
    Map<String, String> bindings = new LinkedHashMap<>();
    for (int i = 0; i < elements.size(); i++) {
      bindings.put(stmt.name + "[" + i + "]", elements.get(i).wire());
    }
    replaceFrame(frame().extend(bindings, ImmutableMap.of(stmt.name, elements.size())));
    return null;
  }

  @Override
  public Void visitGateDefinition(Statement.GateDefinition stmt) {
    callables.define(Callable.of(stmt));
    return null;
  }

  @Override
  public Void visitFunctionDefinition(Statement.FunctionDefinition stmt) {
    callables.define(Callable.of(stmt));
    return null;
  }

  // Operations

  @Override
  public Void visitReset(Statement.Reset stmt) {
    ImmutableList<QubitArg> targets = expand(stmt.target, stmt.line);
    int time = newTime();
    targets.forEach(t -> record(t.wire(), Action.builder(ActionKind.RESET, time, stmt.line)));
    return null;
  }

  @Override
  public Void visitGateCall(Statement.GateCall call) {
    // Built-in gates can't be redefined.
    BuiltinGate builtin = BuiltinGate.lookup(call.name);
    Callable callable = (builtin == null) ? callables.get(call.name) : null;
    boolean isFunction = (callable != null && callable.isFunction);
    ImmutableList<Operand> operands;
    ImmutableList<Expr> classicalArgs;
    if (isFunction && call.qubits.isEmpty()) {
      // f(q[0], 2): the qubit arguments are the ones at the qubit parameters' positions.
      if (call.params.size() != callable.params.size()) {
        throw UnresolvedCallableError.wrongArgumentCount(
            call.name, callable.params.size(), call.params.size(), call.line);
      }
      ImmutableList.Builder<Operand> qubits = ImmutableList.builder();
      ImmutableList.Builder<Expr> classical = ImmutableList.builder();
      for (int i = 0; i < call.params.size(); i++) {
        Expr arg = call.params.get(i);
        if (callable.params.get(i).isQubit) {
          qubits.add(asOperand(arg, call.line));
        } else {
          classical.add(arg);
        }
      }
      operands = qubits.build();
      classicalArgs = classical.build();
    } else {
      operands = call.qubits;
      classicalArgs = call.params;
    }
    if (operands.isEmpty()) {
      return null;
    }
    if (builtin == null && callable == null) {
      throw UnresolvedCallableError.unknown(call.name, call.line);
    }
    if (!isFunction && broadcast(call, operands)) {
      return null;
    }
    int time = -1;
    int controls = 0;
    if (!call.modifiers.isEmpty()) {
      time = newTime();
      for (Modifier modifier : call.modifiers) {
        switch (modifier.name) {
          case "ctrl", "negctrl" -> {
            int count = controlCount(modifier, call.line);
            if (controls + count > operands.size()) {
              throw new MalformedModifierError(
                  String.format(
                      "'%s' needs %s control qubit(s) but only %s argument(s) remain",
                      modifier, count, operands.size() - controls),
                  call.line);
            }
            for (int i = 0; i < count; i++) {
              QubitArg control = single(operands.get(controls++), call.line);
              recordControl(control, time, call.line);
            }
          }
          case "inv", "pow" -> {}
          default ->
              throw new MalformedModifierError(
                  String.format("Unknown gate modifier '%s'", modifier.name), call.line);
        }
      }
    }
    List<Operand> targets = operands.subList(controls, operands.size());
    if (builtin != null) {
      if (targets.size() != builtin.arity) {
        throw UnresolvedCallableError.wrongArity(
            call.name, builtin.arity, targets.size(), call.line);
      }
      ImmutableList<QubitArg> args =
          targets.stream().map(o -> single(o, call.line)).collect(ImmutableList.toImmutableList());
      applyBuiltin(builtin, call.name, args, (time < 0) ? newTime() : time, call.line);
    } else {
      inline(callable, targets, classicalArgs, call.line);
    }
    return null;
  }

  /** Converts a positional argument of a function call to the qubit operand it names. */
  private static Operand asOperand(Expr arg, int line) {
    if (arg instanceof Expr.Identifier id) {
      return Operand.named(id.name);
    } else if (arg instanceof Expr.Indexed indexed) {
      return new Operand(indexed.name, indexed.index);
    }
    throw DeclarationError.of(line, "'%s' is not a qubit", arg);
  }

  private int controlCount(Modifier modifier, int line) {
    if (modifier.argument == null) {
      return 1;
    }
    OptionalLong count = constants.tryEvaluateInt(modifier.argument);
    if (count.isEmpty() || count.getAsLong() < 1 || count.getAsLong() > Integer.MAX_VALUE) {
      throw new MalformedModifierError(
          String.format("Control count '%s' is not a positive integer", modifier.argument), line);
    }
    return (int) count.getAsLong();
  }

  /**
   * If any operand of a gate call denotes a whole register (or range), queues one copy of the
   * call per element in its place and returns true. All such operands must have the same size.
   */
  private boolean broadcast(Statement.GateCall call, List<Operand> operands) {
    int size = -1;
    String sizedBy = null;
    boolean[] aggregate = new boolean[operands.size()];
    for (int i = 0; i < operands.size(); i++) {
      Operand operand = operands.get(i);
      int operandSize = aggregateSize(operand, call.line);
      if (operandSize < 0) {
        continue;
      }
      aggregate[i] = true;
      if (size < 0) {
        size = operandSize;
        sizedBy = operand.toString();
      } else if (operandSize != size) {
        throw new SizeMismatchError(sizedBy, size, operand.toString(), operandSize, call.line);
      }
    }
    if (size < 0) {
      return false;
    }
    List<WorkQueue.Item> copies = new ArrayList<>(size);
    for (int k = 0; k < size; k++) {
      ImmutableList.Builder<Operand> qubits = ImmutableList.builder();
      for (int i = 0; i < operands.size(); i++) {
        Operand operand = operands.get(i);
        qubits.add(aggregate[i] ? element(operand, k, call.line) : operand);
      }
      copies.add(WorkQueue.statement(call.withQubits(qubits.build())));
    }
    queue.pushFront(copies);
    return true;
  }

  private void recordControl(QubitArg arg, int time, int line) {
    record(arg.wire(), Action.builder(ActionKind.CTRL, time, line).localName(arg.localName()));
  }

  private void recordGate(
      ActionKind kind,
      String gate,
      QubitArg arg,
      @Nullable QubitArg partner,
      ImmutableList<String> lineage,
      int time,
      int line) {
    record(
        arg.wire(),
        Action.builder(kind, time, line)
            .gate(gate)
            .pairedWire((partner == null) ? null : partner.wire())
            .lineage(lineage)
            .localName(arg.localName()));
  }

  /**
   * Records the Actions of a built-in gate. Controls are recorded first; the lineage is resolved
   * once all controls are in place and before any target is recorded, so every target of the
   * application gets the same lineage.
   *
   * @throws DeclarationError if a wire is passed more than once
   */
  private void applyBuiltin(
      BuiltinGate group, String gate, List<QubitArg> args, int time, int line) {
    Set<String> seen = new HashSet<>();
    for (QubitArg arg : args) {
      if (!seen.add(arg.wire())) {
        throw DeclarationError.of(
            line, "Qubit '%s' is passed to %s more than once", arg.wire(), gate);
      }
    }
    switch (group) {
      case UNITARY -> {
        ImmutableList<String> lineage = ControlLineage.resolve(this, time);
        recordGate(ActionKind.GATE_CALL, gate, args.get(0), null, lineage, time, line);
      }
      case CONTROLLED -> {
        recordControl(args.get(0), time, line);
        ImmutableList<String> lineage = ControlLineage.resolve(this, time);
        recordGate(ActionKind.CTRL_GATE_CALL, gate, args.get(1), null, lineage, time, line);
      }
      case SWAP -> {
        ImmutableList<String> lineage = ControlLineage.resolve(this, time);
        recordGate(ActionKind.GATE_CALL, gate, args.get(0), args.get(1), lineage, time, line);
        recordGate(ActionKind.GATE_CALL, gate, args.get(1), args.get(0), lineage, time, line);
      }
      case CCX -> {
        recordControl(args.get(0), time, line);
        recordControl(args.get(1), time, line);
        ImmutableList<String> lineage = ControlLineage.resolve(this, time);
        recordGate(ActionKind.CTRL_GATE_CALL, gate, args.get(2), null, lineage, time, line);
      }
      case CSWAP -> {
        recordControl(args.get(0), time, line);
        ImmutableList<String> lineage = ControlLineage.resolve(this, time);
        recordGate(ActionKind.CTRL_GATE_CALL, gate, args.get(1), args.get(2), lineage, time, line);
        recordGate(ActionKind.CTRL_GATE_CALL, gate, args.get(2), args.get(1), lineage, time, line);
      }
    }
  }

  /**
   * Queues the body of a user-defined gate or function, in a new frame that binds its qubit
   * parameters to the given operands, followed by a marker that restores the caller's frame.
   * Classical arguments are substituted into the body.
   */
  private void inline(
      Callable callable, List<Operand> targets, List<Expr> classicalArgs, int line) {
    ImmutableList<Parameter> qubitParams = callable.qubitParams();
    if (targets.size() != qubitParams.size()) {
      throw UnresolvedCallableError.wrongArity(
          callable.name, qubitParams.size(), targets.size(), line);
    }
    Map<String, String> bindings = new LinkedHashMap<>();
    Map<String, Integer> aliasSizes = new HashMap<>();
    for (int i = 0; i < targets.size(); i++) {
      bindParameter(qubitParams.get(i), targets.get(i), bindings, aliasSizes, line);
    }
    ImmutableList<Parameter> classicalParams = callable.classicalParams();
    ImmutableMap.Builder<String, Expr> values = ImmutableMap.builder();
    for (int i = 0; i < Math.min(classicalParams.size(), classicalArgs.size()); i++) {
      values.put(classicalParams.get(i).name, classicalArgs.get(i));
    }
    ImmutableList<Statement> body =
        new Substitution(values.buildKeepingLast(), constants).applyAll(callable.body);
    frames.push(frame().extend(bindings, aliasSizes));
    queue.pushFront(
        ImmutableList.<WorkQueue.Item>builder()
            .addAll(WorkQueue.statements(body))
            .add(WorkQueue.POP_SCOPE)
            .build());
  }

  private void bindParameter(
      Parameter param,
      Operand actual,
      Map<String, String> bindings,
      Map<String, Integer> aliasSizes,
      int line) {
    int size = aggregateSize(actual, line);
    if (size < 0) {
      bindings.put(param.name, single(actual, line).wire());
      return;
    }
    if (param.size != null) {
      OptionalLong declared = constants.tryEvaluateInt(param.size);
      if (declared.isPresent() && declared.getAsLong() != size) {
        throw new SizeMismatchError(
            param.name, (int) declared.getAsLong(), actual.toString(), size, line);
      }
    }
    ImmutableList<QubitArg> elements = expand(actual, line);
    for (int i = 0; i < elements.size(); i++) {
      bindings.put(param.name + "[" + i + "]", elements.get(i).wire());
    }
    aliasSizes.put(param.name, size);
  }

  @Override
  public Void visitMeasureAssign(Statement.MeasureAssign stmt) {
    measure(stmt.target, stmt.store, stmt.line);
    return null;
  }

  @Override
  public Void visitMeasure(Statement.Measure stmt) {
    measure(stmt.target, stmt.store, stmt.line);
    return null;
  }

  /**
   * Records one measure Action per wire of {@code target}, all at one new time. A range store
   * must have as many elements as the target; an unindexed store is indexed like the target when
   * the target has several elements.
   */
  private void measure(Operand target, @Nullable Operand store, int line) {
    ImmutableList<QubitArg> sources = expand(target, line);
    boolean isAggregate = aggregateSize(target, line) >= 0;
    List<String> stores = new ArrayList<>(sources.size());
    if (store == null) {
      sources.forEach(s -> stores.add(null));
    } else if (store.index instanceof Expr.Range range) {
      ImmutableList<Long> indices = rangeValues(range, line);
      if (indices.size() != sources.size()) {
        throw new SizeMismatchError(
            target.toString(), sources.size(), store.toString(), indices.size(), line);
      }
      indices.forEach(i -> stores.add(store.name + "[" + i + "]"));
    } else if (store.index != null) {
      if (isAggregate) {
        throw DeclarationError.of(
            line, "Cannot store %s measurements in the single bit '%s'", sources.size(), store);
      }
      stores.add(key(store));
    } else if (!isAggregate) {
      stores.add(store.name);
    } else {
      for (int i = 0; i < sources.size(); i++) {
        stores.add(store.name + "[" + elementIndex(target, i, line) + "]");
      }
    }
    int time = newTime();
    for (int i = 0; i < sources.size(); i++) {
      record(
          sources.get(i).wire(),
          Action.builder(ActionKind.MEASURE, time, line).store(stores.get(i)));
    }
  }

  @Override
  public Void visitBarrier(Statement.Barrier stmt) {
    Set<String> targets = new LinkedHashSet<>();
    if (stmt.targets.isEmpty()) {
      // Every wire except physical ones that haven't been used.
      wires.values().stream()
          .filter(w -> w.kind != WireKind.PHYSICAL || !w.actions.isEmpty())
          .forEach(w -> targets.add(w.id));
    } else {
      int size = -1;
      String sizedBy = null;
      for (Operand operand : stmt.targets) {
        int operandSize = aggregateSize(operand, stmt.line);
        if (operandSize >= 0) {
          if (size < 0) {
            size = operandSize;
            sizedBy = operand.toString();
          } else if (operandSize != size) {
            throw new SizeMismatchError(
                sizedBy, size, operand.toString(), operandSize, stmt.line);
          }
        }
        expand(operand, stmt.line).forEach(a -> targets.add(a.wire()));
      }
    }
    int time = newTime();
    targets.forEach(w -> record(w, Action.builder(ActionKind.BARRIER, time, stmt.line)));
    return null;
  }

  // Compound statements

  @Override
  public Void visitIf(Statement.If stmt) {
    String condition = stmt.condition.toString();
    List<WorkQueue.Item> items = new ArrayList<>();
    items.add(WorkQueue.pushCondition(condition));
    items.addAll(WorkQueue.statements(stmt.body));
    items.add(WorkQueue.POP_CONDITION);
    if (!stmt.elseBody.isEmpty()) {
      items.add(WorkQueue.pushCondition("!(" + condition + ")"));
      items.addAll(WorkQueue.statements(stmt.elseBody));
      items.add(WorkQueue.POP_CONDITION);
    }
    queue.pushFront(items);
    return null;
  }

  @Override
  public Void visitFor(Statement.For stmt) {
    ImmutableList<Expr> values;
    if (stmt.range != null) {
      values =
          rangeValues(stmt.range, stmt.line).stream()
              .map(v -> Expr.of(v.longValue()))
              .collect(ImmutableList.toImmutableList());
    } else {
      values =
          stmt.values.stream()
              .map(
                  v -> {
                    OptionalDouble folded = constants.tryEvaluate(v);
                    return folded.isPresent() ? Expr.of(folded.getAsDouble()) : v;
                  })
              .collect(ImmutableList.toImmutableList());
    }
    List<WorkQueue.Item> items = new ArrayList<>();
    for (Expr value : values) {
      Substitution substitution = Substitution.of(stmt.variable, value, constants);
      items.addAll(WorkQueue.statements(substitution.applyAll(stmt.body)));
    }
    queue.pushFront(items);
    return null;
  }

  @Override
  public Void visitBox(Statement.Box stmt) {
    queue.pushFront(WorkQueue.statements(stmt.body));
    return null;
  }
}
