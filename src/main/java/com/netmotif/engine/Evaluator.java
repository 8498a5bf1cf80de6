package com.netmotif.engine;

import com.netmotif.api.Graph;
import com.netmotif.api.Value;
import com.netmotif.dsl.ast.*;
import com.netmotif.io.PipelineConfig;
import com.netmotif.motif.DegreeCriteria;
import com.netmotif.motif.GraphOps;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Execution pass.
 *
 * <p>
 * Runs a program that has already passed the {@link Checker}, binding each
 * {@code let} in statement order. The evaluator does not repeat the checker's
 * validation. If evaluation still fails, the checker let through something it
 * should have rejected; that is reported as an {@link IllegalStateException}
 * (a defect), never as a user-facing
 * {@link com.netmotif.error.DslException}.
 *
 * <p>
 * {@code Connect}, {@code Overlay} and {@code Relabel} always produce new
 * graphs; operands stay bound to their original values.
 */
@Log4j2
public final class Evaluator {
    private final PipelineConfig config;
    private final Map<String, Value> env = new LinkedHashMap<>();
    private final ValueVisitor values = new ValueVisitor();
    private final Binder binder = new Binder();
    private Value result;

    public Evaluator() {
        this(PipelineConfig.defaults());
    }

    public Evaluator(PipelineConfig config) {
        this.config = config;
    }

    public EvaluationResult evaluate(Program program) {
        env.clear();
        result = null;
        for (Statement statement : program.statements()) {
            try {
                statement.accept(binder);
            } catch (IllegalArgumentException | ArithmeticException e) {
                throw new IllegalStateException("Evaluation failed at " + statement.position()
                        + " after a successful check (checker/evaluator mismatch)", e);
            }
        }
        log.debug("Evaluated {} statements, {} bindings", program.statements().size(), env.size());
        return new EvaluationResult(Collections.unmodifiableMap(new LinkedHashMap<>(env)),
                Optional.ofNullable(result));
    }

    private Graph graph(Expression expr) {
        Value v = expr.accept(values);
        if (v instanceof Graph g)
            return g;
        throw new IllegalStateException("Expected a Graph at " + expr.position() + " but evaluated to "
                + v.kind().displayName() + " (checker/evaluator mismatch)");
    }

    private final class Binder implements StatementVisitor<Void> {

        @Override
        public Void visitLet(LetStatement let) {
            Value value = let.expression().accept(values);
            Value previous = env.put(let.name(), value);
            if (previous != null && config.isWarnOnRebinding())
                log.warn("'{}' rebound at {}: {} replaced by {}", let.name(), let.position(), previous, value);
            return null;
        }

        @Override
        public Void visitExpression(ExpressionStatement statement) {
            result = statement.expression().accept(values);
            return null;
        }
    }

    private final class ValueVisitor implements ExpressionVisitor<Value> {

        @Override
        public Value visitMotif(MotifExpression expr) {
            return expr.kind().build(expr.args());
        }

        @Override
        public Value visitName(NameExpression expr) {
            Value v = env.get(expr.name());
            if (v == null)
                throw new IllegalStateException("Unbound name '" + expr.name() + "' at " + expr.position()
                        + " (checker/evaluator mismatch)");
            return v;
        }

        @Override
        public Value visitConnect(ConnectExpression expr) {
            Graph left = graph(expr.left());
            Graph right = graph(expr.right());
            return GraphOps.connect(left, right, expr.leftBridge().nodeId(), expr.rightBridge().nodeId());
        }

        @Override
        public Value visitOverlay(OverlayExpression expr) {
            return GraphOps.overlay(graph(expr.left()), graph(expr.right()));
        }

        @Override
        public Value visitRelabel(RelabelExpression expr) {
            return GraphOps.relabel(graph(expr.target()), expr.mapping());
        }

        @Override
        public Value visitPick(PickExpression expr) {
            var c = expr.criteria();
            return GraphOps.pick(graph(expr.target()), new DegreeCriteria(c.comparator(), c.value()));
        }
    }
}
