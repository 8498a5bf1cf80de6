package com.netmotif.engine;

import com.netmotif.dsl.SourcePosition;
import com.netmotif.dsl.ast.*;
import com.netmotif.error.*;
import com.netmotif.io.PipelineConfig;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Static validation pass.
 *
 * <p>
 * Walks the program in statement order and tracks the {@link Shape} of every
 * bound name: a lightweight abstract interpretation that never builds a graph.
 * The first violation stops the walk and is thrown as the matching
 * {@link DslException} subclass; nothing is accumulated.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>Motif calls: arity and per-parameter minimums from
 * {@link com.netmotif.motif.MotifKind}, plus the configured size limits.</li>
 * <li>Names must be bound before use.</li>
 * <li>{@code Connect} operands must be names of bound graphs; each bridge
 * endpoint must name its own operand and address a node inside it.</li>
 * <li>{@code Relabel} mappings must stay in range and permute their keys.</li>
 * <li>{@code Pick} needs a graph target and a non-negative degree.</li>
 * </ul>
 *
 * <p>
 * Instances may be reused sequentially; each {@link #check(Program)} starts
 * from an empty symbol table. Not thread-safe.
 */
@Log4j2
public final class Checker {
    private final PipelineConfig config;
    private final Map<String, Shape> symbols = new LinkedHashMap<>();
    private final ShapeVisitor shapes = new ShapeVisitor();
    private final Binder binder = new Binder();
    private Shape result;

    public Checker() {
        this(PipelineConfig.defaults());
    }

    /**
     * @throws IllegalArgumentException if the config's limits are out of range.
     */
    public Checker(PipelineConfig config) {
        this.config = config.validate();
    }

    public CheckResult check(Program program) {
        symbols.clear();
        result = null;
        for (Statement statement : program.statements())
            statement.accept(binder);
        log.debug("Checked {} statements, {} names bound", program.statements().size(), symbols.size());
        return new CheckResult(Collections.unmodifiableMap(new LinkedHashMap<>(symbols)),
                Optional.ofNullable(result));
    }

    private Shape lookup(String name, SourcePosition position) {
        Shape shape = symbols.get(name);
        if (shape == null)
            throw new UnknownNameException("Unknown name '" + name + "'", position);
        return shape;
    }

    private static Shape requireGraph(Shape shape, String what, SourcePosition position) {
        if (!shape.isGraph())
            throw new TypeMismatchException(what + " must be a Graph, found " + shape.kind().displayName(), position);
        return shape;
    }

    private Shape limited(Shape shape, String construct, SourcePosition position) {
        if (shape.nodeCount() > config.getMaxNodeCount())
            throw new MotifConstraintException(construct + " would build " + shape.nodeCount()
                    + " nodes, limit is " + config.getMaxNodeCount(), position);
        if (shape.edgeCount() > config.getMaxEdgeCount())
            throw new MotifConstraintException(construct + " would build " + shape.edgeCount()
                    + " edges, limit is " + config.getMaxEdgeCount(), position);
        return shape;
    }

    private final class Binder implements StatementVisitor<Void> {

        @Override
        public Void visitLet(LetStatement let) {
            Shape shape = let.expression().accept(shapes);
            if (symbols.containsKey(let.name()))
                log.debug("'{}' rebound at {}", let.name(), let.position());
            symbols.put(let.name(), shape);
            return null;
        }

        @Override
        public Void visitExpression(ExpressionStatement statement) {
            result = statement.expression().accept(shapes);
            return null;
        }
    }

    private final class ShapeVisitor implements ExpressionVisitor<Shape> {

        @Override
        public Shape visitMotif(MotifExpression expr) {
            var kind = expr.kind();
            kind.violation(expr.args()).ifPresent(v -> {
                throw new MotifConstraintException(v, expr.position());
            });
            return limited(Shape.graph(kind.nodeCount(expr.args()), kind.edgeCount(expr.args())),
                    kind.keyword(), expr.position());
        }

        @Override
        public Shape visitName(NameExpression expr) {
            return lookup(expr.name(), expr.position());
        }

        @Override
        public Shape visitConnect(ConnectExpression expr) {
            Shape left = operand(expr.left());
            Shape right = operand(expr.right());
            bridgeEndpoint(expr.leftBridge(), ((NameExpression) expr.left()).name());
            bridgeEndpoint(expr.rightBridge(), ((NameExpression) expr.right()).name());
            return limited(Shape.graph(left.nodeCount() + right.nodeCount(),
                    left.edgeCount() + right.edgeCount() + 1), "Connect", expr.position());
        }

        @Override
        public Shape visitOverlay(OverlayExpression expr) {
            Shape left = requireGraph(expr.left().accept(this), "Overlay operand", expr.left().position());
            Shape right = requireGraph(expr.right().accept(this), "Overlay operand", expr.right().position());
            return limited(Shape.graph(left.nodeCount() + right.nodeCount(),
                    left.edgeCount() + right.edgeCount()), "Overlay", expr.position());
        }

        @Override
        public Shape visitRelabel(RelabelExpression expr) {
            Shape target = requireGraph(expr.target().accept(this), "Relabel target", expr.target().position());
            for (var entry : expr.mapping().entrySet()) {
                for (int id : new int[] { entry.getKey(), entry.getValue() }) {
                    if (id < 0 || id >= target.nodeCount())
                        throw new NodeRefRangeException("Relabel entry " + entry.getKey() + ": " + entry.getValue()
                                + " is outside the node range 0.." + (target.nodeCount() - 1), expr.position());
                }
            }
            if (!new HashSet<>(expr.mapping().values()).equals(expr.mapping().keySet()))
                throw new InvalidMappingException("Relabel mapping " + expr.mapping()
                        + " must map its keys onto themselves (a permutation)", expr.position());
            return target;
        }

        @Override
        public Shape visitPick(PickExpression expr) {
            requireGraph(expr.target().accept(this), "Pick target", expr.target().position());
            if (expr.criteria().value() < 0)
                throw new MotifConstraintException("Pick requires deg value >= 0, got " + expr.criteria().value(),
                        expr.criteria().position());
            return Shape.nodeSet();
        }

        private Shape operand(Expression operand) {
            if (!(operand instanceof NameExpression name))
                throw new TypeMismatchException("Connect operand must be the name of a bound graph", operand.position());
            return requireGraph(lookup(name.name(), name.position()), "Connect operand '" + name.name() + "'",
                    name.position());
        }

        private void bridgeEndpoint(NodeRefLiteral ref, String operandName) {
            Shape shape = requireGraph(lookup(ref.graphName(), ref.position()),
                    "Bridge endpoint " + ref.ref(), ref.position());
            if (!ref.graphName().equals(operandName))
                throw new TypeMismatchException("Bridge endpoint " + ref.ref() + " must address operand '"
                        + operandName + "'", ref.position());
            if (ref.nodeId() >= shape.nodeCount())
                throw new NodeRefRangeException("Node reference " + ref.ref() + " is out of range: '"
                        + ref.graphName() + "' has " + shape.nodeCount() + " nodes", ref.position());
        }
    }
}
