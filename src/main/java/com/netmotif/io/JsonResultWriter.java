package com.netmotif.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.netmotif.api.Edge;
import com.netmotif.api.Graph;
import com.netmotif.api.NodeSet;
import com.netmotif.api.Value;
import com.netmotif.engine.EvaluationResult;
import com.netmotif.error.DslException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders program outcomes as JSON.
 *
 * <p>
 * Bindings appear in binding order, edges and node ids in ascending order, so
 * the same program always renders to the same bytes.
 *
 * <pre>
 * {"bindings":[{"name":"R","type":"Graph","node_count":3,"edges":[[0,1],[0,2],[1,2]]},
 *              {"name":"L","type":"NodeSet","nodes":[0,2]}]}
 * {"error":{"kind":"ParseError","message":"...","line":1,"column":9}}
 * </pre>
 */
public final class JsonResultWriter {
    private final ObjectWriter writer;

    public JsonResultWriter() {
        this(PipelineConfig.defaults());
    }

    public JsonResultWriter(PipelineConfig config) {
        ObjectMapper mapper = new ObjectMapper();
        this.writer = config.isPrettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    public String write(EvaluationResult result) {
        return serialize(toDocument(result));
    }

    public String write(DslException error) {
        return serialize(toDocument(error));
    }

    public static ResultDocument toDocument(EvaluationResult result) {
        ResultDocument doc = new ResultDocument();
        List<ResultDocument.ValueDef> bindings = new ArrayList<>(result.bindings().size());
        for (Map.Entry<String, Value> entry : result.bindings().entrySet()) {
            ResultDocument.ValueDef def = toValueDef(entry.getValue());
            def.setName(entry.getKey());
            bindings.add(def);
        }
        doc.setBindings(bindings);
        result.result().ifPresent(v -> doc.setResult(toValueDef(v)));
        return doc;
    }

    public static ResultDocument toDocument(DslException error) {
        ResultDocument.ErrorDef def = new ResultDocument.ErrorDef();
        def.setKind(error.kind().externalName());
        def.setMessage(error.detail());
        error.position().ifPresent(p -> {
            def.setLine(p.line());
            def.setColumn(p.column());
        });
        ResultDocument doc = new ResultDocument();
        doc.setError(def);
        return doc;
    }

    static ResultDocument.ValueDef toValueDef(Value value) {
        ResultDocument.ValueDef def = new ResultDocument.ValueDef();
        def.setType(value.kind().displayName());
        if (value instanceof Graph g) {
            def.setNodeCount(g.nodeCount());
            List<int[]> edges = new ArrayList<>(g.edgeCount());
            for (Edge e : g.edges())
                edges.add(new int[] { e.a(), e.b() });
            def.setEdges(edges);
        } else if (value instanceof NodeSet s) {
            List<Integer> nodes = new ArrayList<>(s.size());
            for (int id : s)
                nodes.add(id);
            def.setNodes(nodes);
        }
        return def;
    }

    private String serialize(ResultDocument doc) {
        try {
            return writer.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result document", e);
        }
    }
}
