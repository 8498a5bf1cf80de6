package com.netmotif;

import com.netmotif.api.Graph;
import com.netmotif.engine.EvaluationResult;
import com.netmotif.error.DslException;
import com.netmotif.util.GraphExplain;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a sample program through the pipeline and logs what it built.
 */
@Log4j2
public class MotifDemo {

    private static final String PROGRAM = """
            # two motifs joined by a single bridge edge
            let A = Ring(4)
            let B = Star(3)
            let C = Connect(A, B, bridge=(A.0, B.0))
            let H = Pick(C, deg >= 3)
            let T = Overlay(Tree(2, 2), Grid(2, 3))
            """;

    public static void main(String[] args) {
        log.info("Starting NetMotif demo...");

        EvaluationResult result = NetMotif.run(PROGRAM);
        result.bindings().forEach((name, value) -> log.info("{} = {}", name, value));

        Graph c = result.graph("C");
        GraphExplain explain = new GraphExplain("C", c);
        log.info("\n{}", explain.dumpTopology());
        log.info("\n{}", explain.explainNode(0));
        log.info("Mermaid:\n{}", explain.toMermaid());
        log.info("JSON:\n{}", NetMotif.runToJson(PROGRAM));

        try {
            NetMotif.run("let X = Ring(3)\nlet Y = Connect(X, X, bridge=(X.5, X.0))");
        } catch (DslException e) {
            log.info("Rejected as expected: {} {}", e.kind().externalName(), e.getMessage());
        }
    }
}
