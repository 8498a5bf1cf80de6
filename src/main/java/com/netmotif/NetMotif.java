package com.netmotif;

import com.netmotif.dsl.Lexer;
import com.netmotif.dsl.Parser;
import com.netmotif.dsl.Token;
import com.netmotif.dsl.ast.Program;
import com.netmotif.engine.CheckResult;
import com.netmotif.engine.Checker;
import com.netmotif.engine.EvaluationResult;
import com.netmotif.engine.Evaluator;
import com.netmotif.error.DslException;
import com.netmotif.io.JsonResultWriter;
import com.netmotif.io.PipelineConfig;

import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * NetMotif: a small language for composing undirected graphs from motifs.
 *
 * <p>
 * A program is a sequence of statements such as
 *
 * <pre>
 * let A = Ring(4)
 * let B = Star(3)
 * let C = Connect(A, B, bridge=(A.0, B.0))
 * let H = Pick(C, deg &gt;= 3)
 * </pre>
 *
 * and runs through four stages: lex, parse, check, evaluate. The first error
 * from any stage stops the run and surfaces as a
 * {@link com.netmotif.error.DslException} carrying its kind and source
 * position. A program that passes the check always evaluates.
 *
 * <p>
 * Each run uses a fresh checker and evaluator, so runs are independent and
 * deterministic: the same source always yields equal bindings.
 */
@Log4j2
public final class NetMotif {

    private NetMotif() {
        // Prevent instantiation of utility class
    }

    /** Scans {@code source} into tokens, ending with EOF. */
    public static List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        log.debug("Scanned {} tokens", tokens.size());
        return tokens;
    }

    /** Lexes and parses {@code source} without checking it. */
    public static Program parse(String source) {
        return Parser.parse(source);
    }

    /** Parses and checks {@code source}, returning the shapes of its bindings. */
    public static CheckResult check(String source) {
        return check(source, PipelineConfig.load());
    }

    public static CheckResult check(String source, PipelineConfig config) {
        return new Checker(config).check(parse(source));
    }

    /**
     * Runs the whole pipeline.
     *
     * @throws DslException the first lex, parse or check error
     */
    public static EvaluationResult run(String source) {
        return run(source, PipelineConfig.load());
    }

    public static EvaluationResult run(String source, PipelineConfig config) {
        Program program = parse(source);
        new Checker(config).check(program);
        EvaluationResult result = new Evaluator(config).evaluate(program);
        log.debug("Program ran: {} statements, bindings {}", program.statements().size(),
                result.bindings().keySet());
        return result;
    }

    /**
     * Runs {@code source} and renders either its bindings or its first error
     * as JSON.
     */
    public static String runToJson(String source) {
        return runToJson(source, PipelineConfig.load());
    }

    public static String runToJson(String source, PipelineConfig config) {
        JsonResultWriter writer = new JsonResultWriter(config);
        try {
            return writer.write(run(source, config));
        } catch (DslException e) {
            log.debug("Program rejected: {} {}", e.kind().externalName(), e.getMessage());
            return writer.write(e);
        }
    }
}
