package com.vidnyan.trustgate.application.service;

import com.vidnyan.trustgate.adapter.out.evaluator.BuiltinRules;
import com.vidnyan.trustgate.adapter.out.parser.BuiltinLanguages;
import com.vidnyan.trustgate.application.port.in.VerifyCodeUseCase;
import com.vidnyan.trustgate.domain.graph.*;
import com.vidnyan.trustgate.domain.language.LanguageDefinition;
import com.vidnyan.trustgate.domain.language.LanguageRegistry;
import com.vidnyan.trustgate.domain.language.ParseResult;
import com.vidnyan.trustgate.domain.language.SourceParser;
import com.vidnyan.trustgate.domain.meta.MetaAst;
import com.vidnyan.trustgate.domain.meta.MetaAstNormalizer;
import com.vidnyan.trustgate.domain.report.BatchReport;
import com.vidnyan.trustgate.domain.report.VerificationReport;
import com.vidnyan.trustgate.domain.rule.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Runs the verification pipeline: parse, normalise, build graphs, evaluate
 * rules, score. Implements the primary use case.
 * <p>
 * Holds no per-call state; the result cache and the registry's grammar table
 * are the only shared mutable structures.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService implements VerifyCodeUseCase {

    static final String PARSE_ERROR = "parse_error";
    static final String SYNTAX_ERROR = "syntax_error";

    private static final int HASH_LENGTH = 16;

    private final LanguageRegistry registry;
    private final SourceParser sourceParser;
    private final MetaAstNormalizer normalizer;
    private final List<GraphBuilder> graphBuilders;
    private final RuleSet defaultRules;
    private final RuleEngine ruleEngine;
    private final ResultCache cache;

    /**
     * Create a service with the built-in languages, graph builders and rules.
     */
    public static VerificationService withDefaults() {
        return withDefaults(new ResultCache());
    }

    public static VerificationService withDefaults(ResultCache cache) {
        LanguageRegistry registry = BuiltinLanguages.registry();
        return new VerificationService(
                registry,
                new SourceParser(registry),
                new MetaAstNormalizer(),
                defaultGraphBuilders(registry),
                BuiltinRules.ruleSet(),
                new RuleEngine(),
                cache);
    }

    public static List<GraphBuilder> defaultGraphBuilders(LanguageRegistry registry) {
        return List.of(
                new ControlFlowGraphBuilder(),
                new DataFlowGraphBuilder(),
                new TaintFlowGraphBuilder(registry),
                new CallGraphBuilder());
    }

    @Override
    public VerificationReport verify(VerificationRequest request) {
        long start = System.nanoTime();
        LanguageDefinition language = resolveLanguage(request);
        String code = request.code() == null ? "" : request.code();
        String hash = codeHash(language.id(), code);
        boolean cacheable = request.useCache() && request.ruleSet() == null;

        if (cacheable) {
            Optional<VerificationReport> cached = cache.get(hash);
            if (cached.isPresent()) {
                log.debug("Cache hit for {} ({})", hash, language.id());
                return cached.get();
            }
        }

        VerificationReport report;
        try {
            report = run(code, language, hash, request.ruleSet() == null ? defaultRules : request.ruleSet(), start);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Verification of {} code failed: {}", language.id(), e.toString());
            report = VerificationReport.parseFailure(language.id(), elapsedMs(start), hash);
        }

        if (cacheable) {
            cache.put(hash, report);
        }
        return report;
    }

    private VerificationReport run(String code, LanguageDefinition language, String hash,
                                   RuleSet rules, long start) {
        // Step 1: Parse
        ParseResult parse = sourceParser.parse(code, language);
        boolean parseOk = !parse.hasErrors();

        // Step 2: Normalise
        MetaAst ast = normalizer.normalise(parse);

        // Step 3: Build graphs
        Map<GraphKind, ProgramGraph> graphs = buildGraphs(ast);

        // Step 4: Evaluate rules
        List<Finding> findings = new ArrayList<>();
        if (!parseOk) {
            findings.add(Finding.builder()
                    .ruleId(SYNTAX_ERROR)
                    .message("Code contains syntax errors")
                    .severity(Severity.ERROR)
                    .line(1)
                    .build());
        }
        List<EvaluationResult> results = ruleEngine.evaluate(rules, ast, graphs);
        findings.addAll(RuleEngine.findingsOf(results));

        // Step 5: Aggregate
        VerificationReport report = VerificationReport.of(findings, language.id(), parseOk, elapsedMs(start), hash);
        log.debug("Verified {} chars of {}: {} findings, confidence {}",
                code.length(), language.id(), report.findingCount(), report.confidenceScore());
        return report;
    }

    /**
     * Run every graph builder; a failing builder leaves its graph out.
     */
    Map<GraphKind, ProgramGraph> buildGraphs(MetaAst ast) {
        Map<GraphKind, ProgramGraph> graphs = new EnumMap<>(GraphKind.class);
        for (GraphBuilder builder : graphBuilders) {
            try {
                graphs.put(builder.kind(), builder.build(ast));
            } catch (RuntimeException | StackOverflowError e) {
                log.warn("Error building {} graph with {}: {}", builder.kind().id(), builder.getName(), e.toString());
            }
        }
        return graphs;
    }

    @Override
    public BatchReport verifyAll(List<VerificationRequest> requests) {
        List<VerificationReport> reports = new ArrayList<>(requests.size());
        for (VerificationRequest request : requests) {
            reports.add(verify(request));
        }
        BatchReport batch = BatchReport.of(reports);
        log.info("Verified batch of {}: {} findings, valid={}", reports.size(), batch.totalFindings(), batch.valid());
        return batch;
    }

    @Override
    public GraphExport exportGraph(String code, String language, String graphType) {
        GraphKind kind = GraphKind.fromId(graphType)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown graph type: " + graphType + ". Use: " + GraphKind.ids()));
        GraphBuilder builder = graphBuilders.stream()
                .filter(b -> b.kind() == kind)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No builder registered for " + kind.id()));

        try {
            MetaAst ast = normalizer.normalise(sourceParser.parse(code, language));
            return GraphExport.of(builder.build(ast));
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Cannot export {} graph of {} code: {}", kind.id(), language, e.toString());
            throw new IllegalArgumentException("Cannot build " + kind.id() + " graph: " + e.getMessage(), e);
        }
    }

    @Override
    public List<RuleInfo> listRules() {
        return defaultRules.rules().stream().map(RuleInfo::of).toList();
    }

    /**
     * A file name only overrides the language when none, or the default one, was asked for.
     */
    LanguageDefinition resolveLanguage(VerificationRequest request) {
        LanguageDefinition requested = registry.resolve(request.language());
        if (request.filename() == null || !requested.equals(registry.defaultLanguage())) {
            return requested;
        }
        return registry.detect(request.filename()).orElse(requested);
    }

    /**
     * First 16 hex digits of SHA-256 over {@code language:code}.
     */
    public static String codeHash(String language, String code) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((language + ":" + code).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static double elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000.0;
    }

    public ResultCache cache() {
        return cache;
    }

    public LanguageRegistry registry() {
        return registry;
    }
}
