package com.vidnyan.trustgate.domain.language;

import com.vidnyan.trustgate.adapter.out.parser.BuiltinLanguages;
import com.vidnyan.trustgate.domain.syntax.Grammar;
import com.vidnyan.trustgate.domain.syntax.ParseFailureException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LanguageRegistryTest {

    @Test
    void resolve_ByIdAliasAndFallback() {
        LanguageRegistry registry = BuiltinLanguages.registry();

        assertEquals(List.of("python", "javascript"), registry.supportedLanguages());
        assertEquals("python", registry.defaultLanguage().id());
        assertEquals("javascript", registry.resolve("js").id());
        assertEquals("javascript", registry.resolve("JavaScript").id());
        assertEquals("python", registry.resolve("py").id());
        assertEquals("python", registry.resolve("cobol").id());
        assertEquals("python", registry.resolve(null).id());
        assertTrue(registry.find("cobol").isEmpty());
    }

    @Test
    void detect_ByExtension() {
        LanguageRegistry registry = BuiltinLanguages.registry();

        assertEquals("python", registry.detect("src/app.py").orElseThrow().id());
        assertEquals("javascript", registry.detect("web/index.MJS").orElseThrow().id());
        assertEquals("javascript", registry.detect("App.jsx").orElseThrow().id());
        assertTrue(registry.detect("README.md").isEmpty());
        assertTrue(registry.detect(null).isEmpty());
    }

    @Test
    void register_RejectsDuplicateIds() {
        LanguageRegistry registry = BuiltinLanguages.registry();
        LanguageDefinition clash = LanguageDefinition.builder("snake")
                .aliases("py")
                .grammar(() -> source -> null)
                .build();

        assertFalse(registry.register(clash));
        assertEquals(2, registry.languages().size());
    }

    @Test
    void grammarFor_CreatesGrammarOnce() {
        AtomicInteger created = new AtomicInteger();
        LanguageRegistry registry = new LanguageRegistry();
        registry.register(LanguageDefinition.builder("toy")
                .grammar(() -> {
                    created.incrementAndGet();
                    return source -> null;
                })
                .build());
        LanguageDefinition toy = registry.resolve("toy");

        Grammar first = registry.grammarFor(toy);
        Grammar second = registry.grammarFor(toy);

        assertSame(first, second);
        assertEquals(1, created.get());
    }

    @Test
    void sourceParser_RejectsGrammarWithoutTree() {
        LanguageRegistry registry = new LanguageRegistry();
        registry.register(LanguageDefinition.builder("toy")
                .grammar(() -> source -> null)
                .build());
        SourceParser parser = new SourceParser(registry);

        assertThrows(ParseFailureException.class, () -> parser.parse("anything", "toy"));
    }

    @Test
    void sourceParser_FlagsErrorsWithoutThrowing() {
        SourceParser parser = new SourceParser(BuiltinLanguages.registry());

        ParseResult ok = parser.parse("x = 1\n", "python");
        ParseResult broken = parser.parse("function foo( {", "javascript");

        assertFalse(ok.hasErrors());
        assertTrue(broken.hasErrors());
        assertEquals("javascript", broken.language().id());
    }

    @Test
    void taintCatalog_MatchesDottedSuffix() {
        TaintCatalog catalog = BuiltinLanguages.TAINT_CATALOG;

        assertTrue(catalog.isSource("input"));
        assertTrue(catalog.isSource("flask.request.args"));
        assertTrue(catalog.isSink("os.system"));
        assertTrue(catalog.isSink("self.cursor.execute"));
        assertFalse(catalog.isSink("print"));
        assertFalse(catalog.isSource(""));
    }
}
