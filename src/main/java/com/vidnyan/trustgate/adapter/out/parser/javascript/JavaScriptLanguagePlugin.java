package com.vidnyan.trustgate.adapter.out.parser.javascript;

import com.vidnyan.trustgate.adapter.out.parser.BuiltinLanguages;
import com.vidnyan.trustgate.adapter.out.parser.treesitter.TreeSitterGrammar;
import com.vidnyan.trustgate.domain.language.LanguageDefinition;
import com.vidnyan.trustgate.domain.language.LanguagePlugin;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import org.treesitter.TreeSitterJavascript;

import java.util.Map;

import static java.util.Map.entry;

/**
 * JavaScript language: grammar, node-kind table and markers.
 */
public class JavaScriptLanguagePlugin implements LanguagePlugin {

    static final Map<String, NodeKind> NODE_KINDS = Map.ofEntries(
            entry("program", NodeKind.MODULE),
            entry("function_declaration", NodeKind.FUNCTION),
            entry("generator_function_declaration", NodeKind.FUNCTION),
            entry("function_expression", NodeKind.FUNCTION),
            entry("arrow_function", NodeKind.FUNCTION),
            entry("method_definition", NodeKind.FUNCTION),
            entry("class_declaration", NodeKind.CLASS),
            entry("call_expression", NodeKind.CALL),
            entry("assignment_expression", NodeKind.ASSIGNMENT),
            entry("augmented_assignment_expression", NodeKind.ASSIGNMENT),
            entry("variable_declaration", NodeKind.ASSIGNMENT),
            entry("lexical_declaration", NodeKind.ASSIGNMENT),
            entry("variable_declarator", NodeKind.ASSIGNMENT),
            entry("for_statement", NodeKind.LOOP),
            entry("for_in_statement", NodeKind.LOOP),
            entry("while_statement", NodeKind.LOOP),
            entry("do_statement", NodeKind.LOOP),
            entry("if_statement", NodeKind.CONDITIONAL),
            entry("else_clause", NodeKind.CONDITIONAL),
            entry("import_statement", NodeKind.IMPORT),
            entry("return_statement", NodeKind.RETURN),
            entry("identifier", NodeKind.VARIABLE),
            entry("string", NodeKind.LITERAL),
            entry("template_string", NodeKind.LITERAL),
            entry("number", NodeKind.LITERAL),
            entry("true", NodeKind.LITERAL),
            entry("false", NodeKind.LITERAL),
            entry("null", NodeKind.LITERAL),
            entry("undefined", NodeKind.LITERAL),
            entry("binary_expression", NodeKind.BINARY_OP),
            entry("formal_parameters", NodeKind.PARAMETER),
            entry("statement_block", NodeKind.BLOCK),
            entry("member_expression", NodeKind.ATTRIBUTE),
            entry("try_statement", NodeKind.TRY_EXCEPT),
            entry("throw_statement", NodeKind.RAISE));

    private static final LanguageDefinition JAVASCRIPT = LanguageDefinition.builder("javascript")
            .aliases("js")
            .extensions(".js", ".mjs", ".cjs", ".jsx")
            .grammar(() -> new TreeSitterGrammar("javascript", TreeSitterJavascript::new))
            .nodeKinds(NODE_KINDS)
            .taintCatalog(BuiltinLanguages.TAINT_CATALOG)
            .asyncMarkers("await_expression")
            .exceptionMarkers("try_statement", "throw_statement")
            .build();

    @Override
    public LanguageDefinition language() {
        return JAVASCRIPT;
    }
}
