package com.vidnyan.trustgate.adapter.out.parser.python;

import com.vidnyan.trustgate.adapter.out.parser.BuiltinLanguages;
import com.vidnyan.trustgate.adapter.out.parser.treesitter.TreeSitterGrammar;
import com.vidnyan.trustgate.domain.language.LanguageDefinition;
import com.vidnyan.trustgate.domain.language.LanguagePlugin;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import org.treesitter.TreeSitterPython;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Python language: grammar, node-kind table and markers.
 */
public class PythonLanguagePlugin implements LanguagePlugin {

    static final Map<String, NodeKind> NODE_KINDS = Map.ofEntries(
            entry("module", NodeKind.MODULE),
            entry("function_definition", NodeKind.FUNCTION),
            entry("async_function_definition", NodeKind.FUNCTION),
            entry("class_definition", NodeKind.CLASS),
            entry("call", NodeKind.CALL),
            entry("assignment", NodeKind.ASSIGNMENT),
            entry("augmented_assignment", NodeKind.ASSIGNMENT),
            entry("for_statement", NodeKind.LOOP),
            entry("while_statement", NodeKind.LOOP),
            entry("if_statement", NodeKind.CONDITIONAL),
            entry("elif_clause", NodeKind.CONDITIONAL),
            entry("else_clause", NodeKind.CONDITIONAL),
            entry("import_statement", NodeKind.IMPORT),
            entry("import_from_statement", NodeKind.IMPORT),
            entry("return_statement", NodeKind.RETURN),
            entry("identifier", NodeKind.VARIABLE),
            entry("string", NodeKind.LITERAL),
            entry("integer", NodeKind.LITERAL),
            entry("float", NodeKind.LITERAL),
            entry("true", NodeKind.LITERAL),
            entry("false", NodeKind.LITERAL),
            entry("none", NodeKind.LITERAL),
            entry("binary_operator", NodeKind.BINARY_OP),
            entry("comparison_operator", NodeKind.BINARY_OP),
            entry("boolean_operator", NodeKind.BINARY_OP),
            entry("parameters", NodeKind.PARAMETER),
            entry("block", NodeKind.BLOCK),
            entry("attribute", NodeKind.ATTRIBUTE),
            entry("try_statement", NodeKind.TRY_EXCEPT),
            entry("raise_statement", NodeKind.RAISE));

    private static final LanguageDefinition PYTHON = LanguageDefinition.builder("python")
            .aliases("py")
            .extensions(".py", ".pyw", ".pyi")
            .grammar(() -> new TreeSitterGrammar("python", TreeSitterPython::new))
            .nodeKinds(NODE_KINDS)
            .taintCatalog(BuiltinLanguages.TAINT_CATALOG)
            .asyncMarkers("await")
            .exceptionMarkers("try_statement", "raise_statement")
            .build();

    @Override
    public LanguageDefinition language() {
        return PYTHON;
    }
}
