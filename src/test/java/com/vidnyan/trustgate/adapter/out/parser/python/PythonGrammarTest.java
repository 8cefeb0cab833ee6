package com.vidnyan.trustgate.adapter.out.parser.python;

import com.vidnyan.trustgate.domain.syntax.Grammar;
import com.vidnyan.trustgate.domain.syntax.SyntaxNode;
import com.vidnyan.trustgate.domain.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PythonGrammarTest {

    private final Grammar grammar = new PythonLanguagePlugin().language().grammarFactory().get();

    @Test
    void parse_AssignmentOfBinaryExpression() {
        SyntaxTree tree = grammar.parse("x = 1 + 2\nprint(x)");

        assertFalse(tree.containsErrors());
        SyntaxNode root = tree.root();
        assertEquals("module", root.type());
        assertEquals(2, root.childCount());

        SyntaxNode assignment = root.children().get(0).children().get(0);
        assertEquals("assignment", assignment.type());
        assertEquals("x", assignment.field("left").orElseThrow().text(tree.source()));
        SyntaxNode right = assignment.field("right").orElseThrow();
        assertEquals("binary_operator", right.type());
        assertEquals("integer", right.children().get(0).type());

        SyntaxNode call = root.children().get(1).children().get(0);
        assertEquals("call", call.type());
        assertEquals("print", call.field("function").orElseThrow().text(tree.source()));
        assertEquals(1, call.start().row());
    }

    @Test
    void parse_FunctionDefinitionWithBlock() {
        String source = "def add(a, b=1):\n    total = a + b\n    return total\n";

        SyntaxTree tree = grammar.parse(source);

        assertFalse(tree.containsErrors());
        SyntaxNode function = tree.root().children().get(0);
        assertEquals("function_definition", function.type());
        assertEquals("add", function.field("name").orElseThrow().text(source));
        assertEquals("parameters", function.field("parameters").orElseThrow().type());

        SyntaxNode body = function.field("body").orElseThrow();
        assertEquals("block", body.type());
        assertEquals(2, body.childCount());
        assertEquals("return_statement", body.children().get(1).type());
        assertEquals(2, body.children().get(1).start().row());
        assertEquals(4, body.children().get(1).start().column());
    }

    @Test
    void parse_ExceptClauses() {
        String source = "try:\n    run()\nexcept ValueError as e:\n    pass\nexcept:\n    pass\n";

        SyntaxTree tree = grammar.parse(source);

        assertFalse(tree.containsErrors());
        SyntaxNode tryStatement = tree.root().children().get(0);
        assertEquals("try_statement", tryStatement.type());
        SyntaxNode[] clauses = tryStatement.children().stream()
                .filter(c -> c.type().equals("except_clause"))
                .toArray(SyntaxNode[]::new);
        assertEquals(2, clauses.length);
        assertTrue(clauses[0].text(source).startsWith("except ValueError as e:"));
        assertTrue(find(clauses[0], "identifier").isPresent());
        assertTrue(find(clauses[1], "identifier").isEmpty());
    }

    @Test
    void parse_ImportForms() {
        String source = "import os.path as p, sys\nfrom json import loads, dumps as d\nfrom x import *\n";

        SyntaxTree tree = grammar.parse(source);

        assertFalse(tree.containsErrors());
        assertEquals("import_statement", tree.root().children().get(0).type());
        assertTrue(find(tree.root(), "aliased_import").isPresent());
        SyntaxNode from = tree.root().children().get(1);
        assertEquals("import_from_statement", from.type());
        assertEquals("json", from.field("module_name").orElseThrow().text(source));
        assertTrue(find(tree.root().children().get(2), "wildcard_import").isPresent());
    }

    @Test
    void parse_MatchStatement() {
        String source = "match x:\n    case 1:\n        pass\n    case _:\n        y = 2\n";

        SyntaxTree tree = grammar.parse(source);

        assertFalse(tree.containsErrors());
        assertEquals("match_statement", tree.root().children().get(0).type());
        assertTrue(find(tree.root(), "case_clause").isPresent());
    }

    @Test
    void parse_UnclosedParameterListIsFlagged() {
        SyntaxTree tree = grammar.parse("def foo(\n    pass");

        assertTrue(tree.containsErrors());
    }

    @Test
    void parse_BrokenStatementKeepsFollowingLines() {
        String source = "x = = 1\ny = 2\n";

        SyntaxTree tree = grammar.parse(source);

        assertTrue(tree.containsErrors());
        assertTrue(collect(tree.root(), "identifier").stream().anyMatch(id -> id.text(source).equals("y")));
    }

    @Test
    void parse_DeeplyNestedParenthesesAreValid() {
        String source = "x = " + "(".repeat(150) + "1" + ")".repeat(150) + "\n";

        SyntaxTree tree = grammar.parse(source);

        assertFalse(tree.containsErrors());
        assertTrue(find(tree.root(), "parenthesized_expression").isPresent());
    }

    @Test
    void parse_OffsetsAreCharactersNotBytes() {
        String source = "s = \"h\u00e9llo \u20ac \uD83D\uDE00\"\nx = 1\n";

        SyntaxTree tree = grammar.parse(source);

        assertFalse(tree.containsErrors());
        SyntaxNode string = find(tree.root(), "string").orElseThrow();
        assertEquals("\"h\u00e9llo \u20ac \uD83D\uDE00\"", string.text(source));
        SyntaxNode second = tree.root().children().get(1);
        assertEquals("x = 1", second.text(source));
        assertEquals(1, second.start().row());
        assertEquals(0, second.start().column());
    }

    @Test
    void parse_EmptySource() {
        SyntaxTree tree = grammar.parse("");

        assertEquals("module", tree.root().type());
        assertEquals(0, tree.root().childCount());
        assertFalse(tree.containsErrors());
    }

    @Test
    void parse_AsyncFunctionKeepsAsyncLeaf() {
        String source = "async def fetch():\n    await get()\n";

        SyntaxTree tree = grammar.parse(source);

        assertFalse(tree.containsErrors());
        SyntaxNode function = tree.root().children().get(0);
        assertEquals("function_definition", function.type());
        assertEquals("async", function.firstChild().orElseThrow().type());
        assertFalse(function.firstChild().orElseThrow().isNamed());
        assertTrue(find(function, "await").isPresent());
    }

    static List<SyntaxNode> collect(SyntaxNode root, String type) {
        List<SyntaxNode> found = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.type().equals(type)) {
                found.add(node);
            }
            node.children().forEach(stack::push);
        }
        return found;
    }

    static Optional<SyntaxNode> find(SyntaxNode root, String type) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.type().equals(type)) {
                return Optional.of(node);
            }
            node.children().forEach(stack::push);
        }
        return Optional.empty();
    }
}
