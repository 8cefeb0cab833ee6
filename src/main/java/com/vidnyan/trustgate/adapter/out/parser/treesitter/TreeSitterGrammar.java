package com.vidnyan.trustgate.adapter.out.parser.treesitter;

import com.vidnyan.trustgate.domain.syntax.Grammar;
import com.vidnyan.trustgate.domain.syntax.ParseFailureException;
import com.vidnyan.trustgate.domain.syntax.SyntaxNode;
import com.vidnyan.trustgate.domain.syntax.SyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Grammar backed by a native tree-sitter language.
 * A {@link TSParser} is not thread-safe, so every call gets its own parser.
 * The native tree is copied into {@link SyntaxNode}s with an explicit stack,
 * so nesting depth is bounded only by memory.
 */
@Slf4j
public class TreeSitterGrammar implements Grammar {

    private final String name;
    private final TSLanguage language;

    public TreeSitterGrammar(String name, Supplier<TSLanguage> language) {
        this.name = name;
        try {
            this.language = language.get();
        } catch (LinkageError e) {
            log.error("Native tree-sitter grammar for {} could not be loaded", name, e);
            throw new ParseFailureException("No native " + name + " grammar on this platform: " + e.getMessage(), e);
        }
    }

    @Override
    public SyntaxTree parse(String source) {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(language)) {
            throw new ParseFailureException("tree-sitter rejected the " + name + " grammar (ABI mismatch)");
        }
        TSTree tree = parser.parseString(null, source);
        if (tree == null) {
            throw new ParseFailureException("tree-sitter produced no " + name + " tree");
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new ParseFailureException("tree-sitter produced an empty " + name + " tree");
        }
        SyntaxNode converted = convert(root, new Positions(source));
        log.trace("Parsed {} chars of {} into {}", source.length(), name, converted);
        return new SyntaxTree(converted, source);
    }

    private static SyntaxNode convert(TSNode root, Positions positions) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, positions));
        SyntaxNode result = null;
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next < top.childCount) {
                int index = top.next++;
                stack.push(new Frame(top.node.getChild(index), positions));
                continue;
            }
            stack.pop();
            SyntaxNode built = top.builder.build();
            Frame parent = stack.peek();
            if (parent == null) {
                result = built;
            } else {
                String field = parent.node.getFieldNameForChild(parent.next - 1);
                if (field != null) {
                    parent.builder.field(field, built);
                } else {
                    parent.builder.child(built);
                }
            }
        }
        return result;
    }

    /**
     * One node on the conversion stack with the index of its next unvisited child.
     */
    private static final class Frame {
        final TSNode node;
        final int childCount;
        final SyntaxNode.Builder builder;
        int next;

        Frame(TSNode node, Positions positions) {
            this.node = node;
            this.childCount = node.getChildCount();
            int from = positions.charOffset(node.getStartByte());
            int to = positions.charOffset(node.getEndByte());
            this.builder = SyntaxNode.builder(node.getType())
                    .named(node.isNamed())
                    .missing(node.isMissing())
                    .span(from, to, positions.lines.pointAt(from), positions.lines.pointAt(to));
        }
    }

    /**
     * Translates tree-sitter's UTF-8 byte offsets into character offsets of the Java string.
     */
    static final class Positions {
        private final int[] byteToChar;
        private final LineIndex lines;

        Positions(String source) {
            this.lines = new LineIndex(source);
            byte[] utf8 = source.getBytes(StandardCharsets.UTF_8);
            this.byteToChar = new int[utf8.length + 1];
            int bytePos = 0;
            for (int i = 0; i < source.length(); ) {
                int cp = source.codePointAt(i);
                int width = utf8Width(cp);
                for (int b = 0; b < width; b++) {
                    byteToChar[bytePos + b] = i;
                }
                bytePos += width;
                i += Character.charCount(cp);
            }
            byteToChar[utf8.length] = source.length();
        }

        // Unpaired surrogates encode as a single '?' byte.
        private static int utf8Width(int cp) {
            if (cp < 0x80 || Character.isSurrogate((char) cp) && cp < 0x10000) {
                return 1;
            }
            return cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
        }

        int charOffset(int byteOffset) {
            if (byteOffset <= 0) {
                return 0;
            }
            return byteToChar[Math.min(byteOffset, byteToChar.length - 1)];
        }
    }
}
