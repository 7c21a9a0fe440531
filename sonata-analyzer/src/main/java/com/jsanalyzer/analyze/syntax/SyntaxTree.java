package com.jsanalyzer.analyze.syntax;

import com.jsanalyzer.CodeGenerator;
import com.jsanalyzer.Parser;
import com.jsanalyzer.ast.Node;
import com.jsanalyzer.ast.Program;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * An immutable snapshot of a program together with an upward navigation index.
 *
 * <p>Nodes do not know their parents. The tree keeps an identity-keyed index from each
 * node to its parent, so lookups must use the exact node instances of this snapshot.</p>
 */
public final class SyntaxTree {
    private final Program root;
    private final Map<Node, Node> parents = new IdentityHashMap<>();
    private final List<Node> preorder = new ArrayList<>();

    public SyntaxTree(Program root) {
        this.root = root;
        index();
    }

    public static SyntaxTree parse(String source) {
        return new SyntaxTree(Parser.parse(source));
    }

    public static SyntaxTree parse(String source, boolean module) {
        return new SyntaxTree(Parser.parse(source, module));
    }

    private void index() {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            preorder.add(node);
            List<Node> children = NodeChildren.of(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                Node child = children.get(i);
                if (parents.put(child, node) != null) {
                    throw new IllegalStateException("Node " + child.type() + " appears twice in the tree");
                }
                stack.push(child);
            }
        }
    }

    public Program root() {
        return root;
    }

    public boolean contains(Node node) {
        return node == root || parents.containsKey(node);
    }

    public Optional<Node> parent(Node node) {
        requireMember(node);
        return Optional.ofNullable(parents.get(node));
    }

    /**
     * @return the immediate parent if it is an instance of {@code type}
     */
    public <T extends Node> Optional<T> parent(Node node, Class<T> type) {
        return parent(node).filter(type::isInstance).map(type::cast);
    }

    /**
     * @return the ancestors of {@code node}, nearest first, ending with the root
     */
    public Stream<Node> ancestors(Node node) {
        requireMember(node);
        return Stream.iterate(parents.get(node), parent -> parent != null, parents::get);
    }

    /**
     * @return every node of the tree in pre-order, starting with the root
     */
    public Stream<Node> descendants() {
        return Collections.unmodifiableList(preorder).stream();
    }

    public BatchMutation begin() {
        return new BatchMutation(this);
    }

    public String text() {
        return CodeGenerator.generate(root);
    }

    private void requireMember(Node node) {
        if (!contains(node)) {
            throw new IllegalArgumentException(node.type() + " is not part of this tree");
        }
    }

    @Override
    public String toString() {
        return text();
    }
}
