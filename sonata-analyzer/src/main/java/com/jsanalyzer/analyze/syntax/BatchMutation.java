package com.jsanalyzer.analyze.syntax;

import com.jsanalyzer.ast.Expression;
import com.jsanalyzer.ast.Node;
import com.jsanalyzer.ast.Program;
import com.jsanalyzer.ast.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered set of node replacements against one {@link SyntaxTree}.
 *
 * <p>Nothing happens until {@link #commit()}, which either returns a complete new tree or
 * throws. A replacement may contain original nodes of the tree, including the node it
 * replaces; those occurrences receive their rewritten versions, so wrapping a parent and
 * replacing one of its children in the same batch compose.</p>
 */
public final class BatchMutation {
    private final SyntaxTree tree;
    private final Map<Node, Node> replacements = new IdentityHashMap<>();
    private final List<Map.Entry<Node, Node>> ordered = new ArrayList<>();

    BatchMutation(SyntaxTree tree) {
        this.tree = tree;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public BatchMutation replaceNode(Node oldNode, Node newNode) {
        if (!tree.contains(oldNode)) {
            throw new MutationException(oldNode.type() + " is not part of the tree being mutated");
        }
        boolean compatible;
        if (oldNode instanceof Expression) {
            compatible = newNode instanceof Expression;
        } else if (oldNode instanceof Statement) {
            compatible = newNode instanceof Statement;
        } else {
            compatible = oldNode.getClass() == newNode.getClass();
        }
        if (!compatible) {
            throw new MutationException("Cannot replace " + oldNode.type() + " with " + newNode.type());
        }
        if (replacements.put(oldNode, newNode) != null) {
            throw new MutationException(oldNode.type() + " is already replaced in this mutation");
        }
        ordered.add(Map.entry(oldNode, newNode));
        return this;
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }

    public int size() {
        return replacements.size();
    }

    /**
     * @return the replacements in the order they were recorded
     */
    public List<Map.Entry<Node, Node>> replacements() {
        return List.copyOf(ordered);
    }

    public SyntaxTree commit() {
        Commit commit = new Commit();
        Node newRoot = commit.rebuild(tree.root());
        if (commit.applied.size() != replacements.size()) {
            throw new MutationException("Mutation targets a node that could not be reached from the root");
        }
        if (!(newRoot instanceof Program program)) {
            throw new MutationException("Root must remain a Program");
        }
        return new SyntaxTree(program);
    }

    private final class Commit {
        // Original node -> its rewritten version, for nodes that changed
        private final Map<Node, Node> rewritten = new IdentityHashMap<>();
        private final Set<Node> applied = Collections.newSetFromMap(new IdentityHashMap<>());

        Node rebuild(Node node) {
            Node rebuilt = NodeChildren.map(node, this::rebuild);
            if (rebuilt != node) {
                rewritten.put(node, rebuilt);
            }
            Node replacement = replacements.get(node);
            if (replacement == null) {
                return rebuilt;
            }
            applied.add(node);
            // Inside its own replacement the node stands for its rebuilt self
            rewritten.put(node, rebuilt);
            Node result = substitute(replacement);
            rewritten.put(node, result);
            return result;
        }

        private Node substitute(Node node) {
            Node current = rewritten.get(node);
            if (current != null) {
                return current;
            }
            return NodeChildren.map(node, this::substitute);
        }
    }
}
