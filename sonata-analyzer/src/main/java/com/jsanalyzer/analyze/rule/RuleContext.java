package com.jsanalyzer.analyze.rule;

import com.jsanalyzer.analyze.semantic.SemanticModel;
import com.jsanalyzer.analyze.syntax.BatchMutation;
import com.jsanalyzer.analyze.syntax.SyntaxTree;
import com.jsanalyzer.ast.Node;

/**
 * What a rule sees while inspecting one matched node.
 *
 * @param query the matched node
 * @param tree the snapshot being analyzed, read-only
 * @param model bindings of that snapshot
 * @param metadata the metadata of the running rule
 */
public record RuleContext<N extends Node>(N query, SyntaxTree tree, SemanticModel model, RuleMetadata metadata) {

    public String category() {
        return metadata.category();
    }

    /**
     * Starts a new, empty mutation against the snapshot root. Mutations from different calls
     * never see each other's edits.
     */
    public BatchMutation begin() {
        return tree.begin();
    }
}
