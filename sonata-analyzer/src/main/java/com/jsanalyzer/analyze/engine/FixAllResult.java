package com.jsanalyzer.analyze.engine;

import com.jsanalyzer.analyze.syntax.SyntaxTree;

/**
 * Outcome of {@link Analyzer#fixAll}.
 *
 * @param tree the tree after all applied fixes
 * @param fixesApplied how many fixes were committed
 * @param remaining the analysis of the final tree
 */
public record FixAllResult(SyntaxTree tree, int fixesApplied, AnalysisResult remaining) {
}
