package com.jsanalyzer.analyze.semantic;

import com.jsanalyzer.ast.Identifier;

/**
 * An expression that names a global.
 *
 * @param reference the identifier whose binding decides whether the global is shadowed
 * @param name the global's name
 */
public record GlobalReference(Identifier reference, String name) {
}
