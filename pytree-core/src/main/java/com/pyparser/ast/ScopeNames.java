package com.pyparser.ast;

import java.util.List;

/**
 * The names of one scope that are visible at a query position.
 */
public record ScopeNames(Scope scope, List<Name> names) {
}
