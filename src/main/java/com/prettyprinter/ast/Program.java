package com.prettyprinter.ast;

import java.util.List;

/**
 * A source file: the package clause, its top-level declarations and all comments of the
 * file ordered by position.
 */
public record Program(int pos, Expr.Ident name, List<Decl> declarations, List<Comment> comments) {
    public Program {
        declarations = declarations != null ? List.copyOf(declarations) : List.of();
        comments = comments != null ? List.copyOf(comments) : List.of();
        for (int i = 1; i < comments.size(); i++) {
            if (comments.get(i).pos() <= comments.get(i - 1).pos()) {
                throw new IllegalArgumentException("Comments are not ordered by position at index " + i);
            }
        }
    }
}
