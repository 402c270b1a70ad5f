package com.prettyprinter.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Declaration nodes. A declaration inside a {@link DeclList} has position
 * {@link Positions#UNKNOWN} and is printed without its keyword.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Decl.BadDecl.class, name = "BadDecl"),
        @JsonSubTypes.Type(value = Decl.ImportDecl.class, name = "ImportDecl"),
        @JsonSubTypes.Type(value = Decl.ConstDecl.class, name = "ConstDecl"),
        @JsonSubTypes.Type(value = Decl.TypeDecl.class, name = "TypeDecl"),
        @JsonSubTypes.Type(value = Decl.VarDecl.class, name = "VarDecl"),
        @JsonSubTypes.Type(value = Decl.FuncDecl.class, name = "FuncDecl"),
        @JsonSubTypes.Type(value = Decl.DeclList.class, name = "DeclList")
})
public sealed interface Decl extends Node
        permits Decl.BadDecl, Decl.ImportDecl, Decl.ConstDecl, Decl.TypeDecl, Decl.VarDecl,
        Decl.FuncDecl, Decl.DeclList {

    void accept(Visitor v);

    interface Visitor {
        void visitBadDecl(BadDecl d);

        void visitImportDecl(ImportDecl d);

        void visitConstDecl(ConstDecl d);

        void visitTypeDecl(TypeDecl d);

        void visitVarDecl(VarDecl d);

        void visitFuncDecl(FuncDecl d);

        void visitDeclList(DeclList d);
    }

    record BadDecl(int pos) implements Decl {
        @Override
        public void accept(Visitor v) {
            v.visitBadDecl(this);
        }
    }

    /** An import; {@code name} is the optional local package name. */
    record ImportDecl(int pos, Expr.Ident name, Expr path) implements Decl {
        public ImportDecl {
            requireNonNull(path, "path");
        }

        @Override
        public void accept(Visitor v) {
            v.visitImportDecl(this);
        }
    }

    record ConstDecl(int pos, List<Expr.Ident> names, Expr type, Expr values) implements Decl {
        public ConstDecl {
            names = names != null ? List.copyOf(names) : List.of();
        }

        @Override
        public void accept(Visitor v) {
            v.visitConstDecl(this);
        }
    }

    record TypeDecl(int pos, Expr.Ident name, Expr type) implements Decl {
        public TypeDecl {
            requireNonNull(name, "name");
            requireNonNull(type, "type");
        }

        @Override
        public void accept(Visitor v) {
            v.visitTypeDecl(this);
        }
    }

    record VarDecl(int pos, List<Expr.Ident> names, Expr type, Expr values) implements Decl {
        public VarDecl {
            names = names != null ? List.copyOf(names) : List.of();
        }

        @Override
        public void accept(Visitor v) {
            v.visitVarDecl(this);
        }
    }

    /** A function or method; {@code receiver} is {@code null} for functions. */
    record FuncDecl(int pos, Field receiver, Expr.Ident name, Signature signature, Block body)
            implements Decl {
        public FuncDecl {
            requireNonNull(name, "name");
            requireNonNull(signature, "signature");
        }

        @Override
        public void accept(Visitor v) {
            v.visitFuncDecl(this);
        }
    }

    /** A parenthesized group of declarations introduced by {@code tok}. */
    record DeclList(int pos, Token tok, List<Decl> list, int end) implements Decl {
        public DeclList {
            requireNonNull(tok, "tok");
            list = list != null ? List.copyOf(list) : List.of();
        }

        @Override
        public void accept(Visitor v) {
            v.visitDeclList(this);
        }
    }
}
