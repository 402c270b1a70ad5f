package com.prettyprinter.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Expression and type nodes.
 *
 * <p>Expression lists (call arguments, initializer values) are represented as
 * {@link BinaryExpr} trees with the {@link Token#COMMA} operator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Expr.BadExpr.class, name = "BadExpr"),
        @JsonSubTypes.Type(value = Expr.Ident.class, name = "Ident"),
        @JsonSubTypes.Type(value = Expr.BinaryExpr.class, name = "BinaryExpr"),
        @JsonSubTypes.Type(value = Expr.UnaryExpr.class, name = "UnaryExpr"),
        @JsonSubTypes.Type(value = Expr.BasicLit.class, name = "BasicLit"),
        @JsonSubTypes.Type(value = Expr.FunctionLit.class, name = "FunctionLit"),
        @JsonSubTypes.Type(value = Expr.Group.class, name = "Group"),
        @JsonSubTypes.Type(value = Expr.Selector.class, name = "Selector"),
        @JsonSubTypes.Type(value = Expr.TypeGuard.class, name = "TypeGuard"),
        @JsonSubTypes.Type(value = Expr.Index.class, name = "Index"),
        @JsonSubTypes.Type(value = Expr.Call.class, name = "Call"),
        @JsonSubTypes.Type(value = Expr.Ellipsis.class, name = "Ellipsis"),
        @JsonSubTypes.Type(value = Expr.ArrayType.class, name = "ArrayType"),
        @JsonSubTypes.Type(value = Expr.StructType.class, name = "StructType"),
        @JsonSubTypes.Type(value = Expr.PointerType.class, name = "PointerType"),
        @JsonSubTypes.Type(value = Expr.FunctionType.class, name = "FunctionType"),
        @JsonSubTypes.Type(value = Expr.InterfaceType.class, name = "InterfaceType"),
        @JsonSubTypes.Type(value = Expr.MapType.class, name = "MapType"),
        @JsonSubTypes.Type(value = Expr.ChannelType.class, name = "ChannelType")
})
public sealed interface Expr extends Node
        permits Expr.BadExpr, Expr.Ident, Expr.BinaryExpr, Expr.UnaryExpr, Expr.BasicLit,
        Expr.FunctionLit, Expr.Group, Expr.Selector, Expr.TypeGuard, Expr.Index, Expr.Call,
        Expr.Ellipsis, Expr.ArrayType, Expr.StructType, Expr.PointerType, Expr.FunctionType,
        Expr.InterfaceType, Expr.MapType, Expr.ChannelType {

    void accept(Visitor v);

    interface Visitor {
        void visitBadExpr(BadExpr x);

        void visitIdent(Ident x);

        void visitBinaryExpr(BinaryExpr x);

        void visitUnaryExpr(UnaryExpr x);

        void visitBasicLit(BasicLit x);

        void visitFunctionLit(FunctionLit x);

        void visitGroup(Group x);

        void visitSelector(Selector x);

        void visitTypeGuard(TypeGuard x);

        void visitIndex(Index x);

        void visitCall(Call x);

        void visitEllipsis(Ellipsis x);

        void visitArrayType(ArrayType x);

        void visitStructType(StructType x);

        void visitPointerType(PointerType x);

        void visitFunctionType(FunctionType x);

        void visitInterfaceType(InterfaceType x);

        void visitMapType(MapType x);

        void visitChannelType(ChannelType x);
    }

    record BadExpr(int pos) implements Expr {
        @Override
        public void accept(Visitor v) {
            v.visitBadExpr(this);
        }
    }

    /**
     * An identifier. The symbol is {@code null} when the identifier was not resolved.
     */
    record Ident(int pos, String name, Symbol symbol) implements Expr {
        public Ident {
            requireNonNull(name, "name");
        }

        public static Ident of(int pos, String name) {
            return new Ident(pos, name, null);
        }

        @Override
        public void accept(Visitor v) {
            v.visitIdent(this);
        }
    }

    record BinaryExpr(int pos, Token op, Expr x, Expr y) implements Expr {
        public BinaryExpr {
            requireNonNull(op, "op");
            requireNonNull(x, "x");
            requireNonNull(y, "y");
        }

        @Override
        public void accept(Visitor v) {
            v.visitBinaryExpr(this);
        }
    }

    record UnaryExpr(int pos, Token op, Expr x) implements Expr {
        public UnaryExpr {
            requireNonNull(op, "op");
            requireNonNull(x, "x");
        }

        @Override
        public void accept(Visitor v) {
            v.visitUnaryExpr(this);
        }
    }

    /**
     * A literal; {@code kind} is one of {@link Token#INT}, {@link Token#FLOAT},
     * {@link Token#CHAR} or {@link Token#STRING} and {@code value} is the literal source text.
     */
    record BasicLit(int pos, Token kind, String value) implements Expr {
        public BasicLit {
            requireNonNull(kind, "kind");
            requireNonNull(value, "value");
        }

        @Override
        public void accept(Visitor v) {
            v.visitBasicLit(this);
        }
    }

    record FunctionLit(int pos, Signature signature, Block body) implements Expr {
        public FunctionLit {
            requireNonNull(signature, "signature");
            requireNonNull(body, "body");
        }

        @Override
        public void accept(Visitor v) {
            v.visitFunctionLit(this);
        }
    }

    /** A parenthesized expression as written in the source. */
    record Group(int pos, Expr x) implements Expr {
        public Group {
            requireNonNull(x, "x");
        }

        @Override
        public void accept(Visitor v) {
            v.visitGroup(this);
        }
    }

    record Selector(int pos, Expr x, Expr selector) implements Expr {
        public Selector {
            requireNonNull(x, "x");
            requireNonNull(selector, "selector");
        }

        @Override
        public void accept(Visitor v) {
            v.visitSelector(this);
        }
    }

    record TypeGuard(int pos, Expr x, Expr type) implements Expr {
        public TypeGuard {
            requireNonNull(x, "x");
            requireNonNull(type, "type");
        }

        @Override
        public void accept(Visitor v) {
            v.visitTypeGuard(this);
        }
    }

    record Index(int pos, Expr x, Expr index) implements Expr {
        public Index {
            requireNonNull(x, "x");
            requireNonNull(index, "index");
        }

        @Override
        public void accept(Visitor v) {
            v.visitIndex(this);
        }
    }

    /** A call; {@code args} is {@code null} for an empty argument list. */
    record Call(int pos, Expr fun, Expr args) implements Expr {
        public Call {
            requireNonNull(fun, "fun");
        }

        @Override
        public void accept(Visitor v) {
            v.visitCall(this);
        }
    }

    record Ellipsis(int pos) implements Expr {
        @Override
        public void accept(Visitor v) {
            v.visitEllipsis(this);
        }
    }

    /** An array or slice type; {@code len} is {@code null} for slices. */
    record ArrayType(int pos, Expr len, Expr element) implements Expr {
        public ArrayType {
            requireNonNull(element, "element");
        }

        @Override
        public void accept(Visitor v) {
            v.visitArrayType(this);
        }
    }

    /**
     * A struct type. An {@code end} position of {@link Positions#UNKNOWN} means the
     * struct has no field list in the source.
     */
    record StructType(int pos, List<Field> fields, int end) implements Expr {
        public StructType {
            fields = fields != null ? List.copyOf(fields) : List.of();
        }

        public boolean hasBody() {
            return end > Positions.UNKNOWN;
        }

        @Override
        public void accept(Visitor v) {
            v.visitStructType(this);
        }
    }

    record PointerType(int pos, Expr base) implements Expr {
        public PointerType {
            requireNonNull(base, "base");
        }

        @Override
        public void accept(Visitor v) {
            v.visitPointerType(this);
        }
    }

    record FunctionType(int pos, Signature signature) implements Expr {
        public FunctionType {
            requireNonNull(signature, "signature");
        }

        @Override
        public void accept(Visitor v) {
            v.visitFunctionType(this);
        }
    }

    /** An interface type; see {@link StructType} for the meaning of {@code end}. */
    record InterfaceType(int pos, List<Field> methods, int end) implements Expr {
        public InterfaceType {
            methods = methods != null ? List.copyOf(methods) : List.of();
        }

        public boolean hasBody() {
            return end > Positions.UNKNOWN;
        }

        @Override
        public void accept(Visitor v) {
            v.visitInterfaceType(this);
        }
    }

    record MapType(int pos, Expr key, Expr value) implements Expr {
        public MapType {
            requireNonNull(key, "key");
            requireNonNull(value, "value");
        }

        @Override
        public void accept(Visitor v) {
            v.visitMapType(this);
        }
    }

    record ChannelType(int pos, ChannelDir dir, Expr value) implements Expr {
        public ChannelType {
            requireNonNull(value, "value");
            dir = dir != null ? dir : ChannelDir.BOTH;
        }

        @Override
        public void accept(Visitor v) {
            v.visitChannelType(this);
        }
    }
}
