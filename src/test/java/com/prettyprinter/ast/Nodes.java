package com.prettyprinter.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Short-hand constructors for syntax trees in tests. Nodes built without a position get
 * {@link Positions#UNKNOWN}.
 */
public final class Nodes {

    private Nodes() {
    }

    public static Expr.Ident id(String name) {
        return Expr.Ident.of(Positions.UNKNOWN, name);
    }

    public static Expr.Ident id(int pos, String name) {
        return Expr.Ident.of(pos, name);
    }

    public static Expr.BasicLit intLit(String value) {
        return new Expr.BasicLit(Positions.UNKNOWN, Token.INT, value);
    }

    public static Expr.BasicLit intLit(int pos, String value) {
        return new Expr.BasicLit(pos, Token.INT, value);
    }

    public static Expr.BasicLit stringLit(int pos, String value) {
        return new Expr.BasicLit(pos, Token.STRING, value);
    }

    public static Expr.BinaryExpr binary(Token op, Expr x, Expr y) {
        return new Expr.BinaryExpr(Positions.UNKNOWN, op, x, y);
    }

    public static Expr.UnaryExpr unary(Token op, Expr x) {
        return new Expr.UnaryExpr(Positions.UNKNOWN, op, x);
    }

    /**
     * Builds a comma-separated expression list.
     */
    public static Expr list(Expr first, Expr... rest) {
        Expr result = first;
        for (Expr x : rest) {
            result = binary(Token.COMMA, result, x);
        }
        return result;
    }

    public static Block block(Stat... statements) {
        return new Block(Positions.UNKNOWN, Token.LBRACE, List.of(statements), Positions.UNKNOWN);
    }

    public static Block caseBody(Stat... statements) {
        return new Block(Positions.UNKNOWN, Token.COLON, List.of(statements), Positions.UNKNOWN);
    }

    public static Stat expressionStat(Expr x) {
        return new Stat.ExpressionStat(Positions.UNKNOWN, Token.ILLEGAL, x);
    }

    public static Stat increment(Expr x) {
        return new Stat.ExpressionStat(Positions.UNKNOWN, Token.INC, x);
    }

    public static Signature signature(Field... params) {
        return new Signature(List.of(params), null);
    }

    public static Decl.FuncDecl func(String name, Signature signature, Block body) {
        return new Decl.FuncDecl(Positions.UNKNOWN, null, id(name), signature, body);
    }

    public static Decl.ConstDecl constDecl(String name, Expr value) {
        return new Decl.ConstDecl(Positions.SYNTHETIC, List.of(id(name)), null, value);
    }

    public static Decl.VarDecl varDecl(String name, Expr type) {
        return new Decl.VarDecl(Positions.SYNTHETIC, List.of(id(name)), type, null);
    }

    public static Program program(String name, Decl... declarations) {
        return new Program(Positions.UNKNOWN, id(name), Arrays.asList(declarations), List.of());
    }

    public static Program program(String name, List<Comment> comments, Decl... declarations) {
        return new Program(Positions.UNKNOWN, id(name), Arrays.asList(declarations), comments);
    }
}
