package com.prettyprinter.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import static java.util.Objects.requireNonNull;

/**
 * Statement nodes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Stat.BadStat.class, name = "BadStat"),
        @JsonSubTypes.Type(value = Stat.LabelDecl.class, name = "LabelDecl"),
        @JsonSubTypes.Type(value = Stat.DeclarationStat.class, name = "DeclarationStat"),
        @JsonSubTypes.Type(value = Stat.ExpressionStat.class, name = "ExpressionStat"),
        @JsonSubTypes.Type(value = Stat.CompositeStat.class, name = "CompositeStat"),
        @JsonSubTypes.Type(value = Stat.IfStat.class, name = "IfStat"),
        @JsonSubTypes.Type(value = Stat.ForStat.class, name = "ForStat"),
        @JsonSubTypes.Type(value = Stat.CaseClause.class, name = "CaseClause"),
        @JsonSubTypes.Type(value = Stat.SwitchStat.class, name = "SwitchStat"),
        @JsonSubTypes.Type(value = Stat.SelectStat.class, name = "SelectStat"),
        @JsonSubTypes.Type(value = Stat.ControlFlowStat.class, name = "ControlFlowStat"),
        @JsonSubTypes.Type(value = Stat.EmptyStat.class, name = "EmptyStat")
})
public sealed interface Stat extends Node
        permits Stat.BadStat, Stat.LabelDecl, Stat.DeclarationStat, Stat.ExpressionStat,
        Stat.CompositeStat, Stat.IfStat, Stat.ForStat, Stat.CaseClause, Stat.SwitchStat,
        Stat.SelectStat, Stat.ControlFlowStat, Stat.EmptyStat {

    void accept(Visitor v);

    interface Visitor {
        void visitBadStat(BadStat s);

        void visitLabelDecl(LabelDecl s);

        void visitDeclarationStat(DeclarationStat s);

        void visitExpressionStat(ExpressionStat s);

        void visitCompositeStat(CompositeStat s);

        void visitIfStat(IfStat s);

        void visitForStat(ForStat s);

        void visitCaseClause(CaseClause s);

        void visitSwitchStat(SwitchStat s);

        void visitSelectStat(SelectStat s);

        void visitControlFlowStat(ControlFlowStat s);

        void visitEmptyStat(EmptyStat s);
    }

    record BadStat(int pos) implements Stat {
        @Override
        public void accept(Visitor v) {
            v.visitBadStat(this);
        }
    }

    /** A label; {@code pos} is the position of the colon. */
    record LabelDecl(int pos, Expr.Ident label) implements Stat {
        public LabelDecl {
            requireNonNull(label, "label");
        }

        @Override
        public void accept(Visitor v) {
            v.visitLabelDecl(this);
        }
    }

    record DeclarationStat(int pos, Decl decl) implements Stat {
        public DeclarationStat {
            requireNonNull(decl, "decl");
        }

        @Override
        public void accept(Visitor v) {
            v.visitDeclarationStat(this);
        }
    }

    /**
     * An expression used as a statement. {@code tok} is {@link Token#ILLEGAL} for plain
     * expressions (including assignments), {@link Token#INC} or {@link Token#DEC} for
     * increments, and {@link Token#RETURN}, {@link Token#GO} or {@link Token#DEFER} for
     * statements led by that keyword, in which case {@code expr} may be {@code null}.
     */
    record ExpressionStat(int pos, Token tok, Expr expr) implements Stat {
        public ExpressionStat {
            tok = tok != null ? tok : Token.ILLEGAL;
        }

        @Override
        public void accept(Visitor v) {
            v.visitExpressionStat(this);
        }
    }

    record CompositeStat(int pos, Block body) implements Stat {
        public CompositeStat {
            requireNonNull(body, "body");
        }

        @Override
        public void accept(Visitor v) {
            v.visitCompositeStat(this);
        }
    }

    record IfStat(int pos, Stat init, Expr cond, Block body, Stat elseStat) implements Stat {
        public IfStat {
            requireNonNull(body, "body");
        }

        @Override
        public void accept(Visitor v) {
            v.visitIfStat(this);
        }
    }

    record ForStat(int pos, Stat init, Expr cond, Stat post, Block body) implements Stat {
        public ForStat {
            requireNonNull(body, "body");
        }

        @Override
        public void accept(Visitor v) {
            v.visitForStat(this);
        }
    }

    /** A case clause; {@code expr} is {@code null} for the default clause. */
    record CaseClause(int pos, Expr expr, Block body) implements Stat {
        public CaseClause {
            requireNonNull(body, "body");
        }

        @Override
        public void accept(Visitor v) {
            v.visitCaseClause(this);
        }
    }

    record SwitchStat(int pos, Stat init, Expr tag, Block body) implements Stat {
        public SwitchStat {
            requireNonNull(body, "body");
        }

        @Override
        public void accept(Visitor v) {
            v.visitSwitchStat(this);
        }
    }

    record SelectStat(int pos, Block body) implements Stat {
        public SelectStat {
            requireNonNull(body, "body");
        }

        @Override
        public void accept(Visitor v) {
            v.visitSelectStat(this);
        }
    }

    /**
     * {@code break}, {@code continue}, {@code goto} or {@code fallthrough}, with an
     * optional label.
     */
    record ControlFlowStat(int pos, Token tok, Expr.Ident label) implements Stat {
        public ControlFlowStat {
            requireNonNull(tok, "tok");
        }

        @Override
        public void accept(Visitor v) {
            v.visitControlFlowStat(this);
        }
    }

    record EmptyStat(int pos) implements Stat {
        @Override
        public void accept(Visitor v) {
            v.visitEmptyStat(this);
        }
    }
}
