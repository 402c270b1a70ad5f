package com.prettyprinter.printer;

import com.prettyprinter.ast.Block;
import com.prettyprinter.ast.Decl;
import com.prettyprinter.ast.Expr;
import com.prettyprinter.ast.Field;
import com.prettyprinter.ast.Positions;
import com.prettyprinter.ast.Program;
import com.prettyprinter.ast.Signature;
import com.prettyprinter.ast.Stat;
import com.prettyprinter.ast.Token;
import com.prettyprinter.config.FormattingConfig;

import java.util.List;

/**
 * Renders declarations, statements and expressions through a {@link Printer}.
 *
 * <p>Layout decisions are made by scheduling separators, newlines and semantic states on
 * the session's {@link PrinterState}; they take effect with the next printed string.
 */
public class AstPrinter implements Expr.Visitor, Stat.Visitor, Decl.Visitor {
    // cutoff values of a binary operator chain
    private static final int UNSET = Integer.MIN_VALUE;
    private static final int NO_CUTOFF = Integer.MAX_VALUE;

    private final Printer printer;
    private final PrinterState state;
    private final FormattingConfig config;

    // operators binding tighter than the cutoff print without blanks
    private int cutoff = UNSET;
    private boolean chainOperand;

    public AstPrinter(Printer printer) {
        this.printer = printer;
        this.state = printer.state();
        this.config = printer.config();
    }

    // ----------------------------------------------------------------------------
    // Support

    private void token(int pos, Token tok) {
        printer.token(pos, tok);
    }

    private void separator(Separator separator) {
        state.setSeparator(separator);
    }

    private void newlines(int n) {
        state.setNewlines(n);
    }

    private void semanticState(SemanticState semanticState) {
        state.setSemanticState(semanticState);
    }

    private void idents(List<Expr.Ident> list) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                token(Positions.UNKNOWN, Token.COMMA);
                separator(Separator.BLANK);
                semanticState(SemanticState.INSIDE_LIST);
            }
            expr(list.get(i));
        }
    }

    private void parameters(List<Field> list) {
        token(Positions.UNKNOWN, Token.LPAREN);
        for (int i = 0; i < list.size(); i++) {
            Field par = list.get(i);
            if (i > 0) {
                separator(Separator.COMMA);
            }
            if (!par.isAnonymous()) {
                idents(par.getNames());
                separator(Separator.BLANK);
            }
            expr(par.getType());
        }
        token(Positions.UNKNOWN, Token.RPAREN);
    }

    private void signature(Signature sig) {
        parameters(sig.getParams());
        if (sig.hasResults()) {
            separator(Separator.BLANK);

            List<Field> results = sig.getResults();
            if (results.size() == 1 && results.get(0).isAnonymous()
                    && !(results.get(0).getType() instanceof Expr.FunctionType)) {
                // a single anonymous result needs no parentheses unless it is a function type
                expr(results.get(0).getType());
                return;
            }

            parameters(results);
        }
    }

    private void fields(List<Field> list, int end, boolean isInterface) {
        semanticState(SemanticState.OPENING_SCOPE);
        separator(Separator.BLANK);
        token(Positions.UNKNOWN, Token.LBRACE);

        if (!list.isEmpty()) {
            newlines(1);
            for (int i = 0; i < list.size(); i++) {
                Field fld = list.get(i);
                if (i > 0) {
                    separator(Separator.SEMICOLON);
                    newlines(1);
                }
                if (!fld.isAnonymous()) {
                    idents(fld.getNames());
                    separator(Separator.TAB);
                }
                if (isInterface) {
                    if (fld.getType() instanceof Expr.FunctionType) {
                        signature(((Expr.FunctionType) fld.getType()).signature());
                    } else {
                        expr(fld.getType());
                    }
                } else {
                    expr(fld.getType());
                    if (fld.getTag() != null) {
                        separator(Separator.TAB);
                        expr(fld.getTag());
                    }
                }
            }
            newlines(1);
        }

        semanticState(SemanticState.CLOSING_SCOPE);
        token(end, Token.RBRACE);
        state.setOptionalSemicolon(true);
    }

    // ----------------------------------------------------------------------------
    // Expressions

    /**
     * Prints {@code x} in an operator context of precedence {@code prec}.
     */
    public void expr1(Expr x, int prec) {
        boolean chained = chainOperand;
        chainOperand = false;
        if (x == null) {
            return; // empty expression list
        }

        int savedPrec = state.getPrecedence();
        int savedCutoff = cutoff;
        state.setPrecedence(prec);
        if (!chained) {
            cutoff = UNSET;
        }
        x.accept(this);
        state.setPrecedence(savedPrec);
        cutoff = savedCutoff;
    }

    public void expr(Expr x) {
        expr1(x, Token.LOWEST_PREC);
    }

    private void binaryOperand(Expr x, int prec) {
        chainOperand = true;
        expr1(x, prec);
    }

    private static boolean inChain(Token op) {
        return op.getPrecedence() > 0;
    }

    /**
     * Computes the cutoff for the chain of unparenthesized binary operators rooted at
     * {@code x}: the loosest precedence in the chain if it mixes precedences.
     */
    private static int blankCutoff(Expr.BinaryExpr x) {
        int[] range = {x.op().getPrecedence(), x.op().getPrecedence()};
        collectPrecedences(x, range);
        return range[0] == range[1] ? NO_CUTOFF : range[0];
    }

    private static void collectPrecedences(Expr.BinaryExpr x, int[] range) {
        int prec = x.op().getPrecedence();
        for (Expr operand : new Expr[]{x.x(), x.y()}) {
            if (operand instanceof Expr.BinaryExpr) {
                Expr.BinaryExpr b = (Expr.BinaryExpr) operand;
                int p = b.op().getPrecedence();
                if (inChain(b.op()) && p >= prec) {
                    range[0] = Math.min(range[0], p);
                    range[1] = Math.max(range[1], p);
                    collectPrecedences(b, range);
                }
            }
        }
    }

    private boolean blanksAround(int prec) {
        return cutoff == UNSET || cutoff == NO_CUTOFF || prec <= cutoff || prec < Token.ADDITIVE_PREC;
    }

    @Override
    public void visitBadExpr(Expr.BadExpr x) {
        printer.string(x.pos(), "BadExpr");
    }

    @Override
    public void visitIdent(Expr.Ident x) {
        printer.htmlIdentifier(x);
    }

    @Override
    public void visitBinaryExpr(Expr.BinaryExpr x) {
        if (x.op() == Token.COMMA) {
            // list separator, not an operator
            expr(x.x());
            token(x.pos(), Token.COMMA);
            separator(Separator.BLANK);
            semanticState(SemanticState.INSIDE_LIST);
            expr(x.y());
            return;
        }

        int prec = x.op().getPrecedence();
        boolean parens = prec < state.getPrecedence();
        if (!inChain(x.op())) {
            // assignments and colons: each operand starts anew
            if (parens) {
                token(Positions.UNKNOWN, Token.LPAREN);
            }
            expr1(x.x(), prec);
            separator(Separator.BLANK);
            token(x.pos(), x.op());
            separator(Separator.BLANK);
            expr1(x.y(), prec);
            if (parens) {
                token(Positions.UNKNOWN, Token.RPAREN);
            }
            return;
        }

        if (parens || cutoff == UNSET) {
            cutoff = blankCutoff(x);
        }
        boolean blanks = blanksAround(prec);

        if (parens) {
            token(Positions.UNKNOWN, Token.LPAREN);
        }
        binaryOperand(x.x(), prec);
        if (blanks) {
            separator(Separator.BLANK);
        }
        token(x.pos(), x.op());
        if (blanks) {
            separator(Separator.BLANK);
        }
        binaryOperand(x.y(), prec);
        if (parens) {
            token(Positions.UNKNOWN, Token.RPAREN);
        }
    }

    @Override
    public void visitUnaryExpr(Expr.UnaryExpr x) {
        int prec = Token.UNARY_PREC;
        boolean parens = prec < state.getPrecedence();
        if (parens) {
            token(Positions.UNKNOWN, Token.LPAREN);
        }
        token(x.pos(), x.op());
        if (x.op() == Token.RANGE) {
            separator(Separator.BLANK);
        }
        expr1(x.x(), prec);
        if (parens) {
            token(Positions.UNKNOWN, Token.RPAREN);
        }
    }

    @Override
    public void visitBasicLit(Expr.BasicLit x) {
        printer.string(x.pos(), x.value());
    }

    @Override
    public void visitFunctionLit(Expr.FunctionLit x) {
        token(x.pos(), Token.FUNC);
        signature(x.signature());
        separator(Separator.BLANK);
        block(x.body(), true);
        newlines(0);
    }

    @Override
    public void visitGroup(Expr.Group x) {
        token(x.pos(), Token.LPAREN);
        expr(x.x());
        token(Positions.UNKNOWN, Token.RPAREN);
    }

    @Override
    public void visitSelector(Expr.Selector x) {
        expr1(x.x(), Token.HIGHEST_PREC);
        token(x.pos(), Token.PERIOD);
        expr1(x.selector(), Token.HIGHEST_PREC);
    }

    @Override
    public void visitTypeGuard(Expr.TypeGuard x) {
        expr1(x.x(), Token.HIGHEST_PREC);
        token(x.pos(), Token.PERIOD);
        token(Positions.UNKNOWN, Token.LPAREN);
        expr(x.type());
        token(Positions.UNKNOWN, Token.RPAREN);
    }

    @Override
    public void visitIndex(Expr.Index x) {
        expr1(x.x(), Token.HIGHEST_PREC);
        token(x.pos(), Token.LBRACK);
        expr1(x.index(), 0);
        token(Positions.UNKNOWN, Token.RBRACK);
    }

    @Override
    public void visitCall(Expr.Call x) {
        expr1(x.fun(), Token.HIGHEST_PREC);
        token(x.pos(), Token.LPAREN);
        expr(x.args());
        token(Positions.UNKNOWN, Token.RPAREN);
    }

    @Override
    public void visitEllipsis(Expr.Ellipsis x) {
        token(x.pos(), Token.ELLIPSIS);
    }

    @Override
    public void visitArrayType(Expr.ArrayType x) {
        token(x.pos(), Token.LBRACK);
        if (x.len() != null) {
            expr(x.len());
        }
        token(Positions.UNKNOWN, Token.RBRACK);
        expr(x.element());
    }

    @Override
    public void visitStructType(Expr.StructType x) {
        token(x.pos(), Token.STRUCT);
        if (x.hasBody()) {
            fields(x.fields(), x.end(), false);
        }
    }

    @Override
    public void visitPointerType(Expr.PointerType x) {
        token(x.pos(), Token.MUL);
        expr(x.base());
    }

    @Override
    public void visitFunctionType(Expr.FunctionType x) {
        token(x.pos(), Token.FUNC);
        signature(x.signature());
    }

    @Override
    public void visitInterfaceType(Expr.InterfaceType x) {
        token(x.pos(), Token.INTERFACE);
        if (x.hasBody()) {
            fields(x.methods(), x.end(), true);
        }
    }

    @Override
    public void visitMapType(Expr.MapType x) {
        token(x.pos(), Token.MAP);
        separator(Separator.BLANK);
        token(Positions.UNKNOWN, Token.LBRACK);
        expr(x.key());
        token(Positions.UNKNOWN, Token.RBRACK);
        expr(x.value());
    }

    @Override
    public void visitChannelType(Expr.ChannelType x) {
        switch (x.dir()) {
            case BOTH -> token(x.pos(), Token.CHAN);
            case RECV -> {
                token(x.pos(), Token.ARROW);
                token(Positions.UNKNOWN, Token.CHAN);
            }
            case SEND -> {
                token(x.pos(), Token.CHAN);
                separator(Separator.BLANK);
                token(Positions.UNKNOWN, Token.ARROW);
            }
            default -> throw PrinterException.unreachable("channel direction " + x.dir(), x.pos());
        }
        separator(Separator.BLANK);
        expr(x.value());
    }

    // ----------------------------------------------------------------------------
    // Statements

    public void stat(Stat s) {
        s.accept(this);
    }

    private void statementList(List<Stat> list) {
        for (int i = 0; i < list.size(); i++) {
            if (i == 0) {
                newlines(1);
            } else if (!state.isOptionalSemicolon()) {
                separator(Separator.SEMICOLON);
            }
            stat(list.get(i));
            newlines(1);
            semanticState(SemanticState.INSIDE_LIST);
        }
    }

    private void block(Block b, boolean indent) {
        semanticState(SemanticState.OPENING_SCOPE);
        token(b.getPos(), b.getOpen());
        if (!indent) {
            state.outdent();
        }
        statementList(b.getStatements());
        if (!indent) {
            state.indent();
        }
        if (!config.isOptionalSemicolons()) {
            separator(Separator.NONE);
        }
        semanticState(SemanticState.CLOSING_SCOPE);
        if (b.isBraced()) {
            token(b.getEnd(), Token.RBRACE);
            state.setOptionalSemicolon(true);
        } else {
            printer.string(Positions.UNKNOWN, ""); // process the closing scope transition
        }
    }

    @Override
    public void visitBadStat(Stat.BadStat s) {
        printer.string(s.pos(), "BadStat");
    }

    @Override
    public void visitLabelDecl(Stat.LabelDecl s) {
        state.outdent();
        expr(s.label());
        token(s.pos(), Token.COLON);
        state.indent();
        state.setOptionalSemicolon(true); // a label is not terminated
    }

    @Override
    public void visitDeclarationStat(Stat.DeclarationStat s) {
        decl(s.decl());
    }

    @Override
    public void visitExpressionStat(Stat.ExpressionStat s) {
        switch (s.tok()) {
            case ILLEGAL -> expr(s.expr());
            case INC, DEC -> {
                expr(s.expr());
                token(s.pos(), s.tok());
            }
            case RETURN, GO, DEFER -> {
                token(s.pos(), s.tok());
                if (s.expr() != null) {
                    separator(Separator.BLANK);
                    expr(s.expr());
                }
            }
            default -> throw PrinterException.unreachable("expression statement token " + s.tok(), s.pos());
        }
    }

    @Override
    public void visitCompositeStat(Stat.CompositeStat s) {
        block(s.body(), true);
    }

    private void controlClause(boolean isForStat, Stat init, Expr expr, Stat post) {
        separator(Separator.BLANK);
        if (init == null && post == null) {
            // no semicolons required
            if (expr != null) {
                expr(expr);
            }
        } else {
            // all semicolons required; they are not separators, print them explicitly
            if (init != null) {
                stat(init);
                separator(Separator.NONE);
            }
            token(Positions.UNKNOWN, Token.SEMICOLON);
            separator(Separator.BLANK);
            if (expr != null) {
                expr(expr);
                separator(Separator.NONE);
            }
            if (isForStat) {
                token(Positions.UNKNOWN, Token.SEMICOLON);
                separator(Separator.BLANK);
                if (post != null) {
                    stat(post);
                }
            }
        }
        separator(Separator.BLANK);
    }

    @Override
    public void visitIfStat(Stat.IfStat s) {
        token(s.pos(), Token.IF);
        controlClause(false, s.init(), s.cond(), null);
        block(s.body(), true);
        if (s.elseStat() != null) {
            separator(Separator.BLANK);
            token(Positions.UNKNOWN, Token.ELSE);
            separator(Separator.BLANK);
            stat(s.elseStat());
        }
    }

    @Override
    public void visitForStat(Stat.ForStat s) {
        token(s.pos(), Token.FOR);
        controlClause(true, s.init(), s.cond(), s.post());
        block(s.body(), true);
    }

    @Override
    public void visitCaseClause(Stat.CaseClause s) {
        if (s.expr() != null) {
            token(s.pos(), Token.CASE);
            separator(Separator.BLANK);
            expr(s.expr());
        } else {
            token(s.pos(), Token.DEFAULT);
        }
        token(s.body().getPos(), Token.COLON);
        state.indent();
        statementList(s.body().getStatements());
        state.outdent();
        newlines(1);
    }

    @Override
    public void visitSwitchStat(Stat.SwitchStat s) {
        token(s.pos(), Token.SWITCH);
        controlClause(false, s.init(), s.tag(), null);
        block(s.body(), false);
    }

    @Override
    public void visitSelectStat(Stat.SelectStat s) {
        token(s.pos(), Token.SELECT);
        separator(Separator.BLANK);
        block(s.body(), false);
    }

    @Override
    public void visitControlFlowStat(Stat.ControlFlowStat s) {
        token(s.pos(), s.tok());
        if (s.label() != null) {
            separator(Separator.BLANK);
            expr(s.label());
        }
    }

    @Override
    public void visitEmptyStat(Stat.EmptyStat s) {
        printer.string(s.pos(), "");
    }

    // ----------------------------------------------------------------------------
    // Declarations

    public void decl(Decl d) {
        d.accept(this);
    }

    @Override
    public void visitBadDecl(Decl.BadDecl d) {
        printer.string(d.pos(), "BadDecl");
        newlines(2);
    }

    @Override
    public void visitImportDecl(Decl.ImportDecl d) {
        if (d.pos() > Positions.UNKNOWN) {
            token(d.pos(), Token.IMPORT);
            separator(Separator.BLANK);
        }
        if (d.name() != null) {
            expr(d.name());
        } else {
            printer.string(d.path().pos(), ""); // flush pending ';' separator and newlines
        }
        separator(Separator.TAB);
        if (d.path() instanceof Expr.BasicLit && ((Expr.BasicLit) d.path()).kind() == Token.STRING) {
            Expr.BasicLit lit = (Expr.BasicLit) d.path();
            printer.htmlPackageName(lit.pos(), lit.value());
        } else {
            expr(d.path());
        }
        newlines(2);
    }

    @Override
    public void visitConstDecl(Decl.ConstDecl d) {
        if (d.pos() > Positions.UNKNOWN) {
            token(d.pos(), Token.CONST);
            separator(Separator.BLANK);
        }
        valueDeclaration(d.names(), d.type(), d.values());
    }

    @Override
    public void visitTypeDecl(Decl.TypeDecl d) {
        if (d.pos() > Positions.UNKNOWN) {
            token(d.pos(), Token.TYPE);
            separator(Separator.BLANK);
        }
        expr(d.name());
        separator(Separator.BLANK);
        expr(d.type());
        newlines(2);
    }

    @Override
    public void visitVarDecl(Decl.VarDecl d) {
        if (d.pos() > Positions.UNKNOWN) {
            token(d.pos(), Token.VAR);
            separator(Separator.BLANK);
        }
        valueDeclaration(d.names(), d.type(), d.values());
    }

    private void valueDeclaration(List<Expr.Ident> names, Expr type, Expr values) {
        idents(names);
        if (type != null) {
            separator(Separator.BLANK);
            expr(type);
        }
        if (values != null) {
            separator(Separator.TAB);
            token(Positions.UNKNOWN, Token.ASSIGN);
            separator(Separator.BLANK);
            expr(values);
        }
        newlines(2);
    }

    @Override
    public void visitFuncDecl(Decl.FuncDecl d) {
        token(d.pos(), Token.FUNC);
        separator(Separator.BLANK);
        Field recv = d.receiver();
        if (recv != null) {
            token(Positions.UNKNOWN, Token.LPAREN);
            if (!recv.isAnonymous()) {
                expr(recv.getNames().get(0));
                separator(Separator.BLANK);
            }
            expr(recv.getType());
            token(Positions.UNKNOWN, Token.RPAREN);
            separator(Separator.BLANK);
        }
        expr(d.name());
        signature(d.signature());
        if (d.body() != null) {
            separator(Separator.BLANK);
            block(d.body(), true);
        }
        newlines(2);
    }

    @Override
    public void visitDeclList(Decl.DeclList d) {
        if (config.isExperimentalDef() && d.tok() != Token.VAR) {
            printer.string(d.pos(), "def");
        } else {
            token(d.pos(), d.tok());
        }
        separator(Separator.BLANK);

        semanticState(SemanticState.OPENING_SCOPE);
        token(Positions.UNKNOWN, Token.LPAREN);
        if (!d.list().isEmpty()) {
            newlines(1);
            for (int i = 0; i < d.list().size(); i++) {
                if (i > 0) {
                    separator(Separator.SEMICOLON);
                }
                decl(d.list().get(i));
                newlines(1);
            }
        }
        semanticState(SemanticState.CLOSING_SCOPE);
        token(d.end(), Token.RPAREN);
        state.setOptionalSemicolon(true);
        newlines(2);
    }

    // ----------------------------------------------------------------------------
    // Program

    public void program(Program p) {
        token(p.pos(), Token.PACKAGE);
        separator(Separator.BLANK);
        expr(p.name());
        newlines(1);
        for (Decl d : p.declarations()) {
            decl(d);
        }
        newlines(1);
    }
}
