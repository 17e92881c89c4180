package gmlmath.base.grammars;

import gmlmath.hir.AccessExpression;
import gmlmath.hir.ArrayAccess;
import gmlmath.hir.AssignmentExpression;
import gmlmath.hir.AssignmentOperator;
import gmlmath.hir.BinaryExpression;
import gmlmath.hir.BinaryOperator;
import gmlmath.hir.Comment;
import gmlmath.hir.CompoundStatement;
import gmlmath.hir.Expression;
import gmlmath.hir.ExpressionStatement;
import gmlmath.hir.FunctionCall;
import gmlmath.hir.Identifier;
import gmlmath.hir.IfStatement;
import gmlmath.hir.Literal;
import gmlmath.hir.NullStatement;
import gmlmath.hir.ParenthesizedExpression;
import gmlmath.hir.Procedure;
import gmlmath.hir.Program;
import gmlmath.hir.ReturnStatement;
import gmlmath.hir.Statement;
import gmlmath.hir.UnaryExpression;
import gmlmath.hir.UnaryOperator;
import gmlmath.hir.VariableDeclaration;
import gmlmath.hir.VariableDeclarator;
import gmlmath.hir.WhileLoop;
import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
* Visitor that turns the ANTLR parse tree of a GML script into the IR.
* Besides building nodes it records source spans and distributes the
* comments of the hidden channel:
* <ul>
* <li>comments before a statement become its leading comments,</li>
* <li>a comment after a statement on the same line becomes its trailing
*     comment,</li>
* <li>comments inside a statement go to the expression starting right after
*     them, or else to the expression ending right before them,</li>
* <li>comments before a closing brace or the end of the file become closing
*     comments of the enclosing statement list.</li>
* </ul>
* A builder instance is good for one parse only.
*/
public class GmlTreeBuilder extends GmlBaseVisitor<Object> {

    private static final Pattern BLANK_LINE = Pattern.compile("\n[ \t\r\f]*\n");

    private final BufferedTokenStream tokens;

    private final String source_text;

    /** Indices of comment tokens already attached somewhere */
    private final Set<Integer> claimed;

    /** Outermost non-binary expression starting at a token index */
    private final Map<Integer, Expression> starting;

    /** Innermost expression ending at a token index */
    private final Map<Integer, Expression> ending;

    public GmlTreeBuilder(BufferedTokenStream tokens, String source_text) {
        this.tokens = tokens;
        this.source_text = source_text;
        claimed = new HashSet<Integer>();
        starting = new HashMap<Integer, Expression>();
        ending = new HashMap<Integer, Expression>();
    }

    /* Entry points */

    @Override
    public Program visitProgram(GmlParser.ProgramContext ctx) {
        Program program = new Program(source_text);
        buildStatementList(program.getBody(), ctx.statement(),
                ctx.EOF().getSymbol());
        return program;
    }

    @Override
    public Expression visitSingleExpression(GmlParser.SingleExpressionContext ctx) {
        Expression expr = expr(ctx.expression());
        attachLeadingComments(expr, ctx.getStart());
        attachInnerComments(null, expr, ctx.expression());
        return expr;
    }

    /* Statements */

    @Override
    public CompoundStatement visitBlock(GmlParser.BlockContext ctx) {
        CompoundStatement block = new CompoundStatement();
        setSpan(block, ctx);
        buildStatementList(block, ctx.statement(), ctx.getStop());
        return block;
    }

    @Override
    public Statement visitBlockStatement(GmlParser.BlockStatementContext ctx) {
        return visitBlock(ctx.block());
    }

    @Override
    public Statement
            visitVariableStatement(GmlParser.VariableStatementContext ctx) {
        List<VariableDeclarator> declarators =
                new ArrayList<VariableDeclarator>(ctx.variableDeclarator().size());
        for (GmlParser.VariableDeclaratorContext d : ctx.variableDeclarator()) {
            Identifier id = new Identifier(d.Identifier().getText());
            setSpan(id, d.Identifier().getSymbol());
            Expression init = null;
            if (d.expression() != null) {
                init = expr(d.expression());
            }
            declarators.add(new VariableDeclarator(id, init));
        }
        VariableDeclaration decl = new VariableDeclaration(declarators);
        setSpan(decl, ctx);
        return decl;
    }

    @Override
    public Statement visitIfStatement(GmlParser.IfStatementContext ctx) {
        Expression cond = expr(ctx.expression());
        Statement then_stmt = stmt(ctx.statement(0));
        IfStatement ret;
        if (ctx.statement().size() > 1) {
            ret = new IfStatement(cond, then_stmt, stmt(ctx.statement(1)));
        } else {
            ret = new IfStatement(cond, then_stmt);
        }
        setSpan(ret, ctx);
        return ret;
    }

    @Override
    public Statement visitWhileStatement(GmlParser.WhileStatementContext ctx) {
        WhileLoop ret = new WhileLoop(expr(ctx.expression()),
                stmt(ctx.statement()));
        setSpan(ret, ctx);
        return ret;
    }

    @Override
    public Statement visitReturnStatement(GmlParser.ReturnStatementContext ctx) {
        ReturnStatement ret;
        if (ctx.expression() != null) {
            ret = new ReturnStatement(expr(ctx.expression()));
        } else {
            ret = new ReturnStatement();
        }
        setSpan(ret, ctx);
        return ret;
    }

    @Override
    public Statement
            visitFunctionDeclaration(GmlParser.FunctionDeclarationContext ctx) {
        List<Identifier> params = new ArrayList<Identifier>();
        if (ctx.parameterList() != null) {
            for (TerminalNode param : ctx.parameterList().Identifier()) {
                Identifier id = new Identifier(param.getText());
                setSpan(id, param.getSymbol());
                params.add(id);
            }
        }
        Procedure proc = new Procedure(ctx.Identifier().getText(), params,
                visitBlock(ctx.block()));
        setSpan(proc, ctx);
        return proc;
    }

    @Override
    public Statement
            visitAssignmentStatement(GmlParser.AssignmentStatementContext ctx) {
        Expression lhs = expr(ctx.expression(0));
        Expression rhs = expr(ctx.expression(1));
        AssignmentOperator op =
                AssignmentOperator.fromString(ctx.assignmentOperator().getText());
        AssignmentExpression assign = new AssignmentExpression(lhs, op, rhs);
        assign.setSpan(lhs.getStart(), rhs.getEnd());
        ExpressionStatement ret = new ExpressionStatement(assign);
        setSpan(ret, ctx);
        return ret;
    }

    @Override
    public Statement
            visitExpressionStatement(GmlParser.ExpressionStatementContext ctx) {
        ExpressionStatement ret =
                new ExpressionStatement(expr(ctx.expression()));
        setSpan(ret, ctx);
        return ret;
    }

    @Override
    public Statement visitEmptyStatement(GmlParser.EmptyStatementContext ctx) {
        NullStatement ret = new NullStatement();
        setSpan(ret, ctx);
        return ret;
    }

    /* Expressions */

    @Override
    public Expression visitMemberExpression(GmlParser.MemberExpressionContext ctx) {
        Identifier member = new Identifier(ctx.Identifier().getText());
        setSpan(member, ctx.Identifier().getSymbol());
        return register(new AccessExpression(expr(ctx.expression()), member), ctx);
    }

    @Override
    public Expression visitIndexExpression(GmlParser.IndexExpressionContext ctx) {
        Expression array = expr(ctx.expression(0));
        List<Expression> indices = new ArrayList<Expression>();
        for (int i = 1; i < ctx.expression().size(); i++) {
            indices.add(expr(ctx.expression(i)));
        }
        return register(new ArrayAccess(array, indices), ctx);
    }

    @Override
    public Expression visitCallExpression(GmlParser.CallExpressionContext ctx) {
        Expression callee = expr(ctx.expression());
        List<Expression> args = new ArrayList<Expression>();
        if (ctx.arguments() != null) {
            for (GmlParser.ExpressionContext arg : ctx.arguments().expression()) {
                args.add(expr(arg));
            }
        }
        return register(new FunctionCall(callee, args), ctx);
    }

    @Override
    public Expression visitUnaryExpression(GmlParser.UnaryExpressionContext ctx) {
        UnaryOperator op = UnaryOperator.fromString(ctx.op.getText());
        return register(new UnaryExpression(op, expr(ctx.expression())), ctx);
    }

    @Override
    public Expression visitBinaryExpression(GmlParser.BinaryExpressionContext ctx) {
        BinaryOperator op = BinaryOperator.fromString(ctx.op.getText());
        BinaryExpression ret = new BinaryExpression(expr(ctx.expression(0)), op,
                expr(ctx.expression(1)));
        setSpan(ret, ctx);
        // Binary nodes only anchor comments that follow them.
        int stop = ctx.getStop().getTokenIndex();
        if (!ending.containsKey(stop)) {
            ending.put(stop, ret);
        }
        return ret;
    }

    @Override
    public Expression
            visitParenthesizedExpression(GmlParser.ParenthesizedExpressionContext ctx) {
        return register(new ParenthesizedExpression(expr(ctx.expression())), ctx);
    }

    @Override
    public Expression
            visitIdentifierExpression(GmlParser.IdentifierExpressionContext ctx) {
        return register(new Identifier(ctx.Identifier().getText()), ctx);
    }

    @Override
    public Expression visitLiteralExpression(GmlParser.LiteralExpressionContext ctx) {
        return register(new Literal(ctx.literal().getText()), ctx);
    }

    /* Helpers */

    private Expression expr(GmlParser.ExpressionContext ctx) {
        return (Expression)visit(ctx);
    }

    private Statement stmt(GmlParser.StatementContext ctx) {
        return (Statement)visit(ctx);
    }

    private Expression register(Expression expr, ParserRuleContext ctx) {
        setSpan(expr, ctx);
        starting.put(ctx.getStart().getTokenIndex(), expr);
        int stop = ctx.getStop().getTokenIndex();
        if (!ending.containsKey(stop)) {
            ending.put(stop, expr);
        }
        return expr;
    }

    private static void setSpan(Expression expr, ParserRuleContext ctx) {
        expr.setSpan(ctx.getStart().getStartIndex(),
                ctx.getStop().getStopIndex() + 1);
    }

    private static void setSpan(Expression expr, Token token) {
        expr.setSpan(token.getStartIndex(), token.getStopIndex() + 1);
    }

    private static void setSpan(Statement stmt, ParserRuleContext ctx) {
        stmt.setSpan(ctx.getStart().getStartIndex(),
                ctx.getStop().getStopIndex() + 1);
    }

    /**
    * Builds the statements of a list in source order, distributing comments
    * and blank-line markers, then collects the comments before the closing
    * token.
    */
    private void buildStatementList(CompoundStatement list,
            List<GmlParser.StatementContext> contexts, Token closing) {
        List<Statement> built = new ArrayList<Statement>(contexts.size());
        for (GmlParser.StatementContext ctx : contexts) {
            List<Comment> leading = claimHiddenComments(
                    tokens.getHiddenTokensToLeft(ctx.getStart().getTokenIndex()));
            Statement stmt = stmt(ctx);
            for (Comment comment : leading) {
                stmt.addComment(comment);
            }
            attachInnerComments(stmt, null, ctx);
            attachTrailingComment(stmt, ctx.getStop());
            list.addStatement(stmt);
            built.add(stmt);
        }
        for (int i = 0; i + 1 < built.size(); i++) {
            int from = built.get(i).getEnd();
            int to = visualStart(contexts.get(i + 1));
            if (from >= 0 && to > from
                    && BLANK_LINE.matcher(source_text.substring(from, to)).find()) {
                built.get(i).setFollowingBlankLine(true);
            }
        }
        for (Comment comment : claimHiddenComments(
                tokens.getHiddenTokensToLeft(closing.getTokenIndex()))) {
            list.addClosingComment(comment);
        }
    }

    /** Returns the offset of the first comment or token of a statement. */
    private int visualStart(ParserRuleContext ctx) {
        List<Token> hidden =
                tokens.getHiddenTokensToLeft(ctx.getStart().getTokenIndex());
        if (hidden != null) {
            for (Token t : hidden) {
                if (isComment(t)) {
                    return t.getStartIndex();
                }
            }
        }
        return ctx.getStart().getStartIndex();
    }

    private void attachLeadingComments(Expression expr, Token start) {
        for (Comment comment : claimHiddenComments(
                tokens.getHiddenTokensToLeft(start.getTokenIndex()))) {
            expr.addComment(comment);
        }
    }

    /**
    * Attaches comments on the same line after a statement, stopping at the
    * first line break.
    */
    private void attachTrailingComment(Statement stmt, Token stop) {
        List<Token> hidden = tokens.getHiddenTokensToRight(stop.getTokenIndex());
        if (hidden == null) {
            return;
        }
        StringBuilder sb = null;
        int start = -1, end = -1;
        for (Token t : hidden) {
            if (!isComment(t)) {
                if (t.getText().indexOf('\n') >= 0) {
                    break;
                }
                continue;
            }
            if (claimed.contains(t.getTokenIndex())) {
                continue;
            }
            claimed.add(t.getTokenIndex());
            if (sb == null) {
                sb = new StringBuilder(t.getText());
                start = t.getStartIndex();
            } else {
                sb.append(" ").append(t.getText());
            }
            end = t.getStopIndex() + 1;
            if (t.getType() != GmlLexer.BlockComment) {
                // A line comment runs to the end of the line.
                break;
            }
        }
        if (sb != null) {
            stmt.setTrailingComment(new Comment(sb.toString(), start, end));
        }
    }

    /**
    * Attaches the still unclaimed comments inside the token range of the
    * given context to nearby expressions. Comments without a neighboring
    * expression go to the statement, or to the fallback expression.
    */
    private void attachInnerComments(Statement stmt, Expression fallback,
            ParserRuleContext ctx) {
        int first = ctx.getStart().getTokenIndex();
        int last = ctx.getStop().getTokenIndex();
        for (int i = first; i <= last; i++) {
            Token t = tokens.get(i);
            if (!isComment(t) || claimed.contains(i)) {
                continue;
            }
            claimed.add(i);
            Comment comment = toComment(t);
            Expression next = starting.get(nextDefaultToken(i));
            Expression prev = ending.get(previousDefaultToken(i));
            if (next != null) {
                next.addComment(comment);
            } else if (prev != null) {
                prev.addTrailingComment(comment);
            } else if (stmt != null) {
                stmt.addComment(comment);
            } else {
                fallback.addComment(comment);
            }
        }
    }

    private List<Comment> claimHiddenComments(List<Token> hidden) {
        List<Comment> ret = new ArrayList<Comment>(2);
        if (hidden == null) {
            return ret;
        }
        for (Token t : hidden) {
            if (isComment(t) && !claimed.contains(t.getTokenIndex())) {
                claimed.add(t.getTokenIndex());
                ret.add(toComment(t));
            }
        }
        return ret;
    }

    private int nextDefaultToken(int index) {
        for (int i = index + 1; i < tokens.size(); i++) {
            if (tokens.get(i).getChannel() == Token.DEFAULT_CHANNEL) {
                return i;
            }
        }
        return -1;
    }

    private int previousDefaultToken(int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (tokens.get(i).getChannel() == Token.DEFAULT_CHANNEL) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isComment(Token t) {
        int type = t.getType();
        return type == GmlLexer.LineComment || type == GmlLexer.BlockComment
                || type == GmlLexer.Directive;
    }

    private static Comment toComment(Token t) {
        return new Comment(t.getText(), t.getStartIndex(), t.getStopIndex() + 1);
    }

}
