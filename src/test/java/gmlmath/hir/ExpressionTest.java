package gmlmath.hir;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExpressionTest {

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    @Test
    void parenthesizesSynthesizedOperands() {
        Expression sum = new BinaryExpression(id("a"), BinaryOperator.ADD, id("b"));
        assertThat(new BinaryExpression(sum, BinaryOperator.MULTIPLY, id("c"))
                .toString()).isEqualTo("(a + b) * c");
        Expression diff = new BinaryExpression(id("b"), BinaryOperator.SUBTRACT, id("c"));
        assertThat(new BinaryExpression(id("a"), BinaryOperator.SUBTRACT, diff)
                .toString()).isEqualTo("a - (b - c)");
        Expression product = new BinaryExpression(id("b"), BinaryOperator.MULTIPLY, id("c"));
        assertThat(new BinaryExpression(id("a"), BinaryOperator.MULTIPLY, product)
                .toString()).isEqualTo("a * b * c");
        assertThat(new UnaryExpression(UnaryOperator.MINUS,
                new BinaryExpression(id("x"), BinaryOperator.ADD, id("y")))
                .toString()).isEqualTo("-(x + y)");
    }

    @Test
    void cloneIsDetachedDeepCopy() throws ParseException {
        ExpressionStatement stmt =
                new ExpressionStatement(new Parser().parseExpression("f(a) * /* k */ 2"));
        Expression original = stmt.getExpression();
        Expression copy = original.clone();
        assertThat(copy.getParent()).isNull();
        assertThat(copy.toString()).isEqualTo(original.toString());
        ((BinaryExpression)copy).setOperator(BinaryOperator.ADD);
        assertThat(original.toString()).isEqualTo("f(a) * /* k */ 2");
        assertThat(copy.getStart()).isEqualTo(original.getStart());
    }

    @Test
    void movesCommentsToAnotherNode() {
        Expression from = id("a");
        from.addComment(new Comment("/* note */", 0, 10));
        Expression to = id("b");
        from.transferCommentsTo(to);
        assertThat(from.hasComments()).isFalse();
        assertThat(to.toString()).isEqualTo("/* note */ b");
    }

    @Test
    void printsRatioHintAfterStatement() {
        Literal number = new Literal("0.0069444444444");
        number.setRatioHint("(1/144)");
        ExpressionStatement stmt = new ExpressionStatement(new AssignmentExpression(
                id("r"), AssignmentOperator.NORMAL,
                new BinaryExpression(id("s"), BinaryOperator.MULTIPLY, number)));
        assertThat(stmt.toString()).isEqualTo("r = s * 0.0069444444444; /* (1/144) */");
    }

    @Test
    void swapsPositions() throws ParseException {
        ExpressionStatement stmt =
                new ExpressionStatement(new Parser().parseExpression("a - b"));
        BinaryExpression be = (BinaryExpression)stmt.getExpression();
        Expression a = be.getLHS();
        Expression b = be.getRHS();
        a.swapWith(b);
        assertThat(stmt.toString()).isEqualTo("b - a;");
        assertThat(a.getParent()).isSameAs(be);
        stmt.verify();
    }

    @Test
    void buildsCallArguments() {
        FunctionCall call = new FunctionCall(id("lengthdir_x"));
        call.addArgument(new Literal("1"));
        call.addArgument(id("dir"));
        assertThat(call.getNumArguments()).isEqualTo(2);
        assertThat(call.getCalleeName()).isEqualTo("lengthdir_x");
        assertThat(call.toString()).isEqualTo("lengthdir_x(1, dir)");
    }

}
