package gmlmath.hir;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IRToolsTest {

    private static ExpressionStatement hold(String text) throws ParseException {
        return new ExpressionStatement(new Parser().parseExpression(text));
    }

    @Test
    void replacesExpressionInParentSlot() throws ParseException {
        ExpressionStatement stmt = hold("a + b");
        BinaryExpression be = (BinaryExpression)stmt.getExpression();
        Expression old = be.getRHS();
        IRTools.replaceExpression(old, new Identifier("c"));
        assertThat(stmt.toString()).isEqualTo("a + c;");
        assertThat(old.getParent()).isNull();
        assertThat(be.getRHS().getParent()).isSameAs(be);
        stmt.verify();
    }

    @Test
    void liftsDescendantIntoPlace() throws ParseException {
        ExpressionStatement stmt = hold("x * ((y))");
        BinaryExpression be = (BinaryExpression)stmt.getExpression();
        Expression inner = ParenthesizedExpression.unwrap(be.getRHS());
        IRTools.replaceExpression(be.getRHS(), inner);
        assertThat(stmt.toString()).isEqualTo("x * y;");
        assertThat(inner.getParent()).isSameAs(be);
        stmt.verify();
    }

    @Test
    void refusesAttachedReplacement() throws ParseException {
        final ExpressionStatement stmt = hold("a + b");
        final ExpressionStatement other = hold("c");
        assertThrows(NotAnOrphanException.class, new Executable() {
            public void execute() {
                BinaryExpression be = (BinaryExpression)stmt.getExpression();
                IRTools.replaceExpression(be.getLHS(), other.getExpression());
            }
        });
        assertThrows(IllegalArgumentException.class, new Executable() {
            public void execute() {
                IRTools.replaceExpression(new Identifier("z"), new Identifier("w"));
            }
        });
    }

    @Test
    void walksAncestorsAndDescendants() throws ParseException {
        Program program = new Parser().parse("var a = f(b, c * d);");
        List<Identifier> ids =
                IRTools.getDescendentsOfType(program, Identifier.class);
        assertThat(ids).extracting("name")
                .containsExactly("a", "f", "b", "c", "d");
        Identifier d = ids.get(4);
        assertThat(IRTools.getAncestorOfType(d, VariableDeclaration.class))
                .isSameAs(program.getBody().getStatements().get(0));
        assertThat(IRTools.isDescendantOf(d, program)).isTrue();
        assertThat(IRTools.isDescendantOf(program, program)).isFalse();
        assertThat(IRTools.getProgram(d)).isSameAs(program);
        assertThat(IRTools.containsClass(program, FunctionCall.class)).isTrue();
        assertThat(IRTools.containsComments(program)).isFalse();
    }

    @Test
    void snapshotSurvivesEdits() throws ParseException {
        ExpressionStatement stmt = hold("a * b + c");
        List<Identifier> ids =
                new DFIterator<Identifier>(stmt, Identifier.class).getList();
        IRTools.replaceExpression(ids.get(2), new Literal("1"));
        assertThat(ids).hasSize(3);
        assertThat(stmt.toString()).isEqualTo("a * b + 1;");
    }

}
