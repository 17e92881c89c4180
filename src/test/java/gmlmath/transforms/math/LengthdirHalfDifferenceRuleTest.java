package gmlmath.transforms.math;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static gmlmath.transforms.math.RuleFixture.binary;
import static org.assertj.core.api.Assertions.assertThat;

class LengthdirHalfDifferenceRuleTest {

    @Test
    void factorsHalfDifference() throws ParseException {
        assertThat(binary(new LengthdirHalfDifferenceRule(),
                "s - s * 0.5 - lengthdir_y(s * 0.5, dir)"))
                .isEqualTo("s * 0.5 * (1 - lengthdir_y(1, dir))");
        assertThat(binary(new LengthdirHalfDifferenceRule(),
                "s - s / 2 - lengthdir_x(s / 2, dir)"))
                .isEqualTo("s * 0.5 * (1 - lengthdir_x(1, dir))");
    }

    @Test
    void otherFactorsAreLeftAlone() throws ParseException {
        assertThat(binary(new LengthdirHalfDifferenceRule(),
                "s - s * 0.25 - lengthdir_x(s * 0.25, dir)")).isNull();
        assertThat(binary(new LengthdirHalfDifferenceRule(),
                "s - t * 0.5 - lengthdir_x(s * 0.5, dir)")).isNull();
    }

    @Test
    void promotesIntoPrecedingDeclaration() throws ParseException {
        String text = "var s = size * 0.104;\n"
                + "s = s - s * 0.5 - lengthdir_x(s * 0.5, angle);";
        Program program = applyToLastAssignment(text);
        assertThat(program.toString()).isEqualTo(
                "var s = size * 0.052 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void promotionFoldsConstantInitializer() throws ParseException {
        String text = "var s = 10;\n"
                + "s = s - s / 2 - lengthdir_x(s / 2, angle);";
        Program program = applyToLastAssignment(text);
        assertThat(program.toString()).isEqualTo(
                "var s = 5 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void promotionStopsAtInterveningUse() throws ParseException {
        String text = "var s = size;\nshow(s);\n"
                + "s = s - s * 0.5 - lengthdir_x(s * 0.5, angle);";
        Program program = applyToLastAssignment(text);
        assertThat(program.toString()).isEqualTo("var s = size;\nshow(s);\n"
                + "s = s * 0.5 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void promotionNeedsAngleIndependentOfVariable() throws ParseException {
        String text = "var s = size;\n"
                + "s = s - s * 0.5 - lengthdir_x(s * 0.5, s);";
        Program program = applyToLastAssignment(text);
        assertThat(program.toString()).isEqualTo("var s = size;\n"
                + "s = s * 0.5 * (1 - lengthdir_x(1, s));\n");
    }

    private static Program applyToLastAssignment(String text)
            throws ParseException {
        Program program = new Parser().parse(text);
        List<Statement> stmts = program.getBody().getStatements();
        ExpressionStatement last = (ExpressionStatement)stmts.get(stmts.size() - 1);
        AssignmentExpression assign = (AssignmentExpression)last.getExpression();
        NormalizationContext ctx = new NormalizationContext(text, program);
        boolean changed = new LengthdirHalfDifferenceRule().apply(
                (BinaryExpression)assign.getRHS(), ctx);
        assertThat(changed).isTrue();
        program.verify();
        return program;
    }

}
