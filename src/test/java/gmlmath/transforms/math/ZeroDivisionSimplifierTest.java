package gmlmath.transforms.math;

import gmlmath.exec.OptionSet;
import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.Program;
import gmlmath.transforms.TransformPass;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ZeroDivisionSimplifierTest {

    private static String simplify(String text) throws ParseException {
        Program program = new Parser().parse(text);
        TransformPass.run(new ZeroDivisionSimplifier(program,
                NormalizationContext.forProgram(program, new OptionSet())));
        program.verify();
        return program.toString();
    }

    @Test
    void zeroDividendBecomesZero() throws ParseException {
        assertThat(simplify("var a = 0 / b;")).isEqualTo("var a = 0;\n");
        assertThat(simplify("var a = (1 - 1) / b;")).isEqualTo("var a = 0;\n");
    }

    @Test
    void keepsZeroOverZero() throws ParseException {
        assertThat(simplify("var a = 0 / 0;")).isEqualTo("var a = 0 / 0;\n");
    }

    @Test
    void keepsCommentedDividend() throws ParseException {
        assertThat(simplify("var a = /* none */ 0 / b;"))
                .isEqualTo("var a = /* none */ 0 / b;\n");
    }

    @Test
    void removesSimplifiedAlias() throws ParseException {
        assertThat(simplify("var a = 0 / b;\nvar a_simplified = 0;\nshow(a);"))
                .isEqualTo("var a = 0;\nshow(a);\n");
    }

    @Test
    void keepsReferencedAlias() throws ParseException {
        assertThat(simplify("var a = 0 / b;\nvar a_simplified = 0;\nshow(a_simplified);"))
                .isEqualTo("var a = 0;\nvar a_simplified = 0;\nshow(a_simplified);\n");
    }

}
