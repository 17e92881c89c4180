package gmlmath.transforms.math;

import gmlmath.exec.OptionSet;
import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.Program;
import gmlmath.transforms.TransformPass;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LengthdirAssignmentMergerTest {

    private static String merge(String text) throws ParseException {
        Program program = new Parser().parse(text);
        TransformPass.run(new LengthdirAssignmentMerger(program,
                NormalizationContext.forProgram(program, new OptionSet())));
        program.verify();
        return program.toString();
    }

    @Test
    void mergesScaledDeclaration() throws ParseException {
        assertThat(merge("var s = size * 0.104;\n"
                + "s = s - s * 0.5 - lengthdir_x(s * 0.5, angle);"))
                .isEqualTo("var s = size * 0.052 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void mergesHalvedForm() throws ParseException {
        assertThat(merge("var s = w;\n"
                + "s = s - s / 2 - lengthdir_x(s / 2, angle);"))
                .isEqualTo("var s = w * 0.5 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void foldsConstantInitializerFirst() throws ParseException {
        assertThat(merge("var s = 10;\n"
                + "s = s - s / 2 - lengthdir_x(s / 2, angle);"))
                .isEqualTo("var s = 5 * (1 - lengthdir_x(1, angle));\n");
    }

    @Test
    void keepsBlankLineAfterRemovedStatement() throws ParseException {
        assertThat(merge("var s = w;\n"
                + "s = s - s / 2 - lengthdir_x(s / 2, angle);\n\ndraw(s);"))
                .isEqualTo("var s = w * 0.5 * (1 - lengthdir_x(1, angle));\n"
                        + "\ndraw(s);\n");
    }

    @Test
    void declinesOtherFactors() throws ParseException {
        String text = "var s = w;\n"
                + "s = s - s * 0.25 - lengthdir_x(s * 0.25, angle);\n";
        assertThat(merge(text)).isEqualTo(text);
    }

    @Test
    void declinesAngleMentioningVariable() throws ParseException {
        String text = "var s = w;\n"
                + "s = s - s * 0.5 - lengthdir_x(s * 0.5, s);\n";
        assertThat(merge(text)).isEqualTo(text);
    }

}
