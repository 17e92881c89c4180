package gmlmath.exec;

import gmlmath.hir.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParserTest {

    private final Parser parser = new Parser();

    @ParameterizedTest
    @ValueSource(strings = {
        "var a = x * 2, b;\n",
        "a.b[i, j] = f(1, \"s\") - -c;\n",
        "if (a > 0) {\n    b = 1;\n} else {\n    b = 2;\n}\n",
        "while (i < 10) {\n    i += 1;\n}\n",
        "function scale(v, k) {\n    var r = v * k;\n    return r;\n}\n",
        "// header\nx = 1; // note\n",
        "a = 1;\n\nb = 2;\n",
        "c = $FF + 0x10;\n"
    })
    void printsCanonicalTextUnchanged(String text) throws ParseException {
        Program program = parser.parse(text);
        program.verify();
        assertThat(program.toString()).isEqualTo(text);
    }

    @Test
    void printsKeywordOperatorsSymbolically() throws ParseException {
        assertThat(parser.parse("x = a and b or not c").toString())
                .isEqualTo("x = a && b || !c;\n");
        assertThat(parser.parse("y = p mod q div r").toString())
                .isEqualTo("y = p % q div r;\n");
    }

    @Test
    void keepsInnerComments() throws ParseException {
        Expression e = parser.parseExpression("a * /* scale */ b");
        BinaryExpression be = (BinaryExpression)e;
        assertThat(be.getRHS().hasComments()).isTrue();
        assertThat(e.toString()).isEqualTo("a * /* scale */ b");
        assertThat(e.getParent()).isNull();
    }

    @Test
    void keepsCommentsBeforeClosingBrace() throws ParseException {
        String text = "if (a) {\n    b = 1;\n    // done\n}\n";
        Program program = parser.parse(text);
        IfStatement stmt = (IfStatement)program.getBody().getStatements().get(0);
        CompoundStatement block = (CompoundStatement)stmt.getThenStatement();
        assertThat(block.getClosingComments()).hasSize(1);
        assertThat(program.toString()).isEqualTo(text);
    }

    @Test
    void recordsSourceSpans() throws ParseException {
        String text = "var s = size * 0.5;";
        Program program = parser.parse(text);
        VariableDeclaration decl =
                (VariableDeclaration)program.getBody().getStatements().get(0);
        Expression init = decl.getDeclarator(0).getInitializer();
        assertThat(text.substring(init.getStart(), init.getEnd()))
                .isEqualTo("size * 0.5");
        assertThat(program.getSourceText()).isEqualTo(text);
    }

    @Test
    void reportsSyntaxErrorPosition() {
        ParseException pe = assertThrows(ParseException.class, new Executable() {
            public void execute() throws Throwable {
                parser.parse("a = 1;\nvar b = ;");
            }
        });
        assertThat(pe.getMessage()).contains("line 2").contains("^");
        assertThat(pe.getLine()).isEqualTo(2);
        assertThat(pe.getColumn()).isEqualTo(8);
    }

    @Test
    void rejectsTrailingTokensInExpression() {
        assertThrows(ParseException.class, new Executable() {
            public void execute() throws Throwable {
                parser.parseExpression("a b");
            }
        });
    }

    @Test
    void readsFile(@TempDir File dir) throws IOException, ParseException {
        File file = new File(dir, "step.gml");
        Files.write(file.toPath(), "x = y * 1;".getBytes(StandardCharsets.UTF_8));
        assertThat(parser.parse(file).toString()).isEqualTo("x = y * 1;\n");
    }

}
