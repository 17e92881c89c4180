package gmlmath.transforms.math;

import gmlmath.exec.OptionSet;
import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatementToolsTest {

    private static Statement statement(Program program, int n) {
        return program.getBody().getStatements().get(n);
    }

    @Test
    void findsPrecedingDeclaration() throws ParseException {
        Program program = new Parser().parse("var a = 1;\nvar b = 2;\nb = a;");
        VariableDeclaration decl =
                StatementTools.findPrecedingDeclaration(statement(program, 2), "a");
        assertThat(decl).isSameAs(statement(program, 0));
        assertThat(StatementTools.findPrecedingDeclaration(
                statement(program, 2), "c")).isNull();
    }

    @Test
    void precedingSearchStopsAtUse() throws ParseException {
        Program program = new Parser().parse("var a = 1;\nshow(a);\na = 2;");
        assertThat(StatementTools.findPrecedingDeclaration(
                statement(program, 2), "a")).isNull();
    }

    @Test
    void searchesOnlyInsideStatementLists() throws ParseException {
        Program program = new Parser().parse("var a = 1;\nif (c) a = 2;");
        IfStatement stmt = (IfStatement)statement(program, 1);
        assertThat(StatementTools.findPrecedingDeclaration(
                stmt.getThenStatement(), "a")).isNull();
    }

    @Test
    void removedStatementKeepsBlankLine() throws ParseException {
        Program program = new Parser().parse("a = 1;\nb = 2;\n\nc = 3;");
        assertThat(StatementTools.removeStatement(statement(program, 1))).isTrue();
        assertThat(program.toString()).isEqualTo("a = 1;\n\nc = 3;\n");
    }

    @Test
    void findsReferences() throws ParseException {
        Program program = new Parser().parse("x = foo(y, z.w);");
        assertThat(StatementTools.references(program, "y")).isTrue();
        assertThat(StatementTools.references(program, "foo")).isTrue();
        assertThat(StatementTools.references(program, "q")).isFalse();
    }

    @Test
    void recordsOriginalDeclaration() throws ParseException {
        String text = "var k = x * 2 * 0.5;";
        Program program = new Parser().parse(text);
        OptionSet options = new OptionSet();
        options.setValue(OptionSet.RECORD_ORIGINAL, 1);
        NormalizationContext ctx = NormalizationContext.forProgram(program, options);
        VariableDeclaration decl = (VariableDeclaration)statement(program, 0);
        boolean changed = new SimpleScalarProductRule().apply(
                (BinaryExpression)decl.getDeclarator(0).getInitializer(), ctx);
        assertThat(changed).isTrue();
        assertThat(program.toString())
                .isEqualTo("// original: var k = x * 2 * 0.5;\nvar k = x;\n");
        List<Statement> stmts = program.getBody().getStatements();
        assertThat(((VariableDeclaration)stmts.get(0)).isOriginalForm()).isTrue();
        assertThat(decl.isOriginalRecorded()).isTrue();
        assertThat(StatementTools.recordOriginal(
                decl.getDeclarator(0).getInitializer(),
                new Identifier("y"))).isFalse();
    }

}
