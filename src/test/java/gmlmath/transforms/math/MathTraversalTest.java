package gmlmath.transforms.math;

import gmlmath.exec.ParseException;
import gmlmath.exec.Parser;
import gmlmath.hir.*;
import gmlmath.transforms.TransformPass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MathTraversalTest {

    /** Claims a change on every call without touching the tree. */
    private static class RestlessRule extends MathRule<BinaryExpression> {
        final List<String> seen = new ArrayList<String>();

        RestlessRule() {
            super("restless");
        }

        public boolean apply(BinaryExpression node, NormalizationContext ctx) {
            seen.add(node.toString());
            return true;
        }
    }

    @Test
    void stopsAtIterationCap() throws ParseException {
        ExpressionStatement holder = RuleFixture.hold("(x + y) + z");
        RestlessRule rule = new RestlessRule();
        List<MathRule<BinaryExpression>> binary =
                new ArrayList<MathRule<BinaryExpression>>();
        binary.add(rule);
        RuleTable table = new RuleTable(binary,
                Collections.<MathRule<AssignmentExpression>>emptyList(),
                Collections.<MathRule<FunctionCall>>emptyList());
        MathTraversal traversal = new MathTraversal(holder,
                new NormalizationContext("(x + y) + z", holder), table);
        TransformPass.run(traversal);
        assertThat(traversal.getNumRewrites()).isEqualTo(MathTraversal.MAX_ITERATIONS);
        assertThat(rule.seen).hasSize(MathTraversal.MAX_ITERATIONS);
        assertThat(rule.seen).containsOnly("(x + y) + z");
        assertThat(holder.getExpression().toString()).isEqualTo("(x + y) + z");
    }

    @Test
    void rewritesResultOfEarlierRule() throws ParseException {
        String text = "sqrt((x2 - x1) * (x2 - x1) + (y2 - y1) * (y2 - y1)) * 1";
        ExpressionStatement holder = RuleFixture.hold(text);
        MathTraversal traversal = new MathTraversal(holder,
                new NormalizationContext(text, holder));
        TransformPass.run(traversal);
        assertThat(holder.getExpression().toString())
                .isEqualTo("point_distance(x1, y1, x2, y2)");
        assertThat(traversal.getNumRewrites()).isEqualTo(2);
    }

    @Test
    void revisitsParentAfterChildChanged() throws ParseException {
        String text = "x * (1 - 0.25) * 2";
        ExpressionStatement holder = RuleFixture.hold(text);
        TransformPass.run(new MathTraversal(holder,
                new NormalizationContext(text, holder)));
        assertThat(holder.getExpression().toString()).isEqualTo("x * 1.5");
    }

    @Test
    void leavesOriginalFormDeclarationsAlone() throws ParseException {
        String text = "var a = x * 1;\nvar b = y * 1;";
        Program program = new Parser().parse(text);
        VariableDeclaration first =
                (VariableDeclaration)program.getBody().getStatements().get(0);
        first.setOriginalForm(true);
        TransformPass.run(new MathTraversal(program,
                new NormalizationContext(text, program)));
        assertThat(program.toString())
                .isEqualTo("// original: var a = x * 1;\nvar b = y;\n");
    }

    @Test
    void reachesNestedStatements() throws ParseException {
        String text = "function f(a) {\n    if (a > 0) {\n        return a * 1;\n    }\n}";
        Program program = new Parser().parse(text);
        TransformPass.run(new MathTraversal(program,
                new NormalizationContext(text, program)));
        assertThat(program.toString()).contains("return a;");
    }

}
