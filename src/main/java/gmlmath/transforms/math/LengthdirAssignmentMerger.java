package gmlmath.transforms.math;

import gmlmath.analysis.MathPatterns;
import gmlmath.analysis.NumericEvaluator;
import gmlmath.hir.*;
import gmlmath.transforms.TransformPass;

import java.util.List;

/**
* Merges a declaration with an immediately following reassignment of the
* form {@code s = s - s * 0.5 - lengthdir_x(s * 0.5, a);} into one
* declaration {@code var s = e * 0.5 * (1 - lengthdir_x(1, a));}. A
* numeric factor of {@code e} absorbs the one half.
*/
public class LengthdirAssignmentMerger extends TransformPass {

    private static String pass_name = "[LengthdirAssignmentMerger]";

    private final NormalizationContext ctx;

    private int num_merged;

    public LengthdirAssignmentMerger(Traversable root, NormalizationContext ctx) {
        super(root);
        this.ctx = ctx;
    }

    public String getPassName() {
        return pass_name;
    }

    public void start() {
        num_merged = 0;
        List<CompoundStatement> blocks =
                new DFIterator<CompoundStatement>(root, CompoundStatement.class)
                        .getList();
        for (CompoundStatement block : blocks) {
            mergeBlock(block);
        }
        PrintTools.printlnStatus(2, pass_name, "merged:", num_merged);
    }

    private void mergeBlock(CompoundStatement block) {
        List<Statement> stmts = block.getStatements();
        for (int i = 0; i + 1 < stmts.size(); i++) {
            if (merge(stmts.get(i), stmts.get(i + 1))) {
                num_merged++;
                stmts = block.getStatements();
                i--;
            }
        }
    }

    private boolean merge(Statement stmt, Statement next) {
        if (!(stmt instanceof VariableDeclaration)
                || !(next instanceof ExpressionStatement)) {
            return false;
        }
        VariableDeclaration decl = (VariableDeclaration)stmt;
        if (decl.isOriginalForm() || decl.getNumDeclarators() != 1
                || decl.hasComments() || next.hasComments()) {
            return false;
        }
        VariableDeclarator declarator = decl.getDeclarator(0);
        Expression init = declarator.getInitializer();
        if (init == null || IRTools.containsComments(init)) {
            return false;
        }
        Expression expr = ((ExpressionStatement)next).getExpression();
        if (!(expr instanceof AssignmentExpression)) {
            return false;
        }
        AssignmentExpression assign = (AssignmentExpression)expr;
        String name = declarator.getName();
        if (assign.getOperator() != AssignmentOperator.NORMAL
                || assign.hasComments()
                || !MathPatterns.isIdentifierNamed(assign.getLHS(), name)) {
            return false;
        }
        FunctionCall call = matchReassignment(assign.getRHS(), name);
        if (call == null) {
            return false;
        }
        Expression angle = call.getArgument(1);
        if (StatementTools.references(angle, name)) {
            return false;
        }
        Expression base = scaleInitializer(init.clone(), 0.5);
        Expression diff = new ParenthesizedExpression(MathRule.createBinary(
                MathRule.createLiteral("1", init), BinaryOperator.SUBTRACT,
                MathRule.createCall("lengthdir_x", call,
                        MathRule.createLiteral("1", call), angle.clone()),
                init)).copySpanFrom(init);
        declarator.setInitializer(MathRule.createBinary(base,
                BinaryOperator.MULTIPLY, diff, init));
        new ScalarCondensing(decl).start();
        Expression merged = declarator.getInitializer();
        if (merged instanceof BinaryExpression) {
            new SimpleScalarProductRule().apply((BinaryExpression)merged, ctx);
        }
        StatementTools.removeStatement(next);
        PrintTools.printlnStatus(3, pass_name, "merged into", decl);
        return true;
    }

    /*
    * s - s * f - lengthdir_x(s * f, a) with f one half; returns the
    * lengthdir_x call.
    */
    private static FunctionCall matchReassignment(Expression e, String name) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!NumericEvaluator.isBinary(expr, BinaryOperator.SUBTRACT)
                || IRTools.containsComments(expr)) {
            return null;
        }
        BinaryExpression root = (BinaryExpression)expr;
        FunctionCall call = MathPatterns.matchCall(root.getRHS(), "lengthdir_x", 2);
        Expression left = ParenthesizedExpression.unwrap(root.getLHS());
        if (call == null
                || !NumericEvaluator.isBinary(left, BinaryOperator.SUBTRACT)) {
            return null;
        }
        BinaryExpression minuend = (BinaryExpression)left;
        if (!MathPatterns.isIdentifierNamed(minuend.getLHS(), name)) {
            return null;
        }
        Double f1 = factorOf(call.getArgument(0), name);
        Double f2 = factorOf(minuend.getRHS(), name);
        if (f1 == null || f2 == null
                || Math.abs(f1 - f2) > NumericEvaluator.tolerance(0)
                || !NumericEvaluator.isClose(f1, 0.5)) {
            return null;
        }
        return call;
    }

    // The factor f of s * f, f * s or s / d (f = 1 / d).
    private static Double factorOf(Expression e, String name) {
        Expression expr = ParenthesizedExpression.unwrap(e);
        if (!(expr instanceof BinaryExpression)) {
            return null;
        }
        BinaryExpression be = (BinaryExpression)expr;
        if (be.getOperator() == BinaryOperator.MULTIPLY) {
            if (MathPatterns.isIdentifierNamed(be.getLHS(), name)) {
                return NumericEvaluator.parseFactor(be.getRHS());
            }
            if (MathPatterns.isIdentifierNamed(be.getRHS(), name)) {
                return NumericEvaluator.parseFactor(be.getLHS());
            }
        } else if (be.getOperator() == BinaryOperator.DIVIDE
                && MathPatterns.isIdentifierNamed(be.getLHS(), name)) {
            Double divisor = NumericEvaluator.parseFactor(be.getRHS());
            if (divisor != null
                    && Math.abs(divisor) > NumericEvaluator.tolerance(0)) {
                return 1 / divisor;
            }
        }
        return null;
    }

    /*
    * Folds a constant initializer into one number, scales a top-level
    * literal factor, or appends the factor.
    */
    private static Expression scaleInitializer(Expression init, double factor) {
        Expression expr = ParenthesizedExpression.unwrap(init);
        Double value = NumericEvaluator.evaluate(expr);
        if (value != null) {
            String text = MathRule.format(value * factor);
            if (text != null) {
                return MathRule.createNumber(text, init);
            }
        }
        if (NumericEvaluator.isBinary(expr, BinaryOperator.MULTIPLY)) {
            BinaryExpression be = (BinaryExpression)expr;
            Double rvalue = NumericEvaluator.parseFactor(be.getRHS());
            Double lvalue = NumericEvaluator.parseFactor(be.getLHS());
            if (rvalue != null && lvalue == null) {
                String text = MathRule.format(rvalue * factor);
                if (text != null) {
                    be.setRHS(MathRule.createNumber(text, be.getRHS()));
                    return init;
                }
            } else if (lvalue != null && rvalue == null) {
                String text = MathRule.format(lvalue * factor);
                if (text != null) {
                    be.setLHS(MathRule.createNumber(text, be.getLHS()));
                    return init;
                }
            }
        }
        return MathRule.createBinary(init, BinaryOperator.MULTIPLY,
                MathRule.createNumber(MathRule.format(factor), init), init);
    }

}
