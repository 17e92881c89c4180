package gmlmath.transforms.math;

import gmlmath.hir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* The ordered rule lists the traversal tries on each kind of node. The first
* rule of a list that changes the tree wins and the list is tried again from
* the top on the result.
*/
public class RuleTable {

    private final List<MathRule<BinaryExpression>> binary_rules;

    private final List<MathRule<AssignmentExpression>> assignment_rules;

    private final List<MathRule<FunctionCall>> call_rules;

    /**
    * Creates a table with the given rule lists.
    *
    * @param binary_rules rules for binary expressions.
    * @param assignment_rules rules for assignments.
    * @param call_rules rules for function calls.
    */
    public RuleTable(List<MathRule<BinaryExpression>> binary_rules,
            List<MathRule<AssignmentExpression>> assignment_rules,
            List<MathRule<FunctionCall>> call_rules) {
        this.binary_rules = Collections.unmodifiableList(
                new ArrayList<MathRule<BinaryExpression>>(binary_rules));
        this.assignment_rules = Collections.unmodifiableList(
                new ArrayList<MathRule<AssignmentExpression>>(assignment_rules));
        this.call_rules = Collections.unmodifiableList(
                new ArrayList<MathRule<FunctionCall>>(call_rules));
    }

    /** Returns the table of all rewrite rules in their fixed order. */
    public static RuleTable createDefault() {
        List<MathRule<BinaryExpression>> binary =
                new ArrayList<MathRule<BinaryExpression>>();
        binary.add(new OneMinusFactorRule());
        binary.add(new MultiplicativeIdentityRule());
        binary.add(new MultiplicationByZeroRule());
        binary.add(new AdditiveIdentityRule());
        binary.add(new DegreesToRadiansRule());
        binary.add(new DivisionByReciprocalRule());
        binary.add(new ReciprocalRatioRule());
        binary.add(new NegativeDivisionProductRule());
        binary.add(new ScalarProductRule());
        binary.add(new NumericChainRule());
        binary.add(new DistributedScalarRule());
        binary.add(new LengthdirHalfDifferenceRule());
        binary.add(new RepeatedPowerRule());
        binary.add(new SquareRule());
        binary.add(new MeanRule());
        binary.add(new Log2Rule());
        binary.add(new LengthdirRule());
        binary.add(new DotProductRule());
        List<MathRule<AssignmentExpression>> assignment =
                new ArrayList<MathRule<AssignmentExpression>>();
        assignment.add(new CompoundIdentityAssignmentRule());
        List<MathRule<FunctionCall>> call = new ArrayList<MathRule<FunctionCall>>();
        call.add(new PointDistanceRule());
        call.add(new PowerToSqrtRule());
        call.add(new PowerToExpRule());
        call.add(new PointDirectionRule());
        call.add(new TrigDegreeArgumentRule());
        return new RuleTable(binary, assignment, call);
    }

    public List<MathRule<BinaryExpression>> getBinaryRules() {
        return binary_rules;
    }

    public List<MathRule<AssignmentExpression>> getAssignmentRules() {
        return assignment_rules;
    }

    public List<MathRule<FunctionCall>> getCallRules() {
        return call_rules;
    }

}
