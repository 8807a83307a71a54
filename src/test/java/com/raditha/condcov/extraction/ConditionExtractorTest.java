package com.raditha.condcov.extraction;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.raditha.condcov.model.ClassInfo;
import com.raditha.condcov.model.ConditionKind;
import com.raditha.condcov.model.ConditionNode;
import com.raditha.condcov.model.LineRange;
import com.raditha.condcov.model.Scope;
import com.raditha.condcov.model.SourceStructure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConditionExtractor.
 */
class ConditionExtractorTest {

    private ConditionExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ConditionExtractor();
    }

    @Test
    void testSingleComparison() throws SourceParseException {
        String code = """
                class Guard {
                    int positive(int x) {
                        if (x > 0) {
                            return x;
                        }
                        return 0;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(1, structure.conditionCount());
        ConditionNode condition = structure.conditions().get(0);
        assertEquals(3, condition.line());
        assertEquals(ConditionKind.COMPARISON, condition.kind());
    }

    @Test
    void testCombinationAndNegationOnSameLine() throws SourceParseException {
        String code = """
                class Foo {
                    void bar(boolean a, boolean b) {
                        if (a && !b) {
                            return;
                        }
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(2, structure.conditionCount());
        assertEquals(EnumSet.of(ConditionKind.BOOLEAN_COMBINATION, ConditionKind.LOGICAL_NEGATION),
                structure.kindsByLine().get(3));
        assertTrue(structure.conditions().stream()
                .allMatch(c -> c.scope().equals(new Scope.MethodScope("Foo", "bar(boolean, boolean)"))));
    }

    @Test
    void testComparisonInsideCombinationCountsTwice() throws SourceParseException {
        String code = """
                class Eq {
                    boolean same(int a, int b, boolean c) {
                        return a == b && c;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(2, structure.conditionCount());
        assertEquals(EnumSet.of(ConditionKind.COMPARISON, ConditionKind.BOOLEAN_COMBINATION),
                structure.kindsByLine().get(3));
    }

    @Test
    void testAllComparisonOperators() throws SourceParseException {
        String code = """
                class Ops {
                    void all(int a, int b) {
                        boolean r1 = a == b;
                        boolean r2 = a != b;
                        boolean r3 = a < b;
                        boolean r4 = a > b;
                        boolean r5 = a <= b;
                        boolean r6 = a >= b;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(6, structure.conditionCount());
        assertTrue(structure.conditions().stream().allMatch(c -> c.kind() == ConditionKind.COMPARISON));
    }

    @Test
    void testArithmeticAndBitwiseAreNotConditions() throws SourceParseException {
        String code = """
                class Math2 {
                    int mix(int a, int b, boolean c) {
                        int x = -a + ~b;
                        int y = (a & b) | (a ^ b) << 2;
                        boolean z = c & true;
                        return x * y;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(0, structure.conditionCount(), "Only !, &&, || and comparisons are conditions");
    }

    @Test
    void testSameOperatorChainIsOneCondition() throws SourceParseException {
        String code = """
                class Chain {
                    boolean all(boolean a, boolean b, boolean c, boolean d) {
                        return a && b && c && d;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(1, structure.conditionCount());
        assertEquals(ConditionKind.BOOLEAN_COMBINATION, structure.conditions().get(0).kind());
    }

    @Test
    void testMixedOperatorsAreSeparateConditions() throws SourceParseException {
        String code = """
                class Mixed {
                    boolean any(boolean a, boolean b, boolean c) {
                        return a && b || c;
                    }
                    boolean grouped(boolean a, boolean b, boolean c) {
                        return a && (b && c);
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        List<ConditionNode> conditions = structure.conditions();
        assertEquals(2, conditions.stream().filter(c -> c.line() == 3).count(), "|| over && is two conditions");
        assertEquals(2, conditions.stream().filter(c -> c.line() == 6).count(), "parenthesized chain is its own");
    }

    @Test
    void testOperandOrderDoesNotChangeTheCount() throws SourceParseException {
        String code = """
                class Order {
                    boolean left(boolean a, boolean b, boolean c) { return a && b || c; }
                    boolean right(boolean a, boolean b, boolean c) { return c || a && b; }
                    boolean nested(int x) { return x > 1 == x < 9; }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        List<ConditionNode> left = structure.conditions().stream().filter(c -> c.line() == 2).toList();
        List<ConditionNode> right = structure.conditions().stream().filter(c -> c.line() == 3).toList();
        List<ConditionNode> nested = structure.conditions().stream().filter(c -> c.line() == 4).toList();

        assertEquals(2, left.size());
        assertEquals(2, right.size());
        // the || and the a && b both start at a
        assertEquals(left.get(0).column(), left.get(1).column());
        assertEquals(3, nested.size());
        assertEquals(nested.get(0).column(), nested.get(1).column());
    }

    @Test
    void testMultiLineConditionRecordedAtFirstToken() throws SourceParseException {
        String code = """
                class Wrap {
                    boolean check(int a, int b) {
                        return a > 0
                                && b > 0;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(3, structure.conditionCount());
        assertEquals(Set.of(3, 4), structure.kindsByLine().keySet());
        assertEquals(EnumSet.of(ConditionKind.COMPARISON, ConditionKind.BOOLEAN_COMBINATION),
                structure.kindsByLine().get(3));
        assertEquals(EnumSet.of(ConditionKind.COMPARISON), structure.kindsByLine().get(4));
    }

    @Test
    void testTwoComparisonsOnOneLineAreDistinct() throws SourceParseException {
        String code = """
                class Range {
                    boolean between(int x) {
                        return x > 1 == x < 9;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(3, structure.conditionCount());
        assertEquals(Set.of(ConditionKind.COMPARISON), structure.kindsByLine().get(3));
    }

    @Test
    void testClassAndMethodRanges() throws SourceParseException {
        String code = """
                class Foo {
                    int field = 1;

                    void first() {
                        if (field > 0) {
                            field--;
                        }
                    }

                    Foo(int seed) {
                        field = seed;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        ClassInfo foo = structure.classTable().get("Foo").orElseThrow();
        assertEquals(new LineRange(1, 13), foo.range());
        assertEquals(new LineRange(4, 8), foo.methods().get("first()"));
        assertEquals(new LineRange(10, 12), foo.methods().get("Foo(int)"));
        assertEquals(List.of("first()", "Foo(int)"), List.copyOf(foo.methods().keySet()));
    }

    @Test
    void testOverloadsAreKeyedBySignature() throws SourceParseException {
        String code = """
                class Over {
                    boolean test(int a) {
                        return a > 0;
                    }
                    boolean test(String s) {
                        return !s.isEmpty();
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        ClassInfo over = structure.classTable().get("Over").orElseThrow();
        assertEquals(2, over.methods().size());
        assertTrue(over.methods().containsKey("test(int)"));
        assertTrue(over.methods().containsKey("test(String)"));
    }

    @Test
    void testSameMethodNameInTwoClasses() throws SourceParseException {
        String code = """
                class A {
                    boolean run(int x) { return x == 1; }
                }
                class B {
                    boolean run(int x) { return x == 2; }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(new LineRange(2, 2), structure.classTable().get("A").orElseThrow().methods().get("run(int)"));
        assertEquals(new LineRange(5, 5), structure.classTable().get("B").orElseThrow().methods().get("run(int)"));
        assertEquals(new Scope.MethodScope("B", "run(int)"), structure.conditions().get(1).scope());
    }

    @Test
    void testNestedTypesUseDottedNamesAndInnermostScope() throws SourceParseException {
        String code = """
                class Outer {
                    boolean flag = !Boolean.TRUE;

                    static class Inner {
                        boolean inner(int a) {
                            return a < 3;
                        }
                    }

                    boolean outer(int b) {
                        return b > 3;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(Set.of("Outer", "Outer.Inner"), structure.classTable().classes().keySet());
        ClassInfo outer = structure.classTable().get("Outer").orElseThrow();
        assertEquals(Set.of("outer(int)"), outer.methods().keySet(), "inner type methods stay with the inner type");

        List<ConditionNode> conditions = structure.conditions();
        assertEquals(new Scope.ClassScope("Outer"), conditions.get(0).scope());
        assertEquals(new Scope.MethodScope("Outer.Inner", "inner(int)"), conditions.get(1).scope());
        assertEquals(new Scope.MethodScope("Outer", "outer(int)"), conditions.get(2).scope());
    }

    @Test
    void testAnonymousClassAndLambdaStayInEnclosingMethod() throws SourceParseException {
        String code = """
                import java.util.Comparator;
                import java.util.function.IntPredicate;

                class Host {
                    Comparator<String> cmp() {
                        return new Comparator<String>() {
                            @Override
                            public int compare(String a, String b) {
                                return a.length() < b.length() ? -1 : 1;
                            }
                        };
                    }

                    IntPredicate even() {
                        return n -> n % 2 == 0;
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        ClassInfo host = structure.classTable().get("Host").orElseThrow();
        assertEquals(Set.of("cmp()", "even()"), host.methods().keySet());
        assertEquals(new Scope.MethodScope("Host", "cmp()"), structure.conditions().get(0).scope());
        assertEquals(new Scope.MethodScope("Host", "even()"), structure.conditions().get(1).scope());
    }

    @Test
    void testAnonymousClassesInFieldsAddNoMethods() throws SourceParseException {
        String code = """
                class Host {
                    Runnable r1 = new Runnable() {
                        public void run() { if (1 > 0) {} }
                    };
                    Runnable r2 = new Runnable() {
                        public void run() { if (2 > 0) {} }
                    };
                    void own() {}
                }
                """;

        SourceStructure structure = extractor.extract(code);

        ClassInfo host = structure.classTable().get("Host").orElseThrow();
        assertEquals(Set.of("own()"), host.methods().keySet());
        assertEquals(2, structure.conditionCount());
        assertEquals(List.of(3, 6), structure.conditions().stream().map(ConditionNode::line).toList());
        assertTrue(structure.conditions().stream()
                .allMatch(c -> c.scope().equals(new Scope.ClassScope("Host"))));
    }

    @Test
    void testEnumConstantBodiesAddNoMethods() throws SourceParseException {
        String code = """
                enum Op {
                    POS(1) {
                        boolean test(int v) { return v > 0; }
                    },
                    NEG(-1) {
                        boolean test(int v) { return v < 0; }
                    };
                    Op(int sign) {}
                    boolean test(int v) { return !false; }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        ClassInfo op = structure.classTable().get("Op").orElseThrow();
        assertEquals(Set.of("Op(int)", "test(int)"), op.methods().keySet());
        assertEquals(new LineRange(9, 9), op.methods().get("test(int)"));
        assertEquals(3, structure.conditionCount());
        assertEquals(new Scope.ClassScope("Op"), structure.conditions().get(0).scope());
        assertEquals(new Scope.MethodScope("Op", "test(int)"), structure.conditions().get(2).scope());
    }

    @Test
    void testEnumRecordAndInterfaceAreClassScopes() throws SourceParseException {
        String code = """
                enum Level {
                    LOW, HIGH;
                    boolean isHigh() { return this == HIGH; }
                }
                record Point(int x, int y) {
                    boolean origin() { return x == 0 && y == 0; }
                }
                interface Check {
                    default boolean ok(int v) { return v >= 0; }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertEquals(Set.of("Level", "Point", "Check"), structure.classTable().classes().keySet());
        assertTrue(structure.classTable().get("Level").orElseThrow().methods().containsKey("isHigh()"));
        assertTrue(structure.classTable().get("Point").orElseThrow().methods().containsKey("origin()"));
        assertTrue(structure.classTable().get("Check").orElseThrow().methods().containsKey("ok(int)"));
        assertEquals(5, structure.conditionCount());
    }

    @Test
    void testLocalClassesWithSameNameAreKeptApart() throws SourceParseException {
        String code = """
                class Host {
                    void a() {
                        class Helper { boolean t(int x) { return x > 0; } }
                    }
                    void b() {
                        class Helper { boolean t(int x) { return x < 0; } }
                    }
                }
                """;

        SourceStructure structure = extractor.extract(code);

        assertTrue(structure.classTable().get("Host.Helper").isPresent());
        assertTrue(structure.classTable().get("Host.Helper#2").isPresent());
        assertEquals(new LineRange(6, 6), structure.classTable().get("Host.Helper#2").orElseThrow().range());
    }

    @Test
    void testEmptySource() throws SourceParseException {
        SourceStructure structure = extractor.extract("");

        assertEquals(0, structure.conditionCount());
        assertEquals(0, structure.classTable().size());
        assertTrue(structure.kindsByLine().isEmpty());
    }

    @Test
    void testInvalidSourceThrows() {
        String code = """
                class Broken {
                    void oops( {
                }
                """;

        SourceParseException ex = assertThrows(SourceParseException.class, () -> extractor.extract(code));
        assertFalse(ex.getProblems().isEmpty());
        assertNotNull(ex.getMessage());
    }

    @Test
    void testExtractionIsIdempotent() throws SourceParseException {
        String code = """
                class Twice {
                    boolean go(int a, boolean b) {
                        return a != 0 || !b;
                    }
                }
                """;

        assertEquals(extractor.extract(code), extractor.extract(code));
    }

    @Test
    void testContinuesChain() {
        BinaryExpr outer = StaticJavaParser.parseExpression("a && b && c").asBinaryExpr();
        BinaryExpr inner = outer.getLeft().asBinaryExpr();

        assertFalse(ConditionExtractor.continuesChain(outer));
        assertTrue(ConditionExtractor.continuesChain(inner));
    }

    @Test
    void testClassify() {
        assertEquals(ConditionKind.COMPARISON, ConditionExtractor.classify(BinaryExpr.Operator.LESS_EQUALS));
        assertEquals(ConditionKind.BOOLEAN_COMBINATION, ConditionExtractor.classify(BinaryExpr.Operator.OR));
        assertNull(ConditionExtractor.classify(BinaryExpr.Operator.BINARY_AND));
        assertNull(ConditionExtractor.classify(BinaryExpr.Operator.PLUS));
    }
}
