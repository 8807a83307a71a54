package com.raditha.condcov.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.raditha.condcov.model.ConditionKind;
import com.raditha.condcov.model.ConditionNode;
import com.raditha.condcov.model.LineRange;
import com.raditha.condcov.model.SourceStructure;

/**
 * Finds the decision points in a Java source unit and the line extents of its
 * classes and methods.
 * <p>
 * The tree is walked once. The enclosing scope is not kept in visitor fields;
 * it is passed down as an {@link ExtractionContext}, so the visitor holds no
 * state and one instance serves every extraction.
 */
public class ConditionExtractor {

    private static final ConditionVisitor VISITOR = new ConditionVisitor();

    private final ParserConfiguration parserConfiguration;

    /**
     * Create an extractor for Java 17 sources.
     */
    public ConditionExtractor() {
        this.parserConfiguration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    /**
     * Extract conditions and scopes from source text.
     *
     * @param source the complete text of one compilation unit
     * @return the structural model of the source
     * @throws SourceParseException if the text is not valid Java
     */
    public SourceStructure extract(String source) throws SourceParseException {
        CompilationUnit cu = parse(source);
        return extract(cu);
    }

    /**
     * Extract from an already parsed compilation unit.
     */
    public SourceStructure extract(CompilationUnit cu) {
        ExtractionSink sink = new ExtractionSink();
        cu.accept(VISITOR, ExtractionContext.root(sink));
        return sink.toStructure();
    }

    private CompilationUnit parse(String source) throws SourceParseException {
        // JavaParser instances are not thread safe
        ParseResult<CompilationUnit> result = new JavaParser(parserConfiguration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new SourceParseException(result.getProblems());
        }
        return result.getResult().get();
    }

    /**
     * Classify a binary operator. Returns null for arithmetic, bitwise and shift operators.
     */
    static ConditionKind classify(BinaryExpr.Operator operator) {
        return switch (operator) {
            case EQUALS, NOT_EQUALS, LESS, GREATER, LESS_EQUALS, GREATER_EQUALS -> ConditionKind.COMPARISON;
            case AND, OR -> ConditionKind.BOOLEAN_COMBINATION;
            default -> null;
        };
    }

    /**
     * True when this {@code &&}/{@code ||} is an inner link of a longer chain of the same
     * operator, e.g. the {@code a && b} inside {@code a && b && c}.
     */
    static boolean continuesChain(BinaryExpr expr) {
        return expr.getParentNode()
                .filter(BinaryExpr.class::isInstance)
                .map(BinaryExpr.class::cast)
                .map(parent -> parent.getOperator() == expr.getOperator())
                .orElse(false);
    }

    private static final class ConditionVisitor extends VoidVisitorAdapter<ExtractionContext> {

        @Override
        public void visit(ClassOrInterfaceDeclaration n, ExtractionContext ctx) {
            super.visit(n, enterType(n, ctx));
        }

        @Override
        public void visit(EnumDeclaration n, ExtractionContext ctx) {
            super.visit(n, enterType(n, ctx));
        }

        @Override
        public void visit(RecordDeclaration n, ExtractionContext ctx) {
            super.visit(n, enterType(n, ctx));
        }

        @Override
        public void visit(AnnotationDeclaration n, ExtractionContext ctx) {
            super.visit(n, enterType(n, ctx));
        }

        @Override
        public void visit(ObjectCreationExpr n, ExtractionContext ctx) {
            n.getScope().ifPresent(scope -> scope.accept(this, ctx));
            n.getArguments().forEach(argument -> argument.accept(this, ctx));
            ExtractionContext body = ctx.enterAnonymousBody();
            n.getAnonymousClassBody().ifPresent(members -> members.forEach(member -> member.accept(this, body)));
        }

        @Override
        public void visit(EnumConstantDeclaration n, ExtractionContext ctx) {
            n.getArguments().forEach(argument -> argument.accept(this, ctx));
            ExtractionContext body = ctx.enterAnonymousBody();
            n.getClassBody().forEach(member -> member.accept(this, body));
        }

        @Override
        public void visit(MethodDeclaration n, ExtractionContext ctx) {
            super.visit(n, enterCallable(n, ctx));
        }

        @Override
        public void visit(ConstructorDeclaration n, ExtractionContext ctx) {
            super.visit(n, enterCallable(n, ctx));
        }

        @Override
        public void visit(BinaryExpr n, ExtractionContext ctx) {
            ConditionKind kind = classify(n.getOperator());
            if (kind == ConditionKind.COMPARISON
                    || (kind == ConditionKind.BOOLEAN_COMBINATION && !continuesChain(n))) {
                addCondition(n, kind, ctx);
            }
            super.visit(n, ctx);
        }

        @Override
        public void visit(UnaryExpr n, ExtractionContext ctx) {
            if (n.getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT) {
                addCondition(n, ConditionKind.LOGICAL_NEGATION, ctx);
            }
            super.visit(n, ctx);
        }

        private ExtractionContext enterType(TypeDeclaration<?> type, ExtractionContext ctx) {
            String name = ctx.sink().addClass(ctx.qualify(type.getNameAsString()), rangeOf(type));
            return ctx.enterClass(name);
        }

        private ExtractionContext enterCallable(CallableDeclaration<?> callable, ExtractionContext ctx) {
            if (!ctx.isDirectlyInClass()) {
                return ctx;
            }
            String signature = callable.getSignature().asString();
            ctx.sink().addMethod(ctx.scope().className(), signature, rangeOf(callable));
            return ctx.enterMethod(signature);
        }

        private void addCondition(Node node, ConditionKind kind, ExtractionContext ctx) {
            Position begin = node.getBegin()
                    .orElseThrow(() -> new IllegalStateException("Expression missing position: " + node));
            ctx.sink().addCondition(new ConditionNode(begin.line, begin.column, kind, ctx.scope()));
        }

        private static LineRange rangeOf(Node node) {
            return node.getRange()
                    .map(LineRange::from)
                    .orElseThrow(() -> new IllegalStateException("Declaration missing range"));
        }
    }
}
