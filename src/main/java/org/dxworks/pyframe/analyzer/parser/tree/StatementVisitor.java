package org.dxworks.pyframe.analyzer.parser.tree;

public interface StatementVisitor<R> {
    R visitImport(ImportNode node);

    R visitFromImport(FromImportNode node);

    R visitDecorator(DecoratorNode node);

    R visitFunction(FunctionNode node);

    R visitClass(ClassNode node);

    R visitAssignment(AssignmentNode node);

    R visitExpression(ExpressionNode node);

    R visitBlock(BlockNode node);

    R visitSimple(SimpleNode node);

    R visitSkipped(SkippedNode node);
}
