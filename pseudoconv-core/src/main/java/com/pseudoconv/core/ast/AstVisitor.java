package com.pseudoconv.core.ast;

/**
 * Visitor over every {@link Ast.Node} type.
 *
 * <p>One method per node type: a new node type cannot be added without every
 * traversal (generator, inverter, type collector) deciding how to handle it.
 *
 * @param <R> result type of the traversal
 */
public interface AstVisitor<R> {

    R visit(Ast.Program node);

    R visit(Ast.Block node);

    R visit(Ast.Declaration node);

    R visit(Ast.Assignment node);

    R visit(Ast.AssignmentExpr node);

    R visit(Ast.Update node);

    R visit(Ast.ExpressionStatement node);

    R visit(Ast.CallStatement node);

    R visit(Ast.If node);

    R visit(Ast.While node);

    R visit(Ast.DoWhile node);

    R visit(Ast.For node);

    R visit(Ast.Identifier node);

    R visit(Ast.ArrayAccess node);

    R visit(Ast.Literal node);

    R visit(Ast.Call node);

    R visit(Ast.MethodCall node);

    R visit(Ast.Property node);

    R visit(Ast.Length node);

    R visit(Ast.NewArray node);

    R visit(Ast.NewObject node);

    R visit(Ast.ArrayLiteral node);

    R visit(Ast.Unary node);

    R visit(Ast.Binary node);

    R visit(Ast.UnaryPostfix node);
}
