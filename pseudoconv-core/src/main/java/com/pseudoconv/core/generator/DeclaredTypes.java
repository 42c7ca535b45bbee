package com.pseudoconv.core.generator;

import com.pseudoconv.core.ast.Ast;
import com.pseudoconv.core.ast.AstVisitor;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Declared type of every variable in a program, collected before generation.
 *
 * <p>Used to decide whether {@code x.remove(k)} removes by key or by position.
 * The first declaration of a name wins; the subset has no nested scopes worth
 * distinguishing.
 */
public final class DeclaredTypes {

    private final Map<String, String> types;

    private DeclaredTypes(Map<String, String> types) {
        this.types = Map.copyOf(types);
    }

    /**
     * Collects declarations from every statement in the program, including
     * loop headers and nested blocks.
     *
     * @param program parsed program
     * @return declared types by variable name
     */
    public static DeclaredTypes collect(Ast.Program program) {
        Collector collector = new Collector();
        program.accept(collector);
        return new DeclaredTypes(collector.types);
    }

    /**
     * Returns the declared type of a variable.
     *
     * @param name variable name
     * @return declared type such as "HashMap" or "int[]", if declared
     */
    public Optional<String> typeOf(String name) {
        return Optional.ofNullable(types.get(name));
    }

    /**
     * Returns true if the variable holds a keyed collection.
     *
     * <p>A declared type decides when there is one ({@code Map} in the type name);
     * otherwise the variable name is checked for "map".
     *
     * @param name receiver variable name
     * @return true for keyed collections
     */
    public boolean isKeyedCollection(String name) {
        return typeOf(name)
            .map(type -> type.contains("Map"))
            .orElseGet(() -> name.toLowerCase(Locale.ROOT).contains("map"));
    }

    /**
     * Walks statements only; declarations never occur inside expressions.
     */
    private static final class Collector implements AstVisitor<Void> {

        private final Map<String, String> types = new HashMap<>();

        private void visitAll(Iterable<Ast.Node> nodes) {
            for (Ast.Node node : nodes) {
                node.accept(this);
            }
        }

        private void visitOptional(Ast.Node node) {
            if (node != null) {
                node.accept(this);
            }
        }

        @Override
        public Void visit(Ast.Program node) {
            visitAll(node.statements());
            return null;
        }

        @Override
        public Void visit(Ast.Block node) {
            visitAll(node.statements());
            return null;
        }

        @Override
        public Void visit(Ast.Declaration node) {
            types.putIfAbsent(node.name(), node.declaredType());
            return null;
        }

        @Override
        public Void visit(Ast.If node) {
            node.consequent().accept(this);
            visitOptional(node.alternate());
            return null;
        }

        @Override
        public Void visit(Ast.While node) {
            node.body().accept(this);
            return null;
        }

        @Override
        public Void visit(Ast.DoWhile node) {
            node.body().accept(this);
            return null;
        }

        @Override
        public Void visit(Ast.For node) {
            visitOptional(node.init());
            node.body().accept(this);
            return null;
        }

        @Override
        public Void visit(Ast.Assignment node) {
            return null;
        }

        @Override
        public Void visit(Ast.AssignmentExpr node) {
            return null;
        }

        @Override
        public Void visit(Ast.Update node) {
            return null;
        }

        @Override
        public Void visit(Ast.ExpressionStatement node) {
            return null;
        }

        @Override
        public Void visit(Ast.CallStatement node) {
            return null;
        }

        @Override
        public Void visit(Ast.Identifier node) {
            return null;
        }

        @Override
        public Void visit(Ast.ArrayAccess node) {
            return null;
        }

        @Override
        public Void visit(Ast.Literal node) {
            return null;
        }

        @Override
        public Void visit(Ast.Call node) {
            return null;
        }

        @Override
        public Void visit(Ast.MethodCall node) {
            return null;
        }

        @Override
        public Void visit(Ast.Property node) {
            return null;
        }

        @Override
        public Void visit(Ast.Length node) {
            return null;
        }

        @Override
        public Void visit(Ast.NewArray node) {
            return null;
        }

        @Override
        public Void visit(Ast.NewObject node) {
            return null;
        }

        @Override
        public Void visit(Ast.ArrayLiteral node) {
            return null;
        }

        @Override
        public Void visit(Ast.Unary node) {
            return null;
        }

        @Override
        public Void visit(Ast.Binary node) {
            return null;
        }

        @Override
        public Void visit(Ast.UnaryPostfix node) {
            return null;
        }
    }
}
