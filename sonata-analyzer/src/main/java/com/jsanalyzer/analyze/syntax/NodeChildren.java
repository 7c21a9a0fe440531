package com.jsanalyzer.analyze.syntax;

import com.jsanalyzer.ast.Node;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Generic access to the child nodes of AST records.
 *
 * <p>Children are the record components holding a {@link Node} or a list of nodes, in
 * declaration order, which is also source order for every node type.</p>
 */
final class NodeChildren {
    private static final ClassValue<Shape> SHAPES = new ClassValue<>() {
        @Override
        protected Shape computeValue(Class<?> type) {
            return Shape.of(type);
        }
    };

    private NodeChildren() {
    }

    static List<Node> of(Node node) {
        List<Node> children = new ArrayList<>();
        for (RecordComponent component : SHAPES.get(node.getClass()).components) {
            Object value = read(component, node);
            if (value instanceof Node child) {
                children.add(child);
            } else if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Node child) {
                        children.add(child);
                    }
                }
            }
        }
        return children;
    }

    /**
     * Returns a copy of {@code node} with every child passed through {@code rewrite}, or the
     * node itself when no child changed.
     */
    static Node map(Node node, UnaryOperator<Node> rewrite) {
        Shape shape = SHAPES.get(node.getClass());
        Object[] values = new Object[shape.components.length];
        boolean changed = false;
        for (int i = 0; i < values.length; i++) {
            Object value = read(shape.components[i], node);
            if (value instanceof Node child) {
                Node rewritten = rewrite.apply(child);
                changed |= rewritten != child;
                value = rewritten;
            } else if (value instanceof List<?> list) {
                List<Object> rewrittenList = new ArrayList<>(list.size());
                boolean listChanged = false;
                for (Object element : list) {
                    if (element instanceof Node child) {
                        Node rewritten = rewrite.apply(child);
                        listChanged |= rewritten != child;
                        rewrittenList.add(rewritten);
                    } else {
                        rewrittenList.add(element);
                    }
                }
                if (listChanged) {
                    changed = true;
                    value = List.copyOf(rewrittenList);
                }
            }
            values[i] = value;
        }
        if (!changed) {
            return node;
        }
        try {
            return (Node) shape.constructor.newInstance(values);
        } catch (InvocationTargetException e) {
            throw new MutationException("Cannot rebuild " + node.type(), e.getCause());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new MutationException("Cannot rebuild " + node.type() + ": " + e.getMessage(), e);
        }
    }

    private static Object read(RecordComponent component, Node node) {
        try {
            return component.getAccessor().invoke(node);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot read " + component.getName() + " of " + node.type(), e);
        }
    }

    private static final class Shape {
        private final RecordComponent[] components;
        private final Constructor<?> constructor;

        private Shape(RecordComponent[] components, Constructor<?> constructor) {
            this.components = components;
            this.constructor = constructor;
        }

        static Shape of(Class<?> type) {
            if (!type.isRecord()) {
                throw new IllegalStateException(type.getName() + " is not a record");
            }
            RecordComponent[] components = type.getRecordComponents();
            Class<?>[] types = new Class<?>[components.length];
            for (int i = 0; i < components.length; i++) {
                types[i] = components[i].getType();
            }
            try {
                return new Shape(components, type.getDeclaredConstructor(types));
            } catch (NoSuchMethodException e) {
                throw new IllegalStateException("No canonical constructor for " + type.getName(), e);
            }
        }
    }
}
