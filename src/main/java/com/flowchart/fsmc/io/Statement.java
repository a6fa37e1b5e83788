package com.flowchart.fsmc.io;

import com.flowchart.fsmc.model.NodeShape;

import java.util.List;

/**
 * A typed diagram statement produced by {@link StatementParser}.
 *
 * <p>
 * The set of implementations is fixed: {@link NodeDecl}, {@link EdgeDecl},
 * {@link ClassDef}, {@link ClassAssign} and {@link StyleDirective}.
 */
public interface Statement {

    /** 1-based source line. */
    int line();

    /**
     * Node declaration.
     *
     * @param shaped {@code false} for a bare identifier with no brackets
     * @param inline {@code true} when declared as an endpoint of an edge line
     */
    record NodeDecl(String id, String label, NodeShape shape, boolean shaped, boolean inline, int line)
            implements Statement {
    }

    /** Surface form an edge was written in. */
    enum ArrowForm {
        /** {@code A -->|label| B} */
        LABELED_PIPE,
        /** {@code A -- label --> B} */
        DASHED_LABEL,
        /** {@code A --> B} */
        PLAIN,
        /** {@code A -> B} */
        SINGLE_DASH,
        /** {@code A[Label] --> B(Label)} */
        INLINE_BRACKET
    }

    /** Edge declaration. {@code label} is {@code null} when the edge carries no text. */
    record EdgeDecl(String from, String to, String label, ArrowForm form, int line) implements Statement {
    }

    /** {@code classDef name style-list}. */
    record ClassDef(String name, String styles, int line) implements Statement {
    }

    /** {@code class id,id,... name}. */
    record ClassAssign(List<String> ids, String className, int line) implements Statement {
        public ClassAssign {
            ids = List.copyOf(ids);
        }
    }

    /**
     * {@code id@{ shape: x, class: y z }}. {@code shapeName} and {@code classes}
     * are {@code null} when the directive does not set them.
     */
    record StyleDirective(String id, String shapeName, List<String> classes, int line) implements Statement {
    }
}
