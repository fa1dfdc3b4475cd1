package domain.ast;

/**
 * Root of the closed AST variant set.
 *
 * <p>Every variant dispatches through {@link AstVisitor}, so adding a variant without handling it
 * in the generator or the serializer is a compile error.</p>
 */
public interface AstNode {

    <R> R accept(AstVisitor<R> visitor);

    /** Stable variant tag used in serialized output (e.g. {@code SELECT}, {@code AND}). */
    String getType();
}
