package domain.ast;

/** A WHERE predicate: simple comparison, BETWEEN, IN, LIKE, or an AND/OR chain of them. */
public interface ConditionNode extends AstNode {
}
