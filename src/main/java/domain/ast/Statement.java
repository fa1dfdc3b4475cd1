package domain.ast;

/** A complete statement: the root of one parse. */
public interface Statement extends AstNode {
}
