package domain.ast;

public interface AstVisitor<R> {

    R visitSelect(SelectNode node);

    R visitWhere(WhereNode node);

    R visitSimpleCondition(SimpleCondition node);

    R visitAnd(AndCondition node);

    R visitOr(OrCondition node);

    R visitBetween(BetweenCondition node);

    R visitIn(InCondition node);

    R visitLike(LikeCondition node);

    R visitOrderBy(OrderByNode node);

    R visitGroupBy(GroupByNode node);

    R visitAggregate(AggregateNode node);

    R visitInsert(InsertNode node);

    R visitUpdate(UpdateNode node);

    R visitDelete(DeleteNode node);

    R visitAlterTable(AlterTableNode node);
}
