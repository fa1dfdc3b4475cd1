package domain.ast;

public enum AggregateFunction {
    COUNT,
    SUM
}
