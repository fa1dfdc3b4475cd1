package domain.ast;

public enum SortDirection {
    ASC,
    DESC
}
