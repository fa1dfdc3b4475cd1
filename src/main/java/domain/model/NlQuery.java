package domain.model;

import java.util.Objects;

/** One input row: an id (used for output file names and reports) and the query text. */
public final class NlQuery {

    private final String id;
    private final String text;

    public NlQuery(String id, String text) {
        this.id = id == null ? "" : id.trim();
        this.text = text == null ? "" : text;
    }

    public String getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NlQuery)) return false;
        NlQuery q = (NlQuery) o;
        return id.equals(q.id) && text.equals(q.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, text);
    }

    @Override
    public String toString() {
        return id + ": " + text;
    }
}
