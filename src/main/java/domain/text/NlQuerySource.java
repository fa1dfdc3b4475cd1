package domain.text;

import domain.model.NlQuery;

import java.util.List;

/**
 * Supplies the queries for a batch run.
 */
public interface NlQuerySource {
    List<NlQuery> load(String location);
}
