package com.vortex.runtime;

import com.vortex.labels.Labels;

import java.util.List;
import java.util.Map;

/**
 * Read-side querier over a log store.
 *
 * <p>Only log line, label and series queries are served. The remaining
 * shapes throw {@link com.vortex.exception.NotImplementedException}.
 */
public interface LogQuerier {

    /**
     * Runs a log line query. The returned iterator owns every resource of the
     * query and must be closed.
     *
     * @param params the query
     * @return the entries
     * @throws com.vortex.exception.SQLGenerationException if the selector cannot be translated
     * @throws com.vortex.exception.QueryExecutionException if the query fails to start
     */
    EntryIterator selectLogs(SelectLogParams params);

    /**
     * Lists label names, or the values of one label, in normalized form.
     *
     * @param request the request
     * @return the names or values
     * @throws com.vortex.exception.QueryExecutionException if the query fails
     */
    List<String> label(LabelRequest request);

    /**
     * Lists the distinct label sets of matching streams.
     *
     * @param request the request
     * @return the label sets, keys normalized
     * @throws com.vortex.exception.SQLGenerationException if a matcher cannot be translated
     * @throws com.vortex.exception.QueryExecutionException if the query fails
     */
    List<Labels> series(SeriesRequest request);

    List<Sample> selectSamples(SelectSampleParams params);

    EntryIterator tail(SelectLogParams params);

    IndexStats indexStats(SeriesRequest request);

    Map<Labels, Long> seriesVolume(SeriesRequest request);
}
