package com.ukboards.network.persistence;

import com.ukboards.network.graph.BoardGraph;
import com.ukboards.network.model.RunRecord;

/**
 * A network read back from disk. {@code run} is null when the file carried no metadata.
 */
public record StoredNetwork(BoardGraph graph, RunRecord run) {
}
