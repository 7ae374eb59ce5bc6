package com.ukboards.network.service;

import com.ukboards.network.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of the runs of one network client.
 */
public class RunLedger {
    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final List<RunRecord> runs = new ArrayList<>();

    public synchronized void append(RunRecord record) {
        if (!runs.isEmpty()) {
            RunRecord previous = runs.get(runs.size() - 1);
            if (!previous.parameterState().equals(record.parameterState())) {
                log.warn(
                    "Query parameters differ between run of {} {} ({}) and run of {} {} ({})",
                    previous.kind(),
                    previous.rootIds(),
                    previous.parameterState(),
                    record.kind(),
                    record.rootIds(),
                    record.parameterState()
                );
            }
        }
        runs.add(record);
    }

    public synchronized List<RunRecord> runs() {
        return List.copyOf(runs);
    }

    public synchronized List<RunRecord> since(int index) {
        return List.copyOf(runs.subList(Math.min(index, runs.size()), runs.size()));
    }

    public synchronized int size() {
        return runs.size();
    }

    public synchronized Optional<RunRecord> latest() {
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(runs.size() - 1));
    }
}
