package org.timberline.pipeline.tiling;

import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Outcome of a whole run, one entry per chunk in processing order.
 *
 * @param succeeded number of chunks with output
 * @param failed    number of failed chunks
 * @param chunks    per-chunk outcomes
 */
public record RunSummary(int succeeded, int failed, List<ChunkOutcome> chunks) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public RunSummary {
        chunks = List.copyOf(chunks);
    }

    public static RunSummary of(List<ChunkOutcome> outcomes) {
        int ok = (int) outcomes.stream().filter(ChunkOutcome::isSuccess).count();
        return new RunSummary(ok, outcomes.size() - ok, outcomes);
    }

    public boolean allSucceeded() {
        return failed == 0;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static RunSummary fromJson(String json) {
        return GSON.fromJson(json, RunSummary.class);
    }
}
