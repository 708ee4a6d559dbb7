package com.eainde.orchestrator.execution;

/**
 * Append-only destination for transcript entries produced during a run.
 * The engine never reads records back while a run is in progress.
 */
public interface ChatHistorySink {

    void append(ChatHistoryRecord record);
}
