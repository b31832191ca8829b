/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api;

import java.util.Map;

/**
 * Callback interface for translation stage events.
 *
 * <p>A token translation runs through these stages:
 * <ol>
 *   <li>DECODE - parse native source tokens into instructions</li>
 *   <li>SOURCE_REMAP - apply the source qubit convention</li>
 *   <li>RESOLVE - rename or decompose gates for the target vocabulary</li>
 *   <li>TARGET_REMAP - apply the target qubit convention</li>
 *   <li>ENCODE - render native target tokens</li>
 * </ol>
 * Translating an already decoded circuit skips DECODE and ENCODE.
 */
public interface TranslationListener {

    /**
     * Called when a translation stage starts.
     *
     * @param stageName   name of the stage (e.g. "RESOLVE")
     * @param stageNumber current stage number (1-based)
     * @param totalStages total number of stages for this run
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a stage completes successfully.
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails. The exception is rethrown to the caller afterwards.
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single translation stage.
     *
     * @param stageName     name of the stage
     * @param durationNanos duration in nanoseconds
     * @param metrics       stage-specific counters (e.g. "instructionCount")
     */
    record StageResult(
            String stageName,
            long durationNanos,
            Map<String, Object> metrics
    ) {
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
