package com.jreinhal.askdocs.pipeline;

/**
 * Feature toggles of one pipeline instance.
 *
 * @param docActions whether document-aware tools may be routed to
 */
public record PipelineFeatures(boolean toolRouter, boolean docActions, boolean followups, boolean planning) {

    public static PipelineFeatures defaults() {
        return new PipelineFeatures(true, true, true, false);
    }

    /**
     * Applies per-request overrides; {@code null} keeps the configured value.
     */
    public PipelineFeatures withOverrides(Boolean toolRouterOverride, Boolean followupsOverride, Boolean planningOverride) {
        return new PipelineFeatures(
                toolRouterOverride != null ? toolRouterOverride : this.toolRouter,
                this.docActions,
                followupsOverride != null ? followupsOverride : this.followups,
                planningOverride != null ? planningOverride : this.planning);
    }
}
