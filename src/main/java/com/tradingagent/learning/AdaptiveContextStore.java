package com.tradingagent.learning;

/** Persistence for {@link AdaptiveContext}. Called only at loop boundaries. */
public interface AdaptiveContextStore {

    /** @return the stored context, or a fresh one when nothing has been saved yet */
    AdaptiveContext load();

    void save(AdaptiveContext context);
}
