package com.prradar.aggregator.display;

/**
 * Event emitted back to {@link PullRequestController#handle(ItemEvent)} when the user
 * triggers an item's custom action. Each event carries its own payload.
 */
public interface ItemEvent {

    /**
     * Adds a pull request to the multiselect selection of the given view.
     */
    record Multiselect(PrType type, String pullRequestUrl) implements ItemEvent {}

    /**
     * Switches to the approved view.
     */
    record ShowApproved() implements ItemEvent {}
}
