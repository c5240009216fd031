package com.prradar.aggregator.display;

import java.util.List;

/**
 * What happens when an item is activated.
 */
public interface ItemAction {

    record OpenUrl(String url) implements ItemAction {}

    record OpenUrls(List<String> urls) implements ItemAction {
        public OpenUrls {
            urls = List.copyOf(urls);
        }
    }

    /**
     * Keeps the launcher open and delivers {@code event} to the controller.
     */
    record Emit(ItemEvent event) implements ItemAction {}

    record DoNothing() implements ItemAction {}
}
