package com.prradar.aggregator.display;

/**
 * One row of the rendered result list.
 *
 * @param secondaryAction alternate action, or {@code null} when the item has none
 */
public record DisplayItem(
        String title,
        String subtitle,
        IconVariant iconVariant,
        ItemAction primaryAction,
        ItemAction secondaryAction
) {}
