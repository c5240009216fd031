package com.prradar.aggregator.orchestrator;

import com.prradar.aggregator.config.AppConfig;
import com.prradar.aggregator.display.DisplayItem;
import com.prradar.aggregator.display.IconVariant;
import com.prradar.aggregator.display.ItemEvent;
import com.prradar.aggregator.display.PullRequestController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end for PR Radar. Prints the open pull requests of the organization,
 * optionally filtered by a query, or the approved ones.
 *
 * <p>Usage:
 * <pre>
 *   java -jar pr-radar.jar                 # every open pull request
 *   java -jar pr-radar.jar fix login       # open pull requests matching "fix login"
 *   java -jar pr-radar.jar --approved      # approved pull requests
 * </pre>
 */
public class PrRadarApp {

    private static final Logger logger = LoggerFactory.getLogger(PrRadarApp.class);

    static final String APPROVED_FLAG = "--approved";

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(PullRequestController.create(new AppConfig()), args);
        } catch (Exception e) {
            logger.error("Fatal error", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Renders the requested view and closes {@code controller}.
     *
     * @return the process exit code: 1 when the fetch failed, 0 otherwise
     */
    static int run(PullRequestController controller, String[] args) {
        boolean approved = parseApproved(args);
        String query = parseQuery(args);
        logger.info("Starting PR Radar (view: {}, query: '{}')", approved ? "APPROVED" : "OPEN", query);

        try (controller) {
            List<DisplayItem> items = approved
                    ? controller.handle(new ItemEvent.ShowApproved())
                    : controller.query(query);

            printItems(items);
            return isError(items) ? 1 : 0;
        }
    }

    static boolean parseApproved(String[] args) {
        for (String arg : args) {
            if (APPROVED_FLAG.equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String parseQuery(String[] args) {
        List<String> words = new ArrayList<>();
        for (String arg : args) {
            if (!APPROVED_FLAG.equals(arg)) {
                words.add(arg);
            }
        }
        return String.join(" ", words);
    }

    static boolean isError(List<DisplayItem> items) {
        return items.size() == 1 && items.get(0).iconVariant() == IconVariant.ERROR;
    }

    private static void printItems(List<DisplayItem> items) {
        if (items.isEmpty()) {
            System.out.println("No pull requests.");
            return;
        }
        for (DisplayItem item : items) {
            System.out.printf("[%-12s] %s%n", item.iconVariant(), item.title());
            for (String line : item.subtitle().split("\n")) {
                System.out.println("               " + line);
            }
        }
    }
}
