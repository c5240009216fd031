package com.prradar.aggregator.query;

import com.prradar.aggregator.model.PullRequest;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Free-text search over pull request titles and repository names.
 *
 * <p>The query is a case-insensitive regular expression searched anywhere in the title
 * or the repository name; a match in either is enough. Text that does not compile as a
 * regular expression (e.g. a lone {@code "["} typed mid-query) is searched literally.
 * A null or empty query matches everything.</p>
 */
public final class PullRequestQuery {

    private PullRequestQuery() {}

    public static List<PullRequest> filter(List<PullRequest> pullRequests, String query) {
        return pullRequests.stream().filter(matching(query)).toList();
    }

    public static Predicate<PullRequest> matching(String query) {
        if (query == null || query.isEmpty()) {
            return pr -> true;
        }
        Pattern pattern = compile(query);
        return pr -> pattern.matcher(pr.title()).find()
                || pattern.matcher(pr.repository()).find();
    }

    static Pattern compile(String query) {
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        try {
            return Pattern.compile(query, flags);
        } catch (PatternSyntaxException e) {
            return Pattern.compile(Pattern.quote(query), flags);
        }
    }
}
