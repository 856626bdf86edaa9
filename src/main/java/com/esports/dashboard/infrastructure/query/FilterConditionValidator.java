package com.esports.dashboard.infrastructure.query;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Whitelist guard for dynamically composed SQL fragments.
 *
 * Every WHERE / HAVING fragment built at request time must match one of the
 * patterns below before it is joined into a query. Anything else is rejected,
 * including syntactically valid SQL that simply is not listed.
 *
 * Accepted shapes:
 * - Parameterized IN lists with one or more placeholders
 * - Comparisons against a placeholder (>=, <=, BETWEEN ? AND ?)
 * - Fixed literals only where listed (= true, IS NULL, > 0, < 0)
 * - ILIKE ? for search, never LIKE
 * - Aggregate HAVING forms over known columns
 *
 * Aliases: t = teams, p = players, pc = player_contracts, rp = ranked players CTE,
 * a = lol_accounts, ds = lol_daily_stats. Unqualified columns refer to CTE outputs.
 */
@Slf4j
public final class FilterConditionValidator {

    private static final int LOG_TRUNCATE_LENGTH = 100;

    private static final List<Pattern> ALLOWED_PATTERNS = List.of(
            // Teams
            Pattern.compile("^t\\.league IN \\(\\?(?:,\\?)*\\)$"),
            Pattern.compile("^t\\.is_active = true$"),
            Pattern.compile("^t\\.team_id IN \\(\\?(?:,\\?)*\\)$"),

            // Players
            Pattern.compile("^p\\.player_id IN \\(\\?(?:,\\?)*\\)$"),
            Pattern.compile("^p\\.current_pseudo ILIKE \\?$"),
            Pattern.compile("^p\\.is_active = true$"),

            // Team name search
            Pattern.compile("^\\(t\\.current_name ILIKE \\? OR t\\.short_name ILIKE \\?\\)$"),

            // Roles and contracts
            Pattern.compile("^rp\\.role IN \\(\\?(?:,\\?)*\\)$"),
            Pattern.compile("^pc\\.role IN \\(\\?(?:,\\?)*\\)$"),
            Pattern.compile("^pc\\.end_date IS NULL$"),

            // Accounts
            Pattern.compile("^a\\.puuid IN \\(\\?(?:,\\?)*\\)$"),
            Pattern.compile("^a\\.account_id IN \\(\\?(?:,\\?)*\\)$"),

            // Daily stats dates
            Pattern.compile("^ds\\.date >= \\?$"),
            Pattern.compile("^ds\\.date <= \\?$"),
            Pattern.compile("^ds\\.date BETWEEN \\? AND \\?$"),

            // CTE outputs (LP change lists)
            Pattern.compile("^lp_change > 0$"),
            Pattern.compile("^lp_change < 0$"),
            Pattern.compile("^SUM\\(lp_change\\) > 0$"),
            Pattern.compile("^SUM\\(lp_change\\) < 0$"),
            Pattern.compile("^league IN \\(\\?(?:,\\?)*\\)$"),
            Pattern.compile("^role IN \\(\\?(?:,\\?)*\\)$"),
            Pattern.compile("^games >= \\?$"),

            // Aggregate HAVING forms
            Pattern.compile("^SUM\\(ds\\.games_played\\) >= \\?$"),
            Pattern.compile("^COUNT\\(\\*\\) >= \\?$"),
            Pattern.compile("^COALESCE\\(SUM\\(ds\\.games_played\\), 0\\) >= \\?$"),
            Pattern.compile("^SUM\\(games\\) >= \\?$")
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FilterConditionValidator() {
    }

    /**
     * Validate a single fragment.
     *
     * @throws InvalidFilterException if the fragment matches no allowed pattern
     */
    public static void validate(String condition) {
        if (condition == null) {
            log.error("Rejected null SQL filter condition");
            throw new InvalidFilterException();
        }

        String normalized = WHITESPACE.matcher(condition.trim()).replaceAll(" ");

        for (Pattern pattern : ALLOWED_PATTERNS) {
            if (pattern.matcher(normalized).matches()) {
                return;
            }
        }

        log.error("Rejected invalid SQL filter condition, potential injection attempt: {}",
                truncate(condition));
        throw new InvalidFilterException();
    }

    /**
     * Validate every fragment, failing on the first invalid one.
     */
    public static void validateAll(List<String> conditions) {
        for (String condition : conditions) {
            validate(condition);
        }
    }

    public static int patternCount() {
        return ALLOWED_PATTERNS.size();
    }

    private static String truncate(String condition) {
        return condition.length() > LOG_TRUNCATE_LENGTH
                ? condition.substring(0, LOG_TRUNCATE_LENGTH)
                : condition;
    }
}
