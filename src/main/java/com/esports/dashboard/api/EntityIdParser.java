package com.esports.dashboard.api;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the comma-separated id list of the batch history endpoints.
 *
 * Rules:
 * - Values that are not positive integers fitting a 32-bit column are dropped silently
 * - Duplicates are dropped, first occurrence wins
 * - More than {@code maxCount} ids, or none left, is a {@link RequestValidationException}
 */
public final class EntityIdParser {

    private EntityIdParser() {
    }

    public static List<Integer> parse(String raw, int maxCount) {
        Set<Integer> ids = new LinkedHashSet<>();
        if (raw != null) {
            for (String token : raw.split(",")) {
                Integer id = toId(token.trim());
                if (id != null) {
                    ids.add(id);
                }
            }
        }

        if (ids.size() > maxCount) {
            throw new RequestValidationException(
                    "Too many entity IDs. Maximum allowed: " + maxCount + ", received: " + ids.size());
        }
        if (ids.isEmpty()) {
            throw new RequestValidationException("No valid entity IDs provided");
        }
        return new ArrayList<>(ids);
    }

    /**
     * "12" and "12.0" are accepted; "1.5", "0", "-3", "abc" and values above Integer.MAX_VALUE are not.
     */
    private static Integer toId(String token) {
        if (token.isEmpty()) {
            return null;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(token);
        } catch (NumberFormatException e) {
            return null;
        }
        if (value.signum() <= 0 || value.stripTrailingZeros().scale() > 0) {
            return null;
        }
        if (value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return null;
        }
        return value.intValueExact();
    }
}
