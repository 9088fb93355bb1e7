package org.huarongdao.core;

/**
 * Per-search bounds on planner work and frontier growth.
 *
 * <p>The puzzle's state space is finite, so searches terminate without a budget; bounds exist
 * to cap time and memory for callers that need it.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_EXPANDED_EXCEEDED = "HRD_SEARCH_EXPANDED_EXCEEDED";
    public static final String REASON_FRONTIER_EXCEEDED = "HRD_SEARCH_FRONTIER_EXCEEDED";

    public static final String PROP_MAX_EXPANDED = "huarongdao.search.maxExpandedNodes";
    public static final String PROP_MAX_FRONTIER = "huarongdao.search.maxFrontierSize";

    private final int maxExpandedNodes;
    private final int maxFrontierSize;

    private SearchBudget(int maxExpandedNodes, int maxFrontierSize) {
        this.maxExpandedNodes = normalizeBound(maxExpandedNodes);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    /**
     * Creates a budget with explicit bounds; non-positive values mean unbounded.
     */
    public static SearchBudget of(int maxExpandedNodes, int maxFrontierSize) {
        return new SearchBudget(maxExpandedNodes, maxFrontierSize);
    }

    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                readBound(PROP_MAX_EXPANDED),
                readBound(PROP_MAX_FRONTIER)
        );
    }

    public int maxExpandedNodes() {
        return maxExpandedNodes;
    }

    public int maxFrontierSize() {
        return maxFrontierSize;
    }

    /**
     * Validates the expanded-node count against the configured bound.
     */
    void checkExpandedNodes(int expandedNodes) {
        if (expandedNodes > maxExpandedNodes) {
            throw new BudgetExceededException(
                    REASON_EXPANDED_EXCEEDED,
                    "expanded-node budget exceeded: " + expandedNodes + " > " + maxExpandedNodes,
                    expandedNodes
            );
        }
    }

    /**
     * Validates the frontier size against the configured bound.
     */
    void checkFrontierSize(int frontierSize, int expandedNodes) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize,
                    expandedNodes
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;
        private final int expandedNodes;

        BudgetExceededException(String reasonCode, String message, int expandedNodes) {
            super(message);
            this.reasonCode = reasonCode;
            this.expandedNodes = expandedNodes;
        }

        String reasonCode() {
            return reasonCode;
        }

        int expandedNodes() {
            return expandedNodes;
        }
    }
}
