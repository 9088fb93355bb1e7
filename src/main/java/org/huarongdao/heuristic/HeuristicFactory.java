package org.huarongdao.heuristic;

import lombok.experimental.UtilityClass;

/**
 * Heuristic provider factory.
 *
 * <p>Providers are stateless, so each mode maps to one shared instance.</p>
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "HRD_HEURISTIC_TYPE_REQUIRED";

    private static final HeuristicProvider NULL_PROVIDER = new NullHeuristicProvider();
    private static final HeuristicProvider MANHATTAN_PROVIDER = new ManhattanHeuristicProvider();

    /**
     * Returns the provider for one heuristic mode.
     *
     * @param type requested heuristic type.
     * @return shared immutable provider.
     * @throws HeuristicConfigurationException when {@code type} is null.
     */
    public static HeuristicProvider create(HeuristicType type) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, MANHATTAN)"
            );
        }
        return switch (type) {
            case NONE -> NULL_PROVIDER;
            case MANHATTAN -> MANHATTAN_PROVIDER;
        };
    }
}
