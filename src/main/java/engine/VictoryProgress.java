package engine;

import java.util.List;

/**
 * Progress (0-100) toward one win or loss condition for a faction. Warnings are loss
 * conditions closing in.
 */
public record VictoryProgress(
        String condition,
        String label,
        int progress,
        boolean warning,
        List<String> requirements,
        String status
) {
    public VictoryProgress {
        requirements = List.copyOf(requirements);
    }
}
