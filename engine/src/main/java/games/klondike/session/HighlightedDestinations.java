package games.klondike.session;

import java.util.List;

/**
 * Piles where the active card may legally go, cached for the renderer until the next input.
 *
 * @param tableauPiles tableau indices in ascending order
 * @param foundationPiles foundation indices in ascending order
 */
public record HighlightedDestinations(List<Integer> tableauPiles, List<Integer> foundationPiles) {
    public HighlightedDestinations {
        tableauPiles = List.copyOf(tableauPiles);
        foundationPiles = List.copyOf(foundationPiles);
    }

    public static HighlightedDestinations empty() {
        return new HighlightedDestinations(List.of(), List.of());
    }

    public boolean hasAny() {
        return !tableauPiles.isEmpty() || !foundationPiles.isEmpty();
    }

    public int count() {
        return tableauPiles.size() + foundationPiles.size();
    }
}
