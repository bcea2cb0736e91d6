package games.klondike.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies rules-checked moves to a {@link GameState}.
 * <p>
 * Every operation validates first and mutates only once the move is known to be legal, so a
 * failed {@link MoveResult} always means the board is exactly as it was. Tableau sources
 * auto-reveal: when a move leaves a face-down card on top of the source pile it is turned
 * face up.
 * <p>
 * Pile orientation follows {@link GameState}: the last element of each list is the top.
 */
public final class MoveExecutor {
    private MoveExecutor() {
    }

    /**
     * Moves the run {@code src[cardIndex..]} onto another tableau pile.
     *
     * @param state the board, mutated on success
     * @param srcPile source tableau index
     * @param cardIndex index of the base card of the run in the source pile
     * @param destPile destination tableau index
     * @return the outcome
     */
    public static MoveResult moveTableauToTableau(GameState state, int srcPile, int cardIndex, int destPile) {
        if (!KlondikeRules.isTableauIndex(srcPile) || !KlondikeRules.isTableauIndex(destPile)) {
            return MoveResult.failure("Invalid tableau pile");
        }
        if (srcPile == destPile) {
            return MoveResult.failure("Source and destination are the same pile");
        }
        List<Card> src = state.tableau(srcPile);
        List<Card> dest = state.tableau(destPile);

        if (!KlondikeRules.canPickFromTableau(src, cardIndex)) {
            return MoveResult.failure("Cannot pick from that position");
        }
        if (!KlondikeRules.canPlaceOnTableau(src.get(cardIndex), dest)) {
            return MoveResult.failure("Cannot place there");
        }

        List<Card> run = src.subList(cardIndex, src.size());
        dest.addAll(new ArrayList<>(run));
        run.clear();
        revealTop(src);
        return MoveResult.success();
    }

    public static MoveResult moveWasteToTableau(GameState state, int destPile) {
        if (!KlondikeRules.isTableauIndex(destPile)) {
            return MoveResult.failure("Invalid tableau pile");
        }
        if (!KlondikeRules.canPickFromWaste(state)) {
            return MoveResult.failure("Waste is empty");
        }
        List<Card> waste = state.waste();
        Card card = waste.get(waste.size() - 1);
        if (!KlondikeRules.canPlaceOnTableau(card, state.tableau(destPile))) {
            return MoveResult.failure("Cannot place there");
        }

        waste.remove(waste.size() - 1);
        state.tableau(destPile).add(card);
        return MoveResult.success();
    }

    public static MoveResult moveWasteToFoundation(GameState state, int destFoundation) {
        if (!KlondikeRules.isFoundationIndex(destFoundation)) {
            return MoveResult.failure("Invalid foundation");
        }
        if (!KlondikeRules.canPickFromWaste(state)) {
            return MoveResult.failure("Waste is empty");
        }
        List<Card> waste = state.waste();
        Card card = waste.get(waste.size() - 1);
        List<Card> dest = state.foundation(destFoundation);
        if (!KlondikeRules.canPlaceOnFoundation(card, dest, GameState.FOUNDATION_SUITS.get(destFoundation))) {
            return MoveResult.failure("Cannot place on foundation");
        }

        waste.remove(waste.size() - 1);
        dest.add(card);
        return MoveResult.success();
    }

    /**
     * Moves the single top card of a tableau pile onto a foundation.
     *
     * @param state the board, mutated on success
     * @param srcPile source tableau index
     * @param destFoundation destination foundation index
     * @return the outcome
     */
    public static MoveResult moveTableauToFoundation(GameState state, int srcPile, int destFoundation) {
        if (!KlondikeRules.isTableauIndex(srcPile)) {
            return MoveResult.failure("Invalid tableau pile");
        }
        if (!KlondikeRules.isFoundationIndex(destFoundation)) {
            return MoveResult.failure("Invalid foundation");
        }
        List<Card> src = state.tableau(srcPile);
        if (src.isEmpty()) {
            return MoveResult.failure("Tableau pile is empty");
        }
        Card card = src.get(src.size() - 1);
        if (!card.isFaceUp()) {
            return MoveResult.failure("Cannot move face-down card");
        }
        List<Card> dest = state.foundation(destFoundation);
        if (!KlondikeRules.canPlaceOnFoundation(card, dest, GameState.FOUNDATION_SUITS.get(destFoundation))) {
            return MoveResult.failure("Cannot place on foundation");
        }

        src.remove(src.size() - 1);
        dest.add(card);
        revealTop(src);
        return MoveResult.success();
    }

    public static MoveResult moveFoundationToTableau(GameState state, int srcFoundation, int destPile) {
        if (!KlondikeRules.isFoundationIndex(srcFoundation)) {
            return MoveResult.failure("Invalid foundation");
        }
        if (!KlondikeRules.isTableauIndex(destPile)) {
            return MoveResult.failure("Invalid tableau pile");
        }
        List<Card> src = state.foundation(srcFoundation);
        if (src.isEmpty()) {
            return MoveResult.failure("Foundation is empty");
        }
        Card card = src.get(src.size() - 1);
        if (!KlondikeRules.canPlaceOnTableau(card, state.tableau(destPile))) {
            return MoveResult.failure("Cannot place on tableau");
        }

        src.remove(src.size() - 1);
        state.tableau(destPile).add(card);
        return MoveResult.success();
    }

    /**
     * Turns up to {@code drawCount} cards from the stock onto the waste, face up, in draw order.
     *
     * @param state the board, mutated on success
     * @param drawCount maximum cards to draw; fewer are drawn if the stock runs out
     * @return the outcome; fails only when the stock is empty
     */
    public static MoveResult drawFromStock(GameState state, int drawCount) {
        if (!KlondikeRules.canDrawFromStock(state)) {
            return MoveResult.failure("Stock is empty");
        }
        if (drawCount < 1) {
            return MoveResult.failure("Draw count must be positive");
        }
        List<Card> stock = state.stock();
        int toDraw = Math.min(drawCount, stock.size());
        for (int i = 0; i < toDraw; i++) {
            state.waste().add(stock.remove(stock.size() - 1).faceUp());
        }
        return MoveResult.success();
    }

    /**
     * Turns the waste back over to form a new stock, face down.
     * <p>
     * Cards are taken from the waste top one at a time and pushed onto the stock, so the next
     * full pass draws them in the same order as the previous pass.
     *
     * @param state the board, mutated on success
     * @return the outcome; legal only with an empty stock and a non-empty waste
     */
    public static MoveResult recycleWasteToStock(GameState state) {
        if (!state.stock().isEmpty()) {
            return MoveResult.failure("Stock is not empty");
        }
        if (state.waste().isEmpty()) {
            return MoveResult.failure("Waste is empty");
        }
        List<Card> waste = state.waste();
        while (!waste.isEmpty()) {
            state.stock().add(waste.remove(waste.size() - 1).faceDown());
        }
        return MoveResult.success();
    }

    /**
     * Moves the top stock card to the bottom of the stock without turning it.
     * <p>
     * Draw-three stall recovery uses this to change which cards surface on the next pass.
     * A single-card stock is left as it is.
     *
     * @param state the board, mutated on success
     * @return the outcome; fails only on an empty stock
     */
    public static MoveResult buryTopOfStock(GameState state) {
        List<Card> stock = state.stock();
        if (stock.isEmpty()) {
            return MoveResult.failure("Stock is empty");
        }
        stock.add(0, stock.remove(stock.size() - 1));
        return MoveResult.success();
    }

    private static void revealTop(List<Card> pile) {
        if (!pile.isEmpty()) {
            int top = pile.size() - 1;
            pile.set(top, pile.get(top).faceUp());
        }
    }
}
