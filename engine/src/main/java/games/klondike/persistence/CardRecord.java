package games.klondike.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import games.klondike.game.Card;
import games.klondike.game.Rank;
import games.klondike.game.Suit;
import java.util.Locale;

/**
 * Persisted form of a {@link Card}: {@code {"rank": 12, "suit": "hearts", "face_up": true}}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CardRecord {
    private int rank;
    private String suit;
    private boolean faceUp;

    /**
     * Default constructor for JSON binding.
     */
    public CardRecord() {
    }

    public CardRecord(int rank, String suit, boolean faceUp) {
        this.rank = rank;
        this.suit = suit;
        this.faceUp = faceUp;
    }

    public static CardRecord from(Card card) {
        return new CardRecord(card.getRank().getValue(), card.getSuit().name().toLowerCase(Locale.ROOT), card.isFaceUp());
    }

    /**
     * @return the card this record describes
     * @throws IllegalArgumentException if rank or suit is invalid
     */
    public Card toCard() {
        return new Card(Rank.fromValue(rank), Suit.fromName(suit), faceUp);
    }

    public int getRank() {
        return rank;
    }

    public void setRank(int rank) {
        this.rank = rank;
    }

    public String getSuit() {
        return suit;
    }

    public void setSuit(String suit) {
        this.suit = suit;
    }

    public boolean isFaceUp() {
        return faceUp;
    }

    public void setFaceUp(boolean faceUp) {
        this.faceUp = faceUp;
    }
}
