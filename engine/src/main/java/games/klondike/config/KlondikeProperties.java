package games.klondike.config;

import games.klondike.game.DrawMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for a Klondike session.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments="--klondike.draw-count=3 --klondike.seed=42"}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "klondike")
public class KlondikeProperties {
  private int drawCount = 1;
  private Long seed;
  private int undoCapacity = 100;

  /**
   * Returns the number of cards turned per stock draw.
   * @return 1 or 3
   */
  public int getDrawCount() {
    return drawCount;
  }

  /**
   * Sets the number of cards turned per stock draw.
   * @param drawCount 1 or 3
   * @throws IllegalArgumentException for any other value
   */
  public void setDrawCount(int drawCount) {
    DrawMode.fromCount(drawCount);
    this.drawCount = drawCount;
  }

  public DrawMode getDrawMode() {
    return DrawMode.fromCount(drawCount);
  }

  /**
   * Returns the fixed deal seed, or null to deal from a random seed each game.
   * @return the seed or null
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  public int getUndoCapacity() {
    return undoCapacity;
  }

  /**
   * Sets how many undo snapshots are retained.
   * @param undoCapacity a positive count
   * @throws IllegalArgumentException if not positive
   */
  public void setUndoCapacity(int undoCapacity) {
    if (undoCapacity <= 0) {
      throw new IllegalArgumentException("undo-capacity must be positive, got " + undoCapacity);
    }
    this.undoCapacity = undoCapacity;
  }
}
