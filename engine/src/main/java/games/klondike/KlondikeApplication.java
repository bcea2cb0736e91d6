package games.klondike;

import games.klondike.config.KlondikeProperties;
import games.klondike.console.ActionSource;
import games.klondike.console.BoardFormatter;
import games.klondike.session.BuryDecision;
import games.klondike.session.GameAction;
import games.klondike.session.GameController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class KlondikeApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(KlondikeApplication.class);

    private final GameController controller;
    private final ActionSource actionSource;

    public KlondikeApplication(GameController controller, ActionSource actionSource) {
        this.controller = controller;
        this.actionSource = actionSource;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(KlondikeApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Bean
    static GameController gameController(KlondikeProperties properties, BuryDecision buryDecision) {
        return new GameController(properties, buryDecision);
    }

    @Override
    public void run(String... args) {
        play();
    }

    /**
     * Reads actions until the source is exhausted or the player quits.
     *
     * @return the number of actions processed
     */
    public int play() {
        BoardFormatter formatter = new BoardFormatter(controller);
        controller.startGame();
        int actions = 0;
        while (true) {
            log.info("\n{}", formatter.format());
            GameAction action = actionSource.nextAction(controller.getSession());
            if (action == null) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed after {} action(s); {}", actions, controller.getSession());
                }
                break;
            }
            boolean applied = controller.handle(action);
            actions++;
            if (log.isDebugEnabled()) {
                log.debug("{} -> {} ({})", action, applied, controller.getSession().getMessage());
            }
        }
        return actions;
    }
}
