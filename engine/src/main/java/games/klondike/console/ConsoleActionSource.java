package games.klondike.console;

import games.klondike.session.BuryDecision;
import games.klondike.session.GameAction;
import games.klondike.session.GameSession;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Scanner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads word commands from stdin and answers the bury prompt.
 */
@Component
public class ConsoleActionSource implements ActionSource, BuryDecision {
    static final String PROMPT =
            "Enter command (up | down | left | right | select | place | cancel | draw | undo | hint | restart | quit): ";

    private static final Map<String, GameAction> COMMANDS = Map.ofEntries(
            Map.entry("up", GameAction.MOVE_UP),
            Map.entry("w", GameAction.MOVE_UP),
            Map.entry("down", GameAction.MOVE_DOWN),
            Map.entry("s", GameAction.MOVE_DOWN),
            Map.entry("left", GameAction.MOVE_LEFT),
            Map.entry("a", GameAction.MOVE_LEFT),
            Map.entry("right", GameAction.MOVE_RIGHT),
            Map.entry("d", GameAction.MOVE_RIGHT),
            Map.entry("select", GameAction.SELECT),
            Map.entry("enter", GameAction.SELECT),
            Map.entry("place", GameAction.PLACE),
            Map.entry("cancel", GameAction.CANCEL),
            Map.entry("esc", GameAction.CANCEL),
            Map.entry("draw", GameAction.STOCK_ACTION),
            Map.entry("turn", GameAction.STOCK_ACTION),
            Map.entry("undo", GameAction.UNDO),
            Map.entry("u", GameAction.UNDO),
            Map.entry("restart", GameAction.RESTART),
            Map.entry("r", GameAction.RESTART),
            Map.entry("hint", GameAction.SHOW_HINTS),
            Map.entry("tab", GameAction.SHOW_HINTS));

    private final Scanner scanner;
    private final PrintStream out;

    @Autowired
    public ConsoleActionSource() {
        this(System.in, System.out);
    }

    public ConsoleActionSource(InputStream in, PrintStream out) {
        this.scanner = new Scanner(in);
        this.out = out;
    }

    @Override
    public GameAction nextAction(GameSession session) {
        while (true) {
            out.print(PROMPT);
            if (!scanner.hasNextLine()) {
                return null;
            }
            String input = scanner.nextLine().trim().toLowerCase(Locale.ROOT);
            if (input.equals("quit") || input.equals("q")) {
                return null;
            }
            Optional<GameAction> action = parse(input);
            if (action.isPresent()) {
                return action.get();
            }
            if (!input.isEmpty()) {
                out.println("Unknown command: " + input);
            }
        }
    }

    /**
     * Asks on the console; closed input counts as declining.
     */
    @Override
    public boolean shouldBury() {
        while (true) {
            out.print("No progress this pass. Bury top card? (Y/N): ");
            if (!scanner.hasNextLine()) {
                return false;
            }
            String answer = scanner.nextLine().trim().toLowerCase(Locale.ROOT);
            if (answer.equals("y") || answer.equals("yes")) {
                return true;
            }
            if (answer.equals("n") || answer.equals("no")) {
                return false;
            }
        }
    }

    /**
     * Maps one command word (case-insensitive) to its action.
     *
     * @param command the raw word, e.g. "draw" or "Left"
     * @return the action, or empty for unknown words and quit
     */
    public static Optional<GameAction> parse(String command) {
        if (command == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(COMMANDS.get(command.trim().toLowerCase(Locale.ROOT)));
    }
}
