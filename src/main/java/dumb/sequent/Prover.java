package dumb.sequent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static dumb.sequent.util.Log.error;
import static dumb.sequent.util.Log.warning;

/**
 * Command-line entry point: reads {@link Commands} from standard input, one per line.
 */
public class Prover {

    public static void main(String[] args) {
        String configFile = null;
        String templateFile = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = args[++i];
                    case "-t", "--templates" -> templateFile = args[++i];
                    case "-h", "--help" -> printUsageAndExit(0);
                    default -> warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                error("Missing value for " + args[i - 1]);
                printUsageAndExit(1);
            }
        }

        try {
            var config = configFile != null ? Configuration.load(Path.of(configFile)) : Configuration.load();
            if (templateFile != null) config = config.withTemplateFile(templateFile);
            var session = new ProofSession(config);
            var store = new JsonRuleTemplateStore(Path.of(config.templateFile()));
            if (config.loadTemplates()) {
                try {
                    session.registerAll(store.load());
                } catch (IOException e) {
                    error("Could not load rule templates from " + store.path() + ": " + e.getMessage(), e);
                }
            }
            run(new Commands(session, store, config), new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    new PrintStream(System.out, true, StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException e) {
            error("Startup failed: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    static void run(Commands commands, BufferedReader in, PrintStream out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            var trimmed = line.trim();
            if (trimmed.equals("quit") || trimmed.equals("exit")) break;
            var result = commands.execute(trimmed);
            if (!result.isEmpty()) out.println(result);
        }
    }

    private static void printUsageAndExit(int status) {
        System.err.printf("Usage: java %s [-c config.json] [-t templates.json]%n", Prover.class.getName());
        System.err.println("Commands are read from standard input; type 'help' for the list.");
        System.exit(status);
    }
}
