package com.isweep.dispatch.cli;

import com.isweep.core.engine.DecisionEngine;
import com.isweep.core.model.Category;
import com.isweep.core.model.Decision;
import com.isweep.core.model.Preferences;
import com.isweep.core.model.Sensitivity;
import com.isweep.core.rules.InvalidConfigurationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: isweep analyze "&lt;text&gt;"
 * <p>
 * Evaluates text against the loaded rules. Without {@code --user} the
 * preferences are built from the options, so no store is consulted; with
 * {@code --user} the stored preferences of that user apply.
 * <p>
 * Exits with 1 when a sensitivity or category option is not recognised.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Decide the playback action for a caption")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Caption or transcript text")
    private String text;

    @Option(names = {"--user", "-u"}, description = "Use the stored preferences of this user")
    private Long userId;

    @Option(names = {"--sensitivity", "-s"}, defaultValue = "medium",
            description = "Sensitivity for every category: low, medium, high (default: ${DEFAULT-VALUE})")
    private String sensitivity;

    @Option(names = "--language-sensitivity", description = "Override the language sensitivity")
    private String languageSensitivity;

    @Option(names = "--sexual-sensitivity", description = "Override the sexual content sensitivity")
    private String sexualSensitivity;

    @Option(names = "--violence-sensitivity", description = "Override the violence sensitivity")
    private String violenceSensitivity;

    @Option(names = {"--disable", "-d"}, split = ",",
            description = "Categories to leave unfiltered: language, sexual, violence")
    private List<String> disabled = new ArrayList<>();

    private final DecisionEngine decisionEngine;

    public AnalyzeCommand(DecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Decision decision;
        if (userId != null) {
            ConsoleOutput.info("Using stored preferences of user " + userId);
            decision = decisionEngine.decide(userId, text, null);
        } else {
            try {
                decision = decisionEngine.evaluate(buildPreferences(), text);
            } catch (InvalidConfigurationException e) {
                ConsoleOutput.error(e.getMessage() + ". Sensitivities: " + Sensitivity.ALLOWED_VALUES
                        + "; categories: language, sexual, violence");
                return 1;
            }
        }

        ConsoleOutput.decision(decision);
        return 0;
    }

    Preferences buildPreferences() {
        Sensitivity base = Sensitivity.fromWire(sensitivity);
        Preferences preferences = new Preferences(true, true, true, base, base, base);
        if (languageSensitivity != null) {
            preferences = preferences.withSensitivity(Category.LANGUAGE, Sensitivity.fromWire(languageSensitivity));
        }
        if (sexualSensitivity != null) {
            preferences = preferences.withSensitivity(Category.SEXUAL, Sensitivity.fromWire(sexualSensitivity));
        }
        if (violenceSensitivity != null) {
            preferences = preferences.withSensitivity(Category.VIOLENCE, Sensitivity.fromWire(violenceSensitivity));
        }
        for (String category : disabled) {
            preferences = preferences.withFilter(Category.fromWire(category), false);
        }
        return preferences;
    }
}
