package org.bacon.repl;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Settings of the interactive loop, read from the {@code bacon.repl} block of the configuration.
 * <pre>
 * bacon.repl {
 *   prompt = "&gt;&gt; "
 *   mode = "parse"
 *   show-welcome-message = true
 * }
 * </pre>
 *
 * @param prompt The prompt printed before each line.
 * @param mode The initial output mode.
 * @param showWelcomeMessage Whether to greet the user on start.
 */
public record ReplConfig(
        String prompt,
        ReplMode mode,
        boolean showWelcomeMessage
) {

    private static final String PATH = "bacon.repl";

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The application configuration. Must contain the {@code bacon.repl} block.
     * @return The settings.
     * @throws ConfigException.BadValue if the configured mode is unknown.
     */
    public static ReplConfig fromConfig(Config config) {
        Config repl = config.getConfig(PATH);
        String modeName = repl.getString("mode");
        ReplMode mode;
        try {
            mode = ReplMode.fromName(modeName);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(repl.origin(), PATH + ".mode",
                    "Unknown REPL mode '" + modeName + "', expected one of tokens, parse, tree", e);
        }
        return new ReplConfig(repl.getString("prompt"), mode, repl.getBoolean("show-welcome-message"));
    }

    /**
     * @param newMode The mode to use instead.
     * @return A copy of these settings with a different initial mode.
     */
    public ReplConfig withMode(ReplMode newMode) {
        return new ReplConfig(prompt, newMode, showWelcomeMessage);
    }
}
