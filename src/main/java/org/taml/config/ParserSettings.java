package org.taml.config;

import com.typesafe.config.Config;
import org.taml.frontend.parser.ParseOptions;

/**
 * Maps the {@code taml.parser} configuration section to {@link ParseOptions}.
 *
 * <pre>
 * taml.parser {
 *   max-depth = 100
 *   include-positions = true
 * }
 * </pre>
 */
public final class ParserSettings {

    static final String PARSER_PATH = "taml.parser";
    static final String MAX_DEPTH_KEY = "max-depth";
    static final String INCLUDE_POSITIONS_KEY = "include-positions";

    private ParserSettings() {}

    /**
     * Reads parse options from the configuration. Missing keys keep their defaults.
     *
     * @param config The application configuration.
     * @return The parse options.
     * @throws IllegalArgumentException if the configured depth is negative or above {@link ParseOptions#MAX_ALLOWED_DEPTH}.
     * @throws com.typesafe.config.ConfigException.WrongType if a value has the wrong type.
     */
    public static ParseOptions fromConfig(Config config) {
        ParseOptions options = ParseOptions.defaults();
        if (!config.hasPath(PARSER_PATH)) {
            return options;
        }

        Config parserConfig = config.getConfig(PARSER_PATH);
        if (parserConfig.hasPath(MAX_DEPTH_KEY)) {
            options = options.withMaxDepth(parserConfig.getInt(MAX_DEPTH_KEY));
        }
        if (parserConfig.hasPath(INCLUDE_POSITIONS_KEY)) {
            options = options.withIncludePositions(parserConfig.getBoolean(INCLUDE_POSITIONS_KEY));
        }
        return options;
    }
}
