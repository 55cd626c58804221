package org.taml.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed vocabulary of TAML tags. Every tag selects one terminal style and
 * belongs to exactly one {@link Category}.
 */
public enum TamlTag {
    // Standard colors
    BLACK("black", Category.STANDARD_COLOR),
    RED("red", Category.STANDARD_COLOR),
    GREEN("green", Category.STANDARD_COLOR),
    YELLOW("yellow", Category.STANDARD_COLOR),
    BLUE("blue", Category.STANDARD_COLOR),
    MAGENTA("magenta", Category.STANDARD_COLOR),
    CYAN("cyan", Category.STANDARD_COLOR),
    WHITE("white", Category.STANDARD_COLOR),

    // Bright colors
    BRIGHT_BLACK("brightBlack", Category.BRIGHT_COLOR),
    BRIGHT_RED("brightRed", Category.BRIGHT_COLOR),
    BRIGHT_GREEN("brightGreen", Category.BRIGHT_COLOR),
    BRIGHT_YELLOW("brightYellow", Category.BRIGHT_COLOR),
    BRIGHT_BLUE("brightBlue", Category.BRIGHT_COLOR),
    BRIGHT_MAGENTA("brightMagenta", Category.BRIGHT_COLOR),
    BRIGHT_CYAN("brightCyan", Category.BRIGHT_COLOR),
    BRIGHT_WHITE("brightWhite", Category.BRIGHT_COLOR),

    // Background colors, including bright backgrounds
    BG_BLACK("bgBlack", Category.BACKGROUND_COLOR),
    BG_RED("bgRed", Category.BACKGROUND_COLOR),
    BG_GREEN("bgGreen", Category.BACKGROUND_COLOR),
    BG_YELLOW("bgYellow", Category.BACKGROUND_COLOR),
    BG_BLUE("bgBlue", Category.BACKGROUND_COLOR),
    BG_MAGENTA("bgMagenta", Category.BACKGROUND_COLOR),
    BG_CYAN("bgCyan", Category.BACKGROUND_COLOR),
    BG_WHITE("bgWhite", Category.BACKGROUND_COLOR),
    BG_BRIGHT_BLACK("bgBrightBlack", Category.BACKGROUND_COLOR),
    BG_BRIGHT_RED("bgBrightRed", Category.BACKGROUND_COLOR),
    BG_BRIGHT_GREEN("bgBrightGreen", Category.BACKGROUND_COLOR),
    BG_BRIGHT_YELLOW("bgBrightYellow", Category.BACKGROUND_COLOR),
    BG_BRIGHT_BLUE("bgBrightBlue", Category.BACKGROUND_COLOR),
    BG_BRIGHT_MAGENTA("bgBrightMagenta", Category.BACKGROUND_COLOR),
    BG_BRIGHT_CYAN("bgBrightCyan", Category.BACKGROUND_COLOR),
    BG_BRIGHT_WHITE("bgBrightWhite", Category.BACKGROUND_COLOR),

    // Text styles
    BOLD("bold", Category.TEXT_STYLE),
    DIM("dim", Category.TEXT_STYLE),
    ITALIC("italic", Category.TEXT_STYLE),
    UNDERLINE("underline", Category.TEXT_STYLE),
    STRIKETHROUGH("strikethrough", Category.TEXT_STYLE);

    /**
     * The four groups the tag vocabulary is partitioned into.
     */
    public enum Category {
        /** The eight standard foreground colors. */
        STANDARD_COLOR,
        /** The eight bright foreground colors. */
        BRIGHT_COLOR,
        /** Standard and bright background colors. */
        BACKGROUND_COLOR,
        /** Text styles such as bold or underline. */
        TEXT_STYLE
    }

    private static final Map<String, TamlTag> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(TamlTag::tagName, Function.identity()));

    private final String tagName;
    private final Category category;

    TamlTag(String tagName, Category category) {
        this.tagName = tagName;
        this.category = category;
    }

    /**
     * Gets the name of the tag as it is written in source, e.g. {@code brightRed}.
     * @return The tag name.
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Gets the group this tag belongs to.
     * @return The category.
     */
    public Category category() {
        return category;
    }

    /**
     * Checks whether the given string is one of the valid TAML tag names.
     * The check is case sensitive.
     *
     * @param name The candidate tag name, may be null.
     * @return true if the name is a valid tag.
     */
    public static boolean isValidTag(String name) {
        return name != null && BY_NAME.containsKey(name);
    }

    /**
     * Looks up a tag by its source name.
     * @param name The tag name.
     * @return The tag, or empty if the name is not part of the vocabulary.
     */
    public static Optional<TamlTag> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /**
     * Returns all tags of a category in declaration order.
     * @param category The category.
     * @return An unmodifiable list of tags.
     */
    public static List<TamlTag> byCategory(Category category) {
        return Collections.unmodifiableList(Arrays.stream(values())
                .filter(t -> t.category == category)
                .collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        return tagName;
    }
}
