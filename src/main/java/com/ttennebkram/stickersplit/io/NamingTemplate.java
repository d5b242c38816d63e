package com.ttennebkram.stickersplit.io;

import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.ParameterException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tile file-name pattern. Tokens:
 * <ul>
 *   <li>{@code {seq}}  1-based row-major index, zero-padded to 3 digits</li>
 *   <li>{@code {row}}, {@code {col}}  1-based grid position, zero-padded to 2 digits</li>
 *   <li>{@code {name}}  base name of the source image</li>
 * </ul>
 * A template must contain {@code {seq}} or both {@code {row}} and {@code {col}}. Grids have at most
 * 18 rows and columns, so the fixed-width numbers keep names distinct even when tokens touch.
 */
public final class NamingTemplate {

    public static final String DEFAULT = "{seq}_{name}";

    private static final Pattern TOKEN = Pattern.compile("\\{([^{}]*)}");

    private final String pattern;

    private NamingTemplate(String pattern) {
        this.pattern = pattern;
    }

    public static NamingTemplate defaults() {
        return new NamingTemplate(DEFAULT);
    }

    /**
     * @throws ParameterException if the template has unknown tokens, path separators,
     *         or cannot produce unique names
     */
    public static NamingTemplate parse(String pattern) {
        if (pattern == null || pattern.trim().isEmpty()) {
            throw new ParameterException("Naming template is empty");
        }
        if (pattern.indexOf('/') >= 0 || pattern.indexOf('\\') >= 0) {
            throw new ParameterException("Naming template must not contain path separators: " + pattern);
        }
        Matcher m = TOKEN.matcher(pattern);
        while (m.find()) {
            String token = m.group(1);
            if (!token.equals("seq") && !token.equals("row") && !token.equals("col") && !token.equals("name")) {
                throw new ParameterException("Unknown token {" + token + "} in naming template " + pattern);
            }
        }
        boolean hasSeq = pattern.contains("{seq}");
        boolean hasRowCol = pattern.contains("{row}") && pattern.contains("{col}");
        if (!hasSeq && !hasRowCol) {
            throw new ParameterException("Naming template needs {seq} or both {row} and {col}: " + pattern);
        }
        return new NamingTemplate(pattern);
    }

    public String pattern() {
        return pattern;
    }

    /**
     * File name for a tile, with the format's extension.
     *
     * @param seq 0-based row-major index
     * @param row 0-based row index
     * @param col 0-based column index
     */
    public String fileName(int seq, int row, int col, String baseName, OutputFormat format) {
        String name = pattern
                .replace("{seq}", String.format("%03d", seq + 1))
                .replace("{row}", String.format("%02d", row + 1))
                .replace("{col}", String.format("%02d", col + 1))
                .replace("{name}", baseName);
        return name + "." + format.extension();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
