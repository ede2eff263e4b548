package com.questrail.gs1.parse;

import com.questrail.gs1.api.Symbology;
import com.questrail.gs1.config.DecoderOptions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prepares raw scanner output for parsing.
 *
 * <ol>
 *   <li>strip an ISO/IEC 15424 symbology identifier ({@code ]d2}, {@code ]C1}, ...)</li>
 *   <li>detect separator stand-ins and, if enabled, replace them with ASCII 29</li>
 *   <li>trim whitespace and separators from both ends</li>
 * </ol>
 */
public final class InputNormalizer
{
    private final List<String> standIns;
    private final boolean replace;

    public InputNormalizer(DecoderOptions options)
    {
        this(options.separatorStandIns(), options.normalizeSeparators());
    }

    public InputNormalizer(List<String> standIns, boolean replace)
    {
        this.standIns = List.copyOf(Objects.requireNonNull(standIns, "standIns"));
        this.replace = replace;
    }

    public NormalizedInput normalize(String raw)
    {
        Objects.requireNonNull(raw, "raw");

        String text = raw.stripLeading();
        Optional<Symbology> symbology = Symbology.detect(text);
        if (symbology.isPresent()) {
            text = text.substring(symbology.get().prefix().length());
        }

        boolean separators = text.indexOf(DecoderOptions.GS) >= 0;
        for (String s : standIns) {
            if (text.contains(s)) {
                separators = true;
                if (replace) {
                    text = text.replace(s, String.valueOf(DecoderOptions.GS));
                }
            }
        }

        return new NormalizedInput(raw, trim(text), symbology.orElse(Symbology.NONE), separators);
    }

    private static String trim(String text)
    {
        int from = 0;
        int to = text.length();
        while (from < to && isPadding(text.charAt(from))) {
            from++;
        }
        while (to > from && isPadding(text.charAt(to - 1))) {
            to--;
        }
        return text.substring(from, to);
    }

    private static boolean isPadding(char c)
    {
        return c == DecoderOptions.GS || Character.isWhitespace(c);
    }
}
