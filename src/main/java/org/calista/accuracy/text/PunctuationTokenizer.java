package org.calista.accuracy.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cases and splits on runs of whitespace and Unicode punctuation ({@code \p{P}}).
 *
 * <p>Symbols that are not punctuation ({@code + = < > ^}) stay inside tokens,
 * so {@code "2+2"} is one token.
 */
public final class PunctuationTokenizer implements Tokenizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{P}]+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final PunctuationTokenizer INSTANCE = new PunctuationTokenizer();

    public static PunctuationTokenizer instance() {
        return INSTANCE;
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();
        String s = text.toLowerCase(Locale.ROOT);

        String[] parts = SEPARATORS.split(s);
        ArrayList<String> out = new ArrayList<>(parts.length);
        for (String p : parts) if (!p.isEmpty()) out.add(p);
        return out;
    }
}
