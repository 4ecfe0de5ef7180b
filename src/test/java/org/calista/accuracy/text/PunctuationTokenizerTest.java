package org.calista.accuracy.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PunctuationTokenizerTest {

    private final Tokenizer tokenizer = PunctuationTokenizer.instance();

    @Test
    void lowercasesAndSplitsOnWhitespaceAndPunctuation() {
        assertThat(tokenizer.tokenize("Hello, World!  The answer:42."))
                .containsExactly("hello", "world", "the", "answer", "42");
    }

    @Test
    void keepsMathSymbolsInsideTokens() {
        assertThat(tokenizer.tokenize("2+2 = 4")).containsExactly("2+2", "=", "4");
    }

    @Test
    void emptyAndNullYieldNoTokens() {
        assertThat(tokenizer.tokenize("")).isEmpty();
        assertThat(tokenizer.tokenize(null)).isEmpty();
        assertThat(tokenizer.tokenize(" ,.; ")).isEmpty();
    }
}
