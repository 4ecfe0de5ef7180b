package org.calista.accuracy.text;

import java.util.List;

/**
 * Splits text into tokens. Implementations must be deterministic and total (null -> empty list).
 */
public interface Tokenizer {
    List<String> tokenize(String text);
}
