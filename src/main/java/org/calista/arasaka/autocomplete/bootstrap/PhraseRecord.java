package org.calista.arasaka.autocomplete.bootstrap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One JSONL corpus row: {@code {"phrase": "tape grid", "score": 98}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PhraseRecord {

    public String phrase;

    /** Boxed so a missing score can be told apart from 0. */
    public Long score;

    public void validate() {
        if (phrase == null) throw new IllegalArgumentException("PhraseRecord.phrase is required");
        if (score == null) throw new IllegalArgumentException("PhraseRecord.score is required");
    }
}
