package com.carelog.followup;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import com.carelog.core.model.CheckinReplyKind;

class CheckinReplyClassifierTest {

    private final CheckinReplyClassifier classifier = new CheckinReplyClassifier();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "Same as yesterday                | SAME",
            "está igual                       | SAME",
            "sin cambios la verdad            | SAME",
            "c'est pareil                     | SAME",
            "A bit better today               | BETTER",
            "muito melhor, obrigado           | BETTER",
            "it's improving slowly            | BETTER",
            "mejorando poco a poco            | BETTER",
            "Worse than yesterday             | WORSE",
            "c'est pire                       | WORSE",
            "there is more swelling           | WORSE",
            "I went to see a doctor           | OTHER",
    })
    void classifiesByKeyword(String reply, CheckinReplyKind expected) {
        assertThat(classifier.classify(reply)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = { "sameness of it all", "betterment" })
    void keywordsMustStandAlone(String reply) {
        assertThat(classifier.classify(reply)).isEqualTo(CheckinReplyKind.OTHER);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   " })
    void blankIsOther(String reply) {
        assertThat(classifier.classify(reply)).isEqualTo(CheckinReplyKind.OTHER);
    }

    @ParameterizedTest
    @ValueSource(strings = { "same, maybe a little better", "same but worse at night" })
    void sameIsCheckedFirst(String reply) {
        assertThat(classifier.classify(reply)).isEqualTo(CheckinReplyKind.SAME);
    }
}
