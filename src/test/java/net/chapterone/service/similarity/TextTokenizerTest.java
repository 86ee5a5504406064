package net.chapterone.service.similarity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextTokenizerTest {

    @Test
    void should_LowercaseAndDropShortAndStopWords_When_Tokenizing() {
        assertThat(TextTokenizer.tokenize("The Fellowship of the Ring, and Two Towers!"))
            .containsExactly("fellowship", "ring", "two", "towers");
    }

    @Test
    void should_ReturnEmpty_When_TextIsBlank() {
        assertThat(TextTokenizer.tokenize(null)).isEmpty();
        assertThat(TextTokenizer.tokenize("   ")).isEmpty();
    }

    @Test
    void should_DropEnglishStopWords_When_TheyAreLongEnough() {
        assertThat(TextTokenizer.tokenize("There were these dragons which they fought"))
            .containsExactly("dragons", "fought");
    }

    @Test
    void should_KeepDigitsAndLetters_When_PunctuationSeparatesThem() {
        assertThat(TextTokenizer.tokenize("sci-fi 1984 déjà-vu")).containsExactly("sci", "1984", "déjà");
    }
}
