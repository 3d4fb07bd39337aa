package com.phillippitts.essaydefense.service.correlation;

import com.phillippitts.essaydefense.domain.TranscriptTurn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NameExtractorTest {

    @Test
    void extractsFullNameAfterIntroductionPhrase() {
        assertThat(NameExtractor.extract("Hi, my name is Jane Doe and I wrote about tides."))
                .containsExactly("Jane Doe");
        assertThat(NameExtractor.extract("MY NAME IS Jane")).containsExactly("Jane");
        assertThat(NameExtractor.extract("This is Omar Haddad speaking")).containsExactly("Omar Haddad");
    }

    @Test
    void handlesContractionsIncludingCurlyApostrophe() {
        assertThat(NameExtractor.extract("I'm Priya.")).containsExactly("Priya");
        assertThat(NameExtractor.extract("I’m Priya Nair")).containsExactly("Priya Nair");
    }

    @Test
    void ignoresNonNamesAfterIAm() {
        assertThat(NameExtractor.extract("I'm going to talk about tides")).isEmpty();
        assertThat(NameExtractor.extract("I'm Sorry, can you repeat that?")).isEmpty();
        assertThat(NameExtractor.extract("I am Ready")).isEmpty();
    }

    @Test
    void onlyStudentTurnsAreScanned() {
        List<TranscriptTurn> turns = List.of(
                TranscriptTurn.of("agent", "Hello, this is Professor Grey."),
                TranscriptTurn.of("user", "Hi, I'm Sam Lee."),
                TranscriptTurn.of("user", "Yes, Sam Lee, I am Sam Lee."));

        assertThat(NameExtractor.extractStudentNames(turns)).containsExactly("Sam Lee");
    }

    @Test
    void nothingToExtractFromBlankInput() {
        assertThat(NameExtractor.extract(null)).isEmpty();
        assertThat(NameExtractor.extractStudentNames(null)).isEmpty();
    }
}
