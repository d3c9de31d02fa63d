package eu.virtualparadox.pdfrag.ingest.chunker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SentenceSplitterTest {

    private final SentenceSplitter splitter = new SentenceSplitter(10);

    @Test
    @DisplayName("Splits on terminal punctuation followed by a capital letter")
    void testLatinSentences() {
        final List<String> sentences = splitter.split(
                "The dragon slept in the cave. Was it dangerous? Absolutely it was!  The village rejoiced.");

        assertThat(sentences).containsExactly(
                "The dragon slept in the cave.",
                "Was it dangerous?",
                "Absolutely it was!",
                "The village rejoiced.");
    }

    @Test
    @DisplayName("Does not split after known abbreviations")
    void testAbbreviations() {
        final List<String> sentences = splitter.split(
                "Dr. Smith visited the library in Jan. They found nothing useful. Acme Inc. Holdings paid the bill.");

        assertThat(sentences).containsExactly(
                "Dr. Smith visited the library in Jan. They found nothing useful.",
                "Acme Inc. Holdings paid the bill.");
    }

    @Test
    @DisplayName("Does not split decimals or lowercase continuations")
    void testNoFalseBoundaries() {
        assertThat(splitter.split("Version 2.5 was released. it was stable enough for everyone."))
                .containsExactly("Version 2.5 was released. it was stable enough for everyone.");
    }

    @Test
    @DisplayName("Splits on CJK terminators with or without whitespace")
    void testCjkSentences() {
        final SentenceSplitter cjk = new SentenceSplitter(1);

        assertThat(cjk.split("這是第一句。這是第二句！這是第三句？ 最後一句。"))
                .containsExactly("這是第一句。", "這是第二句！", "這是第三句？", "最後一句。");
    }

    @Test
    @DisplayName("Paragraph breaks end a sentence")
    void testParagraphBreak() {
        assertThat(splitter.split("A heading without period\n\nthe body starts here in lowercase."))
                .containsExactly("A heading without period", "the body starts here in lowercase.");
    }

    @Test
    @DisplayName("Fragments shorter than the minimum are dropped")
    void testShortFragmentsDropped() {
        assertThat(splitter.split("12. The dragon guarded the bridge. Page 3. The council met at dawn."))
                .containsExactly("The dragon guarded the bridge.", "The council met at dawn.");
    }

    @Test
    @DisplayName("The lazy iterator yields the same sentences and then stops")
    void testIterator() {
        final String text = "The first sentence is here. The second sentence follows.";
        final Iterator<String> it = splitter.iterate(text);

        assertThat(it.next()).isEqualTo("The first sentence is here.");
        assertThat(it.next()).isEqualTo("The second sentence follows.");
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    @DisplayName("A negative minimum is rejected")
    void testInvalidMinimum() {
        assertThrows(IllegalArgumentException.class, () -> new SentenceSplitter(-1));
    }
}
