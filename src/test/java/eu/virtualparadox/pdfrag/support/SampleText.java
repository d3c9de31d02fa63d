package eu.virtualparadox.pdfrag.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded English-like sentences for chunking and ingestion tests.
 */
public final class SampleText {

    private static final String[] SUBJECTS = {
            "The dragon", "A careful scholar", "The northern council", "An old merchant", "The river guild",
            "Every apprentice", "The mountain village", "A travelling healer", "The royal archive", "Our expedition"
    };
    private static final String[] VERBS = {
            "studied", "guarded", "described", "rebuilt", "questioned", "mapped", "recorded", "defended"
    };
    private static final String[] OBJECTS = {
            "the ancient bridge", "several volcanic eruptions", "the harvest ledgers", "a forgotten library",
            "the winter trade routes", "the copper mines", "a quiet harbour", "the eastern watchtower"
    };
    private static final String[] TAILS = {
            "during the long winter", "with remarkable patience", "before the spring floods",
            "after the council meeting", "for nearly twelve years", "despite the heavy rain"
    };

    private SampleText() {
    }

    /**
     * @param count number of sentences
     * @param seed  random seed
     * @return sentences, each ending with a period
     */
    public static List<String> sentences(final int count, final long seed) {
        final Random rnd = new Random(seed);
        final List<String> sentences = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            sentences.add(SUBJECTS[rnd.nextInt(SUBJECTS.length)] + " "
                    + VERBS[rnd.nextInt(VERBS.length)] + " "
                    + OBJECTS[rnd.nextInt(OBJECTS.length)] + " "
                    + TAILS[rnd.nextInt(TAILS.length)] + ".");
        }
        return sentences;
    }

    /**
     * @return sentences joined with single spaces
     */
    public static String paragraph(final int count, final long seed) {
        return String.join(" ", sentences(count, seed));
    }

    /**
     * Pages of roughly {@code charsPerPage} characters each.
     */
    public static List<String> pages(final int pageCount, final int charsPerPage, final long seed) {
        final List<String> pages = new ArrayList<>(pageCount);
        for (int p = 0; p < pageCount; p++) {
            final StringBuilder page = new StringBuilder();
            final Random rnd = new Random(seed + p);
            while (page.length() < charsPerPage) {
                if (page.length() > 0) {
                    page.append(rnd.nextInt(5) == 0 ? "\n" : " ");
                }
                page.append(sentences(1, rnd.nextLong()).get(0));
            }
            pages.add(page.toString());
        }
        return pages;
    }
}
