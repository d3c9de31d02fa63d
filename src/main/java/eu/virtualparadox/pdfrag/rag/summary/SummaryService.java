package eu.virtualparadox.pdfrag.rag.summary;

import eu.virtualparadox.pdfrag.application.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Condenses extracted document text with the configured {@link ChatModel} before it is chunked.
 * <p>
 * The text is packed into paragraph-aligned pieces of at most {@code pdfrag.ingestion.summary-input-chars}
 * characters and each piece is condensed on its own. A piece keeps its original text when the model
 * fails or answers with less than {@code pdfrag.ingestion.min-summary-chars} characters.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryService {

    private static final String INSTRUCTIONS = String.join("\n",
            "You are a professional text editor. Output only the condensed text, without any reasoning, notes or preamble.",
            "Task: condense the text below to 60-90% of its original length.",
            "Rules:",
            "- Keep every core point and every important fact.",
            "- Remove redundant, repeated and unnecessary content.",
            "- Merge similar sentences and paragraphs.",
            "- Prefer concise wording.",
            "- Keep the language of the original text.",
            "- Never add explanations, introductions or closing remarks."
    );

    private final ChatModel chatModel;
    private final IngestionProperties properties;

    /**
     * @param text normalized document text
     * @return the condensed text with piece counts; never fails, unusable pieces stay as they were
     */
    public TextSummary summarize(final String text) {
        final List<String> pieces = pieces(text, Math.max(1, properties.getSummaryInputChars()));
        final List<String> condensed = new ArrayList<>(pieces.size());
        int replaced = 0;

        for (int i = 0; i < pieces.size(); i++) {
            final String piece = pieces.get(i);
            final String summary = condense(piece, i + 1, pieces.size());
            if (summary != null) {
                condensed.add(summary);
                replaced++;
            } else {
                condensed.add(piece);
            }
        }

        final TextSummary result = new TextSummary(String.join("\n\n", condensed), text.length(), pieces.size(), replaced);
        log.info("Summarized {} pieces ({} condensed): {} -> {} characters",
                result.pieces(), result.condensedPieces(), text.length(), result.text().length());
        return result;
    }

    /**
     * @return the model's summary of the piece, or {@code null} if it is unusable
     */
    private String condense(final String piece, final int number, final int total) {
        try {
            final String output = chatModel.call(new Prompt(
                            new SystemMessage(INSTRUCTIONS),
                            new UserMessage("Original text:\n" + piece + "\n\nCondensed text:")))
                    .getResult()
                    .getOutput()
                    .getText();
            if (output == null || output.strip().length() < properties.getMinSummaryChars()) {
                log.warn("Piece {}/{} produced no usable summary, keeping the original", number, total);
                return null;
            }
            log.debug("Piece {}/{} condensed: {} -> {} characters", number, total, piece.length(), output.strip().length());
            return output.strip();
        } catch (RuntimeException e) {
            log.warn("Summarization of piece {}/{} failed, keeping the original: {}", number, total, e.getMessage());
            return null;
        }
    }

    /**
     * Packs paragraphs into pieces of at most {@code maxChars}. A paragraph longer than the limit is
     * cut at the last whitespace before it.
     */
    static List<String> pieces(final String text, final int maxChars) {
        final List<String> pieces = new ArrayList<>();
        if (text.length() <= maxChars) {
            if (!text.isBlank()) {
                pieces.add(text);
            }
            return pieces;
        }

        final StringBuilder current = new StringBuilder();
        for (final String raw : text.split("\n{2,}")) {
            String paragraph = raw.strip();
            if (paragraph.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + 2 + paragraph.length() > maxChars) {
                pieces.add(current.toString());
                current.setLength(0);
            }
            while (paragraph.length() > maxChars) {
                int cut = paragraph.lastIndexOf(' ', maxChars);
                if (cut <= 0) {
                    cut = maxChars;
                }
                pieces.add(paragraph.substring(0, cut).strip());
                paragraph = paragraph.substring(cut).strip();
            }
            if (paragraph.isEmpty()) {
                continue;
            }
            if (current.length() > 0) {
                current.append("\n\n");
            }
            current.append(paragraph);
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }
}
