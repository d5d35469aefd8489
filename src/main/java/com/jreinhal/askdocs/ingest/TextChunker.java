package com.jreinhal.askdocs.ingest;

import com.jreinhal.askdocs.retrieval.Chunk;
import com.jreinhal.askdocs.retrieval.RetrievalScope;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Splits plain text into overlapping word windows. A window is the source text from its first
 * word to its last, so line breaks and table rows inside it survive.
 */
@Component
public class TextChunker {
    private static final Pattern WORD = Pattern.compile("\\S+");
    @Value("${askdocs.ingest.chunk-words:200}")
    private int chunkWords = 200;
    @Value("${askdocs.ingest.overlap-words:25}")
    private int overlapWords = 25;

    /**
     * @param owner store key of the uploader; {@code null} leaves the chunks shared
     */
    public List<Chunk> chunk(String documentId, String source, String owner, String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<int[]> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(new int[]{matcher.start(), matcher.end()});
        }
        Map<String, String> metadata = new HashMap<>();
        metadata.put("source", source);
        if (owner != null) {
            metadata.put(RetrievalScope.OWNER_KEY, owner);
        }
        int step = Math.max(1, this.chunkWords - this.overlapWords);
        List<Chunk> chunks = new ArrayList<>();
        for (int start = 0; start < words.size(); start += step) {
            int end = Math.min(words.size(), start + this.chunkWords);
            String body = text.substring(words.get(start)[0], words.get(end - 1)[1]);
            int ordinal = chunks.size();
            chunks.add(new Chunk(Chunk.chunkId(documentId, ordinal), documentId, ordinal, body, end - start, null, metadata));
            if (end == words.size()) {
                break;
            }
        }
        return chunks;
    }
}
