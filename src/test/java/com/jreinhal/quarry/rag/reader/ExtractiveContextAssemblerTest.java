package com.jreinhal.quarry.rag.reader;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.model.Candidate;
import com.jreinhal.quarry.model.ChunkText;
import com.jreinhal.quarry.model.ContextBundle;
import com.jreinhal.quarry.model.ScoreComponent;
import com.jreinhal.quarry.model.SentencePick;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractiveContextAssemblerTest {
    private final ExtractiveContextAssembler assembler = new ExtractiveContextAssembler();

    private static Candidate candidate(String path, String chunkId, String text, double fused) {
        Candidate candidate = new Candidate(path, chunkId, ChunkText.ofContent(text));
        candidate.putScore(ScoreComponent.FUSED, fused);
        return candidate;
    }

    private static List<Candidate> prose(int count) {
        List<Candidate> list = new ArrayList<>();
        for (int i = 0; i < count; ++i) {
            list.add(candidate("docs/file" + i + ".md", "0", "Alpha one here. Beta two here. Gamma three here. Delta four here.", 1.0 - i * 0.1));
        }
        return list;
    }

    @Test
    void schemaSentenceRanksFirstForDatabaseQuestion() {
        Candidate schema = candidate("db/schema.md", "0", "Indexes speed up search. CREATE INDEX idx_docs_embedding ON docs USING hnsw (embedding). Remember to vacuum.", 0.8);
        Candidate other = candidate("docs/intro.md", "0", "This project stores documents. It has a web page.", 0.9);

        ContextBundle bundle = assembler.assemble(List.of(other, schema), "How do I create the hnsw index on docs?", QueryTag.DB_WORKFLOWS, QueryTag.DB_WORKFLOWS.getPhraseHints(), ReaderSettings.DEFAULT);

        assertTrue(bundle.text().startsWith("[db/schema.md#chunk:0] CREATE INDEX idx_docs_embedding"));
        assertEquals("db/schema.md", bundle.picks().get(0).sourcePath());
    }

    @Test
    void perChunkAndTotalBoundsHold() {
        ContextBundle bundle = assembler.assemble(prose(4), "alpha beta", QueryTag.GENERAL, List.of(), new ReaderSettings(2, 3, 6000));

        assertEquals(3, bundle.picks().size());
        Map<String, Integer> perChunk = new HashMap<>();
        for (SentencePick pick : bundle.picks()) {
            perChunk.merge(pick.sourcePath() + "#" + pick.chunkId(), 1, Integer::sum);
        }
        assertTrue(perChunk.values().stream().allMatch(n -> n <= 2));
        assertEquals(3, bundle.text().split("\n").length);
    }

    @Test
    void contextNeverExceedsCharacterBound() {
        ContextBundle bundle = assembler.assemble(prose(6), "gamma", QueryTag.GENERAL, List.of(), new ReaderSettings(2, 10, 80));

        assertTrue(bundle.text().length() <= 80);
        assertThat(bundle.text().split("\n")).allMatch(line -> line.startsWith("[docs/file"));
    }

    @Test
    void picksAreOrderedByScore() {
        ContextBundle bundle = assembler.assemble(prose(3), "delta four", QueryTag.GENERAL, List.of(), ReaderSettings.DEFAULT);

        List<SentencePick> picks = bundle.picks();
        for (int i = 1; i < picks.size(); ++i) {
            assertTrue(picks.get(i - 1).rankKey() >= picks.get(i).rankKey());
        }
        assertTrue(picks.get(0).sentence().startsWith("Delta four"));
        assertEquals("docs/file0.md", picks.get(0).sourcePath());
    }

    @Test
    void emptyInputsYieldEmptyBundle() {
        assertTrue(assembler.assemble(List.of(), "q", QueryTag.GENERAL, List.of(), ReaderSettings.DEFAULT).isEmpty());
        assertTrue(assembler.assemble(prose(2), "q", QueryTag.GENERAL, List.of(), new ReaderSettings(0, 10, 100)).isEmpty());
        assertEquals("", assembler.assemble(prose(2), "q", QueryTag.GENERAL, List.of(), new ReaderSettings(2, 0, 100)).text());
    }

    @Test
    void sentenceScoreCombinesOverlapAndTagBonus() {
        double score = ExtractiveContextAssembler.scoreSentence("Set CACHE_PREFIX in the env file", Set.of("cache_prefix"), List.of(), Set.of(), QueryTag.OPS_HEALTH, false);

        assertEquals(1.0 / Math.sqrt(6) + ExtractiveContextAssembler.TAG_BONUS, score, 1e-9);
    }

    @Test
    void leadingDefinitionGetsFirstLineMultiplier() {
        double first = ExtractiveContextAssembler.scoreSentence("CREATE TABLE t (id int)", Set.of(), List.of(), Set.of(), QueryTag.GENERAL, true);
        double later = ExtractiveContextAssembler.scoreSentence("CREATE TABLE t (id int)", Set.of(), List.of(), Set.of(), QueryTag.GENERAL, false);

        assertEquals(0.45, later, 1e-9);
        assertEquals(0.45 * ExtractiveContextAssembler.FIRST_LINE_MULTIPLIER, first, 1e-9);
    }

    @Test
    void firstLineMultiplierNeedsTheWholeFirstLine() {
        ReaderSettings one = new ReaderSettings(1, 1, 6000);
        Candidate ownLine = candidate("db/a.md", "0", "CREATE TABLE docs (id int).\nThen rebuild the cache.", 1.0);
        Candidate sharedLine = candidate("db/b.md", "0", "CREATE TABLE docs (id int). Then rebuild the cache.", 1.0);

        SentencePick onOwnLine = assembler.assemble(List.of(ownLine), "zzz", QueryTag.GENERAL, List.of(), one).picks().get(0);
        SentencePick onSharedLine = assembler.assemble(List.of(sharedLine), "zzz", QueryTag.GENERAL, List.of(), one).picks().get(0);

        assertEquals("CREATE TABLE docs (id int).", onOwnLine.sentence());
        assertEquals("CREATE TABLE docs (id int).", onSharedLine.sentence());
        assertEquals(0.45 * ExtractiveContextAssembler.FIRST_LINE_MULTIPLIER, onOwnLine.score(), 1e-9);
        assertEquals(0.45, onSharedLine.score(), 1e-9);
    }

    @Test
    void fileTokensComeFromTheFileStem() {
        assertEquals(Set.of("deploy", "guide"), ExtractiveContextAssembler.fileTokens("docs/deploy_guide-v2.md"));
        assertTrue(ExtractiveContextAssembler.fileTokens("").isEmpty());
    }

    @Test
    void negativeSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ReaderSettings(-1, 10, 100));
    }
}
