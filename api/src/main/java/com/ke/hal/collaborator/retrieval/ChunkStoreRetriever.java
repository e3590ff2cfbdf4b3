package com.ke.hal.collaborator.retrieval;

import com.ke.hal.db.entity.ChunkDb;
import com.ke.hal.db.repo.ChunkRepo;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 基于本地 chunks 表的关键词检索，未配置外部检索服务时使用
 */
public class ChunkStoreRetriever implements Retriever {

    private final ChunkRepo chunkRepo;

    public ChunkStoreRetriever(ChunkRepo chunkRepo) {
        this.chunkRepo = chunkRepo;
    }

    @Override
    public List<RetrievedChunk> search(String query, List<String> fileIds, int topK) {
        Set<String> terms = terms(query);
        if(terms.isEmpty()) {
            return List.of();
        }
        return chunkRepo.findByFileIds(fileIds).stream()
                .map(chunk -> new RetrievedChunk(chunk.getFileId(), chunk.getId(), chunk.getContent(), score(chunk, terms)))
                .filter(chunk -> chunk.getScore() > 0)
                .sorted(Comparator.comparing(RetrievedChunk::getScore).reversed())
                .limit(topK)
                .collect(Collectors.toList());
    }

    /**
     * 命中词占查询词的比例
     */
    private double score(ChunkDb chunk, Set<String> terms) {
        Set<String> words = terms(chunk.getContent());
        long hits = terms.stream().filter(words::contains).count();
        return (double) hits / terms.size();
    }

    private Set<String> terms(String text) {
        if(StringUtils.isBlank(text)) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(word -> word.length() > 1)
                .collect(Collectors.toSet());
    }
}
