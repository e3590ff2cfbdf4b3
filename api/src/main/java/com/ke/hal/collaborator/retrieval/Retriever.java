package com.ke.hal.collaborator.retrieval;

import java.util.List;

/**
 * 文档检索，给定查询与文件返回按相关度排序的片段
 * 可重试的错误抛出 TransientCollaboratorException
 */
public interface Retriever {

    List<RetrievedChunk> search(String query, List<String> fileIds, int topK);
}
