package com.ke.hal.configuration;

import com.ke.hal.collaborator.action.ActionCaller;
import com.ke.hal.collaborator.action.HttpActionCaller;
import com.ke.hal.collaborator.retrieval.ChunkStoreRetriever;
import com.ke.hal.collaborator.retrieval.HttpRetriever;
import com.ke.hal.collaborator.retrieval.Retriever;
import com.ke.hal.collaborator.sandbox.HttpSandbox;
import com.ke.hal.collaborator.sandbox.Sandbox;
import com.ke.hal.core.ai.ModelClient;
import com.ke.hal.core.ai.OpenAiModelClient;
import com.ke.hal.db.repo.ChunkRepo;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 外部依赖的默认实现，均可由自定义 Bean 覆盖
 */
@Configuration
public class BeanConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(60, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelClient modelClient(OkHttpClient okHttpClient, AssistantProperties assistantProperties) {
        return new OpenAiModelClient(okHttpClient, assistantProperties.getModel());
    }

    @Bean
    @ConditionalOnMissingBean
    public Retriever retriever(OkHttpClient okHttpClient, AssistantProperties assistantProperties, ChunkRepo chunkRepo) {
        ToolProperties.RetrievalToolProperties retrieval = assistantProperties.getTools().getRetrieval();
        if(StringUtils.isBlank(retrieval.getUrl())) {
            return new ChunkStoreRetriever(chunkRepo);
        }
        return new HttpRetriever(okHttpClient, retrieval);
    }

    @Bean
    @ConditionalOnMissingBean
    public Sandbox sandbox(OkHttpClient okHttpClient, AssistantProperties assistantProperties) {
        return new HttpSandbox(okHttpClient, assistantProperties.getTools().getCodeInterpreter().getUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionCaller actionCaller(OkHttpClient okHttpClient) {
        return new HttpActionCaller(okHttpClient);
    }
}
