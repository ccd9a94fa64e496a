package com.posidx.api;

import com.posidx.common.FailurePolicy;
import com.posidx.config.SystemConfig;
import com.posidx.crypto.AesGcmDocumentDecryptor;
import com.posidx.crypto.DocumentDecryptor;
import com.posidx.index.core.PositionalIndexBuilder;
import com.posidx.index.core.Tokenizer;
import com.posidx.index.service.DocumentIndexer;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * Everything a run needs, fixed at startup and handed to every stage explicitly.
 * Immutable; map-phase workers share one instance.
 */
public final class PipelineContext {

    private final SecretKey key;
    private final DocumentDecryptor decryptor;
    private final Tokenizer tokenizer;
    private final PositionalIndexBuilder builder;
    private final FailurePolicy failurePolicy;
    private final int parallelism;
    private final int sampleSize;
    private final PipelineMetrics metrics;
    private final DocumentIndexer indexer;

    public PipelineContext(SecretKey key,
                           DocumentDecryptor decryptor,
                           Tokenizer tokenizer,
                           PositionalIndexBuilder builder,
                           FailurePolicy failurePolicy,
                           int parallelism,
                           int sampleSize,
                           PipelineMetrics metrics) {
        this.key = Objects.requireNonNull(key, "key");
        this.decryptor = Objects.requireNonNull(decryptor, "decryptor");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be positive");
        if (sampleSize < 0) throw new IllegalArgumentException("sampleSize must be >= 0");
        this.parallelism = parallelism;
        this.sampleSize = sampleSize;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.indexer = new DocumentIndexer(decryptor, tokenizer, builder, key);
    }

    public static PipelineContext from(SystemConfig cfg, SecretKey key, PipelineMetrics metrics) {
        Objects.requireNonNull(cfg, "cfg");
        return new PipelineContext(key, new AesGcmDocumentDecryptor(), new Tokenizer(), new PositionalIndexBuilder(),
                cfg.getFailurePolicy(), cfg.getEffectiveParallelism(), cfg.getSampleSize(), metrics);
    }

    public SecretKey getKey() { return key; }
    public DocumentDecryptor getDecryptor() { return decryptor; }
    public Tokenizer getTokenizer() { return tokenizer; }
    public PositionalIndexBuilder getBuilder() { return builder; }
    public FailurePolicy getFailurePolicy() { return failurePolicy; }
    public int getParallelism() { return parallelism; }
    public int getSampleSize() { return sampleSize; }
    public PipelineMetrics getMetrics() { return metrics; }
    public DocumentIndexer getIndexer() { return indexer; }

    @Override
    public String toString() {
        return "PipelineContext{policy=" + failurePolicy + ", parallelism=" + parallelism
                + ", sampleSize=" + sampleSize + ", metrics=" + metrics.isEnabled() + '}';
    }
}
