package com.clipforge.test.support;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.adapter.gateway.IProductAnalysisGateway;
import com.clipforge.domain.production.model.valobj.AnalysisResult;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class StubProductAnalysisGateway implements IProductAnalysisGateway {

    private final AtomicInteger calls = new AtomicInteger();

    public static AnalysisResult sampleAnalysis() {
        return AnalysisResult.builder()
                .benefits(List.of("brighter skin in two weeks", "lightweight texture"))
                .targetAudience("women 25-40 with dull skin")
                .painPoints(List.of("dull skin", "uneven tone"))
                .keyFeatures(List.of("15% vitamin C"))
                .tone("friendly")
                .build();
    }

    @Override
    public AnalysisResult analyze(ProductEntity product) {
        calls.incrementAndGet();
        return sampleAnalysis();
    }

    public int calls() {
        return calls.get();
    }
}
