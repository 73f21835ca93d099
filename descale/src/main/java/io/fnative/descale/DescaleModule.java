package io.fnative.descale;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import java.io.IOException;

public class DescaleModule extends AbstractModule {
    private final AnalysisRequest request;

    public DescaleModule(AnalysisRequest request) { this.request = request; }

    @Override
    protected void configure() {
        bind(AnalysisRequest.class).toInstance(request);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton LumaFrame frame() throws IOException { return FrameLoader.load(request.input(), request.frameNo()); }

    @Provides Kernel kernel() { return Kernels.named(request.kernel(), request.b(), request.c(), request.taps()); }

    @Provides @Singleton ErrorCurveAnalysis analysis(LumaFrame frame, Kernel kernel, MetricRegistry registry) {
        return new ErrorCurveAnalysis(request, frame, kernel, registry);
    }
}
