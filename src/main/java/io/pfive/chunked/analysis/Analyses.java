// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Registry of the analyses tasks can name. Additional analyses, for example test doubles, can be
/// registered at startup.
public abstract class Analyses {

    private static final Map<String, AnalysisDefinition> analyses = new ConcurrentHashMap<>();

    static {
        register(new CoastalChangeAnalysis());
        register(new WaterDetectionAnalysis());
    }

    public static void register (AnalysisDefinition analysis) {
        analyses.put(analysis.name(), analysis);
    }

    public static Optional<AnalysisDefinition> forName (String name) {
        return Optional.ofNullable(analyses.get(name));
    }

}
